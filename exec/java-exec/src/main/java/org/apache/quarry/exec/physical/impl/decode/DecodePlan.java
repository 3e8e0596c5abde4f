/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.quarry.exec.physical.impl.decode;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.quarry.exec.cache.dictionary.DictionaryColumnIdentifier;
import org.apache.quarry.exec.metadata.ColumnIdentifier;
import org.apache.quarry.exec.metadata.DimensionDescriptor;
import org.apache.quarry.exec.metadata.Encoding;
import org.apache.quarry.exec.metadata.TableIdentifier;
import org.apache.quarry.exec.record.BatchSchema;
import org.apache.quarry.exec.record.FieldReference;
import org.apache.quarry.exec.record.MaterializedField;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Per output column, whether and how to decode it. Entries are positionally
 * aligned with the input schema; columns that are not decoded have a null
 * entry.
 */
public class DecodePlan {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DecodePlan.class);

  private final List<Entry> entries;
  private final BatchSchema inputSchema;
  private final BatchSchema outputSchema;
  private final boolean requiredToDecode;

  private DecodePlan(BatchSchema inputSchema, Entry[] entries) {
    this.inputSchema = inputSchema;
    this.entries = Collections.unmodifiableList(Arrays.asList(entries));
    List<MaterializedField> output = Lists.newArrayListWithCapacity(entries.length);
    boolean anyDecode = false;
    for (int i = 0; i < entries.length; i++) {
      MaterializedField field = inputSchema.getColumn(i);
      if (entries[i] == null) {
        output.add(field);
      } else {
        output.add(DecodeTypeTranslator.translate(field, entries[i].getDimension()));
        anyDecode = true;
      }
    }
    this.outputSchema = new BatchSchema(output);
    this.requiredToDecode = anyDecode;
  }

  /**
   * Resolves every input column against the relations and the profile.
   *
   * @throws org.apache.quarry.common.exceptions.UserException if a decodable column has a kind that cannot be decoded
   */
  public static DecodePlan build(BatchSchema inputSchema, DecodeProfile profile,
                                 List<DecoderRelation> relations, DecoderAliasMap aliasMap) {
    Preconditions.checkNotNull(profile);
    Entry[] entries = new Entry[inputSchema.getFieldCount()];
    for (int i = 0; i < entries.length; i++) {
      entries[i] = resolve(inputSchema.getColumn(i).getReference(), profile, relations, aliasMap);
    }
    DecodePlan plan = new DecodePlan(inputSchema, entries);
    logger.debug("Decode plan for {}: {}", inputSchema, plan.entries);
    return plan;
  }

  private static Entry resolve(FieldReference column, DecodeProfile profile,
                               List<DecoderRelation> relations, DecoderAliasMap aliasMap) {
    FieldReference canonical = aliasMap.resolve(column);
    DecoderRelation relation = null;
    for (DecoderRelation candidate : relations) {
      if (candidate.contains(canonical)) {
        relation = candidate;
        break;
      }
    }
    if (relation == null || !profile.canDecode(canonical)) {
      return null;
    }
    TableIdentifier table = relation.getTableIdentifier();
    DimensionDescriptor dimension = relation.lookupDimension(table.getTableName(), canonical.getName());
    if (!isDecodable(dimension)) {
      return null;
    }
    return new Entry(table, dimension.getColumnIdentifier(), dimension);
  }

  static boolean isDecodable(DimensionDescriptor dimension) {
    return dimension != null
        && dimension.hasEncoding(Encoding.DICTIONARY)
        && !dimension.hasEncoding(Encoding.DIRECT_DICTIONARY)
        && !dimension.isComplex();
  }

  public int size() {
    return entries.size();
  }

  /**
   * @return the entry for the column, or null if the column passes through unchanged
   */
  public Entry getEntry(int index) {
    return entries.get(index);
  }

  public List<Entry> getEntries() {
    return entries;
  }

  public boolean isRequiredToDecode() {
    return requiredToDecode;
  }

  public BatchSchema getInputSchema() {
    return inputSchema;
  }

  public BatchSchema getOutputSchema() {
    return outputSchema;
  }

  /**
   * A column to decode: the table that owns it, the column's stable identifier
   * and the dimension describing it.
   */
  public static class Entry {
    private final TableIdentifier table;
    private final ColumnIdentifier columnIdentifier;
    private final DimensionDescriptor dimension;

    public Entry(TableIdentifier table, ColumnIdentifier columnIdentifier, DimensionDescriptor dimension) {
      this.table = table;
      this.columnIdentifier = columnIdentifier;
      this.dimension = dimension;
    }

    public TableIdentifier getTable() {
      return table;
    }

    public String getTableName() {
      return table.getTableName();
    }

    public ColumnIdentifier getColumnIdentifier() {
      return columnIdentifier;
    }

    public DimensionDescriptor getDimension() {
      return dimension;
    }

    public DictionaryColumnIdentifier getDictionaryColumnIdentifier() {
      return new DictionaryColumnIdentifier(table, columnIdentifier, dimension.getDataKind());
    }

    @Override
    public String toString() {
      return "Decode [" + table.getTableName() + "." + dimension.getName() + "]";
    }
  }
}
