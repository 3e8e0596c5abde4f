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

import java.util.List;

import org.apache.quarry.exec.metadata.DimensionDescriptor;
import org.apache.quarry.exec.metadata.TableIdentifier;
import org.apache.quarry.exec.metadata.TableMetadata;
import org.apache.quarry.exec.record.FieldReference;

import com.google.common.collect.ImmutableList;

/**
 * Relation backed by catalog metadata and the list of columns the scan of that
 * table produces.
 */
public class TableDecoderRelation implements DecoderRelation {

  private final TableMetadata table;
  private final List<FieldReference> columns;

  public TableDecoderRelation(TableMetadata table, List<FieldReference> columns) {
    this.table = table;
    this.columns = ImmutableList.copyOf(columns);
  }

  @Override
  public boolean contains(FieldReference column) {
    for (FieldReference ref : columns) {
      if (ref.matches(column)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public TableIdentifier getTableIdentifier() {
    return table.getIdentifier();
  }

  @Override
  public DimensionDescriptor lookupDimension(String tableName, String columnName) {
    return table.getDimensionByName(tableName, columnName);
  }

  @Override
  public String toString() {
    return "TableDecoderRelation [table=" + table.getIdentifier() + ", columns=" + columns + "]";
  }
}
