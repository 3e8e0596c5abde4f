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

import java.util.Iterator;

import org.apache.quarry.common.exceptions.UserException;
import org.apache.quarry.exec.cache.dictionary.Dictionary;
import org.apache.quarry.exec.record.Row;
import org.apache.quarry.exec.record.RowProjection;
import org.apache.quarry.exec.util.DataTypeUtil;

/**
 * Decodes the rows of one partition one at a time.
 */
public class DictionaryDecodeIterator implements Iterator<Row> {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DictionaryDecodeIterator.class);

  private final Iterator<Row> input;
  private final DecodePlan plan;
  private final Dictionary[] dictionaries;
  private final RowProjection projection;

  public DictionaryDecodeIterator(Iterator<Row> input, DecodePlan plan, Dictionary[] dictionaries,
                                  RowProjection projection) {
    this.input = input;
    this.plan = plan;
    this.dictionaries = dictionaries;
    this.projection = projection;
  }

  @Override
  public boolean hasNext() {
    return input.hasNext();
  }

  @Override
  public Row next() {
    Object[] values = input.next().toArray();
    for (int i = 0; i < dictionaries.length; i++) {
      if (dictionaries[i] == null || values[i] == null) {
        continue;
      }
      DecodePlan.Entry entry = plan.getEntry(i);
      int key = ((Number) values[i]).intValue();
      byte[] bytes = dictionaries[i].getDictionaryValueForKeyInBytes(key);
      if (bytes == null) {
        throw missingSurrogateKey(entry.getDimension().getName(), key);
      }
      values[i] = DataTypeUtil.getDataBasedOnDataType(bytes, entry.getDimension());
    }
    return projection.project(values);
  }

  /**
   * Error raised when a surrogate key has no value in its column's dictionary.
   * Also thrown by generated decode code.
   */
  public static UserException missingSurrogateKey(String column, int key) {
    return UserException.dataReadError()
        .message("Surrogate key %d of column %s is not present in the dictionary", key, column)
        .addContext("Column", column)
        .addContext("Surrogate key", key)
        .build(logger);
  }
}
