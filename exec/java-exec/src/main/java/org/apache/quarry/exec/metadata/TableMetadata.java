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
package org.apache.quarry.exec.metadata;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * Dimensions of one table, looked up by column name ignoring case.
 */
public class TableMetadata {

  private final TableIdentifier identifier;
  private final Map<String, DimensionDescriptor> dimensions = Maps.newLinkedHashMap();

  public TableMetadata(TableIdentifier identifier, List<DimensionDescriptor> dimensions) {
    this.identifier = identifier;
    for (DimensionDescriptor dim : dimensions) {
      this.dimensions.put(dim.getName().toLowerCase(Locale.ROOT), dim);
    }
  }

  public TableIdentifier getIdentifier() {
    return identifier;
  }

  public String getTableName() {
    return identifier.getTableName();
  }

  /**
   * @return the dimension, or null when the table is not the named one or has no such dimension
   */
  public DimensionDescriptor getDimensionByName(String tableName, String columnName) {
    if (!identifier.getTableName().equalsIgnoreCase(tableName)) {
      return null;
    }
    return dimensions.get(columnName.toLowerCase(Locale.ROOT));
  }

  public List<DimensionDescriptor> getDimensions() {
    return ImmutableList.copyOf(dimensions.values());
  }
}
