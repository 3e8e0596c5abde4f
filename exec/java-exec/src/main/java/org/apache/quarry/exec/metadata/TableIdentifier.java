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

import java.io.Serializable;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Identity of a table: database, name and the stable id assigned at creation.
 */
public class TableIdentifier implements Serializable {
  private static final long serialVersionUID = -3285931245210719335L;

  private final String databaseName;
  private final String tableName;
  private final String tableId;

  public TableIdentifier(String databaseName, String tableName, String tableId) {
    this.databaseName = Preconditions.checkNotNull(databaseName);
    this.tableName = Preconditions.checkNotNull(tableName);
    this.tableId = Preconditions.checkNotNull(tableId);
  }

  public String getDatabaseName() {
    return databaseName;
  }

  public String getTableName() {
    return tableName;
  }

  public String getTableId() {
    return tableId;
  }

  public String getUniqueName() {
    return databaseName + "_" + tableName;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    TableIdentifier other = (TableIdentifier) obj;
    return databaseName.equals(other.databaseName)
        && tableName.equals(other.tableName)
        && tableId.equals(other.tableId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(databaseName, tableName, tableId);
  }

  @Override
  public String toString() {
    return databaseName + "." + tableName + "[" + tableId + "]";
  }
}
