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
package org.apache.quarry.exec.cache.dictionary;

import java.io.Serializable;
import java.util.Objects;

import org.apache.quarry.exec.metadata.ColumnIdentifier;
import org.apache.quarry.exec.metadata.DataKind;
import org.apache.quarry.exec.metadata.TableIdentifier;

import com.google.common.base.Preconditions;

/**
 * Key of a dictionary in the cache: the owning table and the column. The data
 * kind travels with the key but takes no part in equality.
 */
public class DictionaryColumnIdentifier implements Serializable {
  private static final long serialVersionUID = -1231234567812345678L;

  private final TableIdentifier tableIdentifier;
  private final ColumnIdentifier columnIdentifier;
  private final DataKind dataKind;

  public DictionaryColumnIdentifier(TableIdentifier tableIdentifier, ColumnIdentifier columnIdentifier,
                                    DataKind dataKind) {
    this.tableIdentifier = Preconditions.checkNotNull(tableIdentifier);
    this.columnIdentifier = Preconditions.checkNotNull(columnIdentifier);
    this.dataKind = dataKind;
  }

  public TableIdentifier getTableIdentifier() {
    return tableIdentifier;
  }

  public ColumnIdentifier getColumnIdentifier() {
    return columnIdentifier;
  }

  public DataKind getDataKind() {
    return dataKind;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    DictionaryColumnIdentifier other = (DictionaryColumnIdentifier) obj;
    return tableIdentifier.equals(other.tableIdentifier)
        && columnIdentifier.equals(other.columnIdentifier);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tableIdentifier, columnIdentifier);
  }

  @Override
  public String toString() {
    return tableIdentifier + "." + columnIdentifier;
  }
}
