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

import com.google.common.base.Preconditions;

/**
 * Stable id of a column, used as part of the dictionary cache key. Equality is
 * by id only.
 */
public class ColumnIdentifier implements Serializable {
  private static final long serialVersionUID = 5024188461541474263L;

  private final String columnId;
  private final DataKind dataKind;

  public ColumnIdentifier(String columnId, DataKind dataKind) {
    this.columnId = Preconditions.checkNotNull(columnId);
    this.dataKind = dataKind;
  }

  public String getColumnId() {
    return columnId;
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
    return columnId.equals(((ColumnIdentifier) obj).columnId);
  }

  @Override
  public int hashCode() {
    return columnId.hashCode();
  }

  @Override
  public String toString() {
    return columnId;
  }
}
