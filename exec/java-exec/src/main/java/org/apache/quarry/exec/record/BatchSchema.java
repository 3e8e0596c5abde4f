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
package org.apache.quarry.exec.record;

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Ordered list of the columns an operator produces.
 */
public class BatchSchema implements Iterable<MaterializedField> {

  private final List<MaterializedField> fields;

  public BatchSchema(List<MaterializedField> fields) {
    this.fields = ImmutableList.copyOf(fields);
  }

  public static BatchSchema of(MaterializedField... fields) {
    return new BatchSchema(ImmutableList.copyOf(fields));
  }

  public int getFieldCount() {
    return fields.size();
  }

  public MaterializedField getColumn(int index) {
    return fields.get(index);
  }

  public List<MaterializedField> getFields() {
    return fields;
  }

  @Override
  public Iterator<MaterializedField> iterator() {
    return fields.iterator();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return fields.equals(((BatchSchema) obj).fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "BatchSchema " + fields;
  }
}
