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

import java.util.List;
import java.util.Objects;

import org.apache.quarry.common.types.MajorType;

import com.google.common.collect.ImmutableList;

/**
 * Meta-data description of a column: its reference, its type and, for maps and
 * lists, its child columns.
 */
public class MaterializedField {

  private final FieldReference reference;
  private final MajorType type;
  private final List<MaterializedField> children;

  private MaterializedField(FieldReference reference, MajorType type, List<MaterializedField> children) {
    this.reference = reference;
    this.type = type;
    this.children = ImmutableList.copyOf(children);
  }

  public static MaterializedField create(String name, long id, MajorType type) {
    return new MaterializedField(new FieldReference(name, id), type, ImmutableList.<MaterializedField>of());
  }

  public static MaterializedField create(FieldReference reference, MajorType type) {
    return new MaterializedField(reference, type, ImmutableList.<MaterializedField>of());
  }

  public static MaterializedField create(FieldReference reference, MajorType type, List<MaterializedField> children) {
    return new MaterializedField(reference, type, children);
  }

  public FieldReference getReference() {
    return reference;
  }

  public String getName() {
    return reference.getName();
  }

  public MajorType getType() {
    return type;
  }

  public List<MaterializedField> getChildren() {
    return children;
  }

  public MaterializedField withType(MajorType newType) {
    return new MaterializedField(reference, newType, children);
  }

  public MaterializedField withTypeAndChildren(MajorType newType, List<MaterializedField> newChildren) {
    return new MaterializedField(reference, newType, newChildren);
  }

  /**
   * Whether this field names the same column as the given reference.
   */
  public boolean matches(FieldReference other) {
    return reference.matches(other);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    MaterializedField other = (MaterializedField) obj;
    return reference.equals(other.reference)
        && type.equals(other.type)
        && children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(reference, type, children);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder()
        .append('[').append('`').append(reference.getName()).append('`')
        .append(" (").append(type).append(')');
    if (!children.isEmpty()) {
      sb.append(", children=").append(children);
    }
    return sb.append(']').toString();
  }
}
