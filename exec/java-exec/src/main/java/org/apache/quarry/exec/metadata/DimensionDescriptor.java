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

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

/**
 * Catalog description of a dimension column. Struct and array dimensions carry
 * their child dimensions; for arrays there is exactly one child.
 */
public class DimensionDescriptor {

  private final String name;
  private final DataKind dataKind;
  private final Set<Encoding> encodings;
  private final int precision;
  private final int scale;
  private final ColumnIdentifier columnIdentifier;
  private final List<DimensionDescriptor> children;

  private DimensionDescriptor(Builder builder) {
    this.name = builder.name;
    this.dataKind = builder.dataKind;
    this.encodings = Sets.immutableEnumSet(builder.encodings);
    this.precision = builder.precision;
    this.scale = builder.scale;
    this.columnIdentifier = builder.columnIdentifier == null
        ? new ColumnIdentifier(builder.name, builder.dataKind)
        : builder.columnIdentifier;
    this.children = builder.children.build();
  }

  public static Builder builder(String name, DataKind dataKind) {
    return new Builder(name, dataKind);
  }

  public String getName() {
    return name;
  }

  public DataKind getDataKind() {
    return dataKind;
  }

  public boolean hasEncoding(Encoding encoding) {
    return encodings.contains(encoding);
  }

  public Set<Encoding> getEncodings() {
    return encodings;
  }

  public boolean isComplex() {
    return dataKind.isComplex();
  }

  public int getPrecision() {
    return precision;
  }

  public int getScale() {
    return scale;
  }

  public ColumnIdentifier getColumnIdentifier() {
    return columnIdentifier;
  }

  public List<DimensionDescriptor> getChildren() {
    return children;
  }

  @Override
  public String toString() {
    return "DimensionDescriptor [name=" + name + ", dataKind=" + dataKind + ", encodings=" + encodings + "]";
  }

  public static class Builder {
    private final String name;
    private final DataKind dataKind;
    private final Set<Encoding> encodings = EnumSet.noneOf(Encoding.class);
    private int precision;
    private int scale;
    private ColumnIdentifier columnIdentifier;
    private final ImmutableList.Builder<DimensionDescriptor> children = ImmutableList.builder();

    private Builder(String name, DataKind dataKind) {
      this.name = Preconditions.checkNotNull(name);
      this.dataKind = Preconditions.checkNotNull(dataKind);
    }

    public Builder encoding(Encoding... values) {
      for (Encoding e : values) {
        encodings.add(e);
      }
      return this;
    }

    public Builder dictionary() {
      return encoding(Encoding.DICTIONARY);
    }

    public Builder precisionAndScale(int precision, int scale) {
      this.precision = precision;
      this.scale = scale;
      return this;
    }

    public Builder columnId(String columnId) {
      this.columnIdentifier = new ColumnIdentifier(columnId, dataKind);
      return this;
    }

    public Builder child(DimensionDescriptor child) {
      children.add(child);
      return this;
    }

    public DimensionDescriptor build() {
      return new DimensionDescriptor(this);
    }
  }
}
