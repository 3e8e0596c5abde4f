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
package org.apache.quarry.common.types;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * A minor type together with its nullability and, for decimals, precision and scale.
 */
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
public class MajorType {

  private final MinorType minorType;
  private final DataMode mode;
  private final int precision;
  private final int scale;

  @JsonCreator
  public MajorType(@JsonProperty("minorType") MinorType minorType,
                   @JsonProperty("mode") DataMode mode,
                   @JsonProperty("precision") int precision,
                   @JsonProperty("scale") int scale) {
    this.minorType = Preconditions.checkNotNull(minorType);
    this.mode = mode == null ? DataMode.OPTIONAL : mode;
    this.precision = precision;
    this.scale = scale;
  }

  @JsonProperty("minorType")
  public MinorType getMinorType() {
    return minorType;
  }

  @JsonProperty("mode")
  public DataMode getMode() {
    return mode;
  }

  @JsonProperty("precision")
  public int getPrecision() {
    return precision;
  }

  @JsonProperty("scale")
  public int getScale() {
    return scale;
  }

  @JsonIgnore
  public boolean isNullable() {
    return mode == DataMode.OPTIONAL;
  }

  public MajorType withMode(DataMode newMode) {
    return new MajorType(minorType, newMode, precision, scale);
  }

  @Override
  public int hashCode() {
    return Objects.hash(minorType, mode, precision, scale);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    MajorType other = (MajorType) obj;
    return minorType == other.minorType
        && mode == other.mode
        && precision == other.precision
        && scale == other.scale;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(minorType.name());
    if (minorType == MinorType.VARDECIMAL) {
      sb.append('(').append(precision).append(", ").append(scale).append(')');
    }
    return sb.append(' ').append(mode.name()).toString();
  }
}
