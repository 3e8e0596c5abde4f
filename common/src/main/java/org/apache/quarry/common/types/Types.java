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

public class Types {

  public static MajorType optional(final MinorType type) {
    return new MajorType(type, DataMode.OPTIONAL, 0, 0);
  }

  public static MajorType required(final MinorType type) {
    return new MajorType(type, DataMode.REQUIRED, 0, 0);
  }

  public static MajorType withPrecisionAndScale(final MinorType type, final DataMode mode,
                                                final int precision, final int scale) {
    return new MajorType(type, mode, precision, scale);
  }

  public static MajorType withMode(final MinorType type, final DataMode mode) {
    return new MajorType(type, mode, 0, 0);
  }

  public static boolean isComplex(final MajorType type) {
    switch (type.getMinorType()) {
    case MAP:
    case LIST:
      return true;
    default:
      return false;
    }
  }

  /**
   * @return the Java class values of the given type are represented with in rows
   */
  public static Class<?> getJavaClass(final MinorType type) {
    switch (type) {
    case VARCHAR:
      return String.class;
    case SMALLINT:
      return Short.class;
    case INT:
      return Integer.class;
    case BIGINT:
      return Long.class;
    case FLOAT8:
      return Double.class;
    case BIT:
      return Boolean.class;
    case VARDECIMAL:
      return java.math.BigDecimal.class;
    case TIMESTAMP:
      return java.time.LocalDateTime.class;
    case DATE:
      return java.time.LocalDate.class;
    case MAP:
      return java.util.Map.class;
    case LIST:
      return java.util.List.class;
    default:
      throw new UnsupportedOperationException(type.name());
    }
  }
}
