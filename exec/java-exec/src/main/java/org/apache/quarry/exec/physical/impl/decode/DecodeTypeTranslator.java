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

import java.util.List;

import org.apache.quarry.common.exceptions.UserException;
import org.apache.quarry.common.types.DataMode;
import org.apache.quarry.common.types.MajorType;
import org.apache.quarry.common.types.MinorType;
import org.apache.quarry.common.types.Types;
import org.apache.quarry.exec.metadata.DimensionDescriptor;
import org.apache.quarry.exec.record.FieldReference;
import org.apache.quarry.exec.record.MaterializedField;

import com.google.common.collect.ImmutableList;

/**
 * Derives the type a dimension has once its values are decoded. Struct and
 * array dimensions are translated recursively into map and list fields.
 */
public final class DecodeTypeTranslator {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DecodeTypeTranslator.class);

  /** Precision used for decimals declared without one. */
  public static final int DEFAULT_DECIMAL_PRECISION = 18;
  /** Scale used for decimals declared without one. */
  public static final int DEFAULT_DECIMAL_SCALE = 2;

  private DecodeTypeTranslator() {
  }

  public static MajorType getDecodedType(DimensionDescriptor dimension) {
    switch (dimension.getDataKind()) {
    case STRING:
      return Types.optional(MinorType.VARCHAR);
    case SHORT:
      return Types.optional(MinorType.SMALLINT);
    case INT:
      return Types.optional(MinorType.INT);
    case LONG:
      return Types.optional(MinorType.BIGINT);
    case DOUBLE:
      return Types.optional(MinorType.FLOAT8);
    case BOOLEAN:
      return Types.optional(MinorType.BIT);
    case TIMESTAMP:
      return Types.optional(MinorType.TIMESTAMP);
    case DATE:
      return Types.optional(MinorType.DATE);
    case DECIMAL:
      if (dimension.getPrecision() == 0 && dimension.getScale() == 0) {
        return Types.withPrecisionAndScale(MinorType.VARDECIMAL, DataMode.OPTIONAL,
            DEFAULT_DECIMAL_PRECISION, DEFAULT_DECIMAL_SCALE);
      }
      return Types.withPrecisionAndScale(MinorType.VARDECIMAL, DataMode.OPTIONAL,
          dimension.getPrecision(), dimension.getScale());
    case STRUCT:
      return Types.optional(MinorType.MAP);
    case ARRAY:
      return Types.optional(MinorType.LIST);
    default:
      throw UserException.unsupportedError()
          .message("Data kind %s of column %s cannot be decoded", dimension.getDataKind(), dimension.getName())
          .build(logger);
    }
  }

  /**
   * Builds the output field for a decoded column, keeping the column's reference.
   */
  public static MaterializedField translate(MaterializedField input, DimensionDescriptor dimension) {
    return input.withTypeAndChildren(getDecodedType(dimension), translateChildren(dimension));
  }

  private static List<MaterializedField> translateChildren(DimensionDescriptor dimension) {
    if (!dimension.isComplex()) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<MaterializedField> children = ImmutableList.builder();
    for (DimensionDescriptor child : dimension.getChildren()) {
      children.add(MaterializedField.create(new FieldReference(childName(child), 0),
          getDecodedType(child), translateChildren(child)));
    }
    return children.build();
  }

  // child dimensions are named parent.child
  private static String childName(DimensionDescriptor child) {
    String name = child.getName();
    int dot = name.lastIndexOf('.');
    return dot < 0 ? name : name.substring(dot + 1);
  }
}
