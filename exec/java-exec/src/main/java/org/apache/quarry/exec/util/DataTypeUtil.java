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
package org.apache.quarry.exec.util;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;

import org.apache.quarry.common.exceptions.UserException;
import org.apache.quarry.exec.cache.dictionary.DictionaryConstants;
import org.apache.quarry.exec.metadata.DimensionDescriptor;

/**
 * Converts dictionary values, stored as text bytes, into the Java values rows carry.
 */
public final class DataTypeUtil {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DataTypeUtil.class);

  public static final String TIMESTAMP_FORMAT = "yyyy-MM-dd HH:mm:ss";
  public static final String DATE_FORMAT = "yyyy-MM-dd";

  private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern(TIMESTAMP_FORMAT);
  private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern(DATE_FORMAT);

  private DataTypeUtil() {
  }

  /**
   * Parses dictionary bytes according to the dimension's data kind. Malformed
   * values raise the parser's exception.
   *
   * @return the typed value, or null for null input and for the member default value
   */
  public static Object getDataBasedOnDataType(byte[] dataInBytes, DimensionDescriptor dimension) {
    if (dataInBytes == null || Arrays.equals(DictionaryConstants.MEMBER_DEFAULT_VAL_ARRAY, dataInBytes)) {
      return null;
    }
    String data = new String(dataInBytes, DictionaryConstants.DEFAULT_CHARSET_CLASS);
    switch (dimension.getDataKind()) {
    case STRING:
      return data;
    case SHORT:
      return Short.parseShort(data);
    case INT:
      return Integer.parseInt(data);
    case LONG:
      return Long.parseLong(data);
    case DOUBLE:
      return Double.parseDouble(data);
    case DECIMAL:
      return new BigDecimal(data);
    case BOOLEAN:
      return parseBoolean(data);
    case TIMESTAMP:
      return parseTimestamp(data);
    case DATE:
      return parseDate(data);
    default:
      throw UserException.unsupportedError()
          .message("Dictionary values of kind %s cannot be decoded", dimension.getDataKind())
          .addContext("Column", dimension.getName())
          .build(logger);
    }
  }

  public static Boolean parseBoolean(String data) {
    return Boolean.valueOf(data);
  }

  public static LocalDateTime parseTimestamp(String data) {
    return LocalDateTime.parse(data, TIMESTAMP_FORMATTER);
  }

  public static LocalDate parseDate(String data) {
    return LocalDate.parse(data, DATE_FORMATTER);
  }
}
