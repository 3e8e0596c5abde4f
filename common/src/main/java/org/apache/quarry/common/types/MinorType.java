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

/**
 * Value types a column can carry once decoded.
 */
public enum MinorType {
  /** UTF-8 text, java.lang.String */
  VARCHAR,
  /** 2 byte signed integer, java.lang.Short */
  SMALLINT,
  /** 4 byte signed integer, java.lang.Integer */
  INT,
  /** 8 byte signed integer, java.lang.Long */
  BIGINT,
  /** 8 byte IEEE 754, java.lang.Double */
  FLOAT8,
  /** boolean, java.lang.Boolean */
  BIT,
  /** arbitrary precision decimal, java.math.BigDecimal */
  VARDECIMAL,
  /** java.time.LocalDateTime */
  TIMESTAMP,
  /** java.time.LocalDate */
  DATE,
  /** named children, java.util.Map */
  MAP,
  /** repeated single child, java.util.List */
  LIST
}
