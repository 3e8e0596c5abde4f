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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.junit.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

public class TestTypes {

  @Test
  public void modeDecidesNullability() {
    assertTrue(Types.optional(MinorType.INT).isNullable());
    assertFalse(Types.required(MinorType.INT).isNullable());
    assertEquals(Types.optional(MinorType.INT), Types.required(MinorType.INT).withMode(DataMode.OPTIONAL));
  }

  @Test
  public void precisionTakesPartInEquality() {
    MajorType decimal = Types.withPrecisionAndScale(MinorType.VARDECIMAL, DataMode.OPTIONAL, 18, 2);
    assertNotEquals(decimal, Types.withPrecisionAndScale(MinorType.VARDECIMAL, DataMode.OPTIONAL, 18, 4));
    assertEquals(18, decimal.getPrecision());
    assertEquals(2, decimal.getScale());
  }

  @Test
  public void complexTypes() {
    assertTrue(Types.isComplex(Types.optional(MinorType.MAP)));
    assertTrue(Types.isComplex(Types.optional(MinorType.LIST)));
    assertFalse(Types.isComplex(Types.optional(MinorType.VARCHAR)));
  }

  @Test
  public void javaClasses() {
    assertEquals(Short.class, Types.getJavaClass(MinorType.SMALLINT));
    assertEquals(BigDecimal.class, Types.getJavaClass(MinorType.VARDECIMAL));
    assertEquals(LocalDateTime.class, Types.getJavaClass(MinorType.TIMESTAMP));
  }

  @Test
  public void jsonRoundTrip() throws Exception {
    ObjectMapper mapper = new ObjectMapper();
    MajorType type = Types.withPrecisionAndScale(MinorType.VARDECIMAL, DataMode.REQUIRED, 10, 3);
    assertEquals(type, mapper.readValue(mapper.writeValueAsString(type), MajorType.class));
  }
}
