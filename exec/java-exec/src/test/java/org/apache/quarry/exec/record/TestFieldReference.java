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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Locale;
import java.util.Map;

import org.apache.quarry.exec.physical.impl.decode.DecoderAliasMap;
import org.apache.quarry.test.QuarryTest;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.Maps;

public class TestFieldReference extends QuarryTest {

  private Locale defaultLocale;

  @Before
  public void useTurkishLocale() {
    defaultLocale = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
  }

  @After
  public void restoreLocale() {
    Locale.setDefault(defaultLocale);
  }

  @Test
  public void namesMatchIgnoringCase() {
    FieldReference upper = new FieldReference("CITY", 1);
    FieldReference lower = new FieldReference("city", 1);
    assertTrue(upper.matches(lower));
    assertEquals(upper, lower);
    assertEquals(upper.hashCode(), lower.hashCode());
    assertFalse(upper.matches(new FieldReference("city", 2)));
  }

  @Test
  public void hashLookupIgnoresCaseUnderAnyLocale() {
    Map<FieldReference, String> columns = Maps.newHashMap();
    for (int i = 0; i < 32; i++) {
      columns.put(new FieldReference("col" + i, i), "c" + i);
    }
    columns.put(new FieldReference("item", 40), "item");
    columns.put(new FieldReference("price", 41), "price");

    assertEquals("item", columns.get(new FieldReference("ITEM", 40)));
    assertEquals("price", columns.get(new FieldReference("PRICE", 41)));
  }

  @Test
  public void aliasesResolveIgnoringCase() {
    Map<FieldReference, FieldReference> aliases = Maps.newHashMap();
    aliases.put(new FieldReference("town", 42), new FieldReference("city", 1));
    aliases.put(new FieldReference("item_id", 43), new FieldReference("item", 40));
    DecoderAliasMap aliasMap = new DecoderAliasMap(aliases);

    assertEquals(new FieldReference("item", 40), aliasMap.resolve(new FieldReference("ITEM_ID", 43)));
    assertEquals(new FieldReference("city", 1), aliasMap.resolve(new FieldReference("TOWN", 42)));
  }
}
