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

import static org.apache.quarry.exec.physical.impl.decode.DecodeFixtures.CITY;
import static org.apache.quarry.exec.physical.impl.decode.DecodeFixtures.NOTE;
import static org.apache.quarry.exec.physical.impl.decode.DecodeFixtures.REGION;
import static org.apache.quarry.exec.physical.impl.decode.DecodeFixtures.key;
import static org.apache.quarry.exec.physical.impl.decode.DecodeFixtures.salesRelation;
import static org.apache.quarry.exec.physical.impl.decode.DecodeFixtures.surrogateSchema;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;

import org.apache.quarry.common.exceptions.ErrorType;
import org.apache.quarry.common.exceptions.UserException;
import org.apache.quarry.exec.cache.Cache;
import org.apache.quarry.exec.cache.dictionary.Dictionary;
import org.apache.quarry.exec.cache.dictionary.DictionaryColumnIdentifier;
import org.apache.quarry.exec.cache.dictionary.ReacquirableDictionary;
import org.apache.quarry.exec.record.BatchSchema;
import org.apache.quarry.test.QuarryTest;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class TestDictionaryAcquirer extends QuarryTest {

  private Cache<DictionaryColumnIdentifier, Dictionary> cache;
  private Dictionary cityDictionary;
  private DecodePlan plan;

  @Before
  @SuppressWarnings("unchecked")
  public void setup() throws IOException {
    cache = mock(Cache.class);
    cityDictionary = mock(Dictionary.class);
    when(cache.get(key(CITY))).thenReturn(cityDictionary);
    when(cache.get(key(REGION))).thenThrow(new IOException("dictionary file is missing"));

    BatchSchema schema = surrogateSchema(CITY, REGION, NOTE);
    plan = DecodePlan.build(schema, new AllowAllProfile(), ImmutableList.of(salesRelation(schema)),
        DecoderAliasMap.empty());
  }

  @Test
  public void failedFetchLeavesOnlyThatSlotEmpty() throws IOException {
    Dictionary[] dictionaries = new DictionaryAcquirer(plan, "store", false).acquire(cache);

    assertEquals(3, dictionaries.length);
    assertSame(cityDictionary, dictionaries[0]);
    assertNotNull("region is still planned for decoding", plan.getEntry(1));
    assertNull(dictionaries[1]);
    assertNull(dictionaries[2]);
    verify(cache).get(key(CITY));
    verify(cache).get(key(REGION));
  }

  @Test
  public void runtimeFailuresAreToleratedToo() throws IOException {
    when(cache.get(key(CITY))).thenThrow(new IllegalStateException("corrupt dictionary header"));
    Dictionary[] dictionaries = new DictionaryAcquirer(plan, "store", false).acquire(cache);
    assertNull(dictionaries[0]);
    assertNull(dictionaries[1]);
  }

  @Test
  public void strictModeFailsOnMissingDictionary() {
    try {
      new DictionaryAcquirer(plan, "store", true).acquire(cache);
      fail("Expected the missing region dictionary to fail acquisition");
    } catch (UserException e) {
      assertEquals(ErrorType.DATA_READ, e.getErrorType());
      assertTrue(e.getMessage().contains("region"));
    }
    verify(cityDictionary).release();
  }

  @Test
  public void strictModeReleasesBoundHandlesOnFailure() {
    try {
      new DictionaryAcquirer(plan, "store", true).acquireReacquirable(cache);
      fail("Expected the missing region dictionary to fail acquisition");
    } catch (UserException e) {
      assertEquals(ErrorType.DATA_READ, e.getErrorType());
    }
    verify(cityDictionary).release();
  }

  @Test
  public void releaseFailureIsAttachedToTheFetchFailure() {
    doThrow(new IllegalStateException("already closed")).when(cityDictionary).release();
    try {
      new DictionaryAcquirer(plan, "store", true).acquire(cache);
      fail("Expected the missing region dictionary to fail acquisition");
    } catch (UserException e) {
      assertEquals(1, e.getSuppressed().length);
    }
  }

  @Test
  public void reacquirableHandlesAreBound() throws IOException {
    ReacquirableDictionary[] handles = new DictionaryAcquirer(plan, "store", false).acquireReacquirable(cache);

    assertTrue(handles[0].isBound());
    assertEquals("store", handles[0].getStorePath());
    assertEquals(key(CITY), handles[0].getIdentifier());
    assertNull(handles[1]);
    assertNull(handles[2]);
  }

  @Test
  public void nothingIsFetchedForSkippedColumns() throws IOException {
    BatchSchema schema = surrogateSchema(NOTE);
    DecodePlan nothing = DecodePlan.build(schema, new AllowAllProfile(), ImmutableList.of(salesRelation(schema)),
        DecoderAliasMap.empty());
    Dictionary[] dictionaries = new DictionaryAcquirer(nothing, "store", true).acquire(cache);
    assertNull(dictionaries[0]);
    verify(cache, never()).get(any());
  }
}
