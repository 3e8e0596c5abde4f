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
package org.apache.quarry.exec.cache.dictionary;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.apache.quarry.exec.metadata.ColumnIdentifier;
import org.apache.quarry.exec.metadata.DataKind;
import org.apache.quarry.exec.metadata.TableIdentifier;
import org.apache.quarry.test.QuarryTest;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.Lists;

public class TestForwardDictionaryCache extends QuarryTest {

  private static final TableIdentifier SALES = new TableIdentifier("default", "sales", "sales-0001");

  private static final String STORE = "forward-cache-store";
  private static final DictionaryColumnIdentifier CITY = column("city", DataKind.STRING);

  static DictionaryColumnIdentifier column(String name, DataKind kind) {
    return new DictionaryColumnIdentifier(SALES, new ColumnIdentifier(name, kind), kind);
  }

  private ForwardDictionaryCache cache;

  @Before
  public void setup() {
    InMemoryDictionaryLoader.register(STORE, CITY, Lists.newArrayList("NYC", "LA", null));
    cache = new ForwardDictionaryCache(STORE, new InMemoryDictionaryLoader(STORE));
  }

  @After
  public void cleanup() {
    InMemoryDictionaryLoader.unregisterAll();
  }

  @Test
  public void keysStartAtOne() throws Exception {
    Dictionary dictionary = cache.get(CITY);
    assertEquals("NYC", dictionary.getDictionaryValueForKey(1));
    assertEquals("LA", dictionary.getDictionaryValueForKey(2));
    assertArrayEquals(DictionaryConstants.MEMBER_DEFAULT_VAL_ARRAY, dictionary.getDictionaryValueForKeyInBytes(3));
    dictionary.release();
  }

  @Test
  public void keysOutOfRangeAreAbsent() throws Exception {
    Dictionary dictionary = cache.get(CITY);
    assertNull(dictionary.getDictionaryValueForKeyInBytes(0));
    assertNull(dictionary.getDictionaryValueForKeyInBytes(-1));
    assertNull(dictionary.getDictionaryValueForKey(4));
    dictionary.release();
  }

  @Test
  public void everyGetPinsTheSameInstance() throws Exception {
    Dictionary first = cache.get(CITY);
    Dictionary second = cache.get(CITY);
    assertSame(first, second);
    assertEquals(2, cache.getPinCount(CITY));

    first.release();
    second.release();
    assertEquals(0, cache.getPinCount(CITY));
  }

  @Test
  public void pinCountNeverGoesNegative() throws Exception {
    Dictionary dictionary = cache.get(CITY);
    dictionary.release();
    dictionary.release();
    assertEquals(0, cache.getPinCount(CITY));

    cache.get(CITY);
    assertEquals(1, cache.getPinCount(CITY));
  }

  @Test
  public void onlyUnpinnedDictionariesAreInvalidated() throws Exception {
    Dictionary dictionary = cache.get(CITY);
    assertFalse(cache.invalidate(CITY));
    assertSame(dictionary, cache.getIfPresent(CITY));

    dictionary.release();
    assertTrue(cache.invalidate(CITY));
    assertNull(cache.getIfPresent(CITY));
    assertFalse("nothing left to invalidate", cache.invalidate(CITY));
  }

  @Test
  public void invalidateAllKeepsPinnedEntries() throws Exception {
    DictionaryColumnIdentifier country = column("country", DataKind.STRING);
    InMemoryDictionaryLoader.register(STORE, country, Lists.newArrayList("US"));
    Dictionary pinned = cache.get(CITY);
    cache.get(country).release();

    cache.invalidateAll();
    assertSame(pinned, cache.getIfPresent(CITY));
    assertNull(cache.getIfPresent(country));
    pinned.release();
  }

  @Test
  public void getIfPresentDoesNotLoadOrPin() throws Exception {
    assertNull(cache.getIfPresent(CITY));
    cache.get(CITY).release();
    cache.getIfPresent(CITY);
    assertEquals(0, cache.getPinCount(CITY));
  }

  @Test
  public void loadsOnlyOnce() throws Exception {
    DictionaryLoader loader = mock(DictionaryLoader.class);
    when(loader.load(any())).thenReturn(Lists.newArrayList("x".getBytes(DictionaryConstants.DEFAULT_CHARSET_CLASS)));
    ForwardDictionaryCache counted = new ForwardDictionaryCache(STORE, loader);
    counted.get(CITY).release();
    counted.get(CITY).release();
    verify(loader, times(1)).load(CITY);
  }

  @Test
  public void loaderFailureSurfacesAsIOException() throws Exception {
    DictionaryColumnIdentifier unknown = column("unknown", DataKind.STRING);
    try {
      cache.get(unknown);
      fail("Expected the load to fail");
    } catch (IOException e) {
      assertTrue(e.getMessage().contains("unknown"));
    }
    assertNull(cache.getIfPresent(unknown));
  }

  @Test
  public void identifierIgnoresDataKind() {
    assertEquals(CITY, column("city", DataKind.INT));
  }

  @Test
  public void slowLoadDoesNotBlockOtherCallers() throws Exception {
    CountDownLatch loading = new CountDownLatch(1);
    CountDownLatch finish = new CountDownLatch(1);
    DictionaryLoader slow = key -> {
      loading.countDown();
      try {
        finish.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException(e);
      }
      return Lists.newArrayList("x".getBytes(DictionaryConstants.DEFAULT_CHARSET_CLASS));
    };
    ForwardDictionaryCache slowCache = new ForwardDictionaryCache(STORE, slow);

    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<Dictionary> pending = executor.submit(() -> slowCache.get(CITY));
      assertTrue(loading.await(10, TimeUnit.SECONDS));

      assertFalse(slowCache.invalidate(CITY));
      assertNull(slowCache.getIfPresent(CITY));

      finish.countDown();
      Dictionary dictionary = pending.get(10, TimeUnit.SECONDS);
      assertEquals(1, slowCache.getPinCount(CITY));
      dictionary.release();
    } finally {
      finish.countDown();
      executor.shutdownNow();
    }
  }
}
