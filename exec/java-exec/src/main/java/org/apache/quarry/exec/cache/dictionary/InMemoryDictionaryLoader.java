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

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.google.common.collect.ImmutableList;

/**
 * Serves dictionaries registered programmatically, grouped by store path.
 */
public class InMemoryDictionaryLoader implements DictionaryLoader {

  private static final ConcurrentMap<String, Map<DictionaryColumnIdentifier, List<byte[]>>> STORES =
      new ConcurrentHashMap<>();

  private final String storePath;

  public InMemoryDictionaryLoader(String storePath) {
    this.storePath = storePath;
  }

  /**
   * Registers the values of a dictionary; the first value gets surrogate key 1.
   * A null value is stored as the member default value.
   */
  public static void register(String storePath, DictionaryColumnIdentifier identifier, List<String> values) {
    ImmutableList.Builder<byte[]> bytes = ImmutableList.builder();
    for (String value : values) {
      String stored = value == null ? DictionaryConstants.MEMBER_DEFAULT_VAL : value;
      bytes.add(stored.getBytes(DictionaryConstants.DEFAULT_CHARSET_CLASS));
    }
    STORES.computeIfAbsent(storePath, path -> new ConcurrentHashMap<>()).put(identifier, bytes.build());
  }

  public static void unregisterAll() {
    STORES.clear();
  }

  @Override
  public List<byte[]> load(DictionaryColumnIdentifier identifier) throws IOException {
    Map<DictionaryColumnIdentifier, List<byte[]>> store = STORES.get(storePath);
    List<byte[]> values = store == null ? null : store.get(identifier);
    if (values == null) {
      throw new IOException(String.format("No dictionary for column %s in store %s", identifier, storePath));
    }
    return values;
  }
}
