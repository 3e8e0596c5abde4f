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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

import org.apache.quarry.exec.cache.Cache;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;

/**
 * Forward dictionaries of one store. A dictionary is loaded on first use, pinned
 * by every {@link #get} and unpinned by {@link Dictionary#release()}. Only
 * unpinned dictionaries can be invalidated. Deciding when to invalidate is up
 * to the owner of the cache.
 */
public class ForwardDictionaryCache implements Cache<DictionaryColumnIdentifier, Dictionary> {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ForwardDictionaryCache.class);

  private final String storePath;
  private final DictionaryLoader loader;
  private final ConcurrentMap<DictionaryColumnIdentifier, ForwardDictionary> dictionaries = new ConcurrentHashMap<>();

  public ForwardDictionaryCache(String storePath, DictionaryLoader loader) {
    this.storePath = storePath;
    this.loader = loader;
  }

  /**
   * Pins and returns the dictionary, loading it first if needed. The load runs
   * outside the map's locks; when two callers load the same key concurrently
   * the first one stored wins.
   */
  @Override
  public Dictionary get(DictionaryColumnIdentifier key) throws IOException {
    while (true) {
      ForwardDictionary pinned = dictionaries.computeIfPresent(key, (k, dictionary) -> {
        dictionary.pin();
        return dictionary;
      });
      if (pinned != null) {
        return pinned;
      }
      dictionaries.putIfAbsent(key, load(key));
    }
  }

  private ForwardDictionary load(DictionaryColumnIdentifier key) throws IOException {
    Stopwatch watch = Stopwatch.createStarted();
    ForwardDictionary dictionary = new ForwardDictionary(key, loader.load(key));
    logger.debug("Loaded dictionary {} from store {} with {} value(s) in {}ms",
        key, storePath, dictionary.getSize(), watch.elapsed(TimeUnit.MILLISECONDS));
    return dictionary;
  }

  @Override
  public Dictionary getIfPresent(DictionaryColumnIdentifier key) {
    return dictionaries.get(key);
  }

  @Override
  public boolean invalidate(DictionaryColumnIdentifier key) {
    ForwardDictionary before = dictionaries.get(key);
    ForwardDictionary after = dictionaries.computeIfPresent(key,
        (k, dictionary) -> dictionary.getPinCount() == 0 ? null : dictionary);
    return before != null && after == null;
  }

  @Override
  public void invalidateAll() {
    for (DictionaryColumnIdentifier key : dictionaries.keySet()) {
      invalidate(key);
    }
  }

  @VisibleForTesting
  public int getPinCount(DictionaryColumnIdentifier key) {
    ForwardDictionary dictionary = dictionaries.get(key);
    return dictionary == null ? 0 : dictionary.getPinCount();
  }

  public String getStorePath() {
    return storePath;
  }
}
