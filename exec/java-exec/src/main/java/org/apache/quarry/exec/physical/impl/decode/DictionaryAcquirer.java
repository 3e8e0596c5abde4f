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

import org.apache.quarry.common.exceptions.UserException;
import org.apache.quarry.exec.cache.Cache;
import org.apache.quarry.exec.cache.dictionary.Dictionary;
import org.apache.quarry.exec.cache.dictionary.DictionaryColumnIdentifier;
import org.apache.quarry.exec.cache.dictionary.ReacquirableDictionary;

/**
 * Fetches one dictionary per decoded column from the cache. A column whose
 * dictionary cannot be fetched gets no dictionary: its surrogate keys pass
 * through undecoded, unless strict mode turns the failure into an error.
 */
public class DictionaryAcquirer {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DictionaryAcquirer.class);

  private final DecodePlan plan;
  private final String storePath;
  private final boolean failOnMissing;

  public DictionaryAcquirer(DecodePlan plan, String storePath, boolean failOnMissing) {
    this.plan = plan;
    this.storePath = storePath;
    this.failOnMissing = failOnMissing;
  }

  /**
   * @return dictionaries aligned with the plan's columns; null where the column
   *         is not decoded or its dictionary could not be fetched
   */
  public Dictionary[] acquire(Cache<DictionaryColumnIdentifier, Dictionary> cache) {
    Dictionary[] dictionaries = new Dictionary[plan.size()];
    try {
      for (int i = 0; i < dictionaries.length; i++) {
        DecodePlan.Entry entry = plan.getEntry(i);
        if (entry != null) {
          dictionaries[i] = fetch(cache, entry);
        }
      }
    } catch (RuntimeException e) {
      releaseAcquired(dictionaries, e);
      throw e;
    }
    return dictionaries;
  }

  /**
   * Same as {@link #acquire}, with every fetched dictionary wrapped in a bound
   * {@link ReacquirableDictionary}.
   */
  public ReacquirableDictionary[] acquireReacquirable(Cache<DictionaryColumnIdentifier, Dictionary> cache) {
    ReacquirableDictionary[] handles = new ReacquirableDictionary[plan.size()];
    try {
      for (int i = 0; i < handles.length; i++) {
        DecodePlan.Entry entry = plan.getEntry(i);
        if (entry == null) {
          continue;
        }
        Dictionary dictionary = fetch(cache, entry);
        if (dictionary != null) {
          handles[i] = new ReacquirableDictionary(storePath, entry.getDictionaryColumnIdentifier(), dictionary);
        }
      }
    } catch (RuntimeException e) {
      releaseAcquired(handles, e);
      throw e;
    }
    return handles;
  }

  /**
   * Releases the dictionaries fetched before a failure. Release failures are
   * attached to the original failure.
   */
  private static void releaseAcquired(Dictionary[] dictionaries, RuntimeException failure) {
    for (Dictionary dictionary : dictionaries) {
      if (dictionary == null) {
        continue;
      }
      try {
        dictionary.release();
      } catch (RuntimeException e) {
        failure.addSuppressed(e);
      }
    }
  }

  private Dictionary fetch(Cache<DictionaryColumnIdentifier, Dictionary> cache, DecodePlan.Entry entry) {
    DictionaryColumnIdentifier key = entry.getDictionaryColumnIdentifier();
    try {
      Dictionary dictionary = cache.get(key);
      logger.debug("Acquired dictionary for {}", key);
      return dictionary;
    } catch (Exception e) {
      if (failOnMissing) {
        throw UserException.dataReadError(e)
            .message("Unable to fetch the dictionary of column %s", entry.getDimension().getName())
            .addContext("Table", entry.getTableName())
            .addContext("Store path", storePath)
            .build(logger);
      }
      logger.warn("Unable to fetch the dictionary of column {} in table {}; its values will not be decoded",
          entry.getDimension().getName(), entry.getTableName(), e);
      return null;
    }
  }
}
