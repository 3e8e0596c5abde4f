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
package org.apache.quarry.exec.cache;

import java.lang.reflect.Constructor;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.quarry.common.config.QuarryConfig;
import org.apache.quarry.common.exceptions.QuarryConfigurationException;
import org.apache.quarry.common.exceptions.UserException;
import org.apache.quarry.exec.ExecConstants;
import org.apache.quarry.exec.cache.dictionary.Dictionary;
import org.apache.quarry.exec.cache.dictionary.DictionaryColumnIdentifier;
import org.apache.quarry.exec.cache.dictionary.DictionaryLoader;
import org.apache.quarry.exec.cache.dictionary.ForwardDictionaryCache;

import com.google.common.annotations.VisibleForTesting;

/**
 * Process-wide registry of caches, one per cache type and store path.
 */
public class CacheProvider {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(CacheProvider.class);

  private static volatile CacheProvider instance;

  private final QuarryConfig config;
  private final ConcurrentMap<String, ForwardDictionaryCache> forwardCaches = new ConcurrentHashMap<>();

  @VisibleForTesting
  public CacheProvider(QuarryConfig config) {
    this.config = config;
  }

  public static CacheProvider getInstance() {
    if (instance == null) {
      synchronized (CacheProvider.class) {
        if (instance == null) {
          instance = new CacheProvider(QuarryConfig.create());
        }
      }
    }
    return instance;
  }

  /**
   * Returns the cache of the given type for the store, creating it on first use.
   */
  public Cache<DictionaryColumnIdentifier, Dictionary> createCache(CacheType cacheType, String storePath) {
    switch (cacheType) {
    case FORWARD_DICTIONARY:
      return forwardCaches.computeIfAbsent(storePath,
          path -> new ForwardDictionaryCache(path, createLoader(path)));
    default:
      throw UserException.unsupportedError()
          .message("Cache type %s is not supported", cacheType)
          .build(logger);
    }
  }

  private DictionaryLoader createLoader(String storePath) {
    try {
      Class<DictionaryLoader> loaderClass = config.getClassAt(ExecConstants.DICTIONARY_LOADER, DictionaryLoader.class);
      Constructor<DictionaryLoader> ctor = loaderClass.getConstructor(String.class);
      logger.debug("Creating dictionary loader {} for store {}", loaderClass.getName(), storePath);
      return ctor.newInstance(storePath);
    } catch (QuarryConfigurationException | ReflectiveOperationException e) {
      throw UserException.validationError(e)
          .message("Unable to create the dictionary loader configured at %s", ExecConstants.DICTIONARY_LOADER)
          .addContext("Store path", storePath)
          .build(logger);
    }
  }

  /**
   * Drops every cache this provider created, pinned or not.
   */
  public void dropAllCache() {
    forwardCaches.clear();
  }
}
