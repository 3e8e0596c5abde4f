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

import java.io.IOException;

/**
 * A cache of values that are expensive to load. Values obtained through
 * {@link #get} are pinned until the caller releases them.
 *
 * @param <K> cache key
 * @param <V> cached value
 */
public interface Cache<K, V> {

  /**
   * Returns the value for the key, loading it on a miss, and pins it.
   *
   * @throws IOException if the value cannot be loaded
   */
  V get(K key) throws IOException;

  /**
   * @return the cached value without loading or pinning it, or null when absent
   */
  V getIfPresent(K key);

  /**
   * Drops the entry for the key if nobody has it pinned.
   *
   * @return true if an entry was removed
   */
  boolean invalidate(K key);

  /**
   * Drops every unpinned entry.
   */
  void invalidateAll();
}
