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

/**
 * Maps the surrogate keys of one column to the bytes of the original values.
 * Instances are shared through the dictionary cache; every successful
 * {@code get} from the cache must be matched by one {@link #release()}.
 */
public interface Dictionary {

  /**
   * @return the stored bytes for the key, or null when the key is not in the dictionary
   */
  byte[] getDictionaryValueForKeyInBytes(int surrogateKey);

  /**
   * @return the stored value for the key decoded as text, or null when the key is not in the dictionary
   */
  String getDictionaryValueForKey(int surrogateKey);

  /**
   * Gives up this holder's pin on the dictionary. Never throws.
   */
  void release();
}
