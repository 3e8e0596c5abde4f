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
import java.io.Serializable;

import org.apache.quarry.common.exceptions.UserException;
import org.apache.quarry.exec.cache.CacheProvider;
import org.apache.quarry.exec.cache.CacheType;

/**
 * A dictionary handle that can travel with generated code. It holds a live
 * dictionary only while bound; the reference is transient, so a handle that
 * was serialized, copied or released fetches the dictionary again from the
 * store's cache the next time it is used.
 */
public class ReacquirableDictionary implements Dictionary, Serializable {
  private static final long serialVersionUID = 2016102914370822521L;
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ReacquirableDictionary.class);

  private final String storePath;
  private final DictionaryColumnIdentifier identifier;
  private transient Dictionary dictionary;

  public ReacquirableDictionary(String storePath, DictionaryColumnIdentifier identifier) {
    this(storePath, identifier, null);
  }

  public ReacquirableDictionary(String storePath, DictionaryColumnIdentifier identifier, Dictionary dictionary) {
    this.storePath = storePath;
    this.identifier = identifier;
    this.dictionary = dictionary;
  }

  public boolean isBound() {
    return dictionary != null;
  }

  /**
   * Makes sure a live dictionary is held, fetching and pinning it if needed.
   *
   * @return the live dictionary
   */
  public Dictionary ensureBound() {
    if (dictionary == null) {
      try {
        dictionary = CacheProvider.getInstance()
            .createCache(CacheType.FORWARD_DICTIONARY, storePath)
            .get(identifier);
        logger.debug("Reacquired dictionary {} from store {}", identifier, storePath);
      } catch (IOException e) {
        throw UserException.dataReadError(e)
            .message("Unable to reacquire the dictionary for column %s", identifier)
            .addContext("Store path", storePath)
            .build(logger);
      }
    }
    return dictionary;
  }

  /**
   * @return a handle for the same dictionary that holds no live reference
   */
  public ReacquirableDictionary unboundCopy() {
    return new ReacquirableDictionary(storePath, identifier);
  }

  @Override
  public byte[] getDictionaryValueForKeyInBytes(int surrogateKey) {
    return ensureBound().getDictionaryValueForKeyInBytes(surrogateKey);
  }

  @Override
  public String getDictionaryValueForKey(int surrogateKey) {
    return ensureBound().getDictionaryValueForKey(surrogateKey);
  }

  /**
   * Releases the live dictionary and returns the handle to the unbound state.
   * An unbound handle is bound first so that the release is always matched by
   * an acquisition. A handle whose dictionary can no longer be fetched holds
   * no pin and is left unbound.
   */
  @Override
  public void release() {
    final Dictionary live;
    try {
      live = ensureBound();
    } catch (UserException e) {
      logger.warn("Dictionary {} of store {} could not be reacquired for release", identifier, storePath, e);
      return;
    }
    live.release();
    dictionary = null;
  }

  public String getStorePath() {
    return storePath;
  }

  public DictionaryColumnIdentifier getIdentifier() {
    return identifier;
  }

  @Override
  public String toString() {
    return "ReacquirableDictionary [" + identifier + ", bound=" + isBound() + "]";
  }
}
