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

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.collect.ImmutableList;

/**
 * Dictionary whose surrogate keys are dense and start at 1: key {@code k}
 * maps to the {@code k-1}th stored value.
 */
public class ForwardDictionary implements Dictionary {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ForwardDictionary.class);

  private final DictionaryColumnIdentifier identifier;
  private final List<byte[]> values;
  private final AtomicInteger pinCount = new AtomicInteger();

  public ForwardDictionary(DictionaryColumnIdentifier identifier, List<byte[]> values) {
    this.identifier = identifier;
    this.values = ImmutableList.copyOf(values);
  }

  @Override
  public byte[] getDictionaryValueForKeyInBytes(int surrogateKey) {
    if (surrogateKey < 1 || surrogateKey > values.size()) {
      return null;
    }
    return values.get(surrogateKey - 1);
  }

  @Override
  public String getDictionaryValueForKey(int surrogateKey) {
    byte[] bytes = getDictionaryValueForKeyInBytes(surrogateKey);
    if (bytes == null) {
      return null;
    }
    return new String(bytes, DictionaryConstants.DEFAULT_CHARSET_CLASS);
  }

  @Override
  public void release() {
    int remaining = pinCount.updateAndGet(count -> count > 0 ? count - 1 : 0);
    logger.trace("Released dictionary {}, {} pin(s) left", identifier, remaining);
  }

  void pin() {
    pinCount.incrementAndGet();
  }

  public int getPinCount() {
    return pinCount.get();
  }

  public int getSize() {
    return values.size();
  }

  public DictionaryColumnIdentifier getIdentifier() {
    return identifier;
  }

  @Override
  public String toString() {
    return "ForwardDictionary [" + identifier + ", size=" + values.size() + ", pins=" + pinCount.get() + "]";
  }
}
