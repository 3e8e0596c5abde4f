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

import org.apache.quarry.exec.cache.dictionary.Dictionary;
import org.apache.quarry.exec.ops.CompletionListener;
import org.apache.quarry.exec.ops.FragmentContext;

/**
 * Ties the dictionaries acquired for a fragment to the fragment's completion.
 */
public final class DictionaryLifecycleManager {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DictionaryLifecycleManager.class);

  private DictionaryLifecycleManager() {
  }

  /**
   * Registers a single completion listener that releases every non-null
   * dictionary, whether the fragment succeeds or fails.
   */
  public static void releaseOnCompletion(FragmentContext context, Dictionary[] dictionaries) {
    context.addCompletionListener(new ReleaseDictionaries(dictionaries));
  }

  private static class ReleaseDictionaries implements CompletionListener {
    private final Dictionary[] dictionaries;

    ReleaseDictionaries(Dictionary[] dictionaries) {
      this.dictionaries = dictionaries;
    }

    @Override
    public void onCompletion(FragmentContext context, Throwable failure) {
      int released = 0;
      for (Dictionary dictionary : dictionaries) {
        if (dictionary == null) {
          continue;
        }
        try {
          dictionary.release();
          released++;
        } catch (RuntimeException e) {
          logger.warn("Failure releasing dictionary {} for fragment {}", dictionary, context.getPartitionId(), e);
        }
      }
      logger.debug("Released {} dictionary(ies) for fragment {}", released, context.getPartitionId());
    }
  }
}
