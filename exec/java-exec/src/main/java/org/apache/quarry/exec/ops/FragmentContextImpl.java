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
package org.apache.quarry.exec.ops;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.quarry.common.config.QuarryConfig;

import com.google.common.base.Preconditions;

/**
 * Default fragment context. Completion is signalled either explicitly through
 * {@link #markCompleted(Throwable)} or by closing the context.
 */
public class FragmentContextImpl implements FragmentContext, AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(FragmentContextImpl.class);

  private final int partitionId;
  private final QuarryConfig config;
  private final List<CompletionListener> listeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean completed = new AtomicBoolean(false);

  public FragmentContextImpl(int partitionId, QuarryConfig config) {
    this.partitionId = partitionId;
    this.config = Preconditions.checkNotNull(config);
  }

  @Override
  public int getPartitionId() {
    return partitionId;
  }

  @Override
  public QuarryConfig getConfig() {
    return config;
  }

  @Override
  public void addCompletionListener(CompletionListener listener) {
    Preconditions.checkState(!completed.get(), "Fragment %s has already completed", partitionId);
    listeners.add(Preconditions.checkNotNull(listener));
  }

  @Override
  public boolean isCompleted() {
    return completed.get();
  }

  /**
   * Completes the fragment and fires all registered listeners. Only the first
   * call has any effect.
   *
   * @param failure the failure that terminated the fragment, or null on success
   */
  public void markCompleted(Throwable failure) {
    if (!completed.compareAndSet(false, true)) {
      return;
    }
    if (failure == null) {
      logger.debug("Fragment {} completed, notifying {} listener(s)", partitionId, listeners.size());
    } else {
      logger.debug("Fragment {} failed, notifying {} listener(s)", partitionId, listeners.size(), failure);
    }
    for (CompletionListener listener : listeners) {
      try {
        listener.onCompletion(this, failure);
      } catch (RuntimeException e) {
        logger.warn("Completion listener {} failed for fragment {}", listener, partitionId, e);
      }
    }
    listeners.clear();
  }

  @Override
  public void close() {
    markCompleted(null);
  }
}
