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

import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import org.apache.quarry.common.config.QuarryConfig;
import org.apache.quarry.exec.cache.dictionary.Dictionary;
import org.apache.quarry.exec.ops.FragmentContextImpl;
import org.apache.quarry.test.QuarryTest;
import org.junit.Before;
import org.junit.Test;

public class TestDictionaryLifecycleManager extends QuarryTest {

  private Dictionary first;
  private Dictionary second;
  private FragmentContextImpl context;

  @Before
  public void setup() {
    first = mock(Dictionary.class);
    second = mock(Dictionary.class);
    context = new FragmentContextImpl(0, QuarryConfig.create());
  }

  @Test
  public void releasesEachDictionaryOnceOnSuccess() {
    DictionaryLifecycleManager.releaseOnCompletion(context, new Dictionary[] {first, null, second});
    context.markCompleted(null);
    context.close();

    verify(first, times(1)).release();
    verify(second, times(1)).release();
    assertTrue(context.isCompleted());
  }

  @Test
  public void releasesEachDictionaryOnceOnFailure() {
    DictionaryLifecycleManager.releaseOnCompletion(context, new Dictionary[] {first, second});
    context.markCompleted(new IllegalStateException("partition failed"));
    context.markCompleted(null);

    verify(first, times(1)).release();
    verify(second, times(1)).release();
  }

  @Test
  public void releaseFailureDoesNotStopTheOthers() {
    doThrow(new IllegalStateException("already gone")).when(first).release();
    DictionaryLifecycleManager.releaseOnCompletion(context, new Dictionary[] {first, second});
    context.close();

    verify(first, times(1)).release();
    verify(second, times(1)).release();
  }
}
