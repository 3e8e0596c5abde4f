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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import org.apache.quarry.common.config.QuarryConfig;
import org.apache.quarry.test.QuarryTest;
import org.junit.Test;

public class TestFragmentContextImpl extends QuarryTest {

  private final QuarryConfig config = QuarryConfig.create();

  @Test
  public void listenersFireOnce() {
    CompletionListener listener = mock(CompletionListener.class);
    FragmentContextImpl context = new FragmentContextImpl(3, config);
    context.addCompletionListener(listener);
    assertFalse(context.isCompleted());

    context.close();
    context.markCompleted(new RuntimeException("late"));
    assertTrue(context.isCompleted());
    verify(listener, times(1)).onCompletion(context, null);
    assertEquals(3, context.getPartitionId());
    assertSame(config, context.getConfig());
  }

  @Test
  public void failureIsPassedToListeners() {
    CompletionListener listener = mock(CompletionListener.class);
    FragmentContextImpl context = new FragmentContextImpl(0, config);
    context.addCompletionListener(listener);
    IllegalStateException failure = new IllegalStateException("cancelled");
    context.markCompleted(failure);
    verify(listener).onCompletion(context, failure);
  }

  @Test
  public void failingListenerDoesNotStopOthers() {
    CompletionListener broken = mock(CompletionListener.class);
    doThrow(new IllegalStateException("broken")).when(broken).onCompletion(any(), any());
    CompletionListener next = mock(CompletionListener.class);

    FragmentContextImpl context = new FragmentContextImpl(0, config);
    context.addCompletionListener(broken);
    context.addCompletionListener(next);
    context.close();
    verify(next).onCompletion(context, null);
  }

  @Test(expected = IllegalStateException.class)
  public void cannotRegisterAfterCompletion() {
    FragmentContextImpl context = new FragmentContextImpl(0, config);
    context.close();
    context.addCompletionListener(mock(CompletionListener.class));
  }
}
