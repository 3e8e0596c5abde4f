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
package org.apache.quarry.exec.physical.impl.project;

import javax.inject.Named;

import org.apache.quarry.exec.compile.sig.RuntimeOverridden;
import org.apache.quarry.exec.ops.FragmentContext;

public abstract class RowProjectorTemplate implements RowProjector {

  private int outputWidth;

  @Override
  public final void setup(FragmentContext context, Object[] references, int outputWidth) {
    this.outputWidth = outputWidth;
    doSetup(context, references);
  }

  @Override
  public final Object[] project(Object[] in) {
    Object[] out = new Object[outputWidth];
    doEval(in, out);
    return out;
  }

  @RuntimeOverridden
  public abstract void doSetup(@Named("context") FragmentContext context, @Named("references") Object[] references);

  @RuntimeOverridden
  public abstract void doEval(@Named("in") Object[] in, @Named("out") Object[] out);
}
