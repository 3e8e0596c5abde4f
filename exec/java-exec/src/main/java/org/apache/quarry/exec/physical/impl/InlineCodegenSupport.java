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
package org.apache.quarry.exec.physical.impl;

import java.util.List;

import org.apache.quarry.exec.expr.ClassGenerator;
import org.apache.quarry.exec.expr.ClassGenerator.HoldingContainer;
import org.apache.quarry.exec.record.BatchSchema;

/**
 * An operator that can emit its per-row logic into a generated row routine
 * instead of running as a separate iterator.
 */
public interface InlineCodegenSupport {

  BatchSchema getOutputSchema();

  /**
   * Emits code that turns the upstream column values into this operator's
   * output column values.
   *
   * @param cg the generator of the row routine
   * @param input holders of the upstream values, one per input column
   * @return holders of the output values, one per output column
   */
  List<HoldingContainer> consume(ClassGenerator<?> cg, List<HoldingContainer> input);
}
