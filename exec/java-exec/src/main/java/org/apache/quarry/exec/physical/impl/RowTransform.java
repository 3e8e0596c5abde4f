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

import java.util.Iterator;

import org.apache.quarry.exec.ops.FragmentContext;
import org.apache.quarry.exec.record.BatchSchema;
import org.apache.quarry.exec.record.Row;

/**
 * A single-input, single-output operator that processes one partition's rows
 * as a pull-based iterator.
 */
public interface RowTransform {

  BatchSchema getOutputSchema();

  /**
   * Wraps the partition's input. Per-partition resources are acquired here and
   * released through completion listeners on the context.
   */
  Iterator<Row> execute(FragmentContext context, Iterator<Row> input);
}
