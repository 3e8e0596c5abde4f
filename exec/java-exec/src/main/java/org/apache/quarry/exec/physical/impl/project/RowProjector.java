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

import org.apache.quarry.exec.compile.TemplateClassDefinition;
import org.apache.quarry.exec.ops.FragmentContext;

/**
 * Generated routine that turns one input row into one output row.
 */
public interface RowProjector {

  void setup(FragmentContext context, Object[] references, int outputWidth);

  Object[] project(Object[] in);

  TemplateClassDefinition<RowProjector> TEMPLATE_DEFINITION =
      new TemplateClassDefinition<>(RowProjector.class, RowProjectorTemplate.class);
}
