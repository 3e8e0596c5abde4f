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
import java.util.List;

import org.apache.quarry.common.config.QuarryConfig;
import org.apache.quarry.exec.ExecConstants;
import org.apache.quarry.exec.compile.CodeCompiler;
import org.apache.quarry.exec.ops.FragmentContext;
import org.apache.quarry.exec.physical.impl.project.CompiledRowPipeline;
import org.apache.quarry.exec.record.BatchSchema;
import org.apache.quarry.exec.record.Row;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Turns a chain of operators into one {@link RowTransform}, either by fusing
 * them into generated code or by stacking their row iterators, depending on
 * {@code quarry.exec.decode.codegen.enabled}.
 */
public class PipelineAssembler {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PipelineAssembler.class);

  private final CodeCompiler compiler;
  private final boolean codegenEnabled;

  public PipelineAssembler(QuarryConfig config, CodeCompiler compiler) {
    this.compiler = compiler;
    this.codegenEnabled = config.getBoolean(ExecConstants.DECODE_CODEGEN_ENABLED);
  }

  public <S extends RowTransform & InlineCodegenSupport> RowTransform assemble(BatchSchema inputSchema, List<S> stages) {
    Preconditions.checkArgument(!stages.isEmpty(), "A pipeline needs at least one stage");
    if (codegenEnabled) {
      logger.debug("Assembling compiled pipeline of {} stage(s)", stages.size());
      return new CompiledRowPipeline(compiler, inputSchema, stages);
    }
    logger.debug("Assembling row pipeline of {} stage(s)", stages.size());
    return new ChainedRowTransform(ImmutableList.<RowTransform>copyOf(stages));
  }

  private static class ChainedRowTransform implements RowTransform {
    private final List<RowTransform> stages;

    ChainedRowTransform(List<RowTransform> stages) {
      this.stages = stages;
    }

    @Override
    public BatchSchema getOutputSchema() {
      return stages.get(stages.size() - 1).getOutputSchema();
    }

    @Override
    public Iterator<Row> execute(FragmentContext context, Iterator<Row> input) {
      Iterator<Row> rows = input;
      for (RowTransform stage : stages) {
        rows = stage.execute(context, rows);
      }
      return rows;
    }
  }
}
