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

import java.util.Iterator;
import java.util.List;

import org.apache.quarry.common.exceptions.UserException;
import org.apache.quarry.exec.compile.CodeCompiler;
import org.apache.quarry.exec.exception.ClassTransformationException;
import org.apache.quarry.exec.expr.ClassGenerator;
import org.apache.quarry.exec.expr.ClassGenerator.HoldingContainer;
import org.apache.quarry.exec.expr.CodeGenerator;
import org.apache.quarry.exec.expr.PartitionScopedReference;
import org.apache.quarry.exec.expr.TypeHelper;
import org.apache.quarry.exec.ops.FragmentContext;
import org.apache.quarry.exec.physical.impl.InlineCodegenSupport;
import org.apache.quarry.exec.physical.impl.RowTransform;
import org.apache.quarry.exec.record.BatchSchema;
import org.apache.quarry.exec.record.MaterializedField;
import org.apache.quarry.exec.record.Row;
import org.apache.quarry.exec.record.RowProjection;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.sun.codemodel.JBlock;
import com.sun.codemodel.JClass;
import com.sun.codemodel.JExpr;
import com.sun.codemodel.JExpression;
import com.sun.codemodel.JVar;

/**
 * Fuses a chain of operators into one generated row routine. Code is generated
 * once, when the pipeline is built; the compiled class is shared through the
 * {@link CodeCompiler} cache and instantiated for every partition.
 */
public class CompiledRowPipeline implements RowTransform {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(CompiledRowPipeline.class);

  private final CodeCompiler compiler;
  private final CodeGenerator<RowProjector> codeGenerator;
  private final BatchSchema outputSchema;

  public CompiledRowPipeline(CodeCompiler compiler, BatchSchema inputSchema,
                             List<? extends InlineCodegenSupport> stages) {
    this.compiler = compiler;
    this.codeGenerator = CodeGenerator.get(RowProjector.TEMPLATE_DEFINITION);
    ClassGenerator<RowProjector> cg = codeGenerator.getRoot();
    cg.preparePlainJava();

    JBlock eval = cg.getEvalBlock();
    JExpression in = cg.getMethodArgument(ClassGenerator.EVAL_METHOD, "in");
    JExpression out = cg.getMethodArgument(ClassGenerator.EVAL_METHOD, "out");

    ImmutableList.Builder<HoldingContainer> inputs = ImmutableList.builder();
    for (int i = 0; i < inputSchema.getFieldCount(); i++) {
      MaterializedField field = inputSchema.getColumn(i);
      JClass type = TypeHelper.getHolderType(cg.getModel(), field.getType());
      JVar value = eval.decl(type, cg.getNextVar("in"), JExpr.cast(type, in.component(JExpr.lit(i))));
      inputs.add(new HoldingContainer(field.getType(), value));
    }

    List<HoldingContainer> holders = inputs.build();
    BatchSchema schema = inputSchema;
    for (InlineCodegenSupport stage : stages) {
      holders = stage.consume(cg, holders);
      schema = stage.getOutputSchema();
    }

    for (int i = 0; i < holders.size(); i++) {
      eval.assign(out.component(JExpr.lit(i)), holders.get(i).getHolder());
    }
    this.outputSchema = schema;
  }

  @Override
  public BatchSchema getOutputSchema() {
    return outputSchema;
  }

  @Override
  public Iterator<Row> execute(FragmentContext context, Iterator<Row> input) {
    final RowProjector projector;
    try {
      projector = compiler.createInstance(codeGenerator);
    } catch (ClassTransformationException e) {
      throw UserException.internalError(e)
          .message("Failure while compiling the row routine")
          .addContext("Fragment", context.getPartitionId())
          .build(logger);
    }
    projector.setup(context, bindReferences(context), outputSchema.getFieldCount());
    final RowProjection projection = new RowProjection(outputSchema);
    return Iterators.transform(input, row -> projection.project(projector.project(row.toArray())));
  }

  private Object[] bindReferences(FragmentContext context) {
    List<Object> references = codeGenerator.getReferences();
    Object[] bound = new Object[references.size()];
    for (int i = 0; i < bound.length; i++) {
      Object reference = references.get(i);
      bound[i] = reference instanceof PartitionScopedReference
          ? ((PartitionScopedReference) reference).bind(context)
          : reference;
    }
    return bound;
  }

  @VisibleForTesting
  public CodeGenerator<RowProjector> getCodeGenerator() {
    return codeGenerator;
  }
}
