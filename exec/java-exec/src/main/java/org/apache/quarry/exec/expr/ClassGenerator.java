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
package org.apache.quarry.exec.expr;

import org.apache.quarry.common.types.MajorType;
import org.apache.quarry.exec.compile.sig.CodeGeneratorArgument;
import org.apache.quarry.exec.compile.sig.CodeGeneratorMethod;
import org.apache.quarry.exec.compile.sig.SignatureHolder;

import com.google.common.base.Preconditions;
import com.sun.codemodel.JBlock;
import com.sun.codemodel.JClass;
import com.sun.codemodel.JCodeModel;
import com.sun.codemodel.JDefinedClass;
import com.sun.codemodel.JExpr;
import com.sun.codemodel.JExpression;
import com.sun.codemodel.JMethod;
import com.sun.codemodel.JMod;
import com.sun.codemodel.JType;
import com.sun.codemodel.JVar;

/**
 * Builds the body of one generated class. Each runtime-overridden template
 * method gets its own block; callers append statements to the setup and eval
 * blocks and the blocks become method bodies on {@link #flushCode()}.
 */
public class ClassGenerator<T> {

  public static final String SETUP_METHOD = "doSetup";
  public static final String EVAL_METHOD = "doEval";
  public static final String REFERENCES_ARG = "references";

  public enum BlockType {
    SETUP(SETUP_METHOD), EVAL(EVAL_METHOD);

    private final String methodName;

    BlockType(String methodName) {
      this.methodName = methodName;
    }

    public String getMethodName() {
      return methodName;
    }
  }

  private final SignatureHolder sig;
  private final CodeGenerator<T> codeGenerator;

  public final JDefinedClass clazz;
  private final JBlock[] blocks;
  private final JCodeModel model;

  private int index = 0;
  private boolean flushed;

  ClassGenerator(CodeGenerator<T> codeGenerator, SignatureHolder signature, JDefinedClass clazz, JCodeModel model) {
    this.codeGenerator = codeGenerator;
    this.clazz = clazz;
    this.sig = signature;
    this.model = model;

    blocks = new JBlock[sig.size()];
    for (int i = 0; i < sig.size(); i++) {
      blocks[i] = new JBlock(true, true);
    }
  }

  public CodeGenerator<T> getCodeGenerator() {
    return codeGenerator;
  }

  public JBlock getBlock(String methodName) {
    int i = sig.get(methodName);
    Preconditions.checkArgument(i > -1, "Tried to get method %s, which is not part of %s.", methodName, sig);
    return blocks[i];
  }

  public JBlock getBlock(BlockType type) {
    return getBlock(type.getMethodName());
  }

  public JBlock getSetupBlock() {
    return getBlock(BlockType.SETUP);
  }

  public JBlock getEvalBlock() {
    return getBlock(BlockType.EVAL);
  }

  /**
   * Refers to a parameter of one of the template methods by the name the
   * template declares for it.
   */
  public JExpression getMethodArgument(String methodName, String argumentName) {
    int position = sig.get(methodName);
    Preconditions.checkArgument(position > -1, "Tried to get method %s, which is not part of %s.", methodName, sig);
    CodeGeneratorMethod method = sig.get(position);
    for (CodeGeneratorArgument arg : method) {
      if (arg.getName().equals(argumentName)) {
        return JExpr.direct(argumentName);
      }
    }
    throw new IllegalArgumentException(String.format("Method %s has no argument named %s", methodName, argumentName));
  }

  public JCodeModel getModel() {
    return model;
  }

  public String getNextVar() {
    return "v" + index++;
  }

  public String getNextVar(String prefix) {
    return prefix + index++;
  }

  public JVar declareClassField(String prefix, JType t) {
    return clazz.field(JMod.NONE, t, prefix + index++);
  }

  public JVar declareClassField(String prefix, JType t, JExpression init) {
    return clazz.field(JMod.NONE, t, prefix + index++, init);
  }

  /**
   * Registers an object the generated code needs at run time. The object is
   * handed to the generated setup method, which casts it to the given type and
   * stores it in a class field.
   *
   * @return the class field holding the reference
   */
  public JVar addReferenceObj(Object reference, JType type) {
    int position = codeGenerator.addReference(reference);
    JVar field = declareClassField("ref", type);
    JExpression references = getMethodArgument(SETUP_METHOD, REFERENCES_ARG);
    getSetupBlock().assign(field, JExpr.cast(type, references.component(JExpr.lit(position))));
    return field;
  }

  /**
   * Declares a local in the eval block holding a value of the given type.
   */
  public HoldingContainer declare(MajorType t, JExpression init) {
    JClass holderType = TypeHelper.getHolderType(model, t);
    JVar var = getEvalBlock().decl(holderType, getNextVar("out"), init);
    return new HoldingContainer(t, var);
  }

  /**
   * Emits one method per runtime-overridden template method, each with the
   * statements accumulated in its block.
   */
  public void flushCode() {
    if (flushed) {
      return;
    }
    flushed = true;
    int i = 0;
    for (CodeGeneratorMethod method : sig) {
      JMethod outer = clazz.method(JMod.PUBLIC, model._ref(method.getReturnType()), method.getMethodName());
      for (CodeGeneratorArgument arg : method) {
        outer.param(arg.getType(), arg.getName());
      }
      for (Class<?> c : method.getThrowsIterable()) {
        outer._throws(model.ref(c));
      }
      outer.body().add(blocks[i++]);
    }
  }

  /**
   * The generated class extends its template so the JVM finds the template's
   * concrete methods through normal inheritance.
   */
  public void preparePlainJava() {
    clazz._extends(model.ref(sig.getSignatureClass()));
  }

  /**
   * A value computed by generated code: the local holding it and its type. A
   * null value in the local means the value is null.
   */
  public static class HoldingContainer {
    private final JVar holder;
    private final MajorType type;

    public HoldingContainer(MajorType t, JVar holder) {
      this.holder = holder;
      this.type = t;
    }

    public JVar getHolder() {
      return holder;
    }

    public JExpression isNull() {
      return holder.eq(JExpr._null());
    }

    public MajorType getMajorType() {
      return type;
    }

    @Override
    public String toString() {
      return "HoldingContainer [holder=" + holder.name() + ", type=" + type + "]";
    }
  }
}
