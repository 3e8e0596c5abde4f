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
package org.apache.quarry.exec.compile.sig;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Iterator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.thoughtworks.paranamer.AnnotationParanamer;
import com.thoughtworks.paranamer.Paranamer;

/**
 * A template method the code generator implements. Parameter names come from
 * the {@code @Named} annotations on the template so generated code can refer
 * to them.
 */
public class CodeGeneratorMethod implements Iterable<CodeGeneratorArgument> {

  private final String methodName;
  private final Class<?> returnType;
  private final CodeGeneratorArgument[] arguments;
  private final Class<?>[] exs;
  private final Method underlyingMethod;

  public CodeGeneratorMethod(Method m) {
    this.underlyingMethod = m;
    this.methodName = m.getName();
    this.returnType = m.getReturnType();
    Paranamer para = new AnnotationParanamer();
    String[] parameterNames = para.lookupParameterNames(m, true);
    Class<?>[] types = m.getParameterTypes();
    if (parameterNames.length != types.length) {
      throw new IllegalStateException(String.format("Unexpected number of parameter names %s.  Expected %s on method %s.",
          Arrays.toString(parameterNames), Arrays.toString(types), m.toGenericString()));
    }
    arguments = new CodeGeneratorArgument[parameterNames.length];
    for (int i = 0; i < parameterNames.length; i++) {
      arguments[i] = new CodeGeneratorArgument(parameterNames[i], types[i]);
    }
    exs = m.getExceptionTypes();
  }

  public String getMethodName() {
    return methodName;
  }

  public Class<?> getReturnType() {
    return returnType;
  }

  public Iterable<Class<?>> getThrowsIterable() {
    return ImmutableList.copyOf(exs);
  }

  @Override
  public Iterator<CodeGeneratorArgument> iterator() {
    return Iterators.forArray(arguments);
  }

  @Override
  public String toString() {
    return "CodeGeneratorMethod [" + underlyingMethod.toGenericString() + "]";
  }
}
