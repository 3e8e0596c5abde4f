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
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * The set of {@link RuntimeOverridden} methods a template declares, in a
 * stable (name) order.
 */
public class SignatureHolder implements Iterable<CodeGeneratorMethod> {

  private final Class<?> signature;
  private final CodeGeneratorMethod[] methods;
  private final Map<String, Integer> methodMap;

  public static SignatureHolder getHolder(Class<?> signature) {
    return new SignatureHolder(signature);
  }

  private SignatureHolder(Class<?> signature) {
    this.signature = signature;
    List<Method> overridden = Lists.newArrayList();
    for (Method m : signature.getMethods()) {
      if (m.getAnnotation(RuntimeOverridden.class) != null) {
        if (!Modifier.isAbstract(m.getModifiers())) {
          throw new IllegalStateException(String.format(
              "Method %s is marked as runtime overridden but is not abstract.", m.toGenericString()));
        }
        overridden.add(m);
      }
    }
    overridden.sort(Comparator.comparing(Method::getName));

    methods = new CodeGeneratorMethod[overridden.size()];
    Map<String, Integer> newMap = Maps.newHashMap();
    for (int i = 0; i < methods.length; i++) {
      methods[i] = new CodeGeneratorMethod(overridden.get(i));
      newMap.put(methods[i].getMethodName(), i);
    }
    methodMap = newMap;
  }

  public Class<?> getSignatureClass() {
    return signature;
  }

  public CodeGeneratorMethod get(int i) {
    return methods[i];
  }

  @Override
  public Iterator<CodeGeneratorMethod> iterator() {
    return ImmutableList.copyOf(methods).iterator();
  }

  public int size() {
    return methods.length;
  }

  /**
   * @return the position of the named method, or -1 when the template has no such method
   */
  public int get(String method) {
    Integer meth = methodMap.get(method);
    if (meth == null) {
      return -1;
    }
    return meth;
  }

  @Override
  public String toString() {
    return "SignatureHolder [signature=" + signature.getName() + ", methods=" + Arrays.toString(methods) + "]";
  }
}
