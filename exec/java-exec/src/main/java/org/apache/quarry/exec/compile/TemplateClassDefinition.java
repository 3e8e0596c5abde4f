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
package org.apache.quarry.exec.compile;

import java.util.concurrent.atomic.AtomicLong;

import org.apache.quarry.exec.compile.sig.SignatureHolder;

/**
 * Pairs the interface generated code is used through with the abstract
 * template the generated class extends.
 */
public class TemplateClassDefinition<T> {

  private final Class<T> iface;
  private final Class<?> template;
  private final SignatureHolder signature;
  private static final AtomicLong classNumber = new AtomicLong(0);

  public <X extends T> TemplateClassDefinition(Class<T> iface, Class<X> template) {
    this.iface = iface;
    this.template = template;
    this.signature = SignatureHolder.getHolder(template);
  }

  public long getNextClassNumber() {
    return classNumber.getAndIncrement();
  }

  public Class<T> getExternalInterface() {
    return iface;
  }

  public Class<?> getTemplateClass() {
    return template;
  }

  public String getTemplateClassName() {
    return template.getName();
  }

  public SignatureHolder getSignature() {
    return signature;
  }

  @Override
  public String toString() {
    return "TemplateClassDefinition [template=" + template + ", signature=" + signature + "]";
  }
}
