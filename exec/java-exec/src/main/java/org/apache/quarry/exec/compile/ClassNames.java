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

import java.io.File;
import java.util.Objects;

/**
 * The forms of a generated class name used while compiling and saving it.
 */
public class ClassNames {
  public final String dot;
  public final String slash;
  public final String clazz;

  public ClassNames(String className) {
    dot = className;
    slash = className.replace('.', File.separatorChar);
    clazz = File.separatorChar + slash + ".class";
  }

  @Override
  public int hashCode() {
    return Objects.hash(dot, slash, clazz);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    ClassNames other = (ClassNames) obj;
    return Objects.equals(dot, other.dot)
        && Objects.equals(slash, other.slash)
        && Objects.equals(clazz, other.clazz);
  }

  @Override
  public String toString() {
    return dot;
  }
}
