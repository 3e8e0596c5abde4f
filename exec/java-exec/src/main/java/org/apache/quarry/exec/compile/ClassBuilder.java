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
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;

import org.apache.quarry.common.config.QuarryConfig;
import org.apache.quarry.exec.ExecConstants;
import org.apache.quarry.exec.exception.ClassTransformationException;
import org.apache.quarry.exec.expr.CodeGenerator;
import org.codehaus.commons.compiler.CompileException;

/**
 * Compiles "plain-old Java" produced by a {@link CodeGenerator}, loads the
 * byte codes into a fresh class loader and returns the resulting class. The
 * generated class is a subclass of its template, so the JVM finds the template
 * methods through normal inheritance.
 * <p>
 * To debug generated code:
 * <ul>
 * <li>Set <var>quarry.exec.compile.save_source</var> to <var>true</var>.</li>
 * <li>Set <var>quarry.exec.compile.code_dir</var> to the directory that
 * should receive the source.</li>
 * <li>Add that directory to the IDE's source lookup path and step into the
 * template method from a breakpoint.</li>
 * </ul>
 */
public class ClassBuilder {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ClassBuilder.class);

  private final boolean saveCode;
  private final boolean debug;
  private final File codeDir;

  public ClassBuilder(QuarryConfig config) {
    saveCode = config.getBoolean(ExecConstants.COMPILE_SAVE_SOURCE);
    debug = config.getBoolean(ExecConstants.COMPILE_DEBUG);
    codeDir = new File(config.getString(ExecConstants.COMPILE_CODE_DIR));
  }

  /**
   * Given a code generator which has already generated its code, compile the
   * code, create a class loader, and return the resulting Java class.
   *
   * @param cg a code generator that has generated its code
   * @return the class that the code generator defines
   * @throws ClassTransformationException if the code does not compile or load
   */
  public Class<?> getImplementationClass(CodeGenerator<?> cg) throws ClassTransformationException {
    try {
      return compileClass(cg);
    } catch (CompileException | IOException e) {
      throw new ClassTransformationException(
          String.format("Failure compiling generated class %s", cg.getMaterializedClassName()), e);
    }
  }

  private Class<?> compileClass(CodeGenerator<?> cg) throws IOException, CompileException, ClassTransformationException {
    String code = cg.getGeneratedCode();
    String className = cg.getMaterializedClassName();
    ClassNames name = new ClassNames(className);

    saveCode(code, name);

    ClassLoader parent = cg.getDefinition().getTemplateClass().getClassLoader();
    CachedClassLoader classLoader = new CachedClassLoader(parent);
    JaninoClassCompiler compiler = new JaninoClassCompiler(classLoader, debug);
    Map<String, byte[]> results = compiler.compile(name, code);
    classLoader.addClasses(results);

    try {
      return classLoader.loadClass(className);
    } catch (ClassNotFoundException e) {
      throw new ClassTransformationException(String.format("Compiled class %s could not be loaded", className), e);
    }
  }

  /**
   * Save code to the configured location for debugging. Code is saved in the
   * usual Java layout with each package as a directory.
   */
  private void saveCode(String code, ClassNames name) {
    if (!saveCode) {
      return;
    }

    File codeFile = new File(codeDir, name.slash + ".java");
    codeFile.getParentFile().mkdirs();
    try (Writer writer = Files.newBufferedWriter(codeFile.toPath(), StandardCharsets.UTF_8)) {
      writer.write(code);
    } catch (IOException e) {
      logger.warn("Could not save generated code to {}", codeFile.getAbsolutePath(), e);
    }
  }
}
