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

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutionException;

import org.apache.quarry.common.config.QuarryConfig;
import org.apache.quarry.exec.ExecConstants;
import org.apache.quarry.exec.exception.ClassTransformationException;
import org.apache.quarry.exec.expr.CodeGenerator;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.Lists;

/**
 * Code compiler shared by all threads and operators. Holds a single cache of
 * generated classes, keyed by the generified source, so identical code is
 * compiled only once.
 */
public class CodeCompiler {

  private final ClassBuilder classBuilder;

  /**
   * Guava loading cache that defers creating an entry until first needed. If
   * two threads try to create the same class at the same time, the first does
   * the work and the second waits for it.
   */
  private final LoadingCache<CodeGenerator<?>, GeneratedClassEntry> cache;

  public CodeCompiler(final QuarryConfig config) {
    classBuilder = new ClassBuilder(config);
    final int cacheMaxSize = config.getInt(ExecConstants.COMPILE_CACHE_MAX_SIZE);
    cache = CacheBuilder.newBuilder()
        .maximumSize(cacheMaxSize)
        .build(new Loader());
  }

  /**
   * Create a single instance of the generated class.
   *
   * @param cg code generator for the class to be instantiated.
   * @return an instance of the generated class
   * @throws ClassTransformationException if generation, compilation or instantiation fails
   */
  @SuppressWarnings("unchecked")
  public <T> T createInstance(final CodeGenerator<?> cg) throws ClassTransformationException {
    return (T) createInstances(cg, 1).get(0);
  }

  /**
   * Create multiple instances of the generated class.
   */
  @SuppressWarnings("unchecked")
  public <T> List<T> createInstances(final CodeGenerator<?> cg, int count) throws ClassTransformationException {
    try {
      cg.generate();
    } catch (IOException e) {
      throw new ClassTransformationException("Failure generating code for " + cg.getMaterializedClassName(), e);
    }
    try {
      final GeneratedClassEntry ce = cache.get(cg);
      List<T> tList = Lists.newArrayList();
      for (int i = 0; i < count; i++) {
        tList.add((T) ce.clazz.getDeclaredConstructor().newInstance());
      }
      return tList;
    } catch (ExecutionException e) {
      if (e.getCause() instanceof ClassTransformationException) {
        throw (ClassTransformationException) e.getCause();
      }
      throw new ClassTransformationException(e.getCause());
    } catch (ReflectiveOperationException e) {
      throw new ClassTransformationException(e);
    }
  }

  private class Loader extends CacheLoader<CodeGenerator<?>, GeneratedClassEntry> {
    @Override
    public GeneratedClassEntry load(final CodeGenerator<?> cg) throws Exception {
      return new GeneratedClassEntry(classBuilder.getImplementationClass(cg));
    }
  }

  private static class GeneratedClassEntry {
    private final Class<?> clazz;

    public GeneratedClassEntry(final Class<?> clazz) {
      this.clazz = clazz;
    }
  }

  @VisibleForTesting
  public long getCachedClassCount() {
    return cache.size();
  }

  /**
   * Flush the compiled classes from the cache.
   */
  @VisibleForTesting
  public void flushCache() {
    cache.invalidateAll();
  }
}
