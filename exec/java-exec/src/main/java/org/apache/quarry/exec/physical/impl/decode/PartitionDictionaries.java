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
package org.apache.quarry.exec.physical.impl.decode;

import org.apache.quarry.exec.cache.dictionary.ReacquirableDictionary;
import org.apache.quarry.exec.expr.PartitionScopedReference;
import org.apache.quarry.exec.ops.FragmentContext;

/**
 * Dictionary handles referenced by generated decode code. Every fragment gets
 * its own unbound copies, released when the fragment completes.
 */
public class PartitionDictionaries implements PartitionScopedReference {

  private final ReacquirableDictionary[] handles;

  public PartitionDictionaries(ReacquirableDictionary[] handles) {
    this.handles = handles.clone();
  }

  @Override
  public ReacquirableDictionary[] bind(FragmentContext context) {
    ReacquirableDictionary[] copies = new ReacquirableDictionary[handles.length];
    for (int i = 0; i < handles.length; i++) {
      if (handles[i] != null) {
        copies[i] = handles[i].unboundCopy();
      }
    }
    DictionaryLifecycleManager.releaseOnCompletion(context, copies);
    return copies;
  }

  public boolean hasDictionary(int index) {
    return handles[index] != null;
  }
}
