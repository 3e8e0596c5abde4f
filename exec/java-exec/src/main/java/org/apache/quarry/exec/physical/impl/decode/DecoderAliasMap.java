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

import java.util.Map;

import org.apache.quarry.exec.record.FieldReference;

import com.google.common.collect.ImmutableMap;

/**
 * Maps a projected alias to the column it was derived from. Columns without an
 * entry map to themselves.
 */
public class DecoderAliasMap {

  private static final DecoderAliasMap EMPTY = new DecoderAliasMap(ImmutableMap.<FieldReference, FieldReference>of());

  private final Map<FieldReference, FieldReference> aliases;

  public DecoderAliasMap(Map<FieldReference, FieldReference> aliases) {
    this.aliases = ImmutableMap.copyOf(aliases);
  }

  public static DecoderAliasMap empty() {
    return EMPTY;
  }

  public FieldReference resolve(FieldReference column) {
    FieldReference canonical = aliases.get(column);
    return canonical == null ? column : canonical;
  }

  @Override
  public String toString() {
    return "DecoderAliasMap " + aliases;
  }
}
