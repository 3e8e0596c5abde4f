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

import org.apache.quarry.exec.record.FieldReference;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Decides which columns the decode operator is allowed to decode.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = IncludeProfile.class, name = IncludeProfile.NAME),
    @JsonSubTypes.Type(value = ExcludeProfile.class, name = ExcludeProfile.NAME),
    @JsonSubTypes.Type(value = AllowAllProfile.class, name = AllowAllProfile.NAME)})
public abstract class DecodeProfile {

  DecodeProfile() {
  }

  public abstract boolean canDecode(FieldReference column);

  static boolean containsColumn(Iterable<FieldReference> columns, FieldReference column) {
    for (FieldReference ref : columns) {
      if (ref.matches(column)) {
        return true;
      }
    }
    return false;
  }
}
