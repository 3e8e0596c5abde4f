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

import java.util.List;

import org.apache.quarry.exec.record.FieldReference;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.collect.ImmutableList;

/**
 * Decodes only the listed columns. An empty list decodes nothing.
 */
@JsonTypeName(IncludeProfile.NAME)
public class IncludeProfile extends DecodeProfile {
  public static final String NAME = "include";

  private final List<FieldReference> columns;

  @JsonCreator
  public IncludeProfile(@JsonProperty("columns") List<FieldReference> columns) {
    this.columns = columns == null ? ImmutableList.<FieldReference>of() : ImmutableList.copyOf(columns);
  }

  @JsonProperty("columns")
  public List<FieldReference> getColumns() {
    return columns;
  }

  @Override
  public boolean canDecode(FieldReference column) {
    return containsColumn(columns, column);
  }

  @Override
  public String toString() {
    return "IncludeProfile " + columns;
  }
}
