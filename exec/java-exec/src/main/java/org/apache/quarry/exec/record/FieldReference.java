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
package org.apache.quarry.exec.record;

import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * Identifies a column produced by an upstream operator: its name and the
 * expression id assigned by the planner. Two references match when the names
 * are equal ignoring case and the ids are equal.
 */
public class FieldReference {

  private final String name;
  private final long id;

  @JsonCreator
  public FieldReference(@JsonProperty("name") String name, @JsonProperty("id") long id) {
    this.name = Preconditions.checkNotNull(name, "name");
    this.id = id;
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("id")
  public long getId() {
    return id;
  }

  public boolean matches(FieldReference other) {
    return other != null && id == other.id && normalizedName().equals(other.normalizedName());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FieldReference)) {
      return false;
    }
    return matches((FieldReference) obj);
  }

  @Override
  public int hashCode() {
    return Objects.hash(normalizedName(), id);
  }

  private String normalizedName() {
    return name.toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return name + "#" + id;
  }
}
