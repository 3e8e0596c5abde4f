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

import org.apache.quarry.common.exceptions.QuarryRuntimeException;

/**
 * Turns a buffer of column values into a row of the given output schema.
 */
public class RowProjection {

  private final BatchSchema schema;

  public RowProjection(BatchSchema schema) {
    this.schema = schema;
  }

  public Row project(Object[] values) {
    if (values.length != schema.getFieldCount()) {
      QuarryRuntimeException.format("Row has %d values but the output schema has %d columns: %s",
          values.length, schema.getFieldCount(), schema);
    }
    return new GenericRow(values);
  }

  public BatchSchema getSchema() {
    return schema;
  }
}
