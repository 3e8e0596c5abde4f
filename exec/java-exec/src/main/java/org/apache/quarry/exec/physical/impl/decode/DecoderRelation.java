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

import org.apache.quarry.exec.metadata.DimensionDescriptor;
import org.apache.quarry.exec.metadata.TableIdentifier;
import org.apache.quarry.exec.record.FieldReference;

/**
 * A table scanned below the decode operator. A query joining several tables has
 * one relation per table; each output column belongs to at most one of them.
 */
public interface DecoderRelation {

  /**
   * @return true if the column is produced from this relation's table
   */
  boolean contains(FieldReference column);

  TableIdentifier getTableIdentifier();

  /**
   * @return the dimension with the given name, or null if the table has none
   */
  DimensionDescriptor lookupDimension(String tableName, String columnName);
}
