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
package org.apache.quarry.common.exceptions;

/**
 * Category of a {@link UserException}. The category is rendered as the message prefix.
 */
public enum ErrorType {
  /** Internal failure the user cannot act on. */
  SYSTEM,
  /** Failure while reading or decoding stored data. */
  DATA_READ,
  /** The request is valid but uses a feature that is not supported. */
  UNSUPPORTED_OPERATION,
  /** Invalid configuration or argument. */
  VALIDATION,
  /** Resource exhaustion or an unavailable external resource. */
  RESOURCE,
  /** A broken invariant inside the engine. */
  INTERNAL_ERROR
}
