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
package org.apache.quarry.exec.exception;

import org.apache.quarry.common.exceptions.QuarryException;

public class ClassTransformationException extends QuarryException {
  private static final long serialVersionUID = 3279347210342758743L;

  public ClassTransformationException() {
    super();
  }

  public ClassTransformationException(String message, Throwable cause) {
    super(message, cause);
  }

  public ClassTransformationException(String message) {
    super(message);
  }

  public ClassTransformationException(Throwable cause) {
    super(cause);
  }
}
