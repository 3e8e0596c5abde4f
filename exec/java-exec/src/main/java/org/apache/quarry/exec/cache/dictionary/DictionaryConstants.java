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
package org.apache.quarry.exec.cache.dictionary;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

public final class DictionaryConstants {
  private DictionaryConstants() {
  }

  /**
   * Value stored in a dictionary in place of a null member.
   */
  public static final String MEMBER_DEFAULT_VAL = "@NU#LL$!";

  public static final String DEFAULT_CHARSET = "UTF-8";

  public static final Charset DEFAULT_CHARSET_CLASS = StandardCharsets.UTF_8;

  public static final byte[] MEMBER_DEFAULT_VAL_ARRAY = MEMBER_DEFAULT_VAL.getBytes(DEFAULT_CHARSET_CLASS);
}
