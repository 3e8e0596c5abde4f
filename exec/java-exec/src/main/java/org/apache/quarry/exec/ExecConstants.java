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
package org.apache.quarry.exec;

public final class ExecConstants {
  private ExecConstants() {
    // Do not allow instantiation
  }

  public static final String DICTIONARY_STORE_PATH = "quarry.exec.dictionary.store_path";
  public static final String DICTIONARY_LOADER = "quarry.exec.dictionary.loader";

  /**
   * Selects the compiled decode strategy when the pipeline is assembled. The
   * row-at-a-time strategy is used otherwise.
   */
  public static final String DECODE_CODEGEN_ENABLED = "quarry.exec.decode.codegen.enabled";

  /**
   * When set, a dictionary that cannot be fetched for a decodable column fails
   * the partition instead of letting raw surrogate keys through.
   */
  public static final String DECODE_FAIL_ON_MISSING_DICTIONARY = "quarry.exec.decode.fail_on_missing_dictionary";

  public static final String COMPILE_BASE = "quarry.exec.compile";
  public static final String COMPILE_CACHE_MAX_SIZE = COMPILE_BASE + ".cache_max_size";
  public static final String COMPILE_DEBUG = COMPILE_BASE + ".debug";
  public static final String COMPILE_SAVE_SOURCE = COMPILE_BASE + ".save_source";
  public static final String COMPILE_CODE_DIR = COMPILE_BASE + ".code_dir";
}
