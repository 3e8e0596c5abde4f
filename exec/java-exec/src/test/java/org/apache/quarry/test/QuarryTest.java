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
package org.apache.quarry.test;

import java.util.concurrent.TimeUnit;

import org.junit.AfterClass;
import org.junit.Before;
import org.junit.Rule;
import org.junit.rules.TestName;
import org.junit.rules.TestRule;
import org.junit.rules.TestWatcher;
import org.junit.rules.Timeout;
import org.junit.runner.Description;
import org.slf4j.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

public class QuarryTest {
  static final Logger logger = org.slf4j.LoggerFactory.getLogger(QuarryTest.class);

  protected static final ObjectMapper objectMapper = new ObjectMapper();

  static final Logger testReporter = org.slf4j.LoggerFactory.getLogger("org.apache.quarry.TestReporter");
  static final TestLogReporter LOG_OUTCOME = new TestLogReporter();

  static String className;

  @Rule public final TestRule TIMEOUT = new Timeout(50, TimeUnit.SECONDS);
  @Rule public final TestLogReporter logOutcome = LOG_OUTCOME;

  @Rule public TestName TEST_NAME = new TestName();

  @Before
  public void printID() throws Exception {
    logger.info("Running {}#{}", getClass().getName(), TEST_NAME.getMethodName());
  }

  @AfterClass
  public static void finiQuarryTest() {
    testReporter.info(String.format("Test Class done: %s.", className));
  }

  private static class TestLogReporter extends TestWatcher {

    private long start;

    @Override
    protected void starting(Description description) {
      super.starting(description);
      className = description.getClassName();
      start = System.nanoTime();
    }

    @Override
    protected void failed(Throwable e, Description description) {
      testReporter.error(String.format("Test Failed (%d ms): %s", elapsed(), description.getDisplayName()), e);
    }

    @Override
    public void succeeded(Description description) {
      testReporter.info(String.format("Test Succeeded (%d ms): %s", elapsed(), description.getDisplayName()));
    }

    private long elapsed() {
      return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }
  }
}
