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
package org.apache.quarry.common.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Properties;

import org.apache.quarry.common.exceptions.QuarryConfigurationException;
import org.junit.Test;

public class TestQuarryConfig {

  @Test
  public void readsModuleFiles() {
    QuarryConfig config = QuarryConfig.create();
    assertEquals("module", config.getString("quarry.test.value"));
    assertEquals("module", config.getString("quarry.test.overridden"));
    assertFalse(config.hasPath("quarry.test.absent"));
  }

  @Test
  public void overrideFileWinsOverModules() {
    QuarryConfig config = QuarryConfig.create("quarry-test-override.conf", null);
    assertEquals("override", config.getString("quarry.test.overridden"));
    assertEquals("module", config.getString("quarry.test.value"));
  }

  @Test
  public void propertiesWinOverEverything() {
    Properties props = new Properties();
    props.put("quarry.test.overridden", "property");
    props.put("quarry.test.number", "42");
    QuarryConfig config = QuarryConfig.create("quarry-test-override.conf", props);
    assertEquals("property", config.getString("quarry.test.overridden"));
    assertEquals(42, config.getInt("quarry.test.number"));
    assertEquals(42L, config.getLong("quarry.test.number"));
  }

  @Test
  public void resolvesConfiguredClass() throws Exception {
    assertSame(Thread.class, QuarryConfig.create().getClassAt("quarry.test.runnable", Runnable.class));
  }

  @Test
  public void rejectsClassOfWrongType() {
    assertConfigurationError("quarry.test.not_runnable", "should be of type");
  }

  @Test
  public void rejectsUnknownClass() {
    assertConfigurationError("quarry.test.missing_class", "Failure while initializing class");
  }

  @Test
  public void rejectsEmptyClassName() {
    assertConfigurationError("quarry.test.empty_class", "No class defined");
  }

  private static void assertConfigurationError(String path, String expected) {
    try {
      QuarryConfig.create().getClassAt(path, Runnable.class);
      fail("Expected " + path + " to be rejected");
    } catch (QuarryConfigurationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains(expected));
    }
  }
}
