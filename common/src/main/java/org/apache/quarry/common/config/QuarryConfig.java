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

import java.io.IOException;
import java.net.URL;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Map.Entry;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import org.apache.quarry.common.exceptions.QuarryConfigurationException;
import org.apache.quarry.common.exceptions.UserException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;

/**
 * Quarry configuration, a thin layer over a Typesafe {@link Config}.
 */
public class QuarryConfig {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(QuarryConfig.class);

  private final Config config;

  @VisibleForTesting
  public QuarryConfig(Config config) {
    this.config = config;
    logger.trace("Given Config object is:\n{}", config.root().render(ConfigRenderOptions.defaults()));
  }

  /**
   * Creates a QuarryConfig object using the default config file names.
   * @return The new QuarryConfig object.
   */
  public static QuarryConfig create() {
    return create(null, null);
  }

  /**
   * <b><u>Do not use this method outside of test code.</u></b>
   */
  @VisibleForTesting
  public static QuarryConfig create(Properties testConfigurations) {
    return create(null, testConfigurations);
  }

  /**
   * Creates a configuration using the provided config object.
   * @param config custom configuration
   * @return {@link QuarryConfig} instance
   */
  public static QuarryConfig create(Config config) {
    return new QuarryConfig(config.resolve());
  }

  /**
   * QuarryConfig loads up configuration information from the classpath. The order of precedence is:
   * <ul>
   * <li>Optional overriding properties (tests only).</li>
   * <li>A single copy of "{@code quarry-override.conf}", or the given override resource, together
   *     with JVM system properties.</li>
   * <li>All copies of "{@code quarry-module.conf}". Loading order is indeterminate.</li>
   * </ul>
   *
   * @param overrideFileResourcePathname
   *          the classpath resource pathname of the file to use for
   *          configuration override purposes; {@code null} specifies to use the
   *          default pathname ({@link CommonConstants#CONFIG_OVERRIDE_RESOURCE_PATHNAME})
   * @param overriderProps
   *          optional property map for further overriding
   * @return A merged Config object.
   */
  public static QuarryConfig create(String overrideFileResourcePathname, Properties overriderProps) {
    final StringBuilder logString = new StringBuilder();
    final Stopwatch watch = Stopwatch.createStarted();
    overrideFileResourcePathname =
        overrideFileResourcePathname == null
            ? CommonConstants.CONFIG_OVERRIDE_RESOURCE_PATHNAME
            : overrideFileResourcePathname;

    final ClassLoader classLoader = classLoader();

    // 1. Load per-module configuration files.
    Config fallback = ConfigFactory.empty();
    logString.append("Module configuration files:\n");
    for (URL url : moduleConfigUrls(classLoader)) {
      logString.append("\t- ").append(url).append("\n");
      fallback = ConfigFactory.parseURL(url).withFallback(fallback);
    }

    // 2. Load any overrides file along with any overrides from JVM system properties.
    final URL overrideFileUrl = classLoader.getResource(overrideFileResourcePathname);
    if (overrideFileUrl != null) {
      logString.append("Override File: ").append(overrideFileUrl).append("\n");
    }
    Config effectiveConfig =
        ConfigFactory.load(classLoader, overrideFileResourcePathname).withFallback(fallback);

    // 3. Apply any overriding properties.
    if (overriderProps != null) {
      logString.append("Overridden Properties:\n");
      for (Entry<Object, Object> entry : overriderProps.entrySet()) {
        logString.append("\t-").append(entry.getKey()).append(" = ").append(entry.getValue()).append("\n");
      }
      effectiveConfig =
          ConfigFactory.parseProperties(overriderProps).withFallback(effectiveConfig);
    }

    logger.info("Configuration file(s) identified in {}ms.\n{}",
        watch.elapsed(TimeUnit.MILLISECONDS),
        logString);
    return new QuarryConfig(effectiveConfig.resolve());
  }

  private static ClassLoader classLoader() {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    return loader != null ? loader : QuarryConfig.class.getClassLoader();
  }

  private static List<URL> moduleConfigUrls(ClassLoader classLoader) {
    try {
      Enumeration<URL> urls = classLoader.getResources(CommonConstants.CONFIG_MODULE_RESOURCE_PATHNAME);
      return Collections.list(urls);
    } catch (IOException e) {
      throw UserException.resourceError(e)
          .message("Failure while scanning the classpath for %s", CommonConstants.CONFIG_MODULE_RESOURCE_PATHNAME)
          .build(logger);
    }
  }

  public Config getConfig() {
    return config;
  }

  public boolean hasPath(String path) {
    return config.hasPath(path);
  }

  public String getString(String path) {
    return config.getString(path);
  }

  public boolean getBoolean(String path) {
    return config.getBoolean(path);
  }

  public int getInt(String path) {
    return config.getInt(path);
  }

  public long getLong(String path) {
    return config.getLong(path);
  }

  public <T> Class<T> getClassAt(String location, Class<T> clazz) throws QuarryConfigurationException {
    final String className = getString(location);
    if (className == null || className.isEmpty()) {
      throw new QuarryConfigurationException(String.format(
          "No class defined at location '%s'. Expected a definition of the class [%s]",
          location, clazz.getCanonicalName()));
    }

    try {
      final Class<?> c = Class.forName(className, true, classLoader());
      if (clazz.isAssignableFrom(c)) {
        @SuppressWarnings("unchecked")
        final Class<T> t = (Class<T>) c;
        return t;
      }

      throw new QuarryConfigurationException(String.format("The class [%s] listed at location '%s' should be of type [%s].  It isn't.",
          className, location, clazz.getCanonicalName()));
    } catch (ClassNotFoundException ex) {
      throw new QuarryConfigurationException(String.format("Failure while initializing class [%s] described at configuration value '%s'.",
          className, location), ex);
    }
  }

  @Override
  public String toString() {
    return config.root().render();
  }
}
