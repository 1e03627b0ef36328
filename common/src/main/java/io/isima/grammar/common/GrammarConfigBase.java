/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.grammar.common;

import io.isima.grammar.errors.exception.InvalidConfigurationException;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GrammarConfigBase {
  private static final Logger logger = LoggerFactory.getLogger(GrammarConfigBase.class);

  private static volatile GrammarConfigBase instance;

  private volatile Properties properties = System.getProperties();

  /**
   * GrammarConfigBase is instantiated as a singleton.
   *
   * @return The instance.
   */
  public static GrammarConfigBase getInstance() {
    if (instance == null) {
      synchronized (GrammarConfigBase.class) {
        if (instance == null) {
          instance = new GrammarConfigBase();
        }
      }
    }
    return instance;
  }

  public static void setProperties(Properties properties) {
    logger.debug("Replacing grammar runtime properties ({} entries)", properties.size());
    getInstance().properties = properties;
  }

  /**
   * Generic method to get property as string.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as a string.
   */
  public String getString(String key, String defaultValue) {
    String value = properties.getProperty(key);
    return value != null ? value.trim() : defaultValue;
  }

  /**
   * Generic method to get property as integer.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as an integer.
   */
  public int getInt(String key, int defaultValue) {
    return getInt(key, defaultValue, Integer.MIN_VALUE, Integer.MAX_VALUE);
  }

  /**
   * Generic method to get property as integer.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @param minimumValue allowed minimum value
   * @param maximumValue allowed maximum value
   * @return property as an integer.
   */
  public int getInt(String key, int defaultValue, int minimumValue, int maximumValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      final var intValue = Integer.parseInt(value.trim());
      if (intValue < minimumValue || intValue > maximumValue) {
        throw new InvalidConfigurationException(
            String.format(
                "Value of parameter %s is out of allowed range [%d : %d]: %d",
                key, minimumValue, maximumValue, intValue));
      }
      return intValue;
    } catch (NumberFormatException e) {
      throw new InvalidConfigurationException(
          String.format("Value of parameter %s is not an integer: %s", key, value), e);
    }
  }

  /**
   * Generic method to get property as long.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as a long.
   */
  public long getLong(String key, long defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new InvalidConfigurationException(
          String.format("Value of parameter %s is not a long integer: %s", key, value), e);
    }
  }

  /**
   * Generic method to get property as boolean.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as a boolean.
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
