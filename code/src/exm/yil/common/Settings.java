/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */

package exm.yil.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.yil.common.exceptions.InvalidOptionException;

/**
 * General YIL settings
 *
 * Defaults are set here and may be overridden by Java system properties
 * of the same name through {@link #initYILProperties()}.
 * */
public class Settings
{
  /** Only emit forms that are guaranteed to re-parse */
  public static final String PRINTER_STRICT = "yil.printer.strict";
  /** Emit declaration comments carried in Meta */
  public static final String PRINTER_COMMENTS = "yil.printer.comments";
  /** Spaces per indentation level */
  public static final String PRINTER_INDENT_WIDTH = "yil.printer.indent-width";

  public static final String LOG_FILE = "yil.log.file";
  public static final String LOG_TRACE = "yil.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(PRINTER_STRICT, "true");
    defaults.setProperty(PRINTER_COMMENTS, "false");
    defaults.setProperty(PRINTER_INDENT_WIDTH, "2");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initYILProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
    Logging.setupLoggingFromSettings();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop all explicitly set values, reverting to the defaults
   */
  public static void reset() {
    properties.clear();
  }

  public static List<String> getKeys() {
    List<String> keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(PRINTER_STRICT);
    getBoolean(PRINTER_COMMENTS);
    getBoolean(LOG_TRACE);
    getIndentWidth();
  }

  /**
   * @return the validated value of {@link #PRINTER_INDENT_WIDTH}
   * @throws InvalidOptionException if negative or not an int
   */
  public static int getIndentWidth() throws InvalidOptionException {
    int width = getInt(PRINTER_INDENT_WIDTH);
    if (width < 0) {
      throw new InvalidOptionException("Indentation width for " +
          PRINTER_INDENT_WIDTH + " must not be negative, but was " + width);
    }
    return width;
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static int getInt(String key) throws InvalidOptionException {
    long val = getLong(key);
    if (val < Integer.MIN_VALUE || val > Integer.MAX_VALUE) {
      throw new InvalidOptionException("Value for option " + key +
          " out of range: " + val);
    }
    return (int)val;
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
