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

package exm.sym.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.sym.common.exceptions.InvalidOptionException;
import exm.sym.common.exceptions.SymRuntimeError;

/**
 * General engine settings.  Defaults are set here and may be overridden
 * by Java system properties with the same key, or programmatically with
 * {@link #set(String, String)}.
 * */
public class Settings
{
  public static final String LOG_FILE = "sym.log.file";
  public static final String LOG_TRACE = "sym.log.trace";

  /** Maximum nesting depth of recursive expression walks */
  public static final String MAX_DEPTH = "sym.max-depth";

  /* Largest exponent magnitude that the lowering pass expands into a flat
   * product; above it powers use the backend's power operation */
  public static final String LOWER_POWER_EXPAND_LIMIT =
                                          "sym.lower.power-expand-limit";

  public static final String PRINT_FACTORIZE = "sym.print.factorize";

  public static final String CODEGEN_PROC_NAME = "sym.codegen.proc-name";

  private static final Properties defaults;
  private static final Properties properties;

  static {
    defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(MAX_DEPTH, "2000");
    defaults.setProperty(LOWER_POWER_EXPAND_LIMIT, "8");
    defaults.setProperty(PRINT_FACTORIZE, "true");
    defaults.setProperty(CODEGEN_PROC_NAME, "f");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop all overrides and go back to the built-in defaults
   */
  public static void reset() {
    properties.clear();
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(PRINT_FACTORIZE);
    if (getLong(MAX_DEPTH) <= 0) {
      throw new InvalidOptionException(MAX_DEPTH + " must be positive");
    }
    if (getLong(LOWER_POWER_EXPAND_LIMIT) < 1) {
      throw new InvalidOptionException(LOWER_POWER_EXPAND_LIMIT +
                                       " must be at least 1");
    }
    if (get(CODEGEN_PROC_NAME).trim().isEmpty()) {
      throw new InvalidOptionException(CODEGEN_PROC_NAME + " is empty");
    }
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

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    strVal = strVal.trim();
    if (strVal.equalsIgnoreCase("true")) {
      return true;
    } else if (strVal.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for option " +
          key + ": " + strVal);
    }
  }

  /**
   * For settings that were validated at startup: a bad value at this
   * point is an internal error.
   */
  public static long getLongUnchecked(String key) {
    try {
      return getLong(key);
    } catch (InvalidOptionException e) {
      throw new SymRuntimeError(e.getMessage(), e);
    }
  }

  public static boolean getBooleanUnchecked(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new SymRuntimeError(e.getMessage(), e);
    }
  }
}
