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
package exm.gotoc.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.gotoc.common.exceptions.InvalidOptionException;

/**
 * General settings, backed by Java properties.  Defaults are set here
 * and may be overridden by system properties of the same name.
 */
public class Settings
{
  public static final String LOG_FILE = "gotoc.log.file";
  public static final String LOG_TRACE = "gotoc.log.trace";

  /** Name of machine model preset, see MachineModel.fromName */
  public static final String MACHINE = "gotoc.machine";

  /** Output format: json or goto-binary */
  public static final String OUTPUT_FORMAT = "gotoc.output.format";
  public static final String OUTPUT_FORMAT_JSON = "json";
  public static final String OUTPUT_FORMAT_BINARY = "goto-binary";

  /** Indent JSON output */
  public static final String JSON_PRETTY = "gotoc.json.pretty";

  /** Run table consistency check before serializing */
  public static final String VALIDATE = "gotoc.validate";

  /** Table transformation passes run before serializing */
  public static final String NORMALIZE_NAMES = "gotoc.opt.normalize-names";
  public static final String NONDET_FUNCTIONS = "gotoc.opt.nondet-functions";
  /** Rewrite constructs that are not valid C, for emitting runnable C */
  public static final String GEN_C = "gotoc.opt.gen-c";

  /** What to do with negative line/column numbers: reject or clamp */
  public static final String LOCATION_POLICY = "gotoc.location.policy";
  public static final String LOCATION_POLICY_REJECT = "reject";
  public static final String LOCATION_POLICY_CLAMP = "clamp";

  // Cached for use on hot path of location construction
  private static volatile boolean CLAMP_LOCATIONS = false;

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(MACHINE, "x86_64");
    defaults.setProperty(OUTPUT_FORMAT, OUTPUT_FORMAT_JSON);
    defaults.setProperty(JSON_PRETTY, "false");
    defaults.setProperty(VALIDATE, "true");
    defaults.setProperty(NORMALIZE_NAMES, "false");
    defaults.setProperty(NONDET_FUNCTIONS, "false");
    defaults.setProperty(GEN_C, "false");
    defaults.setProperty(LOCATION_POLICY, LOCATION_POLICY_REJECT);
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initGotocProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value)
      throws InvalidOptionException {
    properties.setProperty(key, value);
    validateProperties();
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  public static boolean clampLocations() {
    return CLAMP_LOCATIONS;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(JSON_PRETTY);
    getBoolean(VALIDATE);
    getBoolean(NORMALIZE_NAMES);
    getBoolean(NONDET_FUNCTIONS);
    getBoolean(GEN_C);
    checkOneOf(MACHINE, Arrays.asList("x86_64", "aarch64"));
    checkOneOf(OUTPUT_FORMAT, Arrays.asList(OUTPUT_FORMAT_JSON,
                                            OUTPUT_FORMAT_BINARY));
    checkOneOf(LOCATION_POLICY, Arrays.asList(LOCATION_POLICY_REJECT,
                                              LOCATION_POLICY_CLAMP));
    CLAMP_LOCATIONS = get(LOCATION_POLICY).equalsIgnoreCase(
                                              LOCATION_POLICY_CLAMP);
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private static void checkOneOf(String key, List<String> validVals)
                                                  throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    for (String vv: validVals) {
      if (val.equalsIgnoreCase(vv)) {
        return;
      }
    }

    StringBuilder sb = new StringBuilder();
    for (String vv: validVals) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("'").append(vv).append("'");
    }
    throw new InvalidOptionException("Expected property " + key +
        " to be one of: " + sb.toString() + " but was '" + val + "'");
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
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
