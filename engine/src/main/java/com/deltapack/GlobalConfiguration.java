/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.deltapack;

import com.deltapack.log.LogManager;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties first and then
 * environment variables.
 */
public enum GlobalConfiguration {
  // ENVIRONMENT
  DUMP_CONFIG_AT_STARTUP("deltapack.dumpConfigAtStartup", "Dumps the configuration at startup", Boolean.class, false, value -> {
    if (Boolean.parseBoolean(String.valueOf(value)))
      dumpConfiguration(System.out);
    return value;
  }),

  // CODEC
  CODEC_DEBUG("deltapack.codec.debug", "Logs the selected bit width and kernel of every encoded and decoded block at FINE level. Slows down the codec",
      Boolean.class, false),

  CODEC_STRICT_DECODE("deltapack.codec.strictDecode",
      "Rejects packs that the encoder of the element type can not produce, such as 32-bit blocks packed wider than 32 bits or raw words that are not "
          + "sign-extended. When false those words are truncated to the element width", Boolean.class, false),
  ;

  /**
   * Place holder for the "undefined" value of setting.
   */
  private final Object nullValue = new Object();

  private final        String                   key;
  private final        Object                   defValue;
  private final        Class<?>                 type;
  private final        Function<Object, Object> callback;
  private volatile     Object                   value  = nullValue;
  private final        String                   description;
  public static final  String                   PREFIX = "deltapack.";

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue) {
    this(key, description, type, defValue, null);
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue,
      final Function<Object, Object> callback) {
    this.key = key;
    this.description = description;
    this.defValue = defValue;
    this.type = type;
    this.callback = callback;
  }

  /**
   * Reset all the configurations to the default values.
   */
  public static void resetAll() {
    for (final GlobalConfiguration v : values())
      v.reset();
  }

  /**
   * Reset the configuration to the default value.
   */
  public void reset() {
    value = nullValue;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.println("DELTAPACK configuration:");

    String lastSection = "";
    for (final GlobalConfiguration v : values()) {
      final String name = v.key.substring(PREFIX.length());
      final int dot = name.indexOf('.');
      final String section = dot > -1 ? name.substring(0, dot) : "environment";

      if (!lastSection.equals(section)) {
        out.print("- ");
        out.println(section.toUpperCase(Locale.ENGLISH));
        lastSection = section;
      }
      out.print("  + ");
      out.print(v.key);
      out.print(" = ");
      out.println(String.valueOf((Object) v.getValue()));
    }
  }

  public static void fromJSON(final String input) {
    if (input == null)
      return;

    final JsonObject json = JsonParser.parseString(input).getAsJsonObject();
    final JsonObject cfg = json.getAsJsonObject("configuration");
    if (cfg == null)
      return;

    for (final Map.Entry<String, JsonElement> entry : cfg.entrySet()) {
      final GlobalConfiguration cfgEntry = findByKey(PREFIX + entry.getKey());
      if (cfgEntry != null)
        cfgEntry.setValue(entry.getValue().getAsString());
    }
  }

  public static String toJSON() {
    final JsonObject json = new JsonObject();

    final JsonObject cfg = new JsonObject();
    json.add("configuration", cfg);

    for (final GlobalConfiguration k : values()) {
      final Object v = k.getValue();
      final String name = k.key.substring(PREFIX.length());
      if (v instanceof Boolean)
        cfg.addProperty(name, (Boolean) v);
      else
        cfg.addProperty(name, v != null ? v.toString() : null);
    }

    return json.toString();
  }

  /**
   * Find the GlobalConfiguration instance by the key. Key is case insensitive.
   *
   * @param key Key to find. It's case insensitive.
   *
   * @return GlobalConfiguration instance if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String key) {
    for (final GlobalConfiguration v : values()) {
      if (v.getKey().equalsIgnoreCase(key))
        return v;
    }
    return null;
  }

  /**
   * Changes the configuration values in one shot by passing a Map of values. Keys can be the Java ENUM names or the string
   * representation of configuration values
   */
  public static void setConfiguration(final Map<String, Object> config) {
    for (final Map.Entry<String, Object> entry : config.entrySet()) {
      for (final GlobalConfiguration v : values()) {
        if (v.getKey().equals(entry.getKey()) || v.name().equals(entry.getKey())) {
          v.setValue(entry.getValue());
          break;
        }
      }
    }
  }

  private static void readConfiguration() {
    for (final GlobalConfiguration config : values()) {
      String prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null)
        config.setValue(prop);
    }
  }

  public <T> T getValue() {
    //noinspection unchecked
    return (T) (value != nullValue && value != null ? value : defValue);
  }

  /**
   * @return {@literal true} if configuration was changed from default value and {@literal false} otherwise.
   */
  public boolean isChanged() {
    return value != nullValue;
  }

  public void setValue(final Object newValue) {
    if (newValue != null)
      if (type == Boolean.class)
        value = Boolean.parseBoolean(newValue.toString());
      else
        value = newValue;

    if (callback != null)
      try {
        final Object callbackValue = callback.apply(value);
        if (callbackValue != value)
          // OVERWRITE IT
          value = callbackValue;
      } catch (final Exception e) {
        LogManager.instance().log(this, Level.SEVERE, "Error during setting property %s=%s", e, key, value);
      }
  }

  public boolean getValueAsBoolean() {
    final Object v = value != nullValue && value != null ? value : defValue;
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString() {
    final Object v = value != nullValue && value != null ? value : defValue;
    return v != null ? v.toString() : null;
  }

  public String getKey() {
    return key;
  }

  public Object getDefValue() {
    return defValue;
  }

  public Class<?> getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }
}
