// This file is part of SPPMon.
// Copyright (C) 2021  The SPPMon Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.sppmon.configuration;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.collect.Maps;

/**
 * The configuration registry. Components register the keys they read 
 * along with a default and a description, then read typed values.
 * <p>
 * Values are resolved in this order:
 * <ol>
 * <li>Runtime overrides added via {@link #addOverride(String, Object)}</li>
 * <li>Java system properties with the same key</li>
 * <li>The JSON config file loaded via {@link #loadFile(String)}. Nested
 * objects are flattened into dotted keys, e.g. the {@code srv_address} 
 * of the {@code influxDB} section is {@code influxDB.srv_address}.</li>
 * <li>The registered default</li>
 * </ol>
 * 
 * @since 1.0
 */
public class Configuration {
  private static final Logger LOG = LoggerFactory.getLogger(
      Configuration.class);
  
  /** Shared mapper used to parse and convert values. */
  protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  
  /** Registered keys. */
  private final Map<String, Schema> schemas;
  
  /** Flattened values from the config file. */
  private final Map<String, Object> file_values;
  
  /** Runtime overrides. */
  private final Map<String, Object> overrides;
  
  /**
   * Default ctor with no file loaded.
   */
  public Configuration() {
    schemas = Maps.newLinkedHashMap();
    file_values = Maps.newHashMap();
    overrides = Maps.newHashMap();
  }
  
  /**
   * Loads the JSON config file, replacing previously loaded file values.
   * @param path A non-null and non-empty path to a JSON file.
   * @throws IllegalArgumentException if the path was null or empty.
   * @throws ConfigurationException if the file could not be read or 
   * parsed or did not contain a JSON object.
   */
  public void loadFile(final String path) {
    if (Strings.isNullOrEmpty(path)) {
      throw new IllegalArgumentException("Path cannot be null or empty.");
    }
    final JsonNode root;
    try {
      root = OBJECT_MAPPER.readTree(new File(path));
    } catch (IOException e) {
      throw new ConfigurationException("Unable to read config file: " 
          + path, e);
    }
    if (root == null || !root.isObject()) {
      throw new ConfigurationException("Config file must contain a JSON "
          + "object: " + path);
    }
    file_values.clear();
    flatten(null, root);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Loaded " + file_values.size() + " values from " + path);
    }
  }
  
  /**
   * Registers a key.
   * @param key A non-null and non-empty key.
   * @param default_value A default value, may be null.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was 
   * null or empty.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key, 
                       final Object default_value, 
                       final String description) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(description)) {
      throw new IllegalArgumentException("Description cannot be null or "
          + "empty. Help the users!");
    }
    if (schemas.containsKey(key)) {
      throw new ConfigurationException("Key is already registered: " + key);
    }
    schemas.put(key, new Schema(key, default_value, description));
  }
  
  /**
   * Sets a value that wins over every other source.
   * @param key A non-null and non-empty registered key.
   * @param value The value, may be null.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key was not registered.
   */
  public void addOverride(final String key, final Object value) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (!schemas.containsKey(key)) {
      throw new ConfigurationException("No registration found for key: " 
          + key);
    }
    overrides.put(key, value);
  }
  
  /**
   * @param key A non-null and non-empty key.
   * @return The value as a string, may be null.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key was not registered.
   */
  public String getString(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    final Object value = resolve(key);
    return value == null ? null : value.toString();
  }
  
  /**
   * @param key A non-null and non-empty key.
   * @return The value as an integer.
   * @throws IllegalArgumentException if the key was null or empty or the
   * value could not be converted.
   * @throws ConfigurationException if the key was not registered or the
   * value was null.
   */
  public int getInt(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return getTyped(key, Integer.class);
  }
  
  /**
   * @param key A non-null and non-empty key.
   * @return The value as a long.
   * @throws IllegalArgumentException if the key was null or empty or the
   * value could not be converted.
   * @throws ConfigurationException if the key was not registered or the
   * value was null.
   */
  public long getLong(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return getTyped(key, Long.class);
  }
  
  /**
   * Parses the value as a boolean where "true", "1" and "yes" are true,
   * any other value is false.
   * @param key A non-null and non-empty key.
   * @return The value as a boolean.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key was not registered.
   */
  public boolean getBoolean(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    String bool = getString(key);
    if (Strings.isNullOrEmpty(bool)) {
      return false;
    }
    bool = bool.toLowerCase().trim();
    if (bool.equals("true") ||
        bool.equals("1") ||
        bool.equals("yes")) {
      return true;
    }
    return false;
  }
  
  /**
   * Determines if the given key has been registered.
   * @param key A non-null and no-empty key.
   * @return True if the key was registered.
   * @throws IllegalArgumentException if the key was null or empty.
   */
  public boolean hasProperty(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return schemas.containsKey(key);
  }
  
  /**
   * Whether or not a value was supplied from a source other than the
   * registered default.
   * @param key A non-null and non-empty key.
   * @return True if an override, system property or file value exists.
   */
  public boolean isSet(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return overrides.containsKey(key) 
        || System.getProperty(key) != null 
        || file_values.containsKey(key);
  }
  
  /** @return A read-only view of the flattened file values. */
  public Map<String, Object> fileValues() {
    return Collections.unmodifiableMap(file_values);
  }
  
  @SuppressWarnings("unchecked")
  private <T> T getTyped(final String key, final Class<T> type) {
    final Object value = resolve(key);
    if (value == null) {
      throw new ConfigurationException("Cannot cast null to a "
          + "primitive type for key: " + key);
    }
    if (value.getClass().equals(type)) {
      return (T) value;
    }
    return OBJECT_MAPPER.convertValue(value, type);
  }
  
  private Object resolve(final String key) {
    final Schema schema = schemas.get(key);
    if (schema == null) {
      throw new ConfigurationException("No registration found for key: " 
          + key);
    }
    if (overrides.containsKey(key)) {
      return overrides.get(key);
    }
    final String property = System.getProperty(key);
    if (property != null) {
      return property;
    }
    if (file_values.containsKey(key)) {
      return file_values.get(key);
    }
    return schema.default_value;
  }
  
  private void flatten(final String prefix, final JsonNode node) {
    final Iterator<Entry<String, JsonNode>> iterator = node.fields();
    while (iterator.hasNext()) {
      final Entry<String, JsonNode> entry = iterator.next();
      final String key = prefix == null ? entry.getKey() 
          : prefix + "." + entry.getKey();
      final JsonNode value = entry.getValue();
      if (value.isObject()) {
        flatten(key, value);
      } else if (value.isNull()) {
        file_values.put(key, null);
      } else if (value.isBoolean()) {
        file_values.put(key, value.booleanValue());
      } else if (value.isNumber()) {
        file_values.put(key, value.numberValue());
      } else if (value.isTextual()) {
        file_values.put(key, value.textValue());
      } else {
        file_values.put(key, value.toString());
      }
    }
  }
  
  /** A registered key. */
  private static class Schema {
    private final String key;
    private final Object default_value;
    private final String description;
    
    Schema(final String key, 
           final Object default_value, 
           final String description) {
      this.key = key;
      this.default_value = default_value;
      this.description = description;
    }
    
    @Override
    public String toString() {
      return key + " (" + description + ")";
    }
  }
}
