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
package net.sppmon.data;

import java.util.Collection;
import java.util.Map;
import java.util.Map.Entry;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.Maps;

import net.sppmon.schema.Table;
import net.sppmon.stats.ErrorCollector;
import net.sppmon.utils.EpochTime;

/**
 * Splits rows of tables without declared fields by looking at the values.
 * Numbers and booleans are fields, strings with whitespace, brackets or 
 * quotes are fields and all other strings are tags. Maps and lists are 
 * serialized to JSON first.
 * <p>
 * Every use is reported since tables should be declared. A row without 
 * fields gets a {@link #MISSING_FIELD} and a row without a timestamp gets
 * the current time.
 * 
 * @since 1.0
 */
public class FallbackRowSplitter implements RowSplitter {
  private static final Logger LOG = LoggerFactory.getLogger(
      FallbackRowSplitter.class);
  
  /** Field name inserted when a row has no fields. */
  public static final String MISSING_FIELD = "MISSING_FIELD";
  
  /** Value of the inserted field. */
  public static final int MISSING_FIELD_VALUE = 42;
  
  private static final String LOG_TIME_KEY = "logTime";
  private static final Pattern FIELD_PATTERN = Pattern.compile("[\\s\\[\\]{}\"]");
  private static final ObjectMapper JSON = new ObjectMapper();
  
  private final ErrorCollector errors;
  
  /**
   * Default ctor.
   * @param errors The non-null collector for warnings.
   */
  public FallbackRowSplitter(final ErrorCollector errors) {
    if (errors == null) {
      throw new IllegalArgumentException("Error collector cannot be null.");
    }
    this.errors = errors;
  }
  
  @Override
  public ClassifiedRow split(final Table table, final Map<String, ?> row) {
    errors.errorMessage("WARNING: Using default split method, table " 
        + table.name() + " is set up only temporary");
    if (LOG.isDebugEnabled()) {
      LOG.debug("Default split of row: " + row);
    }
    
    final Map<String, Object> fields = Maps.newLinkedHashMap();
    final Map<String, Object> tags = Maps.newLinkedHashMap();
    Object time_stamp = null;
    for (final Entry<String, ?> entry : row.entrySet()) {
      final String key = entry.getKey();
      final Object value = entry.getValue();
      if (value == null || 
          (value instanceof CharSequence && ((CharSequence) value).length() < 1)) {
        continue;
      }
      
      if (Table.TIME_KEY_NAMES.contains(key)) {
        // logTime is set by the source and may replace the others
        if (time_stamp == null || key.equals(LOG_TIME_KEY)) {
          time_stamp = value;
        }
        continue;
      }
      
      if (value instanceof Number || value instanceof Boolean) {
        fields.put(key, value);
        continue;
      }
      
      final String string = stringify(value);
      if (FIELD_PATTERN.matcher(string).find()) {
        fields.put(key, string);
      } else {
        tags.put(key, string);
      }
    }
    
    if (fields.isEmpty()) {
      errors.errorMessage("Missing field in row of table " + table.name() 
          + ": " + row);
      fields.put(MISSING_FIELD, MISSING_FIELD_VALUE);
    }
    if (time_stamp == null) {
      errors.errorMessage("No timestamp value gathered when using default " 
          + "split for table " + table.name() + ", using current time: " + row);
      time_stamp = EpochTime.nowSeconds();
    }
    return new ClassifiedRow(tags, fields, time_stamp);
  }
  
  /**
   * Stringifies a value, serializing maps and collections to JSON.
   * @param value A non-null value.
   * @return The string.
   * @throws IllegalArgumentException if the value could not be serialized.
   */
  static String stringify(final Object value) {
    if (value instanceof Map || value instanceof Collection || 
        value.getClass().isArray()) {
      try {
        return JSON.writeValueAsString(value);
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Unable to serialize value: " 
            + value, e);
      }
    }
    return value.toString();
  }
}
