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

import java.util.Map;
import java.util.Map.Entry;

import com.google.common.collect.Maps;

import net.sppmon.schema.Table;
import net.sppmon.stats.ErrorCollector;

/**
 * Splits rows of tables that declare their fields and tags.
 * <p>
 * Timestamp priority: the table's time key always wins, the capture time
 * only fills a gap and any other known time key overwrites as long as the
 * time key was not seen. A column may be both the timestamp and a declared
 * field or tag.
 * <p>
 * Columns that are neither declared nor a known time key are kept as fields
 * and reported. Declared columns missing from the row are kept as null 
 * slots. The timestamp is null when no time column matched.
 * 
 * @since 1.0
 */
public class DeclaredRowSplitter implements RowSplitter {

  private final ErrorCollector errors;
  
  /**
   * Default ctor.
   * @param errors The non-null collector for undeclared columns.
   */
  public DeclaredRowSplitter(final ErrorCollector errors) {
    if (errors == null) {
      throw new IllegalArgumentException("Error collector cannot be null.");
    }
    this.errors = errors;
  }
  
  @Override
  public ClassifiedRow split(final Table table, final Map<String, ?> row) {
    final Map<String, Object> fields = Maps.newLinkedHashMap();
    for (final String field : table.fields().keySet()) {
      fields.put(field, null);
    }
    final Map<String, Object> tags = Maps.newLinkedHashMap();
    for (final String tag : table.tags()) {
      tags.put(tag, null);
    }
    
    Object time_stamp = null;
    boolean time_key_found = false;
    for (final Entry<String, ?> entry : row.entrySet()) {
      final String key = entry.getKey();
      final Object value = entry.getValue();
      if (value == null || 
          (value instanceof CharSequence && ((CharSequence) value).length() < 1)) {
        continue;
      }
      
      final boolean is_time_key = Table.TIME_KEY_NAMES.contains(key) || 
          key.equals(table.timeKey());
      if (key.equals(table.timeKey())) {
        time_stamp = value;
        time_key_found = true;
      } else if (key.equals(Table.CAPTURE_TIME_KEY)) {
        if (time_stamp == null) {
          time_stamp = value;
        }
      } else if (is_time_key && !time_key_found) {
        time_stamp = value;
      }
      
      if (fields.containsKey(key)) {
        fields.put(key, value);
      } else if (tags.containsKey(key)) {
        tags.put(key, value);
      } else if (!is_time_key) {
        errors.errorMessage("Not all columns for table " + table.name() 
            + " are declared: " + key);
        fields.put(key, value);
      }
    }
    
    return new ClassifiedRow(tags, fields, time_stamp);
  }
}
