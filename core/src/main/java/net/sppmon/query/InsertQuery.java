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
package net.sppmon.query;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.Maps;

import net.sppmon.exceptions.NoFieldsToInsertException;
import net.sppmon.schema.Datatype;
import net.sppmon.schema.Table;
import net.sppmon.utils.EpochTime;
import net.sppmon.utils.Escaping;

/**
 * A single point in line protocol:
 * {@code measurement[,tag=value...] field=value[,field=value...] timestamp}.
 * <p>
 * Fields and tags are formatted when the query is built. Null and empty
 * values are dropped. Timestamps are always written in epoch seconds.
 * 
 * @since 1.0
 */
public class InsertQuery {
  private static final Logger LOG = LoggerFactory.getLogger(InsertQuery.class);
  
  /** Value written into the first string field of a point that would
   * otherwise have no fields. */
  public static final String AUTOFILL_VALUE = "\"autofilled\"";
  
  private static final Joiner.MapJoiner PAIRS = 
      Joiner.on(',').withKeyValueSeparator('=');
  
  private final Table table;
  private final Map<String, String> fields;
  private final Map<String, String> tags;
  private final long time_stamp;
  
  /**
   * Default ctor.
   * @param table The non-null table to write into.
   * @param fields The raw fields, keyed by column name.
   * @param tags The raw tags, keyed by column name. May be null.
   * @param time_stamp The timestamp in any epoch precision. If null the
   * current time is used.
   * @throws IllegalArgumentException if the table was null or the fields
   * were null or empty or the timestamp was not numeric.
   * @throws NoFieldsToInsertException if no field remained after 
   * formatting and the table declares no string field to fill in.
   */
  public InsertQuery(final Table table, 
                     final Map<String, ?> fields, 
                     final Map<String, ?> tags, 
                     final Object time_stamp) {
    if (table == null) {
      throw new IllegalArgumentException("Table cannot be null.");
    }
    if (fields == null || fields.isEmpty()) {
      throw new IllegalArgumentException("Need at least one field for a "
          + "point in table " + table.name());
    }
    this.table = table;
    this.time_stamp = time_stamp == null ? EpochTime.nowSeconds() 
        : EpochTime.toEpochSeconds(time_stamp);
    
    final Map<String, String> formatted = formatFields(table, fields);
    if (formatted.isEmpty()) {
      for (final Entry<String, Datatype> entry : table.fields().entrySet()) {
        if (entry.getValue() == Datatype.STRING) {
          formatted.put(Escaping.escapeName(entry.getKey()), AUTOFILL_VALUE);
          break;
        }
      }
      if (formatted.isEmpty()) {
        throw new NoFieldsToInsertException("No fields left after "
            + "formatting a point for table " + table.name() 
            + ", need at least one value.");
      }
    }
    this.fields = Collections.unmodifiableMap(formatted);
    this.tags = Collections.unmodifiableMap(
        formatTags(tags == null ? Collections.<String, Object>emptyMap() : tags));
  }
  
  /** @return The table written into. */
  public Table table() {
    return table;
  }
  
  /** @return The formatted fields, escaped keys to wire values. */
  public Map<String, String> fields() {
    return fields;
  }
  
  /** @return The formatted tags, escaped keys to escaped values. */
  public Map<String, String> tags() {
    return tags;
  }
  
  /** @return The timestamp in epoch seconds. */
  public long timestamp() {
    return time_stamp;
  }
  
  /** @return The point as a line protocol line. */
  public String render() {
    final StringBuilder buf = new StringBuilder()
        .append(table.name());
    if (!tags.isEmpty()) {
      buf.append(',');
      PAIRS.appendTo(buf, tags);
    }
    buf.append(' ');
    PAIRS.appendTo(buf, fields);
    return buf.append(' ')
        .append(time_stamp)
        .toString();
  }
  
  @Override
  public String toString() {
    return render();
  }
  
  /**
   * Formats the fields by the datatypes the table declares, detecting the
   * datatype of undeclared fields from their value. Keys are escaped, 
   * null and empty string values dropped.
   * @param table The non-null table declaring the datatypes.
   * @param fields The non-null raw fields.
   * @return A mutable map of escaped keys to wire values in input order.
   * @throws IllegalArgumentException if a timestamp field was not numeric.
   */
  public static Map<String, String> formatFields(final Table table, 
                                                 final Map<String, ?> fields) {
    final Map<String, String> formatted = Maps.newLinkedHashMap();
    for (final Entry<String, ?> entry : fields.entrySet()) {
      final Object value = entry.getValue();
      if (value == null || 
          (value instanceof CharSequence && ((CharSequence) value).length() < 1)) {
        continue;
      }
      
      Datatype datatype = table.fields().get(entry.getKey());
      if (datatype == null) {
        datatype = Datatype.detect(value);
        if (datatype == Datatype.NONE && LOG.isDebugEnabled()) {
          LOG.debug("No datatype detected for field " + entry.getKey() 
              + " of table " + table.name() + " with value " + value);
        }
      }
      
      formatted.put(Escaping.escapeName(entry.getKey()), 
          formatValue(datatype, value));
    }
    return formatted;
  }
  
  /**
   * Formats the tags. Every value is stringified, keys and values are 
   * escaped and null values dropped.
   * @param tags The non-null raw tags.
   * @return A mutable map of escaped keys to escaped values in input order.
   */
  public static Map<String, String> formatTags(final Map<String, ?> tags) {
    final Map<String, String> formatted = Maps.newLinkedHashMap();
    for (final Entry<String, ?> entry : tags.entrySet()) {
      if (entry.getValue() == null) {
        continue;
      }
      formatted.put(Escaping.escapeName(entry.getKey()), 
          Escaping.escapeName(entry.getValue()));
    }
    return formatted;
  }
  
  private static String formatValue(final Datatype datatype, 
                                    final Object value) {
    switch (datatype) {
    case STRING:
      return "\"" + Escaping.escapeStringField(value) + "\"";
    case TIMESTAMP:
      return EpochTime.toEpochSeconds(value) + "i";
    case INT:
      if (value instanceof Double 
          || value instanceof Float 
          || value instanceof BigDecimal) {
        return Math.round(((Number) value).doubleValue()) + "i";
      }
      return value + "i";
    default:
      return String.valueOf(value);
    }
  }
}
