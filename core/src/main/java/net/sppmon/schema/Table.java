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
package net.sppmon.schema;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.sppmon.utils.Escaping;

/**
 * A measurement with its declared fields, tags, timestamp column and 
 * retention policy.
 * <p>
 * Tables declaring at least one field are classified with the declared
 * schema. Tables without fields, e.g. those created on a lookup miss in
 * {@link Database#get(String)}, fall back to a type based heuristic. The
 * mode is fixed at construction, see {@link #mode()}.
 * 
 * @since 1.0
 */
public class Table {
  
  /** The synthetic column holding the time a row was captured. */
  public static final String CAPTURE_TIME_KEY = "sppmonCaptureTimestampS";
  
  /** Column names recognized as timestamps in any table. */
  public static final List<String> TIME_KEY_NAMES = 
      ImmutableList.of("time", CAPTURE_TIME_KEY, "logTime");
  
  /** How rows of a table are split into tags, fields and a timestamp. */
  public enum SchemaMode {
    /** Split by the declared fields and tags. */
    DECLARED,
    /** No fields declared, split by the type of each value. */
    FALLBACK
  }
  
  private final Database database;
  private final String name;
  private final Map<String, Datatype> fields;
  private final List<String> tags;
  private final String time_key;
  private final RetentionPolicy retention_policy;
  private final SchemaMode mode;
  
  /**
   * Protected ctor.
   * @param builder The non-null builder.
   */
  protected Table(final Builder builder) {
    if (builder.database == null) {
      throw new IllegalArgumentException("Database cannot be null.");
    }
    if (Strings.isNullOrEmpty(builder.name)) {
      throw new IllegalArgumentException("Table name cannot be null or "
          + "empty.");
    }
    if (Strings.isNullOrEmpty(builder.time_key)) {
      throw new IllegalArgumentException("Time key cannot be null or empty.");
    }
    for (final String tag : builder.tags) {
      if (builder.fields.containsKey(tag)) {
        throw new IllegalArgumentException("Column " + tag + " of table " 
            + builder.name + " cannot be both a field and a tag.");
      }
    }
    database = builder.database;
    name = Escaping.escape(builder.name, ' ', ',');
    fields = ImmutableMap.copyOf(builder.fields);
    tags = ImmutableList.copyOf(builder.tags);
    time_key = builder.time_key;
    retention_policy = builder.retention_policy;
    mode = fields.isEmpty() ? SchemaMode.FALLBACK : SchemaMode.DECLARED;
  }
  
  /** @return The database the table belongs to. */
  public Database database() {
    return database;
  }
  
  /** @return The escaped measurement name. */
  public String name() {
    return name;
  }
  
  /** @return The declared fields in declaration order, may be empty. */
  public Map<String, Datatype> fields() {
    return fields;
  }
  
  /** @return The declared tags in declaration order, may be empty. */
  public List<String> tags() {
    return tags;
  }
  
  /** @return The column supplying the timestamp. */
  public String timeKey() {
    return time_key;
  }
  
  /** @return The retention policy, null for the server default. */
  public RetentionPolicy retentionPolicy() {
    return retention_policy;
  }
  
  /** @return How rows of this table are classified. */
  public SchemaMode mode() {
    return mode;
  }
  
  /** @return The "database.policy.name" reference used in queries. An 
   * unset policy leaves the middle part empty so the server picks its 
   * default. */
  public String qualifiedName() {
    return database.name() + "." 
        + (retention_policy == null ? "" : retention_policy.name()) 
        + "." + name;
  }
  
  /** @return A builder initialized with this table's values. */
  public Builder toBuilder() {
    return new Builder()
        .setDatabase(database)
        .setName(name)
        .setFields(fields)
        .setTags(tags)
        .setTimeKey(time_key)
        .setRetentionPolicy(retention_policy);
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Table other = (Table) o;
    return Objects.equals(database.name(), other.database.name())
        && Objects.equals(name, other.name)
        && Objects.equals(retention_policy, other.retention_policy);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(database.name(), name, retention_policy);
  }
  
  @Override
  public String toString() {
    return qualifiedName();
  }
  
  /** @return A new builder using the capture time as the time key. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private Database database;
    private String name;
    private final Map<String, Datatype> fields = Maps.newLinkedHashMap();
    private final List<String> tags = Lists.newArrayList();
    private String time_key = CAPTURE_TIME_KEY;
    private RetentionPolicy retention_policy;
    
    public Builder setDatabase(final Database database) {
      this.database = database;
      return this;
    }
    
    public Builder setName(final String name) {
      this.name = name;
      return this;
    }
    
    public Builder setFields(final Map<String, Datatype> fields) {
      this.fields.clear();
      if (fields != null) {
        this.fields.putAll(fields);
      }
      return this;
    }
    
    public Builder addField(final String name, final Datatype type) {
      if (Strings.isNullOrEmpty(name)) {
        throw new IllegalArgumentException("Field name cannot be null or "
            + "empty.");
      }
      if (type == null) {
        throw new IllegalArgumentException("Datatype cannot be null.");
      }
      fields.put(name, type);
      return this;
    }
    
    public Builder setTags(final List<String> tags) {
      this.tags.clear();
      if (tags != null) {
        this.tags.addAll(tags);
      }
      return this;
    }
    
    public Builder addTag(final String tag) {
      if (Strings.isNullOrEmpty(tag)) {
        throw new IllegalArgumentException("Tag cannot be null or empty.");
      }
      tags.add(tag);
      return this;
    }
    
    /**
     * @param time_key The column supplying the timestamp. Null restores
     * the capture time key.
     * @return The builder.
     */
    public Builder setTimeKey(final String time_key) {
      this.time_key = time_key == null ? CAPTURE_TIME_KEY : time_key;
      return this;
    }
    
    public Builder setRetentionPolicy(final RetentionPolicy retention_policy) {
      this.retention_policy = retention_policy;
      return this;
    }
    
    public Table build() {
      return new Table(this);
    }
  }
}
