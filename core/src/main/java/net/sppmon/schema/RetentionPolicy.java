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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.Strings;
import com.google.common.collect.Maps;

import net.sppmon.exceptions.InvalidDurationException;
import net.sppmon.utils.TimeLiterals;

/**
 * An InfluxDB retention policy. Durations are kept in the canonical form
 * the server reports, e.g. "2160h0m0s", so the policy can be compared with
 * the server's listing. Equality and hash code are computed over 
 * {@link #toMap()}, policies declared by different tables collapse in a 
 * set.
 * 
 * @since 1.0
 */
public class RetentionPolicy {
  
  /** Keys of {@link #toMap()}, named as Influx lists them. */
  public static final String NAME_KEY = "name";
  public static final String DURATION_KEY = "duration";
  public static final String SHARD_DURATION_KEY = "shardGroupDuration";
  public static final String REPLICATION_KEY = "replicaN";
  public static final String DEFAULT_KEY = "default";
  
  private final String name;
  private final Database database;
  private final String duration;
  private final int replication;
  private final String shard_duration;
  private final boolean is_default;
  
  /**
   * Protected ctor.
   * @param builder The non-null builder.
   */
  protected RetentionPolicy(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.name)) {
      throw new IllegalArgumentException("Retention policy name cannot be "
          + "null or empty.");
    }
    if (builder.database == null) {
      throw new IllegalArgumentException("Retention policy " + builder.name 
          + " needs a database.");
    }
    if (Strings.isNullOrEmpty(builder.duration)) {
      throw new IllegalArgumentException("Retention policy " + builder.name 
          + " needs a duration.");
    }
    if (builder.replication < 1) {
      throw new IllegalArgumentException("Retention policy " + builder.name 
          + " needs a replication factor of at least 1.");
    }
    if (Strings.isNullOrEmpty(builder.shard_duration)) {
      throw new IllegalArgumentException("Retention policy " + builder.name 
          + " needs a shard duration.");
    }
    name = builder.name;
    database = builder.database;
    replication = builder.replication;
    is_default = builder.is_default;
    try {
      duration = TimeLiterals.canonicalize(builder.duration);
    } catch (InvalidDurationException e) {
      throw new InvalidDurationException("Duration of retention policy " 
          + name + " is not a valid time literal: " + builder.duration, e);
    }
    try {
      shard_duration = TimeLiterals.canonicalize(builder.shard_duration);
    } catch (InvalidDurationException e) {
      throw new InvalidDurationException("Shard duration of retention policy " 
          + name + " is not a valid time literal: " + builder.shard_duration, e);
    }
  }
  
  /** @return The name of the policy. */
  public String name() {
    return name;
  }
  
  /** @return The database the policy belongs to. */
  public Database database() {
    return database;
  }
  
  /** @return The canonical duration, "0s" for infinite. */
  public String duration() {
    return duration;
  }
  
  /** @return The replication factor. */
  public int replication() {
    return replication;
  }
  
  /** @return The canonical shard group duration, "0s" lets the server 
   * decide. */
  public String shardDuration() {
    return shard_duration;
  }
  
  /** @return Whether or not this is the default policy of the database. */
  public boolean isDefault() {
    return is_default;
  }
  
  /** @return Whether or not data is kept forever. */
  public boolean isInfinite() {
    return TimeLiterals.toSeconds(duration) == 0;
  }
  
  /** @return The policy as Influx lists it, used for comparisons. */
  public Map<String, Object> toMap() {
    final Map<String, Object> map = Maps.newLinkedHashMap();
    map.put(NAME_KEY, name);
    map.put(DURATION_KEY, duration);
    map.put(SHARD_DURATION_KEY, shard_duration);
    map.put(REPLICATION_KEY, replication);
    map.put(DEFAULT_KEY, is_default);
    return Collections.unmodifiableMap(map);
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final RetentionPolicy other = (RetentionPolicy) o;
    return Objects.equals(name, other.name)
        && Objects.equals(duration, other.duration)
        && Objects.equals(shard_duration, other.shard_duration)
        && replication == other.replication
        && is_default == other.is_default;
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(name, duration, shard_duration, replication, 
        is_default);
  }
  
  @Override
  public String toString() {
    return database.name() + "." + name;
  }
  
  /** @return A new builder with the default replication of 1, a shard 
   * duration of "0s" and the default flag unset. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private String name;
    private Database database;
    private String duration;
    private int replication = 1;
    private String shard_duration = TimeLiterals.INFINITE;
    private boolean is_default;
    
    public Builder setName(final String name) {
      this.name = name;
      return this;
    }
    
    public Builder setDatabase(final Database database) {
      this.database = database;
      return this;
    }
    
    public Builder setDuration(final String duration) {
      this.duration = duration;
      return this;
    }
    
    public Builder setReplication(final int replication) {
      this.replication = replication;
      return this;
    }
    
    public Builder setShardDuration(final String shard_duration) {
      this.shard_duration = shard_duration;
      return this;
    }
    
    public Builder setDefault(final boolean is_default) {
      this.is_default = is_default;
      return this;
    }
    
    public RetentionPolicy build() {
      return new RetentionPolicy(this);
    }
  }
}
