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

import java.util.List;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.sppmon.schema.RetentionPolicy;
import net.sppmon.schema.Table;

/**
 * The aggregation part of a continuous query, declared along with a table
 * before the table exists. {@link #resolve(Table, String)} turns it into
 * a query reading from the table and writing into the same measurement 
 * under the target retention policy, grouped by time and the group 
 * arguments.
 * 
 * @since 1.0
 */
public class ContinuousQueryTemplate {
  
  /** The default RESAMPLE FOR interval. */
  public static final String DEFAULT_FOR_INTERVAL = "7d";
  
  private final List<String> fields;
  private final RetentionPolicy into_policy;
  private final String group_time;
  private final List<String> group_args;
  private final String where;
  private final String every_interval;
  private final String for_interval;
  
  /**
   * Protected ctor.
   * @param builder The non-null builder.
   */
  protected ContinuousQueryTemplate(final Builder builder) {
    if (builder.fields.isEmpty()) {
      throw new IllegalArgumentException("Need at least one aggregated "
          + "field.");
    }
    if (builder.into_policy == null) {
      throw new IllegalArgumentException("Need a retention policy to write "
          + "into.");
    }
    if (Strings.isNullOrEmpty(builder.group_time)) {
      throw new IllegalArgumentException("Need a time to group by.");
    }
    fields = ImmutableList.copyOf(builder.fields);
    into_policy = builder.into_policy;
    group_time = builder.group_time;
    group_args = builder.group_args.isEmpty() ? ImmutableList.of("*") 
        : ImmutableList.copyOf(builder.group_args);
    where = builder.where;
    every_interval = builder.every_interval;
    for_interval = builder.for_interval;
  }
  
  /** @return The retention policy the aggregates are written into. */
  public RetentionPolicy intoPolicy() {
    return into_policy;
  }
  
  /**
   * Creates the continuous query for a table.
   * @param table The non-null table to aggregate.
   * @param name The non-null and non-empty query name.
   * @return The continuous query.
   */
  public ContinuousQuery resolve(final Table table, final String name) {
    if (table == null) {
      throw new IllegalArgumentException("Table cannot be null.");
    }
    final Table into_table = Table.newBuilder()
        .setDatabase(table.database())
        .setName(table.name())
        .setRetentionPolicy(into_policy)
        .build();
    final List<String> group_by = Lists.newArrayList();
    group_by.add("time(" + group_time + ")");
    group_by.addAll(group_args);
    
    return ContinuousQuery.newBuilder()
        .setName(name)
        .setDatabase(table.database())
        .setSelectQuery(SelectionQuery.newBuilder(Keyword.SELECT)
            .addTable(table)
            .setIntoTable(into_table)
            .setFields(fields)
            .setWhere(where)
            .setGroupBy(group_by)
            .build())
        .setEveryInterval(every_interval)
        .setForInterval(for_interval)
        .build();
  }
  
  /**
   * Shortcut for a downsampling template grouped by time and all tags.
   * @param fields The aggregations to select.
   * @param into_policy The policy to write into.
   * @param group_time The time literal to group by.
   * @return The template.
   */
  public static ContinuousQueryTemplate downsample(
      final List<String> fields, 
      final RetentionPolicy into_policy, 
      final String group_time) {
    return newBuilder()
        .setFields(fields)
        .setIntoPolicy(into_policy)
        .setGroupTime(group_time)
        .build();
  }
  
  /** @return A new builder with the default FOR interval. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private final List<String> fields = Lists.newArrayList();
    private RetentionPolicy into_policy;
    private String group_time;
    private final List<String> group_args = Lists.newArrayList();
    private String where;
    private String every_interval;
    private String for_interval = DEFAULT_FOR_INTERVAL;
    
    public Builder setFields(final List<String> fields) {
      this.fields.clear();
      if (fields != null) {
        this.fields.addAll(fields);
      }
      return this;
    }
    
    public Builder setIntoPolicy(final RetentionPolicy into_policy) {
      this.into_policy = into_policy;
      return this;
    }
    
    public Builder setGroupTime(final String group_time) {
      this.group_time = group_time;
      return this;
    }
    
    /**
     * @param group_args Grouping besides time. Empty or null groups by "*".
     * @return The builder.
     */
    public Builder setGroupArgs(final List<String> group_args) {
      this.group_args.clear();
      if (group_args != null) {
        this.group_args.addAll(group_args);
      }
      return this;
    }
    
    public Builder setWhere(final String where) {
      this.where = where;
      return this;
    }
    
    public Builder setEveryInterval(final String every_interval) {
      this.every_interval = every_interval;
      return this;
    }
    
    public Builder setForInterval(final String for_interval) {
      this.for_interval = for_interval;
      return this;
    }
    
    public ContinuousQueryTemplate build() {
      return new ContinuousQueryTemplate(this);
    }
  }
}
