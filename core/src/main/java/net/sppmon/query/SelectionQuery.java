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

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.sppmon.exceptions.InvalidCombinationException;
import net.sppmon.schema.Table;

/**
 * A SELECT or DELETE statement.
 * <p>
 * An empty field list selects "*", so does an empty group by list.
 * Sources are rendered fully qualified as "database.policy.table" except
 * for DELETE which only accepts the bare measurement name. ORDER BY always
 * orders by time. A LIMIT or SLIMIT of 0 omits the clause.
 * 
 * @since 1.0
 */
public class SelectionQuery {
  private static final Joiner COMMA = Joiner.on(',');
  private static final Joiner SPACE = Joiner.on(' ');
  
  private final Keyword keyword;
  private final List<Table> tables;
  private final Table into_table;
  private final List<String> fields;
  private final String where;
  private final List<String> group_by;
  private final OrderDirection order_direction;
  private final int limit;
  private final int s_limit;
  
  /**
   * Protected ctor.
   * @param builder The non-null builder.
   */
  protected SelectionQuery(final Builder builder) {
    if (builder.keyword != Keyword.SELECT && builder.keyword != Keyword.DELETE) {
      throw new IllegalArgumentException("Selection queries must be a "
          + "SELECT or DELETE, not " + builder.keyword);
    }
    if (builder.tables.isEmpty()) {
      throw new IllegalArgumentException("Need at least one table to "
          + "query.");
    }
    if (builder.limit < 0 || builder.s_limit < 0) {
      throw new IllegalArgumentException("Limits cannot be negative.");
    }
    if (builder.keyword == Keyword.DELETE 
        && (builder.into_table != null
            || (builder.fields != null && !builder.fields.isEmpty())
            || (builder.group_by != null && !builder.group_by.isEmpty())
            || builder.order_direction != null
            || builder.limit > 0
            || builder.s_limit > 0)) {
      throw new InvalidCombinationException("DELETE does not support INTO, "
          + "fields, GROUP BY, ORDER BY, LIMIT or SLIMIT.");
    }
    keyword = builder.keyword;
    tables = ImmutableList.copyOf(builder.tables);
    into_table = builder.into_table;
    if (keyword == Keyword.DELETE) {
      fields = null;
      group_by = null;
    } else {
      fields = builder.fields == null || builder.fields.isEmpty() ? 
          ImmutableList.of("*") : ImmutableList.copyOf(builder.fields);
      group_by = builder.group_by == null ? null 
          : builder.group_by.isEmpty() ? ImmutableList.of("*") 
              : ImmutableList.copyOf(builder.group_by);
    }
    where = Strings.emptyToNull(builder.where);
    order_direction = builder.order_direction;
    limit = builder.limit;
    s_limit = builder.s_limit;
  }
  
  public Keyword keyword() {
    return keyword;
  }
  
  public List<Table> tables() {
    return tables;
  }
  
  /** @return The INTO target, may be null. */
  public Table intoTable() {
    return into_table;
  }
  
  /** @return The selected fields, null for DELETE. */
  public List<String> fields() {
    return fields;
  }
  
  /** @return The WHERE condition, may be null. */
  public String where() {
    return where;
  }
  
  /** @return The GROUP BY list, may be null. */
  public List<String> groupBy() {
    return group_by;
  }
  
  /** @return The ordering, may be null. */
  public OrderDirection orderDirection() {
    return order_direction;
  }
  
  public int limit() {
    return limit;
  }
  
  public int sLimit() {
    return s_limit;
  }
  
  /** @return The statement as InfluxQL. */
  public String render() {
    final List<String> parts = Lists.newArrayList();
    parts.add(keyword.name());
    if (fields != null) {
      parts.add(COMMA.join(fields));
    }
    if (into_table != null) {
      parts.add("INTO " + into_table.qualifiedName());
    }
    final List<String> sources = Lists.newArrayListWithCapacity(tables.size());
    for (final Table table : tables) {
      sources.add(keyword == Keyword.DELETE ? table.name() 
          : table.qualifiedName());
    }
    parts.add("FROM " + COMMA.join(sources));
    if (where != null) {
      parts.add("WHERE " + where);
    }
    if (group_by != null) {
      parts.add("GROUP BY " + COMMA.join(group_by));
    }
    if (order_direction != null) {
      parts.add("ORDER BY \"time\" " + order_direction.name());
    }
    if (limit > 0) {
      parts.add("LIMIT " + limit);
    }
    if (s_limit > 0) {
      parts.add("SLIMIT " + s_limit);
    }
    return SPACE.join(parts);
  }
  
  @Override
  public String toString() {
    return render();
  }
  
  /** @return A builder initialized with this query's values. */
  public Builder toBuilder() {
    final Builder builder = new Builder(keyword)
        .setTables(tables)
        .setIntoTable(into_table)
        .setWhere(where)
        .setOrderDirection(order_direction)
        .setLimit(limit)
        .setSLimit(s_limit);
    if (keyword == Keyword.SELECT) {
      builder.setFields(fields);
      builder.setGroupBy(group_by);
    }
    return builder;
  }
  
  /**
   * @param keyword Either {@link Keyword#SELECT} or {@link Keyword#DELETE}.
   * @return A new builder.
   */
  public static Builder newBuilder(final Keyword keyword) {
    return new Builder(keyword);
  }
  
  public static class Builder {
    private final Keyword keyword;
    private final List<Table> tables = Lists.newArrayList();
    private Table into_table;
    private List<String> fields;
    private String where;
    private List<String> group_by;
    private OrderDirection order_direction;
    private int limit;
    private int s_limit;
    
    private Builder(final Keyword keyword) {
      this.keyword = keyword;
    }
    
    public Builder addTable(final Table table) {
      if (table == null) {
        throw new IllegalArgumentException("Table cannot be null.");
      }
      tables.add(table);
      return this;
    }
    
    public Builder setTables(final List<Table> tables) {
      this.tables.clear();
      if (tables != null) {
        for (final Table table : tables) {
          addTable(table);
        }
      }
      return this;
    }
    
    public Builder setIntoTable(final Table into_table) {
      this.into_table = into_table;
      return this;
    }
    
    public Builder setFields(final List<String> fields) {
      this.fields = fields;
      return this;
    }
    
    public Builder setWhere(final String where) {
      this.where = where;
      return this;
    }
    
    public Builder setGroupBy(final List<String> group_by) {
      this.group_by = group_by;
      return this;
    }
    
    public Builder setOrderDirection(final OrderDirection order_direction) {
      this.order_direction = order_direction;
      return this;
    }
    
    public Builder setLimit(final int limit) {
      this.limit = limit;
      return this;
    }
    
    public Builder setSLimit(final int s_limit) {
      this.s_limit = s_limit;
      return this;
    }
    
    public SelectionQuery build() {
      return new SelectionQuery(this);
    }
  }
}
