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
import java.util.Set;

import com.google.common.base.Strings;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.sppmon.query.ContinuousQuery;

/**
 * The declared schema of an InfluxDB database: tables, the retention 
 * policies they reference and the continuous queries downsampling them.
 * Filled once at startup, see {@link Definitions}.
 * 
 * @since 1.0
 */
public class Database {
  private final String name;
  private final Map<String, Table> tables;
  private final Set<RetentionPolicy> retention_policies;
  private final Set<ContinuousQuery> continuous_queries;
  
  /**
   * Default ctor.
   * @param name A non-null and non-empty database name.
   * @throws IllegalArgumentException if the name was null or empty.
   */
  public Database(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Database name cannot be null "
          + "or empty.");
    }
    this.name = name;
    tables = Maps.newLinkedHashMap();
    retention_policies = Sets.newLinkedHashSet();
    continuous_queries = Sets.newLinkedHashSet();
  }
  
  /** @return The name of the database. */
  public String name() {
    return name;
  }
  
  /**
   * Returns the declared table or a new, undeclared table with the given 
   * name. Undeclared tables have no fields, no retention policy and are
   * not added to the database.
   * @param table_name A non-null and non-empty table name.
   * @return A non-null table.
   * @throws IllegalArgumentException if the name was null or empty.
   */
  public Table get(final String table_name) {
    if (Strings.isNullOrEmpty(table_name)) {
      throw new IllegalArgumentException("Table name cannot be null or "
          + "empty.");
    }
    final Table table = tables.get(table_name);
    if (table != null) {
      return table;
    }
    return Table.newBuilder()
        .setDatabase(this)
        .setName(table_name)
        .build();
  }
  
  /**
   * @param table_name The name to look for.
   * @return True if a table was declared under the name.
   */
  public boolean hasTable(final String table_name) {
    return tables.containsKey(table_name);
  }
  
  /**
   * Declares a table, replacing a former declaration with the same name.
   * @param table_name The name the table is looked up by.
   * @param table A non-null table of this database.
   * @throws IllegalArgumentException if the table was null or belongs to 
   * another database.
   */
  public void addTable(final String table_name, final Table table) {
    if (table == null) {
      throw new IllegalArgumentException("Table cannot be null.");
    }
    if (table.database() != this) {
      throw new IllegalArgumentException("Table " + table.name() 
          + " belongs to database " + table.database().name());
    }
    tables.put(table_name, table);
  }
  
  /** @param retention_policy A non-null policy to add. */
  public void addRetentionPolicy(final RetentionPolicy retention_policy) {
    if (retention_policy == null) {
      throw new IllegalArgumentException("Retention policy cannot be null.");
    }
    retention_policies.add(retention_policy);
  }
  
  /** @param continuous_query A non-null query to add. */
  public void addContinuousQuery(final ContinuousQuery continuous_query) {
    if (continuous_query == null) {
      throw new IllegalArgumentException("Continuous query cannot be null.");
    }
    continuous_queries.add(continuous_query);
  }
  
  /** @return The declared tables keyed by name, read-only. */
  public Map<String, Table> tables() {
    return Collections.unmodifiableMap(tables);
  }
  
  /** @return The declared retention policies, read-only. */
  public Set<RetentionPolicy> retentionPolicies() {
    return Collections.unmodifiableSet(retention_policies);
  }
  
  /** @return The declared continuous queries, read-only. */
  public Set<ContinuousQuery> continuousQueries() {
    return Collections.unmodifiableSet(continuous_queries);
  }
  
  @Override
  public String toString() {
    return name;
  }
}
