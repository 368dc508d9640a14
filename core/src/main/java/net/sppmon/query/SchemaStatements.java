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

import com.google.common.base.Strings;

import net.sppmon.schema.RetentionPolicy;

/**
 * Renders the InfluxQL statements used to manage databases, retention 
 * policies and continuous queries. Identifiers are double quoted.
 * 
 * @since 1.0
 */
public final class SchemaStatements {
  
  /** Lists the continuous queries of all databases. */
  public static final String SHOW_CONTINUOUS_QUERIES = "SHOW CONTINUOUS QUERIES";
  
  private SchemaStatements() {
    // static helpers only
  }
  
  public static String createDatabase(final String database) {
    return "CREATE DATABASE " + quote(database);
  }
  
  public static String showRetentionPolicies(final String database) {
    return "SHOW RETENTION POLICIES ON " + quote(database);
  }
  
  public static String createRetentionPolicy(final RetentionPolicy policy, 
                                             final String database) {
    return "CREATE " + retentionPolicyClause(policy, database);
  }
  
  public static String alterRetentionPolicy(final RetentionPolicy policy, 
                                            final String database) {
    return "ALTER " + retentionPolicyClause(policy, database);
  }
  
  public static String dropContinuousQuery(final String name, 
                                           final String database) {
    return "DROP CONTINUOUS QUERY " + quote(name) + " ON " + quote(database);
  }
  
  /**
   * @param identifier A non-null and non-empty identifier.
   * @return The identifier in double quotes with embedded quotes escaped.
   */
  public static String quote(final String identifier) {
    if (Strings.isNullOrEmpty(identifier)) {
      throw new IllegalArgumentException("Identifier cannot be null or "
          + "empty.");
    }
    return "\"" + identifier.replace("\"", "\\\"") + "\"";
  }
  
  private static String retentionPolicyClause(final RetentionPolicy policy, 
                                              final String database) {
    if (policy == null) {
      throw new IllegalArgumentException("Retention policy cannot be null.");
    }
    return "RETENTION POLICY " + quote(policy.name()) 
        + " ON " + quote(database)
        + " DURATION " + policy.duration()
        + " REPLICATION " + policy.replication()
        + " SHARD DURATION " + policy.shardDuration()
        + (policy.isDefault() ? " DEFAULT" : "");
  }
}
