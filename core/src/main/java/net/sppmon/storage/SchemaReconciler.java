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
package net.sppmon.storage;

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.influxdb.InfluxDB;
import org.influxdb.InfluxDBException;
import org.influxdb.dto.Query;
import org.influxdb.dto.QueryResult;
import org.influxdb.dto.QueryResult.Result;
import org.influxdb.dto.QueryResult.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.sppmon.exceptions.MultipleDefaultPoliciesException;
import net.sppmon.query.ContinuousQuery;
import net.sppmon.query.SchemaStatements;
import net.sppmon.schema.Database;
import net.sppmon.schema.RetentionPolicy;
import net.sppmon.stats.ErrorCollector;

/**
 * Brings the retention policies and continuous queries on the server in 
 * line with the declared ones. Policies are created or altered. Continuous 
 * queries can't be altered, so changed ones are dropped and created again.
 * <p>
 * Failed statements are recorded and the remaining ones still sent.
 * 
 * @since 1.0
 */
public class SchemaReconciler {
  private static final Logger LOG = LoggerFactory.getLogger(
      SchemaReconciler.class);
  
  private final InfluxDB influx;
  private final Database database;
  private final ErrorCollector errors;
  
  /**
   * Default ctor.
   * @param influx The non-null connection.
   * @param database The non-null declared database.
   * @param errors The non-null error collector.
   */
  public SchemaReconciler(final InfluxDB influx, 
                          final Database database, 
                          final ErrorCollector errors) {
    if (influx == null) {
      throw new IllegalArgumentException("Connection cannot be null.");
    }
    if (database == null) {
      throw new IllegalArgumentException("Database cannot be null.");
    }
    if (errors == null) {
      throw new IllegalArgumentException("Error collector cannot be null.");
    }
    this.influx = influx;
    this.database = database;
    this.errors = errors;
  }
  
  /**
   * Creates missing and alters changed retention policies.
   * @param database_name The database to reconcile, usually the declared 
   * one but may be a copy target.
   * @throws MultipleDefaultPoliciesException if more than one declared 
   * policy is the default. Thrown before anything is sent.
   */
  public void reconcileRetentionPolicies(final String database_name) {
    RetentionPolicy default_policy = null;
    for (final RetentionPolicy policy : database.retentionPolicies()) {
      if (!policy.isDefault()) {
        continue;
      }
      if (default_policy != null) {
        throw new MultipleDefaultPoliciesException("Multiple default "
            + "retention policies declared for database " + database.name() 
            + ": " + default_policy.name() + " and " + policy.name());
      }
      default_policy = policy;
    }
    
    final Map<String, Map<String, Object>> existing = Maps.newHashMap();
    final QueryResult result = 
        send(SchemaStatements.showRetentionPolicies(database_name), 
            database_name);
    if (result == null) {
      return;
    }
    for (final Series series : series(result)) {
      for (final Map<String, Object> row : rows(series)) {
        existing.put(String.valueOf(row.get(RetentionPolicy.NAME_KEY)), row);
      }
    }
    
    for (final RetentionPolicy policy : database.retentionPolicies()) {
      final Map<String, Object> live = existing.get(policy.name());
      if (live == null) {
        LOG.info("Creating retention policy " + policy.name() + " on " 
            + database_name);
        send(SchemaStatements.createRetentionPolicy(policy, database_name), 
            database_name);
      } else if (!policy.toMap().equals(normalize(live, policy.toMap()))) {
        LOG.info("Altering retention policy " + policy.name() + " on " 
            + database_name);
        send(SchemaStatements.alterRetentionPolicy(policy, database_name), 
            database_name);
      }
    }
  }
  
  /**
   * Drops stale continuous queries first, then creates all missing and 
   * changed ones.
   */
  public void reconcileContinuousQueries() {
    final QueryResult result = send(SchemaStatements.SHOW_CONTINUOUS_QUERIES, 
        database.name());
    if (result == null) {
      return;
    }
    final Map<String, String> existing = Maps.newHashMap();
    for (final Series series : series(result)) {
      // one series per database
      if (!database.name().equals(series.getName())) {
        continue;
      }
      for (final Map<String, Object> row : rows(series)) {
        existing.put(String.valueOf(row.get("name")), 
            String.valueOf(row.get("query")));
      }
    }
    
    final List<ContinuousQuery> to_drop = Lists.newArrayList();
    final List<ContinuousQuery> to_create = Lists.newArrayList();
    for (final ContinuousQuery query : database.continuousQueries()) {
      final String live = existing.get(query.name());
      if (live == null) {
        to_create.add(query);
      } else if (!live.equals(query.render())) {
        to_drop.add(query);
        to_create.add(query);
      }
    }
    
    for (final ContinuousQuery query : to_drop) {
      LOG.info("Dropping outdated continuous query " + query.name());
      send(SchemaStatements.dropContinuousQuery(query.name(), 
          database.name()), database.name());
    }
    for (final ContinuousQuery query : to_create) {
      LOG.info("Creating continuous query " + query.name());
      send(query.render(), database.name());
    }
  }
  
  /**
   * Sends a statement and records any failure.
   * @return The result or null if the statement failed.
   */
  private QueryResult send(final String statement, final String db) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Sending: " + statement);
    }
    final QueryResult result;
    try {
      result = influx.query(new Query(statement, db));
    } catch (InfluxDBException e) {
      errors.exceptionInfo(e, "Failed to execute: " + statement);
      return null;
    }
    final String error = error(result);
    if (error != null) {
      errors.errorMessage("Failed to execute: " + statement + ": " + error);
      return null;
    }
    return result;
  }
  
  /**
   * @param result A result, may be null.
   * @return The first error of the result or its statements, null if none.
   */
  static String error(final QueryResult result) {
    if (result == null) {
      return "No result returned";
    }
    if (result.getError() != null) {
      return result.getError();
    }
    if (result.getResults() != null) {
      for (final Result statement : result.getResults()) {
        if (statement.getError() != null) {
          return statement.getError();
        }
      }
    }
    return null;
  }
  
  /** @return All series of all statements, never null. */
  static List<Series> series(final QueryResult result) {
    final List<Series> series = Lists.newArrayList();
    if (result == null || result.getResults() == null) {
      return series;
    }
    for (final Result statement : result.getResults()) {
      if (statement.getSeries() != null) {
        series.addAll(statement.getSeries());
      }
    }
    return series;
  }
  
  /** @return The values of the series keyed by their column names. */
  static List<Map<String, Object>> rows(final Series series) {
    final List<Map<String, Object>> rows = Lists.newArrayList();
    if (series.getColumns() == null || series.getValues() == null) {
      return rows;
    }
    for (final List<Object> values : series.getValues()) {
      final Map<String, Object> row = Maps.newLinkedHashMap();
      for (int i = 0; i < series.getColumns().size() && i < values.size(); i++) {
        row.put(series.getColumns().get(i), values.get(i));
      }
      rows.add(row);
    }
    return rows;
  }
  
  /**
   * Picks the declared keys from a server row. Numbers are converted to 
   * integers since the JSON parser hands out doubles.
   */
  private static Map<String, Object> normalize(final Map<String, Object> live, 
                                               final Map<String, Object> declared) {
    final Map<String, Object> normalized = Maps.newLinkedHashMap();
    for (final Entry<String, Object> entry : declared.entrySet()) {
      Object value = live.get(entry.getKey());
      if (value instanceof Number) {
        value = ((Number) value).intValue();
      }
      normalized.put(entry.getKey(), value);
    }
    return normalized;
  }
}
