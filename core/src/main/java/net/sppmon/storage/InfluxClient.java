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
import java.util.concurrent.TimeUnit;

import org.influxdb.InfluxDB;
import org.influxdb.InfluxDBException;
import org.influxdb.dto.Pong;
import org.influxdb.dto.Query;
import org.influxdb.dto.QueryResult;
import org.influxdb.dto.QueryResult.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.sppmon.data.ClassifiedRow;
import net.sppmon.data.RowClassifier;
import net.sppmon.exceptions.InfluxConnectionException;
import net.sppmon.exceptions.MultipleDefaultPoliciesException;
import net.sppmon.query.ContinuousQuery;
import net.sppmon.query.InsertQuery;
import net.sppmon.query.Keyword;
import net.sppmon.query.SchemaStatements;
import net.sppmon.query.SelectionQuery;
import net.sppmon.schema.Database;
import net.sppmon.schema.Definitions;
import net.sppmon.schema.RetentionPolicy;
import net.sppmon.schema.Table;
import net.sppmon.stats.ErrorCollector;

/**
 * Entry point for writing to and reading from InfluxDB. Holds the declared
 * database, classifies and buffers rows and keeps the server schema in 
 * line with the declared one.
 * <p>
 * Call {@link #connect()} first and {@link #disconnect()} at the end, the 
 * latter flushes what is still buffered. Not thread-safe.
 * 
 * @since 1.0
 */
public class InfluxClient {
  private static final Logger LOG = LoggerFactory.getLogger(InfluxClient.class);
  
  /** A copy query dropping this many points lost data and has to be 
   * repeated with a shorter time range. */
  static final String CRITICAL_DROP = 
      "partial write: points beyond retention policy dropped=10000";
  static final String PARTIAL_DROP = 
      "partial write: points beyond retention policy dropped=";
  
  private final InfluxClientConfig config;
  private final ErrorCollector errors;
  private final InfluxConnector connector;
  private final Database database;
  private final RowClassifier classifier;
  
  private InfluxDB influx;
  private WriteBuffer buffer;
  
  /**
   * Ctor using the default connector.
   * @param config The non-null settings.
   * @param errors The non-null error collector.
   */
  public InfluxClient(final InfluxClientConfig config, 
                      final ErrorCollector errors) {
    this(config, errors, new InfluxConnector());
  }
  
  /**
   * Default ctor. Declares all tables on the database.
   * @param config The non-null settings.
   * @param errors The non-null error collector.
   * @param connector The non-null connector.
   */
  public InfluxClient(final InfluxClientConfig config, 
                      final ErrorCollector errors, 
                      final InfluxConnector connector) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (errors == null) {
      throw new IllegalArgumentException("Error collector cannot be null.");
    }
    if (connector == null) {
      throw new IllegalArgumentException("Connector cannot be null.");
    }
    this.config = config;
    this.errors = errors;
    this.connector = connector;
    database = new Database(config.database());
    Definitions.addTableDefinitions(database);
    classifier = new RowClassifier(errors);
  }
  
  /** @return The declared database. */
  public Database database() {
    return database;
  }
  
  /**
   * Connects, creates the database if missing and reconciles the retention
   * policies and continuous queries.
   * @throws InfluxConnectionException if the server could not be reached.
   * @throws MultipleDefaultPoliciesException if more than one declared 
   * policy is the default.
   */
  public void connect() {
    influx = connector.connect(config, config.timeout());
    try {
      final Pong pong = influx.ping();
      LOG.info("Connected to InfluxDB " + config.url() + ", version: " 
          + pong.getVersion());
      influx.query(new Query(SchemaStatements.createDatabase(database.name())));
    } catch (InfluxDBException e) {
      throw new InfluxConnectionException("Login into InfluxDB failed", e);
    }
    buffer = new WriteBuffer(influx, database, errors, config.maxBatchSize(), 
        config.flushMultiplier());
    
    final SchemaReconciler reconciler = 
        new SchemaReconciler(influx, database, errors);
    reconciler.reconcileRetentionPolicies(database.name());
    reconciler.reconcileContinuousQueries();
  }
  
  /**
   * Flushes twice so the metrics of the first flush are written too, then 
   * closes the connection and logs the error summary.
   */
  public void disconnect() {
    if (influx == null) {
      return;
    }
    LOG.debug("Flushing buffers before disconnecting.");
    buffer.flush();
    buffer.flush();
    influx.close();
    influx = null;
    errors.logSummary();
  }
  
  /**
   * Classifies the rows and buffers them as points of the table. Rows that
   * fail are recorded and skipped.
   * @param table_name The non-null and non-empty table name. Undeclared 
   * names are split by the fallback heuristic.
   * @param rows The non-null rows.
   * @throws IllegalArgumentException if the name was null or empty or the
   * rows were null.
   */
  public void insertRows(final String table_name, 
                         final List<? extends Map<String, ?>> rows) {
    if (Strings.isNullOrEmpty(table_name)) {
      throw new IllegalArgumentException("Table name cannot be null or "
          + "empty.");
    }
    if (rows == null) {
      throw new IllegalArgumentException("Rows cannot be null.");
    }
    if (rows.isEmpty()) {
      return;
    }
    checkConnected();
    
    final Table table = database.get(table_name);
    final List<InsertQuery> queries = Lists.newArrayListWithCapacity(rows.size());
    for (final Map<String, ?> row : rows) {
      try {
        final ClassifiedRow classified = classifier.classify(table, row);
        queries.add(new InsertQuery(table, classified.fields(), 
            classified.tags(), classified.timestamp()));
      } catch (IllegalArgumentException | IllegalStateException e) {
        errors.exceptionInfo(e, "Skipping row of table " + table_name 
            + ": " + row);
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Buffering " + queries.size() + " of " + rows.size() 
          + " rows for table " + table_name);
    }
    buffer.add(table, queries);
  }
  
  /** Writes all buffered points. */
  public void flush() {
    checkConnected();
    buffer.flush();
  }
  
  /**
   * Sends a SELECT, flushing first if a queried table has buffered points.
   * @param query A non-null SELECT.
   * @return The result, empty if the query failed.
   */
  public QueryResult select(final SelectionQuery query) {
    if (query == null) {
      throw new IllegalArgumentException("Query cannot be null.");
    }
    if (query.keyword() != Keyword.SELECT) {
      throw new IllegalArgumentException("Expected a SELECT query: " + query);
    }
    return send(query);
  }
  
  /**
   * Sends a DELETE, flushing first if a queried table has buffered points.
   * @param query A non-null DELETE.
   */
  public void delete(final SelectionQuery query) {
    if (query == null) {
      throw new IllegalArgumentException("Query cannot be null.");
    }
    if (query.keyword() != Keyword.DELETE) {
      throw new IllegalArgumentException("Expected a DELETE query: " + query);
    }
    send(query);
  }
  
  private QueryResult send(final SelectionQuery query) {
    checkConnected();
    for (final Table table : query.tables()) {
      if (buffer.contains(table)) {
        buffer.flush();
        break;
      }
    }
    
    final String statement = query.render();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Sending: " + statement);
    }
    final Stopwatch stopwatch = Stopwatch.createStarted();
    final QueryResult result;
    try {
      result = influx.query(new Query(statement, database.name()), 
          TimeUnit.SECONDS);
    } catch (InfluxDBException e) {
      errors.exceptionInfo(e, "Error when sending query: " + statement);
      return new QueryResult();
    }
    final double duration = stopwatch.elapsed(TimeUnit.MICROSECONDS) / 1e6;
    final String error = SchemaReconciler.error(result);
    if (error != null) {
      errors.errorMessage("Error when sending query: " + statement + ": " 
          + error);
      return new QueryResult();
    }
    
    final List<Series> series = SchemaReconciler.series(result);
    final int count = series.isEmpty() || series.get(0).getValues() == null ? 
        0 : series.get(0).getValues().size();
    final Map<Table, Integer> counts = Maps.newLinkedHashMap();
    for (final Table table : query.tables()) {
      counts.put(table, count / query.tables().size());
    }
    buffer.recordMetrics(query.keyword(), counts, duration, Math.max(count, 1));
    return result;
  }
  
  /**
   * Copies all data into another database. Each table is copied from 
   * {@code autogen} and from its own policy, bounded by the duration of 
   * that policy. The SELECT of every continuous query is run against the 
   * new database so downsampled data is kept as well. Uses its own 
   * connection with the copy timeout.
   * @param new_name The non-null and non-empty target database.
   * @throws IllegalArgumentException if the name was null or empty.
   * @throws IllegalStateException if a query dropped so many points that
   * data was lost.
   */
  public void copyDatabase(final String new_name) {
    if (Strings.isNullOrEmpty(new_name)) {
      throw new IllegalArgumentException("Copying a database requires a "
          + "new database name.");
    }
    checkConnected();
    LOG.info("Copying database " + database.name() + " into " + new_name 
        + ", including autogen data sorted into the retention policies.");
    
    try {
      influx.query(new Query(SchemaStatements.createDatabase(new_name)));
    } catch (InfluxDBException e) {
      throw new InfluxConnectionException("Failed to create database " 
          + new_name, e);
    }
    // continuous queries are not created, they would refer to the old one
    new SchemaReconciler(influx, database, errors)
        .reconcileRetentionPolicies(new_name);
    
    final List<String> queries = buildCopyQueries(new_name);
    LOG.info("Sending " + queries.size() + " copy queries.");
    
    long lines = 0;
    int dropped = 0;
    int critical = 0;
    final InfluxDB copy = connector.connect(config, config.copyTimeout());
    try {
      int i = 0;
      for (final String statement : queries) {
        i++;
        final QueryResult result;
        try {
          result = copy.query(new Query(statement, database.name()), 
              TimeUnit.SECONDS);
        } catch (InfluxDBException e) {
          if (isDrop(e.getMessage(), statement)) {
            dropped++;
          } else {
            errors.exceptionInfo(e, "Transfer of data failed for query " 
                + statement);
            critical++;
          }
          continue;
        }
        final String error = SchemaReconciler.error(result);
        if (error != null) {
          if (isDrop(error, statement)) {
            dropped++;
          } else {
            errors.errorMessage("Transfer of data failed for query " 
                + statement + ": " + error);
            critical++;
          }
          continue;
        }
        final long written = written(result);
        lines += written;
        if (LOG.isDebugEnabled()) {
          LOG.debug("Query " + i + "/" + queries.size() + ": " + written 
              + " new lines.");
        }
      }
    } finally {
      copy.close();
    }
    
    LOG.info("Copied " + lines + " lines into " + new_name + ". " + dropped 
        + " queries dropped data beyond their retention policy, " + critical 
        + " queries failed.");
  }
  
  /**
   * @return The SELECT INTO statements copying all tables and downsampled 
   * data into the new database.
   */
  @VisibleForTesting
  List<String> buildCopyQueries(final String new_name) {
    final Database target = new Database(new_name);
    final List<String> queries = Lists.newArrayList();
    for (final Table table : database.tables().values()) {
      final RetentionPolicy policy = table.retentionPolicy();
      final Table into = table.toBuilder()
          .setDatabase(target)
          .build();
      final String where = policy == null || policy.isInfinite() ? null : 
        "time > now() - " + policy.duration();
      for (final Table source : ImmutableList.of(autogen(table), table)) {
        queries.add(SelectionQuery.newBuilder(Keyword.SELECT)
            .addTable(source)
            .setIntoTable(into)
            .setWhere(where)
            .setGroupBy(ImmutableList.<String>of())
            .build()
            .render());
      }
    }
    
    for (final ContinuousQuery cq : database.continuousQueries()) {
      final SelectionQuery select = cq.selectQuery();
      if (select == null || select.intoTable() == null) {
        errors.errorMessage("Into table of continuous query " + cq.name() 
            + " is not set, copy it manually: " + cq.select());
        continue;
      }
      final Table into = select.intoTable().toBuilder()
          .setDatabase(target)
          .build();
      String where = select.where();
      final RetentionPolicy into_policy = select.intoTable().retentionPolicy();
      if (into_policy != null && !into_policy.isInfinite()) {
        final String bound = "time > now() - " + into_policy.duration();
        where = Strings.isNullOrEmpty(where) ? bound : where + " AND " + bound;
      }
      final SelectionQuery copy = select.toBuilder()
          .setIntoTable(into)
          .setWhere(where)
          .build();
      queries.add(copy.render());
      
      final List<Table> autogen_sources = Lists.newArrayList();
      for (final Table source : select.tables()) {
        autogen_sources.add(autogen(source));
      }
      queries.add(copy.toBuilder()
          .setTables(autogen_sources)
          .build()
          .render());
    }
    return queries;
  }
  
  private Table autogen(final Table table) {
    return table.toBuilder()
        .setRetentionPolicy(RetentionPolicy.newBuilder()
            .setName(Definitions.AUTOGEN)
            .setDatabase(table.database())
            .setDuration("INF")
            .build())
        .build();
  }
  
  private static boolean isDrop(final String message, final String statement) {
    if (message == null) {
      return false;
    }
    if (message.contains(CRITICAL_DROP)) {
      throw new IllegalStateException("Transfer of data failed, retry "
          + "manually with a shorter WHERE clause: " + statement);
    }
    return message.contains(PARTIAL_DROP);
  }
  
  private static long written(final QueryResult result) {
    long written = 0;
    for (final Series series : SchemaReconciler.series(result)) {
      final int index = series.getColumns() == null ? -1 : 
        series.getColumns().indexOf("written");
      if (index < 0 || series.getValues() == null) {
        continue;
      }
      for (final List<Object> values : series.getValues()) {
        final Object value = values.get(index);
        if (value instanceof Number) {
          written += ((Number) value).longValue();
        }
      }
    }
    return written;
  }
  
  private void checkConnected() {
    if (influx == null) {
      throw new IllegalStateException("Not connected, call connect() first.");
    }
  }
}
