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
import java.util.concurrent.TimeUnit;

import org.influxdb.InfluxDB;
import org.influxdb.InfluxDBException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.sppmon.query.InsertQuery;
import net.sppmon.query.Keyword;
import net.sppmon.schema.Database;
import net.sppmon.schema.Table;
import net.sppmon.stats.ErrorCollector;

/**
 * Buffers points per table and writes them in batches with second 
 * precision into the retention policy of the table.
 * <p>
 * Each successful batch queues a row into {@link #METRICS_TABLE}. Those
 * rows are written on the next flush, so the buffer is cleared before
 * sending. A table holding more than {@code flush_multiplier} batches is
 * flushed right away. Write failures are recorded and never thrown.
 * <p>
 * Not thread-safe.
 * 
 * @since 1.0
 */
public class WriteBuffer {
  private static final Logger LOG = LoggerFactory.getLogger(WriteBuffer.class);
  
  /** The table receiving the request metrics. */
  public static final String METRICS_TABLE = "influx_metrics";
  
  private final InfluxDB influx;
  private final Database database;
  private final ErrorCollector errors;
  private final int max_batch_size;
  private final int flush_multiplier;
  
  private final Map<Table, List<InsertQuery>> buffer = Maps.newLinkedHashMap();
  
  /**
   * Default ctor.
   * @param influx The non-null connection.
   * @param database The non-null database to write into.
   * @param errors The non-null error collector.
   * @param max_batch_size The maximum number of lines per request, at 
   * least 1.
   * @param flush_multiplier The number of batches a table may hold before 
   * flushing, at least 1.
   */
  public WriteBuffer(final InfluxDB influx, 
                     final Database database, 
                     final ErrorCollector errors, 
                     final int max_batch_size, 
                     final int flush_multiplier) {
    if (influx == null) {
      throw new IllegalArgumentException("Connection cannot be null.");
    }
    if (database == null) {
      throw new IllegalArgumentException("Database cannot be null.");
    }
    if (errors == null) {
      throw new IllegalArgumentException("Error collector cannot be null.");
    }
    if (max_batch_size < 1 || flush_multiplier < 1) {
      throw new IllegalArgumentException("Batch size and flush multiplier "
          + "must be at least 1.");
    }
    this.influx = influx;
    this.database = database;
    this.errors = errors;
    this.max_batch_size = max_batch_size;
    this.flush_multiplier = flush_multiplier;
  }
  
  /**
   * Appends points of a table, flushing if the table holds too many.
   * @param table The non-null table.
   * @param queries The non-null points.
   */
  public void add(final Table table, final List<InsertQuery> queries) {
    if (table == null) {
      throw new IllegalArgumentException("Table cannot be null.");
    }
    if (queries == null) {
      throw new IllegalArgumentException("Queries cannot be null.");
    }
    final List<InsertQuery> queued = buffer(table);
    queued.addAll(queries);
    if (queued.size() > (long) flush_multiplier * max_batch_size) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Table " + table.name() + " holds " + queued.size() 
            + " points, flushing.");
      }
      flush();
    }
  }
  
  /**
   * Writes all buffered points. The metrics queued while doing so stay in
   * the buffer for the next call.
   */
  public void flush() {
    if (buffer.isEmpty()) {
      return;
    }
    final Map<Table, List<String>> lines = Maps.newLinkedHashMap();
    for (final Entry<Table, List<InsertQuery>> entry : buffer.entrySet()) {
      final List<String> rendered = 
          Lists.newArrayListWithCapacity(entry.getValue().size());
      for (final InsertQuery query : entry.getValue()) {
        rendered.add(query.render());
      }
      lines.put(entry.getKey(), rendered);
    }
    buffer.clear();
    
    for (final Entry<Table, List<String>> entry : lines.entrySet()) {
      final Table table = entry.getKey();
      final String policy = table.retentionPolicy() == null ? null : 
        table.retentionPolicy().name();
      for (final List<String> batch : 
          Lists.partition(entry.getValue(), max_batch_size)) {
        final Stopwatch stopwatch = Stopwatch.createStarted();
        try {
          influx.write(database.name(), policy, InfluxDB.ConsistencyLevel.ONE, 
              TimeUnit.SECONDS, batch);
        } catch (InfluxDBException e) {
          errors.exceptionInfo(e, "Error when sending insert buffer of table " 
              + table.name());
          continue;
        }
        final double duration = stopwatch.elapsed(TimeUnit.MICROSECONDS) / 1e6;
        if (LOG.isDebugEnabled()) {
          LOG.debug("Wrote " + batch.size() + " points into " + table 
              + " in " + duration + "s");
        }
        recordMetrics(Keyword.INSERT, 
            ImmutableMap.of(table, batch.size()), duration, batch.size());
      }
    }
  }
  
  /**
   * Queues one metric row per table. The duration is split between the 
   * tables by their share of the batch.
   * @param keyword The non-null request type.
   * @param counts The non-null item count per table.
   * @param duration_s The duration of the request in seconds, not negative.
   * @param batch_size The number of items of the request, at least 1.
   */
  public void recordMetrics(final Keyword keyword, 
                            final Map<Table, Integer> counts, 
                            final double duration_s, 
                            final int batch_size) {
    if (keyword == null) {
      throw new IllegalArgumentException("Keyword cannot be null.");
    }
    if (counts == null) {
      throw new IllegalArgumentException("Counts cannot be null.");
    }
    if (duration_s < 0) {
      throw new IllegalArgumentException("Duration cannot be negative: " 
          + duration_s);
    }
    if (batch_size < 1) {
      throw new IllegalArgumentException("Batch size must be at least 1: " 
          + batch_size);
    }
    
    final Table metrics = database.get(METRICS_TABLE);
    final List<InsertQuery> queued = buffer(metrics);
    for (final Entry<Table, Integer> entry : counts.entrySet()) {
      final int count = entry.getValue() == null ? 0 : entry.getValue();
      final Map<String, Object> fields = Maps.newLinkedHashMap();
      fields.put("duration_ms", 
          duration_s * 1000 * ((double) Math.max(count, 1) / batch_size));
      fields.put("item_count", count);
      final Map<String, Object> tags = Maps.newLinkedHashMap();
      tags.put("keyword", keyword.name());
      tags.put("tableName", entry.getKey().name());
      queued.add(new InsertQuery(metrics, fields, tags, null));
    }
  }
  
  /**
   * @param table A table.
   * @return True if points of the table are buffered.
   */
  public boolean contains(final Table table) {
    final List<InsertQuery> queued = buffer.get(table);
    return queued != null && !queued.isEmpty();
  }
  
  /** @return The number of buffered points over all tables. */
  public int size() {
    int size = 0;
    for (final List<InsertQuery> queued : buffer.values()) {
      size += queued.size();
    }
    return size;
  }
  
  private List<InsertQuery> buffer(final Table table) {
    List<InsertQuery> queued = buffer.get(table);
    if (queued == null) {
      queued = Lists.newArrayList();
      buffer.put(table, queued);
    }
    return queued;
  }
}
