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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.sppmon.query.ContinuousQuery;
import net.sppmon.query.ContinuousQueryTemplate;

/**
 * The declared tables, retention policies and continuous queries of an
 * SPPMon database.
 * <p>
 * Data is kept by volume tier: high volume data for 14 days, downsampled
 * into 90 days (6h groups) and then forever (1w groups). Low volume data 
 * is kept for 90 days and downsampled forever. Data that can't be 
 * downsampled is kept for half a year. Grouping below 7 days doesn't work 
 * with the 1w groups.
 * <p>
 * Aggregations repeat each field by name rather than using {@code mean(*)}
 * so downsampled fields keep their names for the dashboards.
 * 
 * @since 1.0
 */
public final class Definitions {
  
  /** Where undeclared tables and tables without a policy end up. */
  public static final String AUTOGEN = "autogen";
  
  private final Database database;
  
  private Definitions(final Database database) {
    this.database = database;
  }
  
  /**
   * Declares all tables with their retention policies and continuous 
   * queries on the database.
   * @param database A non-null database.
   * @throws IllegalArgumentException if the database was null.
   */
  public static void addTableDefinitions(final Database database) {
    if (database == null) {
      throw new IllegalArgumentException("Database cannot be null.");
    }
    new Definitions(database).addAll();
  }
  
  // ------------------------------------------------------------------
  // Retention policies
  
  /** @return The server's auto generated policy, kept forever. */
  RetentionPolicy rpAutogen() {
    return policy(AUTOGEN, "INF", false);
  }
  
  /** @return Forever, for heavily downsampled data. */
  RetentionPolicy rpInf() {
    return policy("rp_inf", "INF", false);
  }
  
  /** @return A year, for data that isn't downsampled. */
  RetentionPolicy rpYear() {
    return policy("rp_year", "56w", false);
  }
  
  /** @return Half a year, for data that isn't downsampled. */
  RetentionPolicy rpHalfYear() {
    return policy("rp_half_year", "28w", false);
  }
  
  /** @return 90 days, for low volume or medium downsampled data. */
  RetentionPolicy rpDays90() {
    return policy("rp_days_90", "90d", false);
  }
  
  /** @return 14 days, the default, for high volume data. */
  RetentionPolicy rpDays14() {
    return policy("rp_days_14", "14d", true);
  }
  
  /** @return 7 days, for high volume data aggregated before downsampling. */
  RetentionPolicy rpDays7() {
    return policy("rp_days_7", "7d", false);
  }
  
  private RetentionPolicy policy(final String name, 
                                 final String duration, 
                                 final boolean is_default) {
    return RetentionPolicy.newBuilder()
        .setName(name)
        .setDatabase(database)
        .setDuration(duration)
        .setDefault(is_default)
        .build();
  }
  
  // ------------------------------------------------------------------
  // Continuous query templates
  
  private static ContinuousQueryTemplate downsample(
      final List<String> fields, 
      final RetentionPolicy into_policy, 
      final String group_time) {
    return ContinuousQueryTemplate.downsample(fields, into_policy, group_time);
  }
  
  private static ContinuousQueryTemplate downsample(
      final List<String> fields, 
      final RetentionPolicy into_policy, 
      final String group_time,
      final List<String> group_args) {
    return ContinuousQueryTemplate.newBuilder()
        .setFields(fields)
        .setIntoPolicy(into_policy)
        .setGroupTime(group_time)
        .setGroupArgs(group_args)
        .build();
  }
  
  private static ContinuousQueryTemplate filtered(
      final List<String> fields, 
      final RetentionPolicy into_policy, 
      final String group_time,
      final String where) {
    return ContinuousQueryTemplate.newBuilder()
        .setFields(fields)
        .setIntoPolicy(into_policy)
        .setGroupTime(group_time)
        .setWhere(where)
        .build();
  }
  
  /**
   * Declares a table and registers its policy, its continuous queries and
   * the policies those write into. Queries are named "cq_table_n".
   */
  void addTable(final String name, 
                final Map<String, Datatype> fields, 
                final List<String> tags, 
                final String time_key, 
                final RetentionPolicy retention_policy, 
                final List<ContinuousQueryTemplate> continuous_queries) {
    final RetentionPolicy policy = retention_policy == null ? 
        rpAutogen() : retention_policy;
    database.addRetentionPolicy(policy);
    
    final Table table = Table.newBuilder()
        .setDatabase(database)
        .setName(name)
        .setFields(fields)
        .setTags(tags)
        .setTimeKey(time_key)
        .setRetentionPolicy(policy)
        .build();
    database.addTable(name, table);
    
    int i = 0;
    for (final ContinuousQueryTemplate template : continuous_queries) {
      final ContinuousQuery query = 
          template.resolve(table, "cq_" + table.name() + "_" + i++);
      database.addContinuousQuery(query);
      database.addRetentionPolicy(template.intoPolicy());
    }
  }
  
  private static ImmutableMap.Builder<String, Datatype> fields() {
    return ImmutableMap.builder();
  }
  
  private void addAll() {
    addJobTables();
    addSppmonTables();
    addVmTables();
    addVadpAndStorageTables();
    addSystemTables();
  }
  
  // ------------------------------------------------------------------
  // Tables
  
  private void addJobTables() {
    addTable("jobs",
        fields()
          .put("duration", Datatype.INT)
          .put("start", Datatype.TIMESTAMP)
          .put("end", Datatype.TIMESTAMP)
          .put("jobLogsCount", Datatype.INT)
          .put("id", Datatype.INT)
          .put("numTasks", Datatype.INT)
          .put("percent", Datatype.FLOAT)
          .build(),
        ImmutableList.of("jobId", "status", "indexStatus", "jobName", 
            "subPolicyType", "type", "jobsLogsStored"),
        "start",
        rpDays90(),
        ImmutableList.of(
            downsample(ImmutableList.of(
                "mean(\"duration\") as \"duration\"", 
                "sum(jobLogsCount) as jobLogsCount",
                "mean(numTasks) as numTasks", 
                "mean(\"percent\") as \"percent\"",
                "count(id) as \"count\""), rpInf(), "1w")));
    
    addTable("jobs_statistics",
        fields()
          .put("total", Datatype.INT)
          .put("success", Datatype.INT)
          .put("failed", Datatype.INT)
          .put("skipped", Datatype.INT)
          .put("id", Datatype.INT)
          .build(),
        ImmutableList.of("resourceType", "jobId", "status", "indexStatus", 
            "jobName", "type", "subPolicyType"),
        "start",
        rpDays90(),
        ImmutableList.of(
            downsample(ImmutableList.of(
                "mean(\"total\") as \"total\"", 
                "mean(\"success\") as \"success\"",
                "mean(\"failed\") as \"failed\"", 
                "mean(\"skipped\") as \"skipped\"",
                "count(id) as \"count\""), rpInf(), "1w")));
    
    // ids are fields due to their cardinality
    addTable("jobLogs",
        fields()
          .put("jobLogId", Datatype.STRING)
          .put("jobsessionId", Datatype.INT)
          .put("messageParams", Datatype.STRING)
          .put("message", Datatype.STRING)
          .build(),
        ImmutableList.of("type", "messageId", "jobSessionName", "jobSessionId"),
        "logTime",
        rpHalfYear(),
        ImmutableList.of());
  }
  
  private void addSppmonTables() {
    final List<String> influx_metrics = ImmutableList.of(
        "mean(duration_ms) as duration_ms",
        "mean(item_count) as item_count",
        "STDDEV(*)");
    addTable("influx_metrics",
        fields()
          .put("duration_ms", Datatype.FLOAT)
          .put("item_count", Datatype.INT)
          .build(),
        ImmutableList.of("keyword", "tableName"),
        "time",
        rpDays14(),
        ImmutableList.of(
            downsample(influx_metrics, rpDays90(), "6h"),
            downsample(influx_metrics, rpInf(), "1w")));
    
    addTable("sshCmdResponse",
        fields()
          .put("output", Datatype.STRING)
          .build(),
        ImmutableList.of("command", "host", "ssh_type"),
        null,
        rpHalfYear(),
        ImmutableList.of());
    
    // errorMessages is a string and can't be aggregated
    final List<String> sppmon_metrics = ImmutableList.of(
        "mean(\"duration\") as \"duration\"",
        "sum(errorCount) as sum_errorCount");
    addTable("sppmon_metrics",
        fields()
          .put("duration", Datatype.INT)
          .put("errorCount", Datatype.INT)
          .put("errorMessages", Datatype.STRING)
          .build(),
        ImmutableList.of("sppmon_version", "spp_version", "vms", "spp_build", 
            "all", "confFileJSON", "jobLogs", "jobs", "siteStats", "slaStats", 
            "ssh", "verbose", "vmStats", "vsnapInfo", "constant", "daily", 
            "type", "minimumLogs", "debug", "storages", "sites", "sppcatalog", 
            "cpu", "hourly", "transfer_data", "old_database", 
            "create_dashboard", "dashboard_folder_path", "loadedSystem", 
            "processStats", "copy_database", "test"),
        null,
        rpDays14(),
        ImmutableList.of(
            downsample(sppmon_metrics, rpDays90(), "6h"),
            downsample(sppmon_metrics, rpInf(), "1w")));
  }
  
  private void addVmTables() {
    addTable("slaStats",
        fields()
          .put("vmCountBySLA", Datatype.INT)
          .build(),
        ImmutableList.of("slaId", "slaName"),
        null,
        rpDays90(),
        ImmutableList.of(
            downsample(ImmutableList.of("mean(vmCountBySLA) as vmCountBySLA"), 
                rpInf(), "1w")));
    
    // strings and the uptime timestamp are not aggregated. The id tag is 
    // left out of the grouping.
    final List<String> vms = ImmutableList.of(
        "mean(commited) as commited",
        "mean(uncommited) as uncommited",
        "mean(shared) as shared",
        "mean(cpu) as cpu",
        "mean(coresPerCpu) as coresPerCpu",
        "mean(memory) as memory");
    final List<String> vms_group = ImmutableList.of("host", "vmVersion", 
        "osName", "isProtected", "inHLO", "isEncrypted", "datacenterName", 
        "hypervisorType");
    addTable("vms",
        fields()
          .put("uptime", Datatype.TIMESTAMP)
          .put("powerState", Datatype.STRING)
          .put("commited", Datatype.INT)
          .put("uncommited", Datatype.INT)
          .put("shared", Datatype.INT)
          .put("cpu", Datatype.INT)
          .put("coresPerCpu", Datatype.INT)
          .put("memory", Datatype.INT)
          .put("name", Datatype.STRING)
          .build(),
        ImmutableList.of("host", "vmVersion", "osName", "isProtected", 
            "inHLO", "isEncrypted", "datacenterName", "id", "hypervisorType"),
        "catalogTime",
        rpDays14(),
        ImmutableList.of(
            downsample(vms, rpDays90(), "6h", vms_group),
            downsample(vms, rpInf(), "1w", vms_group)));
    
    final ImmutableMap<String, Datatype> vm_stats = fields()
        .put("vmCount", Datatype.INT)
        .put("vmMaxSize", Datatype.INT)
        .put("vmMinSize", Datatype.INT)
        .put("vmSizeTotal", Datatype.INT)
        .put("vmAvgSize", Datatype.FLOAT)
        .put("vmMaxUptime", Datatype.INT)
        .put("vmMinUptime", Datatype.INT)
        .put("vmUptimeTotal", Datatype.INT)
        .put("vmAvgUptime", Datatype.FLOAT)
        .put("vmCountProtected", Datatype.INT)
        .put("vmCountUnprotected", Datatype.INT)
        .put("vmCountEncrypted", Datatype.INT)
        .put("vmCountPlain", Datatype.INT)
        .put("vmCountHLO", Datatype.INT)
        .put("vmCountNotHLO", Datatype.INT)
        .put("vmCountHyperV", Datatype.INT)
        .put("vmCountVMware", Datatype.INT)
        .put("nrDataCenters", Datatype.INT)
        .put("nrHosts", Datatype.INT)
        .build();
    final ImmutableList.Builder<String> vm_stats_means = ImmutableList.builder();
    for (final String field : vm_stats.keySet()) {
      vm_stats_means.add("mean(" + field + ") as " + field);
    }
    addTable("vmStats",
        vm_stats,
        ImmutableList.of(),
        "time",
        rpDays90(),
        ImmutableList.of(downsample(vm_stats_means.build(), rpInf(), "1w")));
    
    final List<String> vm_backup_summary = ImmutableList.of(
        "mean(\"throughputBytes/s\") as \"throughputBytes/s\"",
        "mean(queueTimeSec) as queueTimeSec",
        "sum(transferredBytes) as sum_transferredBytes",
        "sum(protectedVMDKs) as sum_protectedVMDKs",
        "sum(TotalVMDKs) as sum_TotalVMDKs");
    addTable("vmBackupSummary",
        fields()
          .put("transferredBytes", Datatype.INT)
          .put("throughputBytes/s", Datatype.INT)
          .put("queueTimeSec", Datatype.INT)
          .put("protectedVMDKs", Datatype.INT)
          .put("TotalVMDKs", Datatype.INT)
          .put("name", Datatype.STRING)
          .build(),
        ImmutableList.of("proxy", "vsnaps", "type", "transportType", "status", 
            "messageId"),
        "time",
        rpDays14(),
        ImmutableList.of(
            downsample(vm_backup_summary, rpDays90(), "6h"),
            downsample(vm_backup_summary, rpInf(), "1w")));
    
    addTable("vmReplicateSummary",
        fields()
          .put("total", Datatype.INT)
          .put("failed", Datatype.INT)
          .put("duration", Datatype.INT)
          .build(),
        ImmutableList.of("messageId"),
        "time",
        rpDays90(),
        ImmutableList.of(
            downsample(ImmutableList.of(
                "mean(\"duration\") as \"duration\"",
                "sum(total) as sum_total",
                "sum(failed) as sum_failed"), rpInf(), "1w")));
    
    addTable("vmReplicateStats",
        fields()
          .put("replicatedBytes", Datatype.INT)
          .put("throughputBytes/sec", Datatype.INT)
          .put("duration", Datatype.INT)
          .build(),
        ImmutableList.of("messageId"),
        "time",
        rpDays90(),
        ImmutableList.of(
            downsample(ImmutableList.of(
                "mean(\"throughputBytes/sec\") as \"throughputBytes/sec\"",
                "sum(replicatedBytes) as replicatedBytes",
                "mean(\"duration\") as \"duration\""), rpInf(), "1w")));
  }
  
  private void addVadpAndStorageTables() {
    final List<String> enabled = 
        ImmutableList.of("count(distinct(vadpId)) as enabled_count");
    final List<String> disabled = 
        ImmutableList.of("count(distinct(vadpId)) as disabled_count");
    final String is_enabled = "(\"state\" =~ /ENABLED/)";
    final String is_disabled = "(\"state\" !~ /ENABLED/)";
    addTable("vadps",
        fields()
          .put("state", Datatype.STRING)
          .put("vadpName", Datatype.STRING)
          .put("vadpId", Datatype.INT)
          .put("ipAddr", Datatype.STRING)
          .build(),
        ImmutableList.of("siteId", "siteName", "version"),
        null,
        rpHalfYear(),
        ImmutableList.of(
            filtered(enabled, rpDays14(), "1h", is_enabled),
            filtered(disabled, rpDays14(), "1h", is_disabled),
            filtered(enabled, rpDays90(), "6h", is_enabled),
            filtered(disabled, rpDays90(), "6h", is_disabled),
            filtered(enabled, rpInf(), "1w", is_enabled),
            filtered(disabled, rpInf(), "1w", is_disabled)));
    
    final List<String> storages = ImmutableList.of(
        "mean(free) as free",
        "mean(pct_free) as pct_free",
        "mean(pct_used) as pct_used",
        "mean(total) as total",
        "mean(used) as used");
    addTable("storages",
        fields()
          .put("free", Datatype.INT)
          .put("pct_free", Datatype.FLOAT)
          .put("pct_used", Datatype.FLOAT)
          .put("total", Datatype.INT)
          .put("used", Datatype.INT)
          .put("name", Datatype.STRING)
          .build(),
        ImmutableList.of("isReady", "site", "siteName", "storageId", "type", 
            "version", "hostAddress"),
        "updateTime",
        rpDays14(),
        ImmutableList.of(
            downsample(storages, rpDays90(), "6h"),
            downsample(storages, rpInf(), "1w")));
    
    // updateTime is not refreshed by vsnap, so use the capture time
    final List<String> vsnap_pools = ImmutableList.of(
        "mean(compression_ratio) as compression_ratio",
        "mean(deduplication_ratio) as deduplication_ratio",
        "mean(diskgroup_size) as diskgroup_size",
        "mean(health) as health",
        "mean(size_before_compression) as size_before_compression",
        "mean(size_before_deduplication) as size_before_deduplication",
        "mean(size_free) as size_free",
        "mean(size_total) as size_total",
        "mean(size_used) as size_used");
    addTable("vsnap_pools",
        fields()
          .put("compression_ratio", Datatype.FLOAT)
          .put("deduplication_ratio", Datatype.FLOAT)
          .put("diskgroup_size", Datatype.INT)
          .put("health", Datatype.INT)
          .put("size_before_compression", Datatype.INT)
          .put("size_before_deduplication", Datatype.INT)
          .put("size_free", Datatype.INT)
          .put("size_total", Datatype.INT)
          .put("size_used", Datatype.INT)
          .build(),
        ImmutableList.of("encryption_enabled", "compression", "deduplication", 
            "id", "name", "pool_type", "status", "hostName", "ssh_type"),
        null,
        rpDays14(),
        ImmutableList.of(
            downsample(vsnap_pools, rpDays90(), "6h"),
            downsample(vsnap_pools, rpInf(), "1w")));
    
    final List<String> vsnap_system_stats = ImmutableList.of(
        "mean(size_arc_max) as size_arc_max",
        "mean(size_arc_used) as size_arc_used",
        "mean(size_ddt_core) as size_ddt_core",
        "mean(size_ddt_disk) as size_ddt_disk",
        "mean(size_zfs_arc_meta_max) as size_zfs_arc_meta_max",
        "mean(size_zfs_arc_meta_used) as size_zfs_arc_meta_used");
    addTable("vsnap_system_stats",
        fields()
          .put("size_arc_max", Datatype.INT)
          .put("size_arc_used", Datatype.INT)
          .put("size_ddt_core", Datatype.INT)
          .put("size_ddt_disk", Datatype.INT)
          .put("size_zfs_arc_meta_max", Datatype.INT)
          .put("size_zfs_arc_meta_used", Datatype.INT)
          .build(),
        ImmutableList.of("hostName", "ssh_type"),
        null,
        rpDays14(),
        ImmutableList.of(
            downsample(vsnap_system_stats, rpDays90(), "6h"),
            downsample(vsnap_system_stats, rpInf(), "1w")));
  }
  
  private void addSystemTables() {
    final List<String> cpuram = ImmutableList.of(
        "mean(cpuUtil) as cpuUtil",
        "mean(memorySize) as memorySize",
        "mean(memoryUtil) as memoryUtil",
        "mean(dataSize) as dataSize",
        "mean(dataUtil) as dataUtil",
        "mean(data2Size) as data2Size",
        "mean(data2Util) as data2Util",
        "mean(data3Size) as data3Size",
        "mean(data3Util) as data3Util",
        "STDDEV(*)");
    addTable("cpuram",
        fields()
          .put("cpuUtil", Datatype.FLOAT)
          .put("memorySize", Datatype.INT)
          .put("memoryUtil", Datatype.FLOAT)
          .put("dataSize", Datatype.INT)
          .put("dataUtil", Datatype.FLOAT)
          .put("data2Size", Datatype.INT)
          .put("data2Util", Datatype.FLOAT)
          .put("data3Size", Datatype.INT)
          .put("data3Util", Datatype.FLOAT)
          .build(),
        ImmutableList.of(),
        null,
        rpDays14(),
        ImmutableList.of(
            downsample(cpuram, rpDays90(), "6h"),
            downsample(cpuram, rpInf(), "1w")));
    
    addTable("sites",
        fields()
          .put("throttleRates", Datatype.STRING)
          .put("description", Datatype.STRING)
          .build(),
        ImmutableList.of("siteId", "siteName"),
        null,
        rpHalfYear(),
        ImmutableList.of());
    
    final List<String> sppcatalog = ImmutableList.of(
        "mean(totalSize) as totalSize",
        "mean(usedSize) as usedSize",
        "mean(availableSize) as availableSize",
        "mean(percentUsed) as percentUsed");
    addTable("sppcatalog",
        fields()
          .put("totalSize", Datatype.INT)
          .put("usedSize", Datatype.INT)
          .put("availableSize", Datatype.INT)
          .put("percentUsed", Datatype.FLOAT)
          .put("status", Datatype.STRING)
          .build(),
        ImmutableList.of("name", "type"),
        null,
        rpDays14(),
        ImmutableList.of(
            downsample(sppcatalog, rpDays90(), "6h"),
            downsample(sppcatalog, rpInf(), "1w")));
    
    // grouped by PID too, some idle processes would skew the mean otherwise
    final List<String> process_stats = ImmutableList.of(
        "mean(\"%CPU\") as \"%CPU\"",
        "mean(\"%MEM\") as \"%MEM\"",
        "mean(RES) as RES",
        "mean(SHR) as SHR",
        "mean(\"TIME+\") as \"TIME+\"",
        "mean(VIRT) as VIRT",
        "mean(MEM_ABS) as MEM_ABS",
        "STDDEV(\"%CPU\") as \"sttdev_%CPU\"",
        "STDDEV(\"%MEM\") as \"sttdev_%MEM\"");
    addTable("processStats",
        fields()
          .put("%CPU", Datatype.FLOAT)
          .put("%MEM", Datatype.FLOAT)
          .put("TIME+", Datatype.INT)
          .put("VIRT", Datatype.INT)
          .put("MEM_ABS", Datatype.INT)
          .build(),
        ImmutableList.of("COMMAND", "PID", "USER", "hostName", "ssh_type"),
        null,
        rpDays14(),
        ImmutableList.of(
            downsample(process_stats, rpDays90(), "6h"),
            downsample(process_stats, rpInf(), "1w")));
    
    final List<String> mpstat = ImmutableList.of(
        "mean(\"%usr\") as \"%usr\"",
        "mean(\"%nice\") as \"%nice\"",
        "mean(\"%sys\") as \"%sys\"",
        "mean(\"%iowait\") as \"%iowait\"",
        "mean(\"%irq\") as \"%irq\"",
        "mean(\"%soft\") as \"%soft\"",
        "mean(\"%steal\") as \"%steal\"",
        "mean(\"%guest\") as \"%guest\"",
        "mean(\"%gnice\") as \"%gnice\"",
        "mean(\"%idle\") as \"%idle\"",
        "mean(cpu_count) as cpu_count");
    addTable("ssh_mpstat_cmd",
        fields()
          .put("%usr", Datatype.FLOAT)
          .put("%nice", Datatype.FLOAT)
          .put("%sys", Datatype.FLOAT)
          .put("%iowait", Datatype.FLOAT)
          .put("%irq", Datatype.FLOAT)
          .put("%soft", Datatype.FLOAT)
          .put("%steal", Datatype.FLOAT)
          .put("%guest", Datatype.FLOAT)
          .put("%gnice", Datatype.FLOAT)
          .put("%idle", Datatype.FLOAT)
          .put("cpu_count", Datatype.INT)
          .build(),
        ImmutableList.of("CPU", "name", "host", "system_type", "hostName", 
            "ssh_type"),
        null,
        rpDays14(),
        ImmutableList.of(
            downsample(mpstat, rpDays90(), "6h"),
            downsample(mpstat, rpInf(), "1w")));
    
    final List<String> free = ImmutableList.of(
        "mean(\"buff/cache\") as \"buff/cache\"",
        "mean(free) as free",
        "mean(shared) as shared",
        "mean(total) as total",
        "mean(used) as used");
    addTable("ssh_free_cmd",
        fields()
          .put("buff/cache", Datatype.INT)
          .put("free", Datatype.INT)
          .put("shared", Datatype.INT)
          .put("total", Datatype.INT)
          .put("used", Datatype.INT)
          .build(),
        ImmutableList.of("name", "hostName", "ssh_type"),
        null,
        rpDays14(),
        ImmutableList.of(
            downsample(free, rpDays90(), "6h"),
            downsample(free, rpInf(), "1w")));
    
    final List<String> df = ImmutableList.of(
        "mean(\"Use%\") as \"Use%\"",
        "mean(Available) as Available",
        "mean(Used) as Used",
        "mean(Size) as Size");
    addTable("df_ssh",
        fields()
          .put("Size", Datatype.INT)
          .put("Used", Datatype.INT)
          .put("Available", Datatype.INT)
          .put("Use%", Datatype.INT)
          .build(),
        ImmutableList.of("Filesystem", "Mounted", "hostName", "ssh_type"),
        null,
        rpDays14(),
        ImmutableList.of(
            downsample(df, rpDays90(), "6h"),
            downsample(df, rpInf(), "1w")));
  }
}
