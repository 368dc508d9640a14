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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

import net.sppmon.schema.Database;
import net.sppmon.schema.RetentionPolicy;

public final class TestSchemaStatements {
  private RetentionPolicy policy;
  
  @Before
  public void before() throws Exception {
    policy = RetentionPolicy.newBuilder()
        .setName("rp_days_14")
        .setDatabase(new Database("spp"))
        .setDuration("14d")
        .setDefault(true)
        .build();
  }
  
  @Test
  public void databases() throws Exception {
    assertEquals("CREATE DATABASE \"spp\"", 
        SchemaStatements.createDatabase("spp"));
    assertEquals("SHOW RETENTION POLICIES ON \"spp\"", 
        SchemaStatements.showRetentionPolicies("spp"));
  }
  
  @Test
  public void retentionPolicies() throws Exception {
    assertEquals("CREATE RETENTION POLICY \"rp_days_14\" ON \"copy\" "
        + "DURATION 336h0m0s REPLICATION 1 SHARD DURATION 0h0m0s DEFAULT", 
        SchemaStatements.createRetentionPolicy(policy, "copy"));
    assertEquals("ALTER RETENTION POLICY \"rp_days_14\" ON \"spp\" "
        + "DURATION 336h0m0s REPLICATION 1 SHARD DURATION 0h0m0s DEFAULT", 
        SchemaStatements.alterRetentionPolicy(policy, "spp"));
    
    final RetentionPolicy other = RetentionPolicy.newBuilder()
        .setName("rp_inf")
        .setDatabase(new Database("spp"))
        .setDuration("INF")
        .setReplication(2)
        .build();
    assertEquals("CREATE RETENTION POLICY \"rp_inf\" ON \"spp\" "
        + "DURATION 0s REPLICATION 2 SHARD DURATION 0h0m0s", 
        SchemaStatements.createRetentionPolicy(other, "spp"));
    
    try {
      SchemaStatements.createRetentionPolicy(null, "spp");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void continuousQueries() throws Exception {
    assertEquals("SHOW CONTINUOUS QUERIES", 
        SchemaStatements.SHOW_CONTINUOUS_QUERIES);
    assertEquals("DROP CONTINUOUS QUERY \"cq_vms_0\" ON \"spp\"", 
        SchemaStatements.dropContinuousQuery("cq_vms_0", "spp"));
  }
  
  @Test
  public void quote() throws Exception {
    assertEquals("\"a\\\"b\"", SchemaStatements.quote("a\"b"));
    try {
      SchemaStatements.quote("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
