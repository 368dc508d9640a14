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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

import net.sppmon.exceptions.InvalidCombinationException;
import net.sppmon.schema.Database;
import net.sppmon.schema.RetentionPolicy;
import net.sppmon.schema.Table;

public final class TestSelectionQuery {
  private Database database;
  private Table vms;
  private Table jobs;
  
  @Before
  public void before() throws Exception {
    database = new Database("spp");
    final RetentionPolicy policy = RetentionPolicy.newBuilder()
        .setName("rp_days_14")
        .setDatabase(database)
        .setDuration("14d")
        .build();
    vms = Table.newBuilder()
        .setDatabase(database)
        .setName("vms")
        .setRetentionPolicy(policy)
        .build();
    jobs = Table.newBuilder()
        .setDatabase(database)
        .setName("jobs")
        .setRetentionPolicy(policy)
        .build();
  }
  
  @Test
  public void selectAll() throws Exception {
    final SelectionQuery query = SelectionQuery.newBuilder(Keyword.SELECT)
        .addTable(vms)
        .build();
    assertEquals(ImmutableList.of("*"), query.fields());
    assertNull(query.groupBy());
    assertEquals("SELECT * FROM spp.rp_days_14.vms", query.render());
    assertEquals(query.render(), query.toString());
  }
  
  @Test
  public void selectEverything() throws Exception {
    final SelectionQuery query = SelectionQuery.newBuilder(Keyword.SELECT)
        .addTable(vms)
        .addTable(jobs)
        .setFields(ImmutableList.of("mean(cpu)", "max(memory)"))
        .setWhere("time > now() - 1h")
        .setGroupBy(ImmutableList.of("time(1h)", "host"))
        .setOrderDirection(OrderDirection.DESC)
        .setLimit(10)
        .setSLimit(2)
        .build();
    assertEquals("SELECT mean(cpu),max(memory) FROM spp.rp_days_14.vms,"
        + "spp.rp_days_14.jobs WHERE time > now() - 1h "
        + "GROUP BY time(1h),host ORDER BY \"time\" DESC LIMIT 10 SLIMIT 2", 
        query.render());
  }
  
  @Test
  public void selectEmptyGroupByIsAll() throws Exception {
    assertEquals("SELECT * FROM spp.rp_days_14.vms GROUP BY *", 
        SelectionQuery.newBuilder(Keyword.SELECT)
          .addTable(vms)
          .setGroupBy(ImmutableList.<String>of())
          .build()
          .render());
  }
  
  @Test
  public void selectInto() throws Exception {
    final Table into = vms.toBuilder()
        .setDatabase(new Database("copy"))
        .build();
    assertEquals("SELECT * INTO copy.rp_days_14.vms FROM spp.rp_days_14.vms "
        + "WHERE time > now() - 336h0m0s GROUP BY *", 
        SelectionQuery.newBuilder(Keyword.SELECT)
          .addTable(vms)
          .setIntoTable(into)
          .setWhere("time > now() - 336h0m0s")
          .setGroupBy(ImmutableList.<String>of())
          .build()
          .render());
  }
  
  @Test
  public void zeroLimitsAreOmitted() throws Exception {
    assertEquals("SELECT * FROM spp.rp_days_14.vms ORDER BY \"time\" ASC", 
        SelectionQuery.newBuilder(Keyword.SELECT)
          .addTable(vms)
          .setOrderDirection(OrderDirection.ASC)
          .setLimit(0)
          .setSLimit(0)
          .build()
          .render());
  }
  
  @Test
  public void deleteUsesBareTableName() throws Exception {
    final SelectionQuery query = SelectionQuery.newBuilder(Keyword.DELETE)
        .addTable(vms)
        .setWhere("time < now() - 1d")
        .build();
    assertNull(query.fields());
    assertNull(query.groupBy());
    assertEquals("DELETE FROM vms WHERE time < now() - 1d", query.render());
  }
  
  @Test
  public void deleteRejectsSelectClauses() throws Exception {
    final SelectionQuery.Builder[] builders = new SelectionQuery.Builder[] {
        SelectionQuery.newBuilder(Keyword.DELETE).addTable(vms)
          .setIntoTable(jobs),
        SelectionQuery.newBuilder(Keyword.DELETE).addTable(vms)
          .setFields(ImmutableList.of("cpu")),
        SelectionQuery.newBuilder(Keyword.DELETE).addTable(vms)
          .setGroupBy(ImmutableList.of("host")),
        SelectionQuery.newBuilder(Keyword.DELETE).addTable(vms)
          .setOrderDirection(OrderDirection.ASC),
        SelectionQuery.newBuilder(Keyword.DELETE).addTable(vms)
          .setLimit(1),
        SelectionQuery.newBuilder(Keyword.DELETE).addTable(vms)
          .setSLimit(1)
    };
    for (final SelectionQuery.Builder builder : builders) {
      try {
        builder.build();
        fail("Expected InvalidCombinationException");
      } catch (InvalidCombinationException e) { }
    }
    
    // empty lists are fine
    assertEquals("DELETE FROM vms", SelectionQuery.newBuilder(Keyword.DELETE)
        .addTable(vms)
        .setFields(ImmutableList.<String>of())
        .setGroupBy(ImmutableList.<String>of())
        .build()
        .render());
  }
  
  @Test
  public void invalidArguments() throws Exception {
    try {
      SelectionQuery.newBuilder(Keyword.INSERT).addTable(vms).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      SelectionQuery.newBuilder(Keyword.SELECT).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      SelectionQuery.newBuilder(Keyword.SELECT).addTable(vms).setLimit(-1)
        .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      SelectionQuery.newBuilder(Keyword.SELECT).addTable(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void toBuilder() throws Exception {
    final SelectionQuery query = SelectionQuery.newBuilder(Keyword.SELECT)
        .addTable(vms)
        .setFields(ImmutableList.of("cpu"))
        .setGroupBy(ImmutableList.of("host"))
        .setLimit(5)
        .build();
    assertEquals(query.render(), query.toBuilder().build().render());
    assertEquals("SELECT cpu FROM spp.rp_days_14.jobs GROUP BY host LIMIT 5", 
        query.toBuilder().setTables(ImmutableList.of(jobs)).build().render());
  }
}
