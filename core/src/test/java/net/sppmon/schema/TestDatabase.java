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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

import net.sppmon.schema.Table.SchemaMode;

public final class TestDatabase {
  private Database database;
  
  @Before
  public void before() throws Exception {
    database = new Database("spp");
  }
  
  @Test
  public void ctor() throws Exception {
    assertEquals("spp", database.name());
    assertTrue(database.tables().isEmpty());
    assertTrue(database.retentionPolicies().isEmpty());
    assertTrue(database.continuousQueries().isEmpty());
    
    try {
      new Database(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new Database("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void getDeclared() throws Exception {
    final Table table = Table.newBuilder()
        .setDatabase(database)
        .setName("vms")
        .addField("cpu", Datatype.INT)
        .build();
    database.addTable("vms", table);
    assertTrue(database.hasTable("vms"));
    assertSame(table, database.get("vms"));
  }
  
  @Test
  public void getUndeclared() throws Exception {
    final Table table = database.get("mystery");
    assertEquals("mystery", table.name());
    assertEquals(SchemaMode.FALLBACK, table.mode());
    assertSame(database, table.database());
    assertFalse(database.hasTable("mystery"));
    
    try {
      database.get("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void addTableOfOtherDatabase() throws Exception {
    final Table table = Table.newBuilder()
        .setDatabase(new Database("other"))
        .setName("vms")
        .build();
    try {
      database.addTable("vms", table);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void retentionPoliciesAreDeduplicated() throws Exception {
    database.addRetentionPolicy(RetentionPolicy.newBuilder()
        .setName("rp").setDatabase(database).setDuration("1d").build());
    database.addRetentionPolicy(RetentionPolicy.newBuilder()
        .setName("rp").setDatabase(database).setDuration("1d").build());
    assertEquals(1, database.retentionPolicies().size());
    
    try {
      database.retentionPolicies().clear();
      fail("Expected UnsupportedOperationException");
    } catch (UnsupportedOperationException e) { }
  }
}
