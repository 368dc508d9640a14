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
package net.sppmon.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.sppmon.schema.Database;
import net.sppmon.schema.Datatype;
import net.sppmon.schema.Table;
import net.sppmon.stats.ErrorCollector;

public final class TestRowClassifier {
  private Database database;
  private Table declared;
  private Table undeclared;
  
  @Before
  public void before() throws Exception {
    database = new Database("spp");
    declared = Table.newBuilder()
        .setDatabase(database)
        .setName("cpuram")
        .addField("cpu", Datatype.FLOAT)
        .addTag("host")
        .setTimeKey("time")
        .build();
    undeclared = database.get("mystery");
  }
  
  @Test
  public void classify() throws Exception {
    final ErrorCollector errors = new ErrorCollector();
    final RowClassifier classifier = new RowClassifier(errors);
    final ClassifiedRow row = classifier.classify(declared, 
        ImmutableMap.<String, Object>of("time", 1000, "cpu", 50, "host", "a b"));
    assertEquals(ImmutableMap.of("host", "a b"), row.tags());
    assertEquals(ImmutableMap.of("cpu", 50), row.fields());
    assertEquals(1000, row.timestamp());
    assertEquals(0, errors.count());
  }
  
  @Test
  @SuppressWarnings("unchecked")
  public void dispatchesOnSchemaMode() throws Exception {
    final RowSplitter by_schema = mock(RowSplitter.class);
    final RowSplitter by_value = mock(RowSplitter.class);
    final ClassifiedRow result = new ClassifiedRow(
        ImmutableMap.<String, Object>of(), ImmutableMap.<String, Object>of(), 
        null);
    when(by_schema.split(any(Table.class), any(Map.class))).thenReturn(result);
    when(by_value.split(any(Table.class), any(Map.class))).thenReturn(result);
    final RowClassifier classifier = new RowClassifier(by_schema, by_value);
    
    assertSame(result, classifier.classify(declared, ImmutableMap.of("cpu", 1)));
    verify(by_schema).split(any(Table.class), any(Map.class));
    verify(by_value, never()).split(any(Table.class), any(Map.class));
    
    classifier.classify(undeclared, ImmutableMap.of("cpu", 1));
    verify(by_value).split(any(Table.class), any(Map.class));
  }
  
  @Test
  public void invalidArguments() throws Exception {
    final RowClassifier classifier = new RowClassifier(new ErrorCollector());
    try {
      classifier.classify(declared, ImmutableMap.<String, Object>of());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      classifier.classify(declared, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      classifier.classify(null, ImmutableMap.of("cpu", 1));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new RowClassifier(null, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
