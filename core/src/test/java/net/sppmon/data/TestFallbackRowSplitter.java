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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import net.sppmon.schema.Database;
import net.sppmon.schema.Table;
import net.sppmon.stats.ErrorCollector;
import net.sppmon.utils.EpochTime;

public final class TestFallbackRowSplitter {
  private ErrorCollector errors;
  private FallbackRowSplitter splitter;
  private Table table;
  
  @Before
  public void before() throws Exception {
    errors = new ErrorCollector();
    splitter = new FallbackRowSplitter(errors);
    table = new Database("spp").get("mystery");
  }
  
  @Test
  public void split() throws Exception {
    final Map<String, Object> raw = Maps.newLinkedHashMap();
    raw.put("time", 1000);
    raw.put("count", 3);
    raw.put("ok", true);
    raw.put("host", "hostA");
    raw.put("message", "has spaces");
    raw.put("quoted", "say \"x\"");
    raw.put("empty", "");
    raw.put("gone", null);
    
    final ClassifiedRow row = splitter.split(table, raw);
    assertEquals(ImmutableMap.of("host", "hostA"), row.tags());
    assertEquals(ImmutableMap.of("count", 3, "ok", true, 
        "message", "has spaces", "quoted", "say \"x\""), row.fields());
    assertEquals(1000, row.timestamp());
    // the warning about the fallback
    assertEquals(1, errors.count());
  }
  
  @Test
  public void nestedValuesAreJson() throws Exception {
    final ClassifiedRow row = splitter.split(table, 
        ImmutableMap.<String, Object>of(
            "list", ImmutableList.of(1, 2), 
            "map", ImmutableMap.of("a", "b"),
            "time", 1));
    assertEquals("[1,2]", row.fields().get("list"));
    assertEquals("{\"a\":\"b\"}", row.fields().get("map"));
  }
  
  @Test
  public void logTimeWins() throws Exception {
    final Map<String, Object> raw = Maps.newLinkedHashMap();
    raw.put("time", 1);
    raw.put(Table.CAPTURE_TIME_KEY, 2);
    raw.put("logTime", 3);
    raw.put("x", 1);
    assertEquals(3, splitter.split(table, raw).timestamp());
    
    raw.clear();
    raw.put("logTime", 3);
    raw.put(Table.CAPTURE_TIME_KEY, 2);
    raw.put("x", 1);
    assertEquals(3, splitter.split(table, raw).timestamp());
    
    raw.clear();
    raw.put(Table.CAPTURE_TIME_KEY, 2);
    raw.put("time", 1);
    raw.put("x", 1);
    assertEquals(2, splitter.split(table, raw).timestamp());
  }
  
  @Test
  public void missingField() throws Exception {
    final ClassifiedRow row = splitter.split(table, 
        ImmutableMap.<String, Object>of("host", "a", "time", 5));
    assertEquals(ImmutableMap.of(FallbackRowSplitter.MISSING_FIELD, 
        FallbackRowSplitter.MISSING_FIELD_VALUE), row.fields());
    assertEquals(ImmutableMap.of("host", "a"), row.tags());
    assertEquals(2, errors.count());
  }
  
  @Test
  public void missingTimestamp() throws Exception {
    final long before = EpochTime.nowSeconds();
    final ClassifiedRow row = splitter.split(table, 
        ImmutableMap.of("value", 1));
    assertTrue((Long) row.timestamp() >= before);
    assertEquals(2, errors.count());
    assertFalse(row.fields().isEmpty());
  }
}
