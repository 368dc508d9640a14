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
package net.sppmon.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigDecimal;

import org.junit.Test;

import net.sppmon.exceptions.UnsupportedTimestampTypeException;

public final class TestEpochTime {
  
  @Test
  public void toEpochSecondsSeconds() throws Exception {
    assertEquals(1609459200L, EpochTime.toEpochSeconds(1609459200L));
    assertEquals(1609459200L, EpochTime.toEpochSeconds(1609459200));
    assertEquals(0L, EpochTime.toEpochSeconds(0));
  }
  
  @Test
  public void toEpochSecondsScalesDown() throws Exception {
    // ms, us and ns
    assertEquals(1609459200L, EpochTime.toEpochSeconds(1609459200000L));
    assertEquals(1609459200L, EpochTime.toEpochSeconds(1609459200000000L));
    assertEquals(1609459200L, EpochTime.toEpochSeconds(1609459200000000000L));
    assertEquals(1609459200L, EpochTime.toEpochSeconds(1609459200123L));
  }
  
  @Test
  public void toEpochSecondsThreshold() throws Exception {
    assertEquals(99_999_999_998L, 
        EpochTime.toEpochSeconds(99_999_999_998L));
    assertEquals(99_999_999L, EpochTime.toEpochSeconds(99_999_999_999L));
  }
  
  @Test
  public void toEpochSecondsFloatingPoint() throws Exception {
    assertEquals(1609459200L, EpochTime.toEpochSeconds(1609459200.7));
    assertEquals(1609459200L, EpochTime.toEpochSeconds(1609459200000.0));
    assertEquals(1609459200L, 
        EpochTime.toEpochSeconds(new BigDecimal("1609459200000")));
  }
  
  @Test
  public void toEpochSecondsStrings() throws Exception {
    assertEquals(1609459200L, EpochTime.toEpochSeconds("1609459200000"));
    assertEquals(1609459200L, EpochTime.toEpochSeconds(" 1609459200 "));
    assertEquals(1609459200L, EpochTime.toEpochSeconds("1609459200.5"));
  }
  
  @Test
  public void toEpochSecondsUnsupported() throws Exception {
    for (final Object value : new Object[] { null, "2021-01-01", "", 
        new Object(), Double.NaN, Double.POSITIVE_INFINITY, true }) {
      try {
        EpochTime.toEpochSeconds(value);
        fail("Expected UnsupportedTimestampTypeException for " + value);
      } catch (UnsupportedTimestampTypeException e) { }
    }
  }
  
  @Test
  public void nowSeconds() throws Exception {
    final long now = EpochTime.nowSeconds();
    assertTrue(Math.abs(now - System.currentTimeMillis() / 1000) <= 1);
  }
}
