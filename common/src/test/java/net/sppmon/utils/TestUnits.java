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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.sppmon.exceptions.NotNumericException;
import net.sppmon.exceptions.UnrecognizedUnitException;

public final class TestUnits {

  @Test
  public void parseUnitEmpty() throws Exception {
    assertNull(Units.parseUnit(null));
    assertNull(Units.parseUnit(""));
    assertNull(Units.parseUnit("null"));
  }
  
  @Test
  public void parseUnitNumberPassesThrough() throws Exception {
    final Integer zero = 0;
    assertSame(zero, Units.parseUnit(zero));
    assertEquals(42.5, Units.parseUnit(42.5));
  }
  
  @Test
  public void parseUnitBytes() throws Exception {
    assertEquals(10L << 30, Units.parseUnit("10GiB"));
    assertEquals(10L << 30, Units.parseUnit("10gib"));
    assertEquals(10_000_000_000L, Units.parseUnit("10 GB"));
    assertEquals(3L << 40, Units.parseUnit("3T"));
    assertEquals(2048L, Units.parseUnit("2 k"));
    assertEquals(512L, Units.parseUnit("512b"));
    assertEquals(1536L, Units.parseUnit("1.5KiB"));
  }
  
  @Test
  public void parseUnitTime() throws Exception {
    assertEquals(5400L, Units.parseUnit("1h30m"));
    assertEquals(5400L, Units.parseUnit("1 hour 30 min"));
    assertEquals(86_400L + 60, Units.parseUnit("1d 1m"));
    assertEquals(1_209_600L, Units.parseUnit("2w"));
    assertEquals(10L, Units.parseUnit("10 second(s)"));
  }
  
  @Test
  public void parseUnitGivenUnit() throws Exception {
    assertEquals(120L, Units.parseUnit("2", "m"));
    assertEquals(3L << 20, Units.parseUnit("3", "MiB"));
  }
  
  @Test
  public void parseUnitDelimiter() throws Exception {
    assertEquals(90L, Units.parseUnit("1m;30s", null, ";"));
  }
  
  @Test
  public void parseUnitBareNumbers() throws Exception {
    assertEquals(42L, Units.parseUnit("42"));
    assertEquals(13L, Units.parseUnit("12.5"));
    assertEquals(3L, Units.parseUnit("1 2"));
  }
  
  @Test
  public void parseUnitErrors() throws Exception {
    try {
      Units.parseUnit("5xyz");
      fail("Expected UnrecognizedUnitException");
    } catch (UnrecognizedUnitException e) { }
    
    try {
      Units.parseUnit("abc");
      fail("Expected NotNumericException");
    } catch (NotNumericException e) { }
    
    try {
      Units.parseUnit(new Object());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      Units.parseUnit("5", "parsec");
      fail("Expected UnrecognizedUnitException");
    } catch (UnrecognizedUnitException e) { }
  }
  
  @Test
  public void parseUnitTrailingGarbage() throws Exception {
    try {
      Units.parseUnit("1h30");
      fail("Expected NotNumericException");
    } catch (NotNumericException e) { }
    
    try {
      Units.parseUnit("10GB5");
      fail("Expected NotNumericException");
    } catch (NotNumericException e) { }
  }
  
  @Test
  public void parseUnitOnlyDelimiters() throws Exception {
    try {
      Units.parseUnit(" ");
      fail("Expected NotNumericException");
    } catch (NotNumericException e) { }
    
    try {
      Units.parseUnit(";;", null, ";");
      fail("Expected NotNumericException");
    } catch (NotNumericException e) { }
  }
  
  @Test
  public void isKnownUnit() throws Exception {
    assertTrue(Units.isKnownUnit("GiB"));
    assertTrue(Units.isKnownUnit("hour(s)"));
    assertFalse(Units.isKnownUnit("xyz"));
    assertFalse(Units.isKnownUnit(null));
  }
}
