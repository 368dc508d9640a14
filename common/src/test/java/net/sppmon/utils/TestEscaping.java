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
import static org.junit.Assert.fail;

import org.junit.Test;

public final class TestEscaping {

  @Test
  public void escapeName() throws Exception {
    assertEquals("a\\ b", Escaping.escapeName("a b"));
    assertEquals("a\\,b\\=c", Escaping.escapeName("a,b=c"));
    assertEquals("plain", Escaping.escapeName("plain"));
    assertEquals("42", Escaping.escapeName(42));
  }
  
  @Test
  public void escapeNull() throws Exception {
    try {
      Escaping.escapeName(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      Escaping.escapeStringField(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void escapeDoesNotDoubleEscape() throws Exception {
    assertEquals("a\\ b", Escaping.escapeName("a\\ b"));
    final String once = Escaping.escapeName("x y,z=1");
    assertEquals(once, Escaping.escapeName(once));
  }
  
  @Test
  public void escapeAfterEscapedBackslash() throws Exception {
    // an escaped backslash does not escape the following space
    assertEquals("a\\\\\\ b", Escaping.escapeName("a\\\\ b"));
  }
  
  @Test
  public void escapeStringField() throws Exception {
    assertEquals("say \\\"hi\\\"", Escaping.escapeStringField("say \"hi\""));
    assertEquals("a,b c", Escaping.escapeStringField("a,b c"));
  }
  
  @Test
  public void unescapeReverses() throws Exception {
    for (final String value : new String[] { "", "a", "a b", "a=b,c d", 
        " , = ", "x==y" }) {
      assertEquals(value, Escaping.unescape(Escaping.escapeName(value), 
          Escaping.NAME_CHARACTERS));
    }
  }
  
  @Test
  public void escapeNoCharacters() throws Exception {
    try {
      Escaping.escape("a b");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
