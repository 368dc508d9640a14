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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Backslash escaping for the line protocol. A character that is already
 * escaped, i.e. preceded by an odd number of backslashes, is left alone.
 * 
 * @since 1.0
 */
public final class Escaping {

  /** Characters escaped in measurement names, tag keys, tag values and 
   * field keys. */
  public static final char[] NAME_CHARACTERS = { '=', ' ', ',' };
  
  /** Characters escaped inside quoted string field values. */
  public static final char[] STRING_FIELD_CHARACTERS = { '"' };
  
  /** An even run of backslashes not preceded by another backslash. */
  private static final String EVEN_BACKSLASHES = "((?<!\\\\)(?:\\\\\\\\)*)";
  
  private Escaping() {
    // static helpers only
  }
  
  /**
   * Escapes a name or tag value.
   * @param value The value to escape, stringified if not a string.
   * @return The escaped string.
   */
  public static String escapeName(final Object value) {
    return escape(value, NAME_CHARACTERS);
  }
  
  /**
   * Escapes the contents of a string field value. The caller wraps the 
   * result in double quotes.
   * @param value The value to escape, stringified if not a string.
   * @return The escaped string.
   */
  public static String escapeStringField(final Object value) {
    return escape(value, STRING_FIELD_CHARACTERS);
  }
  
  /**
   * Prefixes each unescaped occurrence of the characters with a backslash.
   * @param value The value to escape, stringified if not a string.
   * @param characters A non-null and non-empty list of characters.
   * @return The escaped string.
   * @throws IllegalArgumentException if the value was null or no 
   * characters were given.
   */
  public static String escape(final Object value, final char... characters) {
    if (characters == null || characters.length < 1) {
      throw new IllegalArgumentException("Need at least one character "
          + "to escape.");
    }
    if (value == null) {
      throw new IllegalArgumentException("Cannot escape a null value.");
    }
    String string = value.toString();
    for (final char c : characters) {
      final String character = String.valueOf(c);
      string = Pattern.compile(EVEN_BACKSLASHES + Pattern.quote(character))
          .matcher(string)
          .replaceAll("$1" + Matcher.quoteReplacement("\\" + character));
    }
    return string;
  }
  
  /**
   * Reverses {@link #escape(Object, char...)} for the given characters.
   * @param value A non-null escaped string.
   * @param characters A non-null and non-empty list of characters.
   * @return The unescaped string.
   * @throws IllegalArgumentException if no characters were given.
   */
  public static String unescape(final String value, final char... characters) {
    if (characters == null || characters.length < 1) {
      throw new IllegalArgumentException("Need at least one character "
          + "to unescape.");
    }
    String string = value;
    for (final char c : characters) {
      final String character = String.valueOf(c);
      string = Pattern.compile(EVEN_BACKSLASHES + "\\\\" 
            + Pattern.quote(character))
          .matcher(string)
          .replaceAll("$1" + Matcher.quoteReplacement(character));
    }
    return string;
  }
}
