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

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import net.sppmon.exceptions.NotNumericException;
import net.sppmon.exceptions.UnrecognizedUnitException;

/**
 * Parses human formatted sizes and durations like "10 GiB", "512kb" or
 * "1h30m" into their base unit, bytes or seconds.
 * <p>
 * Units are matched case-insensitively against a fixed table. Single
 * letters for sizes are binary (IEC), the two letter "b" suffixes are
 * decimal (SI).
 * 
 * @since 1.0
 */
public final class Units {
  
  /** Base unit multipliers, keys are lower case. */
  private static final Map<String, Long> UNITS = 
      ImmutableMap.<String, Long>builder()
      // bytes
      .put("b", 1L)
      .put("k", 1L << 10)
      .put("ki", 1L << 10)
      .put("kib", 1L << 10)
      .put("kb", 1_000L)
      .put("mi", 1L << 20)
      .put("mib", 1L << 20)
      .put("mb", 1_000_000L)
      .put("g", 1L << 30)
      .put("gi", 1L << 30)
      .put("gib", 1L << 30)
      .put("gb", 1_000_000_000L)
      .put("t", 1L << 40)
      .put("ti", 1L << 40)
      .put("tib", 1L << 40)
      .put("tb", 1_000_000_000_000L)
      // seconds
      .put("s", 1L)
      .put("second", 1L)
      .put("seconds", 1L)
      .put("second(s)", 1L)
      .put("m", 60L)
      .put("min", 60L)
      .put("mins", 60L)
      .put("min(s)", 60L)
      .put("h", 3_600L)
      .put("hour", 3_600L)
      .put("hours", 3_600L)
      .put("hour(s)", 3_600L)
      .put("d", 86_400L)
      .put("w", 604_800L)
      .build();
  
  /** A number directly followed by its unit, e.g. "10GB". */
  private static final Pattern VALUE_WITH_UNIT = 
      Pattern.compile("(-?\\d+(?:\\.\\d+)?)([a-zA-Z]+)");
  
  /** A token made of non digits only, used as a unit for the prior token. */
  private static final Pattern UNIT_TOKEN = Pattern.compile("^\\D+");
  
  private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");
  private static final Pattern DECIMAL = Pattern.compile("^-?\\d+\\.\\d+$");
  
  private Units() {
    // static helpers only
  }

  /**
   * Parses the given data splitting tokens on a single space.
   * @param data The data to parse, may be null.
   * @return The value in the base unit or null if there was no data.
   * @see #parseUnit(Object, String, String)
   */
  public static Number parseUnit(final Object data) {
    return parseUnit(data, null, " ");
  }
  
  /**
   * Parses the given data with a unit supplied from outside, splitting
   * tokens on a single space.
   * @param data The data to parse, may be null.
   * @param given_unit An optional unit applied to every token.
   * @return The value in the base unit or null if there was no data.
   * @see #parseUnit(Object, String, String)
   */
  public static Number parseUnit(final Object data, final String given_unit) {
    return parseUnit(data, given_unit, " ");
  }
  
  /**
   * Parses a string or number into the lowest unit. Numbers are returned
   * as is. Strings are split on the delimiter and each token is either a
   * number with its unit attached ("10GB", "1h30m"), a number followed by
   * a unit token ("10 GB") or a bare number. All tokens are summed and the
   * total is rounded to the nearest integer.
   * 
   * @param data The data to parse. May be null.
   * @param given_unit An optional unit to apply to each token when the
   * data itself carries no unit. May be null.
   * @param delimiter A non-null and non-empty token delimiter.
   * @return Null if the data was null, empty or the literal "null", the
   * given number unchanged or the rounded sum as a {@link Long}.
   * @throws IllegalArgumentException if the data was neither a string nor
   * a number or the delimiter was null or empty.
   * @throws UnrecognizedUnitException if a unit was not in the table.
   * @throws NotNumericException if a value was not a number.
   */
  public static Number parseUnit(final Object data, 
                                 final String given_unit, 
                                 final String delimiter) {
    if (data == null) {
      return null;
    }
    if (data instanceof Number) {
      return (Number) data;
    }
    if (!(data instanceof String)) {
      throw new IllegalArgumentException("Need a string or number to parse "
          + "a unit from but got a " + data.getClass());
    }
    final String string = (String) data;
    if (string.isEmpty() || string.equals("null")) {
      return null;
    }
    if (Strings.isNullOrEmpty(delimiter)) {
      throw new IllegalArgumentException("Delimiter cannot be null or empty.");
    }
    
    final List<String> parts = Splitter.on(delimiter)
        .trimResults(CharMatcher.is(' '))
        .omitEmptyStrings()
        .splitToList(string);
    if (parts.isEmpty()) {
      throw new NotNumericException("No value found in: '" + string + "'");
    }
    
    double total = 0;
    int i = 0;
    while (i < parts.size()) {
      final String token = parts.get(i++);
      
      if (!Strings.isNullOrEmpty(given_unit)) {
        total += convert(token, given_unit, string);
        continue;
      }
      
      final Matcher matcher = VALUE_WITH_UNIT.matcher(token);
      int position = 0;
      while (position < token.length() 
          && matcher.find(position) 
          && matcher.start() == position) {
        total += convert(matcher.group(1), matcher.group(2), string);
        position = matcher.end();
      }
      if (position > 0) {
        if (position < token.length()) {
          throw new NotNumericException("Trailing '" 
              + token.substring(position) + "' is not a value with a unit in: " 
              + string);
        }
        continue;
      }
      
      String unit = null;
      if (i < parts.size()) {
        final Matcher unit_matcher = UNIT_TOKEN.matcher(parts.get(i));
        if (unit_matcher.find()) {
          unit = unit_matcher.group();
          i++;
        }
      }
      total += convert(token, unit, string);
    }
    return Math.round(total);
  }
  
  /**
   * @param unit The unit to look up, case-insensitive.
   * @return True if the unit is in the table.
   */
  public static boolean isKnownUnit(final String unit) {
    return unit != null && UNITS.containsKey(unit.toLowerCase(Locale.ROOT));
  }
  
  private static double convert(final String value, 
                                final String unit, 
                                final String data) {
    long multiplier = 1;
    if (unit != null) {
      final Long found = UNITS.get(unit.toLowerCase(Locale.ROOT));
      if (found == null) {
        throw new UnrecognizedUnitException("No known unit '" + unit 
            + "' for value '" + value + "' in: " + data);
      }
      multiplier = found;
    }
    
    if (INTEGER.matcher(value).matches()) {
      return Long.parseLong(value) * (double) multiplier;
    } else if (DECIMAL.matcher(value).matches()) {
      return Double.parseDouble(value) * multiplier;
    }
    throw new NotNumericException("Value '" + value 
        + "' is not numeric in: " + data);
  }
}
