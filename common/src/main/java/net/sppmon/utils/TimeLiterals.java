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

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Strings;

import net.sppmon.exceptions.InvalidDurationException;

/**
 * Helpers for InfluxQL duration literals.
 * 
 * @since 1.0
 */
public final class TimeLiterals {
  
  /** The literal Influx uses for "keep forever". */
  public static final String INFINITE = "0s";
  
  /** Literals we can canonicalize. */
  private static final Pattern CANONICALIZABLE = 
      Pattern.compile("^(\\d+[smhdw])+$");
  
  /** Anything InfluxQL accepts as a duration literal. */
  private static final Pattern INFLUX_LITERAL = 
      Pattern.compile("^(\\d+(?:[uµsmhdw]|ns|ms))+$");
  
  private static final Pattern COMPONENT = Pattern.compile("(\\d+)([a-z]+)");
  
  private TimeLiterals() {
    // static helpers only
  }
  
  /**
   * Whether or not the value is a valid InfluxQL duration literal, e.g.
   * "7d", "90m" or "500ms".
   * @param value A non-null and non-empty literal.
   * @return True if the literal is valid.
   * @throws IllegalArgumentException if the value was null or empty.
   */
  public static boolean isTimeLiteral(final String value) {
    if (Strings.isNullOrEmpty(value)) {
      throw new IllegalArgumentException("Time literal cannot be null or "
          + "empty.");
    }
    return INFLUX_LITERAL.matcher(value).matches();
  }
  
  /**
   * Transforms a literal like "14d" or "1h90m" into the canonical form
   * Influx reports back for retention policies, e.g. "336h0m0s". The 
   * case-insensitive literal "INF" maps to "0s".
   * @param value A non-null and non-empty literal.
   * @return The canonical literal.
   * @throws InvalidDurationException if the value was null, empty or not
   * a literal of s, m, h, d and w components.
   */
  public static String canonicalize(final String value) {
    final long seconds = toSeconds(value);
    if (seconds == 0 && value.toLowerCase(Locale.ROOT).equals("inf")) {
      return INFINITE;
    }
    final long hours = seconds / 3600;
    final long minutes = (seconds % 3600) / 60;
    return hours + "h" + minutes + "m" + (seconds % 60) + "s";
  }
  
  /**
   * Sums up the components of a literal. "INF" is zero.
   * @param value A non-null and non-empty literal.
   * @return The total in seconds.
   * @throws InvalidDurationException if the literal was malformed.
   */
  public static long toSeconds(final String value) {
    if (Strings.isNullOrEmpty(value)) {
      throw new InvalidDurationException("Duration literal cannot be null "
          + "or empty.");
    }
    if (!CANONICALIZABLE.matcher(value).matches()) {
      if (value.toLowerCase(Locale.ROOT).equals("inf")) {
        return 0;
      }
      throw new InvalidDurationException("Invalid duration literal: " 
          + value);
    }
    
    long seconds = 0;
    final Matcher matcher = COMPONENT.matcher(value);
    while (matcher.find()) {
      seconds += Units.parseUnit(matcher.group(1), matcher.group(2))
          .longValue();
    }
    return seconds;
  }
}
