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

import java.util.regex.Pattern;

import net.sppmon.exceptions.UnsupportedTimestampTypeException;

/**
 * Normalizes epoch timestamps of unknown precision to seconds.
 * <p>
 * The precision is guessed from the magnitude: anything at or above
 * {@link #SECONDS_THRESHOLD} is divided by 1000 until it drops below. A
 * legit second precision timestamp past the year 5138 would be scaled
 * down too.
 * 
 * @since 1.0
 */
public final class EpochTime {
  
  /** Values at or above this are treated as milli, micro or nano seconds. */
  public static final long SECONDS_THRESHOLD = 99_999_999_999L;
  
  private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");
  private static final Pattern DECIMAL = Pattern.compile("^-?\\d+\\.\\d+$");
  
  private EpochTime() {
    // static helpers only
  }
  
  /** @return The current wall clock time in epoch seconds, rounded. */
  public static long nowSeconds() {
    return Math.round(System.currentTimeMillis() / 1000.0);
  }
  
  /**
   * Converts a timestamp in any epoch precision to seconds.
   * @param time_stamp A number or numeric string.
   * @return The timestamp in epoch seconds.
   * @throws UnsupportedTimestampTypeException if the value was null, not
   * a number or a string that doesn't parse to a number.
   */
  public static long toEpochSeconds(final Object time_stamp) {
    if (time_stamp instanceof String) {
      final String trimmed = ((String) time_stamp).trim();
      try {
        if (INTEGER.matcher(trimmed).matches()) {
          return toEpochSeconds(Long.parseLong(trimmed));
        } else if (DECIMAL.matcher(trimmed).matches()) {
          return toEpochSeconds(Double.parseDouble(trimmed));
        }
      } catch (NumberFormatException e) {
        throw new UnsupportedTimestampTypeException("Timestamp out of range: " 
            + time_stamp);
      }
      throw new UnsupportedTimestampTypeException("Unsupported timestamp: " 
          + time_stamp);
    }
    
    if (time_stamp instanceof Long 
        || time_stamp instanceof Integer
        || time_stamp instanceof Short 
        || time_stamp instanceof Byte) {
      long value = ((Number) time_stamp).longValue();
      while (value >= SECONDS_THRESHOLD) {
        value /= 1000;
      }
      return value;
    }
    
    if (time_stamp instanceof Number) {
      double value = ((Number) time_stamp).doubleValue();
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new UnsupportedTimestampTypeException("Unsupported timestamp: " 
            + time_stamp);
      }
      while (value >= SECONDS_THRESHOLD) {
        value /= 1000;
      }
      return (long) value;
    }
    
    throw new UnsupportedTimestampTypeException("Unsupported timestamp type: " 
        + (time_stamp == null ? "null" : time_stamp.getClass().getName()));
  }
}
