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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * The datatypes a field can be written as. Tags are always strings.
 * 
 * @since 1.0
 */
public enum Datatype {
  /** Undeclared, written unchanged. */
  NONE,
  
  /** Written quoted with embedded double quotes escaped. */
  STRING,
  
  /** Written unchanged. */
  BOOL,
  
  /** Written with the integer suffix "i". */
  INT,
  
  /** Written unchanged, Influx' default numeric type. */
  FLOAT,
  
  /** An epoch timestamp in any precision, normalized to seconds and 
   * written as an integer. Never detected automatically. */
  TIMESTAMP;
  
  /** Detection order. BOOL must come before INT. */
  private static final List<Map.Entry<Predicate<Object>, Datatype>> DETECTION =
      ImmutableList.of(
          when(value -> value == null, NONE),
          when(value -> value instanceof CharSequence 
              || value instanceof Character, STRING),
          when(value -> value instanceof Boolean, BOOL),
          when(value -> value instanceof Long 
              || value instanceof Integer
              || value instanceof Short
              || value instanceof Byte
              || value instanceof BigInteger, INT),
          when(value -> value instanceof Double 
              || value instanceof Float
              || value instanceof BigDecimal, FLOAT));
  
  /**
   * Picks the datatype from the Java type of the value. Only used when
   * a table does not declare the field.
   * @param value The value to inspect, may be null.
   * @return The first matching datatype or {@link #NONE} if nothing 
   * matched.
   */
  public static Datatype detect(final Object value) {
    for (final Map.Entry<Predicate<Object>, Datatype> entry : DETECTION) {
      if (entry.getKey().test(value)) {
        return entry.getValue();
      }
    }
    return NONE;
  }
  
  private static Map.Entry<Predicate<Object>, Datatype> when(
      final Predicate<Object> predicate, final Datatype datatype) {
    return Maps.immutableEntry(predicate, datatype);
  }
}
