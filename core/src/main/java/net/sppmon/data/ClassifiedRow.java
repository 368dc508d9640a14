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

import java.util.Collections;
import java.util.Map;

/**
 * The result of splitting a raw row into tags, fields and a timestamp.
 * 
 * @since 1.0
 */
public class ClassifiedRow {
  private final Map<String, Object> tags;
  private final Map<String, Object> fields;
  private final Object time_stamp;
  
  /**
   * Default ctor.
   * @param tags The non-null tags.
   * @param fields The non-null fields.
   * @param time_stamp The raw timestamp, may be null.
   */
  public ClassifiedRow(final Map<String, Object> tags, 
                       final Map<String, Object> fields, 
                       final Object time_stamp) {
    this.tags = Collections.unmodifiableMap(tags);
    this.fields = Collections.unmodifiableMap(fields);
    this.time_stamp = time_stamp;
  }
  
  /** @return The tags in column order. */
  public Map<String, Object> tags() {
    return tags;
  }
  
  /** @return The fields in column order. */
  public Map<String, Object> fields() {
    return fields;
  }
  
  /** @return The raw timestamp as found in the row, null if none matched. */
  public Object timestamp() {
    return time_stamp;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("tags=")
        .append(tags)
        .append(", fields=")
        .append(fields)
        .append(", timestamp=")
        .append(time_stamp)
        .toString();
  }
}
