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

import java.util.Map;

import net.sppmon.schema.Table;

/**
 * Splits a raw row of a table into tags, fields and a timestamp.
 * 
 * @since 1.0
 */
public interface RowSplitter {

  /**
   * @param table The non-null table the row belongs to.
   * @param row A non-null and non-empty row of column names to raw values.
   * @return The classified row, never null.
   */
  public ClassifiedRow split(final Table table, final Map<String, ?> row);
  
}
