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
import net.sppmon.stats.ErrorCollector;

/**
 * Picks the splitter for a row by the schema mode of its table.
 * 
 * @since 1.0
 */
public class RowClassifier {

  private final RowSplitter declared;
  private final RowSplitter fallback;
  
  /**
   * Ctor using the default splitters.
   * @param errors The non-null collector for recoverable problems.
   */
  public RowClassifier(final ErrorCollector errors) {
    this(new DeclaredRowSplitter(errors), new FallbackRowSplitter(errors));
  }
  
  /**
   * Ctor with explicit splitters.
   * @param declared The splitter for tables with declared fields.
   * @param fallback The splitter for everything else.
   */
  public RowClassifier(final RowSplitter declared, final RowSplitter fallback) {
    if (declared == null || fallback == null) {
      throw new IllegalArgumentException("Splitters cannot be null.");
    }
    this.declared = declared;
    this.fallback = fallback;
  }
  
  /**
   * Splits the row.
   * @param table The non-null table.
   * @param row The non-null, non-empty row.
   * @return The classified row.
   * @throws IllegalArgumentException if the table was null or the row was
   * null or empty.
   */
  public ClassifiedRow classify(final Table table, final Map<String, ?> row) {
    if (table == null) {
      throw new IllegalArgumentException("Table cannot be null.");
    }
    if (row == null || row.isEmpty()) {
      throw new IllegalArgumentException("At least one entry is required "
          + "to split a row of table " + table.name());
    }
    switch (table.mode()) {
    case DECLARED:
      return declared.split(table, row);
    default:
      return fallback.split(table, row);
    }
  }
}
