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
package net.sppmon.query;

import com.google.common.base.Strings;

import net.sppmon.exceptions.InvalidCombinationException;
import net.sppmon.exceptions.InvalidDurationException;
import net.sppmon.schema.Database;
import net.sppmon.utils.TimeLiterals;

/**
 * A continuous query, either wrapping a structured SELECT ... INTO or a
 * raw SELECT string. Equality and hash code are computed over the 
 * rendered statement as that's what the server lists back.
 * 
 * @since 1.0
 */
public class ContinuousQuery {
  private final String name;
  private final Database database;
  private final SelectionQuery select_query;
  private final String select_string;
  private final String every_interval;
  private final String for_interval;
  private final String rendered;
  
  /**
   * Protected ctor.
   * @param builder The non-null builder.
   */
  protected ContinuousQuery(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.name)) {
      throw new IllegalArgumentException("Continuous query name cannot be "
          + "null or empty.");
    }
    if (builder.database == null) {
      throw new IllegalArgumentException("Continuous query " + builder.name 
          + " needs a database.");
    }
    if (!Strings.isNullOrEmpty(builder.every_interval) 
        && !TimeLiterals.isTimeLiteral(builder.every_interval)) {
      throw new InvalidDurationException("Every interval of continuous query " 
          + builder.name + " is not a time literal: " + builder.every_interval);
    }
    if (!Strings.isNullOrEmpty(builder.for_interval) 
        && !TimeLiterals.isTimeLiteral(builder.for_interval)) {
      throw new InvalidDurationException("For interval of continuous query " 
          + builder.name + " is not a time literal: " + builder.for_interval);
    }
    if (builder.select_query != null 
        && !Strings.isNullOrEmpty(builder.select_string)) {
      throw new InvalidCombinationException("Continuous query " 
          + builder.name + " accepts either a selection query or a query "
          + "string, not both.");
    }
    if (builder.select_query == null 
        && Strings.isNullOrEmpty(builder.select_string)) {
      throw new InvalidCombinationException("Continuous query " 
          + builder.name + " needs either a selection query or a query "
          + "string.");
    }
    if (builder.select_query != null 
        && builder.select_query.intoTable() == null) {
      throw new IllegalArgumentException("The selection query of continuous "
          + "query " + builder.name + " needs an INTO table.");
    }
    name = builder.name;
    database = builder.database;
    select_query = builder.select_query;
    select_string = builder.select_string;
    every_interval = Strings.emptyToNull(builder.every_interval);
    for_interval = Strings.emptyToNull(builder.for_interval);
    rendered = render(name, database, resampleOptions(), select());
  }
  
  public String name() {
    return name;
  }
  
  public Database database() {
    return database;
  }
  
  /** @return The structured select or null if built from a string. */
  public SelectionQuery selectQuery() {
    return select_query;
  }
  
  /** @return The inner SELECT statement. */
  public String select() {
    return select_query != null ? select_query.render() : select_string;
  }
  
  /** @return The "EVERY x FOR y" part of the RESAMPLE clause or null if
   * neither interval is set. */
  public String resampleOptions() {
    if (every_interval == null && for_interval == null) {
      return null;
    }
    final StringBuilder buf = new StringBuilder();
    if (every_interval != null) {
      buf.append("EVERY ").append(every_interval);
    }
    if (for_interval != null) {
      if (buf.length() > 0) {
        buf.append(' ');
      }
      buf.append("FOR ").append(for_interval);
    }
    return buf.toString();
  }
  
  /** @return The CREATE CONTINUOUS QUERY statement. */
  public String render() {
    return rendered;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return rendered.equals(((ContinuousQuery) o).rendered);
  }
  
  @Override
  public int hashCode() {
    return rendered.hashCode();
  }
  
  @Override
  public String toString() {
    return rendered;
  }
  
  private static String render(final String name, 
                               final Database database, 
                               final String resample, 
                               final String select) {
    final String statement = "CREATE CONTINUOUS QUERY " + name + " ON " 
        + database.name() + " " 
        + (resample == null ? "" : "RESAMPLE " + resample) 
        + " BEGIN " + select + " END";
    return statement.replaceAll(" {2,}", " ");
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private String name;
    private Database database;
    private SelectionQuery select_query;
    private String select_string;
    private String every_interval;
    private String for_interval;
    
    public Builder setName(final String name) {
      this.name = name;
      return this;
    }
    
    public Builder setDatabase(final Database database) {
      this.database = database;
      return this;
    }
    
    public Builder setSelectQuery(final SelectionQuery select_query) {
      this.select_query = select_query;
      return this;
    }
    
    public Builder setSelectString(final String select_string) {
      this.select_string = select_string;
      return this;
    }
    
    public Builder setEveryInterval(final String every_interval) {
      this.every_interval = every_interval;
      return this;
    }
    
    public Builder setForInterval(final String for_interval) {
      this.for_interval = for_interval;
      return this;
    }
    
    public ContinuousQuery build() {
      return new ContinuousQuery(this);
    }
  }
}
