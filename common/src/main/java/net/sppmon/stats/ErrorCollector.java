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
package net.sppmon.stats;

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

/**
 * Accumulates recoverable errors of a run so they can be reported at the
 * end. Every message is logged at ERROR when recorded.
 * <p>
 * Not thread-safe, one instance is shared by the components of a run.
 * 
 * @since 1.0
 */
public class ErrorCollector {
  private static final Logger LOG = LoggerFactory.getLogger(
      ErrorCollector.class);

  private final List<String> errors = Lists.newArrayList();
  
  /**
   * Records and logs a message.
   * @param message The message, may be null.
   */
  public void errorMessage(final String message) {
    LOG.error(message);
    errors.add(message);
  }
  
  /**
   * Records and logs an exception with some context.
   * @param error The exception, may be null.
   * @param extra_message Optional context, may be null.
   */
  public void exceptionInfo(final Throwable error, final String extra_message) {
    final StringBuilder buf = new StringBuilder();
    if (extra_message != null) {
      buf.append(extra_message);
    }
    if (error != null) {
      if (buf.length() > 0) {
        buf.append(": ");
      }
      buf.append(error.getClass().getSimpleName())
         .append(": ")
         .append(error.getMessage());
    }
    final String message = buf.toString();
    LOG.error(message, error);
    errors.add(message);
  }
  
  /** @return A read-only copy of the messages recorded so far. */
  public List<String> errors() {
    return Collections.unmodifiableList(Lists.newArrayList(errors));
  }
  
  /** @return The number of errors recorded so far. */
  public int count() {
    return errors.size();
  }
  
  /** Logs the tally, at WARN if anything went wrong. */
  public void logSummary() {
    if (errors.isEmpty()) {
      LOG.info("Finished without errors.");
      return;
    }
    LOG.warn("Finished with " + errors.size() + " error(s):");
    for (final String error : errors) {
      LOG.warn("  " + error);
    }
  }
}
