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
package net.sppmon.exceptions;

/**
 * Query options were combined in a way the query language does not allow.
 * @since 1.0
 */
public final class InvalidCombinationException extends IllegalArgumentException {

  /**
   * Constructor.
   *
   * @param msg Message describing the problem.
   */
  public InvalidCombinationException(final String msg) {
    super(msg);
  }

  static final long serialVersionUID = 1618034428;

}
