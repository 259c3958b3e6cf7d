/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.exception;

/** A bare column name could belong to more than one table of a join. */
public class AmbiguousColumnException extends PlanningException {

  public AmbiguousColumnException(String message) {
    super(ErrorKind.AMBIGUOUS_COLUMN, message);
  }
}
