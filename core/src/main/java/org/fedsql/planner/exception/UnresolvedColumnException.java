/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.exception;

/** A qualified column does not belong to any table in scope. */
public class UnresolvedColumnException extends PlanningException {

  public UnresolvedColumnException(String message) {
    super(ErrorKind.UNRESOLVED_COLUMN, message);
  }
}
