/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.exception;

/** Statement shape the planner does not handle. */
public class UnsupportedStatementException extends PlanningException {

  public UnsupportedStatementException(String message) {
    super(ErrorKind.UNSUPPORTED_STATEMENT, message);
  }
}
