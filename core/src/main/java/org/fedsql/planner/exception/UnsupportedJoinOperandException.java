/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.exception;

/** Join side that is neither a table reference nor a supported derived table. */
public class UnsupportedJoinOperandException extends PlanningException {

  public UnsupportedJoinOperandException(String message) {
    super(ErrorKind.UNSUPPORTED_JOIN_OPERAND, message);
  }
}
