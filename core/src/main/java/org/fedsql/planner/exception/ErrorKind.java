/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.exception;

/** Reasons a statement cannot be planned. */
public enum ErrorKind {
  UNKNOWN_INTEGRATION,
  AMBIGUOUS_COLUMN,
  UNRESOLVED_COLUMN,
  DUAL_PREDICTOR_JOIN,
  UNSUPPORTED_PREDICTOR_QUERY,
  CONFLICTING_ORDER_BY,
  UNSUPPORTED_STATEMENT,
  UNSUPPORTED_JOIN_OPERAND
}
