/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.exception;

/** ORDER BY on a query over a time-series predictor, whose output order is fixed. */
public class ConflictingOrderByException extends PlanningException {

  public ConflictingOrderByException(String message) {
    super(ErrorKind.CONFLICTING_ORDER_BY, message);
  }
}
