/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.exception;

/** Both sides of a join are predictors. */
public class DualPredictorJoinException extends PlanningException {

  public DualPredictorJoinException(String message) {
    super(ErrorKind.DUAL_PREDICTOR_JOIN, message);
  }
}
