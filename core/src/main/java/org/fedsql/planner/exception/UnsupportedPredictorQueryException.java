/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.exception;

/** The query shape cannot be answered by the predictor it selects from. */
public class UnsupportedPredictorQueryException extends PlanningException {

  public UnsupportedPredictorQueryException(String message) {
    super(ErrorKind.UNSUPPORTED_PREDICTOR_QUERY, message);
  }
}
