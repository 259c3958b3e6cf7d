/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.exception;

/** A table reference does not start with a known integration or the predictor namespace. */
public class UnknownIntegrationException extends PlanningException {

  public UnknownIntegrationException(String message) {
    super(ErrorKind.UNKNOWN_INTEGRATION, message);
  }
}
