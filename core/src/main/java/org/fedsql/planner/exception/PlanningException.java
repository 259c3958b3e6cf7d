/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.exception;

import lombok.Getter;

/**
 * Base exception for statements the planner rejects. Planning stops at the first violation, so
 * no partial plan is ever returned alongside it.
 */
@Getter
public abstract class PlanningException extends RuntimeException {

  private final ErrorKind kind;

  protected PlanningException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }
}
