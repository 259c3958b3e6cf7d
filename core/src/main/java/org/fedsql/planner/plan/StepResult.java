/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan;

/**
 * Handle to the output of a plan step. The number is the position of the producing step in its
 * {@link QueryPlan}.
 */
public record StepResult(int stepNum) {

  /** Name under which the executor exposes the step output to later SQL payloads. */
  public String getRefName() {
    return "result_" + stepNum;
  }

  @Override
  public String toString() {
    return getRefName();
  }
}
