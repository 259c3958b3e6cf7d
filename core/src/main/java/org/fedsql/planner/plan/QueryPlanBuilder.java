/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan;

import java.util.ArrayList;
import java.util.List;
import org.fedsql.common.utils.StringUtils;

/** Append-only arena the planner writes steps into while it walks a statement. */
public class QueryPlanBuilder {

  private final List<PlanStep> steps = new ArrayList<>();

  /**
   * Append a step and return the handle of its output.
   *
   * @throws IllegalStateException if the step consumes a result that is not already in the plan
   */
  public StepResult add(PlanStep step) {
    for (StepResult input : step.getInputs()) {
      if (input.stepNum() < 0 || input.stepNum() >= steps.size()) {
        throw new IllegalStateException(
            StringUtils.format(
                "Step %s consumes %s before it is produced",
                step.getClass().getSimpleName(), input.getRefName()));
      }
    }
    steps.add(step);
    return new StepResult(steps.size() - 1);
  }

  public int size() {
    return steps.size();
  }

  public QueryPlan build() {
    return new QueryPlan(steps);
  }
}
