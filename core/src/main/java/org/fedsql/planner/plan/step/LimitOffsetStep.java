/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan.step;

import java.util.List;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.PlanStepVisitor;
import org.fedsql.planner.plan.StepResult;

/** Slice a dataframe. Either bound may be null. */
public record LimitOffsetStep(StepResult dataframe, Integer limit, Integer offset)
    implements PlanStep {

  @Override
  public List<StepResult> getInputs() {
    return List.of(dataframe);
  }

  @Override
  public <R, C> R accept(PlanStepVisitor<R, C> visitor, C context) {
    return visitor.visitLimitOffset(this, context);
  }
}
