/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan.step;

import java.util.List;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.PlanStepVisitor;
import org.fedsql.planner.plan.StepResult;

/** Concatenate two dataframes; {@code unique} drops duplicate rows. */
public record UnionStep(StepResult left, StepResult right, boolean unique) implements PlanStep {

  @Override
  public List<StepResult> getInputs() {
    return List.of(left, right);
  }

  @Override
  public <R, C> R accept(PlanStepVisitor<R, C> visitor, C context) {
    return visitor.visitUnion(this, context);
  }
}
