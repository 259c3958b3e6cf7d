/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan.step;

import java.util.List;
import org.fedsql.ast.tree.Join;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.PlanStepVisitor;
import org.fedsql.planner.plan.StepResult;

/**
 * Join two dataframes. The join node describes both sides as they are visible to the executor,
 * i.e. with any integration prefix removed or replaced by the step result name.
 */
public record JoinStep(StepResult left, StepResult right, Join query) implements PlanStep {

  @Override
  public List<StepResult> getInputs() {
    return List.of(left, right);
  }

  @Override
  public <R, C> R accept(PlanStepVisitor<R, C> visitor, C context) {
    return visitor.visitJoin(this, context);
  }
}
