/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan.step;

import java.util.List;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.PlanStepVisitor;
import org.fedsql.planner.plan.ReduceType;
import org.fedsql.planner.plan.StepResult;

/**
 * Run {@code step} once per row of {@code values}, substituting the row into the partition
 * placeholders of the step, and reduce the outputs. The wrapped step is not part of the plan
 * sequence itself.
 */
public record MapReduceStep(StepResult values, ReduceType reduce, PlanStep step)
    implements PlanStep {

  @Override
  public List<StepResult> getInputs() {
    return List.of(values);
  }

  @Override
  public <R, C> R accept(PlanStepVisitor<R, C> visitor, C context) {
    return visitor.visitMapReduce(this, context);
  }
}
