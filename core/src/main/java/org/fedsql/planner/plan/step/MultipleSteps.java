/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan.step;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.PlanStepVisitor;
import org.fedsql.planner.plan.ReduceType;
import org.fedsql.planner.plan.StepResult;

/** Independent steps whose outputs are reduced into one dataframe. */
public record MultipleSteps(List<PlanStep> steps, ReduceType reduce) implements PlanStep {

  public MultipleSteps {
    steps = ImmutableList.copyOf(steps);
  }

  @Override
  public List<StepResult> getInputs() {
    return steps.stream()
        .flatMap(step -> step.getInputs().stream())
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public <R, C> R accept(PlanStepVisitor<R, C> visitor, C context) {
    return visitor.visitMultipleSteps(this, context);
  }
}
