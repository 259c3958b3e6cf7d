/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan.step;

import java.util.List;
import org.fedsql.ast.expression.UnresolvedExpression;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.PlanStepVisitor;
import org.fedsql.planner.plan.StepResult;

/** Keep the rows of a dataframe matching a condition. */
public record FilterStep(StepResult dataframe, UnresolvedExpression query) implements PlanStep {

  @Override
  public List<StepResult> getInputs() {
    return List.of(dataframe);
  }

  @Override
  public <R, C> R accept(PlanStepVisitor<R, C> visitor, C context) {
    return visitor.visitFilter(this, context);
  }
}
