/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan.step;

import java.util.List;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.PlanStepVisitor;
import org.fedsql.planner.plan.StepResult;

/** Return an empty dataframe carrying the column names of a predictor. */
public record GetPredictorColumnsStep(String namespace, Identifier predictor) implements PlanStep {

  @Override
  public List<StepResult> getInputs() {
    return List.of();
  }

  @Override
  public <R, C> R accept(PlanStepVisitor<R, C> visitor, C context) {
    return visitor.visitGetPredictorColumns(this, context);
  }
}
