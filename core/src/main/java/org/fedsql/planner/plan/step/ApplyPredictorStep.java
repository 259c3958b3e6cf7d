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

/** Run a predictor over every row of a dataframe. */
public record ApplyPredictorStep(String namespace, Identifier predictor, StepResult dataframe)
    implements PlanStep {

  @Override
  public List<StepResult> getInputs() {
    return List.of(dataframe);
  }

  @Override
  public <R, C> R accept(PlanStepVisitor<R, C> visitor, C context) {
    return visitor.visitApplyPredictor(this, context);
  }
}
