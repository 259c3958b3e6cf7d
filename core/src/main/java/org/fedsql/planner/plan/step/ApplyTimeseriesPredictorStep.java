/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan.step;

import java.util.List;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.ast.expression.UnresolvedExpression;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.PlanStepVisitor;
import org.fedsql.planner.plan.StepResult;

/**
 * Run a time-series predictor over historical rows. {@code outputTimeFilter} is the time filter
 * of the original query, used by the executor to pick which forecast rows to return; it is null
 * when the query had none.
 */
public record ApplyTimeseriesPredictorStep(
    String namespace,
    Identifier predictor,
    StepResult dataframe,
    UnresolvedExpression outputTimeFilter)
    implements PlanStep {

  @Override
  public List<StepResult> getInputs() {
    return List.of(dataframe);
  }

  @Override
  public <R, C> R accept(PlanStepVisitor<R, C> visitor, C context) {
    return visitor.visitApplyTimeseriesPredictor(this, context);
  }
}
