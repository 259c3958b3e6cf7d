/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan.step;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.fedsql.ast.expression.UnresolvedExpression;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.PlanStepVisitor;
import org.fedsql.planner.plan.StepResult;

/**
 * Group a dataframe. {@code targets} are the select targets without aliases, so the executor can
 * evaluate the aggregates before projection renames them.
 */
public record GroupByStep(
    StepResult dataframe, List<UnresolvedExpression> columns, List<UnresolvedExpression> targets)
    implements PlanStep {

  public GroupByStep {
    columns = ImmutableList.copyOf(columns);
    targets = ImmutableList.copyOf(targets);
  }

  @Override
  public List<StepResult> getInputs() {
    return List.of(dataframe);
  }

  @Override
  public <R, C> R accept(PlanStepVisitor<R, C> visitor, C context) {
    return visitor.visitGroupBy(this, context);
  }
}
