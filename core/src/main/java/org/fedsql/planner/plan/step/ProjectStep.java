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

/** Select the output columns of a dataframe, keeping their aliases. */
public record ProjectStep(StepResult dataframe, List<UnresolvedExpression> columns)
    implements PlanStep {

  public ProjectStep {
    columns = ImmutableList.copyOf(columns);
  }

  @Override
  public List<StepResult> getInputs() {
    return List.of(dataframe);
  }

  @Override
  public <R, C> R accept(PlanStepVisitor<R, C> visitor, C context) {
    return visitor.visitProject(this, context);
  }
}
