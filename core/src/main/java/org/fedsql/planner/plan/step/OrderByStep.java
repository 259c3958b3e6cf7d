/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan.step;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.fedsql.ast.expression.OrderBy;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.PlanStepVisitor;
import org.fedsql.planner.plan.StepResult;

/** Sort a dataframe. */
public record OrderByStep(StepResult dataframe, List<OrderBy> orderBy) implements PlanStep {

  public OrderByStep {
    orderBy = ImmutableList.copyOf(orderBy);
  }

  @Override
  public List<StepResult> getInputs() {
    return List.of(dataframe);
  }

  @Override
  public <R, C> R accept(PlanStepVisitor<R, C> visitor, C context) {
    return visitor.visitOrderBy(this, context);
  }
}
