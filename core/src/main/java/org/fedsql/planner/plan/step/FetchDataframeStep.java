/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan.step;

import java.util.List;
import org.fedsql.ast.statement.Select;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.PlanStepVisitor;
import org.fedsql.planner.plan.StepResult;

/** Run a query that references a single integration and fetch its rows. */
public record FetchDataframeStep(String integration, Select query) implements PlanStep {

  @Override
  public List<StepResult> getInputs() {
    return List.of();
  }

  @Override
  public <R, C> R accept(PlanStepVisitor<R, C> visitor, C context) {
    return visitor.visitFetchDataframe(this, context);
  }
}
