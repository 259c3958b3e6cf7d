/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan.step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.PlanStepVisitor;
import org.fedsql.planner.plan.StepResult;

/** Run a predictor over a single row given as column to value, in WHERE clause order. */
public record ApplyPredictorRowStep(
    String namespace, Identifier predictor, Map<String, Object> rowDict) implements PlanStep {

  public ApplyPredictorRowStep {
    rowDict = Collections.unmodifiableMap(new LinkedHashMap<>(rowDict));
  }

  @Override
  public List<StepResult> getInputs() {
    return List.of();
  }

  @Override
  public <R, C> R accept(PlanStepVisitor<R, C> visitor, C context) {
    return visitor.visitApplyPredictorRow(this, context);
  }
}
