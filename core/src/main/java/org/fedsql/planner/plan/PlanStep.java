/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan;

import java.util.List;

/** One executable unit of a {@link QueryPlan}. */
public interface PlanStep {

  /** Results of earlier steps this step consumes. */
  List<StepResult> getInputs();

  <R, C> R accept(PlanStepVisitor<R, C> visitor, C context);
}
