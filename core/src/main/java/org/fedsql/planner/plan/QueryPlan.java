/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.fedsql.common.utils.StringUtils;

/**
 * Ordered list of plan steps. A step refers to the output of another step through a {@link
 * StepResult} holding that step's position, and only to steps placed before it.
 */
public class QueryPlan {

  private final List<PlanStep> steps;

  public QueryPlan(List<PlanStep> steps) {
    this.steps = ImmutableList.copyOf(steps);
  }

  /** Returns all steps in execution order. */
  public List<PlanStep> getSteps() {
    return steps;
  }

  public PlanStep getStep(StepResult result) {
    return steps.get(result.stepNum());
  }

  /** Returns the handle of the last step, whose output is the query result. */
  public StepResult getResult() {
    if (steps.isEmpty()) {
      throw new IllegalStateException("QueryPlan has no steps");
    }
    return new StepResult(steps.size() - 1);
  }

  public int size() {
    return steps.size();
  }

  /**
   * Validates the plan. Returns a list of validation errors, or empty list if valid.
   *
   * @return list of error messages
   */
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    if (steps.isEmpty()) {
      errors.add("Plan must have at least one step");
    }
    for (int i = 0; i < steps.size(); i++) {
      for (StepResult input : steps.get(i).getInputs()) {
        if (input.stepNum() < 0 || input.stepNum() >= i) {
          errors.add(
              StringUtils.format(
                  "Step %d references %s which is not an earlier step", i, input.getRefName()));
        }
      }
    }
    return errors;
  }

  /** One line per step: position, kind, inputs and payload. */
  public String explain() {
    StringBuilder sb = new StringBuilder();
    PlanPrinter printer = new PlanPrinter();
    for (int i = 0; i < steps.size(); i++) {
      sb.append(i).append(": ").append(steps.get(i).accept(printer, 0)).append('\n');
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return explain();
  }
}
