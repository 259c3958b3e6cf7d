/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan;

import org.fedsql.planner.plan.step.ApplyPredictorRowStep;
import org.fedsql.planner.plan.step.ApplyPredictorStep;
import org.fedsql.planner.plan.step.ApplyTimeseriesPredictorStep;
import org.fedsql.planner.plan.step.FetchDataframeStep;
import org.fedsql.planner.plan.step.FilterStep;
import org.fedsql.planner.plan.step.GetPredictorColumnsStep;
import org.fedsql.planner.plan.step.GroupByStep;
import org.fedsql.planner.plan.step.JoinStep;
import org.fedsql.planner.plan.step.LimitOffsetStep;
import org.fedsql.planner.plan.step.MapReduceStep;
import org.fedsql.planner.plan.step.MultipleSteps;
import org.fedsql.planner.plan.step.OrderByStep;
import org.fedsql.planner.plan.step.ProjectStep;
import org.fedsql.planner.plan.step.SaveToTableStep;
import org.fedsql.planner.plan.step.UnionStep;

/**
 * Visitor over plan steps. There are no default methods: an executor has to say what it does
 * with every step kind.
 */
public interface PlanStepVisitor<R, C> {

  R visitFetchDataframe(FetchDataframeStep step, C context);

  R visitProject(ProjectStep step, C context);

  R visitJoin(JoinStep step, C context);

  R visitFilter(FilterStep step, C context);

  R visitGroupBy(GroupByStep step, C context);

  R visitOrderBy(OrderByStep step, C context);

  R visitLimitOffset(LimitOffsetStep step, C context);

  R visitUnion(UnionStep step, C context);

  R visitApplyPredictor(ApplyPredictorStep step, C context);

  R visitApplyPredictorRow(ApplyPredictorRowStep step, C context);

  R visitApplyTimeseriesPredictor(ApplyTimeseriesPredictorStep step, C context);

  R visitMapReduce(MapReduceStep step, C context);

  R visitMultipleSteps(MultipleSteps step, C context);

  R visitSaveToTable(SaveToTableStep step, C context);

  R visitGetPredictorColumns(GetPredictorColumnsStep step, C context);
}
