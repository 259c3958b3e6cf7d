/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan;

import com.google.common.base.Strings;
import java.util.List;
import java.util.stream.Collectors;
import org.fedsql.ast.Node;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.common.utils.StringUtils;
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

/** Renders a step as one line of text. The context is the indent level of nested steps. */
class PlanPrinter implements PlanStepVisitor<String, Integer> {

  @Override
  public String visitFetchDataframe(FetchDataframeStep step, Integer indent) {
    return line(indent, "FetchDataframe", "integration=" + step.integration(), step.query());
  }

  @Override
  public String visitProject(ProjectStep step, Integer indent) {
    return line(indent, "Project", step.dataframe(), "columns=[" + nodes(step.columns()) + "]");
  }

  @Override
  public String visitJoin(JoinStep step, Integer indent) {
    return line(indent, "Join", step.left() + ", " + step.right(), step.query());
  }

  @Override
  public String visitFilter(FilterStep step, Integer indent) {
    return line(indent, "Filter", step.dataframe(), step.query());
  }

  @Override
  public String visitGroupBy(GroupByStep step, Integer indent) {
    return line(
        indent,
        "GroupBy",
        step.dataframe(),
        "columns=[" + nodes(step.columns()) + "] targets=[" + nodes(step.targets()) + "]");
  }

  @Override
  public String visitOrderBy(OrderByStep step, Integer indent) {
    return line(indent, "OrderBy", step.dataframe(), nodes(step.orderBy()));
  }

  @Override
  public String visitLimitOffset(LimitOffsetStep step, Integer indent) {
    return line(
        indent,
        "LimitOffset",
        step.dataframe(),
        "limit=" + step.limit() + " offset=" + step.offset());
  }

  @Override
  public String visitUnion(UnionStep step, Integer indent) {
    return line(
        indent, "Union", step.left() + ", " + step.right(), step.unique() ? "unique" : "all");
  }

  @Override
  public String visitApplyPredictor(ApplyPredictorStep step, Integer indent) {
    return line(
        indent, "ApplyPredictor", step.dataframe(), predictor(step.namespace(), step.predictor()));
  }

  @Override
  public String visitApplyPredictorRow(ApplyPredictorRowStep step, Integer indent) {
    return line(
        indent,
        "ApplyPredictorRow",
        predictor(step.namespace(), step.predictor()),
        "row=" + step.rowDict());
  }

  @Override
  public String visitApplyTimeseriesPredictor(ApplyTimeseriesPredictorStep step, Integer indent) {
    return line(
        indent,
        "ApplyTimeseriesPredictor",
        step.dataframe(),
        predictor(step.namespace(), step.predictor())
            + " output_time_filter="
            + step.outputTimeFilter());
  }

  @Override
  public String visitMapReduce(MapReduceStep step, Integer indent) {
    return line(indent, "MapReduce", step.values(), "reduce=" + step.reduce())
        + "\n"
        + step.step().accept(this, indent + 1);
  }

  @Override
  public String visitMultipleSteps(MultipleSteps step, Integer indent) {
    StringBuilder sb =
        new StringBuilder(line(indent, "MultipleSteps", "reduce=" + step.reduce(), ""));
    for (PlanStep nested : step.steps()) {
      sb.append('\n').append(nested.accept(this, indent + 1));
    }
    return sb.toString();
  }

  @Override
  public String visitSaveToTable(SaveToTableStep step, Integer indent) {
    return line(
        indent,
        "SaveToTable",
        step.dataframe(),
        "table=" + step.table().getPath() + (step.replace() ? " replace" : ""));
  }

  @Override
  public String visitGetPredictorColumns(GetPredictorColumnsStep step, Integer indent) {
    return line(indent, "GetPredictorColumns", predictor(step.namespace(), step.predictor()), "");
  }

  private static String line(int indent, String kind, Object inputs, Object payload) {
    String text =
        StringUtils.format("%s%s(%s) %s", Strings.repeat("  ", indent), kind, inputs, payload);
    return text.stripTrailing();
  }

  private static String predictor(String namespace, Identifier predictor) {
    return namespace + "." + predictor.getPath();
  }

  private static String nodes(List<? extends Node> nodes) {
    return nodes.stream().map(Node::toString).collect(Collectors.joining(", "));
  }
}
