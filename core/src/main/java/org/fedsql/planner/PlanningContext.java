/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.fedsql.ast.Node;
import org.fedsql.ast.SqlFormatter;
import org.fedsql.ast.expression.Constant;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.ast.expression.Star;
import org.fedsql.ast.expression.UnresolvedExpression;
import org.fedsql.ast.statement.Select;
import org.fedsql.planner.config.PredictorMetadata;
import org.fedsql.planner.config.PredictorMetadataProvider;
import org.fedsql.planner.exception.UnsupportedStatementException;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.QueryPlanBuilder;
import org.fedsql.planner.plan.StepResult;
import org.fedsql.planner.plan.step.FetchDataframeStep;
import org.fedsql.planner.plan.step.FilterStep;
import org.fedsql.planner.plan.step.GroupByStep;
import org.fedsql.planner.plan.step.LimitOffsetStep;
import org.fedsql.planner.plan.step.OrderByStep;
import org.fedsql.planner.plan.step.ProjectStep;
import org.fedsql.planner.resolver.IdentifierResolver;
import org.fedsql.planner.resolver.PredictorRelation;
import org.fedsql.planner.resolver.SourceTable;
import org.fedsql.planner.rewriter.StatementRewriter;

/** State of one planning run: the plan being built and the collaborators that fill it. */
@Getter
@RequiredArgsConstructor
public class PlanningContext {

  private final IdentifierResolver resolver;

  private final StatementRewriter rewriter;

  private final PredictorMetadataProvider metadataProvider;

  private final QueryPlanBuilder plan = new QueryPlanBuilder();

  public StepResult add(PlanStep step) {
    return plan.add(step);
  }

  /**
   * Build, without adding it to the plan, the step fetching a select from the integration of its
   * innermost FROM table.
   */
  public FetchDataframeStep integrationSelectStep(Select select) {
    Node from = select.getFromTable();
    while (from instanceof Select) {
      from = ((Select) from).getFromTable();
    }
    if (!(from instanceof Identifier)) {
      throw new UnsupportedStatementException(
          "Only a single table can be pushed down to an integration: " + select);
    }
    SourceTable table = resolver.resolveSourceTable((Identifier) from);
    return new FetchDataframeStep(table.integration(), rewriter.rewrite(select, table));
  }

  /** Select that can be fully executed in one integration. */
  public StepResult planIntegrationSelect(Select select) {
    return add(integrationSelectStep(select));
  }

  /**
   * Project the select targets. Identifiers, stars and constants pass through; any other target
   * becomes a column named after its SQL text, keeping its alias.
   */
  public StepResult planProject(List<UnresolvedExpression> targets, StepResult dataframe) {
    List<UnresolvedExpression> columns =
        targets.stream()
            .map(
                target ->
                    target instanceof Identifier
                            || target instanceof Star
                            || target instanceof Constant
                        ? target
                        : new Identifier(
                            List.of(SqlFormatter.formatWithoutAlias(target)), target.getAlias()))
            .collect(Collectors.toList());
    return add(new ProjectStep(dataframe, columns));
  }

  /**
   * Apply WHERE, GROUP BY, HAVING, ORDER BY and LIMIT/OFFSET of a query, in this order, to a
   * dataframe the executor already holds.
   */
  public StepResult planClauseTail(Select query, StepResult dataframe) {
    StepResult last = dataframe;
    if (query.getWhere() != null) {
      last = add(new FilterStep(last, query.getWhere()));
    }
    if (query.hasGroupBy()) {
      List<UnresolvedExpression> targets =
          query.getTargets().stream().map(t -> t.withAlias(null)).collect(Collectors.toList());
      last = add(new GroupByStep(last, query.getGroupBy(), targets));
    }
    if (query.getHaving() != null) {
      last = add(new FilterStep(last, query.getHaving()));
    }
    if (query.hasOrderBy()) {
      last = add(new OrderByStep(last, query.getOrderBy()));
    }
    if (query.getLimit() != null || query.getOffset() != null) {
      last = add(new LimitOffsetStep(last, query.getLimit(), query.getOffset()));
    }
    return last;
  }

  public PredictorMetadata getPredictorMetadata(PredictorRelation predictor) {
    return metadataProvider
        .getPredictorMetadata(predictor.getMetadataKey())
        .orElse(PredictorMetadata.PLAIN);
  }
}
