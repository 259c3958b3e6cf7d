/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.predictor;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.fedsql.ast.expression.BetweenOperation;
import org.fedsql.ast.expression.BinaryOperation;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.ast.expression.Latest;
import org.fedsql.ast.expression.NullConstant;
import org.fedsql.ast.expression.OrderBy;
import org.fedsql.ast.expression.PartitionValue;
import org.fedsql.ast.expression.Star;
import org.fedsql.ast.expression.UnresolvedExpression;
import org.fedsql.ast.statement.Select;
import org.fedsql.common.utils.StringUtils;
import org.fedsql.planner.PlanningContext;
import org.fedsql.planner.config.PredictorMetadata;
import org.fedsql.planner.exception.ConflictingOrderByException;
import org.fedsql.planner.exception.UnsupportedPredictorQueryException;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.ReduceType;
import org.fedsql.planner.plan.StepResult;
import org.fedsql.planner.plan.step.ApplyTimeseriesPredictorStep;
import org.fedsql.planner.plan.step.MapReduceStep;
import org.fedsql.planner.plan.step.MultipleSteps;
import org.fedsql.planner.resolver.PredictorRelation;

/**
 * Plans a time-series predictor joined with a table. The predictor needs, for every series, the
 * most recent rows before the requested period (up to its window) in addition to the rows of the
 * period itself, newest first.
 */
@Log4j2
@RequiredArgsConstructor
public class TimeSeriesPredictorPlanner {

  private final PlanningContext context;

  /**
   * Plan the data fetch and predictor application.
   *
   * @param query query joining the predictor
   * @param table table side of the join
   * @param predictor predictor side of the join
   * @param metadata time-series metadata of the predictor
   * @return predictor and data steps; the query limit is returned to be applied after the join
   */
  public PredictorSteps plan(
      Select query, Identifier table, PredictorRelation predictor, PredictorMetadata metadata) {
    String timeColumn = metadata.getOrderByColumn();
    List<String> groupByColumns = metadata.getGroupByColumns();
    int window = metadata.getWindow();

    if (query.hasOrderBy()) {
      throw new ConflictingOrderByException(
          StringUtils.format(
              "Can't provide ORDER BY to time series predictor %s, it is ordered by %s",
              predictor.getMetadataKey(),
              timeColumn));
    }
    if (query.hasGroupBy() || query.getHaving() != null || query.getOffset() != null) {
      throw new UnsupportedPredictorQueryException(
          "Unsupported query to time series predictor: " + query);
    }

    Set<String> allowedColumns =
        ImmutableSet.<String>builder()
            .add(StringUtils.toLowerCase(timeColumn))
            .addAll(groupByColumns.stream().map(StringUtils::toLowerCase).iterator())
            .build();
    UnresolvedExpression where = query.getWhere();
    TimeFilters.validate(where, allowedColumns);
    UnresolvedExpression timeFilter = TimeFilters.find(where, timeColumn);

    List<Select> pushdowns = pushdowns(table, where, timeFilter, timeColumn, window);
    if (!groupByColumns.isEmpty()) {
      pushdowns =
          pushdowns.stream()
              .map(select -> partitioned(select, groupByColumns))
              .collect(Collectors.toList());
    }
    log.debug(
        "Time filter {} of predictor {} needs {} pushdown(s)",
        timeFilter,
        predictor.getMetadataKey(),
        pushdowns.size());

    PlanStep fetch;
    if (pushdowns.size() == 1) {
      fetch = context.integrationSelectStep(pushdowns.get(0));
    } else {
      List<PlanStep> steps = new ArrayList<>();
      for (Select pushdown : pushdowns) {
        steps.add(context.integrationSelectStep(pushdown));
      }
      fetch = new MultipleSteps(steps, ReduceType.UNION);
    }

    StepResult data;
    if (groupByColumns.isEmpty()) {
      data = context.add(fetch);
    } else {
      StepResult partitions =
          context.planIntegrationSelect(
              Select.builder()
                  .distinct(true)
                  .targets(
                      groupByColumns.stream()
                          .<UnresolvedExpression>map(Identifier::of)
                          .collect(Collectors.toList()))
                  .fromTable(table)
                  .where(TimeFilters.remove(where, timeFilter))
                  .build());
      data = context.add(new MapReduceStep(partitions, ReduceType.UNION, fetch));
    }

    StepResult applied =
        context.add(
            new ApplyTimeseriesPredictorStep(
                predictor.namespace(), predictor.predictor(), data, timeFilter));
    return new PredictorSteps(applied, data, query.getLimit());
  }

  /** Selects fetching the rows the predictor needs, by shape of the time filter. */
  private List<Select> pushdowns(
      Identifier table,
      UnresolvedExpression where,
      UnresolvedExpression timeFilter,
      String timeColumn,
      int window) {
    if (timeFilter instanceof BetweenOperation) {
      UnresolvedExpression before =
          new BinaryOperation(
              "<", Identifier.of(timeColumn), ((BetweenOperation) timeFilter).getFrom());
      return List.of(
          pushdown(table, TimeFilters.replace(where, timeFilter, before), timeColumn, window),
          pushdown(table, where, timeColumn, null));
    }
    if (timeFilter instanceof BinaryOperation) {
      BinaryOperation comparison = (BinaryOperation) timeFilter;
      if (comparison.isOp(">") && comparison.getRight() instanceof Latest) {
        Select latest = pushdown(table, where, timeColumn, window);
        return List.of(
            latest.toBuilder().where(TimeFilters.remove(latest.getWhere(), timeFilter)).build());
      }
      if (comparison.isOp(">") || comparison.isOp(">=")) {
        String complement = comparison.isOp(">") ? "<=" : "<";
        UnresolvedExpression before =
            new BinaryOperation(complement, Identifier.of(timeColumn), comparison.getRight());
        return List.of(
            pushdown(table, TimeFilters.replace(where, timeFilter, before), timeColumn, window),
            pushdown(table, where, timeColumn, null));
      }
    }
    return List.of(pushdown(table, where, timeColumn, null));
  }

  /** Newest rows first, skipping rows without a time value. */
  private static Select pushdown(
      Identifier table, UnresolvedExpression where, String timeColumn, Integer limit) {
    UnresolvedExpression notNull =
        new BinaryOperation("is not", Identifier.of(timeColumn), new NullConstant());
    return Select.builder()
        .targets(List.of(new Star()))
        .fromTable(table)
        .where(BinaryOperation.conjoin(where, notNull))
        .orderBy(List.of(new OrderBy(Identifier.of(timeColumn), OrderBy.Direction.DESC)))
        .limit(limit)
        .build();
  }

  /** Restrict a pushdown to one series; the executor fills in the partition values. */
  private static Select partitioned(Select select, List<String> groupByColumns) {
    UnresolvedExpression where = select.getWhere();
    for (String column : groupByColumns) {
      where =
          BinaryOperation.conjoin(
              where, new BinaryOperation("=", Identifier.of(column), new PartitionValue(column)));
    }
    return select.toBuilder().where(where).build();
  }
}
