/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.predictor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.fedsql.ast.expression.BinaryOperation;
import org.fedsql.ast.expression.Constant;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.ast.expression.Star;
import org.fedsql.ast.expression.UnresolvedExpression;
import org.fedsql.ast.statement.Select;
import org.fedsql.common.utils.StringUtils;
import org.fedsql.planner.PlanningContext;
import org.fedsql.planner.exception.UnsupportedPredictorQueryException;
import org.fedsql.planner.plan.StepResult;
import org.fedsql.planner.plan.step.ApplyPredictorRowStep;
import org.fedsql.planner.plan.step.ApplyPredictorStep;
import org.fedsql.planner.plan.step.GetPredictorColumnsStep;
import org.fedsql.planner.resolver.IdentifierResolver;
import org.fedsql.planner.resolver.PredictorRelation;

/** Plans queries over predictors that are not time-series predictors. */
@Log4j2
@RequiredArgsConstructor
public class PredictorPlanner {

  private final PlanningContext context;

  /**
   * Select directly from a predictor. The WHERE clause gives the single input row as {@code
   * column = constant} pairs, except for {@code WHERE 1 = 0} which asks for the predictor columns.
   *
   * @return output of the projection step
   */
  public StepResult planSelectFromPredictor(Select select) {
    PredictorRelation predictor =
        context.getResolver().resolvePredictor((Identifier) select.getFromTable());

    if (isColumnsQuery(select.getWhere())) {
      log.debug("Describing columns of predictor {}", predictor.getMetadataKey());
      StepResult columns =
          context.add(new GetPredictorColumnsStep(predictor.namespace(), predictor.predictor()));
      return context.planProject(select.getTargets(), columns);
    }

    List<UnresolvedExpression> targets = new ArrayList<>();
    for (UnresolvedExpression target : select.getTargets()) {
      if (target instanceof Identifier) {
        targets.add(IdentifierResolver.disambiguatePredictorColumn((Identifier) target, predictor));
      } else if (target instanceof Star || target instanceof Constant) {
        targets.add(target);
      } else {
        throw new UnsupportedPredictorQueryException(
            "Unsupported select target when querying a predictor: " + target);
      }
    }
    if (select.hasGroupBy() || select.getHaving() != null) {
      throw new UnsupportedPredictorQueryException(
          "Unsupported operation when querying predictor. Only WHERE is allowed and required.");
    }
    if (select.getWhere() == null) {
      throw new UnsupportedPredictorQueryException(
          "WHERE clause required when selecting from predictor");
    }

    Map<String, Object> row = new LinkedHashMap<>();
    extractColumnValues(select.getWhere(), row, predictor);
    StepResult applied =
        context.add(
            new ApplyPredictorRowStep(predictor.namespace(), predictor.predictor(), row));
    return context.planProject(targets, applied);
  }

  /**
   * Predictor joined with a table: fetch the table side with every clause of the query, then run
   * the predictor over the fetched rows.
   */
  public PredictorSteps planApply(Select query, Identifier table, PredictorRelation predictor) {
    Select pushdown =
        Select.builder()
            .targets(List.of(new Star()))
            .fromTable(table)
            .where(query.getWhere())
            .groupBy(query.getGroupBy())
            .having(query.getHaving())
            .orderBy(query.getOrderBy())
            .limit(query.getLimit())
            .offset(query.getOffset())
            .build();
    StepResult data = context.planIntegrationSelect(pushdown);
    StepResult applied =
        context.add(new ApplyPredictorStep(predictor.namespace(), predictor.predictor(), data));
    return new PredictorSteps(applied, data, null);
  }

  private static void extractColumnValues(
      UnresolvedExpression condition, Map<String, Object> row, PredictorRelation predictor) {
    if (condition instanceof BinaryOperation && ((BinaryOperation) condition).isOp("and")) {
      BinaryOperation and = (BinaryOperation) condition;
      extractColumnValues(and.getLeft(), row, predictor);
      extractColumnValues(and.getRight(), row, predictor);
      return;
    }
    if (!(condition instanceof BinaryOperation) || !((BinaryOperation) condition).isOp("=")) {
      throw new UnsupportedPredictorQueryException(
          "Only 'column = constant' pairs joined by AND are supported when selecting from a"
              + " predictor, found: "
              + condition);
    }
    BinaryOperation equals = (BinaryOperation) condition;
    if (!(equals.getLeft() instanceof Identifier) || !(equals.getRight() instanceof Constant)) {
      throw new UnsupportedPredictorQueryException(
          StringUtils.format(
              "The WHERE clause for selecting from a predictor must contain pairs"
                  + " 'column = constant', found: %s",
              condition));
    }
    String column =
        IdentifierResolver.disambiguatePredictorColumn((Identifier) equals.getLeft(), predictor)
            .getPath();
    if (row.containsKey(column)) {
      throw new UnsupportedPredictorQueryException("Multiple values provided for " + column);
    }
    row.put(column, ((Constant) equals.getRight()).getValue());
  }

  /** {@code 1 = 0}, sent by client libraries to learn the columns of a table. */
  private static boolean isColumnsQuery(UnresolvedExpression condition) {
    if (!(condition instanceof BinaryOperation)) {
      return false;
    }
    BinaryOperation operation = (BinaryOperation) condition;
    return operation.isOp("=")
        && isNumber(operation.getLeft(), 1)
        && isNumber(operation.getRight(), 0);
  }

  private static boolean isNumber(UnresolvedExpression expression, long expected) {
    if (!(expression instanceof Constant)) {
      return false;
    }
    Object value = ((Constant) expression).getValue();
    return value instanceof Number && ((Number) value).doubleValue() == expected;
  }
}
