/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.predictor;

import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;
import org.fedsql.ast.expression.BetweenOperation;
import org.fedsql.ast.expression.BinaryOperation;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.ast.expression.UnresolvedExpression;
import org.fedsql.common.utils.StringUtils;
import org.fedsql.planner.exception.UnsupportedPredictorQueryException;

/**
 * Helpers for the WHERE clause of a query over a time-series predictor. The time filter is the
 * comparison against the ordering column of the predictor.
 */
public final class TimeFilters {

  private static final Set<String> ALLOWED_OPERATORS =
      ImmutableSet.of("and", "=", ">", ">=", "<", "<=");

  private TimeFilters() {}

  /**
   * Check that a condition only compares the given columns, with AND as its only connective.
   *
   * @param condition WHERE clause, may be null
   * @param allowedColumns lower-cased column names
   * @throws UnsupportedPredictorQueryException otherwise
   */
  public static void validate(UnresolvedExpression condition, Set<String> allowedColumns) {
    if (condition == null) {
      return;
    }
    List<UnresolvedExpression> operands;
    if (condition instanceof BinaryOperation) {
      BinaryOperation operation = (BinaryOperation) condition;
      if (!ALLOWED_OPERATORS.contains(operation.getOp())) {
        throw unsupported(condition);
      }
      operands = List.of(operation.getLeft(), operation.getRight());
    } else if (condition instanceof BetweenOperation) {
      BetweenOperation between = (BetweenOperation) condition;
      operands = List.of(between.getValue(), between.getFrom(), between.getTo());
    } else {
      throw unsupported(condition);
    }
    for (UnresolvedExpression operand : operands) {
      if (operand instanceof Identifier) {
        String column = StringUtils.toLowerCase(((Identifier) operand).getLastPart());
        if (!allowedColumns.contains(column)) {
          throw new UnsupportedPredictorQueryException(
              StringUtils.format(
                  "Column %s cannot be filtered on when querying a time series predictor. "
                      + "Allowed columns: %s",
                  operand,
                  String.join(", ", allowedColumns)));
        }
      } else if (operand instanceof BinaryOperation || operand instanceof BetweenOperation) {
        validate(operand, allowedColumns);
      }
    }
  }

  /**
   * Find the time filter: the first comparison, in pre-order over the AND tree, that has the
   * ordering column as a direct operand.
   *
   * @return the filter node itself, or null
   */
  public static UnresolvedExpression find(UnresolvedExpression condition, String timeColumn) {
    if (condition instanceof BinaryOperation && ((BinaryOperation) condition).isOp("and")) {
      BinaryOperation and = (BinaryOperation) condition;
      UnresolvedExpression left = find(and.getLeft(), timeColumn);
      return left != null ? left : find(and.getRight(), timeColumn);
    }
    if (condition instanceof BinaryOperation) {
      BinaryOperation operation = (BinaryOperation) condition;
      boolean compared =
          isColumn(operation.getLeft(), timeColumn) || isColumn(operation.getRight(), timeColumn);
      return compared ? condition : null;
    }
    if (condition instanceof BetweenOperation) {
      return isColumn(((BetweenOperation) condition).getValue(), timeColumn) ? condition : null;
    }
    return null;
  }

  /** Replace the filter node, matched by identity, within the AND tree of a condition. */
  public static UnresolvedExpression replace(
      UnresolvedExpression condition,
      UnresolvedExpression filter,
      UnresolvedExpression replacement) {
    if (condition == filter) {
      return replacement;
    }
    if (condition instanceof BinaryOperation && ((BinaryOperation) condition).isOp("and")) {
      BinaryOperation and = (BinaryOperation) condition;
      return new BinaryOperation(
          "and",
          replace(and.getLeft(), filter, replacement),
          replace(and.getRight(), filter, replacement),
          and.getAlias());
    }
    return condition;
  }

  /** Remove the filter node, matched by identity, from the AND tree of a condition. */
  public static UnresolvedExpression remove(
      UnresolvedExpression condition, UnresolvedExpression filter) {
    if (condition == filter) {
      return null;
    }
    if (condition instanceof BinaryOperation && ((BinaryOperation) condition).isOp("and")) {
      BinaryOperation and = (BinaryOperation) condition;
      return BinaryOperation.conjoin(remove(and.getLeft(), filter), remove(and.getRight(), filter));
    }
    return condition;
  }

  private static boolean isColumn(UnresolvedExpression expression, String column) {
    return expression instanceof Identifier
        && StringUtils.equalsIgnoreCase(((Identifier) expression).getLastPart(), column);
  }

  private static UnsupportedPredictorQueryException unsupported(UnresolvedExpression condition) {
    return new UnsupportedPredictorQueryException(
        StringUtils.format(
            "For time series predictors only the following operations are supported: "
                + "and, =, >, >=, <, <=, between. Found: %s",
            condition));
  }
}
