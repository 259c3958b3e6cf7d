/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.fedsql.ast.AstTransformer;
import org.fedsql.ast.Node;
import org.fedsql.ast.expression.BinaryOperation;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.ast.expression.OrderBy;
import org.fedsql.ast.expression.Star;
import org.fedsql.ast.expression.UnresolvedExpression;
import org.fedsql.ast.statement.Select;
import org.fedsql.ast.tree.Join;
import org.fedsql.common.utils.StringUtils;
import org.fedsql.planner.config.PredictorMetadata;
import org.fedsql.planner.exception.AmbiguousColumnException;
import org.fedsql.planner.exception.DualPredictorJoinException;
import org.fedsql.planner.exception.UnresolvedColumnException;
import org.fedsql.planner.exception.UnsupportedJoinOperandException;
import org.fedsql.planner.plan.StepResult;
import org.fedsql.planner.plan.step.JoinStep;
import org.fedsql.planner.plan.step.LimitOffsetStep;
import org.fedsql.planner.predictor.PredictorPlanner;
import org.fedsql.planner.predictor.PredictorSteps;
import org.fedsql.planner.predictor.TimeSeriesPredictorPlanner;
import org.fedsql.planner.resolver.IdentifierResolver;
import org.fedsql.planner.resolver.PredictorRelation;
import org.fedsql.planner.resolver.SourceTable;

/**
 * Plans a select over a join of two relations. Two tables are fetched separately and joined by
 * the executor; a table joined with a predictor feeds the predictor first.
 */
@Log4j2
@RequiredArgsConstructor
public class JoinPlanner {

  private final PlanningContext context;

  private final PredictorPlanner predictorPlanner;

  private final TimeSeriesPredictorPlanner timeSeriesPredictorPlanner;

  /**
   * Plan a join query.
   *
   * @param query select whose FROM clause is a join
   * @param integration integration a CREATE TABLE writes to, or null
   * @return output of the final projection
   */
  public StepResult plan(Select query, String integration) {
    Join join = (Join) query.getFromTable();
    if (join.getLeft() instanceof Select) {
      query = hoistDerivedTable(query, join, integration);
      join = (Join) query.getFromTable();
    }
    if (!(join.getLeft() instanceof Identifier) || !(join.getRight() instanceof Identifier)) {
      throw new UnsupportedJoinOperandException(
          "Join of unsupported objects, currently only tables and predictors can be joined: "
              + join);
    }
    Identifier left = (Identifier) join.getLeft();
    Identifier right = (Identifier) join.getRight();

    Set<String> targetAliases =
        query.getTargets().stream()
            .map(UnresolvedExpression::getAlias)
            .filter(Objects::nonNull)
            .map(StringUtils::toLowerCase)
            .collect(ImmutableSet.toImmutableSet());
    Set<String> none = ImmutableSet.of();
    IdentifierResolver.checkJoinIdentifiersForAmbiguity(query.getWhere(), none);
    for (UnresolvedExpression column : query.getGroupBy()) {
      IdentifierResolver.checkJoinIdentifiersForAmbiguity(column, targetAliases);
    }
    IdentifierResolver.checkJoinIdentifiersForAmbiguity(query.getHaving(), none);
    for (OrderBy orderBy : query.getOrderBy()) {
      IdentifierResolver.checkJoinIdentifiersForAmbiguity(orderBy, targetAliases);
    }
    IdentifierResolver.checkJoinIdentifiersForAmbiguity(join.getCondition(), none);

    IdentifierResolver resolver = context.getResolver();
    boolean leftIsPredictor = resolver.isPredictor(left);
    boolean rightIsPredictor = resolver.isPredictor(right);
    if (leftIsPredictor && rightIsPredictor) {
      throw new DualPredictorJoinException(
          StringUtils.format(
              "Can't join two predictors %s and %s", left.getPath(), right.getPath()));
    }

    StepResult last;
    if (leftIsPredictor || rightIsPredictor) {
      last = planPredictorJoin(query, join, leftIsPredictor);
    } else {
      last = planTableJoin(query, join);
    }
    return context.planProject(query.getTargets(), last);
  }

  private StepResult planTableJoin(Select query, Join join) {
    IdentifierResolver resolver = context.getResolver();
    Identifier left = (Identifier) join.getLeft();
    Identifier right = (Identifier) join.getRight();
    StepResult leftData = context.planIntegrationSelect(selectAll(left));
    StepResult rightData = context.planIntegrationSelect(selectAll(right));
    SourceTable leftTable = resolver.resolveSourceTable(left);
    SourceTable rightTable = resolver.resolveSourceTable(right);

    JoinConditionQualifier qualifier = new JoinConditionQualifier(resolver, leftTable, rightTable);
    if (samePrefix(leftTable, rightTable)) {
      qualifier.renameSides(sideName(leftTable), sideName(rightTable));
      log.debug(
          "Tables {} and {} share a column prefix, naming the join sides apart",
          leftTable.table(),
          rightTable.table());
    }
    UnresolvedExpression condition = qualifier.transform(join.getCondition(), null);
    Join payload =
        new Join(qualifier.leftSide(), qualifier.rightSide(), join.getJoinType(), condition);
    log.debug("Joining tables {} and {}", payload.getLeft(), payload.getRight());

    StepResult joined = context.add(new JoinStep(leftData, rightData, payload));
    return context.planClauseTail(query, joined);
  }

  private StepResult planPredictorJoin(Select query, Join join, boolean predictorIsLeft) {
    IdentifierResolver resolver = context.getResolver();
    Node predictorSide = predictorIsLeft ? join.getLeft() : join.getRight();
    Node tableSide = predictorIsLeft ? join.getRight() : join.getLeft();
    Identifier predictorReference = (Identifier) predictorSide;
    Identifier tableReference = (Identifier) tableSide;
    PredictorRelation predictor = resolver.resolvePredictor(predictorReference);
    PredictorMetadata metadata = context.getPredictorMetadata(predictor);

    PredictorSteps steps;
    if (metadata.isTimeseries()) {
      log.debug("Joining time series predictor {}", predictor.getMetadataKey());
      steps = timeSeriesPredictorPlanner.plan(query, tableReference, predictor, metadata);
    } else {
      log.debug("Joining predictor {}", predictor.getMetadataKey());
      steps = predictorPlanner.planApply(query, tableReference, predictor);
    }

    SourceTable table = resolver.resolveSourceTable(tableReference);
    String tableAlias =
        table.table().getAlias() != null
            ? table.table().getAlias()
            : table.table().getPath().replace('.', '_');
    Identifier predictorResult =
        new Identifier(List.of(steps.predictor().getRefName()), predictor.getReferenceName());
    Identifier dataResult = new Identifier(List.of(steps.data().getRefName()), tableAlias);

    JoinStep joinStep =
        predictorIsLeft
            ? new JoinStep(
                steps.predictor(),
                steps.data(),
                new Join(predictorResult, dataResult, join.getJoinType(), null))
            : new JoinStep(
                steps.data(),
                steps.predictor(),
                new Join(dataResult, predictorResult, join.getJoinType(), null));
    StepResult last = context.add(joinStep);
    if (steps.savedLimit() != null) {
      last = context.add(new LimitOffsetStep(last, steps.savedLimit(), null));
    }
    return last;
  }

  /**
   * Move the clauses of a derived table on the left of a join onto the outer query, so that the
   * join reads the underlying table directly. Clauses of the outer query win, WHERE clauses are
   * combined.
   */
  private Select hoistDerivedTable(Select query, Join join, String integration) {
    Select derived = (Select) join.getLeft();
    if (!(derived.getFromTable() instanceof Identifier)) {
      throw new UnsupportedJoinOperandException(
          "Only a derived table selecting from a single table can be joined: " + derived);
    }
    Identifier innerTable = (Identifier) derived.getFromTable();
    String alias =
        derived.getAlias() != null
            ? derived.getAlias()
            : innerTable.getAlias() != null ? innerTable.getAlias() : innerTable.getLastPart();

    Set<String> innerNames = new HashSet<>();
    innerNames.add(StringUtils.toLowerCase(innerTable.getLastPart()));
    if (innerTable.getAlias() != null) {
      innerNames.add(StringUtils.toLowerCase(innerTable.getAlias()));
    }
    TableAliasQualifier qualifier = new TableAliasQualifier(innerNames, alias);

    Identifier hoistedTable = innerTable.withAlias(alias);
    if (integration != null
        && !StringUtils.equalsIgnoreCase(hoistedTable.getFirstPart(), integration)
        && !context.getResolver().isPredictor(hoistedTable)) {
      List<String> parts = new ArrayList<>();
      parts.add(integration);
      parts.addAll(hoistedTable.getParts());
      hoistedTable = hoistedTable.withParts(parts);
    }
    log.debug("Hoisting derived table {} as {}", derived, hoistedTable);

    return query.toBuilder()
        .fromTable(join.withSides(hoistedTable, join.getRight()))
        .where(
            BinaryOperation.conjoin(
                qualifier.transform(derived.getWhere(), null), query.getWhere()))
        .groupBy(
            query.hasGroupBy()
                ? query.getGroupBy()
                : derived.getGroupBy().stream()
                    .map(column -> qualifier.transform(column, null))
                    .collect(Collectors.toList()))
        .having(
            query.getHaving() != null
                ? query.getHaving()
                : qualifier.transform(derived.getHaving(), null))
        .orderBy(
            query.hasOrderBy()
                ? query.getOrderBy()
                : derived.getOrderBy().stream()
                    .map(orderBy -> qualifier.transform(orderBy, null))
                    .collect(Collectors.toList()))
        .limit(query.getLimit() != null ? query.getLimit() : derived.getLimit())
        .offset(query.getOffset() != null ? query.getOffset() : derived.getOffset())
        .build();
  }

  private static boolean samePrefix(SourceTable left, SourceTable right) {
    List<String> leftPrefix = left.getColumnPrefix();
    List<String> rightPrefix = right.getColumnPrefix();
    if (leftPrefix.size() != rightPrefix.size()) {
      return false;
    }
    for (int i = 0; i < leftPrefix.size(); i++) {
      if (!StringUtils.equalsIgnoreCase(leftPrefix.get(i), rightPrefix.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Alias naming a join side after its integration and table, e.g. {@code int1_sales}. */
  private static String sideName(SourceTable table) {
    String path = StringUtils.joinPath(table.getColumnPrefix()).replace('.', '_');
    return table.integration() + "_" + path;
  }

  private static Select selectAll(Identifier table) {
    return Select.builder().targets(List.of(new Star())).fromTable(table).build();
  }

  /**
   * Attributes each column of a join condition to the side it is qualified with. When both sides
   * share a column prefix, the sides are renamed so the condition still tells them apart.
   */
  @RequiredArgsConstructor
  private static class JoinConditionQualifier extends AstTransformer<Void> {

    private final IdentifierResolver resolver;

    private final SourceTable left;

    private final SourceTable right;

    private String leftName;

    private String rightName;

    void renameSides(String leftName, String rightName) {
      this.leftName = leftName;
      this.rightName = rightName;
    }

    Identifier leftSide() {
      return leftName == null ? left.table() : left.table().withAlias(leftName);
    }

    Identifier rightSide() {
      return rightName == null ? right.table() : right.table().withAlias(rightName);
    }

    @Override
    public Node visitIdentifier(Identifier node, Void context) {
      if (node.size() == 1) {
        throw new AmbiguousColumnException(
            "Ambiguous identifier " + node.getPath() + " in join condition, provide table name");
      }
      boolean inLeft = resolver.belongsTo(node, left);
      boolean inRight = resolver.belongsTo(node, right);
      if (inLeft && inRight) {
        throw new AmbiguousColumnException(
            StringUtils.format(
                "Ambiguous identifier %s in join condition, it matches both %s.%s and %s.%s",
                node.getPath(),
                left.integration(),
                left.table().getPath(),
                right.integration(),
                right.table().getPath()));
      }
      if (inLeft) {
        return rename(resolver.disambiguateIntegrationColumn(node, left, false), left, leftName);
      }
      if (inRight) {
        return rename(
            resolver.disambiguateIntegrationColumn(node, right, false), right, rightName);
      }
      throw new UnresolvedColumnException(
          "Wrong table or no source table in join condition for column: " + node.getPath());
    }

    private static Identifier rename(Identifier column, SourceTable table, String name) {
      if (name == null) {
        return column;
      }
      List<String> parts = new ArrayList<>();
      parts.add(name);
      parts.addAll(column.getParts().subList(table.getColumnPrefix().size(), column.size()));
      return new Identifier(parts, column.getAlias());
    }
  }

  /** Qualifies the columns of a derived table with the alias the hoisted table takes. */
  @RequiredArgsConstructor
  private static class TableAliasQualifier extends AstTransformer<Void> {

    private final Set<String> innerNames;

    private final String alias;

    @Override
    public Node visitIdentifier(Identifier node, Void context) {
      List<String> parts = new ArrayList<>();
      parts.add(alias);
      if (node.size() == 1) {
        parts.addAll(node.getParts());
      } else if (innerNames.contains(StringUtils.toLowerCase(node.getFirstPart()))) {
        parts.addAll(node.getParts().subList(1, node.size()));
      } else {
        return node;
      }
      return node.withParts(parts);
    }
  }
}
