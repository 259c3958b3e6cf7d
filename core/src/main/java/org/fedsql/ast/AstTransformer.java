/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast;

import java.util.List;
import java.util.stream.Collectors;
import org.fedsql.ast.expression.BetweenOperation;
import org.fedsql.ast.expression.BinaryOperation;
import org.fedsql.ast.expression.Constant;
import org.fedsql.ast.expression.Function;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.ast.expression.Latest;
import org.fedsql.ast.expression.NullConstant;
import org.fedsql.ast.expression.OrderBy;
import org.fedsql.ast.expression.PartitionValue;
import org.fedsql.ast.expression.Star;
import org.fedsql.ast.expression.UnaryOperation;
import org.fedsql.ast.expression.UnresolvedExpression;
import org.fedsql.ast.statement.CreateTableAsSelect;
import org.fedsql.ast.statement.Select;
import org.fedsql.ast.statement.Statement;
import org.fedsql.ast.statement.Union;
import org.fedsql.ast.tree.Join;

/**
 * Rebuilds a tree bottom-up. Every visit method returns a node of the same kind as the visited
 * one; subclasses override the nodes they replace. Table identifiers in FROM clauses go through
 * {@link #transformRelation(Node, Object)} and are not visited as columns.
 */
public abstract class AstTransformer<C> extends AbstractNodeVisitor<Node, C> {

  @SuppressWarnings("unchecked")
  public <T extends Node> T transform(T node, C context) {
    return node == null ? null : (T) node.accept(this, context);
  }

  protected List<UnresolvedExpression> transformAll(
      List<UnresolvedExpression> expressions, C context) {
    return expressions.stream().map(e -> transform(e, context)).collect(Collectors.toList());
  }

  protected Node transformRelation(Node relation, C context) {
    if (relation == null || relation instanceof Identifier) {
      return relation;
    }
    return relation.accept(this, context);
  }

  @Override
  public Node visitIdentifier(Identifier node, C context) {
    return node;
  }

  @Override
  public Node visitStar(Star node, C context) {
    return node;
  }

  @Override
  public Node visitConstant(Constant node, C context) {
    return node;
  }

  @Override
  public Node visitNullConstant(NullConstant node, C context) {
    return node;
  }

  @Override
  public Node visitLatest(Latest node, C context) {
    return node;
  }

  @Override
  public Node visitPartitionValue(PartitionValue node, C context) {
    return node;
  }

  @Override
  public Node visitBinaryOperation(BinaryOperation node, C context) {
    return new BinaryOperation(
        node.getOp(),
        transform(node.getLeft(), context),
        transform(node.getRight(), context),
        node.getAlias());
  }

  @Override
  public Node visitUnaryOperation(UnaryOperation node, C context) {
    return new UnaryOperation(node.getOp(), transform(node.getOperand(), context), node.getAlias());
  }

  @Override
  public Node visitBetween(BetweenOperation node, C context) {
    return new BetweenOperation(
        transform(node.getValue(), context),
        transform(node.getFrom(), context),
        transform(node.getTo(), context),
        node.getAlias());
  }

  @Override
  public Node visitFunction(Function node, C context) {
    return new Function(
        node.getName(), transformAll(node.getArgs(), context), node.isDistinct(), node.getAlias());
  }

  @Override
  public Node visitOrderBy(OrderBy node, C context) {
    return new OrderBy(transform(node.getField(), context), node.getDirection());
  }

  @Override
  public Node visitJoin(Join node, C context) {
    return new Join(
        transformRelation(node.getLeft(), context),
        transformRelation(node.getRight(), context),
        node.getJoinType(),
        transform(node.getCondition(), context));
  }

  @Override
  public Node visitSelect(Select node, C context) {
    return node.toBuilder()
        .targets(transformAll(node.getTargets(), context))
        .fromTable(transformRelation(node.getFromTable(), context))
        .where(transform(node.getWhere(), context))
        .groupBy(transformAll(node.getGroupBy(), context))
        .having(transform(node.getHaving(), context))
        .orderBy(
            node.getOrderBy().stream()
                .map(o -> transform(o, context))
                .collect(Collectors.toList()))
        .build();
  }

  @Override
  public Node visitUnion(Union node, C context) {
    return new Union(
        (Statement) transform(node.getLeft(), context),
        (Statement) transform(node.getRight(), context),
        node.isUnique());
  }

  @Override
  public Node visitCreateTableAsSelect(CreateTableAsSelect node, C context) {
    return new CreateTableAsSelect(
        node.getName(), transform(node.getFromSelect(), context), node.isReplace());
  }
}
