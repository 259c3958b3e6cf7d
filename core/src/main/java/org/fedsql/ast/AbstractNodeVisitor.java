/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast;

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
import org.fedsql.ast.statement.CreateTableAsSelect;
import org.fedsql.ast.statement.Select;
import org.fedsql.ast.statement.Union;
import org.fedsql.ast.tree.Join;

/**
 * AST nodes visitor. Defines the traverse path.
 */
public abstract class AbstractNodeVisitor<T, C> {

  public T visit(Node node, C context) {
    return null;
  }

  /**
   * Visit child node.
   *
   * @param node {@link Node}
   * @param context Context
   * @return Return Type.
   */
  public T visitChildren(Node node, C context) {
    T result = defaultResult();

    for (Node child : node.getChild()) {
      T childResult = child.accept(this, context);
      result = aggregateResult(result, childResult);
    }
    return result;
  }

  private T defaultResult() {
    return null;
  }

  private T aggregateResult(T aggregate, T nextResult) {
    return nextResult;
  }

  public T visitIdentifier(Identifier node, C context) {
    return visitChildren(node, context);
  }

  public T visitStar(Star node, C context) {
    return visitChildren(node, context);
  }

  public T visitConstant(Constant node, C context) {
    return visitChildren(node, context);
  }

  public T visitNullConstant(NullConstant node, C context) {
    return visitChildren(node, context);
  }

  public T visitLatest(Latest node, C context) {
    return visitChildren(node, context);
  }

  public T visitPartitionValue(PartitionValue node, C context) {
    return visitChildren(node, context);
  }

  public T visitBinaryOperation(BinaryOperation node, C context) {
    return visitChildren(node, context);
  }

  public T visitUnaryOperation(UnaryOperation node, C context) {
    return visitChildren(node, context);
  }

  public T visitBetween(BetweenOperation node, C context) {
    return visitChildren(node, context);
  }

  public T visitFunction(Function node, C context) {
    return visitChildren(node, context);
  }

  public T visitOrderBy(OrderBy node, C context) {
    return visitChildren(node, context);
  }

  public T visitJoin(Join node, C context) {
    return visitChildren(node, context);
  }

  public T visitSelect(Select node, C context) {
    return visitChildren(node, context);
  }

  public T visitUnion(Union node, C context) {
    return visitChildren(node, context);
  }

  public T visitCreateTableAsSelect(CreateTableAsSelect node, C context) {
    return visitChildren(node, context);
  }
}
