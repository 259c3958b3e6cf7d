/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.dsl;

import java.util.Arrays;
import org.fedsql.ast.Node;
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

/** Class of static methods to create specific node instances. */
public final class AstDSL {

  private AstDSL() {}

  public static Identifier id(String path) {
    return Identifier.fromPath(path);
  }

  public static Identifier id(String path, String alias) {
    return Identifier.fromPath(path).withAlias(alias);
  }

  public static Star star() {
    return new Star();
  }

  public static Constant constant(Object value) {
    return new Constant(value);
  }

  public static NullConstant nullConstant() {
    return new NullConstant();
  }

  public static Latest latest() {
    return new Latest();
  }

  public static PartitionValue partitionValue(String column) {
    return new PartitionValue(column);
  }

  public static BinaryOperation compare(
      String op, UnresolvedExpression left, UnresolvedExpression right) {
    return new BinaryOperation(op, left, right);
  }

  public static BinaryOperation equalTo(UnresolvedExpression left, UnresolvedExpression right) {
    return compare("=", left, right);
  }

  /** Left-deep conjunction of two or more expressions. */
  public static UnresolvedExpression and(UnresolvedExpression... expressions) {
    UnresolvedExpression result = expressions[0];
    for (int i = 1; i < expressions.length; i++) {
      result = new BinaryOperation("and", result, expressions[i]);
    }
    return result;
  }

  public static BinaryOperation or(UnresolvedExpression left, UnresolvedExpression right) {
    return new BinaryOperation("or", left, right);
  }

  public static BinaryOperation isNotNull(UnresolvedExpression expression) {
    return new BinaryOperation("is not", expression, new NullConstant());
  }

  public static UnaryOperation not(UnresolvedExpression expression) {
    return new UnaryOperation("not", expression);
  }

  public static BetweenOperation between(
      UnresolvedExpression value, UnresolvedExpression from, UnresolvedExpression to) {
    return new BetweenOperation(value, from, to);
  }

  public static Function function(String name, UnresolvedExpression... args) {
    return new Function(name, Arrays.asList(args));
  }

  public static OrderBy asc(UnresolvedExpression field) {
    return new OrderBy(field, OrderBy.Direction.ASC);
  }

  public static OrderBy desc(UnresolvedExpression field) {
    return new OrderBy(field, OrderBy.Direction.DESC);
  }

  public static Select.SelectBuilder select(UnresolvedExpression... targets) {
    return Select.builder().targets(Arrays.asList(targets));
  }

  public static Join join(Node left, Node right, UnresolvedExpression condition) {
    return new Join(left, right, Join.JoinType.INNER, condition);
  }

  public static Join join(
      Node left, Node right, Join.JoinType joinType, UnresolvedExpression condition) {
    return new Join(left, right, joinType, condition);
  }

  public static Union union(Statement left, Statement right) {
    return new Union(left, right, true);
  }

  public static Union unionAll(Statement left, Statement right) {
    return new Union(left, right, false);
  }

  public static CreateTableAsSelect createTableAs(String name, Statement query) {
    return new CreateTableAsSelect(id(name), query, false);
  }
}
