/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.expression;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.With;
import org.fedsql.ast.AbstractNodeVisitor;
import org.fedsql.ast.Node;
import org.fedsql.common.utils.StringUtils;

/**
 * Operator with two operands. The operator is kept lower case: {@code and}, {@code or},
 * {@code =}, {@code >=}, {@code is not}, ...
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class BinaryOperation extends UnresolvedExpression {

  private final String op;

  private final UnresolvedExpression left;

  private final UnresolvedExpression right;

  @With
  private final String alias;

  public BinaryOperation(
      String op, UnresolvedExpression left, UnresolvedExpression right, String alias) {
    this.op = StringUtils.toLowerCase(op);
    this.left = left;
    this.right = right;
    this.alias = alias;
  }

  public BinaryOperation(String op, UnresolvedExpression left, UnresolvedExpression right) {
    this(op, left, right, null);
  }

  /** {@code left AND right}, where a null side is dropped. */
  public static UnresolvedExpression conjoin(
      UnresolvedExpression left, UnresolvedExpression right) {
    if (left == null) {
      return right;
    }
    if (right == null) {
      return left;
    }
    return new BinaryOperation("and", left, right);
  }

  public boolean isOp(String name) {
    return op.equals(name);
  }

  @Override
  public List<? extends Node> getChild() {
    return ImmutableList.of(left, right);
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitBinaryOperation(this, context);
  }
}
