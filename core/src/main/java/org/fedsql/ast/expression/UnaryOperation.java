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

/** Prefix operator such as {@code not} or unary minus. */
@Getter
@EqualsAndHashCode(callSuper = false)
public class UnaryOperation extends UnresolvedExpression {

  private final String op;

  private final UnresolvedExpression operand;

  @With
  private final String alias;

  public UnaryOperation(String op, UnresolvedExpression operand, String alias) {
    this.op = StringUtils.toLowerCase(op);
    this.operand = operand;
    this.alias = alias;
  }

  public UnaryOperation(String op, UnresolvedExpression operand) {
    this(op, operand, null);
  }

  @Override
  public List<? extends Node> getChild() {
    return ImmutableList.of(operand);
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitUnaryOperation(this, context);
  }
}
