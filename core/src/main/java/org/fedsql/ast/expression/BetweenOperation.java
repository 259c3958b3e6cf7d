/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.expression;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.With;
import org.fedsql.ast.AbstractNodeVisitor;
import org.fedsql.ast.Node;

/** {@code value BETWEEN from AND to}. */
@Getter
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class BetweenOperation extends UnresolvedExpression {

  private final UnresolvedExpression value;

  private final UnresolvedExpression from;

  private final UnresolvedExpression to;

  @With
  private final String alias;

  public BetweenOperation(
      UnresolvedExpression value, UnresolvedExpression from, UnresolvedExpression to) {
    this(value, from, to, null);
  }

  @Override
  public List<? extends Node> getChild() {
    return ImmutableList.of(value, from, to);
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitBetween(this, context);
  }
}
