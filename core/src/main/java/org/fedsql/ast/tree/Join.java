/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.tree;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.fedsql.ast.AbstractNodeVisitor;
import org.fedsql.ast.Node;
import org.fedsql.ast.expression.UnresolvedExpression;

/**
 * Two relations joined in a FROM clause. Each side is an identifier, a derived select or another
 * join; the condition is null for joins without {@code ON}.
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class Join extends Node {

  private final Node left;

  private final Node right;

  private final JoinType joinType;

  private final UnresolvedExpression condition;

  public Join withSides(Node newLeft, Node newRight) {
    return new Join(newLeft, newRight, joinType, condition);
  }

  public Join withCondition(UnresolvedExpression newCondition) {
    return new Join(left, right, joinType, newCondition);
  }

  @Override
  public List<? extends Node> getChild() {
    List<Node> children = new ArrayList<>(List.of(left, right));
    if (condition != null) {
      children.add(condition);
    }
    return ImmutableList.copyOf(children);
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitJoin(this, context);
  }

  public enum JoinType {
    INNER("JOIN"),
    LEFT("LEFT JOIN"),
    RIGHT("RIGHT JOIN"),
    FULL("FULL JOIN"),
    CROSS("CROSS JOIN");

    @Getter
    private final String keyword;

    JoinType(String keyword) {
      this.keyword = keyword;
    }
  }
}
