/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.expression;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.fedsql.ast.AbstractNodeVisitor;
import org.fedsql.ast.Node;

/** One item of an ORDER BY list. */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class OrderBy extends Node {

  private final UnresolvedExpression field;

  private final Direction direction;

  public OrderBy(UnresolvedExpression field) {
    this(field, Direction.ASC);
  }

  @Override
  public List<? extends Node> getChild() {
    return ImmutableList.of(field);
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitOrderBy(this, context);
  }

  public enum Direction {
    ASC,
    DESC
  }
}
