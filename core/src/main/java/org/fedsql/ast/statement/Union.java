/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.statement;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.fedsql.ast.AbstractNodeVisitor;
import org.fedsql.ast.Node;

/** {@code left UNION [ALL] right}. {@code unique} is false for UNION ALL. */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class Union extends Statement {

  private final Statement left;

  private final Statement right;

  private final boolean unique;

  @Override
  public List<? extends Node> getChild() {
    return ImmutableList.of(left, right);
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitUnion(this, context);
  }
}
