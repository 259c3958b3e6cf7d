/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.expression;

import lombok.EqualsAndHashCode;
import org.fedsql.ast.AbstractNodeVisitor;

/** The {@code *} target. */
@EqualsAndHashCode(callSuper = false)
public class Star extends UnresolvedExpression {

  @Override
  public String getAlias() {
    return null;
  }

  @Override
  public Star withAlias(String alias) {
    if (alias != null) {
      throw new UnsupportedOperationException("* cannot be aliased");
    }
    return this;
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitStar(this, context);
  }
}
