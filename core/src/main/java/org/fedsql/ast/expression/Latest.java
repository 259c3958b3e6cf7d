/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.expression;

import lombok.EqualsAndHashCode;
import org.fedsql.ast.AbstractNodeVisitor;

/**
 * The {@code LATEST} marker of time-series queries, as in {@code WHERE ts > LATEST}. It has no
 * literal value and is never pushed down to an integration.
 */
@EqualsAndHashCode(callSuper = false)
public class Latest extends UnresolvedExpression {

  @Override
  public String getAlias() {
    return null;
  }

  @Override
  public Latest withAlias(String alias) {
    if (alias != null) {
      throw new UnsupportedOperationException("LATEST cannot be aliased");
    }
    return this;
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitLatest(this, context);
  }
}
