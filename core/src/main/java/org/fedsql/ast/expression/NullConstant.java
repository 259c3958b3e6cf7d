/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.expression;

import lombok.EqualsAndHashCode;
import org.fedsql.ast.AbstractNodeVisitor;

/** SQL {@code NULL}. */
@EqualsAndHashCode(callSuper = false)
public class NullConstant extends UnresolvedExpression {

  @Override
  public String getAlias() {
    return null;
  }

  @Override
  public NullConstant withAlias(String alias) {
    if (alias != null) {
      throw new UnsupportedOperationException("NULL cannot be aliased");
    }
    return this;
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitNullConstant(this, context);
  }
}
