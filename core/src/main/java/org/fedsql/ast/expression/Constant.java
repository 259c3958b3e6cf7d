/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.expression;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.With;
import org.fedsql.ast.AbstractNodeVisitor;

/** Literal value: string, number or boolean. */
@Getter
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class Constant extends UnresolvedExpression {

  private final Object value;

  @With
  private final String alias;

  public Constant(Object value) {
    this(value, null);
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitConstant(this, context);
  }
}
