/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.fedsql.ast.AbstractNodeVisitor;

/**
 * Placeholder for the value of a partition column. The executor substitutes it with each
 * distinct partition key when it runs a map-reduce sub-plan.
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class PartitionValue extends UnresolvedExpression {

  private final String column;

  @Override
  public String getAlias() {
    return null;
  }

  @Override
  public PartitionValue withAlias(String alias) {
    if (alias != null) {
      throw new UnsupportedOperationException("Partition placeholder cannot be aliased");
    }
    return this;
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitPartitionValue(this, context);
  }
}
