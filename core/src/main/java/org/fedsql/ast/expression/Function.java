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

/** Function or aggregate call, e.g. {@code count(DISTINCT a.x)}. */
@Getter
@EqualsAndHashCode(callSuper = false)
public class Function extends UnresolvedExpression {

  private final String name;

  private final List<UnresolvedExpression> args;

  private final boolean distinct;

  @With
  private final String alias;

  public Function(String name, List<UnresolvedExpression> args, boolean distinct, String alias) {
    this.name = name;
    this.args = ImmutableList.copyOf(args);
    this.distinct = distinct;
    this.alias = alias;
  }

  public Function(String name, List<UnresolvedExpression> args) {
    this(name, args, false, null);
  }

  @Override
  public List<? extends Node> getChild() {
    return args;
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitFunction(this, context);
  }
}
