/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * AST node. Nodes are immutable; rewriting a tree always builds new nodes.
 */
public abstract class Node {

  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitChildren(this, context);
  }

  public List<? extends Node> getChild() {
    return ImmutableList.of();
  }

  @Override
  public String toString() {
    return SqlFormatter.format(this);
  }
}
