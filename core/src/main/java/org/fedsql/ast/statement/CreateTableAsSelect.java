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
import org.fedsql.ast.expression.Identifier;

/** {@code CREATE [OR REPLACE] TABLE name AS select}. The query is null for plain DDL. */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class CreateTableAsSelect extends Statement {

  private final Identifier name;

  private final Statement fromSelect;

  private final boolean replace;

  @Override
  public List<? extends Node> getChild() {
    return fromSelect == null ? ImmutableList.of(name) : ImmutableList.of(name, fromSelect);
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitCreateTableAsSelect(this, context);
  }
}
