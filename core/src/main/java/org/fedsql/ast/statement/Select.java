/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.statement;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.fedsql.ast.AbstractNodeVisitor;
import org.fedsql.ast.Node;
import org.fedsql.ast.expression.OrderBy;
import org.fedsql.ast.expression.UnresolvedExpression;

/**
 * SELECT statement. Also used as a derived table inside a FROM clause, in which case {@link
 * #getAlias()} holds the derived table name.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class Select extends Statement {

  private final List<UnresolvedExpression> targets;

  private final boolean distinct;

  /** {@link org.fedsql.ast.expression.Identifier}, {@link Select} or join; null without FROM. */
  private final Node fromTable;

  private final UnresolvedExpression where;

  private final List<UnresolvedExpression> groupBy;

  private final UnresolvedExpression having;

  private final List<OrderBy> orderBy;

  private final Integer limit;

  private final Integer offset;

  private final String alias;

  /**
   * Constructor of Select. Null lists are stored as empty lists.
   */
  @Builder(toBuilder = true)
  public Select(
      List<UnresolvedExpression> targets,
      boolean distinct,
      Node fromTable,
      UnresolvedExpression where,
      List<UnresolvedExpression> groupBy,
      UnresolvedExpression having,
      List<OrderBy> orderBy,
      Integer limit,
      Integer offset,
      String alias) {
    this.targets = targets == null ? ImmutableList.of() : ImmutableList.copyOf(targets);
    this.distinct = distinct;
    this.fromTable = fromTable;
    this.where = where;
    this.groupBy = groupBy == null ? ImmutableList.of() : ImmutableList.copyOf(groupBy);
    this.having = having;
    this.orderBy = orderBy == null ? ImmutableList.of() : ImmutableList.copyOf(orderBy);
    this.limit = limit;
    this.offset = offset;
    this.alias = alias;
  }

  public boolean hasGroupBy() {
    return !groupBy.isEmpty();
  }

  public boolean hasOrderBy() {
    return !orderBy.isEmpty();
  }

  public Select withAlias(String newAlias) {
    return toBuilder().alias(newAlias).build();
  }

  @Override
  public List<? extends Node> getChild() {
    List<Node> children = new ArrayList<>(targets);
    if (fromTable != null) {
      children.add(fromTable);
    }
    if (where != null) {
      children.add(where);
    }
    children.addAll(groupBy);
    if (having != null) {
      children.add(having);
    }
    children.addAll(orderBy);
    return ImmutableList.copyOf(children);
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitSelect(this, context);
  }
}
