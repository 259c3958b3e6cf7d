/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.rewriter;

import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.fedsql.ast.AstTransformer;
import org.fedsql.ast.Node;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.ast.expression.OrderBy;
import org.fedsql.ast.expression.Star;
import org.fedsql.ast.expression.UnresolvedExpression;
import org.fedsql.ast.statement.Select;
import org.fedsql.common.utils.StringUtils;
import org.fedsql.planner.exception.UnsupportedStatementException;
import org.fedsql.planner.resolver.IdentifierResolver;
import org.fedsql.planner.resolver.SourceTable;

/**
 * Scopes a select over a single table to the integration holding that table. The result is a
 * new tree in which the FROM clause names the table without its integration and every column is
 * qualified with the table alias or path.
 */
@RequiredArgsConstructor
public class StatementRewriter {

  private final IdentifierResolver resolver;

  /**
   * Rewrite a select for pushdown.
   *
   * @param select select whose FROM clause is the table or a derived select over it
   * @param table resolved table
   * @return rewritten select, the input is left untouched
   */
  public Select rewrite(Select select, SourceTable table) {
    Node from = select.getFromTable();
    if (from instanceof Select) {
      Select derived = (Select) from;
      return select.toBuilder().fromTable(rewrite(derived, table)).build();
    }
    if (from != null && !(from instanceof Identifier)) {
      throw new UnsupportedStatementException(
          "Only a single table can be pushed down to an integration, found: " + from);
    }

    ColumnQualifier qualifier = new ColumnQualifier(resolver, table);
    Set<String> targetAliases =
        select.getTargets().stream()
            .map(UnresolvedExpression::getAlias)
            .filter(Objects::nonNull)
            .map(StringUtils::toLowerCase)
            .collect(ImmutableSet.toImmutableSet());
    Set<String> none = ImmutableSet.of();

    List<UnresolvedExpression> targets =
        select.getTargets().stream()
            .map(target -> qualifyTarget(qualifier, target, table))
            .collect(Collectors.toList());
    List<OrderBy> orderBy =
        select.getOrderBy().stream()
            .map(o -> qualifier.transform(o, targetAliases))
            .collect(Collectors.toList());

    return select.toBuilder()
        .targets(targets)
        .fromTable(from == null ? null : table.table())
        .where(qualifier.transform(select.getWhere(), none))
        .groupBy(
            select.getGroupBy().stream()
                .map(g -> qualifier.transform(g, targetAliases))
                .collect(Collectors.toList()))
        .having(qualifier.transform(select.getHaving(), targetAliases))
        .orderBy(orderBy)
        .build();
  }

  private UnresolvedExpression qualifyTarget(
      ColumnQualifier qualifier, UnresolvedExpression target, SourceTable table) {
    if (target instanceof Identifier) {
      return resolver.disambiguateIntegrationColumn((Identifier) target, table, true);
    }
    if (target instanceof Star) {
      return target;
    }
    return qualifier.transform(target, ImmutableSet.of());
  }

  /** Qualifies identifiers nested anywhere in an expression. The context holds names left as is. */
  @RequiredArgsConstructor
  private static class ColumnQualifier extends AstTransformer<Set<String>> {

    private final IdentifierResolver resolver;

    private final SourceTable table;

    @Override
    public Node visitIdentifier(Identifier node, Set<String> keep) {
      if (node.size() == 1 && keep.contains(StringUtils.toLowerCase(node.getFirstPart()))) {
        return node;
      }
      return resolver.disambiguateIntegrationColumn(node, table, false);
    }
  }
}
