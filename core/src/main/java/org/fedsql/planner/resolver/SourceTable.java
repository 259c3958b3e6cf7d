/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.resolver;

import java.util.List;
import org.fedsql.ast.expression.Identifier;

/**
 * Table living in an integration. {@code int1.schema.t1 AS a} resolves to integration {@code int1}
 * and table {@code schema.t1 AS a}.
 */
public record SourceTable(String integration, Identifier table) implements ResolvedRelation {

  @Override
  public Identifier getName() {
    return table;
  }

  /** Prefix that qualifies the columns of this table: the alias, else the table parts. */
  public List<String> getColumnPrefix() {
    return table.getAlias() != null ? List.of(table.getAlias()) : table.getParts();
  }
}
