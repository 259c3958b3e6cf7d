/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.resolver;

import org.fedsql.ast.expression.Identifier;

/** A relation reference after classification: a source table or a predictor. */
public interface ResolvedRelation {

  /** The reference with its namespace or integration removed, alias kept. */
  Identifier getName();

  /** Name the relation is known by in the statement: its alias, else its dotted path. */
  default String getReferenceName() {
    Identifier name = getName();
    return name.getAlias() != null ? name.getAlias() : name.getPath();
  }
}
