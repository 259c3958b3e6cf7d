/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.expression;

import org.fedsql.ast.Node;

/**
 * Expression as written in the statement, before any table or predictor has been attached to
 * its identifiers.
 */
public abstract class UnresolvedExpression extends Node {

  /** Alias declared for the expression with {@code AS}, or null. */
  public abstract String getAlias();

  /** Copy of this expression carrying the given alias. */
  public abstract UnresolvedExpression withAlias(String alias);
}
