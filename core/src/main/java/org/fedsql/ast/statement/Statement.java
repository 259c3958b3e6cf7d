/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.statement;

import org.fedsql.ast.Node;

/** Statement the planner accepts. */
public abstract class Statement extends Node {
}
