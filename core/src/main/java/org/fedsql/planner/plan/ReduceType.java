/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.plan;

/** How the outputs of a fan-out step are combined. */
public enum ReduceType {
  UNION
}
