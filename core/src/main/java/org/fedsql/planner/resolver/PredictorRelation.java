/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.resolver;

import org.fedsql.ast.expression.Identifier;

/** Predictor referenced as a table. */
public record PredictorRelation(String namespace, Identifier predictor)
    implements ResolvedRelation {

  @Override
  public Identifier getName() {
    return predictor;
  }

  /** Key of the predictor metadata: the predictor path without namespace or alias. */
  public String getMetadataKey() {
    return predictor.getPath();
  }
}
