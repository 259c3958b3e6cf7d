/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.config;

import java.util.Optional;

/** Source of predictor metadata used while planning. */
public interface PredictorMetadataProvider {

  /**
   * Look up a predictor.
   *
   * @param predictorName predictor name without namespace
   * @return metadata, or empty if the predictor is unknown
   */
  Optional<PredictorMetadata> getPredictorMetadata(String predictorName);
}
