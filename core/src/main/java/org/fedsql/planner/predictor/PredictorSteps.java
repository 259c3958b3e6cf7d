/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.predictor;

import org.fedsql.planner.plan.StepResult;

/**
 * Steps produced for the predictor side of a join.
 *
 * @param predictor output of the step applying the predictor
 * @param data output of the step fetching the rows the predictor reads
 * @param savedLimit limit of the original query, applied after the join; null when none
 */
public record PredictorSteps(StepResult predictor, StepResult data, Integer savedLimit) {}
