/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * What the planner knows about a predictor. A predictor declaring an ordering column is a
 * time-series predictor and must also declare a positive window.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
public class PredictorMetadata {

  /** Metadata of a predictor the caller knows nothing about. */
  public static final PredictorMetadata PLAIN = new PredictorMetadata(null, null, null);

  private final String orderByColumn;

  private final List<String> groupByColumns;

  private final Integer window;

  /**
   * Constructor of PredictorMetadata.
   *
   * @param orderByColumn column the predictor orders rows by, null for non time-series predictors
   * @param groupByColumns columns partitioning the series, may be null
   * @param window number of historical rows the predictor looks at
   */
  @Builder
  @JsonCreator
  public PredictorMetadata(
      @JsonProperty("order_by_column") String orderByColumn,
      @JsonProperty("group_by_columns") List<String> groupByColumns,
      @JsonProperty("window") Integer window) {
    if (orderByColumn != null) {
      Preconditions.checkArgument(
          window != null && window > 0,
          "Time series predictor ordered by %s requires a positive window, got %s",
          orderByColumn,
          window);
    }
    this.orderByColumn = orderByColumn;
    this.groupByColumns =
        groupByColumns == null ? ImmutableList.of() : ImmutableList.copyOf(groupByColumns);
    this.window = window;
  }

  public boolean isTimeseries() {
    return orderByColumn != null;
  }
}
