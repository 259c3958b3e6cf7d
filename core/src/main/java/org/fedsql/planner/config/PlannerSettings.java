/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.fedsql.common.utils.StringUtils;

/**
 * Static configuration of a planner: the integrations tables may come from, the namespace
 * holding predictors and the metadata of known predictors. Names are matched case-insensitively.
 * The settings double as the default {@link PredictorMetadataProvider}.
 */
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlannerSettings implements PredictorMetadataProvider {

  private static final Logger LOG = LogManager.getLogger();

  public static final String DEFAULT_PREDICTOR_NAMESPACE = "mindsdb";

  /** Lower-cased integration name to the name as configured. */
  private final Map<String, String> integrations;

  private final String predictorNamespace;

  private final String defaultNamespace;

  /** Lower-cased predictor name to its metadata. */
  private final Map<String, PredictorMetadata> predictors;

  /**
   * Constructor of PlannerSettings.
   *
   * @param integrations known integration names
   * @param predictorNamespace namespace of predictors, {@value #DEFAULT_PREDICTOR_NAMESPACE} when
   *     null
   * @param defaultNamespace namespace tried for references without one, may be null
   * @param predictors predictor metadata by predictor name
   */
  @Builder
  @JsonCreator
  public PlannerSettings(
      @JsonProperty("integrations") @Singular Collection<String> integrations,
      @JsonProperty("predictor_namespace") String predictorNamespace,
      @JsonProperty("default_namespace") String defaultNamespace,
      @JsonProperty("predictors") @Singular Map<String, PredictorMetadata> predictors) {
    Map<String, String> integrationMap = new LinkedHashMap<>();
    if (integrations != null) {
      for (String integration : integrations) {
        Preconditions.checkArgument(
            !Strings.isNullOrEmpty(integration), "Integration name must not be empty");
        integrationMap.putIfAbsent(StringUtils.toLowerCase(integration), integration);
      }
    }
    Map<String, PredictorMetadata> predictorMap = new LinkedHashMap<>();
    if (predictors != null) {
      predictors.forEach(
          (name, metadata) ->
              predictorMap.put(
                  StringUtils.toLowerCase(name),
                  metadata == null ? PredictorMetadata.PLAIN : metadata));
    }
    this.integrations = ImmutableMap.copyOf(integrationMap);
    this.predictorNamespace =
        Strings.isNullOrEmpty(predictorNamespace)
            ? DEFAULT_PREDICTOR_NAMESPACE
            : StringUtils.toLowerCase(predictorNamespace);
    this.defaultNamespace = Strings.emptyToNull(defaultNamespace);
    this.predictors = ImmutableMap.copyOf(predictorMap);
  }

  /**
   * Reads settings from a JSON document.
   *
   * @param inputStream JSON input
   * @return settings
   */
  public static PlannerSettings fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    try {
      return objectMapper.readValue(inputStream, PlannerSettings.class);
    } catch (IOException e) {
      LOG.error("Planner settings are malformed. Verify the configuration file.");
      throw new IllegalArgumentException("Malformed planner settings json: " + e.getMessage(), e);
    }
  }

  public Set<String> getIntegrationNames() {
    return ImmutableSet.copyOf(integrations.values());
  }

  /** Returns the integration name as configured, if {@code name} is a known integration. */
  public Optional<String> findIntegration(String name) {
    return Optional.ofNullable(integrations.get(StringUtils.toLowerCase(name)));
  }

  public boolean isPredictorNamespace(String name) {
    return predictorNamespace.equals(StringUtils.toLowerCase(name));
  }

  /** True when references without a namespace are looked up among predictors. */
  public boolean isDefaultNamespacePredictors() {
    return defaultNamespace != null && isPredictorNamespace(defaultNamespace);
  }

  @Override
  public Optional<PredictorMetadata> getPredictorMetadata(String predictorName) {
    return Optional.ofNullable(predictors.get(StringUtils.toLowerCase(predictorName)));
  }
}
