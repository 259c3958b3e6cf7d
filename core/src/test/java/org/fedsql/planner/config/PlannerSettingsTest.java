/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlannerSettingsTest {

  @Test
  void should_load_settings_from_json_resource() {
    InputStream inputStream =
        getClass().getClassLoader().getResourceAsStream("planner-settings.json");
    PlannerSettings settings = PlannerSettings.fromInputStream(inputStream);

    assertEquals(Set.of("int1", "Int2"), settings.getIntegrationNames());
    assertEquals("mindsdb", settings.getPredictorNamespace());
    assertEquals("int1", settings.getDefaultNamespace());
    assertFalse(settings.isDefaultNamespacePredictors());
    assertEquals(
        Optional.of(PredictorMetadata.PLAIN), settings.getPredictorMetadata("sales_forecast"));

    PredictorMetadata tp3 = settings.getPredictorMetadata("TP3").orElseThrow();
    assertTrue(tp3.isTimeseries());
    assertEquals("ts", tp3.getOrderByColumn());
    assertEquals(List.of("region"), tp3.getGroupByColumns());
    assertEquals(10, tp3.getWindow());
  }

  @Test
  void should_match_integrations_ignoring_case() {
    PlannerSettings settings = PlannerSettings.builder().integration("Int2").build();

    assertEquals(Optional.of("Int2"), settings.findIntegration("INT2"));
    assertEquals(Optional.empty(), settings.findIntegration("int3"));
    assertTrue(settings.isPredictorNamespace("MINDSDB"));
    assertNull(settings.getDefaultNamespace());
  }

  @Test
  void should_treat_predictor_namespace_as_default() {
    PlannerSettings settings =
        PlannerSettings.builder().predictorNamespace("ml").defaultNamespace("ML").build();

    assertTrue(settings.isDefaultNamespacePredictors());
    assertFalse(settings.isPredictorNamespace("mindsdb"));
  }

  @Test
  void should_fail_on_malformed_json() {
    IllegalArgumentException exception =
        assertThrows(
            IllegalArgumentException.class, () -> PlannerSettings.fromInputStream(json("{")));
    assertTrue(exception.getMessage().startsWith("Malformed planner settings json"));
  }

  @Test
  void should_fail_on_time_series_predictor_without_window() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            PlannerSettings.fromInputStream(
                json("{\"predictors\": {\"p\": {\"order_by_column\": \"ts\"}}}")));
    assertThrows(
        IllegalArgumentException.class,
        () -> PredictorMetadata.builder().orderByColumn("ts").window(0).build());
  }

  @Test
  void should_reject_empty_integration_name() {
    assertThrows(
        IllegalArgumentException.class, () -> PlannerSettings.builder().integration("").build());
  }

  private static InputStream json(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }
}
