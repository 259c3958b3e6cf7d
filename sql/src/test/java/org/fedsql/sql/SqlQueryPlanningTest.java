/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.sql;

import static org.fedsql.ast.dsl.AstDSL.constant;
import static org.fedsql.ast.dsl.AstDSL.equalTo;
import static org.fedsql.ast.dsl.AstDSL.id;
import static org.fedsql.ast.dsl.AstDSL.join;
import static org.fedsql.ast.dsl.AstDSL.select;
import static org.fedsql.ast.dsl.AstDSL.star;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.fedsql.planner.QueryPlanner;
import org.fedsql.planner.config.PlannerSettings;
import org.fedsql.planner.config.PredictorMetadata;
import org.fedsql.planner.exception.AmbiguousColumnException;
import org.fedsql.planner.exception.ConflictingOrderByException;
import org.fedsql.planner.exception.DualPredictorJoinException;
import org.fedsql.planner.plan.QueryPlan;
import org.fedsql.planner.plan.StepResult;
import org.fedsql.planner.plan.step.ApplyPredictorRowStep;
import org.fedsql.planner.plan.step.FetchDataframeStep;
import org.fedsql.planner.plan.step.JoinStep;
import org.fedsql.planner.plan.step.ProjectStep;
import org.fedsql.sql.parser.SqlStatementParser;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SqlQueryPlanningTest {

  private final SqlStatementParser parser = new SqlStatementParser();

  private final QueryPlanner planner =
      new QueryPlanner(
          PlannerSettings.builder()
              .integration("int1")
              .integration("int2")
              .predictor("sales_forecast", PredictorMetadata.PLAIN)
              .predictor(
                  "tp3",
                  PredictorMetadata.builder()
                      .orderByColumn("ts")
                      .groupByColumns(List.of("region"))
                      .window(10)
                      .build())
              .build());

  @Test
  void should_plan_predictor_point_lookup() {
    QueryPlan plan = plan("SELECT * FROM mindsdb.sales_forecast WHERE store_id = 5");

    assertEquals(
        List.of(
            new ApplyPredictorRowStep("mindsdb", id("sales_forecast"), Map.of("store_id", 5)),
            new ProjectStep(new StepResult(0), List.of(star()))),
        plan.getSteps());
  }

  @Test
  void should_plan_join_of_tables_from_two_integrations() {
    QueryPlan plan =
        plan("SELECT a.x, b.y FROM int1.t1 AS a JOIN int2.t2 AS b ON a.id = b.id");

    assertEquals(
        List.of(
            new FetchDataframeStep("int1", select(star()).fromTable(id("t1", "a")).build()),
            new FetchDataframeStep("int2", select(star()).fromTable(id("t2", "b")).build()),
            new JoinStep(
                new StepResult(0),
                new StepResult(1),
                join(id("t1", "a"), id("t2", "b"), equalTo(id("a.id"), id("b.id")))),
            new ProjectStep(new StepResult(2), List.of(id("a.x"), id("b.y")))),
        plan.getSteps());
  }

  @Test
  void should_explain_grouped_time_series_predictor_join() {
    QueryPlan plan =
        plan(
            "SELECT t.region, p.y FROM int1.sales AS t JOIN mindsdb.tp3 AS p"
                + " ON t.region = p.region WHERE t.ts > LATEST");

    assertEquals(
        "0: FetchDataframe(integration=int1) SELECT DISTINCT t.region AS region FROM sales AS t\n"
            + "1: MapReduce(result_0) reduce=UNION\n"
            + "  FetchDataframe(integration=int1) SELECT * FROM sales AS t"
            + " WHERE t.ts IS NOT NULL AND t.region = $var[region] ORDER BY t.ts DESC LIMIT 10\n"
            + "2: ApplyTimeseriesPredictor(result_1) mindsdb.tp3"
            + " output_time_filter=t.ts > LATEST\n"
            + "3: Join(result_1, result_2) result_1 AS t JOIN result_2 AS p\n"
            + "4: Project(result_3) columns=[t.region, p.y]\n",
        plan.explain());
    assertTrue(plan.validate().isEmpty());
  }

  @Test
  void should_plan_union_and_create_table() {
    QueryPlan union = plan("SELECT x FROM int1.t1 UNION ALL SELECT x FROM int2.t2");
    QueryPlan create =
        plan("CREATE TABLE int2.sales_copy AS SELECT * FROM int1.t1 WHERE y = 'a'");

    assertEquals(3, union.size());
    assertEquals(
        "0: FetchDataframe(integration=int1) SELECT * FROM t1 WHERE t1.y = 'a'\n"
            + "1: SaveToTable(result_0) table=int2.sales_copy\n",
        create.explain());
    assertEquals(
        new FetchDataframeStep(
            "int1",
            select(star()).fromTable(id("t1")).where(equalTo(id("t1.y"), constant("a"))).build()),
        create.getStep(new StepResult(0)));
  }

  @Test
  void should_report_planning_errors() {
    assertThrows(
        AmbiguousColumnException.class,
        () -> plan("SELECT * FROM int1.t1 AS a JOIN int2.t2 AS b ON a.id = b.id WHERE x = 1"));
    assertThrows(
        DualPredictorJoinException.class,
        () -> plan("SELECT * FROM mindsdb.tp3 AS a JOIN mindsdb.sales_forecast AS b ON a.k = b.k"));
    assertThrows(
        ConflictingOrderByException.class,
        () ->
            plan(
                "SELECT * FROM int1.sales AS t JOIN mindsdb.tp3 AS p ON t.k = p.k"
                    + " ORDER BY t.ts"));
  }

  private QueryPlan plan(String sql) {
    return planner.plan(parser.parse(sql));
  }
}
