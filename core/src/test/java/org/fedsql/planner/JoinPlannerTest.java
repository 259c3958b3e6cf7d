/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner;

import static org.fedsql.ast.dsl.AstDSL.and;
import static org.fedsql.ast.dsl.AstDSL.compare;
import static org.fedsql.ast.dsl.AstDSL.constant;
import static org.fedsql.ast.dsl.AstDSL.desc;
import static org.fedsql.ast.dsl.AstDSL.equalTo;
import static org.fedsql.ast.dsl.AstDSL.function;
import static org.fedsql.ast.dsl.AstDSL.id;
import static org.fedsql.ast.dsl.AstDSL.join;
import static org.fedsql.ast.dsl.AstDSL.select;
import static org.fedsql.ast.dsl.AstDSL.star;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.ast.expression.UnresolvedExpression;
import org.fedsql.ast.statement.Select;
import org.fedsql.ast.tree.Join;
import org.fedsql.planner.config.PlannerSettings;
import org.fedsql.planner.exception.AmbiguousColumnException;
import org.fedsql.planner.exception.DualPredictorJoinException;
import org.fedsql.planner.exception.UnresolvedColumnException;
import org.fedsql.planner.exception.UnsupportedJoinOperandException;
import org.fedsql.planner.plan.PlanStep;
import org.fedsql.planner.plan.StepResult;
import org.fedsql.planner.plan.step.FetchDataframeStep;
import org.fedsql.planner.plan.step.FilterStep;
import org.fedsql.planner.plan.step.GroupByStep;
import org.fedsql.planner.plan.step.JoinStep;
import org.fedsql.planner.plan.step.LimitOffsetStep;
import org.fedsql.planner.plan.step.OrderByStep;
import org.fedsql.planner.plan.step.ProjectStep;
import org.fedsql.planner.predictor.PredictorPlanner;
import org.fedsql.planner.predictor.TimeSeriesPredictorPlanner;
import org.fedsql.planner.resolver.IdentifierResolver;
import org.fedsql.planner.rewriter.StatementRewriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class JoinPlannerTest {

  private static final UnresolvedExpression ON_ID = equalTo(id("a.id"), id("b.id"));

  private PlanningContext context;

  private JoinPlanner planner;

  @BeforeEach
  void setUp() {
    PlannerSettings settings =
        PlannerSettings.builder().integration("int1").integration("int2").build();
    IdentifierResolver resolver = new IdentifierResolver(settings);
    context = new PlanningContext(resolver, new StatementRewriter(resolver), settings);
    planner =
        new JoinPlanner(
            context, new PredictorPlanner(context), new TimeSeriesPredictorPlanner(context));
  }

  @Test
  void should_fetch_both_tables_and_join_them() {
    Select query =
        select(id("a.x"), id("b.y"))
            .fromTable(join(id("int1.t1", "a"), id("int2.t2", "b"), ON_ID))
            .build();

    StepResult result = planner.plan(query, null);

    assertEquals(new StepResult(3), result);
    assertEquals(
        List.of(
            fetchAll("int1", id("t1", "a")),
            fetchAll("int2", id("t2", "b")),
            new JoinStep(
                new StepResult(0),
                new StepResult(1),
                join(id("t1", "a"), id("t2", "b"), ON_ID)),
            new ProjectStep(new StepResult(2), List.of(id("a.x"), id("b.y")))),
        steps());
  }

  @Test
  void should_apply_every_clause_after_the_join() {
    UnresolvedExpression where = compare(">", id("a.x"), constant(1));
    UnresolvedExpression having = compare(">", function("count", id("b.y")), constant(2));
    Select query =
        select(id("a.x"), function("count", id("b.y")).withAlias("cnt"))
            .fromTable(join(id("int1.t1", "a"), id("int2.t2", "b"), Join.JoinType.LEFT, ON_ID))
            .where(where)
            .groupBy(List.of(id("a.x")))
            .having(having)
            .orderBy(List.of(desc(id("cnt"))))
            .limit(10)
            .offset(5)
            .build();

    planner.plan(query, null);

    List<PlanStep> steps = steps();
    assertEquals(9, steps.size());
    assertEquals(
        new JoinStep(
            new StepResult(0),
            new StepResult(1),
            join(id("t1", "a"), id("t2", "b"), Join.JoinType.LEFT, ON_ID)),
        steps.get(2));
    assertEquals(
        List.of(
            new FilterStep(new StepResult(2), where),
            new GroupByStep(
                new StepResult(3),
                List.of(id("a.x")),
                List.of(id("a.x"), function("count", id("b.y")))),
            new FilterStep(new StepResult(4), having),
            new OrderByStep(new StepResult(5), List.of(desc(id("cnt")))),
            new LimitOffsetStep(new StepResult(6), 10, 5),
            new ProjectStep(
                new StepResult(7),
                List.of(id("a.x"), new Identifier(List.of("count(b.y)"), "cnt")))),
        steps.subList(3, 9));
  }

  @Test
  void should_qualify_join_condition_per_side() {
    Select query =
        select(star())
            .fromTable(
                join(id("int2.t2"), id("int1.schema.t1"), equalTo(id("t1.id"), id("int2.t2.id"))))
            .build();

    planner.plan(query, null);

    List<PlanStep> steps = steps();
    assertEquals(fetchAll("int2", id("t2")), steps.get(0));
    assertEquals(fetchAll("int1", id("schema.t1")), steps.get(1));
    assertEquals(
        new JoinStep(
            new StepResult(0),
            new StepResult(1),
            join(id("t2"), id("schema.t1"), equalTo(id("schema.t1.id"), id("t2.id")))),
        steps.get(2));
  }

  @Test
  void should_hoist_derived_table_on_the_left() {
    Select derived =
        select(id("x"))
            .fromTable(id("int1.t1"))
            .where(equalTo(id("x"), constant(1)))
            .limit(7)
            .alias("s")
            .build();
    Select query =
        select(id("s.x"), id("b.y"))
            .fromTable(join(derived, id("int2.t2", "b"), equalTo(id("s.id"), id("b.id"))))
            .where(compare(">", id("b.y"), constant(0)))
            .build();

    planner.plan(query, null);

    assertEquals(
        List.of(
            fetchAll("int1", id("t1", "s")),
            fetchAll("int2", id("t2", "b")),
            new JoinStep(
                new StepResult(0),
                new StepResult(1),
                join(id("t1", "s"), id("t2", "b"), equalTo(id("s.id"), id("b.id")))),
            new FilterStep(
                new StepResult(2),
                and(equalTo(id("s.x"), constant(1)), compare(">", id("b.y"), constant(0)))),
            new LimitOffsetStep(new StepResult(3), 7, null),
            new ProjectStep(new StepResult(4), List.of(id("s.x"), id("b.y")))),
        steps());
  }

  @Test
  void should_reject_unsupported_join_operands() {
    Select derived = select(star()).fromTable(id("int2.t2")).alias("s").build();
    Select rightDerived =
        select(star()).fromTable(join(id("int1.t1", "a"), derived, ON_ID)).build();
    Select nested =
        select(star())
            .fromTable(
                join(
                    join(id("int1.t1", "a"), id("int2.t2", "b"), ON_ID),
                    id("int1.t3", "c"),
                    equalTo(id("a.id"), id("c.id"))))
            .build();

    assertThrows(UnsupportedJoinOperandException.class, () -> planner.plan(rightDerived, null));
    assertThrows(UnsupportedJoinOperandException.class, () -> planner.plan(nested, null));
  }

  @Test
  void should_reject_bare_columns() {
    Join tables = join(id("int1.t1", "a"), id("int2.t2", "b"), ON_ID);
    Select bareWhere =
        select(star()).fromTable(tables).where(equalTo(id("x"), constant(1))).build();
    Select bareCondition =
        select(star())
            .fromTable(join(id("int1.t1", "a"), id("int2.t2", "b"), equalTo(id("id"), id("b.id"))))
            .build();

    assertThrows(AmbiguousColumnException.class, () -> planner.plan(bareWhere, null));
    assertThrows(AmbiguousColumnException.class, () -> planner.plan(bareCondition, null));
  }

  @Test
  void should_reject_condition_column_matching_both_tables() {
    Select query =
        select(star())
            .fromTable(
                join(id("int1.sales"), id("int2.sales"), equalTo(id("sales.id"), id("sales.id"))))
            .build();

    assertThrows(AmbiguousColumnException.class, () -> planner.plan(query, null));
  }

  @Test
  void should_name_sides_apart_when_tables_share_a_name() {
    Select query =
        select(star())
            .fromTable(
                join(
                    id("int1.sales"),
                    id("int2.sales"),
                    equalTo(id("int1.sales.id"), id("int2.sales.store_id"))))
            .build();

    planner.plan(query, null);

    List<PlanStep> steps = steps();
    assertEquals(fetchAll("int1", id("sales")), steps.get(0));
    assertEquals(fetchAll("int2", id("sales")), steps.get(1));
    assertEquals(
        new JoinStep(
            new StepResult(0),
            new StepResult(1),
            join(
                id("sales", "int1_sales"),
                id("sales", "int2_sales"),
                equalTo(id("int1_sales.id"), id("int2_sales.store_id")))),
        steps.get(2));
  }

  @Test
  void should_accept_target_alias_in_order_by_regardless_of_case() {
    Select query =
        select(id("a.x", "Total"))
            .fromTable(join(id("int1.t1", "a"), id("int2.t2", "b"), ON_ID))
            .orderBy(List.of(desc(id("total"))))
            .build();

    planner.plan(query, null);

    assertEquals(
        new OrderByStep(new StepResult(2), List.of(desc(id("total")))), steps().get(3));
  }

  @Test
  void should_reject_condition_on_unknown_table() {
    UnresolvedExpression condition = equalTo(id("c.id"), id("b.id"));
    Select query =
        select(star()).fromTable(join(id("int1.t1", "a"), id("int2.t2", "b"), condition)).build();

    assertThrows(UnresolvedColumnException.class, () -> planner.plan(query, null));
  }

  @Test
  void should_reject_join_of_two_predictors() {
    Select query =
        select(star())
            .fromTable(join(id("mindsdb.p1", "x"), id("mindsdb.p2", "y"), null))
            .build();

    assertThrows(DualPredictorJoinException.class, () -> planner.plan(query, null));
  }

  private static FetchDataframeStep fetchAll(String integration, Identifier table) {
    return new FetchDataframeStep(integration, select(star()).fromTable(table).build());
  }

  private List<PlanStep> steps() {
    return context.getPlan().build().getSteps();
  }
}
