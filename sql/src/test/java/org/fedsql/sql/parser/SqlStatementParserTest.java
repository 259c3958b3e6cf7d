/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.sql.parser;

import static org.fedsql.ast.dsl.AstDSL.and;
import static org.fedsql.ast.dsl.AstDSL.between;
import static org.fedsql.ast.dsl.AstDSL.compare;
import static org.fedsql.ast.dsl.AstDSL.constant;
import static org.fedsql.ast.dsl.AstDSL.desc;
import static org.fedsql.ast.dsl.AstDSL.equalTo;
import static org.fedsql.ast.dsl.AstDSL.function;
import static org.fedsql.ast.dsl.AstDSL.id;
import static org.fedsql.ast.dsl.AstDSL.isNotNull;
import static org.fedsql.ast.dsl.AstDSL.join;
import static org.fedsql.ast.dsl.AstDSL.latest;
import static org.fedsql.ast.dsl.AstDSL.not;
import static org.fedsql.ast.dsl.AstDSL.nullConstant;
import static org.fedsql.ast.dsl.AstDSL.select;
import static org.fedsql.ast.dsl.AstDSL.star;
import static org.fedsql.ast.dsl.AstDSL.union;
import static org.fedsql.ast.dsl.AstDSL.unionAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import org.fedsql.ast.expression.BinaryOperation;
import org.fedsql.ast.expression.Function;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.ast.statement.CreateTableAsSelect;
import org.fedsql.ast.tree.Join;
import org.fedsql.common.parser.SyntaxCheckException;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SqlStatementParserTest {

  private final SqlStatementParser parser = new SqlStatementParser();

  @Test
  void should_parse_select_with_every_clause() {
    assertEquals(
        select(id("t.region"), function("count", star()).withAlias("cnt"))
            .fromTable(id("int1.sales", "t"))
            .where(compare(">", id("t.amount"), constant(10)))
            .groupBy(List.of(id("t.region")))
            .having(compare(">", function("count", star()), constant(1)))
            .orderBy(List.of(desc(id("cnt"))))
            .limit(5)
            .offset(2)
            .build(),
        parser.parse(
            "SELECT t.region, count(*) AS cnt FROM int1.sales AS t WHERE t.amount > 10"
                + " GROUP BY t.region HAVING count(*) > 1 ORDER BY cnt DESC LIMIT 5 OFFSET 2"));
  }

  @Test
  void should_keep_identifier_case_and_quoting() {
    assertEquals(
        select(new Identifier(List.of("my col"))).fromTable(id("Int1.MyTable")).build(),
        parser.parse("SELECT `my col` FROM Int1.MyTable"));
  }

  @Test
  void should_parse_literals() {
    assertEquals(
        select(star())
            .fromTable(id("int1.t1"))
            .where(
                and(
                    equalTo(id("a"), constant("it's")),
                    equalTo(id("b"), constant(1.5)),
                    equalTo(id("c"), constant(true)),
                    equalTo(id("d"), constant(3000000000L)),
                    isNotNull(id("e")),
                    new BinaryOperation("is", id("f"), nullConstant())))
            .build(),
        parser.parse(
            "SELECT * FROM int1.t1 WHERE a = 'it''s' AND b = 1.5 AND c = TRUE"
                + " AND d = 3000000000 AND e IS NOT NULL AND f IS NULL"));
  }

  @Test
  void should_parse_time_filters() {
    assertEquals(
        select(star())
            .fromTable(id("int1.sales"))
            .where(
                and(
                    compare(">", id("ts"), latest()),
                    between(id("ts"), constant("2020-01"), constant("2020-03")),
                    not(between(id("n"), constant(1), constant(2)))))
            .build(),
        parser.parse(
            "SELECT * FROM int1.sales WHERE ts > LATEST"
                + " AND ts BETWEEN '2020-01' AND '2020-03' AND n NOT BETWEEN 1 AND 2"));
  }

  @Test
  void should_parse_distinct_and_functions() {
    assertEquals(
        select(new Function("count", List.of(id("x")), true, null))
            .distinct(true)
            .fromTable(id("int1.t1"))
            .build(),
        parser.parse("SELECT DISTINCT count(DISTINCT x) FROM int1.t1"));
  }

  @Test
  void should_parse_joins_and_derived_tables() {
    assertEquals(
        select(id("s.x"), id("b.y"))
            .fromTable(
                join(
                    select(id("x")).fromTable(id("int1.t1")).alias("s").build(),
                    id("int2.t2", "b"),
                    Join.JoinType.LEFT,
                    equalTo(id("s.id"), id("b.id"))))
            .build(),
        parser.parse(
            "SELECT s.x, b.y FROM (SELECT x FROM int1.t1) AS s"
                + " LEFT JOIN int2.t2 AS b ON s.id = b.id"));
    assertEquals(
        select(star())
            .fromTable(join(id("int1.t1", "a"), id("int2.t2", "b"), Join.JoinType.CROSS, null))
            .build(),
        parser.parse("SELECT * FROM int1.t1 AS a, int2.t2 AS b"));
  }

  @Test
  void should_parse_unions() {
    assertEquals(
        union(
            select(id("x")).fromTable(id("int1.t1")).build(),
            select(id("x")).fromTable(id("int2.t2")).build()),
        parser.parse("SELECT x FROM int1.t1 UNION SELECT x FROM int2.t2"));
    assertEquals(
        unionAll(
            select(id("x")).fromTable(id("int1.t1")).build(),
            select(id("x")).fromTable(id("int2.t2")).build()),
        parser.parse("SELECT x FROM int1.t1 UNION ALL SELECT x FROM int2.t2"));
  }

  @Test
  void should_parse_create_table_as_select() {
    assertEquals(
        new CreateTableAsSelect(
            id("int1.sales_copy"), select(star()).fromTable(id("int2.t2")).build(), true),
        parser.parse("CREATE OR REPLACE TABLE int1.sales_copy AS SELECT * FROM int2.t2"));
    assertEquals(
        new CreateTableAsSelect(
            id("int1.sales_copy"), select(star()).fromTable(id("int2.t2")).build(), false),
        parser.parse("CREATE TABLE int1.sales_copy AS SELECT * FROM int2.t2"));
  }

  @Test
  void should_keep_integer_literal_beyond_long_range_as_decimal() {
    assertEquals(
        select(star())
            .fromTable(id("int1.t1"))
            .where(equalTo(id("x"), constant(new BigDecimal("99999999999999999999"))))
            .build(),
        parser.parse("SELECT * FROM int1.t1 WHERE x = 99999999999999999999"));
  }

  @Test
  void should_fail_on_invalid_sql() {
    SyntaxCheckException exception =
        assertThrows(SyntaxCheckException.class, () -> parser.parse("SELEC * FROM int1.t1"));
    assertTrue(exception.getMessage().startsWith("Failed to parse query"));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "SELECT * FROM int1.t1 NATURAL JOIN int1.t2",
        "SELECT * FROM int1.t1 JOIN int1.t2 USING (id)",
        "SELECT t.* FROM int1.t1 AS t",
        "SELECT * FROM int1.t1 WHERE a = ?",
        "SELECT x FROM int1.t1 UNION SELECT x FROM int2.t2 ORDER BY x",
        "SELECT * FROM int1.t1 LIMIT 99999999999",
        "SELECT * FROM int1.t1 LIMIT 10 OFFSET 99999999999"
      })
  void should_fail_on_constructs_it_does_not_model(String query) {
    assertThrows(SyntaxCheckException.class, () -> parser.parse(query));
  }
}
