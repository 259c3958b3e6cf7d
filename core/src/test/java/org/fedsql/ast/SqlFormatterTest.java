/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast;

import static org.fedsql.ast.dsl.AstDSL.and;
import static org.fedsql.ast.dsl.AstDSL.between;
import static org.fedsql.ast.dsl.AstDSL.compare;
import static org.fedsql.ast.dsl.AstDSL.constant;
import static org.fedsql.ast.dsl.AstDSL.createTableAs;
import static org.fedsql.ast.dsl.AstDSL.desc;
import static org.fedsql.ast.dsl.AstDSL.equalTo;
import static org.fedsql.ast.dsl.AstDSL.function;
import static org.fedsql.ast.dsl.AstDSL.id;
import static org.fedsql.ast.dsl.AstDSL.isNotNull;
import static org.fedsql.ast.dsl.AstDSL.join;
import static org.fedsql.ast.dsl.AstDSL.latest;
import static org.fedsql.ast.dsl.AstDSL.or;
import static org.fedsql.ast.dsl.AstDSL.partitionValue;
import static org.fedsql.ast.dsl.AstDSL.select;
import static org.fedsql.ast.dsl.AstDSL.star;
import static org.fedsql.ast.dsl.AstDSL.unionAll;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SqlFormatterTest {

  @Test
  void should_render_select_with_every_clause() {
    Node query =
        select(id("t.region"), function("count", star()).withAlias("cnt"))
            .fromTable(id("int1.sales", "t"))
            .where(and(compare(">", id("t.amount"), constant(10)), isNotNull(id("t.ts"))))
            .groupBy(List.of(id("t.region")))
            .having(compare(">", function("count", star()), constant(1)))
            .orderBy(List.of(desc(id("cnt"))))
            .limit(5)
            .offset(2)
            .build();

    assertEquals(
        "SELECT t.region, count(*) AS cnt FROM int1.sales AS t"
            + " WHERE t.amount > 10 AND t.ts IS NOT NULL"
            + " GROUP BY t.region HAVING count(*) > 1 ORDER BY cnt DESC LIMIT 5 OFFSET 2",
        query.toString());
  }

  @Test
  void should_parenthesize_mixed_logical_operators() {
    Node condition =
        and(or(equalTo(id("a"), constant(1)), equalTo(id("b"), constant(2))), id("c"));

    assertEquals("(a = 1 OR b = 2) AND c", condition.toString());
  }

  @Test
  void should_render_literals_and_markers() {
    assertEquals("'it''s'", constant("it's").toString());
    assertEquals("TRUE", constant(true).toString());
    assertEquals("ts > LATEST", compare(">", id("ts"), latest()).toString());
    assertEquals(
        "region = $var[region]", equalTo(id("region"), partitionValue("region")).toString());
    assertEquals(
        "ts BETWEEN '2020-01-01' AND '2020-02-01'",
        between(id("ts"), constant("2020-01-01"), constant("2020-02-01")).toString());
  }

  @Test
  void should_omit_alias_when_asked() {
    assertEquals("t.x", SqlFormatter.formatWithoutAlias(id("t.x", "y")));
    assertEquals("t.x AS y", SqlFormatter.format(id("t.x", "y")));
  }

  @Test
  void should_render_joins_derived_tables_and_unions() {
    Node derived = select(star()).fromTable(id("int1.t1")).alias("s").build();
    Node query =
        select(star())
            .fromTable(join(derived, id("int2.t2", "b"), equalTo(id("s.id"), id("b.id"))))
            .build();

    assertEquals(
        "SELECT * FROM (SELECT * FROM int1.t1) AS s JOIN int2.t2 AS b ON s.id = b.id",
        query.toString());
    assertEquals(
        "SELECT * FROM int1.t1 UNION ALL SELECT * FROM int2.t2",
        unionAll(
                select(star()).fromTable(id("int1.t1")).build(),
                select(star()).fromTable(id("int2.t2")).build())
            .toString());
    assertEquals(
        "CREATE TABLE int1.copy AS SELECT * FROM int2.t2",
        createTableAs("int1.copy", select(star()).fromTable(id("int2.t2")).build()).toString());
  }
}
