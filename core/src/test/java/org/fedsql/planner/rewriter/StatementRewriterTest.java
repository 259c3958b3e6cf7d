/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.rewriter;

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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.fedsql.ast.AbstractNodeVisitor;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.ast.statement.Select;
import org.fedsql.planner.config.PlannerSettings;
import org.fedsql.planner.exception.UnresolvedColumnException;
import org.fedsql.planner.exception.UnsupportedStatementException;
import org.fedsql.planner.resolver.IdentifierResolver;
import org.fedsql.planner.resolver.SourceTable;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class StatementRewriterTest {

  private final IdentifierResolver resolver =
      new IdentifierResolver(PlannerSettings.builder().integration("int1").build());

  private final StatementRewriter rewriter = new StatementRewriter(resolver);

  private final SourceTable table = new SourceTable("int1", id("t1"));

  @Test
  void should_qualify_every_clause_with_table() {
    Select query =
        select(id("x"), id("int1.t1.y", "yy"), function("count", id("z")).withAlias("c"))
            .fromTable(id("int1.t1"))
            .where(equalTo(id("x"), constant(1)))
            .groupBy(List.of(id("yy")))
            .orderBy(List.of(desc(id("c"))))
            .limit(3)
            .build();

    assertEquals(
        select(
                new Identifier(List.of("t1", "x"), "x"),
                id("t1.y", "yy"),
                function("count", id("t1.z")).withAlias("c"))
            .fromTable(id("t1"))
            .where(equalTo(id("t1.x"), constant(1)))
            .groupBy(List.of(id("yy")))
            .orderBy(List.of(desc(id("c"))))
            .limit(3)
            .build(),
        rewriter.rewrite(query, table));
  }

  @Test
  void should_match_target_alias_regardless_of_case() {
    Select query =
        select(function("sum", id("x")).withAlias("Total"))
            .fromTable(id("int1.t1"))
            .orderBy(List.of(desc(id("total"))))
            .build();

    assertEquals(List.of(desc(id("total"))), rewriter.rewrite(query, table).getOrderBy());
  }

  @Test
  void should_keep_input_untouched() {
    Select query = select(id("x")).fromTable(id("int1.t1")).build();
    Select copy = query.toBuilder().build();

    rewriter.rewrite(query, table);

    assertEquals(copy, query);
  }

  @Test
  void should_produce_columns_belonging_to_the_table() {
    Select rewritten =
        rewriter.rewrite(
            select(star())
                .fromTable(id("int1.t1"))
                .where(equalTo(id("a"), id("t1.b")))
                .orderBy(List.of(desc(id("int1.t1.c"))))
                .build(),
            table);

    List<Identifier> columns = new ArrayList<>();
    rewritten.accept(
        new AbstractNodeVisitor<Void, Void>() {
          @Override
          public Void visitIdentifier(Identifier node, Void context) {
            columns.add(node);
            return null;
          }
        },
        null);

    assertEquals(4, columns.size());
    columns.stream()
        .filter(column -> column.size() > 1)
        .forEach(column -> assertTrue(resolver.belongsTo(column, table), column.getPath()));
  }

  @Test
  void should_rewrite_derived_table_and_leave_outer_level() {
    Select inner =
        select(id("x")).fromTable(id("int1.t1")).where(equalTo(id("x"), constant(2))).build();
    Select query = select(id("sub.x")).fromTable(inner.withAlias("sub")).limit(1).build();

    Select expected =
        select(id("sub.x"))
            .fromTable(
                select(new Identifier(List.of("t1", "x"), "x"))
                    .fromTable(id("t1"))
                    .where(equalTo(id("t1.x"), constant(2)))
                    .alias("sub")
                    .build())
            .limit(1)
            .build();
    assertEquals(expected, rewriter.rewrite(query, table));
  }

  @Test
  void should_reject_columns_of_other_tables() {
    Select query = select(id("t2.x")).fromTable(id("int1.t1")).build();

    assertThrows(UnresolvedColumnException.class, () -> rewriter.rewrite(query, table));
  }

  @Test
  void should_reject_join_in_from_clause() {
    Select query =
        select(star())
            .fromTable(join(id("int1.t1"), id("int1.t2"), equalTo(id("t1.a"), id("t2.a"))))
            .build();

    assertThrows(UnsupportedStatementException.class, () -> rewriter.rewrite(query, table));
  }
}
