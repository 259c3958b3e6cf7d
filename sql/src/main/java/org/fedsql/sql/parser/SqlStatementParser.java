/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.sql.parser;

import lombok.extern.log4j.Log4j2;
import org.apache.calcite.config.Lex;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.parser.SqlParseException;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.parser.ddl.SqlDdlParserImpl;
import org.fedsql.ast.statement.Statement;
import org.fedsql.common.parser.SyntaxCheckException;

/**
 * Parses SQL text into a planner statement. Calcite, with its DDL extension for {@code CREATE
 * TABLE ... AS SELECT}, does the parsing; identifiers keep the case they are written in.
 */
@Log4j2
public class SqlStatementParser {

  private static final SqlParser.Config PARSER_CONFIG =
      SqlParser.config().withParserFactory(SqlDdlParserImpl.FACTORY).withLex(Lex.MYSQL);

  private final SqlNodeConverter converter = new SqlNodeConverter();

  /**
   * Parse one statement.
   *
   * @param query SQL text
   * @return statement tree
   * @throws SyntaxCheckException if the text is not valid SQL or uses a construct the planner
   *     does not model
   */
  public Statement parse(String query) {
    SqlNode node;
    try {
      node = SqlParser.create(query, PARSER_CONFIG).parseStmt();
    } catch (SqlParseException e) {
      throw new SyntaxCheckException("Failed to parse query: " + e.getMessage(), e);
    }
    Statement statement;
    try {
      statement = converter.convertStatement(node);
    } catch (SyntaxCheckException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SyntaxCheckException("Failed to convert query: " + e.getMessage(), e);
    }
    log.debug("Parsed statement: {}", statement);
    return statement;
  }
}
