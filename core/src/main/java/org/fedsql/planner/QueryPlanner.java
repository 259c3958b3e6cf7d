/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner;

import lombok.extern.log4j.Log4j2;
import org.fedsql.ast.statement.Statement;
import org.fedsql.planner.config.PlannerSettings;
import org.fedsql.planner.config.PredictorMetadataProvider;
import org.fedsql.planner.plan.QueryPlan;
import org.fedsql.planner.resolver.IdentifierResolver;
import org.fedsql.planner.rewriter.StatementRewriter;

/**
 * Compiles a statement over integrations and predictors into a {@link QueryPlan}. Planning does
 * no I/O; an instance only holds configuration and can be shared between threads.
 */
@Log4j2
public class QueryPlanner {

  private final IdentifierResolver resolver;

  private final StatementRewriter rewriter;

  private final PredictorMetadataProvider metadataProvider;

  public QueryPlanner(PlannerSettings settings) {
    this(settings, settings);
  }

  /**
   * Constructor of QueryPlanner.
   *
   * @param settings integrations and namespaces
   * @param metadataProvider source of predictor metadata, in place of the settings
   */
  public QueryPlanner(PlannerSettings settings, PredictorMetadataProvider metadataProvider) {
    this.resolver = new IdentifierResolver(settings);
    this.rewriter = new StatementRewriter(resolver);
    this.metadataProvider = metadataProvider;
  }

  /**
   * Plan a statement.
   *
   * @param statement parsed statement
   * @return plan whose last step produces the statement result
   * @throws org.fedsql.planner.exception.PlanningException if the statement cannot be planned
   */
  public QueryPlan plan(Statement statement) {
    PlanningContext context = new PlanningContext(resolver, rewriter, metadataProvider);
    statement.accept(new StatementPlanner(context), null);
    QueryPlan plan = context.getPlan().build();
    log.info("Planned {} step(s) for statement: {}", plan.size(), statement);
    return plan;
  }
}
