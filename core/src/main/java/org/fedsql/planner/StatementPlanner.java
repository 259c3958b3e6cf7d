/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.fedsql.ast.AbstractNodeVisitor;
import org.fedsql.ast.Node;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.ast.statement.CreateTableAsSelect;
import org.fedsql.ast.statement.Select;
import org.fedsql.ast.statement.Union;
import org.fedsql.ast.tree.Join;
import org.fedsql.planner.exception.UnsupportedStatementException;
import org.fedsql.planner.plan.StepResult;
import org.fedsql.planner.plan.step.SaveToTableStep;
import org.fedsql.planner.plan.step.UnionStep;
import org.fedsql.planner.predictor.PredictorPlanner;
import org.fedsql.planner.predictor.TimeSeriesPredictorPlanner;
import org.fedsql.planner.resolver.SourceTable;

/**
 * Dispatches a statement to the planner for its shape. The context of the visit is the
 * integration a CREATE TABLE writes to, null outside of one. Each visit returns the output of the
 * last step planned for the visited statement.
 */
@Log4j2
class StatementPlanner extends AbstractNodeVisitor<StepResult, String> {

  private final PlanningContext context;

  private final PredictorPlanner predictorPlanner;

  private final JoinPlanner joinPlanner;

  StatementPlanner(PlanningContext context) {
    this.context = context;
    this.predictorPlanner = new PredictorPlanner(context);
    this.joinPlanner =
        new JoinPlanner(context, predictorPlanner, new TimeSeriesPredictorPlanner(context));
  }

  @Override
  public StepResult visitSelect(Select node, String integration) {
    Node from = node.getFromTable();
    if (from instanceof Identifier) {
      if (context.getResolver().isPredictor((Identifier) from)) {
        log.debug("Selecting from predictor {}", from);
        return predictorPlanner.planSelectFromPredictor(node);
      }
      return context.planIntegrationSelect(node);
    }
    if (from instanceof Select) {
      log.debug("Planning derived table {} before the outer query", from);
      StepResult inner = from.accept(this, integration);
      StepResult last = context.planClauseTail(node, inner);
      return context.planProject(node.getTargets(), last);
    }
    if (from instanceof Join) {
      return joinPlanner.plan(node, integration);
    }
    if (from == null) {
      throw new UnsupportedStatementException("SELECT without FROM is not supported: " + node);
    }
    throw new UnsupportedStatementException("Unsupported FROM clause: " + from);
  }

  @Override
  public StepResult visitUnion(Union node, String integration) {
    StepResult left = node.getLeft().accept(this, integration);
    StepResult right = node.getRight().accept(this, integration);
    return context.add(new UnionStep(left, right, node.isUnique()));
  }

  @Override
  public StepResult visitCreateTableAsSelect(CreateTableAsSelect node, String integration) {
    if (node.getFromSelect() == null) {
      throw new UnsupportedStatementException("CREATE TABLE without a query: " + node);
    }
    SourceTable target = context.getResolver().resolveSourceTable(node.getName());
    StepResult data = node.getFromSelect().accept(this, target.integration());

    List<String> parts = new ArrayList<>();
    parts.add(target.integration());
    parts.addAll(target.table().getParts());
    return context.add(new SaveToTableStep(new Identifier(parts), data, node.isReplace()));
  }

  @Override
  public StepResult visitChildren(Node node, String integration) {
    throw new UnsupportedStatementException(
        "Unsupported statement type " + node.getClass().getSimpleName());
  }
}
