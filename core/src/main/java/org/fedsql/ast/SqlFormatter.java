/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.fedsql.ast.expression.BetweenOperation;
import org.fedsql.ast.expression.BinaryOperation;
import org.fedsql.ast.expression.Constant;
import org.fedsql.ast.expression.Function;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.ast.expression.Latest;
import org.fedsql.ast.expression.NullConstant;
import org.fedsql.ast.expression.OrderBy;
import org.fedsql.ast.expression.PartitionValue;
import org.fedsql.ast.expression.Star;
import org.fedsql.ast.expression.UnaryOperation;
import org.fedsql.ast.expression.UnresolvedExpression;
import org.fedsql.ast.statement.CreateTableAsSelect;
import org.fedsql.ast.statement.Select;
import org.fedsql.ast.statement.Union;
import org.fedsql.ast.tree.Join;

/**
 * Renders an AST back to SQL text. The context flag tells whether the alias of the visited node
 * is printed; operands of an expression never carry theirs.
 */
public class SqlFormatter extends AbstractNodeVisitor<String, Boolean> {

  private static final SqlFormatter INSTANCE = new SqlFormatter();

  public static String format(Node node) {
    return node.accept(INSTANCE, true);
  }

  public static String formatWithoutAlias(Node node) {
    return node.accept(INSTANCE, false);
  }

  @Override
  public String visitIdentifier(Identifier node, Boolean withAlias) {
    return aliased(node.getPath(), node.getAlias(), withAlias);
  }

  @Override
  public String visitStar(Star node, Boolean withAlias) {
    return "*";
  }

  @Override
  public String visitConstant(Constant node, Boolean withAlias) {
    Object value = node.getValue();
    String text;
    if (value == null) {
      text = "NULL";
    } else if (value instanceof String) {
      text = "'" + ((String) value).replace("'", "''") + "'";
    } else if (value instanceof Boolean) {
      text = value.toString().toUpperCase(Locale.ROOT);
    } else {
      text = value.toString();
    }
    return aliased(text, node.getAlias(), withAlias);
  }

  @Override
  public String visitNullConstant(NullConstant node, Boolean withAlias) {
    return "NULL";
  }

  @Override
  public String visitLatest(Latest node, Boolean withAlias) {
    return "LATEST";
  }

  @Override
  public String visitPartitionValue(PartitionValue node, Boolean withAlias) {
    return "$var[" + node.getColumn() + "]";
  }

  @Override
  public String visitBinaryOperation(BinaryOperation node, Boolean withAlias) {
    String text =
        operand(node, node.getLeft())
            + " "
            + node.getOp().toUpperCase(Locale.ROOT)
            + " "
            + operand(node, node.getRight());
    return aliased(text, node.getAlias(), withAlias);
  }

  @Override
  public String visitUnaryOperation(UnaryOperation node, Boolean withAlias) {
    String operand = node.getOperand().accept(this, false);
    if (node.getOperand() instanceof BinaryOperation) {
      operand = "(" + operand + ")";
    }
    String text =
        node.getOp().equals("-")
            ? "-" + operand
            : node.getOp().toUpperCase(Locale.ROOT) + " " + operand;
    return aliased(text, node.getAlias(), withAlias);
  }

  @Override
  public String visitBetween(BetweenOperation node, Boolean withAlias) {
    String text =
        node.getValue().accept(this, false)
            + " BETWEEN "
            + node.getFrom().accept(this, false)
            + " AND "
            + node.getTo().accept(this, false);
    return aliased(text, node.getAlias(), withAlias);
  }

  @Override
  public String visitFunction(Function node, Boolean withAlias) {
    String text =
        node.getName()
            + "("
            + (node.isDistinct() ? "DISTINCT " : "")
            + list(node.getArgs(), false)
            + ")";
    return aliased(text, node.getAlias(), withAlias);
  }

  @Override
  public String visitOrderBy(OrderBy node, Boolean withAlias) {
    return node.getField().accept(this, false) + " " + node.getDirection();
  }

  @Override
  public String visitJoin(Join node, Boolean withAlias) {
    StringBuilder sb = new StringBuilder();
    sb.append(relation(node.getLeft()))
        .append(' ')
        .append(node.getJoinType().getKeyword())
        .append(' ')
        .append(relation(node.getRight()));
    if (node.getCondition() != null) {
      sb.append(" ON ").append(node.getCondition().accept(this, false));
    }
    return sb.toString();
  }

  @Override
  public String visitSelect(Select node, Boolean withAlias) {
    StringBuilder sb = new StringBuilder("SELECT ");
    if (node.isDistinct()) {
      sb.append("DISTINCT ");
    }
    sb.append(list(node.getTargets(), true));
    if (node.getFromTable() != null) {
      sb.append(" FROM ").append(relation(node.getFromTable()));
    }
    if (node.getWhere() != null) {
      sb.append(" WHERE ").append(node.getWhere().accept(this, false));
    }
    if (node.hasGroupBy()) {
      sb.append(" GROUP BY ").append(list(node.getGroupBy(), false));
    }
    if (node.getHaving() != null) {
      sb.append(" HAVING ").append(node.getHaving().accept(this, false));
    }
    if (node.hasOrderBy()) {
      sb.append(" ORDER BY ").append(list(node.getOrderBy(), false));
    }
    if (node.getLimit() != null) {
      sb.append(" LIMIT ").append(node.getLimit());
    }
    if (node.getOffset() != null) {
      sb.append(" OFFSET ").append(node.getOffset());
    }
    return sb.toString();
  }

  @Override
  public String visitUnion(Union node, Boolean withAlias) {
    return node.getLeft().accept(this, true)
        + (node.isUnique() ? " UNION " : " UNION ALL ")
        + node.getRight().accept(this, true);
  }

  @Override
  public String visitCreateTableAsSelect(CreateTableAsSelect node, Boolean withAlias) {
    String text =
        "CREATE " + (node.isReplace() ? "OR REPLACE " : "") + "TABLE " + node.getName().getPath();
    return node.getFromSelect() == null ? text : text + " AS " + node.getFromSelect();
  }

  private String relation(Node relation) {
    if (relation instanceof Select) {
      Select select = (Select) relation;
      return aliased("(" + select.accept(this, false) + ")", select.getAlias(), true);
    }
    return relation.accept(this, true);
  }

  private String operand(BinaryOperation parent, UnresolvedExpression operand) {
    String text = operand.accept(this, false);
    if (operand instanceof BinaryOperation) {
      BinaryOperation child = (BinaryOperation) operand;
      boolean logical = child.isOp("and") || child.isOp("or");
      if (logical && !child.getOp().equals(parent.getOp())) {
        return "(" + text + ")";
      }
    }
    return text;
  }

  private String list(List<? extends Node> nodes, boolean withAlias) {
    return nodes.stream().map(n -> n.accept(this, withAlias)).collect(Collectors.joining(", "));
  }

  private static String aliased(String text, String alias, Boolean withAlias) {
    return withAlias && alias != null ? text + " AS " + alias : text;
  }
}
