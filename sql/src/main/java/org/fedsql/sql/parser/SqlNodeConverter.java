/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.sql.parser;

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.calcite.sql.JoinConditionType;
import org.apache.calcite.sql.JoinType;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlCharStringLiteral;
import org.apache.calcite.sql.SqlDataTypeSpec;
import org.apache.calcite.sql.SqlDynamicParam;
import org.apache.calcite.sql.SqlFunction;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlIntervalQualifier;
import org.apache.calcite.sql.SqlJoin;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlLiteral;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;
import org.apache.calcite.sql.SqlNumericLiteral;
import org.apache.calcite.sql.SqlOrderBy;
import org.apache.calcite.sql.SqlSelect;
import org.apache.calcite.sql.SqlSelectKeyword;
import org.apache.calcite.sql.ddl.SqlCreateTable;
import org.apache.calcite.sql.fun.SqlBetweenOperator;
import org.apache.calcite.sql.fun.SqlStdOperatorTable;
import org.apache.calcite.sql.type.SqlTypeName;
import org.apache.calcite.sql.util.SqlVisitor;
import org.fedsql.ast.Node;
import org.fedsql.ast.expression.BetweenOperation;
import org.fedsql.ast.expression.BinaryOperation;
import org.fedsql.ast.expression.Constant;
import org.fedsql.ast.expression.Function;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.ast.expression.Latest;
import org.fedsql.ast.expression.NullConstant;
import org.fedsql.ast.expression.OrderBy;
import org.fedsql.ast.expression.Star;
import org.fedsql.ast.expression.UnaryOperation;
import org.fedsql.ast.expression.UnresolvedExpression;
import org.fedsql.ast.statement.CreateTableAsSelect;
import org.fedsql.ast.statement.Select;
import org.fedsql.ast.statement.Statement;
import org.fedsql.ast.statement.Union;
import org.fedsql.ast.tree.Join;
import org.fedsql.common.parser.SyntaxCheckException;
import org.fedsql.common.utils.StringUtils;

/** Converts Calcite parse trees into planner statements. */
public class SqlNodeConverter {

  private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);

  private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

  private static final Map<SqlKind, String> BINARY_OPERATORS =
      ImmutableMap.<SqlKind, String>builder()
          .put(SqlKind.EQUALS, "=")
          .put(SqlKind.NOT_EQUALS, "<>")
          .put(SqlKind.GREATER_THAN, ">")
          .put(SqlKind.GREATER_THAN_OR_EQUAL, ">=")
          .put(SqlKind.LESS_THAN, "<")
          .put(SqlKind.LESS_THAN_OR_EQUAL, "<=")
          .put(SqlKind.PLUS, "+")
          .put(SqlKind.MINUS, "-")
          .put(SqlKind.TIMES, "*")
          .put(SqlKind.DIVIDE, "/")
          .put(SqlKind.MOD, "%")
          .build();

  private static final Map<JoinType, Join.JoinType> JOIN_TYPES =
      ImmutableMap.of(
          JoinType.INNER, Join.JoinType.INNER,
          JoinType.LEFT, Join.JoinType.LEFT,
          JoinType.RIGHT, Join.JoinType.RIGHT,
          JoinType.FULL, Join.JoinType.FULL,
          JoinType.CROSS, Join.JoinType.CROSS,
          JoinType.COMMA, Join.JoinType.CROSS);

  private final ExpressionConverter expressionConverter = new ExpressionConverter();

  /** Convert a top level statement: a query or {@code CREATE TABLE ... AS query}. */
  public Statement convertStatement(SqlNode node) {
    if (node instanceof SqlCreateTable) {
      SqlCreateTable create = (SqlCreateTable) node;
      Statement query = create.query == null ? null : convertQuery(create.query);
      return new CreateTableAsSelect(
          new Identifier(create.name.names), query, create.getReplace());
    }
    return convertQuery(node);
  }

  private Statement convertQuery(SqlNode node) {
    if (node instanceof SqlOrderBy) {
      SqlOrderBy orderBy = (SqlOrderBy) node;
      if (!(orderBy.query instanceof SqlSelect)) {
        throw unsupported("ORDER BY or LIMIT over a UNION", node);
      }
      return convertSelect((SqlSelect) orderBy.query).toBuilder()
          .orderBy(convertOrderList(orderBy.orderList))
          .limit(intValue(orderBy.fetch))
          .offset(intValue(orderBy.offset))
          .build();
    }
    if (node instanceof SqlSelect) {
      return convertSelect((SqlSelect) node);
    }
    if (node.getKind() == SqlKind.UNION) {
      SqlCall union = (SqlCall) node;
      return new Union(
          convertQuery(union.operand(0)),
          convertQuery(union.operand(1)),
          union.getOperator() != SqlStdOperatorTable.UNION_ALL);
    }
    throw unsupported("Statement", node);
  }

  private Select convertSelect(SqlSelect select) {
    List<UnresolvedExpression> targets = new ArrayList<>();
    for (SqlNode item : select.getSelectList()) {
      targets.add(convertExpression(item));
    }
    List<UnresolvedExpression> groupBy = new ArrayList<>();
    if (select.getGroup() != null) {
      for (SqlNode item : select.getGroup()) {
        groupBy.add(convertExpression(item));
      }
    }
    return Select.builder()
        .targets(targets)
        .distinct(select.isDistinct())
        .fromTable(select.getFrom() == null ? null : convertRelation(select.getFrom()))
        .where(convertNullable(select.getWhere()))
        .groupBy(groupBy)
        .having(convertNullable(select.getHaving()))
        .orderBy(convertOrderList(select.getOrderList()))
        .limit(intValue(select.getFetch()))
        .offset(intValue(select.getOffset()))
        .build();
  }

  private Node convertRelation(SqlNode node) {
    if (node instanceof SqlIdentifier) {
      return new Identifier(((SqlIdentifier) node).names);
    }
    if (node.getKind() == SqlKind.AS) {
      SqlCall as = (SqlCall) node;
      String alias = ((SqlIdentifier) as.operand(1)).getSimple();
      Node relation = convertRelation(as.operand(0));
      if (relation instanceof Identifier) {
        return ((Identifier) relation).withAlias(alias);
      }
      if (relation instanceof Select) {
        return ((Select) relation).withAlias(alias);
      }
      throw unsupported("Aliased relation", node);
    }
    if (node instanceof SqlJoin) {
      SqlJoin join = (SqlJoin) node;
      Join.JoinType joinType = JOIN_TYPES.get(join.getJoinType());
      if (joinType == null || join.isNatural()) {
        throw unsupported("Join type", node);
      }
      if (join.getConditionType() == JoinConditionType.USING) {
        throw unsupported("JOIN ... USING", node);
      }
      return new Join(
          convertRelation(join.getLeft()),
          convertRelation(join.getRight()),
          joinType,
          convertNullable(join.getCondition()));
    }
    if (node instanceof SqlSelect || node instanceof SqlOrderBy) {
      Statement query = convertQuery(node);
      if (query instanceof Select) {
        return query;
      }
    }
    throw unsupported("FROM clause", node);
  }

  private List<OrderBy> convertOrderList(SqlNodeList orderList) {
    List<OrderBy> result = new ArrayList<>();
    if (orderList == null) {
      return result;
    }
    for (SqlNode item : orderList) {
      if (item.getKind() == SqlKind.DESCENDING) {
        result.add(
            new OrderBy(
                convertExpression(((SqlCall) item).operand(0)), OrderBy.Direction.DESC));
      } else {
        result.add(new OrderBy(convertExpression(item), OrderBy.Direction.ASC));
      }
    }
    return result;
  }

  private UnresolvedExpression convertNullable(SqlNode node) {
    return node == null ? null : convertExpression(node);
  }

  private UnresolvedExpression convertExpression(SqlNode node) {
    return node.accept(expressionConverter);
  }

  private static Integer intValue(SqlNode node) {
    if (node == null) {
      return null;
    }
    if (!(node instanceof SqlNumericLiteral)) {
      throw unsupported("LIMIT or OFFSET value", node);
    }
    BigDecimal value = ((SqlLiteral) node).bigDecimalValue();
    try {
      return value.intValueExact();
    } catch (ArithmeticException e) {
      throw new SyntaxCheckException(
          StringUtils.format("LIMIT or OFFSET value %s is not a valid row count", value), e);
    }
  }

  private static SyntaxCheckException unsupported(String what, SqlNode node) {
    return new SyntaxCheckException(
        StringUtils.format("%s is not supported: %s", what, node.toString()));
  }

  /** Converts the expressions of a query: targets, conditions, group and order items. */
  private class ExpressionConverter implements SqlVisitor<UnresolvedExpression> {

    @Override
    public UnresolvedExpression visit(SqlLiteral literal) {
      if (literal.getTypeName() == SqlTypeName.NULL) {
        return new NullConstant();
      }
      if (literal.getTypeName() == SqlTypeName.BOOLEAN) {
        return new Constant(literal.booleanValue());
      }
      if (literal instanceof SqlNumericLiteral) {
        BigDecimal value = literal.bigDecimalValue();
        if (value.scale() <= 0) {
          if (value.compareTo(LONG_MIN) < 0 || value.compareTo(LONG_MAX) > 0) {
            return new Constant(value);
          }
          long longValue = value.longValueExact();
          if (longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE) {
            return new Constant((int) longValue);
          }
          return new Constant(longValue);
        }
        return new Constant(value.doubleValue());
      }
      if (literal instanceof SqlCharStringLiteral) {
        return new Constant(literal.getValueAs(String.class));
      }
      throw unsupported("Literal", literal);
    }

    @Override
    public UnresolvedExpression visit(SqlCall call) {
      SqlKind kind = call.getKind();
      List<SqlNode> operands = call.getOperandList();
      if (call.getOperator() instanceof SqlBetweenOperator) {
        BetweenOperation between =
            new BetweenOperation(
                convertExpression(operands.get(0)),
                convertExpression(operands.get(1)),
                convertExpression(operands.get(2)));
        return ((SqlBetweenOperator) call.getOperator()).isNegated()
            ? new UnaryOperation("not", between)
            : between;
      }
      switch (kind) {
        case AS:
          return convertExpression(operands.get(0))
              .withAlias(((SqlIdentifier) operands.get(1)).getSimple());
        case AND:
        case OR:
          return fold(StringUtils.toLowerCase(kind.name()), operands);
        case NOT:
          return new UnaryOperation("not", convertExpression(operands.get(0)));
        case MINUS_PREFIX:
          return new UnaryOperation("-", convertExpression(operands.get(0)));
        case IS_NULL:
          return new BinaryOperation("is", convertExpression(operands.get(0)), new NullConstant());
        case IS_NOT_NULL:
          return new BinaryOperation(
              "is not", convertExpression(operands.get(0)), new NullConstant());
        case LIKE:
          return new BinaryOperation(
              call.getOperator() == SqlStdOperatorTable.NOT_LIKE ? "not like" : "like",
              convertExpression(operands.get(0)),
              convertExpression(operands.get(1)));
        default:
          break;
      }
      if (BINARY_OPERATORS.containsKey(kind) && operands.size() == 2) {
        return new BinaryOperation(
            BINARY_OPERATORS.get(kind),
            convertExpression(operands.get(0)),
            convertExpression(operands.get(1)));
      }
      if (call.getOperator() instanceof SqlFunction) {
        List<UnresolvedExpression> args = new ArrayList<>();
        for (SqlNode operand : operands) {
          args.add(convertExpression(operand));
        }
        boolean distinct =
            call.getFunctionQuantifier() != null
                && call.getFunctionQuantifier().getValue() == SqlSelectKeyword.DISTINCT;
        return new Function(
            StringUtils.toLowerCase(call.getOperator().getName()), args, distinct, null);
      }
      throw unsupported("Expression", call);
    }

    @Override
    public UnresolvedExpression visit(SqlIdentifier identifier) {
      if (identifier.isStar()) {
        if (identifier.names.size() > 1) {
          throw unsupported("Qualified star", identifier);
        }
        return new Star();
      }
      if (identifier.names.size() == 1 && "latest".equalsIgnoreCase(identifier.getSimple())) {
        return new Latest();
      }
      return new Identifier(identifier.names);
    }

    @Override
    public UnresolvedExpression visit(SqlNodeList nodeList) {
      throw unsupported("Expression list", nodeList);
    }

    @Override
    public UnresolvedExpression visit(SqlDataTypeSpec type) {
      throw unsupported("Data type", type);
    }

    @Override
    public UnresolvedExpression visit(SqlDynamicParam param) {
      throw unsupported("Query parameter", param);
    }

    @Override
    public UnresolvedExpression visit(SqlIntervalQualifier intervalQualifier) {
      throw unsupported("Interval", intervalQualifier);
    }

    private UnresolvedExpression fold(String op, List<SqlNode> operands) {
      UnresolvedExpression result = convertExpression(operands.get(0));
      for (int i = 1; i < operands.size(); i++) {
        result = new BinaryOperation(op, result, convertExpression(operands.get(i)));
      }
      return result;
    }
  }
}
