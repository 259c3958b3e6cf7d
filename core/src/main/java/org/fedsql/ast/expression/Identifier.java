/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.ast.expression;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.With;
import org.fedsql.ast.AbstractNodeVisitor;
import org.fedsql.common.utils.StringUtils;

/**
 * Dotted name with an optional alias. Used both for column references and for relations in the
 * FROM clause, e.g. {@code int1.schema.t1 AS a}.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class Identifier extends UnresolvedExpression {

  private final List<String> parts;

  @With
  private final String alias;

  public Identifier(List<String> parts, String alias) {
    Preconditions.checkArgument(!parts.isEmpty(), "Identifier requires at least one part");
    this.parts = ImmutableList.copyOf(parts);
    this.alias = alias;
  }

  public Identifier(List<String> parts) {
    this(parts, null);
  }

  public static Identifier of(String... parts) {
    return new Identifier(Arrays.asList(parts));
  }

  /** Identifier from a dotted path such as {@code int1.t1}. */
  public static Identifier fromPath(String path) {
    return new Identifier(
        Arrays.stream(path.split("\\."))
            .map(StringUtils::unquoteIdentifier)
            .collect(Collectors.toList()));
  }

  public Identifier withParts(List<String> newParts) {
    return new Identifier(newParts, alias);
  }

  /** Dotted path without the alias. */
  public String getPath() {
    return StringUtils.joinPath(parts);
  }

  public String getFirstPart() {
    return parts.get(0);
  }

  public String getLastPart() {
    return parts.get(parts.size() - 1);
  }

  public int size() {
    return parts.size();
  }

  @Override
  public <R, C> R accept(AbstractNodeVisitor<R, C> visitor, C context) {
    return visitor.visitIdentifier(this, context);
  }
}
