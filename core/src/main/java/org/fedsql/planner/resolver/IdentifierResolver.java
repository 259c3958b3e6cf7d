/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.planner.resolver;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.fedsql.ast.AbstractNodeVisitor;
import org.fedsql.ast.Node;
import org.fedsql.ast.expression.Identifier;
import org.fedsql.common.utils.StringUtils;
import org.fedsql.planner.config.PlannerSettings;
import org.fedsql.planner.exception.AmbiguousColumnException;
import org.fedsql.planner.exception.UnknownIntegrationException;
import org.fedsql.planner.exception.UnresolvedColumnException;
import org.fedsql.planner.exception.UnsupportedStatementException;

/**
 * Classifies relation references as source tables or predictors and qualifies column references
 * against them.
 */
@Log4j2
@RequiredArgsConstructor
public class IdentifierResolver {

  private static final int MAX_REFERENCE_PARTS = 4;

  private final PlannerSettings settings;

  /**
   * A reference is a predictor when it starts with the predictor namespace, or when it is a bare
   * name and the default namespace is the predictor namespace.
   */
  public boolean isPredictor(Identifier reference) {
    if (settings.isPredictorNamespace(reference.getFirstPart())) {
      return true;
    }
    return reference.size() == 1 && settings.isDefaultNamespacePredictors();
  }

  public ResolvedRelation classify(Identifier reference) {
    return isPredictor(reference) ? resolvePredictor(reference) : resolveSourceTable(reference);
  }

  /**
   * Split a reference into integration and table. A reference whose integration is unknown is
   * retried once with the default namespace prepended.
   *
   * @throws UnknownIntegrationException if neither attempt names a known integration
   */
  public SourceTable resolveSourceTable(Identifier reference) {
    try {
      return splitSourceTable(reference);
    } catch (UnknownIntegrationException e) {
      if (settings.getDefaultNamespace() == null) {
        throw e;
      }
      List<String> parts = new ArrayList<>();
      parts.add(settings.getDefaultNamespace());
      parts.addAll(reference.getParts());
      log.debug(
          "Retrying {} within default namespace {}",
          reference.getPath(),
          settings.getDefaultNamespace());
      return splitSourceTable(reference.withParts(parts));
    }
  }

  private SourceTable splitSourceTable(Identifier reference) {
    if (reference.size() > MAX_REFERENCE_PARTS) {
      throw new UnsupportedStatementException(
          "Too many parts (dots) in table identifier: " + reference.getPath());
    }
    if (reference.size() == 1) {
      throw new UnknownIntegrationException(
          "No integration specified for table: " + reference.getPath());
    }
    Optional<String> integration = settings.findIntegration(reference.getFirstPart());
    if (integration.isEmpty()) {
      throw new UnknownIntegrationException(
          StringUtils.format(
              "Unknown integration %s for table %s. Available integrations: %s",
              reference.getFirstPart(),
              reference.getPath(),
              String.join(", ", settings.getIntegrationNames())));
    }
    List<String> tableParts = reference.getParts().subList(1, reference.size());
    return new SourceTable(integration.get(), reference.withParts(tableParts));
  }

  /**
   * Split a predictor reference into namespace and predictor name. A bare name takes the default
   * namespace.
   */
  public PredictorRelation resolvePredictor(Identifier reference) {
    if (reference.size() > MAX_REFERENCE_PARTS) {
      throw new UnsupportedStatementException(
          "Too many parts (dots) in predictor identifier: " + reference.getPath());
    }
    if (reference.size() == 1) {
      if (settings.getDefaultNamespace() == null) {
        throw new UnknownIntegrationException(
            "No namespace specified for predictor: " + reference.getPath());
      }
      return new PredictorRelation(
          StringUtils.toLowerCase(settings.getDefaultNamespace()), reference);
    }
    List<String> predictorParts = reference.getParts().subList(1, reference.size());
    return new PredictorRelation(
        settings.getPredictorNamespace(), reference.withParts(predictorParts));
  }

  /**
   * Qualify a column with the table it is read from. A leading integration name is dropped, a
   * bare column gets the table prefix and a qualified column must already carry it.
   *
   * @param column column reference
   * @param table table the column belongs to
   * @param target true for select targets, which keep their column name as alias
   * @throws UnresolvedColumnException if the column is qualified with another table
   */
  public Identifier disambiguateIntegrationColumn(
      Identifier column, SourceTable table, boolean target) {
    List<String> qualified =
        qualify(column, table)
            .orElseThrow(
                () ->
                    new UnresolvedColumnException(
                        StringUtils.format(
                            "Column %s does not belong to table %s of integration %s",
                            column.getPath(),
                            StringUtils.joinPath(table.getColumnPrefix()),
                            table.integration())));
    String alias = column.getAlias();
    if (alias == null && target) {
      alias = column.getLastPart();
    }
    return new Identifier(qualified, alias);
  }

  /**
   * True when the column is qualified with the given table, i.e. it starts with the table alias,
   * table path or last table part, optionally preceded by the integration name.
   */
  public boolean belongsTo(Identifier column, SourceTable table) {
    return column.size() > 1 && qualify(column, table).isPresent();
  }

  private Optional<List<String>> qualify(Identifier column, SourceTable table) {
    List<String> parts = column.getParts();
    if (parts.size() > 1 && StringUtils.equalsIgnoreCase(parts.get(0), table.integration())) {
      parts = parts.subList(1, parts.size());
    }
    List<String> prefix = table.getColumnPrefix();
    if (parts.size() == 1) {
      return Optional.of(ImmutableList.<String>builder().addAll(prefix).addAll(parts).build());
    }
    if (startsWith(parts, prefix)) {
      return Optional.of(parts);
    }
    if (table.table().getAlias() == null
        && StringUtils.equalsIgnoreCase(parts.get(0), table.table().getLastPart())) {
      return Optional.of(
          ImmutableList.<String>builder()
              .addAll(prefix)
              .addAll(parts.subList(1, parts.size()))
              .build());
    }
    return Optional.empty();
  }

  /**
   * Drop a leading predictor alias or name, or a leading {@code namespace.predictor} pair, from a
   * column reference. The alias of the column is kept.
   */
  public static Identifier disambiguatePredictorColumn(
      Identifier column, PredictorRelation predictor) {
    List<String> parts = column.getParts();
    Identifier name = predictor.predictor();
    if (parts.size() > 2
        && StringUtils.equalsIgnoreCase(parts.get(0), predictor.namespace())
        && StringUtils.equalsIgnoreCase(parts.get(1), name.getLastPart())) {
      parts = parts.subList(2, parts.size());
    } else if (parts.size() > 1
        && (StringUtils.equalsIgnoreCase(parts.get(0), name.getAlias())
            || StringUtils.equalsIgnoreCase(parts.get(0), name.getLastPart()))) {
      parts = parts.subList(1, parts.size());
    }
    return new Identifier(parts, column.getAlias());
  }

  /**
   * Reject bare column names in a clause of a join, since they could come from either side.
   *
   * @param clause expression or order by item, may be null
   * @param targetAliases lower-cased aliases of the select targets, allowed as bare names
   * @throws AmbiguousColumnException on the first bare column found
   */
  public static void checkJoinIdentifiersForAmbiguity(Node clause, Set<String> targetAliases) {
    if (clause != null) {
      clause.accept(new AmbiguityChecker(targetAliases), null);
    }
  }

  private static boolean startsWith(List<String> parts, List<String> prefix) {
    if (parts.size() <= prefix.size()) {
      return false;
    }
    for (int i = 0; i < prefix.size(); i++) {
      if (!StringUtils.equalsIgnoreCase(parts.get(i), prefix.get(i))) {
        return false;
      }
    }
    return true;
  }

  @RequiredArgsConstructor
  private static class AmbiguityChecker extends AbstractNodeVisitor<Void, Void> {

    private final Set<String> targetAliases;

    @Override
    public Void visitIdentifier(Identifier node, Void context) {
      if (node.size() == 1
          && !targetAliases.contains(StringUtils.toLowerCase(node.getFirstPart()))) {
        throw new AmbiguousColumnException(
            StringUtils.format(
                "Ambiguous identifier %s, provide table name for operations on a join",
                node.getPath()));
      }
      return null;
    }
  }
}
