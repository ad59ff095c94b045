/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db.generator;

import com.luisppb16.dbfaker.db.Diagnostic;
import com.luisppb16.dbfaker.db.Row;
import com.luisppb16.dbfaker.model.ColumnInfo;
import com.luisppb16.dbfaker.model.ForeignKeyConstraint;
import com.luisppb16.dbfaker.model.TableSchema;
import com.luisppb16.dbfaker.strategy.GenerationContext;
import com.luisppb16.dbfaker.strategy.Strategies;
import com.luisppb16.dbfaker.strategy.Strategy;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds one row of a table at a time while keeping every enforceable foreign key valid.
 *
 * <p>Per row, each foreign key column is sampled once to decide whether it is NULL. A foreign key
 * with a NULL column is not enforced for that row; the others are resolved together against the
 * committed parent rows. Resolved columns ignore caller overrides. Everything else is generated
 * from its override or the type mapper's default.
 *
 * <p>When the enforceable keys have no valid assignment, nullable keys whose parent has no usable
 * row are set to NULL and the remaining keys are resolved again. If those still fail, the outcome
 * is {@link RowOutcome.Unsatisfiable} unless every column they span is nullable, in which case
 * those columns are set to NULL as well.
 */
@Slf4j
public final class RowGenerator implements Strategy<RowOutcome> {

  @Getter private final TableSchema table;
  private final ForeignKeyResolver resolver;
  private final Map<String, Strategy<?>> columnStrategies;
  private final Set<String> overridden;

  private final Map<List<ForeignKeyConstraint>, FkResolution> resolutions = new HashMap<>();
  private final Set<String> reportedOverrides = new HashSet<>();

  public RowGenerator(
      final TableSchema table,
      final TypeMapper typeMapper,
      final ForeignKeyResolver resolver,
      final Map<String, ? extends Strategy<?>> overrides) {
    this.table = Objects.requireNonNull(table, "Table cannot be null");
    this.resolver = Objects.requireNonNull(resolver, "Foreign key resolver cannot be null");
    Objects.requireNonNull(typeMapper, "Type mapper cannot be null");
    final Map<String, ? extends Strategy<?>> given = overrides == null ? Map.of() : overrides;

    given.keySet().stream()
        .filter(col -> table.column(col) == null)
        .findFirst()
        .ifPresent(
            col -> {
              throw new IllegalArgumentException(
                  "Override targets unknown column %s.%s".formatted(table.name(), col));
            });

    final Map<String, Strategy<?>> strategies = new LinkedHashMap<>();
    for (final ColumnInfo column : table.columns()) {
      final Strategy<?> override = given.get(column.name());
      strategies.put(
          column.name(),
          override != null ? override : typeMapper.strategyFor(table.name(), column));
    }
    this.columnStrategies = strategies;
    this.overridden = Set.copyOf(given.keySet());
  }

  @Override
  public synchronized RowOutcome sample(final GenerationContext context) {
    final Map<String, Object> nullFixed = new LinkedHashMap<>();
    for (final String column : table.fkColumnNames()) {
      if (columnStrategies.get(column).sample(context) == null) {
        nullFixed.put(column, null);
      }
    }

    final List<ForeignKeyConstraint> enforceable = enforceable(nullFixed);
    FkResolution resolution = resolution(enforceable, context);
    if (!resolution.satisfiable()) {
      // Nullable keys whose parent has nothing to offer go NULL; the others are resolved again.
      final List<ForeignKeyConstraint> withoutParents =
          enforceable.stream()
              .filter(fk -> allNullable(fk.localColumns()))
              .filter(fk -> !resolution(List.of(fk), context).satisfiable())
              .toList();
      if (!withoutParents.isEmpty()) {
        withoutParents.forEach(fk -> fk.localColumns().forEach(col -> nullFixed.put(col, null)));
        resolution = resolution(enforceable(nullFixed), context);
      }
    }

    Strategy<Row> fkGroup = Strategies.fixed(Row.empty());
    Set<String> resolvedColumns = Set.of();

    if (resolution.satisfiable()) {
      fkGroup = resolution.strategy();
      resolvedColumns = resolution.constrainedColumns();
      reportIgnoredOverrides(resolvedColumns, context);
    } else if (allNullable(resolution.constrainedColumns())) {
      resolution.constrainedColumns().forEach(col -> nullFixed.put(col, null));
    } else {
      return new RowOutcome.Unsatisfiable(resolution.constrainedColumns());
    }

    final Map<String, Strategy<?>> regular = new LinkedHashMap<>();
    for (final Map.Entry<String, Strategy<?>> e : columnStrategies.entrySet()) {
      if (!nullFixed.containsKey(e.getKey()) && !resolvedColumns.contains(e.getKey())) {
        regular.put(e.getKey(), e.getValue());
      }
    }

    final Row merged =
        Strategies.row(regular, List.of(fkGroup, Strategies.fixed(new Row(nullFixed))), table.name())
            .sample(context);
    return new RowOutcome.Generated(inColumnOrder(merged));
  }

  private List<ForeignKeyConstraint> enforceable(final Map<String, Object> nullFixed) {
    return table.foreignKeys().stream()
        .filter(fk -> fk.localColumns().stream().noneMatch(nullFixed::containsKey))
        .toList();
  }

  private FkResolution resolution(
      final List<ForeignKeyConstraint> enforceable, final GenerationContext context) {
    FkResolution resolution = resolutions.get(enforceable);
    if (resolution == null) {
      resolution = resolver.resolve(enforceable);
      resolutions.put(enforceable, resolution);
      if (resolution.truncated()) {
        context
            .diagnostics()
            .record(
                Diagnostic.Kind.JOIN_TRUNCATED,
                table.name(),
                "Foreign key candidates over %s cut at %d rows"
                    .formatted(resolution.constrainedColumns(), resolution.candidateCount()));
      }
      log.debug(
          "Resolved {} foreign keys of {}: {} candidates.",
          enforceable.size(),
          table.name(),
          resolution.candidateCount());
    }
    return resolution;
  }

  private void reportIgnoredOverrides(final Set<String> resolved, final GenerationContext context) {
    resolved.stream()
        .filter(overridden::contains)
        .filter(reportedOverrides::add)
        .forEach(
            col ->
                context
                    .diagnostics()
                    .record(
                        Diagnostic.Kind.OVERRIDE_IGNORED,
                        table.name(),
                        "Override of foreign key column " + col + " ignored"));
  }

  private boolean allNullable(final Collection<String> columns) {
    return columns.stream().map(table::column).allMatch(c -> c != null && c.nullable());
  }

  private Row inColumnOrder(final Row row) {
    final Map<String, Object> ordered = new LinkedHashMap<>();
    table.columns().forEach(c -> ordered.put(c.name(), row.get(c.name())));
    return new Row(ordered);
  }
}
