/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db.generator;

import com.luisppb16.dbfaker.db.GenerationStore;
import com.luisppb16.dbfaker.db.Row;
import com.luisppb16.dbfaker.model.ForeignKeyConstraint;
import com.luisppb16.dbfaker.strategy.Strategies;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Computes the local column assignments that satisfy a list of foreign keys at once.
 *
 * <p>Each constraint's parent rows are projected onto the referenced columns, rows with a NULL
 * referent are dropped and the remaining ones are renamed to the local column names. Constraints
 * are then combined in declaration order: an inner join on the local columns already seen, or a
 * cartesian product when they share none. At most {@code maxJoinRows} combinations are kept.
 */
@Slf4j
public final class ForeignKeyResolver {

  public static final int DEFAULT_MAX_JOIN_ROWS = 1000;

  private final GenerationStore store;
  private final int maxJoinRows;

  public ForeignKeyResolver(final GenerationStore store, final int maxJoinRows) {
    this.store = Objects.requireNonNull(store, "Generation store cannot be null");
    if (maxJoinRows <= 0) {
      throw new IllegalArgumentException("Join row cap must be positive: " + maxJoinRows);
    }
    this.maxJoinRows = maxJoinRows;
  }

  public ForeignKeyResolver(final GenerationStore store) {
    this(store, DEFAULT_MAX_JOIN_ROWS);
  }

  public FkResolution resolve(final List<ForeignKeyConstraint> constraints) {
    if (constraints.isEmpty()) {
      return new FkResolution(Set.of(), Strategies.fixed(Row.empty()), 1, false);
    }

    final Set<String> allColumns = new LinkedHashSet<>();
    constraints.forEach(fk -> allColumns.addAll(fk.localColumns()));

    final Set<String> seen = new LinkedHashSet<>();
    Stream<Row> candidates = null;
    for (final ForeignKeyConstraint fk : constraints) {
      final List<Row> referents = localizedReferents(fk);
      if (referents.isEmpty()) {
        log.debug(
            "No usable rows in {} for foreign key {}; columns {} are unsatisfiable.",
            fk.foreignTable(),
            fk.name(),
            allColumns);
        return FkResolution.unsatisfiable(allColumns);
      }

      final List<String> overlap = fk.localColumns().stream().filter(seen::contains).toList();
      if (candidates == null) {
        candidates = referents.stream();
      } else if (overlap.isEmpty()) {
        candidates = crossJoin(candidates, referents);
      } else {
        candidates = innerJoin(candidates, referents, overlap);
      }
      seen.addAll(fk.localColumns());
    }

    final List<Row> sampled = candidates.limit(maxJoinRows + 1L).toList();
    if (sampled.isEmpty()) {
      return FkResolution.unsatisfiable(seen);
    }
    final boolean truncated = sampled.size() > maxJoinRows;
    final List<Row> kept = truncated ? sampled.subList(0, maxJoinRows) : sampled;
    return new FkResolution(seen, Strategies.oneOf(kept), kept.size(), truncated);
  }

  /** Parent rows of {@code fk}, projected to its referenced columns and renamed to local names. */
  private List<Row> localizedReferents(final ForeignKeyConstraint fk) {
    final List<Row> localized = new ArrayList<>();
    for (final Row parent : store.rows(fk.foreignTable())) {
      final Map<String, Object> values = new LinkedHashMap<>();
      boolean complete = true;
      for (final Map.Entry<String, String> e : fk.columnMapping().entrySet()) {
        final Object value = parent.get(e.getValue());
        if (value == null) {
          complete = false;
          break;
        }
        values.put(e.getKey(), value);
      }
      if (complete) {
        localized.add(new Row(values));
      }
    }
    return localized;
  }

  private static Stream<Row> crossJoin(final Stream<Row> left, final List<Row> right) {
    return left.flatMap(l -> right.stream().map(r -> merge(l, r)));
  }

  private static Stream<Row> innerJoin(
      final Stream<Row> left, final List<Row> right, final List<String> on) {
    final Map<List<Object>, List<Row>> index = new HashMap<>();
    right.forEach(r -> index.computeIfAbsent(keyOf(r, on), k -> new ArrayList<>()).add(r));
    return left.flatMap(
        l -> index.getOrDefault(keyOf(l, on), List.of()).stream().map(r -> merge(l, r)));
  }

  private static List<Object> keyOf(final Row row, final List<String> columns) {
    return columns.stream().map(row::get).toList();
  }

  private static Row merge(final Row left, final Row right) {
    final Map<String, Object> values = new LinkedHashMap<>(left.values());
    values.putAll(right.values());
    return new Row(values);
  }
}
