/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db;

import com.luisppb16.dbfaker.model.ForeignKeyConstraint;
import com.luisppb16.dbfaker.model.TableSchema;
import com.luisppb16.dbfaker.util.CyclicDependencyException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Orders tables so that every table comes after the tables its foreign keys reference.
 *
 * <p>Kahn's algorithm over the graph with one edge {@code foreign -> local} per foreign key. A
 * table gains one in-degree per foreign key it owns, so a table declaring two keys to the same
 * parent waits for that parent once per key. Tables that take part in no edge are appended in
 * schema order. Any cycle, self references included, is rejected.
 */
@Slf4j
@UtilityClass
public class DependencyOrderer {

  public static List<String> order(final List<TableSchema> tables) {
    final Set<String> known =
        tables.stream().map(TableSchema::name).collect(Collectors.toCollection(LinkedHashSet::new));

    // Dependency -> dependents, one entry per foreign key.
    final Map<String, List<String>> graph = new LinkedHashMap<>();
    final Map<String, Integer> inDegree = new LinkedHashMap<>();

    for (final TableSchema table : tables) {
      for (final ForeignKeyConstraint fk : table.foreignKeys()) {
        if (!known.contains(fk.foreignTable())) {
          log.warn(
              "Table {} references unknown table {} through {}; the edge is ignored.",
              table.name(),
              fk.foreignTable(),
              fk.name());
          continue;
        }
        graph.computeIfAbsent(fk.foreignTable(), k -> new ArrayList<>()).add(table.name());
        graph.computeIfAbsent(table.name(), k -> new ArrayList<>());
        inDegree.putIfAbsent(fk.foreignTable(), 0);
        inDegree.merge(table.name(), 1, Integer::sum);
      }
    }

    final Deque<String> queue = new ArrayDeque<>();
    inDegree.forEach(
        (table, degree) -> {
          if (degree == 0) {
            queue.add(table);
          }
        });

    final List<String> ordered = new ArrayList<>();
    while (!queue.isEmpty()) {
      final String table = queue.remove();
      ordered.add(table);
      for (final String dependent : graph.getOrDefault(table, List.of())) {
        if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
          queue.add(dependent);
        }
      }
    }

    if (ordered.size() < graph.size()) {
      final Set<String> unsorted = new LinkedHashSet<>(graph.keySet());
      ordered.forEach(unsorted::remove);
      throw new CyclicDependencyException(unsorted);
    }

    known.stream().filter(t -> !graph.containsKey(t)).forEach(ordered::add);
    log.debug("Table order: {}", ordered);
    return List.copyOf(ordered);
  }
}
