/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Table name to generated rows, filled table by table in dependency order. A table is committed
 * once; its rows are read-only afterwards and iteration follows commit order.
 */
public final class GenerationStore {

  private final Map<String, List<Row>> data = new LinkedHashMap<>();

  public synchronized void commit(final String table, final List<Row> rows) {
    Objects.requireNonNull(table, "Table name cannot be null");
    Objects.requireNonNull(rows, "Rows cannot be null");
    if (data.containsKey(table)) {
      throw new IllegalStateException("Rows for table " + table + " were already committed");
    }
    data.put(table, List.copyOf(rows));
  }

  public synchronized List<Row> rows(final String table) {
    return data.getOrDefault(table, List.of());
  }

  public synchronized Set<String> tables() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(data.keySet()));
  }

  public synchronized Map<String, List<Row>> asMap() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  public synchronized int totalRows() {
    return data.values().stream().mapToInt(List::size).sum();
  }
}
