/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.model;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.Builder;

/**
 * Immutable snapshot of one table. Unique and foreign key constraints may only name columns the
 * table declares; violations are rejected at construction.
 */
@Builder(toBuilder = true)
public record TableSchema(
    String name,
    List<ColumnInfo> columns,
    List<UniqueConstraint> uniqueConstraints,
    List<ForeignKeyConstraint> foreignKeys) {

  public TableSchema {
    Objects.requireNonNull(name, "Table name cannot be null.");
    Objects.requireNonNull(columns, "Column list cannot be null.");

    columns = List.copyOf(columns);
    uniqueConstraints = uniqueConstraints == null ? List.of() : List.copyOf(uniqueConstraints);
    foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);

    final Set<String> names = new HashSet<>();
    for (final ColumnInfo column : columns) {
      if (!names.add(column.name())) {
        throw new IllegalArgumentException(
            "Duplicate column %s in table %s".formatted(column.name(), name));
      }
    }
    for (final UniqueConstraint uc : uniqueConstraints) {
      requireColumns(name, names, uc.columns(), "unique constraint");
    }
    for (final ForeignKeyConstraint fk : foreignKeys) {
      if (!fk.localTable().equals(name)) {
        throw new IllegalArgumentException(
            "Foreign key %s belongs to %s, not %s".formatted(fk.name(), fk.localTable(), name));
      }
      requireColumns(name, names, fk.localColumns(), "foreign key " + fk.name());
    }
  }

  private static void requireColumns(
      final String table, final Set<String> known, final List<String> referenced, final String what) {
    referenced.stream()
        .filter(c -> !known.contains(c))
        .findFirst()
        .ifPresent(
            c -> {
              throw new IllegalArgumentException(
                  "Column %s of %s is not declared in table %s".formatted(c, what, table));
            });
  }

  public ColumnInfo column(final String columnName) {
    return columns.stream().filter(c -> c.name().equals(columnName)).findFirst().orElse(null);
  }

  public Set<String> fkColumnNames() {
    final Set<String> names = new LinkedHashSet<>();
    foreignKeys.forEach(fk -> names.addAll(fk.localColumns()));
    return Collections.unmodifiableSet(names);
  }
}
