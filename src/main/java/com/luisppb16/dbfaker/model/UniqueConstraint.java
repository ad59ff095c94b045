/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.model;

import java.util.List;
import java.util.Objects;

/** Ordered column tuple that must be unique among rows with no NULL component. */
public record UniqueConstraint(List<String> columns) {

  public UniqueConstraint {
    Objects.requireNonNull(columns, "Unique constraint columns cannot be null.");
    if (columns.isEmpty()) {
      throw new IllegalArgumentException("Unique constraint must name at least one column");
    }
    columns = List.copyOf(columns);
  }

  public static UniqueConstraint of(final String... columns) {
    return new UniqueConstraint(List.of(columns));
  }

  public boolean sameColumnsAs(final UniqueConstraint other) {
    return columns.size() == other.columns.size() && columns.containsAll(other.columns);
  }
}
