/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;

/**
 * A foreign key owned by {@code localTable}. The column mapping goes from local column to
 * referenced column and keeps its declaration order, so composite keys line up.
 */
@Builder(toBuilder = true)
public record ForeignKeyConstraint(
    String name, String localTable, String foreignTable, Map<String, String> columnMapping) {

  public ForeignKeyConstraint {
    Objects.requireNonNull(localTable, "The local table name cannot be null.");
    Objects.requireNonNull(foreignTable, "The foreign table name cannot be null.");
    Objects.requireNonNull(columnMapping, "The column mapping cannot be null.");
    if (columnMapping.isEmpty()) {
      throw new IllegalArgumentException(
          "Foreign key from %s to %s maps no columns".formatted(localTable, foreignTable));
    }

    columnMapping = Collections.unmodifiableMap(new LinkedHashMap<>(columnMapping));

    if (name == null || name.isBlank()) {
      name = "fk_%s_%s_%s".formatted(localTable, foreignTable, String.join("__", columnMapping.keySet()));
    }
  }

  public List<String> localColumns() {
    return List.copyOf(columnMapping.keySet());
  }
}
