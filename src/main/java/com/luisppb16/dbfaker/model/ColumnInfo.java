/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import lombok.Builder;

/**
 * Column metadata as reported by the schema introspector.
 *
 * <p>{@code type} is the logical type tag ({@code int4}, {@code varchar}, {@code timestamptz},
 * ...). Length, precision and scale are {@code null} when the database does not declare them.
 */
@Builder(toBuilder = true)
public record ColumnInfo(
    String name,
    String type,
    boolean nullable,
    Integer maxLength,
    Integer numericPrecision,
    Integer numericScale,
    List<String> enumValues) {

  public ColumnInfo {
    Objects.requireNonNull(name, "Column name cannot be null.");
    Objects.requireNonNull(type, "Column type cannot be null.");
    enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
  }

  public boolean hasEnumValues() {
    return !enumValues.isEmpty();
  }

  public String typeTag() {
    return type.trim().toLowerCase(Locale.ROOT);
  }
}
