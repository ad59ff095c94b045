/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.config;

import com.luisppb16.dbfaker.db.generator.ColumnNameMappings;
import com.luisppb16.dbfaker.db.generator.ForeignKeyResolver;
import com.luisppb16.dbfaker.strategy.Strategies;
import com.luisppb16.dbfaker.strategy.Strategy;
import java.util.Locale;
import java.util.Map;
import lombok.Builder;

/**
 * Caller inputs of a generation run. Every field is optional; {@code null} or non-positive values
 * fall back to the defaults below.
 *
 * <ul>
 *   <li>{@code seed}: fixes every random draw of the run; random when {@code null}
 *   <li>{@code locale}: Datafaker locale, {@link Locale#ENGLISH}
 *   <li>{@code rowCounts}: exact row count per table
 *   <li>{@code overrides}: table to column to strategy replacing the type mapper's
 *   <li>{@code columnNameMappings}: heuristics for unbounded text, {@link
 *       ColumnNameMappings#defaults()}
 *   <li>{@code nullProbability}: 0.1
 *   <li>{@code minRows} / {@code maxRows}: 10 / 1000 when no row count is given
 *   <li>{@code maxAttempts}: 10 000 candidate rows per table
 *   <li>{@code maxJoinRows}: 1000 foreign key combinations per table
 * </ul>
 */
@Builder(toBuilder = true)
public record GenerationConfig(
    Long seed,
    Locale locale,
    Map<String, Integer> rowCounts,
    Map<String, Map<String, Strategy<?>>> overrides,
    ColumnNameMappings columnNameMappings,
    Double nullProbability,
    Integer minRows,
    Integer maxRows,
    Integer maxAttempts,
    Integer maxJoinRows) {

  public static final int DEFAULT_MIN_ROWS = 10;
  public static final int DEFAULT_MAX_ROWS = 1000;

  public GenerationConfig {
    locale = locale != null ? locale : Locale.ENGLISH;
    rowCounts = rowCounts != null ? Map.copyOf(rowCounts) : Map.of();
    overrides = overrides != null ? Map.copyOf(overrides) : Map.of();
    columnNameMappings =
        columnNameMappings != null ? columnNameMappings : ColumnNameMappings.defaults();
    nullProbability =
        nullProbability != null ? nullProbability : Strategies.DEFAULT_NULL_PROBABILITY;
    if (nullProbability < 0.0 || nullProbability > 1.0) {
      throw new IllegalArgumentException(
          "Null probability must be within [0, 1]: " + nullProbability);
    }
    minRows = minRows != null && minRows >= 0 ? minRows : DEFAULT_MIN_ROWS;
    maxRows = maxRows != null && maxRows > 0 ? maxRows : Math.max(DEFAULT_MAX_ROWS, minRows);
    if (maxRows < minRows) {
      throw new IllegalArgumentException(
          "maxRows (%d) cannot be lower than minRows (%d)".formatted(maxRows, minRows));
    }
    maxAttempts = maxAttempts != null && maxAttempts > 0 ? maxAttempts : Strategies.DEFAULT_MAX_ATTEMPTS;
    maxJoinRows =
        maxJoinRows != null && maxJoinRows > 0 ? maxJoinRows : ForeignKeyResolver.DEFAULT_MAX_JOIN_ROWS;
  }

  public static GenerationConfig defaults() {
    return GenerationConfig.builder().build();
  }

  public Map<String, Strategy<?>> overridesFor(final String table) {
    return overrides.getOrDefault(table, Map.of());
  }

  public Integer rowCountFor(final String table) {
    return rowCounts.get(table);
  }
}
