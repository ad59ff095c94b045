/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db.generator;

import com.luisppb16.dbfaker.model.ColumnInfo;
import com.luisppb16.dbfaker.strategy.Strategies;
import com.luisppb16.dbfaker.strategy.Strategy;
import com.luisppb16.dbfaker.util.UnsupportedColumnTypeException;
import java.util.Objects;

/**
 * Maps a column's type tag and metadata to its base strategy.
 *
 * <p>Columns carrying enum labels always draw from those labels. Unbounded text columns consult
 * the column-name heuristics first and fall back to short random text. Numeric layouts come from
 * precision and scale (53/0 when undeclared); integers span the signed range of their width.
 * Nullable columns get their base strategy wrapped in {@link Strategies#nullable}. Any other tag
 * fails the run with {@link UnsupportedColumnTypeException}.
 */
public final class TypeMapper {

  private static final int DEFAULT_NUMERIC_PRECISION = 53;
  private static final int DEFAULT_INTEGER_BITS = 32;

  private final ColumnNameMappings columnNameMappings;
  private final double nullProbability;

  public TypeMapper(final ColumnNameMappings columnNameMappings, final double nullProbability) {
    this.columnNameMappings =
        Objects.requireNonNull(columnNameMappings, "Column name mappings cannot be null");
    this.nullProbability = nullProbability;
  }

  public TypeMapper(final ColumnNameMappings columnNameMappings) {
    this(columnNameMappings, Strategies.DEFAULT_NULL_PROBABILITY);
  }

  public Strategy<?> strategyFor(final String table, final ColumnInfo column) {
    final Strategy<?> base = baseStrategy(table, column);
    return column.nullable() ? Strategies.nullable(base, nullProbability) : base;
  }

  Strategy<?> baseStrategy(final String table, final ColumnInfo column) {
    if (column.hasEnumValues()) {
      return Strategies.oneOf(column.enumValues());
    }

    final String tag = column.typeTag();
    return switch (tag) {
      case "uuid" -> Strategies.uuid();
      case "date" -> Strategies.date();
      case "timestamp" -> Strategies.timestamp(false);
      case "timestamptz" -> Strategies.timestamp(true);
      case "time" -> Strategies.time(false);
      case "timetz" -> Strategies.time(true);
      case "varchar", "text", "bpchar" -> textStrategy(column);
      case "numeric", "money" -> decimalStrategy(column);
      case "bool" -> Strategies.bool();
      case "int2", "int4", "int8" -> Strategies.integer(integerBits(column, tag));
      case "json", "jsonb" -> Strategies.json();
      case "bit" -> Strategies.bitString(column.maxLength(), false);
      case "varbit" -> Strategies.bitString(column.maxLength(), true);
      case "xml" -> Strategies.xml();
      default -> {
        if (tag.startsWith("float")) {
          yield decimalStrategy(column);
        }
        throw new UnsupportedColumnTypeException(column.type(), table, column.name());
      }
    };
  }

  private Strategy<?> textStrategy(final ColumnInfo column) {
    final Integer maxLength = column.maxLength();
    if (maxLength != null && maxLength > 0) {
      return Strategies.text(maxLength);
    }
    return columnNameMappings.match(column.name()).orElseGet(() -> Strategies.text(null));
  }

  private static Strategy<?> decimalStrategy(final ColumnInfo column) {
    final int precision =
        column.numericPrecision() != null && column.numericPrecision() > 0
            ? column.numericPrecision()
            : DEFAULT_NUMERIC_PRECISION;
    final int scale = column.numericScale() != null ? Math.max(column.numericScale(), 0) : 0;
    return Strategies.decimal(precision, scale);
  }

  private static int integerBits(final ColumnInfo column, final String tag) {
    final Integer precision = column.numericPrecision();
    if (precision != null && precision >= 2 && precision <= 64) {
      return precision;
    }
    return switch (tag) {
      case "int2" -> 16;
      case "int8" -> 64;
      default -> DEFAULT_INTEGER_BITS;
    };
  }
}
