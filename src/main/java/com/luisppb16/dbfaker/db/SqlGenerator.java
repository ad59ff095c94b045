/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db;

import com.luisppb16.dbfaker.model.ColumnInfo;
import com.luisppb16.dbfaker.model.TableSchema;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.experimental.UtilityClass;

/** Renders generated rows as a plain SQL {@code INSERT} script, one statement per row. */
@UtilityClass
public class SqlGenerator {

  private static final Pattern UNQUOTED = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private static final Set<String> RESERVED_KEYWORDS =
      Set.of(
          "select", "from", "where", "group", "order", "limit", "offset", "insert", "update",
          "delete", "user", "table");

  private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
  private static final DateTimeFormatter TIMESTAMP_TZ =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssxxx");
  private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
  private static final DateTimeFormatter TIME_TZ = DateTimeFormatter.ofPattern("HH:mm:ssxxx");

  public static String generate(final List<TableSchema> tables, final GenerationStore store) {
    return generate(tables, store, SqlOptions.builder().quoteIdentifiers(true).build());
  }

  public static String generate(
      final List<TableSchema> tables, final GenerationStore store, final SqlOptions opts) {
    Objects.requireNonNull(store, "Generation store cannot be null");
    final Map<String, TableSchema> byName =
        tables.stream().collect(Collectors.toMap(TableSchema::name, Function.identity()));

    final StringBuilder sb = new StringBuilder();
    // Store order is dependency order, so parents are always inserted first.
    for (final Map.Entry<String, List<Row>> entry : store.asMap().entrySet()) {
      final TableSchema table = byName.get(entry.getKey());
      final List<Row> rows = entry.getValue();
      if (table == null || rows.isEmpty()) {
        continue;
      }

      final List<ColumnInfo> columns = table.columns();
      final String tableName = qualified(opts, table.name());
      final String columnList =
          columns.stream().map(c -> qualified(opts, c.name())).collect(Collectors.joining(", "));

      for (final Row row : rows) {
        final String values =
            columns.stream()
                .map(c -> formatValue(c, row.get(c.name())))
                .collect(Collectors.joining(", "));
        sb.append("INSERT INTO ")
            .append(tableName)
            .append(" (")
            .append(columnList)
            .append(") VALUES (")
            .append(values)
            .append(");\n");
      }
    }
    return sb.toString();
  }

  static String qualified(final SqlOptions opts, final String identifier) {
    final boolean forceQuote = opts.quoteIdentifiers() || needsQuoting(identifier);
    final String safe = identifier.replace("\"", "\"\"");
    return forceQuote ? "\"".concat(safe).concat("\"") : identifier;
  }

  private static boolean needsQuoting(final String identifier) {
    if (!UNQUOTED.matcher(identifier).matches()) {
      return true;
    }
    return RESERVED_KEYWORDS.contains(identifier.toLowerCase(Locale.ROOT));
  }

  static String formatValue(final ColumnInfo column, final Object value) {
    if (value == null) {
      return "NULL";
    }

    final String tag = column.typeTag();
    if (value instanceof String s && ("bit".equals(tag) || "varbit".equals(tag))) {
      return "B'".concat(s).concat("'");
    }
    if (value instanceof String s) return quote(s);
    if (value instanceof UUID u) return quote(u.toString());
    if (value instanceof LocalDate d) return quote(d.toString());
    if (value instanceof LocalDateTime t) return quote(TIMESTAMP.format(t));
    if (value instanceof OffsetDateTime t) return quote(TIMESTAMP_TZ.format(t));
    if (value instanceof LocalTime t) return quote(TIME.format(t));
    if (value instanceof OffsetTime t) return quote(TIME_TZ.format(t));
    if (value instanceof Boolean b) return b ? "TRUE" : "FALSE";
    if (value instanceof BigDecimal d) return d.toPlainString();

    return Objects.toString(value, "NULL");
  }

  private static String quote(final String s) {
    return "'".concat(s.replace("'", "''")).concat("'");
  }

  @Builder(toBuilder = true)
  public record SqlOptions(boolean quoteIdentifiers) {}
}
