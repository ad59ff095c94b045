/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db;

import com.luisppb16.dbfaker.model.ColumnInfo;
import com.luisppb16.dbfaker.model.TableSchema;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes a {@link GenerationStore} through JDBC, one parameterised {@code INSERT} per table run
 * in batches. Tables are visited in store order; the caller owns the transaction.
 */
@Slf4j
@UtilityClass
public class BatchInserter {

  public static final int BATCH_SIZE = 500;

  // PostgreSQL refuses these from a plain string parameter.
  private static final Set<String> UNTYPED_TAGS = Set.of("json", "jsonb", "xml", "bit", "varbit");

  public static Map<String, Integer> insert(
      final Connection conn, final List<TableSchema> tables, final GenerationStore store)
      throws SQLException {
    Objects.requireNonNull(conn, "Connection cannot be null");
    Objects.requireNonNull(store, "Generation store cannot be null");
    final Map<String, TableSchema> byName =
        tables.stream().collect(Collectors.toMap(TableSchema::name, Function.identity()));
    final boolean postgres =
        String.valueOf(conn.getMetaData().getDatabaseProductName())
            .toLowerCase(Locale.ROOT)
            .contains("postgres");

    final Map<String, Integer> inserted = new LinkedHashMap<>();
    for (final Map.Entry<String, List<Row>> entry : store.asMap().entrySet()) {
      final TableSchema table = byName.get(entry.getKey());
      if (table == null) {
        throw new IllegalArgumentException("No schema for generated table " + entry.getKey());
      }
      final List<Row> rows = entry.getValue();
      if (rows.isEmpty()) {
        log.debug("Skipping empty table {}.", table.name());
        continue;
      }
      inserted.put(table.name(), insertTable(conn, table, rows, postgres));
    }
    return inserted;
  }

  private static int insertTable(
      final Connection conn, final TableSchema table, final List<Row> rows, final boolean postgres)
      throws SQLException {
    final List<ColumnInfo> columns = table.columns();
    final String sql = insertStatement(table);
    int count = 0;
    try (final PreparedStatement ps = conn.prepareStatement(sql)) {
      for (final Row row : rows) {
        for (int i = 0; i < columns.size(); i++) {
          final ColumnInfo column = columns.get(i);
          final Object value = row.get(column.name());
          if (postgres && (UNTYPED_TAGS.contains(column.typeTag()) || column.hasEnumValues())) {
            ps.setObject(i + 1, value, Types.OTHER);
          } else {
            ps.setObject(i + 1, value);
          }
        }
        ps.addBatch();
        count++;
        if (count % BATCH_SIZE == 0) {
          ps.executeBatch();
        }
      }
      if (count % BATCH_SIZE != 0) {
        ps.executeBatch();
      }
    }
    log.info("Inserted {} rows into {}.", count, table.name());
    return count;
  }

  static String insertStatement(final TableSchema table) {
    final String columnList =
        table.columns().stream().map(c -> quote(c.name())).collect(Collectors.joining(", "));
    final String placeholders =
        table.columns().stream().map(c -> "?").collect(Collectors.joining(", "));
    return "INSERT INTO %s (%s) VALUES (%s)"
        .formatted(qualifiedName(table.name()), columnList, placeholders);
  }

  static String qualifiedName(final String table) {
    return Arrays.stream(table.split("\\.")).map(BatchInserter::quote).collect(Collectors.joining("."));
  }

  static String quote(final String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }
}
