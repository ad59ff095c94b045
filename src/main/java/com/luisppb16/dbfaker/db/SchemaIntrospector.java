/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db;

import com.luisppb16.dbfaker.model.ColumnInfo;
import com.luisppb16.dbfaker.model.ForeignKeyConstraint;
import com.luisppb16.dbfaker.model.TableSchema;
import com.luisppb16.dbfaker.model.UniqueConstraint;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the schema snapshot of a live database through {@link DatabaseMetaData}.
 *
 * <p>JDBC type names are normalised to the PostgreSQL type tags the type mapper understands.
 * Primary keys and unique indexes become unique constraints, imported keys become foreign keys
 * and, on PostgreSQL, enum types contribute their labels.
 */
@Slf4j
@UtilityClass
public class SchemaIntrospector {

  private static final String COLUMN_NAME = "COLUMN_NAME";
  private static final int UNBOUNDED_LENGTH = 10_485_760;
  private static final int MAX_DECLARED_PRECISION = 1000;

  private static final Map<String, String> TYPE_ALIASES = typeAliases();

  public static List<TableSchema> introspect(final Connection conn, final String schema)
      throws SQLException {
    Objects.requireNonNull(conn, "Connection cannot be null");
    final DatabaseMetaData meta = conn.getMetaData();
    final Map<String, List<String>> enumLabels = loadEnumLabels(conn, meta);
    final List<TableSchema> tables = new ArrayList<>();

    try (final ResultSet rs = meta.getTables(null, schema, "%", new String[] {"TABLE"})) {
      while (rs.next()) {
        final String tableName = rs.getString("TABLE_NAME");
        final String tableSchema = rs.getString("TABLE_SCHEM");
        final String effectiveSchema = tableSchema != null ? tableSchema : schema;

        tables.add(
            TableSchema.builder()
                .name(tableName)
                .columns(loadColumns(meta, effectiveSchema, tableName, enumLabels))
                .uniqueConstraints(loadUniqueConstraints(meta, effectiveSchema, tableName))
                .foreignKeys(loadForeignKeys(meta, effectiveSchema, tableName))
                .build());
      }
    }
    log.info("Introspected {} tables from schema {}.", tables.size(), schema);
    return tables;
  }

  private static List<ColumnInfo> loadColumns(
      final DatabaseMetaData meta,
      final String schema,
      final String table,
      final Map<String, List<String>> enumLabels)
      throws SQLException {
    final List<ColumnInfo> columns = new ArrayList<>();
    try (final ResultSet rs = meta.getColumns(null, schema, table, "%")) {
      while (rs.next()) {
        final String name = rs.getString(COLUMN_NAME);
        final int dataType = rs.getInt("DATA_TYPE");
        final String typeName = rs.getString("TYPE_NAME");
        final int size = rs.getInt("COLUMN_SIZE");
        final boolean sizeKnown = !rs.wasNull();
        final int digits = rs.getInt("DECIMAL_DIGITS");
        final boolean digitsKnown = !rs.wasNull();
        final int radix = rs.getInt("NUM_PREC_RADIX");

        final List<String> labels = typeName != null ? enumLabels.get(typeName) : null;
        final String tag = labels != null ? typeName : typeTag(typeName, dataType);

        final ColumnInfo.ColumnInfoBuilder column =
            ColumnInfo.builder()
                .name(name)
                .type(tag)
                .nullable("YES".equalsIgnoreCase(rs.getString("IS_NULLABLE")))
                .enumValues(labels);

        switch (tag) {
          case "varchar", "bpchar", "text", "bit", "varbit" -> {
            if (sizeKnown && size > 0 && size < UNBOUNDED_LENGTH) {
              column.maxLength(size);
            }
          }
          case "numeric" -> {
            if (sizeKnown && size > 0 && size <= MAX_DECLARED_PRECISION) {
              column.numericPrecision(size).numericScale(digitsKnown ? digits : 0);
            }
          }
          case "money" -> column.numericPrecision(18).numericScale(2);
          case "float4" -> column.numericPrecision(24);
          case "int2", "int4", "int8" -> {
            if (sizeKnown && radix == 2 && size >= 2 && size <= 64) {
              column.numericPrecision(size);
            }
          }
          default -> {
            // Other tags carry no length or layout.
          }
        }
        columns.add(column.build());
      }
    }
    return columns;
  }

  private static List<UniqueConstraint> loadUniqueConstraints(
      final DatabaseMetaData meta, final String schema, final String table) throws SQLException {
    final List<UniqueConstraint> constraints = new ArrayList<>();

    final Map<Short, String> pkColumns = new TreeMap<>();
    try (final ResultSet rs = meta.getPrimaryKeys(null, schema, table)) {
      while (rs.next()) {
        pkColumns.put(rs.getShort("KEY_SEQ"), rs.getString(COLUMN_NAME));
      }
    }
    if (!pkColumns.isEmpty()) {
      constraints.add(new UniqueConstraint(List.copyOf(pkColumns.values())));
    }

    final Map<String, Map<Short, String>> indexes = new LinkedHashMap<>();
    try (final ResultSet rs = meta.getIndexInfo(null, schema, table, true, false)) {
      while (rs.next()) {
        final String indexName = rs.getString("INDEX_NAME");
        final String columnName = rs.getString(COLUMN_NAME);
        if (indexName == null || columnName == null || rs.getBoolean("NON_UNIQUE")) {
          continue;
        }
        indexes
            .computeIfAbsent(indexName, k -> new TreeMap<>())
            .put(rs.getShort("ORDINAL_POSITION"), columnName);
      }
    }
    for (final Map<Short, String> index : indexes.values()) {
      final UniqueConstraint candidate = new UniqueConstraint(List.copyOf(index.values()));
      if (constraints.stream().noneMatch(candidate::sameColumnsAs)) {
        constraints.add(candidate);
      }
    }
    return constraints;
  }

  private static List<ForeignKeyConstraint> loadForeignKeys(
      final DatabaseMetaData meta, final String schema, final String table) throws SQLException {
    final Map<String, Map<Short, String[]>> grouped = new LinkedHashMap<>();
    final Map<String, String> fkToPkTable = new HashMap<>();
    try (final ResultSet rs = meta.getImportedKeys(null, schema, table)) {
      while (rs.next()) {
        final String pkTableName = rs.getString("PKTABLE_NAME");
        final String fkName =
            Objects.requireNonNullElse(rs.getString("FK_NAME"), "fk_" + table + "_" + pkTableName);
        fkToPkTable.put(fkName, pkTableName);
        grouped
            .computeIfAbsent(fkName, k -> new TreeMap<>())
            .put(
                rs.getShort("KEY_SEQ"),
                new String[] {rs.getString("FKCOLUMN_NAME"), rs.getString("PKCOLUMN_NAME")});
      }
    }

    final List<ForeignKeyConstraint> fks = new ArrayList<>();
    grouped.forEach(
        (fkName, pairs) -> {
          final Map<String, String> mapping = new LinkedHashMap<>();
          pairs.values().forEach(pair -> mapping.put(pair[0], pair[1]));
          fks.add(
              ForeignKeyConstraint.builder()
                  .name(fkName)
                  .localTable(table)
                  .foreignTable(fkToPkTable.get(fkName))
                  .columnMapping(mapping)
                  .build());
        });
    return fks;
  }

  private static Map<String, List<String>> loadEnumLabels(
      final Connection conn, final DatabaseMetaData meta) throws SQLException {
    final String product = safe(meta.getDatabaseProductName()).toLowerCase(Locale.ROOT);
    if (!product.contains("postgres")) {
      return Map.of();
    }
    final String sql =
        "SELECT t.typname, e.enumlabel FROM pg_type t "
            + "JOIN pg_enum e ON e.enumtypid = t.oid "
            + "ORDER BY t.typname, e.enumsortorder";
    final Map<String, List<String>> labels = new HashMap<>();
    try (final PreparedStatement ps = conn.prepareStatement(sql);
        final ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        labels.computeIfAbsent(rs.getString(1), k -> new ArrayList<>()).add(rs.getString(2));
      }
    }
    return labels;
  }

  static String typeTag(final String typeName, final int dataType) {
    if (typeName != null) {
      final String alias = TYPE_ALIASES.get(typeName.trim().toUpperCase(Locale.ROOT));
      if (alias != null) {
        return alias;
      }
    }
    return switch (dataType) {
      case Types.SMALLINT, Types.TINYINT -> "int2";
      case Types.INTEGER -> "int4";
      case Types.BIGINT -> "int8";
      case Types.BOOLEAN -> "bool";
      case Types.VARCHAR, Types.NVARCHAR -> "varchar";
      case Types.CHAR, Types.NCHAR -> "bpchar";
      case Types.LONGVARCHAR, Types.LONGNVARCHAR, Types.CLOB, Types.NCLOB -> "text";
      case Types.NUMERIC, Types.DECIMAL -> "numeric";
      case Types.REAL -> "float4";
      case Types.FLOAT, Types.DOUBLE -> "float8";
      case Types.DATE -> "date";
      case Types.TIME -> "time";
      case Types.TIME_WITH_TIMEZONE -> "timetz";
      case Types.TIMESTAMP -> "timestamp";
      case Types.TIMESTAMP_WITH_TIMEZONE -> "timestamptz";
      case Types.SQLXML -> "xml";
      default -> typeName != null ? typeName.trim().toLowerCase(Locale.ROOT) : "unknown";
    };
  }

  private static Map<String, String> typeAliases() {
    final Map<String, String> aliases = new HashMap<>();
    aliasAll(aliases, "int2", "INT2", "SMALLINT", "SMALLSERIAL", "TINYINT");
    aliasAll(aliases, "int4", "INT4", "INT", "INTEGER", "SERIAL", "MEDIUMINT");
    aliasAll(aliases, "int8", "INT8", "BIGINT", "BIGSERIAL");
    aliasAll(aliases, "bool", "BOOL", "BOOLEAN");
    aliasAll(aliases, "varchar", "VARCHAR", "CHARACTER VARYING", "VARCHAR_IGNORECASE", "NVARCHAR");
    aliasAll(aliases, "bpchar", "BPCHAR", "CHAR", "CHARACTER", "NCHAR");
    aliasAll(aliases, "text", "TEXT", "CLOB", "CHARACTER LARGE OBJECT", "LONGTEXT");
    aliasAll(aliases, "numeric", "NUMERIC", "DECIMAL", "DEC", "NUMBER");
    aliasAll(aliases, "money", "MONEY");
    aliasAll(aliases, "float4", "FLOAT4", "REAL");
    aliasAll(aliases, "float8", "FLOAT8", "FLOAT", "DOUBLE", "DOUBLE PRECISION", "DECFLOAT");
    aliasAll(aliases, "date", "DATE");
    aliasAll(aliases, "timestamp", "TIMESTAMP", "TIMESTAMP WITHOUT TIME ZONE", "DATETIME");
    aliasAll(aliases, "timestamptz", "TIMESTAMPTZ", "TIMESTAMP WITH TIME ZONE");
    aliasAll(aliases, "time", "TIME", "TIME WITHOUT TIME ZONE");
    aliasAll(aliases, "timetz", "TIMETZ", "TIME WITH TIME ZONE");
    aliasAll(aliases, "uuid", "UUID");
    aliasAll(aliases, "json", "JSON");
    aliasAll(aliases, "jsonb", "JSONB");
    aliasAll(aliases, "xml", "XML");
    aliasAll(aliases, "bit", "BIT");
    aliasAll(aliases, "varbit", "VARBIT", "BIT VARYING");
    return Map.copyOf(aliases);
  }

  private static void aliasAll(
      final Map<String, String> aliases, final String tag, final String... names) {
    Set.of(names).forEach(n -> aliases.put(n, tag));
  }

  private static String safe(final String s) {
    return s == null ? "" : s;
  }
}
