/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.luisppb16.dbfaker.model.ColumnInfo;
import com.luisppb16.dbfaker.model.ForeignKeyConstraint;
import com.luisppb16.dbfaker.model.TableSchema;
import com.luisppb16.dbfaker.model.UniqueConstraint;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

class SchemaIntrospectorTest {

  private static Connection h2(final String name, final String... ddl) throws SQLException {
    final Connection conn =
        DriverManager.getConnection("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1", "sa", "");
    try (Statement stmt = conn.createStatement()) {
      for (final String sql : ddl) {
        stmt.execute(sql);
      }
    }
    return conn;
  }

  private static TableSchema table(final List<TableSchema> tables, final String name) {
    return tables.stream().filter(t -> t.name().equals(name)).findFirst().orElseThrow();
  }

  @Test
  @DisplayName("Should map H2 column types to type tags with their layout")
  void shouldMapColumnTypes() throws SQLException {
    try (Connection conn =
        h2(
            "introspect_types",
            "CREATE TABLE ITEMS ("
                + "id UUID PRIMARY KEY, "
                + "code CHAR(3) NOT NULL, "
                + "title VARCHAR(40), "
                + "body CLOB, "
                + "price DECIMAL(8, 3) NOT NULL, "
                + "weight REAL, "
                + "qty SMALLINT, "
                + "total BIGINT, "
                + "active BOOLEAN, "
                + "born DATE, "
                + "seen TIMESTAMP, "
                + "seen_tz TIMESTAMP WITH TIME ZONE)")) {

      final TableSchema items = table(SchemaIntrospector.introspect(conn, "PUBLIC"), "ITEMS");
      final Map<String, ColumnInfo> columns =
          items.columns().stream().collect(Collectors.toMap(ColumnInfo::name, Function.identity()));

      assertEquals("uuid", columns.get("ID").type());
      assertEquals("bpchar", columns.get("CODE").type());
      assertEquals(3, columns.get("CODE").maxLength());
      assertFalse(columns.get("CODE").nullable());
      assertEquals("varchar", columns.get("TITLE").type());
      assertEquals(40, columns.get("TITLE").maxLength());
      assertTrue(columns.get("TITLE").nullable());
      assertEquals("text", columns.get("BODY").type());
      assertNull(columns.get("BODY").maxLength());
      assertEquals("numeric", columns.get("PRICE").type());
      assertEquals(8, columns.get("PRICE").numericPrecision());
      assertEquals(3, columns.get("PRICE").numericScale());
      assertEquals("float4", columns.get("WEIGHT").type());
      assertEquals("int2", columns.get("QTY").type());
      assertEquals("int8", columns.get("TOTAL").type());
      assertEquals("bool", columns.get("ACTIVE").type());
      assertEquals("date", columns.get("BORN").type());
      assertEquals("timestamp", columns.get("SEEN").type());
      assertEquals("timestamptz", columns.get("SEEN_TZ").type());
    }
  }

  @Test
  @DisplayName("Should keep declared column order")
  void shouldKeepColumnOrder() throws SQLException {
    try (Connection conn = h2("introspect_order", "CREATE TABLE T (c INT, a INT, b INT)")) {
      final TableSchema t = table(SchemaIntrospector.introspect(conn, "PUBLIC"), "T");

      assertEquals(List.of("C", "A", "B"), t.columns().stream().map(ColumnInfo::name).toList());
    }
  }

  @Test
  @DisplayName("Should read primary keys and unique constraints without duplicates")
  void shouldReadUniqueConstraints() throws SQLException {
    try (Connection conn =
        h2(
            "introspect_unique",
            "CREATE TABLE EMPLOYEES ("
                + "dept_id INT, emp_id INT, email VARCHAR(255), "
                + "PRIMARY KEY (dept_id, emp_id), UNIQUE (email))")) {

      final TableSchema employees =
          table(SchemaIntrospector.introspect(conn, "PUBLIC"), "EMPLOYEES");

      assertEquals(2, employees.uniqueConstraints().size());
      assertEquals(List.of("DEPT_ID", "EMP_ID"), employees.uniqueConstraints().get(0).columns());
      assertTrue(
          employees.uniqueConstraints().stream()
              .anyMatch(uc -> uc.sameColumnsAs(UniqueConstraint.of("EMAIL"))));
    }
  }

  @Test
  @DisplayName("Should group composite foreign keys in key order")
  void shouldReadForeignKeys() throws SQLException {
    try (Connection conn =
        h2(
            "introspect_fk",
            "CREATE TABLE PARENT (a INT, b INT, PRIMARY KEY (a, b))",
            "CREATE TABLE CHILD (id INT PRIMARY KEY, pb INT, pa INT, "
                + "FOREIGN KEY (pa, pb) REFERENCES PARENT(a, b))")) {

      final List<TableSchema> tables = SchemaIntrospector.introspect(conn, "PUBLIC");
      final TableSchema child = table(tables, "CHILD");

      assertTrue(table(tables, "PARENT").foreignKeys().isEmpty());
      assertEquals(1, child.foreignKeys().size());
      final ForeignKeyConstraint fk = child.foreignKeys().get(0);
      assertEquals("CHILD", fk.localTable());
      assertEquals("PARENT", fk.foreignTable());
      assertEquals(List.of("PA", "PB"), fk.localColumns());
      assertEquals(List.of("A", "B"), List.copyOf(fk.columnMapping().values()));
    }
  }

  @ParameterizedTest
  @CsvSource({
    "CHARACTER VARYING, 12, varchar",
    "int4, 4, int4",
    "SERIAL, 4, int4",
    "DOUBLE PRECISION, 8, float8",
    "timestamptz, 93, timestamptz",
    "jsonb, 1111, jsonb",
    "BIT VARYING, -7, varbit",
    "MYSTERY_TYPE, 5, int2",
    "mood, 1111, mood"
  })
  @DisplayName("Should resolve type tags from names first and JDBC codes second")
  void shouldResolveTypeTags(final String typeName, final int dataType, final String expected) {
    assertEquals(expected, SchemaIntrospector.typeTag(typeName, dataType));
  }

  @Test
  void shouldFallBackToJdbcCodeWithoutTypeName() {
    assertEquals("int8", SchemaIntrospector.typeTag(null, Types.BIGINT));
    assertEquals("unknown", SchemaIntrospector.typeTag(null, Types.ARRAY));
  }

  @Nested
  @ExtendWith(MockitoExtension.class)
  class WithMockedMetadata {

    @Mock private Connection connection;

    @Mock private DatabaseMetaData metaData;

    @Test
    @DisplayName("Should return empty list if no tables found")
    void shouldReturnEmptyListIfNoTables() throws SQLException {
      when(connection.getMetaData()).thenReturn(metaData);
      when(metaData.getDatabaseProductName()).thenReturn("H2");

      final ResultSet tableRs = mock(ResultSet.class);
      when(tableRs.next()).thenReturn(false);
      when(metaData.getTables(null, "public", "%", new String[] {"TABLE"})).thenReturn(tableRs);

      assertTrue(SchemaIntrospector.introspect(connection, "public").isEmpty());
    }
  }
}
