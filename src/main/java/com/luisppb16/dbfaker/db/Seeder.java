/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db;

import com.luisppb16.dbfaker.config.GenerationConfig;
import com.luisppb16.dbfaker.model.TableSchema;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/** Introspects a schema, generates rows for it and inserts them over the same connection. */
@Slf4j
@UtilityClass
public class Seeder {

  public static GenerationResult seed(
      final Connection conn, final String schema, final GenerationConfig config)
      throws SQLException {
    final List<TableSchema> tables = SchemaIntrospector.introspect(conn, schema);
    final GenerationResult result = DataGenerator.generate(tables, config);
    final Map<String, Integer> inserted = BatchInserter.insert(conn, tables, result.store());
    log.info(
        "Seeded {} tables of schema {} with {} rows.",
        inserted.size(),
        schema,
        inserted.values().stream().mapToInt(Integer::intValue).sum());
    return result;
  }
}
