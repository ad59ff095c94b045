/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db;

import com.luisppb16.dbfaker.config.GenerationConfig;
import com.luisppb16.dbfaker.db.generator.ForeignKeyResolver;
import com.luisppb16.dbfaker.db.generator.RowGenerator;
import com.luisppb16.dbfaker.db.generator.TableGenerator;
import com.luisppb16.dbfaker.db.generator.TypeMapper;
import com.luisppb16.dbfaker.model.TableSchema;
import com.luisppb16.dbfaker.strategy.GenerationContext;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of a generation run: orders the schema, then generates and commits each table in
 * turn so later tables can reference the rows of earlier ones.
 */
@Slf4j
@UtilityClass
public class DataGenerator {

  public static GenerationResult generate(final List<TableSchema> tables) {
    return generate(tables, GenerationConfig.defaults());
  }

  public static GenerationResult generate(
      final List<TableSchema> tables, final GenerationConfig config) {
    Objects.requireNonNull(tables, "Tables cannot be null");
    Objects.requireNonNull(config, "Generation config cannot be null");

    final Instant start = Instant.now();
    final Map<String, TableSchema> tableMap = indexByName(tables);
    final List<String> order = DependencyOrderer.order(tables);

    final GenerationContext context =
        GenerationContext.create(config.seed(), config.locale(), config.columnNameMappings());
    final GenerationStore store = new GenerationStore();
    final TypeMapper typeMapper =
        new TypeMapper(context.columnNameMappings(), config.nullProbability());
    final ForeignKeyResolver resolver = new ForeignKeyResolver(store, config.maxJoinRows());

    // Every column is mapped up front so an unsupported type aborts before any row exists.
    final Map<String, TableGenerator> generators = new LinkedHashMap<>();
    for (final String name : order) {
      final RowGenerator rowGenerator =
          new RowGenerator(tableMap.get(name), typeMapper, resolver, config.overridesFor(name));
      generators.put(
          name,
          new TableGenerator(
              rowGenerator,
              config.rowCountFor(name),
              config.minRows(),
              config.maxRows(),
              config.maxAttempts()));
    }

    generators.forEach(
        (name, generator) -> {
          log.info("Generating rows for table {}.", name);
          store.commit(name, generator.sample(context));
        });

    final double seconds = Duration.between(start, Instant.now()).toMillis() / 1000.0;
    final List<Diagnostic> diagnostics = context.diagnostics().entries();
    log.info(
        "Generation completed in {} seconds. Tables: {}, rows: {}, diagnostics: {}",
        String.format(Locale.ROOT, "%.3f", seconds),
        store.tables().size(),
        store.totalRows(),
        diagnostics.size());

    return new GenerationResult(store, diagnostics);
  }

  private static Map<String, TableSchema> indexByName(final List<TableSchema> tables) {
    final Map<String, TableSchema> byName = new LinkedHashMap<>();
    for (final TableSchema table : tables) {
      if (byName.putIfAbsent(table.name(), table) != null) {
        throw new IllegalArgumentException("Duplicate table " + table.name() + " in schema");
      }
    }
    return byName;
  }
}
