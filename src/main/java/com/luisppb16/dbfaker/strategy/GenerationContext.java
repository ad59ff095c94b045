/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.strategy;

import com.luisppb16.dbfaker.db.Diagnostics;
import com.luisppb16.dbfaker.db.generator.ColumnNameMappings;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;
import net.datafaker.Faker;

/**
 * Per-run state threaded through every strategy: the random source (shared with Faker, so one
 * seed fixes the whole run), the column-name heuristic dictionary and the diagnostics sink.
 */
public record GenerationContext(
    Random random, Faker faker, ColumnNameMappings columnNameMappings, Diagnostics diagnostics) {

  public GenerationContext {
    Objects.requireNonNull(random, "Random source cannot be null");
    Objects.requireNonNull(faker, "Faker cannot be null");
    Objects.requireNonNull(columnNameMappings, "Column name mappings cannot be null");
    Objects.requireNonNull(diagnostics, "Diagnostics cannot be null");
  }

  public static GenerationContext create(
      final Long seed, final Locale locale, final ColumnNameMappings mappings) {
    final Random random = seed != null ? new Random(seed) : new Random();
    return new GenerationContext(
        random, new Faker(locale, random), mappings, new Diagnostics());
  }

  public static GenerationContext seeded(final long seed) {
    return create(seed, Locale.ENGLISH, ColumnNameMappings.defaults());
  }
}
