/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db;

import java.util.List;
import java.util.Objects;

/** Rows of a completed run, in dependency order, with the diagnostics recorded along the way. */
public record GenerationResult(GenerationStore store, List<Diagnostic> diagnostics) {

  public GenerationResult {
    Objects.requireNonNull(store, "Generation store cannot be null");
    diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
  }

  public List<Row> rows(final String table) {
    return store.rows(table);
  }

  public List<Diagnostic> diagnostics(final Diagnostic.Kind kind) {
    return diagnostics.stream().filter(d -> d.kind() == kind).toList();
  }
}
