/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Collects the diagnostics of one run. Safe to share between threads. */
@Slf4j
public final class Diagnostics {

  private final List<Diagnostic> entries = Collections.synchronizedList(new ArrayList<>());

  public void record(final Diagnostic.Kind kind, final String table, final String message) {
    final Diagnostic diagnostic = new Diagnostic(kind, table, message);
    entries.add(diagnostic);
    log.warn("[{}] {}: {}", kind, table, message);
  }

  public List<Diagnostic> entries() {
    synchronized (entries) {
      return List.copyOf(entries);
    }
  }

  public List<Diagnostic> ofKind(final Diagnostic.Kind kind) {
    return entries().stream().filter(d -> d.kind() == kind).toList();
  }
}
