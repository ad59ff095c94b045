/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db;

import java.util.Objects;

/** A recoverable or advisory condition met while generating; never fails the run. */
public record Diagnostic(Kind kind, String table, String message) {

  public Diagnostic {
    Objects.requireNonNull(kind, "Diagnostic kind cannot be null");
    Objects.requireNonNull(message, "Diagnostic message cannot be null");
  }

  public enum Kind {
    /** A table's foreign keys could not be satisfied by the committed parent rows. */
    FK_UNSATISFIABLE,
    /** Fewer unique rows than the minimum were found within the attempt budget. */
    UNIQUE_SHORTFALL,
    /** The foreign key candidate join was cut at the sampling cap. */
    JOIN_TRUNCATED,
    /** A caller override targeted a column owned by a foreign key. */
    OVERRIDE_IGNORED,
    /** Two field groups of a row produced the same column. */
    KEY_COLLISION
  }
}
