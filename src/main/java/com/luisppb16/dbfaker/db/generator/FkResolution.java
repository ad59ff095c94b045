/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db.generator;

import com.luisppb16.dbfaker.db.Row;
import com.luisppb16.dbfaker.strategy.Strategy;
import java.util.Objects;
import java.util.Set;

/**
 * Result of joining a table's enforceable foreign keys against the committed parent rows.
 *
 * @param constrainedColumns every local column spanned by the resolved constraints
 * @param strategy picks one valid assignment of those columns; {@code null} when none exists
 * @param candidateCount number of candidate assignments kept after the cap
 * @param truncated whether the join produced more candidates than the cap
 */
public record FkResolution(
    Set<String> constrainedColumns, Strategy<Row> strategy, int candidateCount, boolean truncated) {

  public FkResolution {
    Objects.requireNonNull(constrainedColumns, "Constrained columns cannot be null");
    constrainedColumns = Set.copyOf(constrainedColumns);
  }

  public static FkResolution unsatisfiable(final Set<String> constrainedColumns) {
    return new FkResolution(constrainedColumns, null, 0, false);
  }

  public boolean satisfiable() {
    return strategy != null;
  }
}
