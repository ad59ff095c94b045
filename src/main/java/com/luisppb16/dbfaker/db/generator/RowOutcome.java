/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db.generator;

import com.luisppb16.dbfaker.db.Row;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Either a generated row or the set of foreign key columns no parent data could satisfy. */
public sealed interface RowOutcome permits RowOutcome.Generated, RowOutcome.Unsatisfiable {

  default Optional<Row> generatedRow() {
    return this instanceof Generated generated ? Optional.of(generated.row()) : Optional.empty();
  }

  default boolean isGenerated() {
    return this instanceof Generated;
  }

  record Generated(Row row) implements RowOutcome {
    public Generated {
      Objects.requireNonNull(row, "Row cannot be null");
    }
  }

  record Unsatisfiable(Set<String> columns) implements RowOutcome {
    public Unsatisfiable {
      columns = Set.copyOf(columns);
    }
  }
}
