/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db.generator;

import com.luisppb16.dbfaker.db.Diagnostic;
import com.luisppb16.dbfaker.db.Row;
import com.luisppb16.dbfaker.model.TableSchema;
import com.luisppb16.dbfaker.strategy.GenerationContext;
import com.luisppb16.dbfaker.strategy.Strategies;
import com.luisppb16.dbfaker.strategy.Strategy;
import com.luisppb16.dbfaker.strategy.UniquenessKey;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Generates all rows of one table. A table asked for no rows yields none without sampling.
 * Otherwise a trial row is drawn first; if its foreign keys cannot be satisfied the table is left
 * empty. Otherwise rows are drawn until the target count is met or the attempt budget runs out,
 * and a row is kept only when none of its fully non-null unique keys was seen before.
 */
@Slf4j
public final class TableGenerator implements Strategy<List<Row>> {

  private final TableSchema table;
  private final RowGenerator rowGenerator;
  private final int minRows;
  private final int maxRows;
  private final int maxAttempts;

  public TableGenerator(
      final RowGenerator rowGenerator,
      final Integer rowCount,
      final int minRows,
      final int maxRows,
      final int maxAttempts) {
    this.rowGenerator = Objects.requireNonNull(rowGenerator, "Row generator cannot be null");
    this.table = rowGenerator.getTable();
    if (rowCount != null) {
      if (rowCount < 0) {
        throw new IllegalArgumentException(
            "Row count for %s cannot be negative: %d".formatted(table.name(), rowCount));
      }
      this.minRows = rowCount;
      this.maxRows = rowCount;
    } else {
      this.minRows = minRows;
      this.maxRows = maxRows;
    }
    this.maxAttempts = maxAttempts;
  }

  @Override
  public List<Row> sample(final GenerationContext context) {
    if (maxRows == 0) {
      return List.of();
    }
    final RowOutcome trial = rowGenerator.sample(context);
    if (trial instanceof RowOutcome.Unsatisfiable unsatisfiable) {
      context
          .diagnostics()
          .record(
              Diagnostic.Kind.FK_UNSATISFIABLE,
              table.name(),
              "No parent rows satisfy foreign key columns %s; table left empty"
                  .formatted(unsatisfiable.columns()));
      return List.of();
    }

    final AtomicInteger rejected = new AtomicInteger();
    final Strategy<Row> rows =
        rowGenerator.map(
            outcome -> {
              if (!outcome.isGenerated()) {
                rejected.incrementAndGet();
              }
              return outcome.generatedRow().orElse(null);
            });

    final List<UniquenessKey<Row>> keys =
        table.uniqueConstraints().stream().map(uc -> UniquenessKey.columns(uc.columns())).toList();

    final List<Row> result =
        Strategies.<Row>list(
                rows, minRows, maxRows, keys, Objects::nonNull, maxAttempts, table.name())
            .sample(context);

    if (rejected.get() > 0) {
      log.debug(
          "{} candidate rows of {} had unsatisfiable foreign keys.", rejected.get(), table.name());
    }
    log.debug("Generated {} rows for table {}.", result.size(), table.name());
    return result;
  }
}
