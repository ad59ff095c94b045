/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.strategy;

import com.luisppb16.dbfaker.db.Row;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the key an item must not share with previously accepted items. Returning {@code null}
 * means the key cannot be enforced for this item and the check is skipped.
 *
 * @param <T> item type
 */
@FunctionalInterface
public interface UniquenessKey<T> {

  Object keyOf(T item);

  /** Key over the given row columns; {@code null} as soon as one of them is NULL. */
  static UniquenessKey<Row> columns(final List<String> columns) {
    final List<String> cols = List.copyOf(columns);
    return row -> {
      final List<Object> values = new ArrayList<>(cols.size());
      for (final String col : cols) {
        final Object value = row.get(col);
        if (value == null) {
          return null;
        }
        values.add(value);
      }
      return List.copyOf(values);
    };
  }
}
