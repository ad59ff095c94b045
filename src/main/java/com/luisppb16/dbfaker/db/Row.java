/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** One generated row. Values may be {@code null}; the map keeps column order and is read-only. */
public record Row(Map<String, Object> values) {

  public Row {
    Objects.requireNonNull(values, "Row values cannot be null");
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static Row empty() {
    return new Row(Map.of());
  }

  public Object get(final String column) {
    return values.get(column);
  }

  public boolean has(final String column) {
    return values.containsKey(column);
  }

  public Set<String> columns() {
    return values.keySet();
  }
}
