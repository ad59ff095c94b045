/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.util;

import lombok.Getter;

@Getter
public class UnsupportedColumnTypeException extends DataFakerException {

  private final String type;
  private final String table;
  private final String column;

  public UnsupportedColumnTypeException(final String type, final String table, final String column) {
    super("Unsupported column type '%s' for column %s.%s".formatted(type, table, column));
    this.type = type;
    this.table = table;
    this.column = column;
  }
}
