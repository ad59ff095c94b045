/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.util;

/** Base type of the errors that abort a whole generation run. */
public class DataFakerException extends RuntimeException {
  public DataFakerException(final String message) {
    super(message);
  }
}
