/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.util;

import java.util.Set;
import lombok.Getter;

/** Thrown when the foreign key graph contains a cycle, self references included. */
@Getter
public class CyclicDependencyException extends DataFakerException {

  private final Set<String> tables;

  public CyclicDependencyException(final Set<String> tables) {
    super("Cycle detected in foreign key constraints between tables " + tables);
    this.tables = Set.copyOf(tables);
  }
}
