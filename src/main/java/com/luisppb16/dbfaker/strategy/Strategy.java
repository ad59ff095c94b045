/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.strategy;

import java.util.function.Function;

/**
 * A deferred, parameterised value producer. Implementations keep their arguments from
 * construction and may be sampled any number of times; each call draws an independent value from
 * the context's random source.
 *
 * @param <T> produced value type
 */
@FunctionalInterface
public interface Strategy<T> {

  T sample(GenerationContext context);

  default <R> Strategy<R> map(final Function<? super T, ? extends R> fn) {
    return Strategies.map(this, fn);
  }
}
