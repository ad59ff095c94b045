/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db.generator;

import com.luisppb16.dbfaker.strategy.Strategies;
import com.luisppb16.dbfaker.strategy.Strategy;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered column-name heuristics for unbounded text columns. A rule matches when every one of its
 * words occurs in the lower-cased column name; the first matching rule wins, so specific rules
 * have to precede general ones.
 *
 * <p>The defaults put compound and longer words ahead of their prefixes ({@code street_address}
 * before {@code address}, {@code company + name} before {@code name}). Callers extend them with
 * {@link #prependedWith(List)} or replace them with {@link #of(List)}.
 */
public final class ColumnNameMappings {

  private static final ColumnNameMappings DEFAULTS =
      of(
          List.of(
              rule(Strategies.faked("email", f -> f.internet().emailAddress()), "email"),
              rule(
                  Strategies.faked("phone number", f -> f.phoneNumber().phoneNumber()),
                  "phone_number"),
              rule(Strategies.faked("phone number", f -> f.phoneNumber().phoneNumber()), "telephone"),
              rule(
                  Strategies.faked("street address", f -> f.address().streetAddress()),
                  "street_address"),
              rule(Strategies.faked("street address", f -> f.address().streetAddress()), "street"),
              rule(Strategies.faked("zip code", f -> f.address().zipCode()), "zip_code"),
              rule(Strategies.faked("zip code", f -> f.address().zipCode()), "postal_code"),
              rule(Strategies.faked("company", f -> f.company().name()), "company", "name"),
              rule(counterpartyName(), "counterparty", "name"),
              rule(counterpartyName(), "customer", "name"),
              rule(counterpartyName(), "supplier", "name"),
              rule(Strategies.faked("address", f -> f.address().fullAddress()), "address"),
              rule(Strategies.faked("name", f -> f.name().fullName()), "name"),
              rule(Strategies.faked("city", f -> f.address().city()), "city"),
              rule(Strategies.faked("country", f -> f.address().country()), "country"),
              rule(Strategies.faked("currency", f -> f.currency().code()), "currency")));

  private final List<ColumnNameRule> rules;

  private ColumnNameMappings(final List<ColumnNameRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public static ColumnNameMappings defaults() {
    return DEFAULTS;
  }

  public static ColumnNameMappings of(final List<ColumnNameRule> rules) {
    Objects.requireNonNull(rules, "Rules cannot be null");
    return new ColumnNameMappings(rules);
  }

  public static ColumnNameMappings empty() {
    return new ColumnNameMappings(List.of());
  }

  public static ColumnNameRule rule(final Strategy<?> strategy, final String... words) {
    return new ColumnNameRule(List.of(words), strategy);
  }

  /** Caller rules first, then these. */
  public ColumnNameMappings prependedWith(final List<ColumnNameRule> callerRules) {
    final List<ColumnNameRule> merged = new ArrayList<>(callerRules);
    merged.addAll(rules);
    return new ColumnNameMappings(merged);
  }

  public Optional<Strategy<?>> match(final String columnName) {
    final String lowered = columnName.toLowerCase(Locale.ROOT);
    return rules.stream()
        .filter(r -> r.matches(lowered))
        .findFirst()
        .map(ColumnNameRule::strategy);
  }

  public List<ColumnNameRule> rules() {
    return rules;
  }

  private static Strategy<String> counterpartyName() {
    return Strategies.faked(
        "counterparty name",
        f ->
            f.bool().bool()
                ? f.company().name()
                : f.name().fullName() + " " + f.company().suffix());
  }

  /** Words are matched as lower-case substrings of the column name. */
  public record ColumnNameRule(List<String> words, Strategy<?> strategy) {

    public ColumnNameRule {
      Objects.requireNonNull(strategy, "Rule strategy cannot be null");
      if (words == null || words.isEmpty()) {
        throw new IllegalArgumentException("A column name rule needs at least one word");
      }
      words = words.stream().map(w -> w.toLowerCase(Locale.ROOT)).toList();
    }

    boolean matches(final String loweredColumnName) {
      return words.stream().allMatch(loweredColumnName::contains);
    }
  }
}
