/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.luisppb16.dbfaker.db.Diagnostic;
import com.luisppb16.dbfaker.db.Row;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneOffset;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import net.datafaker.Faker;

/**
 * Factory for every generator kind. Combinators ({@link #fixed}, {@link #nullable}, {@link
 * #oneOf}, {@link #row}, {@link #list}, {@link #map}) compose other strategies; the remaining
 * factories are the terminal fake-value producers used by the type mapper.
 *
 * <p>Each kind is an immutable record carrying its own parameters, so a strategy prints what it
 * will do and two strategies built from the same arguments are equal.
 */
public final class Strategies {

  public static final double DEFAULT_NULL_PROBABILITY = 0.1;
  public static final int DEFAULT_MAX_ATTEMPTS = 10_000;

  static final int DEFAULT_TEXT_LENGTH = 20;
  static final int MAX_VARBIT_LENGTH = 64;

  private static final ObjectMapper JSON = new ObjectMapper();
  private static final int DATE_RANGE_DAYS = (int) LocalDate.of(2037, 12, 31).toEpochDay();
  private static final long MAX_EPOCH_SECOND =
      LocalDateTime.of(2037, 12, 31, 23, 59, 59).toEpochSecond(ZoneOffset.UTC);
  private static final int SECONDS_PER_DAY = 86_400;

  private Strategies() {}

  // ── Combinators ──

  public static <T> Strategy<T> fixed(final T value) {
    return new Fixed<>(value);
  }

  public static <T> Strategy<T> nullable(final Strategy<? extends T> inner) {
    return nullable(inner, DEFAULT_NULL_PROBABILITY);
  }

  public static <T> Strategy<T> nullable(final Strategy<? extends T> inner, final double probNull) {
    Objects.requireNonNull(inner, "Inner strategy cannot be null");
    if (probNull < 0.0 || probNull > 1.0) {
      throw new IllegalArgumentException("Null probability must be within [0, 1]: " + probNull);
    }
    return new Nullable<>(inner, probNull);
  }

  public static <T> Strategy<T> oneOf(final Collection<? extends T> options) {
    Objects.requireNonNull(options, "Options cannot be null");
    if (options.isEmpty()) {
      throw new IllegalArgumentException("oneOf needs at least one option");
    }
    return new OneOf<>(Collections.unmodifiableList(new ArrayList<T>(options)));
  }

  /**
   * Row built from one strategy per column, then merged with the row of every extra group in
   * order. A column produced twice is reported as {@link Diagnostic.Kind#KEY_COLLISION} and the
   * later group wins.
   */
  public static Strategy<Row> row(
      final Map<String, ? extends Strategy<?>> fields,
      final List<? extends Strategy<Row>> extraGroups,
      final String label) {
    Objects.requireNonNull(fields, "Field strategies cannot be null");
    final List<Strategy<Row>> groups = extraGroups == null ? List.of() : List.copyOf(extraGroups);
    return new RowOf(
        Collections.unmodifiableMap(new LinkedHashMap<String, Strategy<?>>(fields)), groups, label);
  }

  public static Strategy<Row> row(final Map<String, ? extends Strategy<?>> fields) {
    return row(fields, List.of(), "row");
  }

  /**
   * List of uniformly chosen length in [{@code minLength}, {@code maxLength}]. Up to {@code
   * maxAttempts} candidates are drawn; a candidate is dropped when the admission predicate
   * rejects it or when one of its enforceable keys was already accepted. Coming up short of
   * {@code minLength} is reported, not thrown.
   */
  public static <T> Strategy<List<T>> list(
      final Strategy<? extends T> item,
      final int minLength,
      final int maxLength,
      final List<? extends UniquenessKey<? super T>> uniquenessKeys,
      final Predicate<? super T> admission,
      final int maxAttempts,
      final String label) {
    Objects.requireNonNull(item, "Item strategy cannot be null");
    if (minLength < 0 || maxLength < minLength) {
      throw new IllegalArgumentException(
          "Invalid list length bounds [%d, %d]".formatted(minLength, maxLength));
    }
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("Max attempts must be positive: " + maxAttempts);
    }
    final List<UniquenessKey<? super T>> keys =
        uniquenessKeys == null ? List.of() : List.copyOf(uniquenessKeys);
    final Predicate<? super T> admit = admission == null ? x -> true : admission;
    return new ListOf<T>(item, minLength, maxLength, keys, admit, maxAttempts, label);
  }

  public static <T> Strategy<List<T>> list(
      final Strategy<? extends T> item, final int minLength, final int maxLength) {
    return list(item, minLength, maxLength, List.of(), null, DEFAULT_MAX_ATTEMPTS, "list");
  }

  public static <T, R> Strategy<R> map(
      final Strategy<? extends T> inner, final Function<? super T, ? extends R> fn) {
    Objects.requireNonNull(inner, "Inner strategy cannot be null");
    Objects.requireNonNull(fn, "Mapping function cannot be null");
    return new Mapped<>(inner, fn);
  }

  // ── Terminal fake values ──

  public static Strategy<UUID> uuid() {
    return new UuidValue();
  }

  public static Strategy<LocalDate> date() {
    return new DateValue();
  }

  public static Strategy<Temporal> timestamp(final boolean withZone) {
    return new TimestampValue(withZone);
  }

  public static Strategy<Temporal> time(final boolean withZone) {
    return new TimeValue(withZone);
  }

  public static Strategy<String> text(final Integer maxLength) {
    return new TextValue(maxLength);
  }

  public static Strategy<BigDecimal> decimal(final int precision, final int scale) {
    if (precision <= 0 || scale < 0) {
      throw new IllegalArgumentException(
          "Invalid decimal layout precision=%d scale=%d".formatted(precision, scale));
    }
    return new DecimalValue(precision, scale);
  }

  public static Strategy<Boolean> bool() {
    return new BooleanValue();
  }

  public static Strategy<Number> integer(final int bits) {
    if (bits < 2 || bits > 64) {
      throw new IllegalArgumentException("Integer width must be within [2, 64] bits: " + bits);
    }
    return new IntegerValue(bits);
  }

  public static Strategy<String> json() {
    return new JsonValue();
  }

  public static Strategy<String> xml() {
    return new XmlValue();
  }

  public static Strategy<String> bitString(final Integer length, final boolean varying) {
    return new BitStringValue(length, varying);
  }

  public static <T> Strategy<T> faked(final String label, final Function<Faker, ? extends T> fn) {
    Objects.requireNonNull(fn, "Faker function cannot be null");
    return new Faked<>(label, fn);
  }

  // ── Kinds ──

  private record Fixed<T>(T value) implements Strategy<T> {
    @Override
    public T sample(final GenerationContext context) {
      return value;
    }
  }

  private record Nullable<T>(Strategy<? extends T> inner, double probNull) implements Strategy<T> {
    @Override
    public T sample(final GenerationContext context) {
      return context.random().nextDouble() < probNull ? null : inner.sample(context);
    }
  }

  private record OneOf<T>(List<T> options) implements Strategy<T> {
    @Override
    public T sample(final GenerationContext context) {
      return options.get(context.random().nextInt(options.size()));
    }
  }

  private record RowOf(
      Map<String, Strategy<?>> fields, List<Strategy<Row>> extraGroups, String label)
      implements Strategy<Row> {
    @Override
    public Row sample(final GenerationContext context) {
      final Map<String, Object> values = new LinkedHashMap<>();
      fields.forEach((column, strategy) -> values.put(column, strategy.sample(context)));
      for (final Strategy<Row> group : extraGroups) {
        final Row other = group.sample(context);
        final Set<String> overlap =
            other.columns().stream()
                .filter(values::containsKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (!overlap.isEmpty()) {
          context
              .diagnostics()
              .record(Diagnostic.Kind.KEY_COLLISION, label, "Key overlap in row fields: " + overlap);
        }
        values.putAll(other.values());
      }
      return new Row(values);
    }
  }

  private record ListOf<T>(
      Strategy<? extends T> item,
      int minLength,
      int maxLength,
      List<UniquenessKey<? super T>> uniquenessKeys,
      Predicate<? super T> admission,
      int maxAttempts,
      String label)
      implements Strategy<List<T>> {

    @Override
    public List<T> sample(final GenerationContext context) {
      final int length = minLength + context.random().nextInt(maxLength - minLength + 1);
      final List<Set<Object>> seen = new ArrayList<>(uniquenessKeys.size());
      uniquenessKeys.forEach(k -> seen.add(new HashSet<>()));

      final List<T> items = new ArrayList<>(length);
      for (int attempt = 0; attempt < maxAttempts && items.size() < length; attempt++) {
        final T candidate = item.sample(context);
        if (!admission.test(candidate)) {
          continue;
        }
        final Object[] keys = new Object[uniquenessKeys.size()];
        boolean duplicate = false;
        for (int i = 0; i < keys.length && !duplicate; i++) {
          keys[i] = uniquenessKeys.get(i).keyOf(candidate);
          duplicate = keys[i] != null && seen.get(i).contains(keys[i]);
        }
        if (duplicate) {
          continue;
        }
        for (int i = 0; i < keys.length; i++) {
          if (keys[i] != null) {
            seen.get(i).add(keys[i]);
          }
        }
        items.add(candidate);
      }

      if (items.size() < minLength) {
        context
            .diagnostics()
            .record(
                Diagnostic.Kind.UNIQUE_SHORTFALL,
                label,
                "Generated %d items, fewer than the minimum %d after %d attempts"
                    .formatted(items.size(), minLength, maxAttempts));
      }
      return Collections.unmodifiableList(items);
    }
  }

  private record Mapped<T, R>(Strategy<? extends T> inner, Function<? super T, ? extends R> fn)
      implements Strategy<R> {
    @Override
    public R sample(final GenerationContext context) {
      return fn.apply(inner.sample(context));
    }
  }

  private record UuidValue() implements Strategy<UUID> {
    @Override
    public UUID sample(final GenerationContext context) {
      final Random random = context.random();
      final long msb = (random.nextLong() & ~0xF000L) | 0x4000L;
      final long lsb = (random.nextLong() & 0x3FFF_FFFF_FFFF_FFFFL) | 0x8000_0000_0000_0000L;
      return new UUID(msb, lsb);
    }
  }

  private record DateValue() implements Strategy<LocalDate> {
    @Override
    public LocalDate sample(final GenerationContext context) {
      return LocalDate.ofEpochDay(context.random().nextInt(DATE_RANGE_DAYS));
    }
  }

  private record TimestampValue(boolean withZone) implements Strategy<Temporal> {
    @Override
    public Temporal sample(final GenerationContext context) {
      final LocalDateTime value =
          LocalDateTime.ofEpochSecond(
              context.random().nextLong(0, MAX_EPOCH_SECOND), 0, ZoneOffset.UTC);
      return withZone ? OffsetDateTime.of(value, ZoneOffset.UTC) : value;
    }
  }

  private record TimeValue(boolean withZone) implements Strategy<Temporal> {
    @Override
    public Temporal sample(final GenerationContext context) {
      final LocalTime value = LocalTime.ofSecondOfDay(context.random().nextInt(SECONDS_PER_DAY));
      return withZone ? OffsetTime.of(value, ZoneOffset.UTC) : value;
    }
  }

  private record TextValue(Integer maxLength) implements Strategy<String> {
    @Override
    public String sample(final GenerationContext context) {
      final int upper =
          maxLength != null && maxLength > 0
              ? Math.min(maxLength, DEFAULT_TEXT_LENGTH)
              : DEFAULT_TEXT_LENGTH;
      return context.faker().lorem().characters(1 + context.random().nextInt(upper));
    }
  }

  private record DecimalValue(int precision, int scale) implements Strategy<BigDecimal> {
    @Override
    public BigDecimal sample(final GenerationContext context) {
      final int integerDigits = Math.max(precision - scale, 0);
      final int totalDigits = integerDigits + scale;
      final StringBuilder digits = new StringBuilder(totalDigits);
      for (int i = 0; i < totalDigits; i++) {
        digits.append((char) ('0' + context.random().nextInt(10)));
      }
      final BigDecimal value = new BigDecimal(new BigInteger(digits.toString()), scale);
      return context.random().nextBoolean() ? value.negate() : value;
    }
  }

  private record BooleanValue() implements Strategy<Boolean> {
    @Override
    public Boolean sample(final GenerationContext context) {
      return context.faker().bool().bool();
    }
  }

  private record IntegerValue(int bits) implements Strategy<Number> {
    @Override
    public Number sample(final GenerationContext context) {
      if (bits == 64) {
        return context.random().nextLong();
      }
      final long bound = 1L << (bits - 1);
      final long value = context.random().nextLong(-bound, bound);
      if (bits <= 32) {
        return (int) value;
      }
      return value;
    }
  }

  private record JsonValue() implements Strategy<String> {
    @Override
    public String sample(final GenerationContext context) {
      final ObjectNode node = JSON.createObjectNode();
      final int fields = 1 + context.random().nextInt(4);
      for (int i = 0; i < fields; i++) {
        final String key = context.faker().lorem().word() + "_" + i;
        switch (context.random().nextInt(3)) {
          case 0 -> node.put(key, context.random().nextInt(1_000));
          case 1 -> node.put(key, context.faker().lorem().word());
          default -> node.put(key, context.random().nextBoolean());
        }
      }
      try {
        return JSON.writeValueAsString(node);
      } catch (final JsonProcessingException e) {
        throw new UncheckedIOException(e);
      }
    }
  }

  private record XmlValue() implements Strategy<String> {
    @Override
    public String sample(final GenerationContext context) {
      final StringBuilder sb = new StringBuilder("<record>");
      final int fields = 1 + context.random().nextInt(4);
      for (int i = 0; i < fields; i++) {
        final String tag = context.faker().lorem().word();
        sb.append('<')
            .append(tag)
            .append('>')
            .append(context.faker().lorem().word())
            .append("</")
            .append(tag)
            .append('>');
      }
      return sb.append("</record>").toString();
    }
  }

  private record BitStringValue(Integer length, boolean varying) implements Strategy<String> {
    @Override
    public String sample(final GenerationContext context) {
      final int size;
      if (length == null || length <= 0) {
        size = varying ? 1 + context.random().nextInt(MAX_VARBIT_LENGTH) : 1;
      } else {
        size = varying ? 1 + context.random().nextInt(length) : length;
      }
      final StringBuilder bits = new StringBuilder(size);
      for (int i = 0; i < size; i++) {
        bits.append(context.random().nextBoolean() ? '1' : '0');
      }
      return bits.toString();
    }
  }

  private record Faked<T>(String label, Function<Faker, ? extends T> fn) implements Strategy<T> {
    @Override
    public T sample(final GenerationContext context) {
      return fn.apply(context.faker());
    }
  }
}
