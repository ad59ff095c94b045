/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db.generator;

import static org.assertj.core.api.Assertions.*;

import com.luisppb16.dbfaker.db.Diagnostic;
import com.luisppb16.dbfaker.db.GenerationStore;
import com.luisppb16.dbfaker.db.Row;
import com.luisppb16.dbfaker.model.ColumnInfo;
import com.luisppb16.dbfaker.model.ForeignKeyConstraint;
import com.luisppb16.dbfaker.model.TableSchema;
import com.luisppb16.dbfaker.strategy.GenerationContext;
import com.luisppb16.dbfaker.strategy.Strategies;
import com.luisppb16.dbfaker.strategy.Strategy;
import com.luisppb16.dbfaker.util.UnsupportedColumnTypeException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RowGeneratorTest {

  private GenerationStore store;
  private GenerationContext ctx;
  private TypeMapper notNullMapper;

  @BeforeEach
  void setUp() {
    store = new GenerationStore();
    ctx = GenerationContext.seeded(5L);
    notNullMapper = new TypeMapper(ColumnNameMappings.defaults(), 0.0);
  }

  private static ColumnInfo col(final String name, final String type, final boolean nullable) {
    return ColumnInfo.builder().name(name).type(type).nullable(nullable).build();
  }

  private static ForeignKeyConstraint fk(
      final String local, final String foreign, final Map<String, String> mapping) {
    return ForeignKeyConstraint.builder()
        .localTable(local)
        .foreignTable(foreign)
        .columnMapping(mapping)
        .build();
  }

  private static TableSchema child(final boolean nullableFk) {
    return TableSchema.builder()
        .name("child")
        .columns(List.of(col("id", "int4", false), col("parent_id", "int4", nullableFk), col("note", "text", true)))
        .foreignKeys(List.of(fk("child", "parent", Map.of("parent_id", "id"))))
        .build();
  }

  private void commitParents(final int... ids) {
    final List<Row> rows = new ArrayList<>();
    for (final int id : ids) {
      rows.add(new Row(Map.of("id", id)));
    }
    store.commit("parent", rows);
  }

  private RowGenerator generator(
      final TableSchema table, final TypeMapper mapper, final Map<String, Strategy<?>> overrides) {
    return new RowGenerator(table, mapper, new ForeignKeyResolver(store), overrides);
  }

  private Row generated(final RowGenerator generator) {
    final RowOutcome outcome = generator.sample(ctx);
    assertThat(outcome.isGenerated()).isTrue();
    return outcome.generatedRow().orElseThrow();
  }

  @Test
  void plainTable_rowHasEveryColumnInDeclaredOrder() {
    final TableSchema table =
        TableSchema.builder()
            .name("plain")
            .columns(List.of(col("b", "bool", false), col("a", "uuid", false), col("c", "date", true)))
            .build();

    final Row row = generated(generator(table, notNullMapper, Map.of()));

    assertThat(row.columns()).containsExactly("b", "a", "c");
  }

  @Test
  void foreignKeyColumn_takesParentValues() {
    commitParents(1, 2, 3);
    final RowGenerator generator = generator(child(false), notNullMapper, Map.of());

    for (int i = 0; i < 50; i++) {
      assertThat(generated(generator).get("parent_id")).isIn(1, 2, 3);
    }
  }

  @Test
  void notNullForeignKey_withoutParents_isUnsatisfiable() {
    commitParents();

    final RowOutcome outcome = generator(child(false), notNullMapper, Map.of()).sample(ctx);

    assertThat(outcome).isInstanceOf(RowOutcome.Unsatisfiable.class);
    assertThat(((RowOutcome.Unsatisfiable) outcome).columns()).containsExactly("parent_id");
    assertThat(outcome.generatedRow()).isEmpty();
  }

  @Test
  void nullForeignKeyValue_skipsResolution() {
    commitParents();
    final TypeMapper alwaysNull = new TypeMapper(ColumnNameMappings.defaults(), 1.0);

    final Row row = generated(generator(child(true), alwaysNull, Map.of()));

    assertThat(row.has("parent_id")).isTrue();
    assertThat(row.get("parent_id")).isNull();
  }

  @Test
  void nullableForeignKey_withoutParents_fallsBackToNull() {
    commitParents();

    final Row row = generated(generator(child(true), notNullMapper, Map.of()));

    assertThat(row.get("parent_id")).isNull();
    assertThat(row.get("id")).isNotNull();
  }

  @Test
  void compositeKeyWithOneNull_isNotEnforced() {
    store.commit("pair", List.of());
    final Map<String, String> mapping = new LinkedHashMap<>();
    mapping.put("a", "x");
    mapping.put("b", "y");
    final TableSchema table =
        TableSchema.builder()
            .name("child")
            .columns(List.of(col("a", "int4", true), col("b", "int4", false)))
            .foreignKeys(List.of(fk("child", "pair", mapping)))
            .build();

    final Row row =
        generated(generator(table, notNullMapper, Map.of("a", Strategies.fixed(null))));

    assertThat(row.get("a")).isNull();
    assertThat(row.get("b")).isInstanceOf(Integer.class);
  }

  @Test
  void overrideOnRegularColumn_isUsed() {
    commitParents(1);
    final RowGenerator generator =
        generator(child(false), notNullMapper, Map.of("note", Strategies.fixed("hello")));

    assertThat(generated(generator).get("note")).isEqualTo("hello");
  }

  @Test
  void overrideOnResolvedColumn_isIgnoredAndReportedOnce() {
    commitParents(1, 2);
    final RowGenerator generator =
        generator(child(false), notNullMapper, Map.of("parent_id", Strategies.fixed(99)));

    for (int i = 0; i < 10; i++) {
      assertThat(generated(generator).get("parent_id")).isIn(1, 2);
    }
    assertThat(ctx.diagnostics().ofKind(Diagnostic.Kind.OVERRIDE_IGNORED)).hasSize(1);
  }

  @Test
  void overrideOnUnknownColumn_rejected() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> generator(child(false), notNullMapper, Map.of("ghost", Strategies.fixed(1))))
        .withMessageContaining("child.ghost");
  }

  @Test
  void unsupportedColumnType_failsAtConstruction() {
    final TableSchema table =
        TableSchema.builder().name("shapes").columns(List.of(col("p", "point", false))).build();

    assertThatThrownBy(() -> generator(table, notNullMapper, Map.of()))
        .isInstanceOf(UnsupportedColumnTypeException.class);
  }

  @Test
  void truncatedJoin_isReportedOnce() {
    commitParents(1, 2, 3, 4, 5);
    final RowGenerator generator =
        new RowGenerator(child(false), notNullMapper, new ForeignKeyResolver(store, 2), Map.of());

    for (int i = 0; i < 20; i++) {
      assertThat(generated(generator).get("parent_id")).isIn(1, 2);
    }
    assertThat(ctx.diagnostics().ofKind(Diagnostic.Kind.JOIN_TRUNCATED)).hasSize(1);
  }

  @Test
  void overrideDecidesForeignKeyNullness() {
    commitParents(1);
    final RowGenerator generator =
        generator(child(true), notNullMapper, Map.of("parent_id", Strategies.nullable(Strategies.fixed(1), 1.0)));

    assertThat(generated(generator).get("parent_id")).isNull();
    assertThat(ctx.diagnostics().ofKind(Diagnostic.Kind.OVERRIDE_IGNORED)).isEmpty();
  }

  @Test
  void nullableKeyToEmptyParent_isNulledWhileOtherKeysResolve() {
    commitParents(1, 2, 3);
    store.commit("tag", List.of());
    final TableSchema table =
        TableSchema.builder()
            .name("child")
            .columns(List.of(col("parent_id", "int4", false), col("tag_id", "int4", true)))
            .foreignKeys(
                List.of(
                    fk("child", "parent", Map.of("parent_id", "id")),
                    fk("child", "tag", Map.of("tag_id", "id"))))
            .build();
    final RowGenerator generator = generator(table, notNullMapper, Map.of());

    for (int i = 0; i < 30; i++) {
      final Row row = generated(generator);
      assertThat(row.get("parent_id")).isIn(1, 2, 3);
      assertThat(row.get("tag_id")).isNull();
    }
  }

  @Test
  void notNullKeyToEmptyParent_staysUnsatisfiableNextToNullableKey() {
    commitParents();
    store.commit("tag", List.of(new Row(Map.of("id", 9))));
    final TableSchema table =
        TableSchema.builder()
            .name("child")
            .columns(List.of(col("parent_id", "int4", false), col("tag_id", "int4", true)))
            .foreignKeys(
                List.of(
                    fk("child", "parent", Map.of("parent_id", "id")),
                    fk("child", "tag", Map.of("tag_id", "id"))))
            .build();

    final RowOutcome outcome = generator(table, notNullMapper, Map.of()).sample(ctx);

    assertThat(outcome).isInstanceOf(RowOutcome.Unsatisfiable.class);
    assertThat(((RowOutcome.Unsatisfiable) outcome).columns()).contains("parent_id");
  }
}
