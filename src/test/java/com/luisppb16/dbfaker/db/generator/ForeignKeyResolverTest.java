/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfaker.db.generator;

import static org.assertj.core.api.Assertions.*;

import com.luisppb16.dbfaker.db.GenerationStore;
import com.luisppb16.dbfaker.db.Row;
import com.luisppb16.dbfaker.model.ForeignKeyConstraint;
import com.luisppb16.dbfaker.strategy.GenerationContext;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ForeignKeyResolverTest {

  private GenerationStore store;
  private GenerationContext ctx;

  @BeforeEach
  void setUp() {
    store = new GenerationStore();
    ctx = GenerationContext.seeded(3L);
  }

  private static Row row(final Object... kv) {
    final Map<String, Object> values = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) {
      values.put((String) kv[i], kv[i + 1]);
    }
    return new Row(values);
  }

  private static ForeignKeyConstraint fk(
      final String foreignTable, final String... localToForeign) {
    final Map<String, String> mapping = new LinkedHashMap<>();
    for (int i = 0; i < localToForeign.length; i += 2) {
      mapping.put(localToForeign[i], localToForeign[i + 1]);
    }
    return ForeignKeyConstraint.builder()
        .localTable("child")
        .foreignTable(foreignTable)
        .columnMapping(mapping)
        .build();
  }

  private Set<Row> drawAll(final FkResolution resolution, final int draws) {
    final Set<Row> seen = new HashSet<>();
    for (int i = 0; i < draws; i++) {
      seen.add(resolution.strategy().sample(ctx));
    }
    return seen;
  }

  private void commitOverlappingParents() {
    store.commit("parent1", List.of(row("x", 1, "y", 10), row("x", 2, "y", 10), row("x", 3, "y", 20)));
    store.commit(
        "parent2",
        List.of(
            row("y", 10, "z", 100),
            row("y", 10, "z", 101),
            row("y", 20, "z", 200),
            row("y", 30, "z", 300)));
  }

  @Test
  void noConstraints_yieldsEmptyAssignment() {
    final FkResolution resolution = new ForeignKeyResolver(store).resolve(List.of());

    assertThat(resolution.satisfiable()).isTrue();
    assertThat(resolution.constrainedColumns()).isEmpty();
    assertThat(resolution.strategy().sample(ctx)).isEqualTo(Row.empty());
  }

  @Test
  void singleConstraint_projectsAndRenamesParentRows() {
    store.commit("parent", List.of(row("id", 1, "name", "a"), row("id", 2, "name", "b")));

    final FkResolution resolution =
        new ForeignKeyResolver(store).resolve(List.of(fk("parent", "parent_id", "id")));

    assertThat(resolution.constrainedColumns()).containsExactly("parent_id");
    assertThat(resolution.candidateCount()).isEqualTo(2);
    assertThat(drawAll(resolution, 100)).containsExactlyInAnyOrder(row("parent_id", 1), row("parent_id", 2));
  }

  @Test
  void parentRowsWithNullReferents_areDiscarded() {
    store.commit("parent", List.of(row("id", null), row("id", 7)));

    final FkResolution resolution =
        new ForeignKeyResolver(store).resolve(List.of(fk("parent", "parent_id", "id")));

    assertThat(resolution.candidateCount()).isEqualTo(1);
    assertThat(drawAll(resolution, 20)).containsExactly(row("parent_id", 7));
  }

  @Test
  void emptyParent_makesEveryConstrainedColumnUnsatisfiable() {
    store.commit("full", List.of(row("id", 1)));
    store.commit("empty", List.of());

    final FkResolution resolution =
        new ForeignKeyResolver(store)
            .resolve(List.of(fk("full", "a", "id"), fk("empty", "b", "id")));

    assertThat(resolution.satisfiable()).isFalse();
    assertThat(resolution.constrainedColumns()).containsExactlyInAnyOrder("a", "b");
  }

  @Test
  void uncommittedParent_isUnsatisfiable() {
    final FkResolution resolution =
        new ForeignKeyResolver(store).resolve(List.of(fk("missing", "a", "id")));
    assertThat(resolution.satisfiable()).isFalse();
  }

  @Test
  void overlappingConstraints_innerJoinOnSharedColumns() {
    commitOverlappingParents();

    final FkResolution resolution =
        new ForeignKeyResolver(store)
            .resolve(List.of(fk("parent1", "a", "x", "b", "y"), fk("parent2", "b", "y", "c", "z")));

    assertThat(resolution.constrainedColumns()).containsExactlyInAnyOrder("a", "b", "c");
    assertThat(resolution.candidateCount()).isEqualTo(5);
    assertThat(resolution.truncated()).isFalse();
    assertThat(drawAll(resolution, 500))
        .containsExactlyInAnyOrder(
            row("a", 1, "b", 10, "c", 100),
            row("a", 1, "b", 10, "c", 101),
            row("a", 2, "b", 10, "c", 100),
            row("a", 2, "b", 10, "c", 101),
            row("a", 3, "b", 20, "c", 200));
  }

  @Test
  void disjointConstraints_crossJoin() {
    store.commit("left", List.of(row("id", 1), row("id", 2), row("id", 3)));
    store.commit("right", List.of(row("id", "x"), row("id", "y")));

    final FkResolution resolution =
        new ForeignKeyResolver(store).resolve(List.of(fk("left", "l", "id"), fk("right", "r", "id")));

    assertThat(resolution.candidateCount()).isEqualTo(6);
  }

  @Test
  void joinWithoutMatches_isUnsatisfiable() {
    store.commit("p1", List.of(row("k", 1)));
    store.commit("p2", List.of(row("k", 2)));

    final FkResolution resolution =
        new ForeignKeyResolver(store).resolve(List.of(fk("p1", "k", "k"), fk("p2", "k", "k")));

    assertThat(resolution.satisfiable()).isFalse();
    assertThat(resolution.constrainedColumns()).containsExactly("k");
  }

  @Test
  void valuesJoinOnlyWhenTypesMatch() {
    store.commit("p1", List.of(row("k", 1)));
    store.commit("p2", List.of(row("k", 1L)));

    final FkResolution resolution =
        new ForeignKeyResolver(store).resolve(List.of(fk("p1", "k", "k"), fk("p2", "k", "k")));

    assertThat(resolution.satisfiable()).isFalse();
  }

  @Test
  void candidatesBeyondCap_areTruncated() {
    commitOverlappingParents();

    final FkResolution resolution =
        new ForeignKeyResolver(store, 3)
            .resolve(List.of(fk("parent1", "a", "x", "b", "y"), fk("parent2", "b", "y", "c", "z")));

    assertThat(resolution.truncated()).isTrue();
    assertThat(resolution.candidateCount()).isEqualTo(3);
    assertThat(drawAll(resolution, 200)).hasSize(3);
  }

  @Test
  void candidatesExactlyAtCap_areNotTruncated() {
    final List<Row> parents = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      parents.add(row("id", i));
    }
    store.commit("parent", parents);

    final FkResolution resolution =
        new ForeignKeyResolver(store, 4).resolve(List.of(fk("parent", "parent_id", "id")));

    assertThat(resolution.truncated()).isFalse();
    assertThat(resolution.candidateCount()).isEqualTo(4);
  }

  @Test
  void nonPositiveCap_rejected() {
    assertThatIllegalArgumentException().isThrownBy(() -> new ForeignKeyResolver(store, 0));
  }
}
