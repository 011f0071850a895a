package com.worldmaker.core.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EdgeStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private EdgeStore store;

    @BeforeEach
    void setUp() {
        store = new EdgeStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Omitted types and severity fall back to defaults")
    void addEdge_appliesDefaults() {
        var edge = store.addEdge("orders", null, "payments", " ", null, null);

        assertThat(edge.sourceType()).isEqualTo("service");
        assertThat(edge.targetType()).isEqualTo("service");
        assertThat(edge.dependencyType()).isEqualTo("runtime");
        assertThat(edge.severity()).isEqualTo(Severity.MEDIUM);
        assertThat(edge.circular()).isFalse();
        assertThat(edge.createdAt()).isEqualTo(NOW);
        assertThat(edge.id()).isNotBlank();
    }

    @Test
    @DisplayName("Blank ids are rejected")
    void addEdge_blankIds_throw() {
        assertThatThrownBy(() -> store.addEdge("", null, "b", null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sourceId");
        assertThatThrownBy(() -> store.addEdge("a", null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("targetId");
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Only the edge closing a cycle is flagged circular")
    void addEdge_closingEdgeFlagged() {
        var ab = store.addEdge("a", null, "b", null, null, null);
        var bc = store.addEdge("b", null, "c", null, null, null);
        var ca = store.addEdge("c", null, "a", null, null, null);

        assertThat(ab.circular()).isFalse();
        assertThat(bc.circular()).isFalse();
        assertThat(ca.circular()).isTrue();
        assertThat(store.allEdges())
                .filteredOn(DependencyEdge::circular)
                .containsExactly(ca);
    }

    @Test
    @DisplayName("A self-dependency is circular")
    void addEdge_selfLoopIsCircular() {
        assertThat(store.addEdge("a", null, "a", null, null, null).circular()).isTrue();
    }

    @Test
    @DisplayName("Cycles longer than the search bound go unflagged")
    void addEdge_cycleBeyondSearchDepth_notFlagged() {
        chain("n", 22);
        assertThat(store.addEdge("n22", null, "n0", null, null, null).circular()).isFalse();

        store.clear();
        chain("m", 21);
        assertThat(store.addEdge("m21", null, "m0", null, null, null).circular()).isTrue();
    }

    @Test
    @DisplayName("Adjacency lookups keep insertion order and tolerate unknown ids")
    void lookups_insertionOrdered() {
        var first = store.addEdge("api", null, "users", null, null, Severity.HIGH);
        var second = store.addEdge("api", null, "orders", null, null, Severity.LOW);
        var third = store.addEdge("web", null, "users", null, null, null);

        assertThat(store.getDependenciesOf("api")).containsExactly(first, second);
        assertThat(store.getDependentsOf("users")).containsExactly(first, third);
        assertThat(store.getDependenciesOf("unknown")).isEmpty();
        assertThat(store.getDependentsOf("unknown")).isEmpty();
        assertThat(store.findById(second.id())).contains(second);
        assertThat(store.entityIds()).containsExactlyInAnyOrder("api", "users", "orders", "web");
    }

    @Test
    @DisplayName("Parallel edges are kept")
    void addEdge_duplicatesKept() {
        store.addEdge("a", null, "b", null, "runtime", null);
        store.addEdge("a", null, "b", null, "build", null);

        assertThat(store.getDependenciesOf("a")).hasSize(2);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Clear drops every edge and index")
    void clear_resetsStore() {
        store.addEdge("a", null, "b", null, null, null);
        store.clear();

        assertThat(store.size()).isZero();
        assertThat(store.getDependenciesOf("a")).isEmpty();
        assertThat(store.getDependentsOf("b")).isEmpty();
        assertThat(store.addEdge("b", null, "a", null, null, null).circular()).isFalse();
    }

    private void chain(String prefix, int length) {
        for (int i = 0; i < length; i++) {
            store.addEdge(prefix + i, null, prefix + (i + 1), null, null, null);
        }
    }
}
