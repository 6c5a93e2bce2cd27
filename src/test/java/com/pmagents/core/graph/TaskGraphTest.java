package com.pmagents.core.graph;

import com.pmagents.core.model.Task;
import com.pmagents.core.model.TaskPriority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskGraphTest {

    private final TaskGraph graph = TaskGraph.of(List.of(
            Task.of("A", "code-generator", Set.of()),
            Task.of("B", "doc-generator", Set.of()),
            new Task("C", "merge", "code-generator", Set.of("A", "B"), TaskPriority.HIGH, 3.0, List.of(), List.of()),
            Task.of("D", "lint", Set.of("C"))));

    @Test
    @DisplayName("every task's level exceeds its dependencies' levels")
    void levelInvariant() {
        for (var task : graph.tasks()) {
            for (var dep : task.dependencies()) {
                assertTrue(graph.levelOf(task.id()) > graph.levelOf(dep), task.id() + " vs " + dep);
            }
        }
        assertEquals(3, graph.levels().size());
    }

    @Test
    @DisplayName("dependents are indexed directly and transitively")
    void dependents() {
        assertEquals(List.of("C"), graph.dependentsOf("A"));
        assertEquals(Set.of("C", "D"), graph.transitiveDependents("B"));
        assertTrue(graph.dependentsOf("D").isEmpty());
    }

    @Test
    @DisplayName("aggregates cost and capabilities")
    void aggregates() {
        assertEquals(6.0, graph.totalEstimatedCost());
        assertEquals(Set.of("code-generator", "doc-generator", "lint"), graph.capabilities());
        assertEquals(4, graph.size());
    }

    @Test
    @DisplayName("unknown ids are rejected")
    void unknownIdLookup() {
        assertThrows(IllegalArgumentException.class, () -> graph.task("nope"));
        assertThrows(IllegalArgumentException.class, () -> graph.levelOf("nope"));
    }

    @Test
    @DisplayName("task without capability cannot be built")
    void blankCapability() {
        assertThrows(IllegalArgumentException.class, () -> Task.of("A", " ", Set.of()));
    }
}
