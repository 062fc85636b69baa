package org.releven.query.plan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.releven.query.model.SelectedEdge;
import org.releven.query.model.SelectionGraph;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.releven.query.SelectionFixtures.EX;
import static org.releven.query.SelectionFixtures.field;
import static org.releven.query.SelectionFixtures.node;

/**
 * Unit tests for CountSubgraphPlanner.
 */
public class CountSubgraphPlannerTest {

    private static SelectionGraph graph() {
        return new SelectionGraph(
            List.of(node(field("r", EX + "R")), node(field("m", EX + "M")),
                node(field("x", EX + "X")), node(field("n", EX + "N")),
                node(field("z", EX + "Z"))),
            List.of(SelectedEdge.of("r", "m"), SelectedEdge.of("m", "x"),
                SelectedEdge.of("r", "n")),
            "r");
    }

    @Test
    @DisplayName("Closure holds the count node and what hangs off it")
    public void testClosure() {
        CountSubgraphs counts = CountSubgraphPlanner.plan(graph(),
            List.of("m"));

        assertEquals(Set.of("m", "x"), counts.closures().get("m"));
        assertEquals(Set.of("m", "x"), counts.excludedFromOuter());
        assertEquals("r", counts.boundaryParentOf("m").orElseThrow());
    }

    @Test
    @DisplayName("Closures keep count declaration order")
    public void testDeclarationOrder() {
        CountSubgraphs counts = CountSubgraphPlanner.plan(graph(),
            List.of("n", "m"));

        assertEquals(List.of("n", "m"),
            List.copyOf(counts.closures().keySet()));
        assertEquals(Set.of("n"), counts.closures().get("n"));
    }

    @Test
    @DisplayName("Unselected and unreachable count nodes are ignored")
    public void testIgnoredCountNodes() {
        CountSubgraphs counts = CountSubgraphPlanner.plan(graph(),
            List.of("unknown", "z"));

        assertTrue(counts.isEmpty());
        assertTrue(counts.excludedFromOuter().isEmpty());
    }

    @Test
    @DisplayName("No count nodes means nothing to split off")
    public void testNoCounts() {
        assertTrue(CountSubgraphPlanner.plan(graph(), List.of()).isEmpty());
    }
}
