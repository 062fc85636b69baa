package org.releven.query.render;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.releven.query.build.CountSubquery;
import org.releven.query.build.CountSubquerySynthesizer;
import org.releven.query.build.PatternBuild;
import org.releven.query.build.PatternBuilder;
import org.releven.query.model.PathClassification;
import org.releven.query.model.QueryOptions;
import org.releven.query.model.SelectedEdge;
import org.releven.query.model.SelectionGraph;
import org.releven.query.plan.CountSubgraphPlanner;
import org.releven.query.plan.CountSubgraphs;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.releven.query.SelectionFixtures.CRM;
import static org.releven.query.SelectionFixtures.EX;
import static org.releven.query.SelectionFixtures.element;
import static org.releven.query.SelectionFixtures.field;
import static org.releven.query.SelectionFixtures.node;

/**
 * Unit tests for QueryRenderer.
 */
public class QueryRendererTest {

    private static final SelectionGraph MEMBERS = new SelectionGraph(
        List.of(node(field("r", EX + "R")),
            node(element("m", true, PathClassification.GROUP, EX + "R",
                EX + "has", EX + "M"))),
        List.of(SelectedEdge.of("r", "m")), "r");

    private static final SelectionGraph EMPTY =
        new SelectionGraph(List.of(), List.of(), null);

    private static PatternBuild outer() {
        return PatternBuilder.build(MEMBERS.subgraph(Set.of("r"), "r"),
            false);
    }

    private static CountSubquery memberCount(final boolean includeZero) {
        CountSubgraphs counts = CountSubgraphPlanner.plan(MEMBERS,
            List.of("m"));
        SelectionGraph outerGraph = MEMBERS.subgraph(Set.of("r"), "r");
        return CountSubquerySynthesizer.synthesize(MEMBERS, counts,
            outerGraph, outer(), false, includeZero).get(0);
    }

    @Test
    @DisplayName("Empty build selects * from an empty pattern")
    public void testEmptyQuery() {
        String text = QueryRenderer.render(PatternBuilder.build(EMPTY, false),
            List.of(), QueryOptions.defaults());

        assertEquals("\nSELECT DISTINCT\n  *\nWHERE {\n}", text);
    }

    @Test
    @DisplayName("ORDER BY and LIMIT follow the closing brace")
    public void testOrderByAndLimit() {
        QueryOptions options = QueryOptions.builder()
            .orderBy("x", QueryOptions.OrderDirection.ASC)
            .limit(5)
            .build();

        String text = QueryRenderer.render(PatternBuilder.build(EMPTY, false),
            List.of(), options);

        assertTrue(text.endsWith("}\nORDER BY ASC(?x)\nLIMIT 5"));
    }

    @Test
    @DisplayName("Only namespaces used by printed triples are declared")
    public void testUsedPrefixesOnly() {
        PatternBuild build = PatternBuilder.build(new SelectionGraph(
            List.of(node(field("p", CRM + "E21_Person")),
                node(field("q", EX + "Q"))),
            List.of(), "p"), false);

        String text = QueryRenderer.render(build, List.of(),
            QueryOptions.defaults());

        assertTrue(text.startsWith(
            "PREFIX crm: <http://www.cidoc-crm.org/cidoc-crm/>\n\n"));
        assertFalse(text.contains("PREFIX lrmoo:"));
        assertFalse(text.contains("PREFIX rdf"));
    }

    @Test
    @DisplayName("Count sub-query is appended to the WHERE body")
    public void testGroupedCountQuery() {
        String text = QueryRenderer.render(outer(),
            List.of(memberCount(false)), QueryOptions.defaults());

        assertEquals(String.join("\n",
            "",
            "SELECT DISTINCT",
            "  ?r_root  # <<<<< central node",
            "    ?m_node_count_raw",
            "WHERE {",
            "",
            "# >>>> Central node: r <<<<",
            "  ?r_root a <http://example.org/R> .",
            "",
            "  # r > m",
            "  {",
            "    SELECT ?r_root (COUNT(DISTINCT ?m_node) AS ?m_node_count_raw)",
            "    WHERE {",
            "        ?r_root <http://example.org/has> ?m_node .",
            "        ?m_node a <http://example.org/M> .",
            "    }",
            "    GROUP BY ?r_root",
            "  }",
            "}"), text);
    }

    @Test
    @DisplayName("Zero-count block is optional and projects a coalesced alias")
    public void testZeroCountBlock() {
        CountSubquery count = memberCount(true);

        List<String> block = QueryRenderer.countBlock(count,
            List.of("  ?a <http://example.org/p> ?b .", ""));

        assertEquals(List.of(
            "  # r > m",
            "  OPTIONAL {",
            "    {",
            "    SELECT ?r_root (COUNT(DISTINCT ?m_node) AS ?m_node_count_raw)",
            "      WHERE {",
            "        ?a <http://example.org/p> ?b .",
            "",
            "      }",
            "      GROUP BY ?r_root",
            "    }",
            "  }"), block);
        assertTrue(QueryRenderer.render(outer(), List.of(count),
            QueryOptions.defaults()).contains(
                "    (COALESCE(?m_node_count_raw, 0) AS ?m_node_count)"));
    }

    @Test
    @DisplayName("Count projections follow the outer projections")
    public void testProjectionOrder() {
        CountSubquery count = memberCount(false);

        assertEquals(List.of("r_root", "m_node_count_raw"),
            QueryRenderer.projections(outer(), List.of(count)).stream()
                .map(projection -> projection.variableName()).toList());
    }
}
