package org.releven.query;

import org.apache.jena.query.QueryBuildException;
import org.apache.jena.query.QueryParseException;
import org.apache.jena.sparql.core.Var;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.releven.query.SelectionQueryCompiler.CompiledQuery;
import org.releven.query.SelectionQueryCompiler.QueryValidationException;
import org.releven.query.model.PathClassification;
import org.releven.query.model.PathElement;
import org.releven.query.model.QueryOptions;
import org.releven.query.model.SelectedEdge;
import org.releven.query.model.SelectedNode;
import org.releven.query.model.SelectionGraph;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.releven.query.SelectionFixtures.CRM;
import static org.releven.query.SelectionFixtures.EX;
import static org.releven.query.SelectionFixtures.element;
import static org.releven.query.SelectionFixtures.field;
import static org.releven.query.SelectionFixtures.node;

/**
 * Tests for SelectionQueryCompiler, checking the generated text and that
 * Jena accepts it.
 */
public class SelectionQueryCompilerTest {

    private static final String SHARED_LINE =
        "?a_root <http://example.org/y> ?a_node .";

    private static SelectionGraph sharedPrefixGraph() {
        return new SelectionGraph(
            List.of(node(field("a", EX + "X", EX + "y", EX + "Z")),
                node(field("b", EX + "X", EX + "y", EX + "Z", EX + "q",
                    EX + "W"))),
            List.of(SelectedEdge.of("a", "b")),
            "a");
    }

    private static SelectionGraph membershipGraph() {
        return new SelectionGraph(
            List.of(node(element("person", false, PathClassification.ROOT,
                    CRM + "E21_Person")),
                node(element("membership", true, PathClassification.GROUP,
                    CRM + "E21_Person",
                    "^" + CRM + "P107_has_current_or_former_member",
                    CRM + "E74_Group")),
                node(field("group_name", CRM + "E21_Person",
                    "^" + CRM + "P107_has_current_or_former_member",
                    CRM + "E74_Group", CRM + "P1_is_identified_by",
                    CRM + "E41_Appellation"))),
            List.of(SelectedEdge.of("person", "membership"),
                SelectedEdge.of("membership", "group_name")),
            "person");
    }

    private static SelectionGraph twoMembershipsGraph() {
        return new SelectionGraph(
            List.of(node(element("person", false, PathClassification.ROOT,
                    CRM + "E21_Person")),
                node("m1", membership()), node("m2", membership())),
            List.of(SelectedEdge.of("person", "m1"),
                SelectedEdge.of("person", "m2")),
            "person");
    }

    private static PathElement membership() {
        return element("membership", true, PathClassification.GROUP,
            CRM + "E21_Person", "^" + CRM + "P107_has_current_or_former_member",
            CRM + "E74_Group");
    }

    private static int occurrences(final String text, final String part) {
        int count = 0;
        int index = text.indexOf(part);
        while (index >= 0) {
            count++;
            index = text.indexOf(part, index + part.length());
        }
        return count;
    }

    private static List<String> projectedByJena(final CompiledQuery compiled) {
        return compiled.query().getProjectVars().stream()
            .map(Var::getVarName).toList();
    }

    @Test
    @DisplayName("Shared path prefix renders once and both nodes are projected")
    public void testSharedPrefix() {
        CompiledQuery compiled = SelectionQueryCompiler.compile(
            sharedPrefixGraph());

        assertEquals(1, occurrences(compiled.text(), SHARED_LINE));
        assertEquals(List.of("a_node", "b_node"),
            compiled.projectedVariables());
        assertEquals(List.of("a_node", "b_node"), projectedByJena(compiled));
        assertTrue(compiled.query().isSelectType());
        assertTrue(compiled.query().isDistinct());
    }

    @Test
    @DisplayName("Header describes the selection")
    public void testHeader() {
        String text = SelectionQueryCompiler.compile(sharedPrefixGraph())
            .text();

        assertTrue(text.startsWith(String.join("\n",
            "# Auto-generated from the selected graph nodes",
            "# Central display node: a",
            "# Selected graph nodes: 2",
            "# Shared path prefixes are deduplicated in WHERE patterns.",
            "")));
    }

    @Test
    @DisplayName("Empty selection compiles to SELECT *")
    public void testEmptySelection() {
        CompiledQuery compiled = SelectionQueryCompiler.compile(
            new SelectionGraph(List.of(), List.of(), null));

        assertTrue(compiled.text().contains("# Central display node: (none)"));
        assertTrue(compiled.text().contains("# No selected graph nodes found"));
        assertTrue(compiled.query().isQueryResultStar());
        assertTrue(compiled.projectedVariables().isEmpty());
    }

    @Test
    @DisplayName("Full-prefix mode keeps a separate chain per node")
    public void testFullPrefixMode() {
        QueryOptions options = QueryOptions.builder()
            .includeFullPrefixConstraints(true)
            .build();

        CompiledQuery compiled = SelectionQueryCompiler.compile(
            sharedPrefixGraph(), options);

        assertTrue(compiled.text().contains(
            "# Full path prefix constraints are included per selected node."));
        assertEquals(1, occurrences(compiled.text(), SHARED_LINE));
        assertEquals(1, occurrences(compiled.text(),
            "?b_root <http://example.org/y> ?b_step_1 ."));
    }

    @Test
    @DisplayName("Full-prefix mode only applies when the central node is not a root model")
    public void testFullPrefixModeEffective() {
        QueryOptions requested = QueryOptions.builder()
            .includeFullPrefixConstraints(true)
            .build();

        assertTrue(SelectionQueryCompiler.isFullPrefixMode(
            sharedPrefixGraph(), requested));
        assertFalse(SelectionQueryCompiler.isFullPrefixMode(
            membershipGraph(), requested));
        assertFalse(SelectionQueryCompiler.isFullPrefixMode(
            sharedPrefixGraph(), QueryOptions.defaults()));
        assertFalse(SelectionQueryCompiler.isFullPrefixMode(
            new SelectionGraph(List.of(), List.of(), null), requested));
    }

    @Test
    @DisplayName("Multiple branch renders inside exactly one OPTIONAL")
    public void testOptionalNesting() {
        CompiledQuery compiled = SelectionQueryCompiler.compile(
            membershipGraph());

        assertEquals(1, occurrences(compiled.text(), "OPTIONAL {"));
        String text = compiled.text();
        int open = text.indexOf("OPTIONAL {");
        int member = text.indexOf(
            "?membership_node crm:P107_has_current_or_former_member ?person_root .");
        int name = text.indexOf(
            "?membership_node crm:P1_is_identified_by ?group_name_node .");
        assertTrue(open < member);
        assertTrue(member < name);
    }

    @Test
    @DisplayName("Count without zero results projects the raw count")
    public void testCountWithoutZeroResults() {
        QueryOptions options = QueryOptions.builder()
            .countNodes("membership")
            .build();

        CompiledQuery compiled = SelectionQueryCompiler.compile(
            membershipGraph(), options);

        assertFalse(compiled.text().contains("OPTIONAL"));
        assertFalse(compiled.text().contains("COALESCE"));
        assertTrue(compiled.text().contains(
            "SELECT ?person_root (COUNT(DISTINCT ?membership_node) AS "
                + "?membership_node_count_raw)"));
        assertEquals(List.of("person_root", "membership_node_count_raw"),
            projectedByJena(compiled));
    }

    @Test
    @DisplayName("Count with zero results is optional and coalesced")
    public void testCountWithZeroResults() {
        QueryOptions options = QueryOptions.builder()
            .countNodes("membership")
            .includeZeroCountResults(true)
            .orderBy("membership_node_count", QueryOptions.OrderDirection.DESC)
            .limit(25)
            .build();

        CompiledQuery compiled = SelectionQueryCompiler.compile(
            membershipGraph(), options);

        assertEquals(1, occurrences(compiled.text(), "OPTIONAL {"));
        assertTrue(compiled.text().contains(
            "(COALESCE(?membership_node_count_raw, 0) AS "
                + "?membership_node_count)"));
        assertEquals(List.of("person_root", "membership_node_count"),
            compiled.projectedVariables());
        assertEquals(25L, compiled.query().getLimit());
        assertTrue(compiled.query().hasOrderBy());
        // the counted branch does not render in the outer pattern
        assertEquals(1, occurrences(compiled.text(),
            "crm:P1_is_identified_by"));
    }

    @Test
    @DisplayName("Raw counts over two instances of one path stay separate")
    public void testInstanceCountsWithoutZeroResults() {
        QueryOptions options = QueryOptions.builder()
            .countNodes("m1", "m2")
            .build();

        CompiledQuery compiled = SelectionQueryCompiler.compile(
            twoMembershipsGraph(), options);

        List<String> expected = List.of("person_root",
            "membership_node_count_raw", "membership_node_count_2_raw");
        assertEquals(expected, compiled.projectedVariables());
        assertEquals(expected, projectedByJena(compiled));
        assertEquals(1, occurrences(compiled.text(),
            "AS ?membership_node_count_raw)"));
        assertEquals(1, occurrences(compiled.text(),
            "AS ?membership_node_count_2_raw)"));
    }

    @Test
    @DisplayName("Coalesced counts over two instances of one path compile")
    public void testInstanceCountsWithZeroResults() {
        QueryOptions options = QueryOptions.builder()
            .countNodes("m1", "m2")
            .includeZeroCountResults(true)
            .build();

        CompiledQuery compiled = SelectionQueryCompiler.compile(
            twoMembershipsGraph(), options);

        assertEquals(List.of("person_root", "membership_node_count",
            "membership_node_count_2"), projectedByJena(compiled));
        assertEquals(2, occurrences(compiled.text(), "OPTIONAL {"));
    }

    @Test
    @DisplayName("Duplicate requests for one triple render one line")
    public void testDedupIdempotence() {
        SelectedNode first = node("a1", field("a", EX + "X", EX + "y",
            EX + "Z"));
        SelectedNode second = node("a2", field("a", EX + "X", EX + "y",
            EX + "Z"));
        SelectionGraph graph = new SelectionGraph(List.of(first, second,
                node(field("c", EX + "X", EX + "y", EX + "Z", EX + "q",
                    EX + "W"))),
            List.of(SelectedEdge.of("a1", "c"), SelectedEdge.of("a2", "c")),
            "a1");

        CompiledQuery compiled = SelectionQueryCompiler.compile(graph);

        assertEquals(1, occurrences(compiled.text(), SHARED_LINE));
        assertEquals(List.of("a_node", "c_node"),
            compiled.projectedVariables());
    }

    @Test
    @DisplayName("Central marker appears once whatever the degree")
    public void testCentralMarkerUnique() {
        SelectionGraph graph = new SelectionGraph(
            List.of(node(field("p", EX + "P")),
                node(field("a", EX + "P", EX + "to", EX + "A")),
                node(field("b", EX + "P", EX + "to", EX + "A", EX + "of",
                    EX + "B")),
                node(field("c", EX + "P", EX + "to", EX + "A", EX + "by",
                    EX + "C"))),
            List.of(SelectedEdge.of("p", "a"), SelectedEdge.of("a", "b"),
                SelectedEdge.of("a", "c")),
            "a");

        String text = SelectionQueryCompiler.compile(graph).text();

        assertEquals(1, occurrences(text, "# >>>> Central node:"));
        assertEquals(1, occurrences(text, "# <<<<< central node"));
    }

    @Test
    @DisplayName("Disconnected selections compile to juxtaposed patterns")
    public void testDisconnectedSelection() {
        SelectionGraph graph = new SelectionGraph(
            List.of(node(field("a", EX + "A")), node(field("b", EX + "B"))),
            List.of(), "a");

        CompiledQuery compiled = SelectionQueryCompiler.compile(graph);

        assertEquals(List.of("a_root", "b_root"),
            compiled.projectedVariables());
    }

    @Test
    @DisplayName("Unparseable output fails with the rejected text")
    public void testValidationFailure() {
        SelectionGraph graph = new SelectionGraph(
            List.of(node(field("x", EX + "bad iri"))), List.of(), "x");

        QueryValidationException e = assertThrows(
            QueryValidationException.class,
            () -> SelectionQueryCompiler.compile(graph));

        assertTrue(e.getQueryText().contains("<http://example.org/bad iri>"));
        assertInstanceOf(QueryParseException.class, e.getCause());
    }

    @Test
    @DisplayName("Text Jena parses but rejects fails validation too")
    public void testValidationFailureOnRejectedStructure() {
        String text = "SELECT (1 AS ?x) (2 AS ?x) WHERE { }";

        QueryValidationException e = assertThrows(
            QueryValidationException.class,
            () -> SelectionQueryCompiler.validate(text));

        assertEquals(text, e.getQueryText());
        assertInstanceOf(QueryBuildException.class, e.getCause());
    }
}
