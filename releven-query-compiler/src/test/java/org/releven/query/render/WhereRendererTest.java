package org.releven.query.render;

import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.vocabulary.RDF;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.releven.query.build.PatternBuild;
import org.releven.query.build.PatternBuilder;
import org.releven.query.model.NamespaceTable;
import org.releven.query.model.PathClassification;
import org.releven.query.model.SelectedEdge;
import org.releven.query.model.SelectionGraph;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.releven.query.SelectionFixtures.CRM;
import static org.releven.query.SelectionFixtures.EX;
import static org.releven.query.SelectionFixtures.element;
import static org.releven.query.SelectionFixtures.field;
import static org.releven.query.SelectionFixtures.node;

/**
 * Unit tests for WhereRenderer.
 */
public class WhereRendererTest {

    private static final NamespaceTable NAMESPACES = NamespaceTable.defaults();

    private static PatternBuild personBuild() {
        return PatternBuilder.build(new SelectionGraph(
            List.of(node(field("r", CRM + "E21_Person")),
                node(element("m", true, PathClassification.GROUP,
                    CRM + "E21_Person",
                    CRM + "P107i_is_current_or_former_member_of",
                    CRM + "E74_Group")),
                node(field("n", CRM + "E21_Person",
                    CRM + "P1_is_identified_by", CRM + "E41_Appellation"))),
            List.of(SelectedEdge.of("r", "m"), SelectedEdge.of("r", "n")),
            "r"), false);
    }

    @Test
    @DisplayName("Shared triples are printed once at their first emission")
    public void testSharedPrefixRendering() {
        PatternBuild build = PatternBuilder.build(new SelectionGraph(
            List.of(node(field("a", EX + "X", EX + "y", EX + "Z")),
                node(field("b", EX + "X", EX + "y", EX + "Z", EX + "q",
                    EX + "W"))),
            List.of(SelectedEdge.of("a", "b")), "a"), false);

        WhereRenderer.RenderedWhere where = WhereRenderer.render(build,
            NAMESPACES);

        assertEquals(List.of(
            "",
            "# >>>> Central node: a <<<<",
            "  ?a_root a <http://example.org/X> .",
            "  ?a_root <http://example.org/y> ?a_node .",
            "  ?a_node a <http://example.org/Z> .",
            "",
            "    # a > b",
            "    ?a_node <http://example.org/q> ?b_node .",
            "    ?b_node a <http://example.org/W> ."), where.lines());
        assertTrue(where.usedPrefixes().isEmpty());
    }

    @Test
    @DisplayName("Multiple nodes open an OPTIONAL that closes for siblings")
    public void testOptionalScope() {
        WhereRenderer.RenderedWhere where = WhereRenderer.render(
            personBuild(), NAMESPACES);
        List<String> lines = where.lines();

        int open = lines.indexOf("    OPTIONAL {");
        int member = lines.indexOf(
            "    ?r_root crm:P107i_is_current_or_former_member_of ?m_node .");
        int close = lines.indexOf("    }");
        int name = lines.indexOf(
            "    ?r_root crm:P1_is_identified_by ?n_node .");

        assertTrue(open >= 0);
        assertTrue(open < member);
        assertTrue(member < close);
        assertTrue(close < name);
        assertEquals(1, lines.stream()
            .filter(line -> line.endsWith("OPTIONAL {")).count());
        assertEquals(Set.of("crm"), where.usedPrefixes());
    }

    @Test
    @DisplayName("Central marker closes open scopes and prints at column 0")
    public void testCentralMarkerClosesScopes() {
        PatternBuild build = PatternBuilder.build(new SelectionGraph(
            List.of(node(element("a", true, PathClassification.GROUP,
                    EX + "A")),
                node(field("b", EX + "A", EX + "p", EX + "B"))),
            List.of(SelectedEdge.of("a", "b")), "b"), false);

        WhereRenderer.RenderedWhere where = WhereRenderer.render(build,
            NAMESPACES);

        assertEquals(List.of(
            "  OPTIONAL {",
            "  ?a_root a <http://example.org/A> .",
            "",
            "    # a > b",
            "  }",
            "",
            "# >>>> Central node: b <<<<",
            "    ?a_root <http://example.org/p> ?b_node .",
            "    ?b_node a <http://example.org/B> ."), where.lines());
    }

    @Test
    @DisplayName("Excluded triples, suppressed comments and the marker are left out")
    public void testExclusions() {
        Triple rootType = Triple.create(Var.alloc("r_root"),
            RDF.type.asNode(), NodeFactory.createURI(CRM + "E21_Person"));

        WhereRenderer.RenderedWhere where = WhereRenderer.render(
            personBuild(), NAMESPACES, Set.of(rootType), false,
            Set.of("# r > m"));

        assertFalse(where.lines().contains("# >>>> Central node: r <<<<"));
        assertFalse(where.lines().contains("    # r > m"));
        assertFalse(where.lines().contains("  ?r_root a crm:E21_Person ."));
        assertTrue(where.lines().contains("    # r > n"));
    }

    @Test
    @DisplayName("Triples render compacted terms and a terminating dot")
    public void testRenderTriple() {
        Triple triple = Triple.create(Var.alloc("s"),
            NodeFactory.createURI(CRM + "P1_is_identified_by"),
            NodeFactory.createURI(EX + "o"));

        assertEquals("?s crm:P1_is_identified_by <http://example.org/o> .",
            WhereRenderer.renderTriple(triple, NAMESPACES));
    }
}
