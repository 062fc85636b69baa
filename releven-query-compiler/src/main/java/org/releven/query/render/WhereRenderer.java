package org.releven.query.render;

import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.sys.JenaSystem;
import org.apache.jena.vocabulary.RDF;
import org.releven.query.build.EmissionComment;
import org.releven.query.build.PatternBuild;
import org.releven.query.build.TripleEmission;
import org.releven.query.model.NamespaceTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders the emission log of a {@link PatternBuild} into WHERE body lines.
 *
 * <p>Emissions are scanned in order while a stack of open OPTIONAL scopes
 * is kept. Before a triple is printed the stack is reduced to its longest
 * common prefix with the owner's optional chain and the remaining chain
 * entries are opened. A key that was already printed, or is excluded,
 * only drives comments; the line itself is not repeated. Every triple line
 * is indented by {@code depth + 1} levels.</p>
 */
public final class WhereRenderer {

    static {
        // initialise Jena before any vocabulary class loads
        JenaSystem.init();
    }

    /** One indentation level. */
    static final String INDENT = "  ";

    private WhereRenderer() {
        throw new AssertionError("No instances");
    }

    /**
     * Rendered WHERE body.
     *
     * @param lines the body lines, without the enclosing braces
     * @param usedPrefixes prefixes referenced by the printed triples
     */
    public record RenderedWhere(List<String> lines, Set<String> usedPrefixes) {

        /**
         * Whether no line was produced.
         *
         * @return true if empty
         */
        public boolean isEmpty() {
            return lines.isEmpty();
        }
    }

    /** An open OPTIONAL scope. */
    private record OpenScope(String rootDisplayId, int depth) {
    }

    /**
     * Render a build with every triple and the central marker.
     *
     * @param build the build
     * @param namespaces the namespace table
     * @return the rendered body
     */
    public static RenderedWhere render(final PatternBuild build,
            final NamespaceTable namespaces) {
        return render(build, namespaces, Set.of(), true, Set.of());
    }

    /**
     * Render a build.
     *
     * @param build the build
     * @param namespaces the namespace table
     * @param excludedKeys triples not to print
     * @param includeCentralMarker whether to print the central marker
     * @param suppressedComments comment lines not to print
     * @return the rendered body
     */
    public static RenderedWhere render(final PatternBuild build,
            final NamespaceTable namespaces, final Set<Triple> excludedKeys,
            final boolean includeCentralMarker,
            final Set<String> suppressedComments) {
        List<String> lines = new ArrayList<>();
        Deque<OpenScope> open = new ArrayDeque<>();
        Set<Triple> printed = new HashSet<>();
        Set<String> usedPrefixes = new LinkedHashSet<>();

        for (TripleEmission emission : build.emissions()) {
            if (!build.records().containsKey(emission.key())) {
                continue;
            }
            String indent = INDENT.repeat(emission.depth() + 1);
            List<String> chain = build.optionalChainOf(
                emission.ownerDisplayId());

            boolean central = false;
            for (EmissionComment comment : build.commentsOf(emission.id())) {
                if (comment.centralMarker()) {
                    central = includeCentralMarker;
                } else if (!suppressedComments.contains(comment.text())) {
                    lines.add("");
                    lines.add(indent + comment.text());
                }
            }
            if (central) {
                closeTo(open, commonPrefix(open, chain), lines);
                for (EmissionComment comment
                        : build.commentsOf(emission.id())) {
                    if (comment.centralMarker()) {
                        lines.add("");
                        lines.add(comment.text());
                    }
                }
            }

            Triple key = emission.key();
            if (excludedKeys.contains(key) || printed.contains(key)) {
                continue;
            }

            closeTo(open, commonPrefix(open, chain), lines);
            for (int i = open.size(); i < chain.size(); i++) {
                open.addLast(new OpenScope(chain.get(i), emission.depth()));
                lines.add(indent + "OPTIONAL {");
            }
            printed.add(key);
            collectPrefixes(key, namespaces, usedPrefixes);
            lines.add(indent + renderTriple(key, namespaces));
        }
        closeTo(open, 0, lines);

        return new RenderedWhere(Collections.unmodifiableList(lines),
            Collections.unmodifiableSet(usedPrefixes));
    }

    private static int commonPrefix(final Deque<OpenScope> open,
            final List<String> chain) {
        int length = 0;
        Iterator<OpenScope> scopes = open.iterator();
        while (scopes.hasNext() && length < chain.size()
                && scopes.next().rootDisplayId().equals(chain.get(length))) {
            length++;
        }
        return length;
    }

    private static void closeTo(final Deque<OpenScope> open, final int size,
            final List<String> lines) {
        while (open.size() > size) {
            OpenScope closing = open.removeLast();
            lines.add(INDENT.repeat(closing.depth() + 1) + "}");
        }
    }

    private static void collectPrefixes(final Triple triple,
            final NamespaceTable namespaces, final Set<String> usedPrefixes) {
        for (Node node : List.of(triple.getSubject(), triple.getPredicate(),
                triple.getObject())) {
            if (node.isURI() && !RDF.type.asNode().equals(node)) {
                namespaces.namespaceFor(node.getURI()).ifPresent(
                    namespace -> usedPrefixes.add(namespace.prefix()));
            }
        }
    }

    /**
     * Render one triple as a pattern line.
     *
     * @param triple the triple
     * @param namespaces the namespace table
     * @return e.g. {@code ?a_root crm:P1 ?b_node .}
     */
    static String renderTriple(final Triple triple,
            final NamespaceTable namespaces) {
        return renderTerm(triple.getSubject(), namespaces) + " "
            + renderTerm(triple.getPredicate(), namespaces) + " "
            + renderTerm(triple.getObject(), namespaces) + " .";
    }

    private static String renderTerm(final Node node,
            final NamespaceTable namespaces) {
        if (node.isVariable()) {
            return "?" + node.getName();
        }
        return namespaces.compact(node.getURI());
    }
}
