package org.releven.query.build;

import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sys.JenaSystem;
import org.apache.jena.vocabulary.RDF;
import org.releven.query.model.PathToken;
import org.releven.query.model.SafeFragments;
import org.releven.query.model.SelectedNode;
import org.releven.query.model.SelectionGraph;
import org.releven.query.plan.TraversalPlan;
import org.releven.query.plan.TraversalPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the deduplicated triple pattern of a selection graph.
 *
 * <p>Each selected node's property path is walked class by class. The
 * variable at every step comes from a prefix cache keyed by the node's
 * boundary context and the tokens read so far, so nodes sharing a path
 * prefix share its variables and triples:</p>
 *
 * <pre>{@code
 * // A: [ex:X, ex:y, ex:Z]          (central)
 * // B: [ex:X, ex:y, ex:Z, ex:q, ex:W]
 *
 * ?a_root a ex:X .
 * ?a_root ex:y ?a_node .
 * ?a_node a ex:Z .
 * ?a_node ex:q ?b_node .
 * ?b_node a ex:W .
 * }</pre>
 *
 * <p>A class following the last predicate still receives its type triple
 * and its variable becomes the node's select variable; a path ending with a
 * predicate selects the bare value. In full-prefix mode the owning node is
 * part of every cache key, so nothing is shared between nodes.</p>
 */
public final class PatternBuilder {

    static {
        // initialise Jena before any vocabulary class loads
        JenaSystem.init();
    }

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        PatternBuilder.class);

    /** rdf:type predicate. */
    static final Node RDF_TYPE = RDF.type.asNode();

    private PatternBuilder() {
        throw new AssertionError("No instances");
    }

    /**
     * Build the pattern of a selection graph.
     *
     * @param graph the selection graph
     * @param fullPrefixConstraints whether to disable prefix sharing
     *     between nodes
     * @return the build result
     */
    public static PatternBuild build(final SelectionGraph graph,
            final boolean fullPrefixConstraints) {
        TraversalPlan plan = TraversalPlanner.plan(graph);
        CompilationContext context = new CompilationContext();
        Map<String, String> preferred = preferredSelectVariables(graph,
            plan);

        for (String displayId : plan.emissionOrder()) {
            graph.node(displayId).ifPresent(node -> emitPath(context, plan,
                node, preferred.get(displayId), fullPrefixConstraints));
        }

        BridgeResolver.resolve(graph, plan, context);

        String start = plan.startNodeId();
        if (start != null) {
            Optional<String> anchor = context.firstEmissionOf(start);
            anchor.ifPresent(id -> context.addComment(id,
                EmissionComment.centralMarker(nameOf(graph, start))));
        }

        PatternBuild build = context.toBuild(plan,
            projections(plan, context));
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Built {} triples from {} emissions for {} nodes",
                build.records().size(), build.emissions().size(),
                graph.size());
        }
        return build;
    }

    /**
     * Preferred select variable per node: {@code base_node} for the first
     * node with a given source path, {@code base_node_N} for the Nth.
     */
    private static Map<String, String> preferredSelectVariables(
            final SelectionGraph graph, final TraversalPlan plan) {
        Map<String, Integer> occurrences = new HashMap<>();
        Map<String, String> preferred = new HashMap<>();
        for (String displayId : plan.emissionOrder()) {
            Optional<SelectedNode> node = graph.node(displayId);
            if (node.isEmpty()) {
                continue;
            }
            String base = SafeFragments.of(node.get().sourcePathId());
            int count = occurrences.merge(base, 1, Integer::sum);
            preferred.put(displayId, count == 1
                ? base + "_node" : base + "_node_" + count);
        }
        return preferred;
    }

    private static void emitPath(final CompilationContext context,
            final TraversalPlan plan, final SelectedNode node,
            final String selectedName, final boolean fullPrefixConstraints) {
        String displayId = node.displayId();
        List<PathToken> classes = node.pathElement()
            .map(element -> element.classes()).orElse(List.of());
        if (classes.isEmpty()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Node {} has no property path", displayId);
            }
            return;
        }
        List<PathToken> predicates = node.path().predicates();
        String base = SafeFragments.of(node.sourcePathId());
        String selected = selectedName != null ? selectedName
            : base + "_node";
        int depth = plan.depthOf(displayId);
        String boundary = plan.boundaryContextOf(displayId);
        String owner = fullPrefixConstraints ? displayId : null;

        PathToken rootClass = PathToken.forward(classes.get(0).iri());
        String current = context.prefixVariable(
            new PrefixKey(boundary, PrefixKey.Kind.ROOT_CLASS,
                List.of(rootClass), owner),
            base + "_root", "root");
        String first = context.addTriple(Var.alloc(current), RDF_TYPE,
            NodeFactory.createURI(rootClass.iri()), depth, displayId);
        context.markFirstEmission(displayId, first);

        List<PathToken> prefix = new ArrayList<>();
        prefix.add(classes.get(0));
        for (int step = 0; step < predicates.size(); step++) {
            PathToken predicate = predicates.get(step);
            prefix.add(predicate);
            int next = step + 1;
            if (next < classes.size()) {
                PathToken nextClass = classes.get(next);
                prefix.add(nextClass);
                String preferredName = next == classes.size() - 1
                    ? selected : base + "_step_" + next;
                String variable = context.prefixVariable(
                    new PrefixKey(boundary, PrefixKey.Kind.CLASS, prefix,
                        owner),
                    preferredName, "step_" + next);
                link(context, current, predicate, variable, depth,
                    displayId);
                context.addTriple(Var.alloc(variable), RDF_TYPE,
                    NodeFactory.createURI(nextClass.iri()), depth, displayId);
                current = variable;
            } else {
                String value = context.prefixVariable(
                    new PrefixKey(boundary, PrefixKey.Kind.VALUE, prefix,
                        owner),
                    selected, "value");
                link(context, current, predicate, value, depth, displayId);
                current = value;
                break;
            }
        }
        context.resolveSelectVariable(displayId, current);
    }

    /**
     * Add {@code ?from predicate ?to}, swapped for an inverse predicate.
     *
     * @return the emission id
     */
    static String link(final CompilationContext context, final String from,
            final PathToken predicate, final String to, final int depth,
            final String owner) {
        Var subject = Var.alloc(predicate.inverse() ? to : from);
        Var object = Var.alloc(predicate.inverse() ? from : to);
        return context.addTriple(subject,
            NodeFactory.createURI(predicate.iri()), object, depth, owner);
    }

    private static List<SelectProjection> projections(
            final TraversalPlan plan, final CompilationContext context) {
        Map<String, SelectProjection> byVariable = new LinkedHashMap<>();
        for (String displayId : plan.emissionOrder()) {
            Optional<String> variable = context.selectVariableOf(displayId);
            if (variable.isEmpty()) {
                continue;
            }
            boolean central = displayId.equals(plan.startNodeId());
            SelectProjection existing = byVariable.get(variable.get());
            if (existing == null) {
                byVariable.put(variable.get(), SelectProjection.of(
                    variable.get(), plan.depthOf(displayId), central));
            } else if (central) {
                byVariable.put(variable.get(), existing.asCentral());
            }
        }
        return new ArrayList<>(byVariable.values());
    }

    static String nameOf(final SelectionGraph graph, final String displayId) {
        return graph.node(displayId).map(SelectedNode::displayName)
            .orElse(displayId);
    }
}
