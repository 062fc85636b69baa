package org.releven.query.build;

import org.releven.query.model.PathToken;
import org.releven.query.model.SelectedEdge;
import org.releven.query.model.SelectionGraph;
import org.releven.query.plan.Transition;
import org.releven.query.plan.TraversalPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Adds bridge triples for edges with an explicit predicate and attaches
 * transition comments to every parent/child transition.
 *
 * <p>Comment arrows: {@value #PLAIN_ARROW} for plain transitions,
 * {@value #FORWARD_REFERENCE_ARROW} for reference transitions walked
 * downstream and {@value #UPSTREAM_REFERENCE_ARROW} for those discovered
 * walking upstream from the central node.</p>
 */
final class BridgeResolver {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        BridgeResolver.class);

    /** Arrow of a plain transition. */
    static final String PLAIN_ARROW = ">";

    /** Arrow of a reference transition walked downstream. */
    static final String FORWARD_REFERENCE_ARROW = "->>";

    /** Arrow of a reference transition discovered upstream. */
    static final String UPSTREAM_REFERENCE_ARROW = "<<-";

    private static final Comparator<Transition> SOURCE_THEN_TARGET =
        Comparator.comparing(Transition::source)
            .thenComparing(Transition::target);

    private BridgeResolver() {
        throw new AssertionError("No instances");
    }

    /**
     * Resolve bridges and transition comments into the context.
     *
     * @param graph the selection graph
     * @param plan its traversal plan
     * @param context the build context, after path emission
     */
    static void resolve(final SelectionGraph graph, final TraversalPlan plan,
            final CompilationContext context) {
        Set<Transition> bridges = new HashSet<>();
        Set<Transition> references = new HashSet<>();

        for (SelectedEdge edge : graph.edges()) {
            Transition transition = Transition.of(edge);
            Optional<PathToken> predicate = edge.bridge();
            if (predicate.isEmpty()) {
                if (edge.entityReferenceBoundary()) {
                    references.add(transition);
                }
                continue;
            }
            bridges.add(transition);
            references.add(transition);
            addBridge(graph, plan, context, edge, predicate.get());
        }

        Set<Transition> handled = new HashSet<>();
        Set<Transition> plain = new TreeSet<>(SOURCE_THEN_TARGET);
        for (SelectedEdge edge : graph.edges()) {
            Transition transition = Transition.of(edge);
            if (!bridges.contains(transition)) {
                plain.add(transition);
            }
        }
        for (Transition transition : plain) {
            Optional<String> anchor = context.firstEmissionOf(
                transition.target());
            if (anchor.isEmpty()) {
                continue;
            }
            context.addComment(anchor.get(), comment(graph, transition,
                arrow(plan, transition, references.contains(transition))));
            handled.add(transition);
        }

        for (Map.Entry<String, String> entry : plan.parents().entrySet()) {
            Transition transition = new Transition(entry.getValue(),
                entry.getKey());
            Optional<String> anchor = context.firstEmissionOf(entry.getKey());
            if (anchor.isEmpty() || handled.contains(transition)
                    || bridges.contains(transition)) {
                continue;
            }
            context.addComment(anchor.get(), comment(graph, transition,
                arrow(plan, transition, references.contains(transition))));
        }
    }

    private static void addBridge(final SelectionGraph graph,
            final TraversalPlan plan, final CompilationContext context,
            final SelectedEdge edge, final PathToken predicate) {
        Optional<String> source = context.selectVariableOf(
            edge.sourceDisplayId());
        Optional<String> target = context.selectVariableOf(
            edge.targetDisplayId());
        if (source.isEmpty() || target.isEmpty()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Skipping bridge {} -> {}: endpoint without "
                    + "variable", edge.sourceDisplayId(),
                    edge.targetDisplayId());
            }
            return;
        }
        String emissionId = PatternBuilder.link(context, source.get(),
            predicate, target.get(), plan.depthOf(edge.targetDisplayId()),
            edge.targetDisplayId());
        Transition transition = Transition.of(edge);
        String arrow = plan.isUpstream(transition)
            ? UPSTREAM_REFERENCE_ARROW : FORWARD_REFERENCE_ARROW;
        context.addComment(emissionId, comment(graph, transition, arrow));
        context.firstEmissionOf(edge.targetDisplayId())
            .ifPresent(anchor -> context.moveBefore(emissionId, anchor));
    }

    private static String arrow(final TraversalPlan plan,
            final Transition transition, final boolean reference) {
        if (!reference) {
            return PLAIN_ARROW;
        }
        return plan.isUpstream(transition)
            ? UPSTREAM_REFERENCE_ARROW : FORWARD_REFERENCE_ARROW;
    }

    /**
     * The comment text of a transition.
     *
     * @param parentName the parent's name
     * @param arrow the arrow
     * @param childName the child's name
     * @return the comment line
     */
    static String transitionText(final String parentName, final String arrow,
            final String childName) {
        return "# " + parentName + " " + arrow + " " + childName;
    }

    private static EmissionComment comment(final SelectionGraph graph,
            final Transition transition, final String arrow) {
        return EmissionComment.transition(transitionText(
            PatternBuilder.nameOf(graph, transition.source()), arrow,
            PatternBuilder.nameOf(graph, transition.target())));
    }
}
