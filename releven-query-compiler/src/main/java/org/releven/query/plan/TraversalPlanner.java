package org.releven.query.plan;

import org.releven.query.model.SafeFragments;
import org.releven.query.model.SelectedNode;
import org.releven.query.model.SelectionGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plans how a selection graph is walked when its triples are emitted.
 *
 * <p>The planner computes, relative to the central node (or the first
 * selected node when there is none):</p>
 * <ul>
 *   <li>a depth per node, used for indentation and triple placement</li>
 *   <li>a reference boundary context per node, which decides whether two
 *       nodes may share compiled variables</li>
 *   <li>a deterministic emission order: upstream ancestors first, then the
 *       central node, then its descendants</li>
 *   <li>a parent per node and the optional chain derived from it</li>
 * </ul>
 *
 * <p>All ties are broken by sorted display id, so the plan is a pure
 * function of the graph.</p>
 */
public final class TraversalPlanner {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        TraversalPlanner.class);

    /** Separator of boundary context segments. */
    private static final String CONTEXT_SEPARATOR = "|ref:";

    private TraversalPlanner() {
        throw new AssertionError("No instances");
    }

    /**
     * Plan the traversal of a selection graph.
     *
     * @param graph the selection graph
     * @return the plan
     */
    public static TraversalPlan plan(final SelectionGraph graph) {
        Adjacency adjacency = Adjacency.of(graph);
        String start = graph.startNodeId().orElse(null);

        Map<String, Integer> depths = computeDepths(graph, adjacency, start);
        Map<String, String> contexts =
            computeBoundaryContexts(graph, adjacency, start);

        OrderWalk walk = new OrderWalk(adjacency);
        if (start != null) {
            walk.visitUpstream(start);
            for (String ancestor : walk.upstreamPostOrder) {
                if (!ancestor.equals(start)) {
                    walk.append(ancestor);
                }
            }
            walk.append(start);
            walk.visitDownstream(start);
        }
        for (String root : orderedRoots(graph, adjacency, start)) {
            if (!walk.ordered.contains(root)) {
                walk.visitDownstream(root);
            }
        }
        for (String id : graph.sortedDisplayIds()) {
            if (!walk.ordered.contains(id)) {
                walk.visitDownstream(id);
            }
        }

        List<String> order = List.copyOf(walk.ordered);
        Map<String, List<String>> chains = computeOptionalChains(graph,
            order, walk.parents, start);

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Planned {} nodes from {}: order={}, parents={}",
                order.size(), start, order, walk.parents);
        }

        return new TraversalPlan(start,
            Collections.unmodifiableMap(depths),
            Collections.unmodifiableMap(contexts),
            order,
            Collections.unmodifiableMap(walk.parents),
            Collections.unmodifiableMap(chains),
            Collections.unmodifiableSet(walk.upstream));
    }

    /**
     * Compute the relative depth of every node of a graph.
     *
     * @param graph the selection graph
     * @return depth per display id, minimum 0
     */
    public static Map<String, Integer> computeDepths(
            final SelectionGraph graph) {
        return computeDepths(graph, Adjacency.of(graph),
            graph.startNodeId().orElse(null));
    }

    /**
     * Breadth-first from the start node: parents get one less than the
     * current depth, children one more. Nodes left unreached seed their own
     * search at depth 0, in sorted order. Depths are finally shifted so the
     * minimum is 0.
     */
    private static Map<String, Integer> computeDepths(
            final SelectionGraph graph,
            final Adjacency adjacency,
            final String start) {
        Map<String, Integer> depths = new LinkedHashMap<>();
        if (start != null) {
            spreadDepths(start, adjacency, depths);
        }
        for (String id : graph.sortedDisplayIds()) {
            if (!depths.containsKey(id)) {
                spreadDepths(id, adjacency, depths);
            }
        }

        int min = 0;
        for (int depth : depths.values()) {
            min = Math.min(min, depth);
        }
        if (min < 0) {
            int shift = -min;
            depths.replaceAll((id, depth) -> depth + shift);
        }
        return depths;
    }

    private static void spreadDepths(final String seed,
            final Adjacency adjacency,
            final Map<String, Integer> depths) {
        Deque<String> queue = new ArrayDeque<>();
        depths.put(seed, 0);
        queue.add(seed);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int depth = depths.get(current);
            for (String parent : adjacency.parents(current)) {
                if (!depths.containsKey(parent)) {
                    depths.put(parent, depth - 1);
                    queue.add(parent);
                }
            }
            for (String child : adjacency.children(current)) {
                if (!depths.containsKey(child)) {
                    depths.put(child, depth + 1);
                    queue.add(child);
                }
            }
        }
    }

    /**
     * Breadth-first along edge direction from the roots. Children of an
     * entity reference node get a new context segment keyed by that node.
     */
    private static Map<String, String> computeBoundaryContexts(
            final SelectionGraph graph,
            final Adjacency adjacency,
            final String start) {
        Map<String, String> contexts = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String root : orderedRoots(graph, adjacency, start)) {
            if (!contexts.containsKey(root)) {
                contexts.put(root, TraversalPlan.ROOT_CONTEXT);
                queue.add(root);
            }
        }
        spreadContexts(queue, graph, adjacency, contexts);

        for (String id : graph.sortedDisplayIds()) {
            if (!contexts.containsKey(id)) {
                contexts.put(id, TraversalPlan.ROOT_CONTEXT);
                queue.add(id);
                spreadContexts(queue, graph, adjacency, contexts);
            }
        }
        return contexts;
    }

    private static void spreadContexts(final Deque<String> queue,
            final SelectionGraph graph,
            final Adjacency adjacency,
            final Map<String, String> contexts) {
        while (!queue.isEmpty()) {
            String current = queue.poll();
            String context = contexts.get(current);
            boolean crossesBoundary = graph.node(current)
                .map(SelectedNode::isEntityReference)
                .orElse(false);
            String childContext = crossesBoundary
                ? context + CONTEXT_SEPARATOR + SafeFragments.of(current)
                : context;
            for (String child : adjacency.children(current)) {
                if (!contexts.containsKey(child)) {
                    contexts.put(child, childContext);
                    queue.add(child);
                }
            }
        }
    }

    /**
     * Nodes without incoming edges in sorted order, with the start node
     * moved (or added) to the front.
     */
    private static List<String> orderedRoots(final SelectionGraph graph,
            final Adjacency adjacency,
            final String start) {
        List<String> roots = new ArrayList<>();
        for (String id : graph.sortedDisplayIds()) {
            if (adjacency.isRoot(id)) {
                roots.add(id);
            }
        }
        if (start != null) {
            roots.remove(start);
            roots.add(0, start);
        }
        return roots;
    }

    /**
     * A node opens an OPTIONAL only if it is multiple and no ancestor has
     * opened one already; descendants inherit their parent's chain. The
     * start node never opens one.
     */
    private static Map<String, List<String>> computeOptionalChains(
            final SelectionGraph graph,
            final List<String> order,
            final Map<String, String> parents,
            final String start) {
        Map<String, List<String>> memo = new HashMap<>();
        Set<String> inProgress = new HashSet<>();
        Map<String, List<String>> chains = new LinkedHashMap<>();
        for (String id : order) {
            chains.put(id, optionalChain(id, graph, parents, start, memo,
                inProgress));
        }
        return chains;
    }

    private static List<String> optionalChain(final String id,
            final SelectionGraph graph,
            final Map<String, String> parents,
            final String start,
            final Map<String, List<String>> memo,
            final Set<String> inProgress) {
        List<String> memoized = memo.get(id);
        if (memoized != null) {
            return memoized;
        }
        if (inProgress.contains(id)) {
            return List.of();
        }
        if (id.equals(start)) {
            memo.put(id, List.of());
            return List.of();
        }
        inProgress.add(id);
        String parent = parents.get(id);
        List<String> parentChain = parent == null
            ? List.of()
            : optionalChain(parent, graph, parents, start, memo, inProgress);
        List<String> chain;
        if (!parentChain.isEmpty()) {
            chain = parentChain;
        } else if (graph.node(id).map(SelectedNode::isMultiple)
                .orElse(false)) {
            chain = List.of(id);
        } else {
            chain = List.of();
        }
        inProgress.remove(id);
        memo.put(id, chain);
        return chain;
    }

    /**
     * Mutable state of the emission order walk.
     */
    private static final class OrderWalk {
        /** Adjacency being walked. */
        private final Adjacency adjacency;
        /** Emission order. */
        private final Set<String> ordered = new LinkedHashSet<>();
        /** First-visiting predecessor per node. */
        private final Map<String, String> parents = new LinkedHashMap<>();
        /** Transitions discovered upstream. */
        private final Set<Transition> upstream = new LinkedHashSet<>();
        /** Nodes visited upstream. */
        private final Set<String> upstreamVisited = new HashSet<>();
        /** Upstream nodes in post-order, ancestors first. */
        private final List<String> upstreamPostOrder = new ArrayList<>();

        OrderWalk(final Adjacency value) {
            this.adjacency = value;
        }

        void append(final String id) {
            ordered.add(id);
        }

        void visitUpstream(final String current) {
            if (!upstreamVisited.add(current)) {
                return;
            }
            for (String parent : adjacency.parents(current)) {
                parents.putIfAbsent(current, parent);
                upstream.add(new Transition(parent, current));
                visitUpstream(parent);
            }
            upstreamPostOrder.add(current);
        }

        void visitDownstream(final String current) {
            append(current);
            for (String child : adjacency.children(current)) {
                parents.putIfAbsent(child, current);
                if (!ordered.contains(child)) {
                    visitDownstream(child);
                }
            }
        }
    }
}
