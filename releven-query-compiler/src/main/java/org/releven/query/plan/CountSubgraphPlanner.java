package org.releven.query.plan;

import org.releven.query.model.SelectionGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits count nodes and the subgraphs behind them off a selection.
 *
 * <p>A breadth-first search over the undirected selection, starting at the
 * central node, yields a spanning tree. The closure of a count node is the
 * count node plus its descendants in that tree; its boundary parent is its
 * tree parent. Count ids that are unselected or unreachable from the
 * central node are ignored.</p>
 */
public final class CountSubgraphPlanner {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        CountSubgraphPlanner.class);

    private CountSubgraphPlanner() {
        throw new AssertionError("No instances");
    }

    /**
     * Compute the count subgraphs of a selection.
     *
     * @param graph the full selection graph
     * @param countNodeIds the requested count display ids
     * @return the count subgraphs
     */
    public static CountSubgraphs plan(final SelectionGraph graph,
            final List<String> countNodeIds) {
        String start = graph.startNodeId().orElse(null);
        if (start == null || countNodeIds.isEmpty()) {
            return new CountSubgraphs(Set.of(), Map.of(), Map.of());
        }

        Adjacency adjacency = Adjacency.of(graph);
        Map<String, List<String>> children = new HashMap<>();
        Map<String, String> treeParents = new HashMap<>();
        Set<String> connected = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        connected.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String neighbour : adjacency.neighbours(current)) {
                if (connected.add(neighbour)) {
                    treeParents.put(neighbour, current);
                    children.computeIfAbsent(current, k -> new ArrayList<>())
                        .add(neighbour);
                    queue.add(neighbour);
                }
            }
        }

        Set<String> excluded = new LinkedHashSet<>();
        Map<String, Set<String>> closures = new LinkedHashMap<>();
        Map<String, String> boundaryParents = new LinkedHashMap<>();
        for (String countId : countNodeIds) {
            if (!graph.contains(countId) || !connected.contains(countId)) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Ignoring count node {}: not reachable",
                        countId);
                }
                continue;
            }
            Set<String> closure = new LinkedHashSet<>();
            closure.add(countId);
            String parent = treeParents.get(countId);
            if (parent != null) {
                boundaryParents.put(countId, parent);
            }
            Deque<String> stack = new ArrayDeque<>(
                children.getOrDefault(countId, List.of()));
            while (!stack.isEmpty()) {
                String current = stack.pop();
                if (closure.add(current)) {
                    stack.addAll(children.getOrDefault(current, List.of()));
                }
            }
            excluded.addAll(closure);
            closures.put(countId, Collections.unmodifiableSet(closure));
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Count closures {} with boundary parents {}",
                closures, boundaryParents);
        }
        return new CountSubgraphs(Collections.unmodifiableSet(excluded),
            Collections.unmodifiableMap(closures),
            Collections.unmodifiableMap(boundaryParents));
    }
}
