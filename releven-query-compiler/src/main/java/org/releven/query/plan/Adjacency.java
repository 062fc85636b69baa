package org.releven.query.plan;

import org.releven.query.model.SelectedEdge;
import org.releven.query.model.SelectionGraph;

import java.util.HashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Sorted directed and undirected adjacency of a selection graph.
 */
final class Adjacency {

    /** Children per display id. */
    private final Map<String, NavigableSet<String>> outgoing = new HashMap<>();

    /** Parents per display id. */
    private final Map<String, NavigableSet<String>> incoming = new HashMap<>();

    private Adjacency() {
    }

    /**
     * Build the adjacency of a graph.
     *
     * @param graph the selection graph
     * @return the adjacency
     */
    static Adjacency of(final SelectionGraph graph) {
        Adjacency adjacency = new Adjacency();
        for (String id : graph.displayIds()) {
            adjacency.outgoing.put(id, new TreeSet<>());
            adjacency.incoming.put(id, new TreeSet<>());
        }
        for (SelectedEdge edge : graph.edges()) {
            adjacency.outgoing.get(edge.sourceDisplayId())
                .add(edge.targetDisplayId());
            adjacency.incoming.get(edge.targetDisplayId())
                .add(edge.sourceDisplayId());
        }
        return adjacency;
    }

    /**
     * Children of a node, sorted.
     *
     * @param id the display id
     * @return the children
     */
    NavigableSet<String> children(final String id) {
        return outgoing.getOrDefault(id, new TreeSet<>());
    }

    /**
     * Parents of a node, sorted.
     *
     * @param id the display id
     * @return the parents
     */
    NavigableSet<String> parents(final String id) {
        return incoming.getOrDefault(id, new TreeSet<>());
    }

    /**
     * Neighbours of a node in either direction, sorted.
     *
     * @param id the display id
     * @return the neighbours
     */
    NavigableSet<String> neighbours(final String id) {
        NavigableSet<String> all = new TreeSet<>(children(id));
        all.addAll(parents(id));
        return all;
    }

    /**
     * Whether a node has no incoming edge.
     *
     * @param id the display id
     * @return true if the node is a root
     */
    boolean isRoot(final String id) {
        return parents(id).isEmpty();
    }
}
