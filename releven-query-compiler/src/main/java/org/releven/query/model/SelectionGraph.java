package org.releven.query.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * The selected subgraph handed to the compiler: selected nodes, the edges
 * between them and the designated central node.
 *
 * <p>Nodes keep their first occurrence per display id. Edges whose
 * endpoints are not both selected are dropped on construction, so every
 * edge of a graph connects two of its nodes. Instances are immutable.</p>
 */
public final class SelectionGraph {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SelectionGraph.class);

    /** Selected nodes by display id, in selection order. */
    private final Map<String, SelectedNode> nodesById;

    /** Edges between selected nodes, in discovery order. */
    private final List<SelectedEdge> edges;

    /** The central display id, or null. */
    private final String centralNodeId;

    /**
     * Creates a selection graph.
     *
     * @param nodes the selected nodes
     * @param edges the selected edges
     * @param centralNodeId the central display id (may be null)
     */
    public SelectionGraph(final Collection<SelectedNode> nodes,
            final Collection<SelectedEdge> edges,
            final String centralNodeId) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(edges, "edges");
        Map<String, SelectedNode> byId = new LinkedHashMap<>();
        for (SelectedNode node : nodes) {
            byId.putIfAbsent(node.displayId(), node);
        }
        List<SelectedEdge> kept = new ArrayList<>();
        for (SelectedEdge edge : edges) {
            if (byId.containsKey(edge.sourceDisplayId())
                    && byId.containsKey(edge.targetDisplayId())) {
                kept.add(edge);
            } else if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Dropping edge {} -> {} outside the selection",
                    edge.sourceDisplayId(), edge.targetDisplayId());
            }
        }
        this.nodesById = Collections.unmodifiableMap(byId);
        this.edges = List.copyOf(kept);
        this.centralNodeId = centralNodeId;
    }

    /**
     * Selected nodes in selection order.
     *
     * @return the nodes
     */
    public List<SelectedNode> nodes() {
        return List.copyOf(nodesById.values());
    }

    /**
     * Edges between selected nodes.
     *
     * @return the edges
     */
    public List<SelectedEdge> edges() {
        return edges;
    }

    /**
     * The requested central display id, which may not be selected.
     *
     * @return the central id, or null
     */
    public String centralNodeId() {
        return centralNodeId;
    }

    /**
     * The node traversal starts from: the central node if selected,
     * otherwise the first selected node.
     *
     * @return the start display id, or empty for an empty selection
     */
    public Optional<String> startNodeId() {
        if (centralNodeId != null && nodesById.containsKey(centralNodeId)) {
            return Optional.of(centralNodeId);
        }
        return nodesById.keySet().stream().findFirst();
    }

    /**
     * Look up a selected node.
     *
     * @param displayId the display id
     * @return the node, or empty if not selected
     */
    public Optional<SelectedNode> node(final String displayId) {
        return Optional.ofNullable(nodesById.get(displayId));
    }

    /**
     * Whether a display id is selected.
     *
     * @param displayId the display id
     * @return true if selected
     */
    public boolean contains(final String displayId) {
        return nodesById.containsKey(displayId);
    }

    /**
     * Display ids in selection order.
     *
     * @return the ids
     */
    public List<String> displayIds() {
        return List.copyOf(nodesById.keySet());
    }

    /**
     * Display ids in sorted order.
     *
     * @return the sorted ids
     */
    public List<String> sortedDisplayIds() {
        return List.copyOf(new TreeSet<>(nodesById.keySet()));
    }

    /**
     * Number of selected nodes.
     *
     * @return the node count
     */
    public int size() {
        return nodesById.size();
    }

    /**
     * Whether nothing is selected.
     *
     * @return true if no node is selected
     */
    public boolean isEmpty() {
        return nodesById.isEmpty();
    }

    /**
     * Restrict the graph to the given display ids, keeping selection and
     * edge order.
     *
     * @param displayIds the ids to keep
     * @param central the central id of the restricted graph (may be null)
     * @return the restricted graph
     */
    public SelectionGraph subgraph(final Set<String> displayIds,
            final String central) {
        List<SelectedNode> kept = new ArrayList<>();
        for (SelectedNode node : nodesById.values()) {
            if (displayIds.contains(node.displayId())) {
                kept.add(node);
            }
        }
        return new SelectionGraph(kept, edges, central);
    }

    /**
     * Obtain a builder that resolves path elements from the given model.
     *
     * @param pathModel the path model
     * @return a new builder
     */
    public static Builder builder(final PathModel pathModel) {
        return new Builder(pathModel);
    }

    /**
     * Obtain a builder without a path model; nodes must then carry their
     * path elements.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder(id -> Optional.empty());
    }

    /**
     * Builder for {@link SelectionGraph}.
     */
    public static class Builder {
        /** Path model used to resolve source path ids. */
        private final PathModel pathModel;
        /** Nodes collected so far. */
        private final List<SelectedNode> nodes = new ArrayList<>();
        /** Edge declarations collected so far. */
        private final List<EdgeSpec> edgeSpecs = new ArrayList<>();
        /** Central display id. */
        private String central = null;

        /**
         * Creates a builder.
         *
         * @param model the path model
         */
        public Builder(final PathModel model) {
            this.pathModel = Objects.requireNonNull(model, "model");
        }

        /**
         * Select a node, resolving its path element from the path model.
         *
         * @param displayId the display id
         * @param sourcePathId the schema id
         * @return this builder
         */
        public Builder node(final String displayId,
                final String sourcePathId) {
            PathElement path = pathModel.find(sourcePathId).orElse(null);
            if (path == null && LOGGER.isDebugEnabled()) {
                LOGGER.debug("No path metadata for {} (display node {})",
                    sourcePathId, displayId);
            }
            nodes.add(new SelectedNode(displayId, sourcePathId, path));
            return this;
        }

        /**
         * Select a node whose display id equals its schema id.
         *
         * @param pathId the schema id
         * @return this builder
         */
        public Builder node(final String pathId) {
            return node(pathId, pathId);
        }

        /**
         * Select a node with an already resolved path element.
         *
         * @param node the node
         * @return this builder
         */
        public Builder node(final SelectedNode node) {
            nodes.add(node);
            return this;
        }

        /**
         * Add an edge. Its boundary flag is derived from the target's
         * classification when the graph is built.
         *
         * @param source the source display id
         * @param target the target display id
         * @return this builder
         */
        public Builder edge(final String source, final String target) {
            edgeSpecs.add(new EdgeSpec(source, target, null, null));
            return this;
        }

        /**
         * Add an edge with an explicit bridge predicate. Its boundary flag
         * is derived from the target's classification.
         *
         * @param source the source display id
         * @param target the target display id
         * @param bridgePredicate the bridge predicate
         * @return this builder
         */
        public Builder bridgeEdge(final String source, final String target,
                final PathToken bridgePredicate) {
            edgeSpecs.add(new EdgeSpec(source, target, bridgePredicate,
                null));
            return this;
        }

        /**
         * Add an edge that was reached through a reference path. The bridge
         * predicate is the reference path's last predicate.
         *
         * @param source the source display id
         * @param target the target display id
         * @param viaReferencePathId the schema id of the reference path
         * @return this builder
         */
        public Builder edgeVia(final String source, final String target,
                final String viaReferencePathId) {
            PathToken bridge = pathModel.bridgePredicateOf(viaReferencePathId)
                .orElse(null);
            edgeSpecs.add(new EdgeSpec(source, target, bridge, null));
            return this;
        }

        /**
         * Add a fully specified edge.
         *
         * @param edge the edge
         * @return this builder
         */
        public Builder edge(final SelectedEdge edge) {
            edgeSpecs.add(new EdgeSpec(edge.sourceDisplayId(),
                edge.targetDisplayId(), edge.bridgePredicate(),
                edge.entityReferenceBoundary()));
            return this;
        }

        /**
         * Designate the central node.
         *
         * @param displayId the central display id
         * @return this builder
         */
        public Builder central(final String displayId) {
            this.central = displayId;
            return this;
        }

        /**
         * Build the selection graph.
         *
         * @return the graph
         */
        public SelectionGraph build() {
            Map<String, SelectedNode> byId = new LinkedHashMap<>();
            for (SelectedNode node : nodes) {
                byId.putIfAbsent(node.displayId(), node);
            }
            List<SelectedEdge> edges = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (EdgeSpec spec : edgeSpecs) {
                SelectedNode target = byId.get(spec.target());
                boolean boundary = spec.boundary() != null
                    ? spec.boundary()
                    : target != null && target.isEntityReference();
                SelectedEdge edge = new SelectedEdge(spec.source(),
                    spec.target(), spec.bridge(), boundary);
                if (seen.add(spec.source() + "=>" + spec.target())) {
                    edges.add(edge);
                }
            }
            return new SelectionGraph(byId.values(), edges, central);
        }

        /**
         * Edge declaration whose boundary flag may still be derived.
         */
        private record EdgeSpec(String source, String target,
                PathToken bridge, Boolean boundary) {
        }
    }
}
