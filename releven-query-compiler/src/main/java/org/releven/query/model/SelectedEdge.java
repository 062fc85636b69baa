package org.releven.query.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A selected edge between two display nodes, directed in discovery order.
 *
 * @param sourceDisplayId the source display id
 * @param targetDisplayId the target display id
 * @param bridgePredicate explicit predicate bridging a reference boundary,
 *     or null
 * @param entityReferenceBoundary whether the edge crosses an entity
 *     reference boundary
 */
public record SelectedEdge(
        String sourceDisplayId,
        String targetDisplayId,
        PathToken bridgePredicate,
        boolean entityReferenceBoundary) {

    /**
     * Creates an edge.
     *
     * @param sourceDisplayId the source display id
     * @param targetDisplayId the target display id
     * @param bridgePredicate the bridge predicate (may be null)
     * @param entityReferenceBoundary the boundary flag
     */
    public SelectedEdge {
        Objects.requireNonNull(sourceDisplayId, "sourceDisplayId");
        Objects.requireNonNull(targetDisplayId, "targetDisplayId");
    }

    /**
     * Create a plain edge without bridge predicate.
     *
     * @param source the source display id
     * @param target the target display id
     * @return the edge
     */
    public static SelectedEdge of(final String source, final String target) {
        return new SelectedEdge(source, target, null, false);
    }

    /**
     * The explicit bridge predicate.
     *
     * @return the predicate, or empty
     */
    public Optional<PathToken> bridge() {
        return Optional.ofNullable(bridgePredicate);
    }
}
