package org.releven.query.plan;

import org.releven.query.model.SelectedEdge;

/**
 * A directed parent-to-child step between two display nodes.
 *
 * @param source the source display id
 * @param target the target display id
 */
public record Transition(String source, String target) {

    /**
     * The transition an edge describes.
     *
     * @param edge the edge
     * @return the transition from the edge's source to its target
     */
    public static Transition of(final SelectedEdge edge) {
        return new Transition(edge.sourceDisplayId(), edge.targetDisplayId());
    }
}
