package org.releven.query.plan;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Result of planning the traversal of a selection graph.
 *
 * @param startNodeId the node traversal started from (central node or
 *     fallback), or null for an empty selection
 * @param depths relative depth per display id, minimum 0
 * @param boundaryContexts reference boundary context per display id
 * @param emissionOrder display ids in the order their triples are emitted
 * @param parents first-visiting predecessor per non-root display id
 * @param optionalChains optional chain per display id
 * @param upstreamTransitions transitions discovered while walking upstream
 *     from the start node
 */
public record TraversalPlan(
        String startNodeId,
        Map<String, Integer> depths,
        Map<String, String> boundaryContexts,
        List<String> emissionOrder,
        Map<String, String> parents,
        Map<String, List<String>> optionalChains,
        Set<Transition> upstreamTransitions) {

    /** Context label of nodes not behind any reference boundary. */
    public static final String ROOT_CONTEXT = "root";

    /**
     * Depth of a node.
     *
     * @param displayId the display id
     * @return the depth, 0 if unknown
     */
    public int depthOf(final String displayId) {
        return depths.getOrDefault(displayId, 0);
    }

    /**
     * Boundary context of a node.
     *
     * @param displayId the display id
     * @return the context, {@value #ROOT_CONTEXT} if unknown
     */
    public String boundaryContextOf(final String displayId) {
        return boundaryContexts.getOrDefault(displayId, ROOT_CONTEXT);
    }

    /**
     * Optional chain of a node.
     *
     * @param displayId the display id
     * @return the chain, empty if unknown
     */
    public List<String> optionalChainOf(final String displayId) {
        return optionalChains.getOrDefault(displayId, List.of());
    }

    /**
     * Parent of a node.
     *
     * @param displayId the display id
     * @return the parent, or empty for roots
     */
    public Optional<String> parentOf(final String displayId) {
        return Optional.ofNullable(parents.get(displayId));
    }

    /**
     * Whether a transition was discovered walking upstream.
     *
     * @param transition the transition
     * @return true if upstream
     */
    public boolean isUpstream(final Transition transition) {
        return upstreamTransitions.contains(transition);
    }
}
