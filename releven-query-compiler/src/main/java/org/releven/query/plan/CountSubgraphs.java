package org.releven.query.plan;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The parts of a selection that are compiled into count sub-queries.
 *
 * @param excludedFromOuter display ids that must not render in the outer
 *     pattern
 * @param closures per count node (in count declaration order), the count
 *     node and every node reachable only through it
 * @param boundaryParents per count node, the node it hangs off
 */
public record CountSubgraphs(
        Set<String> excludedFromOuter,
        Map<String, Set<String>> closures,
        Map<String, String> boundaryParents) {

    /**
     * The node a count node hangs off.
     *
     * @param countId the count display id
     * @return the boundary parent, or empty if the count node is the start
     */
    public Optional<String> boundaryParentOf(final String countId) {
        return Optional.ofNullable(boundaryParents.get(countId));
    }

    /**
     * Whether there is nothing to count.
     *
     * @return true if no count node applies
     */
    public boolean isEmpty() {
        return closures.isEmpty();
    }
}
