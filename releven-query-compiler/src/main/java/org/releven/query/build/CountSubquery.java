package org.releven.query.build;

import org.apache.jena.graph.Triple;

import java.util.Optional;
import java.util.Set;

/**
 * An aggregate sub-query counting the matches of a count node.
 *
 * @param countNodeId the count node
 * @param build the sub-pattern, with the boundary variable renamed to the
 *     outer one
 * @param excludedKeys sub-pattern triples already present in the outer
 *     pattern
 * @param countVariable the counted variable
 * @param rawAlias the variable bound by {@code COUNT}
 * @param outerParentVariable the outer variable the count is grouped by,
 *     or null
 * @param comment the block comment
 * @param suppressedComments sub-pattern comments repeating the block comment
 * @param projection the projection added to the outer SELECT
 * @param zeroCoalesced whether the block is optional and defaults to zero
 */
public record CountSubquery(
        String countNodeId,
        PatternBuild build,
        Set<Triple> excludedKeys,
        String countVariable,
        String rawAlias,
        String outerParentVariable,
        String comment,
        Set<String> suppressedComments,
        SelectProjection projection,
        boolean zeroCoalesced) {

    /**
     * The variable the count is grouped by.
     *
     * @return the outer parent variable, or empty for an ungrouped count
     */
    public Optional<String> groupVariable() {
        return Optional.ofNullable(outerParentVariable);
    }
}
