package org.releven.query.build;

import org.apache.jena.graph.Triple;

/**
 * One request to emit a triple. Several emissions may share a key; the
 * emission log keeps them all, in order.
 *
 * @param id the emission id, unique within one compilation
 * @param key the requested triple
 * @param depth the depth the triple was requested at
 * @param ownerDisplayId the node that caused the emission, or null
 */
public record TripleEmission(String id, Triple key, int depth,
        String ownerDisplayId) {

    /**
     * The same emission for a different triple.
     *
     * @param triple the replacement triple
     * @return the re-keyed emission
     */
    public TripleEmission withKey(final Triple triple) {
        return new TripleEmission(id, triple, depth, ownerDisplayId);
    }
}
