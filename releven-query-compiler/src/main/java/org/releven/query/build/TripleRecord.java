package org.releven.query.build;

import org.apache.jena.graph.Triple;

import java.util.Objects;

/**
 * A unique triple of a compiled pattern together with the smallest depth at
 * which it was requested.
 */
public final class TripleRecord {

    /** The triple, which is also its structural key. */
    private final Triple triple;

    /** Smallest requested depth. */
    private int depth;

    /**
     * Creates a record.
     *
     * @param triple the triple
     * @param depth the initial depth
     */
    public TripleRecord(final Triple triple, final int depth) {
        this.triple = Objects.requireNonNull(triple, "triple");
        this.depth = depth;
    }

    /**
     * The triple.
     *
     * @return the triple
     */
    public Triple triple() {
        return triple;
    }

    /**
     * The smallest depth the triple was requested at.
     *
     * @return the depth
     */
    public int depth() {
        return depth;
    }

    /**
     * Record another request; the closer depth wins.
     *
     * @param requested the requested depth
     */
    void lowerDepth(final int requested) {
        if (requested < depth) {
            depth = requested;
        }
    }

    @Override
    public String toString() {
        return triple + " @" + depth;
    }
}
