package org.releven.query.build;

/**
 * A projected variable of the SELECT clause.
 *
 * @param variableName the projected variable name
 * @param depth the depth used to indent the projection
 * @param central whether this is the central node's variable
 * @param coalesceToZero whether the projection is
 *     {@code COALESCE(?source, 0)}
 * @param sourceVariableName the coalesced variable, or null
 */
public record SelectProjection(
        String variableName,
        int depth,
        boolean central,
        boolean coalesceToZero,
        String sourceVariableName) {

    /**
     * A plain variable projection.
     *
     * @param variableName the variable name
     * @param depth the depth
     * @param central whether it is the central node's variable
     * @return the projection
     */
    public static SelectProjection of(final String variableName,
            final int depth, final boolean central) {
        return new SelectProjection(variableName, depth, central, false,
            null);
    }

    /**
     * A projection defaulting an unbound count to zero.
     *
     * @param alias the projected alias
     * @param source the raw count variable
     * @param depth the depth
     * @return the projection
     */
    public static SelectProjection coalesced(final String alias,
            final String source, final int depth) {
        return new SelectProjection(alias, depth, false, true, source);
    }

    /**
     * This projection marked as the central node's.
     *
     * @return the marked projection
     */
    public SelectProjection asCentral() {
        return new SelectProjection(variableName, depth, true, coalesceToZero,
            sourceVariableName);
    }
}
