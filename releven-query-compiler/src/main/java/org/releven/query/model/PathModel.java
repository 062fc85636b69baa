package org.releven.query.model;

import java.util.Optional;

/**
 * Lookup of schema path elements by id.
 *
 * <p>Implementations are expected to guarantee referential integrity, but
 * callers treat an absent id as "no path" rather than as a fault.</p>
 */
public interface PathModel {

    /**
     * Find the path element with the given id.
     *
     * @param id the schema id
     * @return the element, or empty if unknown
     */
    Optional<PathElement> find(String id);

    /**
     * The predicate that bridges into the entity referenced by the given
     * path: the last predicate of its property path.
     *
     * @param id the schema id of the reference path
     * @return the bridge predicate, or empty if the path is unknown or has
     *     no predicate
     */
    default Optional<PathToken> bridgePredicateOf(final String id) {
        return find(id).flatMap(PathElement::lastPredicate);
    }
}
