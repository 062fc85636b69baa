package org.releven.query.build;

import org.releven.query.model.PathToken;

import java.util.List;

/**
 * Key of the prefix variable cache. Two path steps resolve to the same
 * variable exactly when their keys are equal.
 *
 * @param boundaryContext the reference boundary context of the node
 * @param kind what the prefix ends with
 * @param tokens the token prefix
 * @param owner the owning display id in full-prefix mode, else null
 */
record PrefixKey(String boundaryContext, Kind kind, List<PathToken> tokens,
        String owner) {

    /**
     * What a token prefix ends with.
     */
    enum Kind {
        /** The root class of a path. */
        ROOT_CLASS,
        /** A class reached through a predicate. */
        CLASS,
        /** A terminal value reached through a predicate. */
        VALUE
    }

    PrefixKey {
        tokens = List.copyOf(tokens);
    }
}
