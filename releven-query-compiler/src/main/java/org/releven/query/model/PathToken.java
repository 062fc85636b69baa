package org.releven.query.model;

import java.util.Objects;

/**
 * A single token of a property path: either a class IRI (even positions)
 * or a predicate IRI (odd positions).
 *
 * <p>A raw token starting with {@code ^} marks an inverse predicate: the
 * triple built from it has subject and object swapped relative to forward
 * traversal. The marker is stripped from {@link #iri()} but kept in
 * {@link #raw()}, so two tokens are equal only if both the IRI and the
 * direction match.</p>
 *
 * @param iri the IRI without the inverse marker
 * @param inverse whether the token carried the inverse marker
 */
public record PathToken(String iri, boolean inverse) {

    /** Prefix marking an inverse predicate in raw path tokens. */
    public static final String INVERSE_MARKER = "^";

    /**
     * Creates a token.
     *
     * @param iri the IRI without the inverse marker
     * @param inverse whether the token is inverse
     */
    public PathToken {
        Objects.requireNonNull(iri, "iri");
    }

    /**
     * Parse a raw token, honouring a leading inverse marker.
     *
     * @param raw the raw token, e.g. {@code ^http://example.org/p}
     * @return the parsed token
     * @throws IllegalArgumentException if the token is blank
     */
    public static PathToken parse(final String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException(
                "Path token must not be blank");
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith(INVERSE_MARKER)) {
            return new PathToken(
                trimmed.substring(INVERSE_MARKER.length()).trim(), true);
        }
        return new PathToken(trimmed, false);
    }

    /**
     * Create a forward (non-inverse) token.
     *
     * @param iri the IRI
     * @return the token
     */
    public static PathToken forward(final String iri) {
        return new PathToken(iri, false);
    }

    /**
     * The token as it appears in a raw path array.
     *
     * @return the IRI, prefixed with the inverse marker when inverse
     */
    public String raw() {
        return inverse ? INVERSE_MARKER + iri : iri;
    }

    @Override
    public String toString() {
        return raw();
    }
}
