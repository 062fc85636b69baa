package org.releven.query.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns arbitrary ids into fragments usable in SPARQL variable names and
 * boundary context labels.
 */
public final class SafeFragments {

    /** Runs of characters not allowed in a fragment. */
    private static final Pattern UNSAFE_RUN = Pattern.compile("[^a-z0-9]+");

    /** Leading or trailing underscores. */
    private static final Pattern EDGE_UNDERSCORES =
        Pattern.compile("^_+|_+$");

    /** Fallback for ids with no usable character. */
    private static final String EMPTY_FRAGMENT = "path";

    private SafeFragments() {
        throw new AssertionError("No instances");
    }

    /**
     * Lower-case the value, collapse unsafe runs into one underscore and trim
     * underscores. A fragment starting with a digit gets a {@code p_}
     * prefix; an empty fragment becomes {@code path}.
     *
     * @param value the raw id (may be null)
     * @return the safe fragment
     */
    public static String of(final String value) {
        String raw = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        String safe = UNSAFE_RUN.matcher(raw).replaceAll("_");
        safe = EDGE_UNDERSCORES.matcher(safe).replaceAll("");
        if (safe.isEmpty()) {
            return EMPTY_FRAGMENT;
        }
        if (Character.isDigit(safe.charAt(0))) {
            return "p_" + safe;
        }
        return safe;
    }
}
