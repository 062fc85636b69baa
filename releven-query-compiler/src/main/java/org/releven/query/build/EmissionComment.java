package org.releven.query.build;

/**
 * A comment printed before an emission.
 *
 * @param text the comment line, starting with {@code #}
 * @param centralMarker whether this is the central node marker
 */
public record EmissionComment(String text, boolean centralMarker) {

    /**
     * A transition comment.
     *
     * @param text the comment line
     * @return the comment
     */
    public static EmissionComment transition(final String text) {
        return new EmissionComment(text, false);
    }

    /**
     * The marker of the central node.
     *
     * @param nodeName the central node's name
     * @return the marker comment
     */
    public static EmissionComment centralMarker(final String nodeName) {
        return new EmissionComment(
            "# >>>> Central node: " + nodeName + " <<<<", true);
    }
}
