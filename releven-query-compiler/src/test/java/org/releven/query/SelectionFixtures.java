package org.releven.query;

import org.releven.query.model.PathClassification;
import org.releven.query.model.PathElement;
import org.releven.query.model.SelectedNode;

/**
 * Shared builders for selection test data.
 */
public final class SelectionFixtures {

    /** Example namespace, not in the default namespace table. */
    public static final String EX = "http://example.org/";

    /** CIDOC CRM namespace, in the default namespace table. */
    public static final String CRM = "http://www.cidoc-crm.org/cidoc-crm/";

    private SelectionFixtures() {
        throw new AssertionError("No instances");
    }

    /**
     * A field path element.
     *
     * @param id the schema id
     * @param path raw path tokens
     * @return the element
     */
    public static PathElement field(final String id, final String... path) {
        return PathElement.builder(id).path(path).build();
    }

    /**
     * A path element with multiplicity and classification.
     *
     * @param id the schema id
     * @param multiple the multiplicity flag
     * @param classification the classification
     * @param path raw path tokens
     * @return the element
     */
    public static PathElement element(final String id, final boolean multiple,
            final PathClassification classification, final String... path) {
        return PathElement.builder(id)
            .multiple(multiple)
            .classification(classification)
            .path(path)
            .build();
    }

    /**
     * A selected node whose display id equals its schema id.
     *
     * @param path the path element
     * @return the node
     */
    public static SelectedNode node(final PathElement path) {
        return new SelectedNode(path.id(), path.id(), path);
    }

    /**
     * A selected node with its own display id.
     *
     * @param displayId the display id
     * @param path the path element
     * @return the node
     */
    public static SelectedNode node(final String displayId,
            final PathElement path) {
        return new SelectedNode(displayId, path.id(), path);
    }
}
