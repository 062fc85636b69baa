package org.releven.query.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A selected display node.
 *
 * <p>{@code displayId} identifies one visual instance of a schema node;
 * several instances may share a {@code sourcePathId} when the same schema
 * node is reached through different reference chains.</p>
 *
 * @param displayId the display id
 * @param sourcePathId the schema id the node was created from
 * @param path the resolved path element, or null if unknown
 */
public record SelectedNode(String displayId, String sourcePathId,
        PathElement path) {

    /**
     * Creates a selected node.
     *
     * @param displayId the display id
     * @param sourcePathId the schema id
     * @param path the path element (may be null)
     */
    public SelectedNode {
        Objects.requireNonNull(displayId, "displayId");
        sourcePathId = sourcePathId == null ? "" : sourcePathId;
    }

    /**
     * The resolved path element.
     *
     * @return the element, or empty if unresolved
     */
    public Optional<PathElement> pathElement() {
        return Optional.ofNullable(path);
    }

    /**
     * The property path of the node.
     *
     * @return the path tokens, empty if unresolved
     */
    public List<PathToken> propertyPath() {
        return path == null ? List.of() : path.propertyPath();
    }

    /**
     * Whether the node may occur more than once.
     *
     * @return the multiplicity flag, false if unresolved
     */
    public boolean isMultiple() {
        return path != null && path.multiple();
    }

    /**
     * Whether the node is an entity reference field.
     *
     * @return true if classified as reference
     */
    public boolean isEntityReference() {
        return path != null && path.isReference();
    }

    /**
     * Whether the node is a top-level model.
     *
     * @return true if classified as root
     */
    public boolean isRootModel() {
        return path != null
            && path.classification() == PathClassification.ROOT;
    }

    /**
     * Human readable name, flattened to one line: the path name, else the
     * source path id, else the display id.
     *
     * @return the display name
     */
    public String displayName() {
        String raw;
        if (path != null && !path.name().isBlank()) {
            raw = path.name();
        } else if (!sourcePathId.isBlank()) {
            raw = sourcePathId;
        } else {
            raw = displayId;
        }
        return raw.trim().replaceAll("\\s+", " ");
    }
}
