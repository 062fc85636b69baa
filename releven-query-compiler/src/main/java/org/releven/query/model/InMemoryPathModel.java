package org.releven.query.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link PathModel} backed by an insertion-ordered map.
 */
public final class InMemoryPathModel implements PathModel {

    /** Elements by schema id. */
    private final Map<String, PathElement> byId;

    private InMemoryPathModel(final Map<String, PathElement> elements) {
        this.byId = Collections.unmodifiableMap(
            new LinkedHashMap<>(elements));
    }

    @Override
    public Optional<PathElement> find(final String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Elements whose parent id matches the given id, in insertion order.
     *
     * @param parentId the parent schema id
     * @return the child elements
     */
    public List<PathElement> childrenOf(final String parentId) {
        List<PathElement> children = new ArrayList<>();
        for (PathElement element : byId.values()) {
            if (parentId != null && parentId.equals(element.parentId())) {
                children.add(element);
            }
        }
        return children;
    }

    /**
     * Number of elements in the model.
     *
     * @return the element count
     */
    public int size() {
        return byId.size();
    }

    /**
     * Obtain a {@link Builder} to populate a model.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link InMemoryPathModel}.
     */
    public static class Builder {
        /** Elements collected so far. */
        private final Map<String, PathElement> elements =
            new LinkedHashMap<>();

        /**
         * Creates an empty builder.
         */
        public Builder() {
            // Default constructor
        }

        /**
         * Add an element. A later element with the same id replaces an
         * earlier one.
         *
         * @param element the element to add
         * @return this builder
         */
        public Builder add(final PathElement element) {
            elements.put(element.id(), element);
            return this;
        }

        /**
         * Build the model.
         *
         * @return the model
         */
        public InMemoryPathModel build() {
            return new InMemoryPathModel(elements);
        }
    }
}
