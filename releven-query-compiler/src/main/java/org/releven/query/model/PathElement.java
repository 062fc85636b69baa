package org.releven.query.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A schema path element: a node of the schema tree with its type, its
 * multiplicity, its classification and the property path that leads from a
 * root class to its value.
 *
 * <p>The property path alternates class tokens (even indices) and predicate
 * tokens (odd indices). Instances are immutable.</p>
 *
 * @param id the schema id
 * @param typeIri the class or datatype IRI of the element (may be empty)
 * @param multiple whether the element may occur more than once
 * @param classification the element classification
 * @param name the human readable name (may be empty)
 * @param parentId the id of the parent element (may be null)
 * @param propertyPath the property path tokens
 */
public record PathElement(
        String id,
        String typeIri,
        boolean multiple,
        PathClassification classification,
        String name,
        String parentId,
        List<PathToken> propertyPath) {

    /**
     * Creates a path element, normalising null collections and strings.
     *
     * @param id the schema id
     * @param typeIri the type IRI
     * @param multiple the multiplicity flag
     * @param classification the classification
     * @param name the name
     * @param parentId the parent id
     * @param propertyPath the property path
     */
    public PathElement {
        Objects.requireNonNull(id, "id");
        typeIri = typeIri == null ? "" : typeIri;
        classification = classification == null
            ? PathClassification.FIELD : classification;
        name = name == null ? "" : name;
        propertyPath = propertyPath == null
            ? List.of() : List.copyOf(propertyPath);
    }

    /**
     * Class tokens of the property path (even indices).
     *
     * @return the class tokens in path order
     */
    public List<PathToken> classes() {
        List<PathToken> classes = new ArrayList<>();
        for (int i = 0; i < propertyPath.size(); i += 2) {
            classes.add(propertyPath.get(i));
        }
        return classes;
    }

    /**
     * Predicate tokens of the property path (odd indices).
     *
     * @return the predicate tokens in path order
     */
    public List<PathToken> predicates() {
        List<PathToken> predicates = new ArrayList<>();
        for (int i = 1; i < propertyPath.size(); i += 2) {
            predicates.add(propertyPath.get(i));
        }
        return predicates;
    }

    /**
     * The last predicate of the property path, used to bridge a reference
     * boundary.
     *
     * @return the last predicate, or empty if the path has none
     */
    public Optional<PathToken> lastPredicate() {
        List<PathToken> predicates = predicates();
        if (predicates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(predicates.get(predicates.size() - 1));
    }

    /**
     * Whether this element is an entity reference field.
     *
     * @return true for {@link PathClassification#REFERENCE}
     */
    public boolean isReference() {
        return classification == PathClassification.REFERENCE;
    }

    /**
     * Obtain a builder for a path element.
     *
     * @param id the schema id
     * @return a new builder
     */
    public static Builder builder(final String id) {
        return new Builder(id);
    }

    /**
     * Builder for {@link PathElement}.
     */
    public static class Builder {
        /** Schema id. */
        private final String id;
        /** Type IRI. */
        private String typeIri = "";
        /** Multiplicity flag. */
        private boolean multiple = false;
        /** Classification. */
        private PathClassification classification = PathClassification.FIELD;
        /** Display name. */
        private String name = "";
        /** Parent id. */
        private String parentId = null;
        /** Property path tokens. */
        private final List<PathToken> propertyPath = new ArrayList<>();

        /**
         * Creates a builder for the given id.
         *
         * @param value the schema id
         */
        public Builder(final String value) {
            this.id = value;
        }

        /**
         * Set the type IRI.
         *
         * @param value the type IRI
         * @return this builder
         */
        public Builder type(final String value) {
            this.typeIri = value;
            return this;
        }

        /**
         * Set the multiplicity flag.
         *
         * @param value true if the element may occur more than once
         * @return this builder
         */
        public Builder multiple(final boolean value) {
            this.multiple = value;
            return this;
        }

        /**
         * Set the classification.
         *
         * @param value the classification
         * @return this builder
         */
        public Builder classification(final PathClassification value) {
            this.classification = value;
            return this;
        }

        /**
         * Set the display name.
         *
         * @param value the name
         * @return this builder
         */
        public Builder name(final String value) {
            this.name = value;
            return this;
        }

        /**
         * Set the parent id.
         *
         * @param value the parent id
         * @return this builder
         */
        public Builder parent(final String value) {
            this.parentId = value;
            return this;
        }

        /**
         * Set the property path from raw tokens. Blank tokens are dropped.
         *
         * @param rawTokens alternating class and predicate tokens
         * @return this builder
         */
        public Builder path(final String... rawTokens) {
            propertyPath.clear();
            for (String raw : rawTokens) {
                if (raw != null && !raw.isBlank()) {
                    propertyPath.add(PathToken.parse(raw));
                }
            }
            return this;
        }

        /**
         * Build the path element.
         *
         * @return the path element
         */
        public PathElement build() {
            return new PathElement(id, typeIri, multiple, classification,
                name, parentId, propertyPath);
        }
    }
}
