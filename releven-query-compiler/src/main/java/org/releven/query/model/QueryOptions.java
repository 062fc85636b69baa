package org.releven.query.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Options controlling how a selection is compiled into a query.
 *
 * <p>Instances are immutable and created through {@link #builder()}.</p>
 */
public final class QueryOptions {

    /** Variable names accepted for ORDER BY. */
    private static final Pattern VARIABLE_NAME =
        Pattern.compile("[A-Za-z0-9_]+");

    /**
     * Sort direction of the ORDER BY clause.
     */
    public enum OrderDirection {
        /** Ascending. */
        ASC,
        /** Descending. */
        DESC
    }

    /** Count node display ids, in declaration order. */
    private final List<String> countNodeIds;

    /** Whether count blocks default missing matches to zero. */
    private final boolean includeZeroCountResults;

    /** Whether prefix variables are kept per node when allowed. */
    private final boolean includeFullPrefixConstraintsWhenCentralNotTopModel;

    /** ORDER BY variable name, or null. */
    private final String orderByVariableName;

    /** ORDER BY direction. */
    private final OrderDirection orderByDirection;

    /** LIMIT, or null. */
    private final Integer limit;

    /** Namespace table for IRI compaction. */
    private final NamespaceTable namespaces;

    private QueryOptions(final Builder builder) {
        this.countNodeIds = List.copyOf(builder.countNodeIds);
        this.includeZeroCountResults = builder.includeZeroCountResults;
        this.includeFullPrefixConstraintsWhenCentralNotTopModel =
            builder.includeFullPrefixConstraints;
        this.orderByVariableName = builder.orderByVariableName;
        this.orderByDirection = builder.orderByDirection;
        this.limit = builder.limit;
        this.namespaces = builder.namespaces;
    }

    /**
     * Options with every default.
     *
     * @return the default options
     */
    public static QueryOptions defaults() {
        return builder().build();
    }

    /**
     * Count node display ids.
     *
     * @return the ids, without duplicates
     */
    public List<String> countNodeIds() {
        return countNodeIds;
    }

    /**
     * Whether count blocks are optional and coalesced to zero.
     *
     * @return the flag
     */
    public boolean includeZeroCountResults() {
        return includeZeroCountResults;
    }

    /**
     * Whether full prefix constraints are requested. They only apply when
     * the central node is not a top-level model.
     *
     * @return the requested flag
     */
    public boolean includeFullPrefixConstraintsWhenCentralNotTopModel() {
        return includeFullPrefixConstraintsWhenCentralNotTopModel;
    }

    /**
     * The ORDER BY variable.
     *
     * @return the variable name without {@code ?}, or empty
     */
    public Optional<String> orderByVariableName() {
        return Optional.ofNullable(orderByVariableName);
    }

    /**
     * The ORDER BY direction.
     *
     * @return the direction
     */
    public OrderDirection orderByDirection() {
        return orderByDirection;
    }

    /**
     * The LIMIT.
     *
     * @return the limit, or empty
     */
    public Optional<Integer> limit() {
        return Optional.ofNullable(limit);
    }

    /**
     * The namespace table.
     *
     * @return the table
     */
    public NamespaceTable namespaces() {
        return namespaces;
    }

    /**
     * Obtain a {@link Builder}.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link QueryOptions}.
     */
    public static class Builder {
        /** Count node ids. */
        private final LinkedHashSet<String> countNodeIds =
            new LinkedHashSet<>();
        /** Zero count flag. */
        private boolean includeZeroCountResults = false;
        /** Full prefix flag. */
        private boolean includeFullPrefixConstraints = false;
        /** ORDER BY variable. */
        private String orderByVariableName = null;
        /** ORDER BY direction. */
        private OrderDirection orderByDirection = OrderDirection.DESC;
        /** LIMIT. */
        private Integer limit = null;
        /** Namespace table. */
        private NamespaceTable namespaces = NamespaceTable.defaults();

        /**
         * Creates a builder with default settings.
         */
        public Builder() {
            // Default constructor
        }

        /**
         * Add count nodes.
         *
         * @param displayIds the display ids of nodes to aggregate
         * @return this builder
         */
        public Builder countNodes(final String... displayIds) {
            for (String id : displayIds) {
                countNodeIds.add(Objects.requireNonNull(id, "displayId"));
            }
            return this;
        }

        /**
         * Add count nodes.
         *
         * @param displayIds the display ids of nodes to aggregate
         * @return this builder
         */
        public Builder countNodes(final Iterable<String> displayIds) {
            for (String id : displayIds) {
                countNodeIds.add(Objects.requireNonNull(id, "displayId"));
            }
            return this;
        }

        /**
         * Set whether count blocks default missing matches to zero.
         *
         * @param value the flag
         * @return this builder
         */
        public Builder includeZeroCountResults(final boolean value) {
            this.includeZeroCountResults = value;
            return this;
        }

        /**
         * Set whether prefix variables are kept per node when the central
         * node is not a top-level model.
         *
         * @param value the flag
         * @return this builder
         */
        public Builder includeFullPrefixConstraints(final boolean value) {
            this.includeFullPrefixConstraints = value;
            return this;
        }

        /**
         * Order results by a projected variable.
         *
         * @param variableName the variable name, with or without {@code ?}
         * @param direction the sort direction
         * @return this builder
         * @throws IllegalArgumentException if the name is not a valid
         *     variable name
         */
        public Builder orderBy(final String variableName,
                final OrderDirection direction) {
            String name = variableName == null ? "" : variableName.trim();
            if (name.startsWith("?")) {
                name = name.substring(1);
            }
            if (!VARIABLE_NAME.matcher(name).matches()) {
                throw new IllegalArgumentException(
                    "Invalid ORDER BY variable: " + variableName);
            }
            this.orderByVariableName = name;
            this.orderByDirection = Objects.requireNonNull(direction,
                "direction");
            return this;
        }

        /**
         * Limit the number of results.
         *
         * @param value a positive limit
         * @return this builder
         * @throws IllegalArgumentException if the limit is not positive
         */
        public Builder limit(final int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(
                    "Limit must be positive: " + value);
            }
            this.limit = value;
            return this;
        }

        /**
         * Set the namespace table.
         *
         * @param value the table
         * @return this builder
         */
        public Builder namespaces(final NamespaceTable value) {
            this.namespaces = Objects.requireNonNull(value, "namespaces");
            return this;
        }

        /**
         * Build the options.
         *
         * @return the options
         */
        public QueryOptions build() {
            return new QueryOptions(this);
        }
    }
}
