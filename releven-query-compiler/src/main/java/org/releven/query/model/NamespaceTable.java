package org.releven.query.model;

import org.apache.jena.sys.JenaSystem;
import org.apache.jena.vocabulary.RDF;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ordered namespace table used to compact IRIs in rendered queries.
 *
 * <p>The first namespace whose IRI is a prefix of a value wins. A value is
 * only compacted when the remaining local part is a valid SPARQL local
 * name; otherwise it is rendered in full {@code <iri>} form.</p>
 */
public final class NamespaceTable {

    static {
        // initialise Jena before any vocabulary class loads
        JenaSystem.init();
    }

    /** Compacted form of {@code rdf:type}. */
    public static final String RDF_TYPE_KEYWORD = "a";

    /** Local names accepted in prefixed names. */
    private static final Pattern LOCAL_NAME = Pattern.compile(
        "([A-Za-z0-9_]([A-Za-z0-9_.\\-]*[A-Za-z0-9_\\-])?)?");

    /** Default table of the project ontologies. */
    private static final NamespaceTable DEFAULTS = builder()
        .add("aaao", "https://ontology.swissartresearch.net/aaao/")
        .add("crm", "http://www.cidoc-crm.org/cidoc-crm/")
        .add("lrmoo", "http://iflastandards.info/ns/lrm/lrmoo/")
        .add("owl", "http://www.w3.org/2002/07/owl#")
        .add("rdfschema", "http://www.w3.org/2000/01/rdf-schema#")
        .add("star", "https://r11.eu/ns/star/")
        .add("skos", "http://www.w3.org/2004/02/skos/core#")
        .add("r11", "https://r11.eu/ns/spec/")
        .add("r11pros", "https://r11.eu/ns/prosopography/")
        .add("pwro", "https://ontology.swissartresearch.net/pwro/")
        .build();

    /**
     * A namespace entry.
     *
     * @param prefix the prefix label, without colon
     * @param iri the namespace IRI
     */
    public record Namespace(String prefix, String iri) {
        /**
         * Creates a namespace entry.
         *
         * @param prefix the prefix label
         * @param iri the namespace IRI
         */
        public Namespace {
            Objects.requireNonNull(prefix, "prefix");
            Objects.requireNonNull(iri, "iri");
        }

        /**
         * The SPARQL declaration of this namespace.
         *
         * @return e.g. {@code PREFIX crm: <http://...>}
         */
        public String declaration() {
            return "PREFIX " + prefix + ": <" + iri + ">";
        }
    }

    /** Entries in match order. */
    private final List<Namespace> namespaces;

    private NamespaceTable(final List<Namespace> entries) {
        this.namespaces = List.copyOf(entries);
    }

    /**
     * The default project namespace table.
     *
     * @return the default table
     */
    public static NamespaceTable defaults() {
        return DEFAULTS;
    }

    /**
     * An empty table; every IRI renders in full form.
     *
     * @return the empty table
     */
    public static NamespaceTable empty() {
        return new NamespaceTable(List.of());
    }

    /**
     * Entries in match order.
     *
     * @return the namespaces
     */
    public List<Namespace> namespaces() {
        return namespaces;
    }

    /**
     * The namespace a value compacts against.
     *
     * @param iri the full IRI
     * @return the namespace, or empty if the value is rendered in full
     */
    public Optional<Namespace> namespaceFor(final String iri) {
        for (Namespace namespace : namespaces) {
            if (iri.startsWith(namespace.iri())) {
                String local = iri.substring(namespace.iri().length());
                if (LOCAL_NAME.matcher(local).matches()) {
                    return Optional.of(namespace);
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Render an IRI in its most compact form.
     *
     * @param iri the full IRI
     * @return {@code a} for rdf:type, a prefixed name, or {@code <iri>}
     */
    public String compact(final String iri) {
        if (RDF.type.getURI().equals(iri)) {
            return RDF_TYPE_KEYWORD;
        }
        Optional<Namespace> namespace = namespaceFor(iri);
        if (namespace.isPresent()) {
            return namespace.get().prefix() + ":"
                + iri.substring(namespace.get().iri().length());
        }
        return "<" + iri + ">";
    }

    /**
     * Obtain a builder for a custom table.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link NamespaceTable}.
     */
    public static class Builder {
        /** Entries collected so far. */
        private final List<Namespace> entries = new ArrayList<>();

        /**
         * Creates an empty builder.
         */
        public Builder() {
            // Default constructor
        }

        /**
         * Append a namespace.
         *
         * @param prefix the prefix label
         * @param iri the namespace IRI
         * @return this builder
         */
        public Builder add(final String prefix, final String iri) {
            entries.add(new Namespace(prefix, iri));
            return this;
        }

        /**
         * Build the table.
         *
         * @return the table
         */
        public NamespaceTable build() {
            return new NamespaceTable(entries);
        }
    }
}
