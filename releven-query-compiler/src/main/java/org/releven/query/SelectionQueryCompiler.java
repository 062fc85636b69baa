package org.releven.query;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.query.QueryException;
import org.apache.jena.query.Syntax;
import org.apache.jena.sys.JenaSystem;
import org.releven.query.build.CountSubquery;
import org.releven.query.build.CountSubquerySynthesizer;
import org.releven.query.build.PatternBuild;
import org.releven.query.build.PatternBuilder;
import org.releven.query.build.SelectProjection;
import org.releven.query.model.QueryOptions;
import org.releven.query.model.SelectedNode;
import org.releven.query.model.SelectionGraph;
import org.releven.query.plan.CountSubgraphPlanner;
import org.releven.query.plan.CountSubgraphs;
import org.releven.query.render.QueryRenderer;
import org.releven.query.tracing.TracingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Compiles a selection graph into a SPARQL 1.1 SELECT query.
 *
 * <p>Compilation is a pure function of the graph and the options. Count
 * nodes and everything behind them are split off first; the remaining
 * selection is built into one deduplicated pattern, each count closure
 * into an aggregate sub-query, and the result is rendered and validated
 * with Jena's SPARQL 1.1 parser.</p>
 *
 * <h2>Example:</h2>
 * <pre>{@code
 * SelectionGraph graph = SelectionGraph.builder(pathModel)
 *     .node("person")
 *     .node("person_name")
 *     .edge("person", "person_name")
 *     .central("person")
 *     .build();
 * CompiledQuery compiled = SelectionQueryCompiler.compile(graph,
 *     QueryOptions.builder().limit(100).build());
 * }</pre>
 */
public final class SelectionQueryCompiler {

    static {
        // initialise Jena before any vocabulary class loads
        JenaSystem.init();
    }

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SelectionQueryCompiler.class);

    /** Tracer for compiler operations. */
    private static final Tracer TRACER = TracingUtil.getTracer(
        TracingUtil.SCOPE_COMPILER);

    /** Attribute key for the number of selected nodes. */
    private static final AttributeKey<Long> ATTR_NODE_COUNT =
        AttributeKey.longKey("releven.selection.node_count");

    /** Attribute key for the number of selected edges. */
    private static final AttributeKey<Long> ATTR_EDGE_COUNT =
        AttributeKey.longKey("releven.selection.edge_count");

    /** Attribute key for the number of count nodes. */
    private static final AttributeKey<Long> ATTR_COUNT_NODE_COUNT =
        AttributeKey.longKey("releven.selection.count_node_count");

    /** Attribute key for the effective prefix mode. */
    private static final AttributeKey<Boolean> ATTR_FULL_PREFIX =
        AttributeKey.booleanKey("releven.query.full_prefix");

    /** Attribute key for the rendered query. */
    private static final AttributeKey<String> ATTR_QUERY =
        AttributeKey.stringKey("releven.query.text");

    /**
     * Result of a compilation.
     *
     * @param text the full query text, header comments included
     * @param query the parsed query
     * @param projectedVariables projected variable names in SELECT order
     */
    public record CompiledQuery(
            String text,
            Query query,
            List<String> projectedVariables) {
    }

    /**
     * Thrown when the rendered text is not a valid SPARQL 1.1 query. This
     * signals a defect in the compiler, never bad input.
     */
    public static class QueryValidationException
            extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        /** The rejected query text. */
        private final String queryText;

        /**
         * Constructs a new QueryValidationException.
         *
         * @param message the detail message
         * @param queryText the rejected query text
         * @param cause the parser failure
         */
        public QueryValidationException(final String message,
                final String queryText, final Throwable cause) {
            super(message, cause);
            this.queryText = queryText;
        }

        /**
         * The rejected query text.
         *
         * @return the text
         */
        public String getQueryText() {
            return queryText;
        }
    }

    /** Private constructor to prevent instantiation. */
    private SelectionQueryCompiler() {
        throw new AssertionError("No instances");
    }

    /**
     * Compile a selection with default options.
     *
     * @param graph the selection graph
     * @return the compiled query
     */
    public static CompiledQuery compile(final SelectionGraph graph) {
        return compile(graph, QueryOptions.defaults());
    }

    /**
     * Compile a selection.
     *
     * @param graph the selection graph
     * @param options the query options
     * @return the compiled query
     * @throws QueryValidationException if the rendered text does not parse
     */
    public static CompiledQuery compile(final SelectionGraph graph,
            final QueryOptions options) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(options, "options");
        boolean fullPrefix = isFullPrefixMode(graph, options);

        Span span = TRACER.spanBuilder("SelectionQueryCompiler.compile")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_NODE_COUNT, (long) graph.size())
            .setAttribute(ATTR_EDGE_COUNT, (long) graph.edges().size())
            .setAttribute(ATTR_COUNT_NODE_COUNT,
                (long) options.countNodeIds().size())
            .setAttribute(ATTR_FULL_PREFIX, fullPrefix)
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            CompiledQuery compiled = compile(graph, options, fullPrefix);
            span.setAttribute(ATTR_QUERY, compiled.text());
            span.setStatus(StatusCode.OK);
            return compiled;
        } catch (QueryValidationException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    private static CompiledQuery compile(final SelectionGraph graph,
            final QueryOptions options, final boolean fullPrefix) {
        CountSubgraphs counts = CountSubgraphPlanner.plan(graph,
            options.countNodeIds());
        Set<String> outerIds = new LinkedHashSet<>(graph.displayIds());
        outerIds.removeAll(counts.excludedFromOuter());
        SelectionGraph outerGraph = graph.subgraph(outerIds,
            graph.centralNodeId());

        PatternBuild outer = PatternBuilder.build(outerGraph, fullPrefix);
        List<CountSubquery> countQueries = CountSubquerySynthesizer
            .synthesize(graph, counts, outerGraph, outer, fullPrefix,
                options.includeZeroCountResults());

        String text = header(graph, fullPrefix) + "\n"
            + QueryRenderer.render(outer, countQueries, options);
        Query query = validate(text);

        List<String> projected = new ArrayList<>();
        for (SelectProjection projection
                : QueryRenderer.projections(outer, countQueries)) {
            projected.add(projection.variableName());
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Compiled {} nodes into:\n{}", graph.size(), text);
        }
        return new CompiledQuery(text, query, List.copyOf(projected));
    }

    /**
     * Whether prefix sharing is disabled for a compilation: only when
     * requested and the central node is not a top-level model.
     *
     * @param graph the selection graph
     * @param options the query options
     * @return true for full-prefix mode
     */
    static boolean isFullPrefixMode(final SelectionGraph graph,
            final QueryOptions options) {
        if (!options.includeFullPrefixConstraintsWhenCentralNotTopModel()) {
            return false;
        }
        return graph.startNodeId().flatMap(graph::node)
            .map(node -> !node.isRootModel())
            .orElse(false);
    }

    private static String header(final SelectionGraph graph,
            final boolean fullPrefix) {
        String central = graph.startNodeId().flatMap(graph::node)
            .map(SelectedNode::displayId).orElse("(none)");
        return String.join("\n",
            "# Auto-generated from the selected graph nodes",
            "# Central display node: " + central,
            graph.isEmpty() ? "# No selected graph nodes found"
                : "# Selected graph nodes: " + graph.size(),
            fullPrefix
                ? "# Full path prefix constraints are included per "
                    + "selected node."
                : "# Shared path prefixes are deduplicated in WHERE "
                    + "patterns.");
    }

    /**
     * Parse generated text as SPARQL 1.1. Both syntax errors and rejected
     * query structure (such as a projection bound twice) fail validation.
     *
     * @param text the query text
     * @return the parsed query
     * @throws QueryValidationException if Jena rejects the text
     */
    static Query validate(final String text) {
        try {
            return QueryFactory.create(text, Syntax.syntaxSPARQL_11);
        } catch (QueryException e) {
            LOGGER.error("Generated query is rejected: {}\n{}",
                e.getMessage(), text);
            throw new QueryValidationException(
                "Generated query is not valid SPARQL 1.1: " + e.getMessage(),
                text, e);
        }
    }
}
