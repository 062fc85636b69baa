package org.releven.query.build;

import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.sparql.core.Var;
import org.releven.query.model.SelectionGraph;
import org.releven.query.plan.CountSubgraphs;
import org.releven.query.plan.TraversalPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compiles count nodes into aggregate sub-queries.
 *
 * <p>Each count node's closure is built on its own together with its
 * boundary parent, with the count node as the central node. The sub-build's
 * variable for the boundary parent is renamed to the outer pattern's, and
 * sub-triples already present in the outer pattern are excluded. A count
 * whose triples are all excluded is dropped.</p>
 *
 * <p>Count aliases are unique across the query: an alias already taken by
 * an outer variable or an earlier count gets a numeric suffix.</p>
 */
public final class CountSubquerySynthesizer {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        CountSubquerySynthesizer.class);

    /** Suffix of the public count alias. */
    static final String COUNT_SUFFIX = "_count";

    /** Suffix of the raw count variable. */
    static final String RAW_SUFFIX = "_raw";

    private CountSubquerySynthesizer() {
        throw new AssertionError("No instances");
    }

    /**
     * Synthesize the count sub-queries of a selection.
     *
     * @param graph the full selection graph
     * @param counts the count subgraphs of the full graph
     * @param outerGraph the graph without the count closures
     * @param outer the outer pattern built from {@code outerGraph}
     * @param fullPrefixConstraints the prefix mode of the outer build
     * @param includeZeroCounts whether a missing count defaults to zero
     * @return the sub-queries in count declaration order
     */
    public static List<CountSubquery> synthesize(final SelectionGraph graph,
            final CountSubgraphs counts, final SelectionGraph outerGraph,
            final PatternBuild outer, final boolean fullPrefixConstraints,
            final boolean includeZeroCounts) {
        if (counts.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> fullDepths =
            TraversalPlanner.computeDepths(graph);
        Set<String> takenNames = outerVariableNames(outer);
        List<CountSubquery> result = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry
                : counts.closures().entrySet()) {
            synthesize(graph, counts, outerGraph, outer,
                fullPrefixConstraints, includeZeroCounts, fullDepths,
                entry.getKey(), entry.getValue(), takenNames)
                .ifPresent(result::add);
        }
        return List.copyOf(result);
    }

    private static Optional<CountSubquery> synthesize(
            final SelectionGraph graph, final CountSubgraphs counts,
            final SelectionGraph outerGraph, final PatternBuild outer,
            final boolean fullPrefixConstraints,
            final boolean includeZeroCounts,
            final Map<String, Integer> fullDepths, final String countId,
            final Set<String> closure, final Set<String> takenNames) {
        String parentId = counts.boundaryParentOf(countId).orElse(null);
        if (parentId != null && !outerGraph.contains(parentId)) {
            // nested inside another count's closure
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Skipping count {}: parent {} is counted",
                    countId, parentId);
            }
            return Optional.empty();
        }

        Set<String> ids = new LinkedHashSet<>(closure);
        if (parentId != null) {
            ids.add(parentId);
        }
        PatternBuild sub = PatternBuilder.build(
            graph.subgraph(ids, countId), fullPrefixConstraints);
        Optional<String> countVariable = sub.selectVariableOf(countId);
        if (countVariable.isEmpty()) {
            return Optional.empty();
        }

        String outerParentVariable = parentId == null ? null
            : outer.selectVariableOf(parentId).orElse(null);
        String subParentVariable = parentId == null ? null
            : sub.selectVariableOf(parentId).orElse(null);
        if (outerParentVariable != null && subParentVariable != null
                && !outerParentVariable.equals(subParentVariable)) {
            sub = sub.remap(Map.of(Var.alloc(subParentVariable),
                Var.alloc(outerParentVariable)));
        }

        Set<Triple> excluded = new LinkedHashSet<>();
        for (Triple key : sub.tripleKeys()) {
            if (outer.tripleKeys().contains(key)) {
                excluded.add(key);
            }
        }
        if (excluded.size() == sub.tripleKeys().size()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Dropping count {}: nothing left to match",
                    countId);
            }
            return Optional.empty();
        }

        String parentName = parentId == null ? ""
            : PatternBuilder.nameOf(graph, parentId);
        String countName = PatternBuilder.nameOf(graph, countId);
        Set<String> suppressed = new LinkedHashSet<>();
        for (String arrow : List.of(BridgeResolver.PLAIN_ARROW,
                BridgeResolver.FORWARD_REFERENCE_ARROW,
                BridgeResolver.UPSTREAM_REFERENCE_ARROW)) {
            suppressed.add(BridgeResolver.transitionText(parentName, arrow,
                countName));
        }

        String alias = uniqueAlias(countVariable.get() + COUNT_SUFFIX,
            takenNames);
        String rawAlias = alias + RAW_SUFFIX;
        takenNames.add(alias);
        takenNames.add(rawAlias);
        int depth = fullDepths.getOrDefault(countId, 0);
        SelectProjection projection = includeZeroCounts
            ? SelectProjection.coalesced(alias, rawAlias, depth)
            : SelectProjection.of(rawAlias, depth, false);

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Count {} over ?{} grouped by {}: {} of {} triples "
                + "excluded", countId, countVariable.get(),
                outerParentVariable, excluded.size(), sub.tripleKeys().size());
        }
        return Optional.of(new CountSubquery(countId, sub,
            Collections.unmodifiableSet(excluded), countVariable.get(),
            rawAlias, outerParentVariable,
            BridgeResolver.transitionText(parentName,
                BridgeResolver.PLAIN_ARROW, countName),
            Collections.unmodifiableSet(suppressed), projection,
            includeZeroCounts));
    }

    /**
     * The first of {@code base}, {@code base_2}, {@code base_3}, ... such
     * that neither it nor its raw form is taken.
     */
    static String uniqueAlias(final String base, final Set<String> taken) {
        String alias = base;
        int suffix = 2;
        while (taken.contains(alias) || taken.contains(alias + RAW_SUFFIX)) {
            alias = base + "_" + suffix++;
        }
        return alias;
    }

    private static Set<String> outerVariableNames(final PatternBuild outer) {
        Set<String> names = new LinkedHashSet<>();
        for (SelectProjection projection : outer.projections()) {
            names.add(projection.variableName());
        }
        for (Triple key : outer.tripleKeys()) {
            for (Node node : List.of(key.getSubject(), key.getPredicate(),
                    key.getObject())) {
                if (node.isVariable()) {
                    names.add(node.getName());
                }
            }
        }
        return names;
    }
}
