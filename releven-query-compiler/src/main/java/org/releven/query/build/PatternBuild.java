package org.releven.query.build;

import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.sparql.core.Var;
import org.releven.query.plan.TraversalPlan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Result of building the triple pattern of a selection graph.
 *
 * @param plan the traversal plan the build followed
 * @param records unique triples in first-request order
 * @param emissions the emission log in render order
 * @param comments comments per emission id
 * @param projections select projections, deduplicated by variable
 * @param selectVariables resolved select variable per display id
 */
public record PatternBuild(
        TraversalPlan plan,
        Map<Triple, TripleRecord> records,
        List<TripleEmission> emissions,
        Map<String, List<EmissionComment>> comments,
        List<SelectProjection> projections,
        Map<String, String> selectVariables) {

    /**
     * The select variable of a node.
     *
     * @param displayId the display id
     * @return the variable name, or empty if the node emitted nothing
     */
    public Optional<String> selectVariableOf(final String displayId) {
        return Optional.ofNullable(selectVariables.get(displayId));
    }

    /**
     * The structural keys of all triples.
     *
     * @return the keys
     */
    public Set<Triple> tripleKeys() {
        return records.keySet();
    }

    /**
     * Comments attached to an emission.
     *
     * @param emissionId the emission id
     * @return the comments, possibly empty
     */
    public List<EmissionComment> commentsOf(final String emissionId) {
        return comments.getOrDefault(emissionId, List.of());
    }

    /**
     * Optional chain of an emission owner.
     *
     * @param ownerDisplayId the owner, may be null
     * @return the chain, empty for unowned emissions
     */
    public List<String> optionalChainOf(final String ownerDisplayId) {
        if (ownerDisplayId == null) {
            return List.of();
        }
        return plan.optionalChainOf(ownerDisplayId);
    }

    /**
     * Rename variables throughout the build. Records that collapse onto the
     * same key keep the smaller depth.
     *
     * @param mapping variables to replace
     * @return the renamed build, or this build if the mapping is empty
     */
    public PatternBuild remap(final Map<Var, Var> mapping) {
        if (mapping.isEmpty()) {
            return this;
        }
        Map<Triple, TripleRecord> remappedRecords = new LinkedHashMap<>();
        for (TripleRecord record : records.values()) {
            Triple key = remap(record.triple(), mapping);
            TripleRecord existing = remappedRecords.get(key);
            if (existing == null) {
                remappedRecords.put(key, new TripleRecord(key,
                    record.depth()));
            } else {
                existing.lowerDepth(record.depth());
            }
        }

        List<TripleEmission> remappedEmissions = new ArrayList<>();
        for (TripleEmission emission : emissions) {
            remappedEmissions.add(emission.withKey(
                remap(emission.key(), mapping)));
        }

        Map<String, String> remappedVariables = new LinkedHashMap<>();
        selectVariables.forEach((id, name) ->
            remappedVariables.put(id, rename(name, mapping)));

        List<SelectProjection> remappedProjections = new ArrayList<>();
        for (SelectProjection projection : projections) {
            remappedProjections.add(new SelectProjection(
                rename(projection.variableName(), mapping),
                projection.depth(), projection.central(),
                projection.coalesceToZero(),
                projection.sourceVariableName() == null ? null
                    : rename(projection.sourceVariableName(), mapping)));
        }

        return new PatternBuild(plan,
            Collections.unmodifiableMap(remappedRecords),
            List.copyOf(remappedEmissions), comments,
            List.copyOf(remappedProjections),
            Collections.unmodifiableMap(remappedVariables));
    }

    private static Triple remap(final Triple triple,
            final Map<Var, Var> mapping) {
        return Triple.create(
            remap(triple.getSubject(), mapping),
            remap(triple.getPredicate(), mapping),
            remap(triple.getObject(), mapping));
    }

    private static Node remap(final Node node, final Map<Var, Var> mapping) {
        if (!node.isVariable()) {
            return node;
        }
        Var var = Var.alloc(node);
        return mapping.getOrDefault(var, var);
    }

    private static String rename(final String name,
            final Map<Var, Var> mapping) {
        Var replacement = mapping.get(Var.alloc(name));
        return replacement == null ? name : replacement.getVarName();
    }
}
