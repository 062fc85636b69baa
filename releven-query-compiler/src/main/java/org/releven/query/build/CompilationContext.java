package org.releven.query.build;

import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.releven.query.plan.TraversalPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of a single pattern build. A context is created for one
 * build, never shared, and frozen into a {@link PatternBuild} at the end.
 */
final class CompilationContext {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        CompilationContext.class);

    /** Prefix of emission ids. */
    private static final String EMISSION_ID_PREFIX = "e";

    /** Unique triples in insertion order. */
    private final Map<Triple, TripleRecord> records = new LinkedHashMap<>();

    /** Emission log, one entry per request. */
    private final List<TripleEmission> emissions = new ArrayList<>();

    /** Prefix variable cache. */
    private final Map<PrefixKey, String> prefixVariables = new HashMap<>();

    /** Names handed out by the prefix variable cache. */
    private final Set<String> allocatedNames = new HashSet<>();

    /** Resolved select variable per display id. */
    private final Map<String, String> selectVariables = new LinkedHashMap<>();

    /** First emission id per display id. */
    private final Map<String, String> firstEmissions = new HashMap<>();

    /** Comments per emission id. */
    private final Map<String, List<EmissionComment>> comments =
        new HashMap<>();

    /** Next emission number. */
    private int emissionCounter;

    /**
     * Record a request for a triple.
     *
     * <p>A new key creates a {@link TripleRecord}; a known key keeps the
     * smaller depth. Either way an emission is appended.</p>
     *
     * @param subject the subject
     * @param predicate the predicate
     * @param object the object
     * @param depth the requested depth, clamped to 0
     * @param ownerDisplayId the owning node, or null
     * @return the id of the new emission
     */
    String addTriple(final Node subject, final Node predicate,
            final Node object, final int depth, final String ownerDisplayId) {
        Triple key = Triple.create(subject, predicate, object);
        int normalized = Math.max(0, depth);
        String emissionId = EMISSION_ID_PREFIX + emissionCounter;
        emissionCounter++;

        TripleRecord existing = records.get(key);
        if (existing == null) {
            records.put(key, new TripleRecord(key, normalized));
        } else {
            existing.lowerDepth(normalized);
        }
        emissions.add(new TripleEmission(emissionId, key, normalized,
            ownerDisplayId));
        return emissionId;
    }

    /**
     * Move an emission immediately before another one. Unknown ids leave
     * the log unchanged.
     *
     * @param emissionId the emission to move
     * @param anchorId the emission it must precede
     */
    void moveBefore(final String emissionId, final String anchorId) {
        if (emissionId.equals(anchorId)) {
            return;
        }
        int from = indexOf(emissionId);
        if (from < 0 || indexOf(anchorId) < 0) {
            return;
        }
        TripleEmission moved = emissions.remove(from);
        emissions.add(indexOf(anchorId), moved);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Moved emission {} before {}", emissionId, anchorId);
        }
    }

    private int indexOf(final String emissionId) {
        for (int i = 0; i < emissions.size(); i++) {
            if (emissions.get(i).id().equals(emissionId)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Look up or allocate the variable of a path prefix.
     *
     * <p>On a miss the preferred name is used if free, otherwise
     * {@code preferred_suffix_N} with N counting up from 2.</p>
     *
     * @param key the prefix key
     * @param preferredName the preferred variable name
     * @param fallbackSuffix the suffix used on collisions
     * @return the variable name
     */
    String prefixVariable(final PrefixKey key, final String preferredName,
            final String fallbackSuffix) {
        String existing = prefixVariables.get(key);
        if (existing != null) {
            return existing;
        }
        String candidate = preferredName;
        int index = 1;
        while (allocatedNames.contains(candidate)) {
            index++;
            candidate = preferredName + "_" + fallbackSuffix + "_" + index;
        }
        prefixVariables.put(key, candidate);
        allocatedNames.add(candidate);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Allocated ?{} for {}", candidate, key);
        }
        return candidate;
    }

    /**
     * Attach a comment to an emission; repeated comments are ignored.
     *
     * @param emissionId the emission id
     * @param comment the comment
     */
    void addComment(final String emissionId, final EmissionComment comment) {
        List<EmissionComment> entries = comments.computeIfAbsent(emissionId,
            k -> new ArrayList<>());
        if (!entries.contains(comment)) {
            entries.add(comment);
        }
    }

    void markFirstEmission(final String displayId, final String emissionId) {
        firstEmissions.putIfAbsent(displayId, emissionId);
    }

    Optional<String> firstEmissionOf(final String displayId) {
        return Optional.ofNullable(firstEmissions.get(displayId));
    }

    void resolveSelectVariable(final String displayId,
            final String variableName) {
        selectVariables.put(displayId, variableName);
    }

    Optional<String> selectVariableOf(final String displayId) {
        return Optional.ofNullable(selectVariables.get(displayId));
    }

    /**
     * Freeze the state into a build result.
     *
     * @param plan the traversal plan the build followed
     * @param projections the select projections
     * @return the build
     */
    PatternBuild toBuild(final TraversalPlan plan,
            final List<SelectProjection> projections) {
        Map<String, List<EmissionComment>> frozenComments = new HashMap<>();
        comments.forEach((id, list) -> frozenComments.put(id,
            List.copyOf(list)));
        return new PatternBuild(plan,
            Collections.unmodifiableMap(new LinkedHashMap<>(records)),
            List.copyOf(emissions),
            Collections.unmodifiableMap(frozenComments),
            List.copyOf(projections),
            Collections.unmodifiableMap(new LinkedHashMap<>(selectVariables)));
    }
}
