package org.releven.query.render;

import org.releven.query.build.CountSubquery;
import org.releven.query.build.PatternBuild;
import org.releven.query.build.SelectProjection;
import org.releven.query.model.NamespaceTable;
import org.releven.query.model.QueryOptions;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Assembles the final query text: prefix declarations, the SELECT
 * projection, the WHERE body with count blocks appended, then ORDER BY
 * and LIMIT.
 *
 * <p>Only namespaces referenced by a printed triple are declared, in table
 * order. An empty projection renders as {@code *}.</p>
 */
public final class QueryRenderer {

    /** Trailing comment of the central node's projection. */
    static final String CENTRAL_PROJECTION_COMMENT = "  # <<<<< central node";

    private QueryRenderer() {
        throw new AssertionError("No instances");
    }

    /**
     * All projections: the outer ones followed by the count aliases, keeping
     * the first projection of each variable.
     *
     * @param outer the outer build
     * @param counts the count sub-queries
     * @return the projections in SELECT order
     */
    public static List<SelectProjection> projections(final PatternBuild outer,
            final List<CountSubquery> counts) {
        List<SelectProjection> all = new ArrayList<>(outer.projections());
        for (CountSubquery count : counts) {
            all.add(count.projection());
        }
        Set<String> seen = new LinkedHashSet<>();
        List<SelectProjection> projections = new ArrayList<>();
        for (SelectProjection projection : all) {
            if (seen.add(projection.variableName())) {
                projections.add(projection);
            }
        }
        return projections;
    }

    /**
     * Render the query.
     *
     * @param outer the outer build
     * @param counts the count sub-queries
     * @param options the query options
     * @return the query text
     */
    public static String render(final PatternBuild outer,
            final List<CountSubquery> counts, final QueryOptions options) {
        NamespaceTable namespaces = options.namespaces();
        WhereRenderer.RenderedWhere where = WhereRenderer.render(outer,
            namespaces);
        Set<String> usedPrefixes = new LinkedHashSet<>(where.usedPrefixes());
        List<String> whereLines = new ArrayList<>(where.lines());

        for (CountSubquery count : counts) {
            WhereRenderer.RenderedWhere sub = WhereRenderer.render(
                count.build(), namespaces, count.excludedKeys(), false,
                count.suppressedComments());
            usedPrefixes.addAll(sub.usedPrefixes());
            if (!whereLines.isEmpty()) {
                whereLines.add("");
            }
            whereLines.addAll(countBlock(count, sub.lines()));
        }

        List<String> lines = new ArrayList<>();
        for (NamespaceTable.Namespace namespace : namespaces.namespaces()) {
            if (usedPrefixes.contains(namespace.prefix())) {
                lines.add(namespace.declaration());
            }
        }
        lines.add("");
        lines.add("SELECT DISTINCT");
        List<SelectProjection> projections = projections(outer, counts);
        if (projections.isEmpty()) {
            lines.add(WhereRenderer.INDENT + "*");
        }
        for (SelectProjection projection : projections) {
            lines.add(projectionLine(projection));
        }
        lines.add("WHERE {");
        lines.addAll(whereLines);
        lines.add("}");
        options.orderByVariableName().ifPresent(name -> lines.add(
            "ORDER BY " + options.orderByDirection().name() + "(?" + name
                + ")"));
        options.limit().ifPresent(limit -> lines.add("LIMIT " + limit));
        return String.join("\n", lines);
    }

    private static String projectionLine(final SelectProjection projection) {
        StringBuilder line = new StringBuilder(
            WhereRenderer.INDENT.repeat(projection.depth() + 1));
        if (projection.coalesceToZero()) {
            String source = projection.sourceVariableName() != null
                ? projection.sourceVariableName()
                : projection.variableName();
            line.append("(COALESCE(?").append(source).append(", 0) AS ?")
                .append(projection.variableName()).append(')');
        } else {
            line.append('?').append(projection.variableName());
        }
        if (projection.central()) {
            line.append(CENTRAL_PROJECTION_COMMENT);
        }
        return line.toString();
    }

    /**
     * Wrap rendered sub-pattern lines into an aggregate block.
     *
     * <pre>{@code
     *   # Parent > Count
     *   OPTIONAL {
     *     {
     *     SELECT ?parent (COUNT(DISTINCT ?c) AS ?c_count_raw)
     *       WHERE {
     *         ...
     *       }
     *       GROUP BY ?parent
     *     }
     *   }
     * }</pre>
     *
     * <p>Without zero coalescing the block is a plain group.</p>
     */
    static List<String> countBlock(final CountSubquery count,
            final List<String> subLines) {
        StringBuilder select = new StringBuilder("SELECT ");
        count.groupVariable().ifPresent(parent ->
            select.append('?').append(parent).append(' '));
        select.append("(COUNT(DISTINCT ?").append(count.countVariable())
            .append(") AS ?").append(count.rawAlias()).append(')');

        String indent = count.zeroCoalesced() ? "      " : "    ";
        List<String> block = new ArrayList<>();
        block.add("  " + count.comment());
        if (count.zeroCoalesced()) {
            block.add("  OPTIONAL {");
            block.add("    {");
        } else {
            block.add("  {");
        }
        block.add("    " + select);
        block.add(indent + "WHERE {");
        for (String line : subLines) {
            block.add(line.isEmpty() ? line : indent + line);
        }
        block.add(indent + "}");
        count.groupVariable().ifPresent(parent ->
            block.add(indent + "GROUP BY ?" + parent));
        if (count.zeroCoalesced()) {
            block.add("    }");
        }
        block.add("  }");
        return block;
    }
}
