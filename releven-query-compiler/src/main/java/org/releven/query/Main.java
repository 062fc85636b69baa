package org.releven.query;

import org.releven.query.model.InMemoryPathModel;
import org.releven.query.model.PathClassification;
import org.releven.query.model.PathElement;
import org.releven.query.model.QueryOptions;
import org.releven.query.model.SelectionGraph;
import org.releven.query.tracing.TracingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple demo application that compiles a small person selection and logs
 * the resulting query.
 * <p>
 * Options can be configured via environment variables:
 * <ul>
 *   <li>RELEVEN_INCLUDE_ZERO_COUNTS - default missing counts to zero
 *       (default: false)</li>
 *   <li>RELEVEN_FULL_PREFIX - keep path prefixes per node
 *       (default: false)</li>
 *   <li>RELEVEN_QUERY_LIMIT - result limit (default: none)</li>
 * </ul>
 */
public final class Main {
    /** Logger instance for this class. */
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    /** Environment variable name for zero count results. */
    private static final String ENV_INCLUDE_ZERO_COUNTS =
        "RELEVEN_INCLUDE_ZERO_COUNTS";

    /** Environment variable name for full prefix constraints. */
    private static final String ENV_FULL_PREFIX = "RELEVEN_FULL_PREFIX";

    /** Environment variable name for the result limit. */
    private static final String ENV_LIMIT = "RELEVEN_QUERY_LIMIT";

    /** CIDOC CRM namespace. */
    private static final String CRM = "http://www.cidoc-crm.org/cidoc-crm/";

    /** Prevent instantiation of this utility/demo class. */
    private Main() {
        throw new AssertionError("No instances");
    }

    /**
     * Demo entry point.
     *
     * @param args command line arguments (ignored)
     */
    public static void main(final String[] args) {
        boolean includeZeroCounts = Boolean.parseBoolean(
            System.getenv(ENV_INCLUDE_ZERO_COUNTS));
        boolean fullPrefix = Boolean.parseBoolean(
            System.getenv(ENV_FULL_PREFIX));

        try {
            runDemo(includeZeroCounts, fullPrefix,
                parseLimit(System.getenv(ENV_LIMIT)));
        } catch (RuntimeException e) {
            if (LOGGER.isErrorEnabled()) {
                LOGGER.error("✗ Error: {}", e.getMessage());
            }
            LOGGER.error("Stack trace:", e);
        } finally {
            TracingUtil.shutdown();
        }
    }

    /**
     * Parse the result limit setting.
     *
     * @param value the raw setting, or null
     * @return the limit, or null when unset
     * @throws NumberFormatException if the value is not an integer
     */
    static Integer parseLimit(final String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Integer.parseInt(value.trim());
    }

    /**
     * Run the demo with the specified options.
     * This method is package-private to allow testing.
     *
     * @param includeZeroCounts whether missing counts default to zero
     * @param fullPrefix whether prefixes are kept per node
     * @param limit the result limit, or null
     * @return the compiled query text
     */
    static String runDemo(final boolean includeZeroCounts,
            final boolean fullPrefix, final Integer limit) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Selection Query Compiler Demo");
            LOGGER.info("===============================================");
        }

        SelectionGraph graph = SelectionGraph.builder(demoPathModel())
            .node("person")
            .node("person_name")
            .node("person_birth")
            .node("person_birth_date")
            .node("person_membership")
            .node("person_membership_name")
            .edge("person", "person_name")
            .edge("person", "person_birth")
            .edge("person_birth", "person_birth_date")
            .edge("person", "person_membership")
            .edge("person_membership", "person_membership_name")
            .central("person")
            .build();

        QueryOptions.Builder options = QueryOptions.builder()
            .countNodes("person_membership")
            .includeZeroCountResults(includeZeroCounts)
            .includeFullPrefixConstraints(fullPrefix)
            .orderBy(includeZeroCounts
                ? "person_membership_node_count"
                : "person_membership_node_count_raw",
                QueryOptions.OrderDirection.DESC);
        if (limit != null) {
            options.limit(limit);
        }

        SelectionQueryCompiler.CompiledQuery compiled =
            SelectionQueryCompiler.compile(graph, options.build());
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Projected variables: {}",
                compiled.projectedVariables());
            LOGGER.info("\n{}", compiled.text());
            LOGGER.info("✓ Query compiled and validated");
        }
        return compiled.text();
    }

    /**
     * A small person model: name, birth date and group memberships.
     *
     * @return the path model
     */
    static InMemoryPathModel demoPathModel() {
        return InMemoryPathModel.builder()
            .add(PathElement.builder("person")
                .name("Person")
                .type(CRM + "E21_Person")
                .classification(PathClassification.ROOT)
                .path(CRM + "E21_Person")
                .build())
            .add(PathElement.builder("person_name")
                .name("Name")
                .parent("person")
                .path(CRM + "E21_Person", CRM + "P1_is_identified_by",
                    CRM + "E41_Appellation", CRM + "P190_has_symbolic_content")
                .build())
            .add(PathElement.builder("person_birth")
                .name("Birth")
                .parent("person")
                .classification(PathClassification.GROUP)
                .path(CRM + "E21_Person", "^" + CRM + "P98_brought_into_life",
                    CRM + "E67_Birth")
                .build())
            .add(PathElement.builder("person_birth_date")
                .name("Birth date")
                .parent("person_birth")
                .path(CRM + "E21_Person", "^" + CRM + "P98_brought_into_life",
                    CRM + "E67_Birth", CRM + "P4_has_time-span",
                    CRM + "E52_Time-Span", CRM + "P82a_begin_of_the_begin")
                .build())
            .add(PathElement.builder("person_membership")
                .name("Membership")
                .parent("person")
                .multiple(true)
                .classification(PathClassification.GROUP)
                .path(CRM + "E21_Person",
                    "^" + CRM + "P107_has_current_or_former_member",
                    CRM + "E74_Group")
                .build())
            .add(PathElement.builder("person_membership_name")
                .name("Group name")
                .parent("person_membership")
                .path(CRM + "E21_Person",
                    "^" + CRM + "P107_has_current_or_former_member",
                    CRM + "E74_Group", CRM + "P1_is_identified_by",
                    CRM + "E41_Appellation", CRM + "P190_has_symbolic_content")
                .build())
            .build();
    }
}
