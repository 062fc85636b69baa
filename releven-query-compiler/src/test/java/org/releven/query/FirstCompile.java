package org.releven.query;

import org.releven.query.model.SelectionGraph;

/**
 * Compiles a small selection as the first thing a new JVM does, so that
 * nothing else has loaded Jena beforehand.
 */
public final class FirstCompile {

    private FirstCompile() {
        throw new AssertionError("No instances");
    }

    /**
     * Entry point; exits non-zero if compilation throws.
     *
     * @param args ignored
     */
    public static void main(final String[] args) {
        SelectionGraph graph = SelectionGraph.builder(Main.demoPathModel())
            .node("person")
            .node("person_name")
            .edge("person", "person_name")
            .central("person")
            .build();
        System.out.println(SelectionQueryCompiler.compile(graph).text());
    }
}
