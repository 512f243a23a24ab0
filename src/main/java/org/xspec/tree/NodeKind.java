package org.xspec.tree;

/**
 * Kind of a spec node. Declaration order is the nesting depth used when attaching new nodes.
 */
public enum NodeKind {
    GIVEN("Given"),
    WHEN("When"),
    IT("It"),
    THE_EXCEPTION("The exception");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * A node placed with this precedence may only be attached beneath a node of a strictly shallower kind.
     */
    public boolean canNestUnder(NodeKind candidateParent) {
        return candidateParent.ordinal() < ordinal();
    }

    /**
     * Nodes of kind {@code IT} or deeper end a scenario.
     */
    public boolean endsScenario() {
        return compareTo(IT) >= 0;
    }

    /**
     * Fixture steps are the ones replayed to rebuild state.
     */
    public boolean isFixtureStep() {
        return compareTo(WHEN) <= 0;
    }
}
