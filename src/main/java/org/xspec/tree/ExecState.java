package org.xspec.tree;

/**
 * Outcome of executing a node, ordered by severity.
 */
public enum ExecState {
    NOT_RUN("not run"),
    PASSED("ok"),
    FAILED("FAILED"),
    EXCEPTION("exception");

    private final String word;

    ExecState(String word) {
        this.word = word;
    }

    public String word() {
        return word;
    }

    public ExecState worst(ExecState other) {
        return other.compareTo(this) > 0 ? other : this;
    }
}
