package org.xspec.report;

import java.util.Objects;
import java.util.Optional;
import org.xspec.engine.ExecutionMode;

/**
 * Result of one spec run: verdict, rendered text and the per-node snapshot tree.
 */
public final class SpecReport {
    private final ExecutionMode mode;
    private final NodeReport root;
    private final String abortReason;
    private final String text;

    SpecReport(ExecutionMode mode, NodeReport root, String abortReason, String text) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.root = Objects.requireNonNull(root, "root");
        this.abortReason = abortReason;
        this.text = Objects.requireNonNull(text, "text");
    }

    public ExecutionMode mode() {
        return mode;
    }

    public NodeReport root() {
        return root;
    }

    public Optional<String> abortReason() {
        return Optional.ofNullable(abortReason);
    }

    public boolean passed() {
        return abortReason == null && root.passed();
    }

    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
