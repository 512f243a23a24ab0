package org.xspec.engine;

import java.util.Objects;
import java.util.Optional;
import org.xspec.tree.SpecNode;

/**
 * Summary of one strategy run; per-node results live on the nodes themselves.
 */
public final class ExecutionOutcome {
    private final ExecutionMode mode;
    private final int scenarioCount;
    private final int passCount;
    private final SpecNode abortedAt;

    private ExecutionOutcome(ExecutionMode mode, int scenarioCount, int passCount, SpecNode abortedAt) {
        this.mode = Objects.requireNonNull(mode, "mode");
        if (scenarioCount < 0) {
            throw new IllegalArgumentException("scenarioCount must be >= 0");
        }
        if (passCount < 0) {
            throw new IllegalArgumentException("passCount must be >= 0");
        }
        this.scenarioCount = scenarioCount;
        this.passCount = passCount;
        this.abortedAt = abortedAt;
    }

    public static ExecutionOutcome completed(ExecutionMode mode, int scenarioCount, int passCount) {
        return new ExecutionOutcome(mode, scenarioCount, passCount, null);
    }

    public static ExecutionOutcome aborted(ExecutionMode mode, int scenarioCount, int passCount, SpecNode abortedAt) {
        return new ExecutionOutcome(mode, scenarioCount, passCount, Objects.requireNonNull(abortedAt, "abortedAt"));
    }

    public ExecutionMode mode() {
        return mode;
    }

    public int scenarioCount() {
        return scenarioCount;
    }

    /**
     * Scenarios walked (isolated) or forward passes made (quick).
     */
    public int passCount() {
        return passCount;
    }

    public Optional<SpecNode> abortedAt() {
        return Optional.ofNullable(abortedAt);
    }

    public boolean aborted() {
        return abortedAt != null;
    }
}
