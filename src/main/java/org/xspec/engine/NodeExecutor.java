package org.xspec.engine;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;
import org.xspec.assertion.FailureClassifier;
import org.xspec.tree.ExecRecord;
import org.xspec.tree.ExecState;
import org.xspec.tree.SpecNode;

/**
 * Runs a single node's action once, timing it and recording the outcome on the node.
 */
public final class NodeExecutor {
    private final LongSupplier nanoTicker;
    private int executionCount;

    public NodeExecutor() {
        this(System::nanoTime);
    }

    public NodeExecutor(LongSupplier nanoTicker) {
        this.nanoTicker = Objects.requireNonNull(nanoTicker, "nanoTicker");
    }

    /**
     * Executes {@code node} and appends the result to its log.
     *
     * <p>The captured exception replaces whatever the previous execution left behind. A node that swallows
     * exceptions records a pass and lets the scenario continue; its exception stays available to the
     * assertions attached beneath it.
     *
     * @return {@code true} if the scenario may advance past this node
     */
    public boolean exec(SpecNode node) {
        Objects.requireNonNull(node, "node");
        Throwable failure = null;
        long startedAtNanos = nanoTicker.getAsLong();
        try {
            node.action().execute();
        } catch (Throwable t) {
            if (FailureClassifier.isUnrecoverable(t)) {
                throw (VirtualMachineError) t;
            }
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            failure = t;
        }
        long elapsedNanos = Math.max(0L, nanoTicker.getAsLong() - startedAtNanos);
        node.captureException(failure);

        ExecState state = ExecState.PASSED;
        String message = null;
        if (failure != null && !node.swallowsExceptions()) {
            state = FailureClassifier.classify(failure);
            message = FailureClassifier.describe(failure);
        }
        node.record(new ExecRecord(Duration.ofNanos(elapsedNanos), state, message));
        executionCount++;
        return state == ExecState.PASSED || node.swallowsExceptions();
    }

    public int executionCount() {
        return executionCount;
    }
}
