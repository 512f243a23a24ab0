package org.xspec.tree;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * One execution of a node's action.
 */
public final class ExecRecord {
    private final Duration elapsed;
    private final ExecState state;
    private final String message;

    public ExecRecord(Duration elapsed, ExecState state, String message) {
        this.elapsed = Objects.requireNonNull(elapsed, "elapsed");
        this.state = Objects.requireNonNull(state, "state");
        if (state == ExecState.NOT_RUN) {
            throw new IllegalArgumentException("state must describe an executed node");
        }
        this.message = message;
    }

    public Duration elapsed() {
        return elapsed;
    }

    public ExecState state() {
        return state;
    }

    /**
     * Failure detail; absent for passing runs.
     */
    public Optional<String> message() {
        return Optional.ofNullable(message);
    }
}
