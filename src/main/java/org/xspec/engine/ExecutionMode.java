package org.xspec.engine;

import java.util.Locale;

/**
 * Execution discipline for a spec tree.
 */
public enum ExecutionMode {
    /**
     * Replays every root-to-assertion path from scratch, so assertions never observe each other's side effects.
     */
    ISOLATED {
        @Override
        public ExecutionStrategy strategy() {
            return new IsolatedExecutionStrategy();
        }
    },
    /**
     * Runs the tree in pre-order and only replays the given/when prefix after a node fails.
     */
    QUICK {
        @Override
        public ExecutionStrategy strategy() {
            return new QuickExecutionStrategy();
        }
    };

    public abstract ExecutionStrategy strategy();

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExecutionMode parse(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (ExecutionMode mode : values()) {
            if (mode.key().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unsupported execution mode: " + value);
    }
}
