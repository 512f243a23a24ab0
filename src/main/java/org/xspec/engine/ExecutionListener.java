package org.xspec.engine;

import org.xspec.tree.SpecNode;

/**
 * Progress callbacks raised while a strategy walks the tree.
 */
public interface ExecutionListener {
    ExecutionListener NONE = new ExecutionListener() {
    };

    /**
     * A scenario (isolated) or forward pass (quick) stopped at {@code node}.
     */
    default void stopped(int pass, SpecNode node) {
    }

    /**
     * A fixture step that passed before did not pass when replayed; the run is abandoned.
     */
    default void replayAborted(int pass, SpecNode node) {
    }
}
