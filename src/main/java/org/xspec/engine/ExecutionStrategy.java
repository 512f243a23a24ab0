package org.xspec.engine;

import org.xspec.tree.SpecNode;

/**
 * Walks a spec tree and executes its nodes through a shared {@link NodeExecutor}.
 */
public interface ExecutionStrategy {
    ExecutionMode mode();

    ExecutionOutcome execute(SpecNode root, NodeExecutor executor, ExecutionListener listener);
}
