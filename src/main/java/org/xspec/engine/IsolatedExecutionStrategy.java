package org.xspec.engine;

import java.util.List;
import java.util.Objects;
import org.xspec.tree.SpecNode;

/**
 * Runs each scenario from the root, so given/when steps are replayed once per assertion beneath them.
 */
public final class IsolatedExecutionStrategy implements ExecutionStrategy {
    @Override
    public ExecutionMode mode() {
        return ExecutionMode.ISOLATED;
    }

    @Override
    public ExecutionOutcome execute(SpecNode root, NodeExecutor executor, ExecutionListener listener) {
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(listener, "listener");
        List<List<SpecNode>> scenarios = ScenarioCollector.scenarios(root);
        for (int i = 0; i < scenarios.size(); i++) {
            for (SpecNode node : scenarios.get(i)) {
                if (!executor.exec(node)) {
                    listener.stopped(i, node);
                    break;
                }
            }
        }
        return ExecutionOutcome.completed(mode(), scenarios.size(), scenarios.size());
    }
}
