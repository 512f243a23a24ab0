package org.xspec.engine;

import java.util.List;
import java.util.Objects;
import org.xspec.tree.SpecNode;

/**
 * Runs the pre-order sequence in one forward pass while everything passes. After a node stops progress, the
 * given/when steps before the cursor are replayed to rebuild state and the pass resumes after that node.
 *
 * <p>Assertions are not re-isolated from one another: only fixture steps are replayed.
 */
public final class QuickExecutionStrategy implements ExecutionStrategy {
    @Override
    public ExecutionMode mode() {
        return ExecutionMode.QUICK;
    }

    @Override
    public ExecutionOutcome execute(SpecNode root, NodeExecutor executor, ExecutionListener listener) {
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(listener, "listener");
        List<SpecNode> sequence = ScenarioCollector.preOrder(root);
        int scenarioCount = countScenarioEnds(sequence);
        int end = 0;
        int pass = 0;
        while (end < sequence.size()) {
            for (int i = 0; i < end; i++) {
                SpecNode node = sequence.get(i);
                if (!node.kind().isFixtureStep()) {
                    continue;
                }
                if (!executor.exec(node)) {
                    listener.replayAborted(pass, node);
                    return ExecutionOutcome.aborted(mode(), scenarioCount, pass + 1, node);
                }
            }

            while (end < sequence.size() && executor.exec(sequence.get(end))) {
                end++;
            }
            if (end < sequence.size()) {
                listener.stopped(pass, sequence.get(end));
            }
            end++;
            pass++;
        }
        return ExecutionOutcome.completed(mode(), scenarioCount, pass);
    }

    private static int countScenarioEnds(List<SpecNode> sequence) {
        int count = 0;
        for (SpecNode node : sequence) {
            if (node.kind().endsScenario()) {
                count++;
            }
        }
        return count;
    }
}
