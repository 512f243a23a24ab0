package org.xspec.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.xspec.engine.ExecutionOutcome;
import org.xspec.tree.ExecRecord;
import org.xspec.tree.SpecNode;

/**
 * Renders a spec tree after execution, one indented line per node.
 *
 * <pre>
 * Given an integer, set to zero (0ms, ok)
 *   When the integer is incremented (0ms, ok)
 *     It should be 2 (0ms, FAILED: 'expected: &lt;2&gt; but was: &lt;1&gt;')
 * </pre>
 */
public final class SpecReportRenderer {
    private static final String INDENT = "  ";

    public SpecReport render(SpecNode root, ExecutionOutcome outcome) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(outcome, "outcome");
        NodeReport rootReport = snapshot(root);

        String abortReason = outcome.abortedAt()
            .map(node -> "Run aborted: '" + node + "' did not pass when replayed")
            .orElse(null);

        StringBuilder sb = new StringBuilder();
        if (abortReason != null) {
            sb.append(abortReason).append('\n');
        }
        appendNode(sb, rootReport, 0);
        return new SpecReport(outcome.mode(), rootReport, abortReason, sb.toString());
    }

    static NodeReport snapshot(SpecNode node) {
        long totalNanos = 0L;
        String firstMessage = null;
        boolean multipleMessages = false;
        for (ExecRecord record : node.records()) {
            totalNanos += record.elapsed().toNanos();
            String message = record.message().orElse(null);
            if (message == null) {
                continue;
            }
            if (firstMessage == null) {
                firstMessage = message;
            } else if (!firstMessage.equals(message)) {
                multipleMessages = true;
            }
        }
        int executions = node.records().size();
        long averageMillis = executions == 0 ? 0L : totalNanos / executions / 1_000_000L;

        List<NodeReport> children = new ArrayList<>(node.children().size());
        for (SpecNode child : node.children()) {
            children.add(snapshot(child));
        }
        return new NodeReport(
            node.kind(),
            node.description(),
            node.aggregateState(),
            executions,
            averageMillis,
            firstMessage,
            multipleMessages,
            children
        );
    }

    private static void appendNode(StringBuilder sb, NodeReport node, int depth) {
        sb.append(INDENT.repeat(depth));
        sb.append(node.kind().label()).append(' ').append(node.description());
        sb.append(" (").append(node.averageMillis()).append("ms, ");
        if (node.multipleMessages()) {
            sb.append('+');
        }
        sb.append(node.state().word());
        node.firstMessage().ifPresent(message -> sb.append(": '").append(message).append('\''));
        sb.append(")\n");
        for (NodeReport child : node.children()) {
            appendNode(sb, child, depth + 1);
        }
    }
}
