package org.xspec.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.xspec.tree.ExecState;
import org.xspec.tree.NodeKind;

/**
 * Immutable snapshot of one node's results after a run.
 */
public final class NodeReport {
    private final NodeKind kind;
    private final String description;
    private final ExecState state;
    private final int executionCount;
    private final long averageMillis;
    private final String firstMessage;
    private final boolean multipleMessages;
    private final List<NodeReport> children;

    NodeReport(
        NodeKind kind,
        String description,
        ExecState state,
        int executionCount,
        long averageMillis,
        String firstMessage,
        boolean multipleMessages,
        List<NodeReport> children
    ) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.description = Objects.requireNonNull(description, "description");
        this.state = Objects.requireNonNull(state, "state");
        this.executionCount = executionCount;
        this.averageMillis = averageMillis;
        this.firstMessage = firstMessage;
        this.multipleMessages = multipleMessages;
        this.children = List.copyOf(new ArrayList<>(Objects.requireNonNull(children, "children")));
    }

    public NodeKind kind() {
        return kind;
    }

    public String description() {
        return description;
    }

    public ExecState state() {
        return state;
    }

    public int executionCount() {
        return executionCount;
    }

    public long averageMillis() {
        return averageMillis;
    }

    public Optional<String> firstMessage() {
        return Optional.ofNullable(firstMessage);
    }

    /**
     * More than one distinct failure message was recorded across executions.
     */
    public boolean multipleMessages() {
        return multipleMessages;
    }

    public List<NodeReport> children() {
        return children;
    }

    /**
     * True when this node and every descendant passed.
     */
    public boolean passed() {
        if (state != ExecState.PASSED) {
            return false;
        }
        for (NodeReport child : children) {
            if (!child.passed()) {
                return false;
            }
        }
        return true;
    }
}
