package org.xspec.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.junit.jupiter.api.function.Executable;

/**
 * One step of a spec tree: an initial condition, an action or an assertion.
 *
 * <p>The tree is built once by {@link SpecTreeBuilder} and then owned by a single run. Only the execution
 * bookkeeping (swallow flag, last exception, result log and aggregate state) changes after construction.
 * Instances are not thread-safe.
 */
public final class SpecNode {
    private final String description;
    private final Executable action;
    private final NodeKind kind;
    private final SpecNode parent;
    private final List<SpecNode> children = new ArrayList<>();
    private final List<ExecRecord> records = new ArrayList<>();
    private boolean swallowExceptions;
    private Throwable lastException;
    private ExecState aggregateState = ExecState.NOT_RUN;

    SpecNode(String description, Executable action, NodeKind kind, SpecNode parent) {
        this.description = Objects.requireNonNull(description, "description");
        this.action = Objects.requireNonNull(action, "action");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.parent = parent;
    }

    public String description() {
        return description;
    }

    public Executable action() {
        return action;
    }

    public NodeKind kind() {
        return kind;
    }

    public Optional<SpecNode> parent() {
        return Optional.ofNullable(parent);
    }

    public List<SpecNode> children() {
        return Collections.unmodifiableList(children);
    }

    public SpecNode root() {
        SpecNode current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    public boolean swallowsExceptions() {
        return swallowExceptions;
    }

    public Optional<Throwable> lastException() {
        return Optional.ofNullable(lastException);
    }

    public List<ExecRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public ExecState aggregateState() {
        return aggregateState;
    }

    /**
     * Replaces the exception captured by the previous execution; {@code null} clears it.
     */
    public void captureException(Throwable exception) {
        this.lastException = exception;
    }

    /**
     * Appends one execution to the result log and raises the aggregate state if the new run is worse.
     */
    public void record(ExecRecord record) {
        Objects.requireNonNull(record, "record");
        records.add(record);
        aggregateState = aggregateState.worst(record.state());
    }

    void addChild(SpecNode child) {
        children.add(child);
    }

    void swallowExceptions() {
        if (kind.endsScenario()) {
            throw new IllegalStateException("only given/when steps can swallow exceptions: " + description);
        }
        this.swallowExceptions = true;
    }

    @Override
    public String toString() {
        return kind.label() + " " + description;
    }
}
