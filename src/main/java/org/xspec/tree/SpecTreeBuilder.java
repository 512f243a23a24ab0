package org.xspec.tree;

import java.util.Objects;
import java.util.function.Function;
import org.junit.jupiter.api.function.Executable;

/**
 * Precedence-aware attachment of new nodes.
 *
 * <p>A node is attached beneath the nearest node, walking up from the node the call was made on, whose kind
 * is strictly shallower than the new node's precedence. Calling {@code it} on a {@code when} therefore adds a
 * child, while calling {@code it} on the returned {@code it} adds a sibling under the same {@code when}.
 */
public final class SpecTreeBuilder {
    private SpecTreeBuilder() {
    }

    public static SpecNode root(String description, Executable action) {
        return new SpecNode(requireText(description, "description"), requireValue(action, "action"), NodeKind.GIVEN, null);
    }

    public static SpecNode attach(SpecNode from, String description, Executable action, NodeKind kind) {
        return attach(from, description, action, kind, kind);
    }

    /**
     * Attaches with an explicit precedence; {@code THE_EXCEPTION} nodes use {@code IT} so they become peers of
     * {@code it} nodes instead of their children.
     */
    public static SpecNode attach(
        SpecNode from,
        String description,
        Executable action,
        NodeKind kind,
        NodeKind precedence
    ) {
        String checkedDescription = requireText(description, "description");
        Executable checkedAction = requireValue(action, "action");
        SpecNode parent = locateParent(from, precedence);
        SpecNode node = new SpecNode(checkedDescription, checkedAction, kind, parent);
        parent.addChild(node);
        return node;
    }

    /**
     * Attaches an assertion about the exception captured by the located parent. The parent is switched to
     * swallowing its own exceptions so the scenario continues past it.
     */
    public static SpecNode attachExceptionCheck(
        SpecNode from,
        String description,
        NodeKind kind,
        Function<SpecNode, Executable> actionFactory
    ) {
        String checkedDescription = requireText(description, "description");
        Objects.requireNonNull(actionFactory, "actionFactory");
        SpecNode parent = locateParent(from, NodeKind.IT);
        Executable action = Objects.requireNonNull(actionFactory.apply(parent), "action");
        SpecNode node = new SpecNode(checkedDescription, action, kind, parent);
        parent.swallowExceptions();
        parent.addChild(node);
        return node;
    }

    static SpecNode locateParent(SpecNode from, NodeKind precedence) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(precedence, "precedence");
        SpecNode candidate = from;
        while (!precedence.canNestUnder(candidate.kind())) {
            candidate = candidate.parent().orElseThrow(
                () -> new IllegalStateException("no " + precedence.label() + " parent above: " + from)
            );
        }
        return candidate;
    }

    public static String requireText(String value, String fieldName) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be empty");
        }
        return value;
    }

    public static <T> T requireValue(T value, String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
        return value;
    }
}
