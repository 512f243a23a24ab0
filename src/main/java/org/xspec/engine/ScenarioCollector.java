package org.xspec.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.xspec.tree.SpecNode;

/**
 * Flattens a spec tree into scenarios or into a single pre-order sequence.
 */
public final class ScenarioCollector {
    private ScenarioCollector() {
    }

    /**
     * Every root-to-node path ending at an assertion, in tree order. An assertion that has children of its
     * own still ends a scenario and also prefixes the deeper ones.
     */
    public static List<List<SpecNode>> scenarios(SpecNode root) {
        Objects.requireNonNull(root, "root");
        List<List<SpecNode>> scenarios = new ArrayList<>();
        collect(root, new ArrayList<>(), scenarios);
        return scenarios;
    }

    public static List<SpecNode> preOrder(SpecNode root) {
        Objects.requireNonNull(root, "root");
        List<SpecNode> sequence = new ArrayList<>();
        appendPreOrder(root, sequence);
        return sequence;
    }

    private static void collect(SpecNode node, List<SpecNode> path, List<List<SpecNode>> scenarios) {
        path.add(node);
        if (node.kind().endsScenario()) {
            scenarios.add(List.copyOf(path));
        }
        for (SpecNode child : node.children()) {
            collect(child, path, scenarios);
        }
        path.remove(path.size() - 1);
    }

    private static void appendPreOrder(SpecNode node, List<SpecNode> sequence) {
        sequence.add(node);
        for (SpecNode child : node.children()) {
            appendPreOrder(child, sequence);
        }
    }
}
