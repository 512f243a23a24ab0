package org.xspec.junit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.stream.Stream;
import org.junit.jupiter.api.DynamicTest;
import org.xspec.Spec;
import org.xspec.engine.NodeExecutor;
import org.xspec.engine.ScenarioCollector;
import org.xspec.tree.SpecNode;

/**
 * Exposes each isolated scenario of a spec as a JUnit dynamic test.
 *
 * <pre>{@code
 * @TestFactory
 * Stream<DynamicTest> counter() {
 *     return SpecDynamicTests.scenarios(Spec.given(...).when(...).itIs(...));
 * }
 * }</pre>
 */
public final class SpecDynamicTests {
    private SpecDynamicTests() {
    }

    public static Stream<DynamicTest> scenarios(Spec spec) {
        Objects.requireNonNull(spec, "spec");
        return scenarios(spec.root(), new NodeExecutor());
    }

    static Stream<DynamicTest> scenarios(SpecNode root, NodeExecutor executor) {
        List<DynamicTest> tests = new ArrayList<>();
        for (List<SpecNode> scenario : ScenarioCollector.scenarios(root)) {
            tests.add(DynamicTest.dynamicTest(displayName(scenario), () -> replay(scenario, executor)));
        }
        return tests.stream();
    }

    private static void replay(List<SpecNode> scenario, NodeExecutor executor) throws Throwable {
        for (SpecNode node : scenario) {
            if (!executor.exec(node)) {
                throw node.lastException()
                    .orElseThrow(() -> new IllegalStateException("no failure captured for " + node));
            }
        }
    }

    static String displayName(List<SpecNode> scenario) {
        StringJoiner joiner = new StringJoiner(", ");
        for (SpecNode node : scenario) {
            joiner.add(node.toString());
        }
        return joiner.toString();
    }
}
