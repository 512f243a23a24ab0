package org.xspec.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.xspec.Spec;
import org.xspec.config.SpecSettings;
import org.xspec.tree.ExecState;
import org.xspec.tree.SpecNode;

class QuickExecutionStrategyTest {
    private static final SpecSettings QUIET = SpecSettings.builder().echoReport(false).build();

    @Test
    void runsEveryNodeOnceWhenAllPass() {
        AtomicInteger x = new AtomicInteger();
        Spec last = Spec.given("an integer, set to zero", () -> x.set(0), QUIET)
            .when("the integer is incremented", x::incrementAndGet)
            .itIs("should be 1", () -> x.get() == 1)
            .when("the integer is incremented again", x::incrementAndGet)
            .itIs("should be 2", () -> x.get() == 2)
            .when("the integer is divided by zero", () -> x.set(x.get() / (x.get() - 2)))
            .itShouldThrow(ArithmeticException.class);
        NodeExecutor executor = new NodeExecutor();

        ExecutionOutcome outcome = new QuickExecutionStrategy().execute(last.root(), executor, ExecutionListener.NONE);

        assertFalse(outcome.aborted());
        assertEquals(1, outcome.passCount());
        assertEquals(3, outcome.scenarioCount());
        assertEquals(7, executor.executionCount());
        for (SpecNode node : ScenarioCollector.preOrder(last.root())) {
            assertEquals(ExecState.PASSED, node.aggregateState(), node.toString());
        }
    }

    @Test
    void replaysOnlyFixturePrefixAfterFailure() {
        List<String> trace = new ArrayList<>();
        List<SpecNode> stoppedAt = new ArrayList<>();
        Spec given = Spec.given("g", () -> trace.add("g"), QUIET);
        Spec w1 = given.when("w1", () -> trace.add("w1"));
        Spec failing = w1.it("i1", () -> {
            trace.add("i1");
            throw new AssertionError("nope");
        });
        Spec passing = failing.it("i2", () -> trace.add("i2"));
        Spec w2 = passing.when("w2", () -> trace.add("w2"));
        w2.it("i3", () -> trace.add("i3"));
        NodeExecutor executor = new NodeExecutor();

        ExecutionOutcome outcome = new QuickExecutionStrategy().execute(given.root(), executor, new ExecutionListener() {
            @Override
            public void stopped(int pass, SpecNode node) {
                stoppedAt.add(node);
            }
        });

        assertEquals(List.of("g", "w1", "i1", "g", "w1", "i2", "w2", "i3"), trace);
        assertEquals(2, outcome.passCount());
        assertEquals(List.of(failing.node()), stoppedAt);
        assertEquals(2, given.node().records().size());
        assertEquals(2, w1.node().records().size());
        assertEquals(1, failing.node().records().size());
        assertEquals(ExecState.FAILED, failing.node().aggregateState());
        assertEquals(ExecState.PASSED, passing.node().aggregateState());
    }

    @Test
    void assertionsAreNotIsolatedFromEachOther() {
        AtomicInteger count = new AtomicInteger();
        Spec last = Spec.given("a count of 23", () -> count.set(23), QUIET)
            .itIs("should be 23", () -> count.get() == 23)
            .it("should let me set it to 24", () -> count.set(24))
            .itIs("should be 23 here, though", () -> count.get() == 23);

        new QuickExecutionStrategy().execute(last.root(), new NodeExecutor(), ExecutionListener.NONE);

        assertEquals(ExecState.FAILED, last.node().aggregateState());
    }

    @Test
    void abortsWhenFixtureStepFailsOnReplay() {
        AtomicInteger calls = new AtomicInteger();
        List<SpecNode> aborted = new ArrayList<>();
        Spec given = Spec.given("a service", () -> {
        }, QUIET);
        Spec flaky = given.when("it is called", () -> {
            if (calls.incrementAndGet() > 1) {
                throw new IllegalStateException("second call refused");
            }
        });
        Spec failing = flaky.it("returns a value", () -> {
            throw new AssertionError("no value");
        });
        Spec unreached = failing.it("logs the call", () -> {
        });

        QuickExecutionStrategy strategy = new QuickExecutionStrategy();
        ExecutionOutcome outcome = strategy.execute(given.root(), new NodeExecutor(), new ExecutionListener() {
            @Override
            public void replayAborted(int pass, SpecNode node) {
                aborted.add(node);
            }
        });

        assertSame(ExecutionMode.QUICK, strategy.mode());
        assertTrue(outcome.aborted());
        assertSame(flaky.node(), outcome.abortedAt().orElseThrow());
        assertEquals(List.of(flaky.node()), aborted);
        assertEquals(ExecState.EXCEPTION, flaky.node().aggregateState());
        assertEquals(ExecState.NOT_RUN, unreached.node().aggregateState());
        assertEquals(2, calls.get());
    }
}
