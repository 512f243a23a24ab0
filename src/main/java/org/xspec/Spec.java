package org.xspec;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.api.function.ThrowingConsumer;
import org.xspec.assertion.Comparison;
import org.xspec.assertion.ExceptionAssertions;
import org.xspec.config.SpecSettings;
import org.xspec.engine.ExecutionMode;
import org.xspec.obs.JsonLinesLogger;
import org.xspec.report.SpecReport;
import org.xspec.tree.NodeKind;
import org.xspec.tree.SpecNode;
import org.xspec.tree.SpecTreeBuilder;

/**
 * Fluent builder for given/when/it specifications.
 *
 * <pre>{@code
 * AtomicInteger x = new AtomicInteger();
 * Spec.given("an integer, set to zero", () -> x.set(0))
 *     .when("the integer is incremented", x::incrementAndGet)
 *         .itIs("should be 1", () -> x.get() == 1)
 *     .when("the integer is incremented again", x::incrementAndGet)
 *         .itIs("should be 2", Comparison.that(x::get).isEqualTo(2))
 *     .when("the integer is divided by zero", () -> x.set(x.get() / (x.get() - 2)))
 *         .itShouldThrow(ArithmeticException.class)
 *     .go();
 * }</pre>
 *
 * <p>Every call returns a handle on the node it created. {@code it} called on an {@code it} node adds a
 * sibling assertion, and {@code when} called on an assertion adds a step beneath the nearest given.
 * The given action runs many times and must fully reset the state it sets up.
 */
public final class Spec {
    private final SpecNode node;
    private final SpecSettings settings;

    private Spec(SpecNode node, SpecSettings settings) {
        this.node = node;
        this.settings = settings;
    }

    /**
     * Starts a spec, reading run settings from system properties and the environment.
     *
     * @param description initial conditions, phrased to follow the word "Given"
     */
    public static Spec given(String description, Executable action) {
        return given(description, action, SpecSettings.fromEnvironment());
    }

    public static Spec given(String description, Executable action, SpecSettings settings) {
        Objects.requireNonNull(settings, "settings");
        return new Spec(SpecTreeBuilder.root(description, action), settings);
    }

    /**
     * Adds a step that changes the state set up by the preceding given/when steps.
     */
    public Spec when(String description, Executable action) {
        return attach(SpecTreeBuilder.attach(node, description, action, NodeKind.WHEN));
    }

    /**
     * Adds an assertion; it fails by throwing an {@link AssertionError}.
     */
    public Spec it(String description, Executable assertion) {
        return attach(SpecTreeBuilder.attach(node, description, assertion, NodeKind.IT));
    }

    public Spec itIs(String description, BooleanSupplier predicate) {
        BooleanSupplier checked = SpecTreeBuilder.requireValue(predicate, "predicate");
        return it(description, () -> assertTrue(checked.getAsBoolean()));
    }

    /**
     * Adds an assertion from an explicit comparison, so a failure shows expected and actual values.
     */
    public Spec itIs(String description, Comparison<?> comparison) {
        return it(description, SpecTreeBuilder.requireValue(comparison, "comparison").toAssertion());
    }

    /**
     * Asserts that the preceding step threw {@code exceptionType}. That step no longer fails its scenario by
     * throwing; the exception is kept for this and any following exception assertions.
     */
    public Spec itShouldThrow(Class<? extends Throwable> exceptionType) {
        Class<? extends Throwable> checked = SpecTreeBuilder.requireValue(exceptionType, "exceptionType");
        return attach(SpecTreeBuilder.attachExceptionCheck(
            node,
            "should throw " + checked.getSimpleName(),
            NodeKind.IT,
            step -> ExceptionAssertions.shouldThrow(step, checked)
        ));
    }

    public Spec theException(String description, ThrowingConsumer<Throwable> assertion) {
        ThrowingConsumer<Throwable> checked = SpecTreeBuilder.requireValue(assertion, "assertion");
        return attach(SpecTreeBuilder.attachExceptionCheck(
            node,
            description,
            NodeKind.THE_EXCEPTION,
            step -> ExceptionAssertions.satisfies(step, checked)
        ));
    }

    public Spec theExceptionMatches(String description, Predicate<Throwable> predicate) {
        Predicate<Throwable> checked = SpecTreeBuilder.requireValue(predicate, "predicate");
        return attach(SpecTreeBuilder.attachExceptionCheck(
            node,
            description,
            NodeKind.THE_EXCEPTION,
            step -> ExceptionAssertions.matches(step, checked)
        ));
    }

    public SpecNode node() {
        return node;
    }

    public SpecNode root() {
        return node.root();
    }

    public SpecSettings settings() {
        return settings;
    }

    /**
     * Executes the whole spec under the configured default mode.
     *
     * @throws SpecFailedException if any node did not pass; the message holds the report
     */
    public void go() {
        go(settings.defaultMode());
    }

    public void goIsolated() {
        go(ExecutionMode.ISOLATED);
    }

    public void goQuick() {
        go(ExecutionMode.QUICK);
    }

    public void go(ExecutionMode mode) {
        try (JsonLinesLogger logger = settings.logTarget().open(Clock.systemUTC())) {
            new SpecRunner(System.out, settings.echoReport(), logger).go(node, mode);
        }
    }

    /**
     * Executes the whole spec and returns the report without raising on failure.
     */
    public SpecReport run(ExecutionMode mode) {
        try (JsonLinesLogger logger = settings.logTarget().open(Clock.systemUTC())) {
            return new SpecRunner(System.out, settings.echoReport(), logger).run(node, mode);
        }
    }

    private Spec attach(SpecNode created) {
        return new Spec(created, settings);
    }
}
