package org.xspec.assertion;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Objects;
import java.util.function.Predicate;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.api.function.ThrowingConsumer;
import org.opentest4j.AssertionFailedError;
import org.xspec.tree.SpecNode;

/**
 * Actions that assert on the exception captured by a preceding step.
 */
public final class ExceptionAssertions {
    public static final String NO_EXCEPTION_MESSAGE = "No exception was thrown.";

    private ExceptionAssertions() {
    }

    public static Executable shouldThrow(SpecNode step, Class<? extends Throwable> expectedType) {
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(expectedType, "expectedType");
        return () -> assertInstanceOf(expectedType, FailureClassifier.unwrapAggregate(captured(step)));
    }

    public static Executable satisfies(SpecNode step, ThrowingConsumer<Throwable> assertion) {
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(assertion, "assertion");
        return () -> assertion.accept(captured(step));
    }

    public static Executable matches(SpecNode step, Predicate<Throwable> predicate) {
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(predicate, "predicate");
        return () -> assertTrue(predicate.test(captured(step)));
    }

    private static Throwable captured(SpecNode step) {
        return step.lastException().orElseThrow(() -> new AssertionFailedError(NO_EXCEPTION_MESSAGE));
    }
}
