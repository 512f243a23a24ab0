package org.xspec.assertion;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.opentest4j.MultipleFailuresError;
import org.opentest4j.TestAbortedException;
import org.xspec.tree.ExecState;

/**
 * Maps throwables raised by node actions onto execution states.
 */
public final class FailureClassifier {
    private FailureClassifier() {
    }

    /**
     * Assertion failures and aborted assumptions count as {@link ExecState#FAILED}; anything else as
     * {@link ExecState#EXCEPTION}.
     */
    public static ExecState classify(Throwable failure) {
        if (failure == null) {
            return ExecState.PASSED;
        }
        if (failure instanceof AssertionError || failure instanceof TestAbortedException) {
            return ExecState.FAILED;
        }
        return ExecState.EXCEPTION;
    }

    public static String describe(Throwable failure) {
        String message = failure.getMessage();
        if (failure instanceof AssertionError || failure instanceof TestAbortedException) {
            return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
        }
        if (message == null || message.isBlank()) {
            return failure.getClass().getSimpleName();
        }
        return failure.getClass().getSimpleName() + ": " + message;
    }

    /**
     * Unwraps one level of batching: a single-failure {@link MultipleFailuresError}, or the cause of a
     * {@link CompletionException} / {@link ExecutionException}.
     */
    public static Throwable unwrapAggregate(Throwable failure) {
        if (failure instanceof MultipleFailuresError multiple && multiple.getFailures().size() == 1) {
            return multiple.getFailures().get(0);
        }
        if ((failure instanceof CompletionException || failure instanceof ExecutionException)
            && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    /**
     * Errors the run must never absorb.
     */
    public static boolean isUnrecoverable(Throwable failure) {
        return failure instanceof VirtualMachineError;
    }
}
