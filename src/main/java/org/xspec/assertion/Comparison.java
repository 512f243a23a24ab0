package org.xspec.assertion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.Objects;
import java.util.function.Supplier;
import org.junit.jupiter.api.function.Executable;

/**
 * Equality check built from explicit operands so failures report expected and actual values.
 *
 * <pre>{@code
 * spec.itIs("should be 1", Comparison.that(() -> counter.get()).isEqualTo(1));
 * }</pre>
 *
 * <p>A literal {@code null} on either side turns the check into a null check of the other side.
 */
public final class Comparison<T> {
    public enum Operator {
        EQ,
        NOT_EQ
    }

    private final Operand<T> left;
    private final Operand<T> right;
    private final Operator operator;

    private Comparison(Operand<T> left, Operand<T> right, Operator operator) {
        this.left = left;
        this.right = right;
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    public static <T> Subject<T> that(Supplier<? extends T> actual) {
        return new Subject<>(Operand.of(actual));
    }

    public static <T> Subject<T> thatValue(T actual) {
        return new Subject<>(Operand.literal(actual));
    }

    public Operator operator() {
        return operator;
    }

    public Executable toAssertion() {
        if (right.isLiteralNull() || left.isLiteralNull()) {
            Operand<T> other = right.isLiteralNull() ? left : right;
            return operator == Operator.EQ
                ? () -> assertNull(other.get())
                : () -> assertNotNull(other.get());
        }
        return operator == Operator.EQ
            ? () -> assertEquals(right.get(), left.get())
            : () -> assertNotEquals(right.get(), left.get());
    }

    /**
     * Left-hand side of a comparison awaiting its operator.
     */
    public static final class Subject<T> {
        private final Operand<T> actual;

        private Subject(Operand<T> actual) {
            this.actual = actual;
        }

        public Comparison<T> isEqualTo(T expected) {
            return new Comparison<>(actual, Operand.literal(expected), Operator.EQ);
        }

        public Comparison<T> isEqualToValueOf(Supplier<? extends T> expected) {
            return new Comparison<>(actual, Operand.of(expected), Operator.EQ);
        }

        public Comparison<T> isNotEqualTo(T expected) {
            return new Comparison<>(actual, Operand.literal(expected), Operator.NOT_EQ);
        }

        public Comparison<T> isNotEqualToValueOf(Supplier<? extends T> expected) {
            return new Comparison<>(actual, Operand.of(expected), Operator.NOT_EQ);
        }

        public Comparison<T> isNull() {
            return new Comparison<>(actual, Operand.literal(null), Operator.EQ);
        }

        public Comparison<T> isNotNull() {
            return new Comparison<>(actual, Operand.literal(null), Operator.NOT_EQ);
        }
    }

    private static final class Operand<T> {
        private final Supplier<? extends T> producer;
        private final boolean literalNull;

        private Operand(Supplier<? extends T> producer, boolean literalNull) {
            this.producer = producer;
            this.literalNull = literalNull;
        }

        static <T> Operand<T> of(Supplier<? extends T> producer) {
            if (producer == null) {
                throw new IllegalArgumentException("operand must not be null");
            }
            return new Operand<>(producer, false);
        }

        static <T> Operand<T> literal(T value) {
            return new Operand<>(() -> value, value == null);
        }

        T get() {
            return producer.get();
        }

        boolean isLiteralNull() {
            return literalNull;
        }
    }
}
