package org.javai.projective;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The result of checking a law that is part of the public contract.
 * Either {@link Holds} carrying the checked value, or {@link Violated} carrying a {@link Violation}.
 *
 * <p>Consistency checks return verdicts so callers can inspect the disagreement; callers that
 * treat any violation as fatal use {@link #getOrThrow()}.
 *
 * @param <T> The type of the checked value
 */
public sealed interface Verdict<T> permits Verdict.Holds, Verdict.Violated {

    /**
     * The law holds.
     *
     * @param value the checked value
     */
    record Holds<T>(T value) implements Verdict<T> {

        @Override
        public boolean isSatisfied() {
            return true;
        }

        @Override
        public boolean isViolated() {
            return false;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Verdict<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Holds<>(mapper.apply(value));
        }

        @Override
        public <U> Verdict<U> flatMap(Function<? super T, ? extends Verdict<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }
    }

    /**
     * The law is violated.
     *
     * @param violation what was found
     */
    record Violated<T>(Violation violation) implements Verdict<T> {

        public Violated {
            Objects.requireNonNull(violation, "violation must not be null");
        }

        @Override
        public boolean isSatisfied() {
            return false;
        }

        @Override
        public boolean isViolated() {
            return true;
        }

        @Override
        public T getOrThrow() {
            throw new InvariantViolationException(violation);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Verdict<U> map(Function<? super T, ? extends U> mapper) {
            return new Violated<>(violation);
        }

        @Override
        public <U> Verdict<U> flatMap(Function<? super T, ? extends Verdict<U>> mapper) {
            return new Violated<>(violation);
        }
    }

    boolean isSatisfied();
    boolean isViolated();

    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    <U> Verdict<U> map(Function<? super T, ? extends U> mapper);
    <U> Verdict<U> flatMap(Function<? super T, ? extends Verdict<U>> mapper);

    static <T> Verdict<T> holds(T value) {
        return new Holds<>(value);
    }

    static <T> Verdict<T> violated(Violation violation) {
        return new Violated<>(violation);
    }
}
