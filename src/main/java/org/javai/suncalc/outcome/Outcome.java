package org.javai.suncalc.outcome;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Represents the outcome of a solar computation that may be undefined for the given place and date.
 * Either {@link Ok} containing the computed value, or {@link Fail} containing a {@link DomainError}.
 *
 * <p>An undefined sunrise is not exceptional: above the polar circles it is the expected answer for
 * part of the year. Callers branch on the variant with pattern matching or {@link #fold}, or recover
 * locally with {@link #recover}.
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the computed value
     */
    record Ok<T>(T value) implements Outcome<T> {

        public Ok {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
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
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Outcome<T> recover(Function<? super DomainError, ? extends T> recovery) {
            return this;
        }

        @Override
        public Outcome<T> recoverWith(Function<? super DomainError, ? extends Outcome<T>> recovery) {
            return this;
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk, Function<? super DomainError, ? extends R> onFail) {
            Objects.requireNonNull(onOk);
            return onOk.apply(value);
        }
    }

    /**
     * A failed outcome carrying the domain error that made the value undefined.
     *
     * @param error the domain error
     */
    record Fail<T>(DomainError error) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public T getOrThrow() {
            throw new DomainErrorException(error);
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
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(error);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(error);
        }

        @Override
        public Outcome<T> recover(Function<? super DomainError, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(error));
        }

        @Override
        public Outcome<T> recoverWith(Function<? super DomainError, ? extends Outcome<T>> recovery) {
            Objects.requireNonNull(recovery);
            return recovery.apply(error);
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk, Function<? super DomainError, ? extends R> onFail) {
            Objects.requireNonNull(onFail);
            return onFail.apply(error);
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    // Recovery
    Outcome<T> recover(Function<? super DomainError, ? extends T> recovery);
    Outcome<T> recoverWith(Function<? super DomainError, ? extends Outcome<T>> recovery);

    /**
     * Collapses both variants into a single value.
     *
     * @param onOk applied to the value of an {@link Ok}
     * @param onFail applied to the error of a {@link Fail}
     * @return the result of whichever function matched
     */
    <R> R fold(Function<? super T, ? extends R> onOk, Function<? super DomainError, ? extends R> onFail);

    // Static factories
    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(DomainError error) {
        return new Fail<>(error);
    }
}
