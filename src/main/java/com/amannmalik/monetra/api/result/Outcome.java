package com.amannmalik.monetra.api.result;

import com.amannmalik.monetra.util.Ensure;

import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a monetary operation: either a value or exactly one {@link MonetaryError}.
 *
 * <p>Core operations return an {@code Outcome} instead of throwing so that an inexact result
 * without a rounding policy has to be dealt with at the call site. {@link #orElseThrow()} is
 * the explicit opt-out.
 */
public sealed interface Outcome<T> {
    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> failure(MonetaryError error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    Optional<MonetaryError> error();

    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);

    <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> mapper);

    <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super MonetaryError, ? extends R> onFailure);

    /// @throws MonetaryException carrying the error when this is a failure
    T orElseThrow();

    record Success<T>(T value) implements Outcome<T> {
        public Success {
            value = Ensure.notNull("outcome.value", value);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<MonetaryError> error() {
            return Optional.empty();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> mapper) {
            return Ensure.notNull("outcome", mapper.apply(value));
        }

        @Override
        public <R> R fold(
                Function<? super T, ? extends R> onSuccess, Function<? super MonetaryError, ? extends R> onFailure) {
            return onSuccess.apply(value);
        }

        @Override
        public T orElseThrow() {
            return value;
        }
    }

    record Failure<T>(MonetaryError cause) implements Outcome<T> {
        public Failure {
            cause = Ensure.notNull("outcome.error", cause);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<MonetaryError> error() {
            return Optional.of(cause);
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(cause);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> mapper) {
            return new Failure<>(cause);
        }

        @Override
        public <R> R fold(
                Function<? super T, ? extends R> onSuccess, Function<? super MonetaryError, ? extends R> onFailure) {
            return onFailure.apply(cause);
        }

        @Override
        public T orElseThrow() {
            throw new MonetaryException(cause);
        }
    }
}
