package org.pragmatica.calculator.error;

import java.util.function.Function;

/**
 * Outcome of a parsing or evaluation step - either a value or the first error encountered.
 * Once failed, all subsequent {@link #map} and {@link #flatMap} steps are skipped.
 */
public sealed interface CalculationResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    static <T> CalculationResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> CalculationResult<T> failure(CalculationError error) {
        return new Failure<>(error);
    }

    /**
     * View a result of a subtype as a result of its supertype.
     */
    @SuppressWarnings("unchecked")
    static <T> CalculationResult<T> widen(CalculationResult<? extends T> result) {
        return (CalculationResult<T>) result;
    }

    <R> CalculationResult<R> map(Function<? super T, ? extends R> mapper);

    <R> CalculationResult<R> flatMap(Function<? super T, CalculationResult<R>> mapper);

    <R> R fold(Function<CalculationError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    /**
     * Value of a successful result.
     *
     * @throws IllegalStateException if the result is a failure
     */
    T unwrap();

    /**
     * Error of a failed result.
     *
     * @throws IllegalStateException if the result is a success
     */
    CalculationError error();

    /**
     * Successful step carrying a value.
     */
    record Success<T>(T value) implements CalculationResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> CalculationResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <R> CalculationResult<R> flatMap(Function<? super T, CalculationResult<R>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public <R> R fold(Function<CalculationError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public CalculationError error() {
            throw new IllegalStateException("Successful result has no error: " + value);
        }
    }

    /**
     * Failed step carrying the first error.
     */
    record Failure<T>(CalculationError cause) implements CalculationResult<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> CalculationResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(cause);
        }

        @Override
        public <R> CalculationResult<R> flatMap(Function<? super T, CalculationResult<R>> mapper) {
            return new Failure<>(cause);
        }

        @Override
        public <R> R fold(Function<CalculationError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Failed result has no value: " + cause.message());
        }

        @Override
        public CalculationError error() {
            return cause;
        }
    }
}
