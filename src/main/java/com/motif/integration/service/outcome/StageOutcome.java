package com.motif.integration.service.outcome;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Tagged result of one stage or branch.
 *
 * Uses the sealed interface pattern so an outcome is exactly one of
 * {@link Success} or {@link Failure}. Downstream adapters and the
 * partial-failure aggregator return outcomes instead of throwing.
 *
 * @param <T> the success payload type
 */
public sealed interface StageOutcome<T> permits StageOutcome.Success, StageOutcome.Failure {

    static <T> StageOutcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> StageOutcome<T> failure(ErrorKind kind, String message) {
        return new Failure<>(kind, message);
    }

    boolean isSuccess();

    /**
     * Gets the success value, empty for failures.
     */
    Optional<T> value();

    /**
     * Gets the failure, empty for successes.
     */
    Optional<Failure<T>> failure();

    /**
     * Transforms the success value, passing failures through untouched.
     */
    <R> StageOutcome<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Chains a dependent stage that only runs on success.
     */
    <R> StageOutcome<R> flatMap(Function<? super T, StageOutcome<R>> next);

    record Success<T>(T payload) implements StageOutcome<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<T> value() {
            return Optional.ofNullable(payload);
        }

        @Override
        public Optional<Failure<T>> failure() {
            return Optional.empty();
        }

        @Override
        public <R> StageOutcome<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(payload));
        }

        @Override
        public <R> StageOutcome<R> flatMap(Function<? super T, StageOutcome<R>> next) {
            return next.apply(payload);
        }
    }

    record Failure<T>(ErrorKind kind, String message) implements StageOutcome<T> {

        public Failure {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<T> value() {
            return Optional.empty();
        }

        @Override
        public Optional<Failure<T>> failure() {
            return Optional.of(this);
        }

        @Override
        public <R> StageOutcome<R> map(Function<? super T, ? extends R> mapper) {
            return retype();
        }

        @Override
        public <R> StageOutcome<R> flatMap(Function<? super T, StageOutcome<R>> next) {
            return retype();
        }

        /**
         * Re-parameterizes this failure; it carries no payload of type T.
         */
        public <R> Failure<R> retype() {
            return new Failure<>(kind, message);
        }
    }
}
