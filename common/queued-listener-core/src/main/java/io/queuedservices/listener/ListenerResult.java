package io.queuedservices.listener;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a public listener operation. Failures carry a {@link ListenerError} instead of being
 * thrown, so hosts decide when and how to surface them.
 *
 * @param <T> value produced on success
 */
public sealed interface ListenerResult<T> permits ListenerResult.Success, ListenerResult.Failure {

    static <T> ListenerResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ListenerResult<T> failure(ListenerError error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Returns the value when successful.
     */
    Optional<T> value();

    /**
     * Returns the error when failed.
     */
    Optional<ListenerError> error();

    /**
     * Returns the value or throws a {@link QueuedListenerException} carrying the error.
     */
    T orElseThrow();

    <R> ListenerResult<R> map(Function<? super T, ? extends R> mapper);

    record Success<T>(T result) implements ListenerResult<T> {

        public Success {
            Objects.requireNonNull(result, "result");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<T> value() {
            return Optional.of(result);
        }

        @Override
        public Optional<ListenerError> error() {
            return Optional.empty();
        }

        @Override
        public T orElseThrow() {
            return result;
        }

        @Override
        public <R> ListenerResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(result));
        }
    }

    record Failure<T>(ListenerError cause) implements ListenerResult<T> {

        public Failure {
            Objects.requireNonNull(cause, "cause");
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
        public Optional<ListenerError> error() {
            return Optional.of(cause);
        }

        @Override
        public T orElseThrow() {
            throw new QueuedListenerException(cause);
        }

        @Override
        public <R> ListenerResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(cause);
        }
    }
}
