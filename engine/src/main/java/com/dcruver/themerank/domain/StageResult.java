package com.dcruver.themerank.domain;

import java.util.function.Function;

/**
 * Outcome of a pipeline stage: either a value or a human-readable reason.
 * Expected failures (too few posts, no clusters) travel as values, not exceptions.
 *
 * @param <T> payload type on success
 */
public sealed interface StageResult<T> permits StageResult.Success, StageResult.Failure {

    static <T> StageResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> StageResult<T> failure(String reason) {
        return new Failure<>(reason);
    }

    static <T> StageResult<T> failure(String format, Object... args) {
        return new Failure<>(String.format(format, args));
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Transform the payload, passing failures through unchanged
     */
    default <R> StageResult<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return new Failure<>(((Failure<T>) this).reason());
    }

    record Success<T>(T value) implements StageResult<T> {
    }

    record Failure<T>(String reason) implements StageResult<T> {
    }
}
