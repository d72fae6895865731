package com.gnovoa.livematch.error;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a facade operation: either a value or a typed failure with a human readable message.
 *
 * @param value result on success, may be null for operations without a payload
 * @param failure failure kind, null on success
 * @param message failure message, null on success
 */
public record OperationResult<T>(T value, FailureKind failure, String message) {

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(value, null, null);
    }

    public static <T> OperationResult<T> failure(FailureKind kind, String message) {
        return new OperationResult<>(null, Objects.requireNonNull(kind, "kind"), message);
    }

    public static <T> OperationResult<T> failure(MatchOperationException e) {
        return failure(e.kind(), e.getMessage());
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public <R> OperationResult<R> map(Function<? super T, ? extends R> fn) {
        if (!isSuccess()) return failure(failure, message);
        return success(fn.apply(value));
    }

    /** @throws MatchOperationException carrying the failure when this result is not a success */
    public T orElseThrow() {
        if (!isSuccess()) throw new MatchOperationException(failure, message);
        return value;
    }
}
