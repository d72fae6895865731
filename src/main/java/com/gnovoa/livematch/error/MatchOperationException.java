package com.gnovoa.livematch.error;

import java.util.Objects;

/**
 * Raised by engine components when an operation is rejected. The facade turns it into a failed
 * {@link OperationResult}; it never escapes to callers of the facade.
 */
public class MatchOperationException extends RuntimeException {

    private final FailureKind kind;

    public MatchOperationException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public MatchOperationException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind kind() {
        return kind;
    }

    public static MatchOperationException notFound(String message) {
        return new MatchOperationException(FailureKind.NOT_FOUND, message);
    }

    public static MatchOperationException conflict(String message) {
        return new MatchOperationException(FailureKind.CONFLICT, message);
    }

    public static MatchOperationException invalidTransition(String message) {
        return new MatchOperationException(FailureKind.INVALID_TRANSITION, message);
    }

    public static MatchOperationException invalidReference(String message) {
        return new MatchOperationException(FailureKind.INVALID_REFERENCE, message);
    }

    public static MatchOperationException invalidInput(String message) {
        return new MatchOperationException(FailureKind.INVALID_INPUT, message);
    }
}
