package com.gnovoa.livematch.store;

import java.util.Objects;

/** Constraint or lookup failure raised by a {@link MatchStore} inside a transaction. */
public class StoreException extends RuntimeException {

    public enum Kind {
        UNIQUE_VIOLATION,
        FOREIGN_KEY_VIOLATION,
        ROW_NOT_FOUND
    }

    private final Kind kind;

    public StoreException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }

    public static StoreException unique(String message) {
        return new StoreException(Kind.UNIQUE_VIOLATION, message);
    }

    public static StoreException foreignKey(String message) {
        return new StoreException(Kind.FOREIGN_KEY_VIOLATION, message);
    }

    public static StoreException notFound(String message) {
        return new StoreException(Kind.ROW_NOT_FOUND, message);
    }
}
