package com.gnovoa.livematch.core;

import com.gnovoa.livematch.error.FailureKind;
import com.gnovoa.livematch.error.MatchOperationException;
import com.gnovoa.livematch.store.MatchStore;
import com.gnovoa.livematch.store.StoreException;
import com.gnovoa.livematch.store.TransactionWork;

/** Runs match transactions and turns store constraint failures into engine failures. */
public final class TransactionRunner {

    private final MatchStore store;

    public TransactionRunner(MatchStore store) {
        this.store = store;
    }

    public MatchStore store() {
        return store;
    }

    public <T> T run(String matchId, TransactionWork<T> work) {
        try {
            return store.inTransaction(matchId, work);
        } catch (StoreException e) {
            throw translate(e);
        }
    }

    static MatchOperationException translate(StoreException e) {
        FailureKind kind = switch (e.kind()) {
            case UNIQUE_VIOLATION -> FailureKind.CONFLICT;
            case FOREIGN_KEY_VIOLATION -> FailureKind.INVALID_REFERENCE;
            case ROW_NOT_FOUND -> FailureKind.NOT_FOUND;
        };
        return new MatchOperationException(kind, e.getMessage(), e);
    }
}
