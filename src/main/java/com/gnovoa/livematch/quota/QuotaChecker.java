package com.gnovoa.livematch.quota;

import com.gnovoa.livematch.events.EventKind;
import com.gnovoa.livematch.model.Requester;

/**
 * Usage limits consulted before any write. Implementations reject by throwing
 * {@link com.gnovoa.livematch.error.MatchOperationException} with
 * {@link com.gnovoa.livematch.error.FailureKind#QUOTA_EXCEEDED}.
 */
public interface QuotaChecker {

    void checkEventCreate(Requester requester, String matchId, EventKind kind);

    void checkKindChange(Requester requester, String matchId, EventKind newKind);

    void checkFormationChange(Requester requester, String matchId);

    /** Checker that never rejects. */
    static QuotaChecker unlimited() {
        return new QuotaChecker() {
            @Override
            public void checkEventCreate(Requester requester, String matchId, EventKind kind) {}

            @Override
            public void checkKindChange(Requester requester, String matchId, EventKind newKind) {}

            @Override
            public void checkFormationChange(Requester requester, String matchId) {}
        };
    }
}
