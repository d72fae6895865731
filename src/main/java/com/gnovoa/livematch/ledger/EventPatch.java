package com.gnovoa.livematch.ledger;

import com.gnovoa.livematch.events.EventKind;

/** Partial update of an event; null fields keep their stored value. */
public record EventPatch(
        EventKind kind,
        String teamId,
        String playerId,
        Integer periodNumber,
        Long clockMs,
        String notes,
        Integer sentiment
) {

    public EventPatch {
        if (clockMs != null && clockMs < 0) throw new IllegalArgumentException("clockMs must not be negative");
        if (sentiment != null && (sentiment < -3 || sentiment > 3)) {
            throw new IllegalArgumentException("sentiment must be within [-3,3]");
        }
    }
}
