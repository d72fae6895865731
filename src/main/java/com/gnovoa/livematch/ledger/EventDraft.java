package com.gnovoa.livematch.ledger;

import com.gnovoa.livematch.events.EventKind;

/**
 * Data of an event to record. {@code id} is optional; when given it is the client's idempotency
 * key and retries with the same id return the stored event.
 */
public record EventDraft(
        String id,
        String matchId,
        EventKind kind,
        String teamId,
        String playerId,
        Integer periodNumber,
        long clockMs,
        String notes,
        int sentiment
) {

    public EventDraft {
        if (matchId == null || matchId.isBlank()) throw new IllegalArgumentException("matchId is required");
        if (kind == null) throw new IllegalArgumentException("kind is required");
        if (clockMs < 0) throw new IllegalArgumentException("clockMs must not be negative");
        if (sentiment < -3 || sentiment > 3) throw new IllegalArgumentException("sentiment must be within [-3,3]");
        if (id != null && id.isBlank()) id = null;
    }
}
