package com.gnovoa.livematch.api.dto;

import com.gnovoa.livematch.events.EventKind;
import com.gnovoa.livematch.ledger.EventDraft;

/** New event; {@code id} is the optional client idempotency key. */
public record EventRequest(
        String id,
        EventKind kind,
        String teamId,
        String playerId,
        Integer periodNumber,
        Long clockMs,
        String notes,
        Integer sentiment
) {
    public EventDraft toDraft(String matchId) {
        return new EventDraft(id, matchId, kind, teamId, playerId, periodNumber,
                clockMs == null ? 0 : clockMs, notes, sentiment == null ? 0 : sentiment);
    }
}
