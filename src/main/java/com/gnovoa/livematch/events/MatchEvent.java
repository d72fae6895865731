package com.gnovoa.livematch.events;

import com.gnovoa.livematch.model.Tombstone;

import java.time.Instant;
import java.util.Objects;

/**
 * An entry of the match event ledger. Rows are never physically removed; deletion sets the
 * tombstone.
 */
public record MatchEvent(
        String id,
        String matchId,
        EventKind kind,
        String teamId,
        String playerId,
        Integer periodNumber,
        long clockMs,
        String notes,
        int sentiment,
        Instant createdAt,
        String createdBy,
        Tombstone tombstone
) {

    public MatchEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        if (sentiment < -3 || sentiment > 3) {
            throw new IllegalArgumentException("Sentiment must be within [-3,3]: " + sentiment);
        }
        if (clockMs < 0) throw new IllegalArgumentException("clockMs must not be negative: " + clockMs);
    }

    public boolean isDeleted() { return tombstone != null; }

    /** Same match, team, player, kind and clock: the natural key used for soft-delete restore. */
    public boolean sameOccurrenceAs(String teamId, String playerId, EventKind kind, long clockMs) {
        return this.kind == kind
                && this.clockMs == clockMs
                && Objects.equals(this.teamId, teamId)
                && Objects.equals(this.playerId, playerId);
    }

    public MatchEvent withTombstone(Tombstone t) {
        return new MatchEvent(id, matchId, kind, teamId, playerId, periodNumber, clockMs, notes, sentiment,
                createdAt, createdBy, t);
    }
}
