package com.gnovoa.livematch.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/** Whole-squad positions from {@code startMin} until {@code endMin} (open while null). */
public record FormationSnapshot(
        String id,
        String matchId,
        BigDecimal startMin,
        BigDecimal endMin,
        List<FormationPlayer> players,
        String substitutionReason,
        Instant createdAt,
        String createdBy,
        Tombstone tombstone
) {

    public FormationSnapshot {
        startMin = Minutes.of(startMin);
        endMin = Minutes.of(endMin);
        players = players == null ? List.of() : List.copyOf(players);
    }

    public boolean isOpen() { return endMin == null; }

    public boolean isDeleted() { return tombstone != null; }

    public FormationSnapshot closeAt(BigDecimal minute, String reason) {
        return new FormationSnapshot(id, matchId, startMin, minute, players,
                reason != null ? reason : substitutionReason, createdAt, createdBy, tombstone);
    }

    public FormationSnapshot withTombstone(Tombstone t) {
        return new FormationSnapshot(id, matchId, startMin, endMin, players, substitutionReason, createdAt, createdBy, t);
    }
}
