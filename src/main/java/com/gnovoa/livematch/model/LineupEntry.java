package com.gnovoa.livematch.model;

import java.math.BigDecimal;

/**
 * A player's on-pitch interval within a match, keyed by {@code (matchId, playerId, startMin)}.
 * The player is on the pitch while {@code endMin} is null.
 */
public record LineupEntry(
        String matchId,
        String playerId,
        BigDecimal startMin,
        BigDecimal endMin,
        String position,
        Double pitchX,
        Double pitchY,
        String substitutionReason,
        Tombstone tombstone
) {

    public LineupEntry {
        startMin = Minutes.of(startMin);
        endMin = Minutes.of(endMin);
    }

    public static LineupEntry open(String matchId, String playerId, BigDecimal startMin, String position,
                                   Double pitchX, Double pitchY, String reason) {
        return new LineupEntry(matchId, playerId, startMin, null, position, pitchX, pitchY, reason, null);
    }

    public boolean isOpen() { return endMin == null; }

    public boolean isDeleted() { return tombstone != null; }

    public LineupEntry closeAt(BigDecimal minute, String reason) {
        return new LineupEntry(matchId, playerId, startMin, minute, position, pitchX, pitchY,
                reason != null ? reason : substitutionReason, tombstone);
    }

    public LineupEntry withTombstone(Tombstone t) {
        return new LineupEntry(matchId, playerId, startMin, endMin, position, pitchX, pitchY, substitutionReason, t);
    }
}
