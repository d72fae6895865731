package com.gnovoa.livematch.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A fixture between two teams. Owned outside the engine; the engine only writes the derived
 * score back onto it.
 */
public record Match(
        String matchId,
        String homeTeamId,
        String awayTeamId,
        Instant kickoffAt,
        String competition,
        String venue,
        Integer durationMinutes,
        int homeScore,
        int awayScore,
        String createdBy,
        Tombstone tombstone
) {

    public static Match scheduled(String matchId, String homeTeamId, String awayTeamId, String createdBy) {
        return new Match(matchId, homeTeamId, awayTeamId, null, null, null, null, 0, 0, createdBy, null);
    }

    public boolean isDeleted() { return tombstone != null; }

    public boolean involves(String teamId) {
        return teamId != null && (teamId.equals(homeTeamId) || teamId.equals(awayTeamId));
    }

    public boolean isHome(String teamId) {
        return Objects.equals(homeTeamId, teamId);
    }

    public boolean isAway(String teamId) {
        return Objects.equals(awayTeamId, teamId);
    }

    public Match withScore(int home, int away) {
        return new Match(matchId, homeTeamId, awayTeamId, kickoffAt, competition, venue, durationMinutes,
                home, away, createdBy, tombstone);
    }

    public Match withTombstone(Tombstone t) {
        return new Match(matchId, homeTeamId, awayTeamId, kickoffAt, competition, venue, durationMinutes,
                homeScore, awayScore, createdBy, t);
    }
}
