package com.gnovoa.livematch.query;

import com.gnovoa.livematch.model.MatchStatus;
import com.gnovoa.livematch.model.PeriodType;

import java.time.Instant;

/**
 * Scoreboard summary of a match. {@code elapsedSeconds} is computed when the view is returned,
 * so it keeps running while the match is live even when the rest comes from the cache.
 */
public record MatchStatusView(
        String matchId,
        TeamRef homeTeam,
        TeamRef awayTeam,
        Instant kickoffAt,
        String competition,
        String venue,
        int homeScore,
        int awayScore,
        MatchStatus status,
        Integer currentPeriodNumber,
        PeriodType currentPeriodType,
        Instant startedAt,
        Instant endedAt,
        long totalElapsedSeconds,
        long elapsedSeconds
) {

    public record TeamRef(String id, String name) {}
}
