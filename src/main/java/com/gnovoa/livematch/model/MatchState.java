package com.gnovoa.livematch.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Persisted lifecycle state of a single match.
 *
 * <p>This record owns:
 * <ul>
 *   <li>The lifecycle status (see {@link MatchStatus} for the transition table)</li>
 *   <li>The period currently being played, mirrored from the period log</li>
 *   <li>Clock accounting: {@code totalElapsedSeconds} plus {@code activeSince}</li>
 * </ul>
 *
 * <p>{@code activeSince} is non-null iff the status is {@link MatchStatus#LIVE}. The clock is
 * never ticked: the live elapsed time is always {@code totalElapsedSeconds} plus the delta since
 * {@code activeSince}.
 */
public record MatchState(
        String matchId,
        MatchStatus status,
        Integer currentPeriodNumber,
        PeriodType currentPeriodType,
        Instant startedAt,
        Instant endedAt,
        long totalElapsedSeconds,
        Instant activeSince,
        Tombstone tombstone
) {

    /** Initial state, created lazily on the first status-changing call for a match. */
    public static MatchState scheduled(String matchId) {
        return new MatchState(matchId, MatchStatus.SCHEDULED, null, null, null, null, 0, null, null);
    }

    public boolean isDeleted() { return tombstone != null; }

    /**
     * Elapsed playing time at {@code now}.
     *
     * @param now instant the clock is read at
     * @return stored total plus the running delta when live
     */
    public long elapsedSecondsAt(Instant now) {
        if (status != MatchStatus.LIVE || activeSince == null) return totalElapsedSeconds;
        return totalElapsedSeconds + Math.max(0, Duration.between(activeSince, now).toSeconds());
    }

    public MatchState withStatus(MatchStatus s) {
        return new MatchState(matchId, s, currentPeriodNumber, currentPeriodType, startedAt, endedAt,
                totalElapsedSeconds, activeSince, tombstone);
    }

    public MatchState withCurrentPeriod(Integer number, PeriodType type) {
        return new MatchState(matchId, status, number, type, startedAt, endedAt,
                totalElapsedSeconds, activeSince, tombstone);
    }

    public MatchState withStartedAt(Instant t) {
        return new MatchState(matchId, status, currentPeriodNumber, currentPeriodType, t, endedAt,
                totalElapsedSeconds, activeSince, tombstone);
    }

    public MatchState withEndedAt(Instant t) {
        return new MatchState(matchId, status, currentPeriodNumber, currentPeriodType, startedAt, t,
                totalElapsedSeconds, activeSince, tombstone);
    }

    public MatchState withTotalElapsedSeconds(long seconds) {
        return new MatchState(matchId, status, currentPeriodNumber, currentPeriodType, startedAt, endedAt,
                seconds, activeSince, tombstone);
    }

    public MatchState withActiveSince(Instant t) {
        return new MatchState(matchId, status, currentPeriodNumber, currentPeriodType, startedAt, endedAt,
                totalElapsedSeconds, t, tombstone);
    }

    public MatchState withTombstone(Tombstone t) {
        return new MatchState(matchId, status, currentPeriodNumber, currentPeriodType, startedAt, endedAt,
                totalElapsedSeconds, activeSince, t);
    }
}
