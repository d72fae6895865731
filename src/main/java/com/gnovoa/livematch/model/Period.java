package com.gnovoa.livematch.model;

import java.time.Duration;
import java.time.Instant;

/** A played period (half, extra-time half, shootout). Open while {@code endedAt} is null. */
public record Period(
        String id,
        String matchId,
        int periodNumber,
        PeriodType periodType,
        Instant startedAt,
        Instant endedAt,
        Long durationSeconds,
        Tombstone tombstone
) {

    public static Period open(String id, String matchId, int periodNumber, PeriodType type, Instant startedAt) {
        return new Period(id, matchId, periodNumber, type, startedAt, null, null, null);
    }

    public boolean isOpen() { return endedAt == null; }

    public boolean isDeleted() { return tombstone != null; }

    /**
     * Closes the period; duration is rounded up to the next whole second.
     *
     * @param at end instant
     * @return closed copy of this period
     */
    public Period closeAt(Instant at) {
        long millis = Math.max(0, Duration.between(startedAt, at).toMillis());
        long seconds = (millis + 999) / 1000;
        return new Period(id, matchId, periodNumber, periodType, startedAt, at, seconds, tombstone);
    }

    public Period withTombstone(Tombstone t) {
        return new Period(id, matchId, periodNumber, periodType, startedAt, endedAt, durationSeconds, t);
    }
}
