package com.gnovoa.livematch.events;

import com.gnovoa.livematch.model.MatchState;
import com.gnovoa.livematch.model.PeriodType;

import java.time.Instant;

/** Clock view carried in state notifications so viewers can render without a follow-up read. */
public record MatchClockSnapshot(
        String status,
        Integer period,
        PeriodType periodType,
        long elapsedSeconds,
        int minute,
        Instant activeSince
) {

    public static MatchClockSnapshot of(MatchState state, Instant now) {
        long elapsed = state.elapsedSecondsAt(now);
        return new MatchClockSnapshot(
                state.status().name(),
                state.currentPeriodNumber(),
                state.currentPeriodType(),
                elapsed,
                (int) (elapsed / 60),
                state.activeSince()
        );
    }
}
