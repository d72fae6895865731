package com.gnovoa.livematch.core;

import com.gnovoa.livematch.error.MatchOperationException;
import com.gnovoa.livematch.model.MatchState;
import com.gnovoa.livematch.model.Period;
import com.gnovoa.livematch.model.PeriodType;
import com.gnovoa.livematch.store.MatchTransaction;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Period log of a match. Used inside the transaction of the calling operation; at most one
 * period is open at any time and period numbers are assigned as max + 1.
 */
public final class PeriodTracker {

    public Period openPeriod(MatchTransaction tx, int periodNumber, PeriodType type, Instant at) {
        findOpen(tx).ifPresent(p -> {
            throw MatchOperationException.invalidTransition(
                    "Period " + p.periodNumber() + " is still open in match " + tx.matchId());
        });
        Period period = Period.open(UUID.randomUUID().toString(), tx.matchId(), periodNumber, type, at);
        tx.insertPeriod(period);
        return period;
    }

    public Period closePeriod(MatchTransaction tx, String periodId, Instant endedAt) {
        Period period = active(tx).stream()
                .filter(p -> p.id().equals(periodId))
                .findFirst()
                .orElseThrow(() -> MatchOperationException.notFound("Period not found: " + periodId));
        if (!period.isOpen()) {
            throw MatchOperationException.invalidTransition("Period " + period.periodNumber() + " is already closed");
        }
        Period closed = period.closeAt(endedAt);
        tx.updatePeriod(closed);
        return closed;
    }

    public Optional<Period> findOpen(MatchTransaction tx) {
        return active(tx).stream().filter(Period::isOpen).findFirst();
    }

    /** Deleted periods still hold their number. */
    public int nextPeriodNumber(MatchTransaction tx) {
        return tx.periods().stream().mapToInt(Period::periodNumber).max().orElse(0) + 1;
    }

    public List<Period> active(MatchTransaction tx) {
        return tx.periods().stream().filter(p -> !p.isDeleted()).toList();
    }

    /** Sum of the durations of closed, non-deleted periods. */
    public static long loggedSeconds(Collection<Period> periods) {
        return periods.stream()
                .filter(p -> !p.isDeleted() && !p.isOpen() && p.durationSeconds() != null)
                .mapToLong(Period::durationSeconds)
                .sum();
    }

    public static long liveElapsedSeconds(MatchState state, Instant now) {
        return state == null ? 0 : state.elapsedSecondsAt(now);
    }
}
