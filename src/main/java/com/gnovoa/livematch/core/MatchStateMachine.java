package com.gnovoa.livematch.core;

import com.gnovoa.livematch.broadcast.NotificationType;
import com.gnovoa.livematch.error.MatchOperationException;
import com.gnovoa.livematch.events.MatchClockSnapshot;
import com.gnovoa.livematch.model.MatchState;
import com.gnovoa.livematch.model.MatchStatus;
import com.gnovoa.livematch.model.Period;
import com.gnovoa.livematch.model.PeriodType;
import com.gnovoa.livematch.model.Requester;
import com.gnovoa.livematch.store.MatchTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Lifecycle of a match: status transitions, period start/end and clock accounting.
 *
 * <p>Every operation runs in one transaction that re-reads the state, checks the transition
 * against {@link MatchStatus} and writes. A rejected call leaves the state untouched. There is no
 * tick: while live, elapsed time is derived from {@code activeSince}.
 */
public final class MatchStateMachine {

    private static final Logger log = LoggerFactory.getLogger(MatchStateMachine.class);

    private final TransactionRunner runner;
    private final MatchGuard guard;
    private final PeriodTracker periods;
    private final PostCommitEffects effects;
    private final Clock clock;

    public MatchStateMachine(TransactionRunner runner, MatchGuard guard, PeriodTracker periods,
                             PostCommitEffects effects, Clock clock) {
        this.runner = runner;
        this.guard = guard;
        this.periods = periods;
        this.effects = effects;
        this.clock = clock;
    }

    /** SCHEDULED to LIVE. Opens period 1 (REGULAR) when the match has no period yet. */
    public MatchState start(String matchId, Requester requester) {
        return goLive(matchId, requester, true);
    }

    /** PAUSED to LIVE; on a never started match it behaves like {@link #start}. */
    public MatchState resume(String matchId, Requester requester) {
        return goLive(matchId, requester, false);
    }

    public MatchState pause(String matchId, String reason, Requester requester) {
        return runner.run(matchId, tx -> {
            guard.requireWritable(tx, requester);
            MatchState current = existing(tx);
            require(current, MatchStatus.PAUSED);
            Instant now = clock.instant();
            MatchState next = stopClock(current, now).withStatus(MatchStatus.PAUSED);
            tx.saveState(next);
            changed(tx, requester, current, next, reason, now);
            return next;
        });
    }

    /** Closes the open period; the total becomes the sum of the period durations. */
    public MatchState complete(String matchId, Requester requester) {
        return runner.run(matchId, tx -> {
            guard.requireWritable(tx, requester);
            MatchState current = existing(tx);
            require(current, MatchStatus.COMPLETED);
            Instant now = clock.instant();
            Optional<Period> closed = periods.findOpen(tx).map(p -> periods.closePeriod(tx, p.id(), now));
            MatchState next = current
                    .withStatus(MatchStatus.COMPLETED)
                    .withTotalElapsedSeconds(PeriodTracker.loggedSeconds(periods.active(tx)))
                    .withActiveSince(null)
                    .withEndedAt(now);
            tx.saveState(next);
            closed.ifPresent(p -> effects.broadcast(tx, NotificationType.PERIOD_ENDED,
                    () -> new PeriodChange(matchId, p, MatchClockSnapshot.of(next, now))));
            changed(tx, requester, current, next, null, now);
            return next;
        });
    }

    /** Creates the state when absent so a match can be called off before it ever started. */
    public MatchState cancel(String matchId, String reason, Requester requester) {
        return runner.run(matchId, tx -> {
            guard.requireWritable(tx, requester);
            MatchState current = tx.state().orElseGet(() -> MatchState.scheduled(matchId));
            require(current, MatchStatus.CANCELLED);
            Instant now = clock.instant();
            MatchState next = current.withStatus(MatchStatus.CANCELLED).withEndedAt(now);
            tx.saveState(next);
            changed(tx, requester, current, next, reason, now);
            return next;
        });
    }

    public MatchState postpone(String matchId, String reason, Requester requester) {
        return runner.run(matchId, tx -> {
            guard.requireWritable(tx, requester);
            MatchState current = tx.state().orElseGet(() -> MatchState.scheduled(matchId));
            require(current, MatchStatus.POSTPONED);
            Instant now = clock.instant();
            MatchState next = current.withStatus(MatchStatus.POSTPONED);
            tx.saveState(next);
            changed(tx, requester, current, next, reason, now);
            return next;
        });
    }

    /** POSTPONED back to SCHEDULED. */
    public MatchState reschedule(String matchId, Requester requester) {
        return runner.run(matchId, tx -> {
            guard.requireWritable(tx, requester);
            MatchState current = existing(tx);
            require(current, MatchStatus.SCHEDULED);
            Instant now = clock.instant();
            MatchState next = current.withStatus(MatchStatus.SCHEDULED);
            tx.saveState(next);
            changed(tx, requester, current, next, null, now);
            return next;
        });
    }

    /**
     * Opens the next period of a live or paused match and mirrors it on the state. A paused match
     * goes live again.
     */
    public PeriodChange startPeriod(String matchId, PeriodType type, Requester requester) {
        PeriodType periodType = type == null ? PeriodType.REGULAR : type;
        return runner.run(matchId, tx -> {
            guard.requireWritable(tx, requester);
            MatchState current = existing(tx);
            if (current.status() != MatchStatus.LIVE && current.status() != MatchStatus.PAUSED) {
                throw MatchOperationException.invalidTransition(
                        "Cannot start a period while the match is " + current.status());
            }
            Instant now = clock.instant();
            Period period = periods.openPeriod(tx, periods.nextPeriodNumber(tx), periodType, now);
            MatchState next = current.withCurrentPeriod(period.periodNumber(), period.periodType());
            if (current.status() == MatchStatus.PAUSED) {
                next = next.withStatus(MatchStatus.LIVE).withActiveSince(now);
            }
            tx.saveState(next);
            PeriodChange change = new PeriodChange(matchId, period, MatchClockSnapshot.of(next, now));
            effects.broadcast(tx, NotificationType.PERIOD_STARTED, () -> change);
            changed(tx, requester, current, next, null, now);
            return change;
        });
    }

    /** Closes the period; a live match is paused with the running delta folded in. */
    public PeriodChange endPeriod(String matchId, String periodId, Requester requester) {
        return runner.run(matchId, tx -> {
            guard.requireWritable(tx, requester);
            MatchState current = existing(tx);
            Instant now = clock.instant();
            Period closed = periods.closePeriod(tx, periodId, now);
            MatchState next = current;
            if (current.status() == MatchStatus.LIVE) {
                next = stopClock(current, now).withStatus(MatchStatus.PAUSED);
            }
            tx.saveState(next);
            PeriodChange change = new PeriodChange(matchId, closed, MatchClockSnapshot.of(next, now));
            effects.broadcast(tx, NotificationType.PERIOD_ENDED, () -> change);
            changed(tx, requester, current, next, null, now);
            return change;
        });
    }

    private MatchState goLive(String matchId, Requester requester, boolean restartClock) {
        return runner.run(matchId, tx -> {
            guard.requireWritable(tx, requester);
            MatchState current = tx.state().orElseGet(() -> MatchState.scheduled(matchId));
            require(current, MatchStatus.LIVE);
            Instant now = clock.instant();
            MatchState next = current.withStatus(MatchStatus.LIVE).withActiveSince(now);
            if (restartClock || current.startedAt() == null) next = next.withStartedAt(now);
            if (periods.active(tx).isEmpty()) {
                Period first = periods.openPeriod(tx, periods.nextPeriodNumber(tx), PeriodType.REGULAR, now);
                next = next.withCurrentPeriod(first.periodNumber(), first.periodType());
                MatchState opened = next;
                effects.broadcast(tx, NotificationType.PERIOD_STARTED,
                        () -> new PeriodChange(matchId, first, MatchClockSnapshot.of(opened, now)));
            }
            tx.saveState(next);
            changed(tx, requester, current, next, null, now);
            return next;
        });
    }

    /** Folds the whole seconds since {@code activeSince} into the total. */
    private static MatchState stopClock(MatchState state, Instant now) {
        if (state.activeSince() == null) return state;
        long delta = Math.max(0, Duration.between(state.activeSince(), now).toSeconds());
        return state.withTotalElapsedSeconds(state.totalElapsedSeconds() + delta).withActiveSince(null);
    }

    private static MatchState existing(MatchTransaction tx) {
        return tx.state()
                .filter(s -> !s.isDeleted())
                .orElseThrow(() -> MatchOperationException.notFound("Match " + tx.matchId() + " has no live state"));
    }

    private static void require(MatchState current, MatchStatus target) {
        if (!current.status().canTransitionTo(target)) {
            throw MatchOperationException.invalidTransition(
                    "Match " + current.matchId() + " cannot go from " + current.status() + " to " + target);
        }
    }

    private void changed(MatchTransaction tx, Requester requester, MatchState from, MatchState to,
                         String reason, Instant now) {
        effects.recomputeScore(tx);
        effects.invalidateMatch(tx, requester);
        if (from.status() != to.status()) {
            StateChange change = new StateChange(tx.matchId(), from.status(), to.status(), reason,
                    MatchClockSnapshot.of(to, now));
            effects.broadcast(tx, NotificationType.STATE_CHANGED, () -> change);
            log.info("Match {} {} -> {}{}", tx.matchId(), from.status(), to.status(),
                    reason == null ? "" : " (" + reason + ")");
        }
    }
}
