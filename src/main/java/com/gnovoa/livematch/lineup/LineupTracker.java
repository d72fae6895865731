package com.gnovoa.livematch.lineup;

import com.gnovoa.livematch.core.MatchGuard;
import com.gnovoa.livematch.core.PeriodTracker;
import com.gnovoa.livematch.core.TransactionRunner;
import com.gnovoa.livematch.error.FailureKind;
import com.gnovoa.livematch.error.MatchOperationException;
import com.gnovoa.livematch.events.EventKind;
import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.ledger.EventDraft;
import com.gnovoa.livematch.ledger.EventLedger;
import com.gnovoa.livematch.model.LineupEntry;
import com.gnovoa.livematch.model.Match;
import com.gnovoa.livematch.model.Minutes;
import com.gnovoa.livematch.model.Period;
import com.gnovoa.livematch.model.Requester;
import com.gnovoa.livematch.store.MatchTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** On-pitch intervals of players. A player has at most one open entry per match. */
public final class LineupTracker {

    private static final Logger log = LoggerFactory.getLogger(LineupTracker.class);

    private final TransactionRunner runner;
    private final MatchGuard guard;
    private final PeriodTracker periods;
    private final EventLedger ledger;

    public LineupTracker(TransactionRunner runner, MatchGuard guard, PeriodTracker periods, EventLedger ledger) {
        this.runner = runner;
        this.guard = guard;
        this.periods = periods;
        this.ledger = ledger;
    }

    /**
     * Swaps two players at {@code atMinute} in one transaction and records a
     * {@code substitution_off} / {@code substitution_on} pair on the timeline.
     */
    public SubstitutionResult substitute(SubstitutionRequest req, Requester requester) {
        return runner.run(req.matchId(), tx -> {
            Match match = guard.requireWritable(tx, requester);
            BigDecimal at = req.atMinute();

            LineupEntry off = openEntry(tx, req.playerOffId())
                    .filter(e -> e.startMin().compareTo(at) <= 0)
                    .orElseThrow(() -> new MatchOperationException(FailureKind.PLAYER_NOT_ON_PITCH,
                            "Player " + req.playerOffId() + " is not on the pitch at minute " + at));
            if (openEntry(tx, req.playerOnId()).isPresent()) {
                throw MatchOperationException.conflict("Player " + req.playerOnId() + " is already on the pitch");
            }

            LineupEntry closed = off.closeAt(at, req.reason());
            tx.updateLineup(closed);
            LineupEntry opened = LineupEntry.open(req.matchId(), req.playerOnId(), at, req.position(), null, null,
                    req.reason());
            tx.insertLineup(opened);

            Integer period = periods.findOpen(tx).map(Period::periodNumber).orElse(null);
            long clockMs = Minutes.toClockMs(at);
            MatchEvent offEvent = ledger.append(tx, new EventDraft(null, req.matchId(), EventKind.SUBSTITUTION_OFF,
                    teamOf(tx, match, req.playerOffId()), req.playerOffId(), period, clockMs, req.reason(), 0),
                    requester.userId());
            MatchEvent onEvent = ledger.append(tx, new EventDraft(null, req.matchId(), EventKind.SUBSTITUTION_ON,
                    teamOf(tx, match, req.playerOnId()), req.playerOnId(), period, clockMs, req.reason(), 0),
                    requester.userId());

            log.info("Match {}: {} replaced by {} at minute {}", req.matchId(), req.playerOffId(), req.playerOnId(), at);
            return new SubstitutionResult(closed, opened, List.of(offEvent, onEvent));
        });
    }

    /** Open entries ordered by start minute. */
    public List<LineupEntry> currentLineup(String matchId, Requester requester) {
        return runner.run(matchId, tx -> {
            guard.require(tx.match(), requester);
            return openEntries(tx);
        });
    }

    static List<LineupEntry> openEntries(MatchTransaction tx) {
        return tx.lineup().stream()
                .filter(e -> e.isOpen() && !e.isDeleted())
                .sorted(Comparator.comparing(LineupEntry::startMin).thenComparing(LineupEntry::playerId))
                .toList();
    }

    private static Optional<LineupEntry> openEntry(MatchTransaction tx, String playerId) {
        return tx.lineup().stream()
                .filter(e -> e.isOpen() && !e.isDeleted() && e.playerId().equals(playerId))
                .findFirst();
    }

    private static String teamOf(MatchTransaction tx, Match match, String playerId) {
        if (tx.hasActiveMembership(playerId, match.homeTeamId())) return match.homeTeamId();
        if (tx.hasActiveMembership(playerId, match.awayTeamId())) return match.awayTeamId();
        return null;
    }
}
