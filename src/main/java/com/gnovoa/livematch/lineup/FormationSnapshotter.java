package com.gnovoa.livematch.lineup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.livematch.broadcast.NotificationType;
import com.gnovoa.livematch.core.MatchGuard;
import com.gnovoa.livematch.core.PeriodTracker;
import com.gnovoa.livematch.core.PostCommitEffects;
import com.gnovoa.livematch.core.TransactionRunner;
import com.gnovoa.livematch.error.MatchOperationException;
import com.gnovoa.livematch.events.EventKind;
import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.ledger.EventDraft;
import com.gnovoa.livematch.ledger.EventLedger;
import com.gnovoa.livematch.model.FormationPlayer;
import com.gnovoa.livematch.model.FormationSnapshot;
import com.gnovoa.livematch.model.LineupEntry;
import com.gnovoa.livematch.model.Minutes;
import com.gnovoa.livematch.model.Period;
import com.gnovoa.livematch.model.Player;
import com.gnovoa.livematch.model.Requester;
import com.gnovoa.livematch.positions.PositionClassifier;
import com.gnovoa.livematch.quota.QuotaChecker;
import com.gnovoa.livematch.store.MatchTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Whole-squad formation snapshots.
 *
 * <p>A formation change closes the open snapshot and every open lineup entry, then opens a new
 * snapshot plus one lineup entry per listed player, all in one transaction. Players leaving and
 * joining are paired by index into inferred substitutions and the change is recorded on the
 * timeline as a {@code formation_change} event.
 */
public final class FormationSnapshotter {

    private static final Logger log = LoggerFactory.getLogger(FormationSnapshotter.class);

    /** Start minutes are unique per match; a collision moves the start forward at most this often. */
    static final int MAX_START_NUDGES = 100;

    private final TransactionRunner runner;
    private final MatchGuard guard;
    private final QuotaChecker quota;
    private final PeriodTracker periods;
    private final EventLedger ledger;
    private final PositionClassifier classifier;
    private final PostCommitEffects effects;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FormationSnapshotter(TransactionRunner runner, MatchGuard guard, QuotaChecker quota, PeriodTracker periods,
                                EventLedger ledger, PositionClassifier classifier, PostCommitEffects effects,
                                ObjectMapper mapper, Clock clock) {
        this.runner = runner;
        this.guard = guard;
        this.quota = quota;
        this.periods = periods;
        this.ledger = ledger;
        this.classifier = classifier;
        this.effects = effects;
        this.mapper = mapper;
        this.clock = clock;
    }

    public FormationChangeResult applyFormationChange(FormationChangeRequest req, Requester requester) {
        String key = req.idempotencyKey();
        boolean knownKey = key != null && runner.store().findEvent(key).filter(e -> !e.isDeleted()).isPresent();
        if (!knownKey) quota.checkFormationChange(requester, req.matchId());

        return runner.run(req.matchId(), tx -> {
            guard.requireWritable(tx, requester);
            if (key != null) {
                Optional<MatchEvent> recorded = tx.findEvent(key).filter(e -> !e.isDeleted());
                if (recorded.isPresent()) return replay(tx, recorded.get());
            }
            return change(tx, req, requester);
        });
    }

    /** Players of the open snapshot, or of the open lineup when no snapshot exists. */
    public FormationView currentFormation(String matchId, Requester requester) {
        return runner.run(matchId, tx -> {
            guard.require(tx.match(), requester);
            Optional<FormationSnapshot> open = openSnapshot(tx);
            if (open.isPresent()) {
                FormationSnapshot s = open.get();
                return new FormationView(matchId, FormationView.Source.SNAPSHOT, s.startMin(), shapeOf(s.players()),
                        s.players());
            }
            List<LineupEntry> lineup = LineupTracker.openEntries(tx);
            if (lineup.isEmpty()) return new FormationView(matchId, FormationView.Source.NONE, null, "", List.of());
            List<FormationPlayer> players = fromLineup(tx, lineup);
            BigDecimal start = lineup.stream().map(LineupEntry::startMin).max(BigDecimal::compareTo).orElse(null);
            return new FormationView(matchId, FormationView.Source.LINEUP, start, shapeOf(players), players);
        });
    }

    private FormationChangeResult change(MatchTransaction tx, FormationChangeRequest req, Requester requester) {
        Instant now = clock.instant();
        List<FormationSnapshot> all = tx.formations();
        FormationSnapshot previous = all.stream().filter(s -> s.isOpen() && !s.isDeleted()).findFirst().orElse(null);
        BigDecimal start = collisionFreeStart(all, req.atMinute());
        if (previous != null && start.compareTo(previous.startMin()) < 0) {
            throw MatchOperationException.conflict("Formation change at minute " + start
                    + " precedes the current formation starting at " + previous.startMin());
        }

        List<LineupEntry> openLineup = LineupTracker.openEntries(tx);
        List<FormationPlayer> before = previous != null ? previous.players() : fromLineup(tx, openLineup);
        List<FormationPlayer> after = req.formation().stream()
                .map(p -> p.withPosition(classify(p)))
                .map(p -> p.name() != null ? p : withName(tx, p))
                .toList();
        List<SubstitutionPair> substitutions = pairSubstitutions(before, after);

        if (previous != null) tx.updateFormation(previous.closeAt(start, req.reason()));
        Set<String> incoming = new LinkedHashSet<>(after.stream().map(FormationPlayer::playerId).toList());
        for (LineupEntry e : openLineup) {
            int cmp = e.startMin().compareTo(start);
            if (cmp < 0) {
                tx.updateLineup(e.closeAt(start, req.reason()));
            } else if (cmp > 0 || !incoming.contains(e.playerId())) {
                tx.updateLineup(e.closeAt(e.startMin(), req.reason()));
            }
        }
        Map<String, LineupEntry> atStart = new HashMap<>();
        tx.lineup().stream()
                .filter(e -> e.startMin().compareTo(start) == 0)
                .forEach(e -> atStart.put(e.playerId(), e));
        for (FormationPlayer p : after) {
            LineupEntry entry = new LineupEntry(req.matchId(), p.playerId(), start, null, p.position(), p.x(), p.y(),
                    req.reason(), null);
            if (atStart.containsKey(p.playerId())) tx.updateLineup(entry);
            else tx.insertLineup(entry);
        }

        FormationSnapshot snapshot = new FormationSnapshot(UUID.randomUUID().toString(), req.matchId(), start, null,
                after, req.reason(), now, requester.userId(), null);
        tx.insertFormation(snapshot);

        String from = shapeOf(before);
        String to = shapeOf(after);
        Optional<Period> openPeriod = periods.findOpen(tx);
        Integer periodNumber = openPeriod.map(Period::periodNumber).orElse(null);
        long clockMs = Minutes.toClockMs(start);
        String notes = writeNotes(new FormationChangeNotes(req.reason(), from, to, substitutions,
                new FormationChangeNotes.Formation(after)));
        MatchEvent event = ledger.append(tx, new EventDraft(req.idempotencyKey(), req.matchId(),
                EventKind.FORMATION_CHANGE, null, null, periodNumber, clockMs, notes, 0), requester.userId());

        FormationChangedPayload payload = new FormationChangedPayload(req.matchId(), now, periodNumber,
                openPeriod.map(Period::periodType).orElse(null), clockMs, req.reason(), after, before, substitutions);
        effects.broadcast(tx, NotificationType.FORMATION_CHANGED, () -> payload);

        log.info("Match {} formation {} -> {} at minute {} ({} substitutions)",
                req.matchId(), from.isEmpty() ? "none" : from, to, start, substitutions.size());
        return new FormationChangeResult(snapshot, previous, from, to, substitutions, event, false);
    }

    private FormationChangeResult replay(MatchTransaction tx, MatchEvent recorded) {
        if (!recorded.matchId().equals(tx.matchId()) || recorded.kind() != EventKind.FORMATION_CHANGE) {
            throw MatchOperationException.conflict("Key " + recorded.id() + " is already used by another event");
        }
        FormationSnapshot open = openSnapshot(tx).orElse(null);
        FormationChangeNotes notes = readNotes(recorded, open);
        log.debug("Replayed formation change {} on match {}", recorded.id(), tx.matchId());
        return new FormationChangeResult(open, null, notes.formationFrom(), notes.formationTo(),
                notes.substitutions() == null ? List.of() : notes.substitutions(), recorded, true);
    }

    /**
     * Pairs players leaving with players joining by list position. The longer side keeps its
     * extra players with a null counterpart.
     */
    static List<SubstitutionPair> pairSubstitutions(List<FormationPlayer> before, List<FormationPlayer> after) {
        Set<String> beforeIds = new LinkedHashSet<>(before.stream().map(FormationPlayer::playerId).toList());
        Set<String> afterIds = new LinkedHashSet<>(after.stream().map(FormationPlayer::playerId).toList());
        List<FormationPlayer> outs = before.stream().filter(p -> !afterIds.contains(p.playerId())).toList();
        List<FormationPlayer> ins = after.stream().filter(p -> !beforeIds.contains(p.playerId())).toList();
        List<SubstitutionPair> pairs = new ArrayList<>();
        int maxPairs = Math.max(outs.size(), ins.size());
        for (int i = 0; i < maxPairs; i++) {
            pairs.add(new SubstitutionPair(
                    i < outs.size() ? ref(outs.get(i)) : null,
                    i < ins.size() ? ref(ins.get(i)) : null));
        }
        return List.copyOf(pairs);
    }

    static BigDecimal collisionFreeStart(List<FormationSnapshot> existing, BigDecimal requested) {
        BigDecimal start = requested;
        for (int nudges = 0; nudges <= MAX_START_NUDGES; nudges++) {
            BigDecimal candidate = start;
            if (existing.stream().noneMatch(s -> s.startMin().compareTo(candidate) == 0)) return candidate;
            start = start.add(Minutes.EPSILON);
        }
        throw MatchOperationException.conflict("No free formation start near minute " + requested);
    }

    private static SubstitutionPair.PlayerRef ref(FormationPlayer p) {
        return new SubstitutionPair.PlayerRef(p.playerId(), p.name());
    }

    private String classify(FormationPlayer p) {
        return classifier.classify(p.x(), p.y());
    }

    private static FormationPlayer withName(MatchTransaction tx, FormationPlayer p) {
        String name = tx.player(p.playerId()).map(Player::name).orElse(null);
        return new FormationPlayer(p.playerId(), name, p.position(), p.x(), p.y());
    }

    private static List<FormationPlayer> fromLineup(MatchTransaction tx, List<LineupEntry> lineup) {
        return lineup.stream()
                .map(e -> new FormationPlayer(e.playerId(), tx.player(e.playerId()).map(Player::name).orElse(null),
                        e.position(), e.pitchX(), e.pitchY()))
                .toList();
    }

    private static String shapeOf(List<FormationPlayer> players) {
        return FormationShape.label(players.stream()
                .map(p -> p.position() == null ? PositionClassifier.FALLBACK_CODE : p.position())
                .toList());
    }

    private static Optional<FormationSnapshot> openSnapshot(MatchTransaction tx) {
        return tx.formations().stream().filter(s -> s.isOpen() && !s.isDeleted()).findFirst();
    }

    private String writeNotes(FormationChangeNotes notes) {
        try {
            return mapper.writeValueAsString(notes);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize formation change notes", e);
        }
    }

    /** Notes written by hand through the event API may not be ours; fall back to the open shape. */
    private FormationChangeNotes readNotes(MatchEvent recorded, FormationSnapshot open) {
        if (recorded.notes() != null) {
            try {
                return mapper.readValue(recorded.notes(), FormationChangeNotes.class);
            } catch (JsonProcessingException e) {
                log.warn("Formation change {} has unreadable notes, using the open formation", recorded.id(), e);
            }
        }
        String shape = open == null ? "" : shapeOf(open.players());
        return new FormationChangeNotes(null, shape, shape, List.of(), null);
    }
}
