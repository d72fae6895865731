package com.gnovoa.livematch.ledger;

import com.gnovoa.livematch.broadcast.NotificationType;
import com.gnovoa.livematch.core.MatchGuard;
import com.gnovoa.livematch.core.PostCommitEffects;
import com.gnovoa.livematch.core.TransactionRunner;
import com.gnovoa.livematch.error.FailureKind;
import com.gnovoa.livematch.error.MatchOperationException;
import com.gnovoa.livematch.events.EventKind;
import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.model.Match;
import com.gnovoa.livematch.model.Requester;
import com.gnovoa.livematch.model.Tombstone;
import com.gnovoa.livematch.quota.QuotaChecker;
import com.gnovoa.livematch.store.MatchStore;
import com.gnovoa.livematch.store.MatchTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Append-only log of match events.
 *
 * <p>Writes are idempotent for offline clients:
 * <ul>
 *   <li>a client supplied id that is already stored returns the stored event unchanged</li>
 *   <li>an event matching a stored one on team, player, kind and clock reuses that row,
 *       restoring it when it was deleted</li>
 * </ul>
 * Rows are never removed; deletion sets a tombstone. Goal-affecting writes trigger a score
 * recompute after commit.
 */
public final class EventLedger {

    private static final Logger log = LoggerFactory.getLogger(EventLedger.class);

    /** Timeline order: match clock, then creation time. */
    public static final Comparator<MatchEvent> TIMELINE_ORDER = Comparator
            .comparingLong(MatchEvent::clockMs)
            .thenComparing(MatchEvent::createdAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(MatchEvent::id);

    private final TransactionRunner runner;
    private final MatchGuard guard;
    private final QuotaChecker quota;
    private final PostCommitEffects effects;
    private final Clock clock;

    public EventLedger(TransactionRunner runner, MatchGuard guard, QuotaChecker quota,
                       PostCommitEffects effects, Clock clock) {
        this.runner = runner;
        this.guard = guard;
        this.quota = quota;
        this.effects = effects;
        this.clock = clock;
    }

    public MatchEvent create(EventDraft draft, Requester requester) {
        if (!isStored(draft.id())) quota.checkEventCreate(requester, draft.matchId(), draft.kind());
        return runner.run(draft.matchId(), tx -> {
            Match match = guard.requireWritable(tx, requester);
            validateReferences(tx, match, draft.kind(), draft.teamId(), draft.playerId());
            return append(tx, draft, requester.userId());
        });
    }

    /**
     * Records {@code draft} inside an already open transaction, without quota or reference checks.
     * A new or restored row is broadcast as {@code event_created} after commit.
     *
     * @return the stored event, which is an existing row on replay
     */
    public MatchEvent append(MatchTransaction tx, EventDraft draft, String createdBy) {
        if (!draft.matchId().equals(tx.matchId())) {
            throw new IllegalArgumentException("Draft for match " + draft.matchId() + " in transaction of " + tx.matchId());
        }
        Instant now = clock.instant();
        if (draft.id() != null) {
            Optional<MatchEvent> sameId = tx.findEvent(draft.id());
            if (sameId.isPresent()) {
                MatchEvent stored = sameId.get();
                if (!stored.matchId().equals(draft.matchId())) {
                    throw MatchOperationException.conflict("Event id " + draft.id() + " belongs to another match");
                }
                if (!stored.isDeleted()) {
                    log.debug("Replayed event {} on match {}", stored.id(), stored.matchId());
                    return stored;
                }
                return restore(tx, stored.id(), draft, now, createdBy);
            }
        }

        Optional<MatchEvent> duplicate = tx.events().stream()
                .filter(e -> e.sameOccurrenceAs(draft.teamId(), draft.playerId(), draft.kind(), draft.clockMs()))
                .min(Comparator.comparing(MatchEvent::isDeleted));
        if (duplicate.isPresent()) {
            MatchEvent stored = duplicate.get();
            if (!stored.isDeleted()) {
                log.debug("Event {} already recorded as {}", draft.kind().wireName(), stored.id());
                return stored;
            }
            return restore(tx, stored.id(), draft, now, createdBy);
        }

        String id = draft.id() != null ? draft.id() : UUID.randomUUID().toString();
        MatchEvent event = build(id, draft, now, createdBy);
        tx.insertEvent(event);
        afterWrite(tx, event, null, NotificationType.EVENT_CREATED);
        log.debug("Event {} {} recorded on match {}", event.kind().wireName(), event.id(), event.matchId());
        return event;
    }

    public MatchEvent update(String eventId, EventPatch patch, Requester requester) {
        requireEventId(eventId);
        if (patch == null) throw new IllegalArgumentException("patch is required");
        MatchEvent current = findLive(eventId);
        if (patch.kind() != null && patch.kind() != current.kind()) {
            quota.checkKindChange(requester, current.matchId(), patch.kind());
        }
        return runner.run(current.matchId(), tx -> {
            Match match = guard.requireWritable(tx, requester);
            MatchEvent stored = liveInTransaction(tx, eventId);
            MatchEvent next = new MatchEvent(
                    stored.id(),
                    stored.matchId(),
                    patch.kind() != null ? patch.kind() : stored.kind(),
                    patch.teamId() != null ? patch.teamId() : stored.teamId(),
                    patch.playerId() != null ? patch.playerId() : stored.playerId(),
                    patch.periodNumber() != null ? patch.periodNumber() : stored.periodNumber(),
                    patch.clockMs() != null ? patch.clockMs() : stored.clockMs(),
                    patch.notes() != null ? patch.notes() : stored.notes(),
                    patch.sentiment() != null ? patch.sentiment() : stored.sentiment(),
                    stored.createdAt(),
                    stored.createdBy(),
                    null
            );
            validateReferences(tx, match, next.kind(), next.teamId(), next.playerId());
            tx.updateEvent(next);
            afterWrite(tx, next, stored.kind(), NotificationType.EVENT_UPDATED);
            return next;
        });
    }

    public MatchEvent delete(String eventId, Requester requester) {
        requireEventId(eventId);
        MatchEvent current = findLive(eventId);
        return runner.run(current.matchId(), tx -> {
            guard.requireWritable(tx, requester);
            MatchEvent stored = liveInTransaction(tx, eventId);
            MatchEvent deleted = stored.withTombstone(new Tombstone(clock.instant(), requester.userId()));
            tx.updateEvent(deleted);
            afterWrite(tx, deleted, null, NotificationType.EVENT_DELETED);
            log.info("Event {} deleted from match {} by {}", eventId, deleted.matchId(), requester.userId());
            return deleted;
        });
    }

    /** Live events of the match in timeline order. */
    public List<MatchEvent> timeline(String matchId, Requester requester) {
        return runner.run(matchId, tx -> {
            guard.require(tx.match(), requester);
            return liveTimeline(tx);
        });
    }

    public static List<MatchEvent> liveTimeline(MatchTransaction tx) {
        return tx.events().stream().filter(e -> !e.isDeleted()).sorted(TIMELINE_ORDER).toList();
    }

    /**
     * Applies every entry of the batch independently. A rejected entry is reported in the result
     * and does not stop the remaining ones.
     */
    public BatchResult applyBatch(BatchRequest batch, Requester requester) {
        List<BatchResult.Item> items = new ArrayList<>();
        for (int i = 0; i < batch.creates().size(); i++) {
            EventDraft d = batch.creates().get(i);
            String id = d == null ? null : d.id();
            items.add(applyEntry(BatchResult.Operation.CREATE, i, id, () -> {
                if (d == null) throw MatchOperationException.invalidInput("Create entry has no event");
                return create(d, requester);
            }));
        }
        for (int i = 0; i < batch.updates().size(); i++) {
            BatchRequest.Update u = batch.updates().get(i);
            String id = u == null ? null : u.eventId();
            items.add(applyEntry(BatchResult.Operation.UPDATE, i, id, () -> {
                if (u == null || isBlank(u.eventId())) throw MatchOperationException.invalidInput("Update entry has no event id");
                if (u.patch() == null) throw MatchOperationException.invalidInput("Update of " + u.eventId() + " has no changes");
                return update(u.eventId(), u.patch(), requester);
            }));
        }
        for (int i = 0; i < batch.deletes().size(); i++) {
            String id = batch.deletes().get(i);
            items.add(applyEntry(BatchResult.Operation.DELETE, i, id, () -> {
                if (isBlank(id)) throw MatchOperationException.invalidInput("Delete entry has no event id");
                return delete(id, requester);
            }));
        }
        BatchResult result = new BatchResult(List.copyOf(items));
        log.info("Batch by {}: {} entries, {} rejected", requester.userId(), items.size(), result.failures());
        return result;
    }

    private static BatchResult.Item applyEntry(BatchResult.Operation op, int index, String eventId,
                                               Supplier<MatchEvent> entry) {
        try {
            MatchEvent e = entry.get();
            return new BatchResult.Item(op, index, e.id(), e, null, null);
        } catch (MatchOperationException e) {
            return new BatchResult.Item(op, index, eventId, null, e.kind(), e.getMessage());
        } catch (IllegalArgumentException e) {
            return new BatchResult.Item(op, index, eventId, null, FailureKind.INVALID_INPUT, e.getMessage());
        }
    }

    private static void requireEventId(String eventId) {
        if (isBlank(eventId)) throw new IllegalArgumentException("eventId is required");
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private MatchEvent restore(MatchTransaction tx, String id, EventDraft draft, Instant now, String createdBy) {
        MatchEvent restored = build(id, draft, now, createdBy);
        tx.updateEvent(restored);
        afterWrite(tx, restored, null, NotificationType.EVENT_CREATED);
        log.debug("Restored deleted event {} on match {}", id, restored.matchId());
        return restored;
    }

    private void afterWrite(MatchTransaction tx, MatchEvent event, EventKind previousKind, NotificationType type) {
        if (event.kind().affectsScore() || (previousKind != null && previousKind.affectsScore())) {
            effects.recomputeScore(tx);
        }
        effects.invalidateStatus(tx);
        MatchStore store = runner.store();
        effects.broadcast(tx, type, () -> EventView.of(event, store));
    }

    private static MatchEvent build(String id, EventDraft d, Instant now, String createdBy) {
        return new MatchEvent(id, d.matchId(), d.kind(), d.teamId(), d.playerId(), d.periodNumber(), d.clockMs(),
                d.notes(), d.sentiment(), now, createdBy, null);
    }

    private boolean isStored(String eventId) {
        return eventId != null && runner.store().findEvent(eventId).filter(e -> !e.isDeleted()).isPresent();
    }

    private MatchEvent findLive(String eventId) {
        return runner.store().findEvent(eventId)
                .filter(e -> !e.isDeleted())
                .orElseThrow(() -> MatchOperationException.notFound("Event not found: " + eventId));
    }

    private static MatchEvent liveInTransaction(MatchTransaction tx, String eventId) {
        return tx.findEvent(eventId)
                .filter(e -> !e.isDeleted() && e.matchId().equals(tx.matchId()))
                .orElseThrow(() -> MatchOperationException.notFound("Event not found: " + eventId));
    }

    /**
     * The team must play in the match and the player must be an active member of that team. Goals
     * need a team; a player given without team must belong to one of the two sides.
     */
    static void validateReferences(MatchTransaction tx, Match match, EventKind kind, String teamId, String playerId) {
        if (teamId == null) {
            if (kind.affectsScore()) {
                throw MatchOperationException.invalidReference("A " + kind.wireName() + " event needs a team");
            }
            if (playerId != null
                    && !tx.hasActiveMembership(playerId, match.homeTeamId())
                    && !tx.hasActiveMembership(playerId, match.awayTeamId())) {
                throw MatchOperationException.invalidReference("Player " + playerId + " plays for neither side");
            }
            return;
        }
        if (!match.involves(teamId)) {
            throw MatchOperationException.invalidReference("Team " + teamId + " does not play in match " + match.matchId());
        }
        if (playerId != null && !tx.hasActiveMembership(playerId, teamId)) {
            throw MatchOperationException.invalidReference(
                    "Player " + playerId + " is not an active member of team " + teamId);
        }
    }
}
