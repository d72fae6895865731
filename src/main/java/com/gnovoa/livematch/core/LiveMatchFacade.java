package com.gnovoa.livematch.core;

import com.gnovoa.livematch.access.ViewerLink;
import com.gnovoa.livematch.broadcast.BroadcastHub;
import com.gnovoa.livematch.broadcast.MatchSubscriber;
import com.gnovoa.livematch.broadcast.Subscription;
import com.gnovoa.livematch.error.MatchOperationException;
import com.gnovoa.livematch.error.OperationResult;
import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.ledger.BatchRequest;
import com.gnovoa.livematch.ledger.BatchResult;
import com.gnovoa.livematch.ledger.EventDraft;
import com.gnovoa.livematch.ledger.EventLedger;
import com.gnovoa.livematch.ledger.EventPatch;
import com.gnovoa.livematch.lineup.FormationChangeRequest;
import com.gnovoa.livematch.lineup.FormationChangeResult;
import com.gnovoa.livematch.lineup.FormationSnapshotter;
import com.gnovoa.livematch.lineup.FormationView;
import com.gnovoa.livematch.lineup.LineupTracker;
import com.gnovoa.livematch.lineup.SubstitutionRequest;
import com.gnovoa.livematch.lineup.SubstitutionResult;
import com.gnovoa.livematch.model.LineupEntry;
import com.gnovoa.livematch.model.MatchState;
import com.gnovoa.livematch.model.Period;
import com.gnovoa.livematch.model.PeriodType;
import com.gnovoa.livematch.model.Requester;
import com.gnovoa.livematch.query.MatchReadService;
import com.gnovoa.livematch.query.MatchSnapshot;
import com.gnovoa.livematch.query.MatchStatusView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point of the engine: one operation per user action. Rejections come back as failed
 * {@link OperationResult}s instead of exceptions.
 */
@Component
public final class LiveMatchFacade {

    private static final Logger log = LoggerFactory.getLogger(LiveMatchFacade.class);

    private final MatchStateMachine stateMachine;
    private final EventLedger ledger;
    private final LineupTracker lineup;
    private final FormationSnapshotter formations;
    private final MatchReadService reads;
    private final BroadcastHub hub;

    public LiveMatchFacade(MatchStateMachine stateMachine, EventLedger ledger, LineupTracker lineup,
                           FormationSnapshotter formations, MatchReadService reads, BroadcastHub hub) {
        this.stateMachine = stateMachine;
        this.ledger = ledger;
        this.lineup = lineup;
        this.formations = formations;
        this.reads = reads;
        this.hub = hub;
    }

    // lifecycle

    public OperationResult<MatchState> start(String matchId, Requester requester) {
        return attempt("start", matchId, () -> stateMachine.start(matchId, requester));
    }

    public OperationResult<MatchState> pause(String matchId, String reason, Requester requester) {
        return attempt("pause", matchId, () -> stateMachine.pause(matchId, reason, requester));
    }

    public OperationResult<MatchState> resume(String matchId, Requester requester) {
        return attempt("resume", matchId, () -> stateMachine.resume(matchId, requester));
    }

    public OperationResult<MatchState> complete(String matchId, Requester requester) {
        return attempt("complete", matchId, () -> stateMachine.complete(matchId, requester));
    }

    public OperationResult<MatchState> cancel(String matchId, String reason, Requester requester) {
        return attempt("cancel", matchId, () -> stateMachine.cancel(matchId, reason, requester));
    }

    public OperationResult<MatchState> postpone(String matchId, String reason, Requester requester) {
        return attempt("postpone", matchId, () -> stateMachine.postpone(matchId, reason, requester));
    }

    public OperationResult<MatchState> reschedule(String matchId, Requester requester) {
        return attempt("reschedule", matchId, () -> stateMachine.reschedule(matchId, requester));
    }

    public OperationResult<PeriodChange> startPeriod(String matchId, PeriodType type, Requester requester) {
        return attempt("startPeriod", matchId, () -> stateMachine.startPeriod(matchId, type, requester));
    }

    public OperationResult<PeriodChange> endPeriod(String matchId, String periodId, Requester requester) {
        return attempt("endPeriod", matchId, () -> stateMachine.endPeriod(matchId, periodId, requester));
    }

    // events

    public OperationResult<MatchEvent> createEvent(EventDraft draft, Requester requester) {
        return attempt("createEvent", draft.matchId(), () -> ledger.create(draft, requester));
    }

    public OperationResult<MatchEvent> updateEvent(String eventId, EventPatch patch, Requester requester) {
        return attempt("updateEvent", eventId, () -> ledger.update(eventId, patch, requester));
    }

    public OperationResult<MatchEvent> deleteEvent(String eventId, Requester requester) {
        return attempt("deleteEvent", eventId, () -> ledger.delete(eventId, requester));
    }

    public OperationResult<BatchResult> applyBatch(BatchRequest batch, Requester requester) {
        return attempt("applyBatch", requester.userId(), () -> ledger.applyBatch(batch, requester));
    }

    // lineup and formation

    public OperationResult<SubstitutionResult> substitute(SubstitutionRequest request, Requester requester) {
        return attempt("substitute", request.matchId(), () -> lineup.substitute(request, requester));
    }

    public OperationResult<FormationChangeResult> applyFormationChange(FormationChangeRequest request,
                                                                       Requester requester) {
        return attempt("applyFormationChange", request.matchId(),
                () -> formations.applyFormationChange(request, requester));
    }

    // reads

    public OperationResult<Optional<MatchState>> currentState(String matchId, Requester requester) {
        return attempt("currentState", matchId, () -> reads.currentState(matchId, requester));
    }

    public OperationResult<MatchStatusView> matchStatus(String matchId, Requester requester) {
        return attempt("matchStatus", matchId, () -> reads.matchStatus(matchId, requester));
    }

    public OperationResult<List<MatchStatusView>> liveMatches(Requester requester) {
        return attempt("liveMatches", requester.userId(), () -> reads.liveMatches(requester));
    }

    public OperationResult<List<Period>> periods(String matchId, Requester requester) {
        return attempt("periods", matchId, () -> reads.periods(matchId, requester));
    }

    public OperationResult<List<MatchEvent>> timeline(String matchId, Requester requester) {
        return attempt("timeline", matchId, () -> ledger.timeline(matchId, requester));
    }

    public OperationResult<List<LineupEntry>> currentLineup(String matchId, Requester requester) {
        return attempt("currentLineup", matchId, () -> lineup.currentLineup(matchId, requester));
    }

    public OperationResult<FormationView> currentFormation(String matchId, Requester requester) {
        return attempt("currentFormation", matchId, () -> formations.currentFormation(matchId, requester));
    }

    public OperationResult<MatchSnapshot> snapshot(String matchId, Requester requester) {
        return attempt("snapshot", matchId, () -> reads.snapshot(matchId, requester));
    }

    public OperationResult<ViewerLink> issueViewerLink(String matchId, Requester requester) {
        return attempt("issueViewerLink", matchId, () -> reads.issueViewerLink(matchId, requester));
    }

    public Subscription subscribe(String matchId, MatchSubscriber subscriber) {
        return hub.subscribe(matchId, subscriber);
    }

    private static <T> OperationResult<T> attempt(String operation, String target, Supplier<T> action) {
        try {
            return OperationResult.success(action.get());
        } catch (MatchOperationException e) {
            log.debug("{} on {} rejected: {} {}", operation, target, e.kind(), e.getMessage());
            return OperationResult.failure(e);
        }
    }
}
