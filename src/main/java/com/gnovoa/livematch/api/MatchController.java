package com.gnovoa.livematch.api;

import com.gnovoa.livematch.api.dto.ErrorResponse;
import com.gnovoa.livematch.api.dto.EventRequest;
import com.gnovoa.livematch.api.dto.FormationChangeBody;
import com.gnovoa.livematch.api.dto.ReasonRequest;
import com.gnovoa.livematch.api.dto.StartPeriodRequest;
import com.gnovoa.livematch.api.dto.SubstitutionBody;
import com.gnovoa.livematch.core.LiveMatchFacade;
import com.gnovoa.livematch.error.FailureKind;
import com.gnovoa.livematch.error.OperationResult;
import com.gnovoa.livematch.ledger.BatchRequest;
import com.gnovoa.livematch.ledger.EventPatch;
import com.gnovoa.livematch.model.MatchState;
import com.gnovoa.livematch.model.Requester;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

/**
 * HTTP adapter over {@link LiveMatchFacade}. The caller is identified by the {@code X-User-Id} and
 * {@code X-User-Role} headers.
 */
@RestController
@RequestMapping("/api")
public class MatchController {

    private static final String USER = "X-User-Id";
    private static final String ROLE = "X-User-Role";

    private final LiveMatchFacade facade;

    public MatchController(LiveMatchFacade facade) {
        this.facade = facade;
    }

    @PostMapping("/matches/{matchId}/start")
    public ResponseEntity<?> start(@PathVariable String matchId,
                                   @RequestHeader(USER) String userId,
                                   @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.start(matchId, requester(userId, role)));
    }

    @PostMapping("/matches/{matchId}/pause")
    public ResponseEntity<?> pause(@PathVariable String matchId,
                                   @RequestBody(required = false) ReasonRequest body,
                                   @RequestHeader(USER) String userId,
                                   @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.pause(matchId, reason(body), requester(userId, role)));
    }

    @PostMapping("/matches/{matchId}/resume")
    public ResponseEntity<?> resume(@PathVariable String matchId,
                                    @RequestHeader(USER) String userId,
                                    @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.resume(matchId, requester(userId, role)));
    }

    @PostMapping("/matches/{matchId}/complete")
    public ResponseEntity<?> complete(@PathVariable String matchId,
                                      @RequestHeader(USER) String userId,
                                      @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.complete(matchId, requester(userId, role)));
    }

    @PostMapping("/matches/{matchId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String matchId,
                                    @RequestBody(required = false) ReasonRequest body,
                                    @RequestHeader(USER) String userId,
                                    @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.cancel(matchId, reason(body), requester(userId, role)));
    }

    @PostMapping("/matches/{matchId}/postpone")
    public ResponseEntity<?> postpone(@PathVariable String matchId,
                                      @RequestBody(required = false) ReasonRequest body,
                                      @RequestHeader(USER) String userId,
                                      @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.postpone(matchId, reason(body), requester(userId, role)));
    }

    @PostMapping("/matches/{matchId}/reschedule")
    public ResponseEntity<?> reschedule(@PathVariable String matchId,
                                        @RequestHeader(USER) String userId,
                                        @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.reschedule(matchId, requester(userId, role)));
    }

    @PostMapping("/matches/{matchId}/periods")
    public ResponseEntity<?> startPeriod(@PathVariable String matchId,
                                         @RequestBody(required = false) StartPeriodRequest body,
                                         @RequestHeader(USER) String userId,
                                         @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.startPeriod(matchId, body == null ? null : body.type(), requester(userId, role)),
                HttpStatus.CREATED);
    }

    @PostMapping("/matches/{matchId}/periods/{periodId}/end")
    public ResponseEntity<?> endPeriod(@PathVariable String matchId, @PathVariable String periodId,
                                       @RequestHeader(USER) String userId,
                                       @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.endPeriod(matchId, periodId, requester(userId, role)));
    }

    @GetMapping("/matches/{matchId}/periods")
    public ResponseEntity<?> periods(@PathVariable String matchId,
                                     @RequestHeader(USER) String userId,
                                     @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.periods(matchId, requester(userId, role)));
    }

    @GetMapping("/matches/{matchId}/state")
    public ResponseEntity<?> state(@PathVariable String matchId,
                                   @RequestHeader(USER) String userId,
                                   @RequestHeader(value = ROLE, required = false) String role) {
        OperationResult<Optional<MatchState>> r =
                facade.currentState(matchId, requester(userId, role));
        if (r.isSuccess() && r.value().isEmpty()) return ResponseEntity.noContent().build();
        return respond(r.map(Optional::get));
    }

    @GetMapping("/matches/{matchId}/status")
    public ResponseEntity<?> status(@PathVariable String matchId,
                                    @RequestHeader(USER) String userId,
                                    @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.matchStatus(matchId, requester(userId, role)));
    }

    @GetMapping("/matches/live")
    public ResponseEntity<?> live(@RequestHeader(USER) String userId,
                                  @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.liveMatches(requester(userId, role)));
    }

    @GetMapping("/matches/{matchId}/snapshot")
    public ResponseEntity<?> snapshot(@PathVariable String matchId,
                                      @RequestHeader(USER) String userId,
                                      @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.snapshot(matchId, requester(userId, role)));
    }

    @PostMapping("/matches/{matchId}/viewer-links")
    public ResponseEntity<?> issueViewerLink(@PathVariable String matchId,
                                             @RequestHeader(USER) String userId,
                                             @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.issueViewerLink(matchId, requester(userId, role)), HttpStatus.CREATED);
    }

    @PostMapping("/matches/{matchId}/events")
    public ResponseEntity<?> createEvent(@PathVariable String matchId, @RequestBody EventRequest body,
                                         @RequestHeader(USER) String userId,
                                         @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.createEvent(body.toDraft(matchId), requester(userId, role)), HttpStatus.CREATED);
    }

    @GetMapping("/matches/{matchId}/events")
    public ResponseEntity<?> timeline(@PathVariable String matchId,
                                      @RequestHeader(USER) String userId,
                                      @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.timeline(matchId, requester(userId, role)));
    }

    @PatchMapping("/events/{eventId}")
    public ResponseEntity<?> updateEvent(@PathVariable String eventId, @RequestBody EventPatch patch,
                                         @RequestHeader(USER) String userId,
                                         @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.updateEvent(eventId, patch, requester(userId, role)));
    }

    @DeleteMapping("/events/{eventId}")
    public ResponseEntity<?> deleteEvent(@PathVariable String eventId,
                                         @RequestHeader(USER) String userId,
                                         @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.deleteEvent(eventId, requester(userId, role)));
    }

    @PostMapping("/events/batch")
    public ResponseEntity<?> batch(@RequestBody BatchRequest batch,
                                   @RequestHeader(USER) String userId,
                                   @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.applyBatch(batch, requester(userId, role)));
    }

    @PostMapping("/matches/{matchId}/substitutions")
    public ResponseEntity<?> substitute(@PathVariable String matchId, @RequestBody SubstitutionBody body,
                                        @RequestHeader(USER) String userId,
                                        @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.substitute(body.toRequest(matchId), requester(userId, role)));
    }

    @GetMapping("/matches/{matchId}/lineup")
    public ResponseEntity<?> lineup(@PathVariable String matchId,
                                    @RequestHeader(USER) String userId,
                                    @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.currentLineup(matchId, requester(userId, role)));
    }

    @PostMapping("/matches/{matchId}/formation-changes")
    public ResponseEntity<?> formationChange(@PathVariable String matchId, @RequestBody FormationChangeBody body,
                                             @RequestHeader(USER) String userId,
                                             @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.applyFormationChange(body.toRequest(matchId), requester(userId, role)));
    }

    @GetMapping("/matches/{matchId}/formation")
    public ResponseEntity<?> formation(@PathVariable String matchId,
                                       @RequestHeader(USER) String userId,
                                       @RequestHeader(value = ROLE, required = false) String role) {
        return respond(facade.currentFormation(matchId, requester(userId, role)));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
    }

    static HttpStatus statusOf(FailureKind kind) {
        return switch (kind) {
            case ACCESS_DENIED -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_TRANSITION, CONFLICT -> HttpStatus.CONFLICT;
            case INVALID_REFERENCE, PLAYER_NOT_ON_PITCH -> HttpStatus.UNPROCESSABLE_ENTITY;
            case QUOTA_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
        };
    }

    private static ResponseEntity<?> respond(OperationResult<?> result) {
        return respond(result, HttpStatus.OK);
    }

    private static ResponseEntity<?> respond(OperationResult<?> result, HttpStatus ok) {
        if (result.isSuccess()) return ResponseEntity.status(ok).body(result.value());
        return ResponseEntity.status(statusOf(result.failure()))
                .body(new ErrorResponse(result.failure().name(), result.message()));
    }

    private static Requester requester(String userId, String role) {
        if (userId == null || userId.isBlank()) throw new IllegalArgumentException(USER + " header is required");
        return Requester.of(userId, role);
    }

    private static String reason(ReasonRequest body) {
        return body == null ? null : body.reason();
    }
}
