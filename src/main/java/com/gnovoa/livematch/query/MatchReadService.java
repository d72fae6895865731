package com.gnovoa.livematch.query;

import com.gnovoa.livematch.access.ViewerLink;
import com.gnovoa.livematch.access.ViewerLinks;
import com.gnovoa.livematch.cache.CacheKeys;
import com.gnovoa.livematch.cache.ReadCache;
import com.gnovoa.livematch.core.MatchGuard;
import com.gnovoa.livematch.core.PeriodTracker;
import com.gnovoa.livematch.core.TransactionRunner;
import com.gnovoa.livematch.error.FailureKind;
import com.gnovoa.livematch.error.MatchOperationException;
import com.gnovoa.livematch.ledger.EventLedger;
import com.gnovoa.livematch.ledger.EventView;
import com.gnovoa.livematch.model.Match;
import com.gnovoa.livematch.model.MatchState;
import com.gnovoa.livematch.model.MatchStatus;
import com.gnovoa.livematch.model.Period;
import com.gnovoa.livematch.model.Requester;
import com.gnovoa.livematch.model.Team;
import com.gnovoa.livematch.store.MatchStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read side of the engine. State, status and live listings are memoized in the {@link ReadCache};
 * access is checked on every call, cache hits included.
 */
public final class MatchReadService {

    /** Maximum number of timeline events included in a snapshot. */
    public static final int SNAPSHOT_EVENT_LIMIT = 200;

    /** Committed rows a status view is built from. */
    private record StatusSource(Match match, MatchState state, String homeTeamName, String awayTeamName) {}

    private record StateSource(Match match, MatchState state) {}

    private record SnapshotRows(StatusSource source, List<Period> periods, List<EventView> events) {}

    private final TransactionRunner runner;
    private final MatchGuard guard;
    private final PeriodTracker periods;
    private final ReadCache cache;
    private final ViewerLinks viewerLinks;
    private final Clock clock;

    public MatchReadService(TransactionRunner runner, MatchGuard guard, PeriodTracker periods, ReadCache cache,
                            ViewerLinks viewerLinks, Clock clock) {
        this.runner = runner;
        this.guard = guard;
        this.periods = periods;
        this.cache = cache;
        this.viewerLinks = viewerLinks;
        this.clock = clock;
    }

    public Optional<MatchState> currentState(String matchId, Requester requester) {
        StateSource src = cache.getOrLoad(CacheKeys.matchState(matchId),
                () -> runner.run(matchId, tx -> new StateSource(tx.match(), tx.state().orElse(null))));
        guard.require(src.match(), requester);
        return Optional.ofNullable(src.state()).filter(s -> !s.isDeleted());
    }

    public MatchStatusView matchStatus(String matchId, Requester requester) {
        StatusSource src = statusSource(matchId);
        guard.require(src.match(), requester);
        return toView(src, clock.instant());
    }

    /**
     * Live matches the requester may follow, most recently started first. Admins see every live
     * match; other users see the matches they created or whose home or away team they created.
     */
    public List<MatchStatusView> liveMatches(Requester requester) {
        List<StatusSource> sources = cache.getOrLoad(CacheKeys.liveMatches(requester),
                () -> loadLive(requester));
        Instant now = clock.instant();
        return sources.stream().map(s -> toView(s, now)).toList();
    }

    public List<Period> periods(String matchId, Requester requester) {
        return runner.run(matchId, tx -> {
            guard.require(tx.match(), requester);
            return periods.active(tx);
        });
    }

    public MatchSnapshot snapshot(String matchId, Requester requester) {
        guard.require(existingMatch(matchId), requester);
        return buildSnapshot(matchId);
    }

    /**
     * Snapshot for a viewer connection. A valid viewer code for the match is enough; without one
     * the requester must pass the match access rule.
     */
    public MatchSnapshot viewerSnapshot(String matchId, Requester requester, String viewerCode) {
        Match match = existingMatch(matchId);
        if (viewerLinks.resolve(viewerCode, matchId).isEmpty()) {
            if (requester == null) {
                throw new MatchOperationException(FailureKind.ACCESS_DENIED,
                        "Match " + matchId + " needs a viewer code or a signed-in user");
            }
            guard.require(match, requester);
        }
        return buildSnapshot(matchId);
    }

    /** Issues a viewer code for the match; only users who may manage the match can share it. */
    public ViewerLink issueViewerLink(String matchId, Requester requester) {
        guard.require(existingMatch(matchId), requester);
        return viewerLinks.issue(matchId, requester.userId());
    }

    private Match existingMatch(String matchId) {
        return runner.store().findMatch(matchId)
                .filter(m -> !m.isDeleted())
                .orElseThrow(() -> MatchOperationException.notFound("Match not found: " + matchId));
    }

    private MatchSnapshot buildSnapshot(String matchId) {
        MatchStore store = runner.store();
        SnapshotRows rows = runner.run(matchId, tx -> {
            Match match = tx.match();
            List<EventView> events = EventLedger.liveTimeline(tx).stream()
                    .limit(SNAPSHOT_EVENT_LIMIT)
                    .map(e -> EventView.of(e, store))
                    .toList();
            return new SnapshotRows(source(store, match, tx.state().orElse(null)), periods.active(tx), events);
        });
        return new MatchSnapshot(toView(rows.source(), clock.instant()), rows.periods(), rows.events());
    }

    private StatusSource statusSource(String matchId) {
        MatchStore store = runner.store();
        return cache.getOrLoad(CacheKeys.matchStatus(matchId),
                () -> runner.run(matchId, tx -> source(store, tx.match(), tx.state().orElse(null))));
    }

    private List<StatusSource> loadLive(Requester requester) {
        MatchStore store = runner.store();
        Set<String> ownTeams = requester.isAdmin() ? Set.of() : userTeams(requester.userId());
        return store.findStatesByStatus(MatchStatus.LIVE).stream()
                .map(state -> store.findMatch(state.matchId())
                        .filter(m -> !m.isDeleted())
                        .filter(m -> requester.isAdmin()
                                || requester.userId().equals(m.createdBy())
                                || ownTeams.contains(m.homeTeamId())
                                || ownTeams.contains(m.awayTeamId()))
                        .map(m -> source(store, m, state))
                        .orElse(null))
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing((StatusSource s) -> s.state().startedAt(),
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .toList();
    }

    private Set<String> userTeams(String userId) {
        return cache.getOrLoad(CacheKeys.userTeams(userId),
                () -> runner.store().findTeamIdsCreatedBy(userId));
    }

    private static StatusSource source(MatchStore store, Match match, MatchState state) {
        return new StatusSource(match, state,
                store.findTeam(match.homeTeamId()).map(Team::name).orElse(null),
                store.findTeam(match.awayTeamId()).map(Team::name).orElse(null));
    }

    private static MatchStatusView toView(StatusSource src, Instant now) {
        Match m = src.match();
        MatchState s = src.state() != null && !src.state().isDeleted() ? src.state() : MatchState.scheduled(m.matchId());
        return new MatchStatusView(
                m.matchId(),
                new MatchStatusView.TeamRef(m.homeTeamId(), src.homeTeamName()),
                new MatchStatusView.TeamRef(m.awayTeamId(), src.awayTeamName()),
                m.kickoffAt(),
                m.competition(),
                m.venue(),
                m.homeScore(),
                m.awayScore(),
                s.status(),
                s.currentPeriodNumber(),
                s.currentPeriodType(),
                s.startedAt(),
                s.endedAt(),
                s.totalElapsedSeconds(),
                PeriodTracker.liveElapsedSeconds(s, now)
        );
    }
}
