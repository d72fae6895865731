package com.gnovoa.livematch.query;

import com.gnovoa.livematch.access.ViewerLink;
import com.gnovoa.livematch.cache.CacheKeys;
import com.gnovoa.livematch.error.FailureKind;
import com.gnovoa.livematch.error.MatchOperationException;
import com.gnovoa.livematch.events.EventKind;
import com.gnovoa.livematch.ledger.EventDraft;
import com.gnovoa.livematch.model.Match;
import com.gnovoa.livematch.model.MatchState;
import com.gnovoa.livematch.model.MatchStatus;
import com.gnovoa.livematch.model.Requester;
import com.gnovoa.livematch.model.Team;
import com.gnovoa.livematch.support.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static com.gnovoa.livematch.support.TestEngine.AWAY;
import static com.gnovoa.livematch.support.TestEngine.HOME;
import static com.gnovoa.livematch.support.TestEngine.MATCH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchReadServiceTest {

  private TestEngine engine;
  private MatchReadService reads;

  @BeforeEach
  void setUp() {
    engine = new TestEngine();
    reads = engine.reads;
  }

  private static void assertRejected(Runnable call, FailureKind kind) {
    assertThatThrownBy(call::run)
        .isInstanceOf(MatchOperationException.class)
        .extracting(e -> ((MatchOperationException) e).kind())
        .isEqualTo(kind);
  }

  @Test
  void stateIsEmptyBeforeFirstTransition() {
    assertThat(reads.currentState(MATCH, engine.owner)).isEmpty();

    MatchStatusView status = reads.matchStatus(MATCH, engine.owner);
    assertThat(status.status()).isEqualTo(MatchStatus.SCHEDULED);
    assertThat(status.homeTeam()).isEqualTo(new MatchStatusView.TeamRef(HOME, "Harbour Town"));
    assertThat(status.awayTeam().name()).isEqualTo("Valley Rovers");
  }

  @Test
  void cachedStateIsDroppedOnTransition() {
    engine.stateMachine.start(MATCH, engine.owner);
    Optional<MatchState> live = reads.currentState(MATCH, engine.owner);
    assertThat(engine.cache.contains(CacheKeys.matchState(MATCH))).isTrue();

    engine.stateMachine.pause(MATCH, null, engine.owner);

    assertThat(engine.cache.contains(CacheKeys.matchState(MATCH))).isFalse();
    assertThat(live).get().extracting(MatchState::status).isEqualTo(MatchStatus.LIVE);
    assertThat(reads.currentState(MATCH, engine.owner)).get()
        .extracting(MatchState::status).isEqualTo(MatchStatus.PAUSED);
  }

  @Test
  void statusScoreFollowsGoalsDespiteCache() {
    engine.stateMachine.start(MATCH, engine.owner);
    assertThat(reads.matchStatus(MATCH, engine.owner).homeScore()).isZero();

    engine.ledger.create(new EventDraft(null, MATCH, EventKind.GOAL, HOME, "h9", 1, 60_000, null, 0), engine.owner);

    assertThat(reads.matchStatus(MATCH, engine.owner).homeScore()).isEqualTo(1);
  }

  @Test
  void cachedStatusKeepsClockRunning() {
    engine.stateMachine.start(MATCH, engine.owner);
    MatchStatusView first = reads.matchStatus(MATCH, engine.owner);

    engine.clock.advanceSeconds(40);
    MatchStatusView second = reads.matchStatus(MATCH, engine.owner);

    assertThat(first.elapsedSeconds()).isZero();
    assertThat(second.elapsedSeconds()).isEqualTo(40);
    assertThat(second.totalElapsedSeconds()).isZero();
  }

  @Test
  void privateReadsNeedMatchAccess() {
    assertRejected(() -> reads.currentState(MATCH, engine.stranger), FailureKind.ACCESS_DENIED);
    assertRejected(() -> reads.matchStatus(MATCH, engine.stranger), FailureKind.ACCESS_DENIED);
    assertRejected(() -> reads.snapshot(MATCH, engine.stranger), FailureKind.ACCESS_DENIED);
    assertRejected(() -> reads.snapshot("missing", engine.owner), FailureKind.NOT_FOUND);
    assertThat(reads.matchStatus(MATCH, engine.admin).matchId()).isEqualTo(MATCH);
  }

  @Test
  void liveListingFollowsOwnership() {
    engine.store.saveTeam(new Team("third", "Third Team", "someone"));
    engine.store.saveTeam(new Team("fourth", "Fourth Team", "someone"));
    engine.store.saveMatch(new Match("m2", "third", "fourth", null, null, null, null,
        0, 0, "someone", null));
    engine.stateMachine.start(MATCH, engine.owner);
    engine.clock.advanceSeconds(60);
    engine.stateMachine.start("m2", Requester.user("someone"));

    assertThat(reads.liveMatches(engine.admin)).extracting(MatchStatusView::matchId).containsExactly("m2", MATCH);
    assertThat(reads.liveMatches(engine.owner)).extracting(MatchStatusView::matchId).containsExactly(MATCH);
    assertThat(reads.liveMatches(engine.rival)).extracting(MatchStatusView::matchId).containsExactly(MATCH);
    assertThat(reads.liveMatches(engine.stranger)).isEmpty();
  }

  @Test
  void endedMatchLeavesCallersListingImmediately() {
    engine.stateMachine.start(MATCH, engine.owner);
    assertThat(reads.liveMatches(engine.owner)).hasSize(1);
    assertThat(reads.liveMatches(engine.admin)).hasSize(1);

    engine.stateMachine.complete(MATCH, engine.owner);

    assertThat(reads.liveMatches(engine.owner)).isEmpty();
    assertThat(reads.liveMatches(engine.admin)).isEmpty();
  }

  @Test
  void snapshotCarriesSummaryPeriodsAndEvents() {
    engine.stateMachine.start(MATCH, engine.owner);
    engine.ledger.create(new EventDraft(null, MATCH, EventKind.CORNER, AWAY, null, 1, 120_000, null, 0), engine.owner);
    engine.ledger.create(new EventDraft(null, MATCH, EventKind.GOAL, HOME, "h9", 1, 60_000, null, 0), engine.owner);

    MatchSnapshot snapshot = reads.snapshot(MATCH, engine.owner);

    assertThat(snapshot.summary().status()).isEqualTo(MatchStatus.LIVE);
    assertThat(snapshot.summary().homeScore()).isEqualTo(1);
    assertThat(snapshot.periods()).hasSize(1);
    assertThat(snapshot.events()).extracting(e -> e.kind()).containsExactly(EventKind.GOAL, EventKind.CORNER);
    assertThat(snapshot.events().get(0).playerName()).isEqualTo("Home Player 9");
  }

  @Test
  void snapshotIsLimitedToFirstEventsInClockOrder() {
    for (int i = 0; i < MatchReadService.SNAPSHOT_EVENT_LIMIT + 5; i++) {
      engine.ledger.create(new EventDraft(null, MATCH, EventKind.FOUL, HOME, null, 1, i * 1_000L, null, 0),
          engine.owner);
    }

    MatchSnapshot snapshot = reads.snapshot(MATCH, engine.owner);

    assertThat(snapshot.events()).hasSize(MatchReadService.SNAPSHOT_EVENT_LIMIT);
    assertThat(snapshot.events().get(0).clockMs()).isZero();
  }

  @Test
  void viewerCodeOpensTheSnapshotOfItsMatchOnly() {
    engine.addMatch("m2", "owner");
    ViewerLink link = reads.issueViewerLink(MATCH, engine.owner);

    assertThat(reads.viewerSnapshot(MATCH, null, link.code()).summary().matchId()).isEqualTo(MATCH);
    assertRejected(() -> reads.viewerSnapshot("m2", null, link.code()), FailureKind.ACCESS_DENIED);
    assertRejected(() -> reads.viewerSnapshot(MATCH, null, "NOPE"), FailureKind.ACCESS_DENIED);
  }

  @Test
  void expiredViewerCodeIsRefused() {
    ViewerLink link = reads.issueViewerLink(MATCH, engine.owner);

    engine.clock.advance(Duration.ofHours(2));

    assertRejected(() -> reads.viewerSnapshot(MATCH, null, link.code()), FailureKind.ACCESS_DENIED);
  }

  @Test
  void viewerWithoutCodeNeedsMatchAccess() {
    assertRejected(() -> reads.viewerSnapshot(MATCH, null, null), FailureKind.ACCESS_DENIED);
    assertRejected(() -> reads.viewerSnapshot(MATCH, engine.stranger, null), FailureKind.ACCESS_DENIED);
    assertThat(reads.viewerSnapshot(MATCH, engine.admin, null).summary().matchId()).isEqualTo(MATCH);
    assertRejected(() -> reads.viewerSnapshot("missing", engine.admin, null), FailureKind.NOT_FOUND);
  }

  @Test
  void onlyMatchManagersIssueViewerCodes() {
    assertRejected(() -> reads.issueViewerLink(MATCH, engine.stranger), FailureKind.ACCESS_DENIED);

    ViewerLink link = reads.issueViewerLink(MATCH, engine.admin);

    assertThat(link.matchId()).isEqualTo(MATCH);
    assertThat(link.createdBy()).isEqualTo("root");
    assertThat(link.expiresAt()).isEqualTo(TestEngine.KICKOFF.plus(Duration.ofHours(2)));
  }
}
