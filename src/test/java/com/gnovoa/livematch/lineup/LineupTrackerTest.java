package com.gnovoa.livematch.lineup;

import com.gnovoa.livematch.error.FailureKind;
import com.gnovoa.livematch.error.MatchOperationException;
import com.gnovoa.livematch.events.EventKind;
import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.model.LineupEntry;
import com.gnovoa.livematch.support.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.gnovoa.livematch.support.TestEngine.HOME;
import static com.gnovoa.livematch.support.TestEngine.MATCH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LineupTrackerTest {

  private TestEngine engine;
  private LineupTracker tracker;

  @BeforeEach
  void setUp() {
    engine = new TestEngine();
    tracker = engine.lineup;
    engine.putOnPitch("h9", 0, "ST");
    engine.putOnPitch("h1", 0, "GK");
  }

  private static SubstitutionRequest sub(String off, String on, double minute) {
    return new SubstitutionRequest(MATCH, off, on, "ST", BigDecimal.valueOf(minute), "tactical");
  }

  private static void assertRejected(Runnable call, FailureKind kind) {
    assertThatThrownBy(call::run)
        .isInstanceOf(MatchOperationException.class)
        .extracting(e -> ((MatchOperationException) e).kind())
        .isEqualTo(kind);
  }

  @Test
  void substitutionSwapsEntriesAndRecordsTwoEvents() {
    engine.stateMachine.start(MATCH, engine.owner);

    SubstitutionResult result = tracker.substitute(sub("h9", "h10", 60), engine.owner);

    assertThat(result.closed().playerId()).isEqualTo("h9");
    assertThat(result.closed().endMin()).isEqualByComparingTo("60");
    assertThat(result.opened().playerId()).isEqualTo("h10");
    assertThat(result.opened().startMin()).isEqualByComparingTo("60");
    assertThat(result.opened().endMin()).isNull();
    assertThat(result.opened().position()).isEqualTo("ST");

    assertThat(tracker.currentLineup(MATCH, engine.owner))
        .extracting(LineupEntry::playerId)
        .containsExactly("h1", "h10");

    List<MatchEvent> timeline = engine.ledger.timeline(MATCH, engine.owner);
    assertThat(timeline).extracting(MatchEvent::kind)
        .containsExactly(EventKind.SUBSTITUTION_OFF, EventKind.SUBSTITUTION_ON);
    assertThat(timeline).allSatisfy(e -> {
      assertThat(e.clockMs()).isEqualTo(3_600_000L);
      assertThat(e.teamId()).isEqualTo(HOME);
      assertThat(e.periodNumber()).isEqualTo(1);
    });
    assertThat(engine.match().homeScore()).isZero();
  }

  @Test
  void substitutionWithoutOpenPeriodHasNoPeriodNumber() {
    SubstitutionResult result = tracker.substitute(sub("h9", "h10", 12.5), engine.owner);

    assertThat(result.events()).extracting(MatchEvent::periodNumber).containsOnlyNulls();
    assertThat(result.events()).extracting(MatchEvent::clockMs).containsOnly(750_000L);
  }

  @Test
  void outgoingPlayerMustBeOnThePitch() {
    assertRejected(() -> tracker.substitute(sub("h5", "h10", 60), engine.owner), FailureKind.PLAYER_NOT_ON_PITCH);

    engine.putOnPitch("h6", 70, "CM");
    assertRejected(() -> tracker.substitute(sub("h6", "h10", 60), engine.owner), FailureKind.PLAYER_NOT_ON_PITCH);
    assertThat(engine.ledger.timeline(MATCH, engine.owner)).isEmpty();
  }

  @Test
  void incomingPlayerMustNotBeOnThePitch() {
    assertRejected(() -> tracker.substitute(sub("h9", "h1", 60), engine.owner), FailureKind.CONFLICT);

    assertThat(tracker.currentLineup(MATCH, engine.owner))
        .extracting(LineupEntry::playerId)
        .containsExactly("h1", "h9");
  }

  @Test
  void playerCanComeBackOnLater() {
    tracker.substitute(sub("h9", "h10", 30), engine.owner);
    tracker.substitute(sub("h10", "h9", 70), engine.owner);

    assertThat(tracker.currentLineup(MATCH, engine.owner))
        .filteredOn(e -> e.playerId().equals("h9"))
        .singleElement()
        .satisfies(e -> assertThat(e.startMin()).isEqualByComparingTo("70"));
    assertThat(engine.ledger.timeline(MATCH, engine.owner)).hasSize(4);
  }

  @Test
  void substitutionNeedsMatchAccess() {
    assertRejected(() -> tracker.substitute(sub("h9", "h10", 60), engine.stranger), FailureKind.ACCESS_DENIED);
    assertRejected(() -> tracker.currentLineup(MATCH, engine.stranger), FailureKind.ACCESS_DENIED);
  }

  @Test
  void requestRejectsSamePlayerOnBothSides() {
    assertThatThrownBy(() -> sub("h9", "h9", 60)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SubstitutionRequest(MATCH, "h9", "h10", "ST", null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
