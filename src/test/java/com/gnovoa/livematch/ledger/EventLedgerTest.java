package com.gnovoa.livematch.ledger;

import com.gnovoa.livematch.broadcast.MatchNotification;
import com.gnovoa.livematch.broadcast.NotificationType;
import com.gnovoa.livematch.error.FailureKind;
import com.gnovoa.livematch.error.MatchOperationException;
import com.gnovoa.livematch.events.EventKind;
import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.model.Team;
import com.gnovoa.livematch.support.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.gnovoa.livematch.support.TestEngine.AWAY;
import static com.gnovoa.livematch.support.TestEngine.HOME;
import static com.gnovoa.livematch.support.TestEngine.MATCH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class EventLedgerTest {

  private TestEngine engine;
  private EventLedger ledger;

  @BeforeEach
  void setUp() {
    engine = new TestEngine();
    ledger = engine.ledger;
  }

  private static EventDraft draft(String id, EventKind kind, String teamId, String playerId, long clockMs) {
    return new EventDraft(id, MATCH, kind, teamId, playerId, 1, clockMs, null, 0);
  }

  private static void assertRejected(Runnable call, FailureKind kind) {
    assertThatThrownBy(call::run)
        .isInstanceOf(MatchOperationException.class)
        .extracting(e -> ((MatchOperationException) e).kind())
        .isEqualTo(kind);
  }

  private List<MatchEvent> timeline() {
    return ledger.timeline(MATCH, engine.owner);
  }

  @Test
  void goalsUpdateTheScore() {
    ledger.create(draft(null, EventKind.GOAL, HOME, "h9", 1_380_000), engine.owner);
    ledger.create(draft(null, EventKind.GOAL, AWAY, "a10", 2_400_000), engine.owner);
    MatchEvent third = ledger.create(draft(null, EventKind.GOAL, HOME, "h7", 3_000_000), engine.owner);

    assertThat(engine.match().homeScore()).isEqualTo(2);
    assertThat(engine.match().awayScore()).isEqualTo(1);

    ledger.delete(third.id(), engine.owner);

    assertThat(engine.match().homeScore()).isEqualTo(1);
    assertThat(engine.match().awayScore()).isEqualTo(1);
    assertThat(timeline()).hasSize(2);
  }

  @Test
  void replayWithSameIdReturnsStoredEvent() {
    MatchEvent first = ledger.create(draft("client-1", EventKind.GOAL, HOME, "h9", 60_000), engine.owner);
    engine.clock.advanceSeconds(30);
    MatchEvent again = ledger.create(draft("client-1", EventKind.GOAL, HOME, "h9", 60_000), engine.owner);

    assertThat(again).isEqualTo(first);
    assertThat(timeline()).hasSize(1);
    assertThat(engine.match().homeScore()).isEqualTo(1);
    assertThat(engine.notificationsOf(NotificationType.EVENT_CREATED)).hasSize(1);
  }

  @Test
  void idOfAnotherMatchIsConflict() {
    engine.addMatch("m2", "owner");
    engine.facade.createEvent(new EventDraft("shared", "m2", EventKind.FOUL, HOME, null, 1, 0, null, 0),
        engine.owner).orElseThrow();

    assertRejected(() -> ledger.create(draft("shared", EventKind.FOUL, HOME, null, 0), engine.owner),
        FailureKind.CONFLICT);
    assertThat(timeline()).isEmpty();
  }

  @Test
  void naturalDuplicateReusesTheStoredRow() {
    MatchEvent first = ledger.create(draft(null, EventKind.FOUL, HOME, "h4", 120_000), engine.owner);
    MatchEvent second = ledger.create(draft(null, EventKind.FOUL, HOME, "h4", 120_000), engine.owner);

    assertThat(second.id()).isEqualTo(first.id());
    assertThat(timeline()).hasSize(1);
  }

  @Test
  void recreatingDeletedEventRestoresTheSameRow() {
    MatchEvent goal = ledger.create(draft(null, EventKind.GOAL, AWAY, "a9", 300_000), engine.owner);
    ledger.delete(goal.id(), engine.owner);
    assertThat(engine.match().awayScore()).isZero();

    MatchEvent restored = ledger.create(draft(null, EventKind.GOAL, AWAY, "a9", 300_000), engine.owner);

    assertThat(restored.id()).isEqualTo(goal.id());
    assertThat(restored.isDeleted()).isFalse();
    assertThat(engine.match().awayScore()).isEqualTo(1);
    assertThat(engine.store.<List<MatchEvent>>inTransaction(MATCH, tx -> tx.events())).hasSize(1);
  }

  @Test
  void replayOfDeletedIdRestoresIt() {
    ledger.create(draft("client-7", EventKind.CORNER, HOME, null, 10_000), engine.owner);
    ledger.delete("client-7", engine.owner);

    MatchEvent restored = ledger.create(draft("client-7", EventKind.CORNER, HOME, null, 10_000), engine.owner);

    assertThat(restored.isDeleted()).isFalse();
    assertThat(timeline()).extracting(MatchEvent::id).containsExactly("client-7");
  }

  @Test
  void referencesAreValidated() {
    engine.store.saveTeam(new Team("third", "Third Team", "owner"));

    assertRejected(() -> ledger.create(draft(null, EventKind.FOUL, "third", null, 0), engine.owner),
        FailureKind.INVALID_REFERENCE);
    assertRejected(() -> ledger.create(draft(null, EventKind.FOUL, HOME, "a3", 0), engine.owner),
        FailureKind.INVALID_REFERENCE);
    assertRejected(() -> ledger.create(draft(null, EventKind.FOUL, HOME, "h99", 0), engine.owner),
        FailureKind.INVALID_REFERENCE);
    assertRejected(() -> ledger.create(draft(null, EventKind.GOAL, null, null, 0), engine.owner),
        FailureKind.INVALID_REFERENCE);
    assertRejected(() -> ledger.create(draft(null, EventKind.FOUL, "ghost", null, 0), engine.owner),
        FailureKind.INVALID_REFERENCE);
    assertThat(timeline()).isEmpty();
  }

  @Test
  void playerWithoutTeamMustPlayForEitherSide() {
    MatchEvent save = ledger.create(draft(null, EventKind.SAVE, null, "a1", 0), engine.owner);

    assertThat(save.teamId()).isNull();
    assertRejected(() -> ledger.create(draft(null, EventKind.SAVE, null, "h99", 0), engine.owner),
        FailureKind.INVALID_REFERENCE);
  }

  @Test
  void writesNeedMatchAccess() {
    assertRejected(() -> ledger.create(draft(null, EventKind.FOUL, HOME, null, 0), engine.stranger),
        FailureKind.ACCESS_DENIED);
    assertRejected(() -> ledger.timeline(MATCH, engine.stranger), FailureKind.ACCESS_DENIED);
    assertRejected(() -> ledger.create(new EventDraft(null, "missing", EventKind.FOUL, HOME, null, 1, 0, null, 0),
        engine.owner), FailureKind.NOT_FOUND);
  }

  @Test
  void changingKindRecomputesScore() {
    MatchEvent goal = ledger.create(draft(null, EventKind.GOAL, HOME, "h9", 60_000), engine.owner);
    assertThat(engine.match().homeScore()).isEqualTo(1);

    MatchEvent updated = ledger.update(goal.id(),
        new EventPatch(EventKind.SHOT_ON_TARGET, null, null, null, null, "saved on the line", 1), engine.owner);

    assertThat(updated.kind()).isEqualTo(EventKind.SHOT_ON_TARGET);
    assertThat(updated.playerId()).isEqualTo("h9");
    assertThat(updated.notes()).isEqualTo("saved on the line");
    assertThat(engine.match().homeScore()).isZero();
    assertThat(engine.notificationsOf(NotificationType.EVENT_UPDATED)).hasSize(1);
  }

  @Test
  void deletedEventsCannotBeUpdatedOrDeletedAgain() {
    MatchEvent foul = ledger.create(draft(null, EventKind.FOUL, HOME, null, 0), engine.owner);
    ledger.delete(foul.id(), engine.owner);

    assertRejected(() -> ledger.delete(foul.id(), engine.owner), FailureKind.NOT_FOUND);
    assertRejected(() -> ledger.update(foul.id(), new EventPatch(null, null, null, null, 5L, null, null),
        engine.owner), FailureKind.NOT_FOUND);
    assertThat(engine.notificationsOf(NotificationType.EVENT_DELETED)).hasSize(1);
  }

  @Test
  void timelineIsOrderedByClock() {
    ledger.create(draft(null, EventKind.CORNER, HOME, null, 90_000), engine.owner);
    ledger.create(draft(null, EventKind.FOUL, AWAY, null, 30_000), engine.owner);
    ledger.create(draft(null, EventKind.OFFSIDE, HOME, null, 60_000), engine.owner);

    assertThat(timeline()).extracting(MatchEvent::clockMs).containsExactly(30_000L, 60_000L, 90_000L);
  }

  @Test
  void createdNotificationCarriesDisplayNames() {
    ledger.create(draft(null, EventKind.YELLOW_CARD, AWAY, "a5", 45_000), engine.owner);

    List<MatchNotification> created = engine.notificationsOf(NotificationType.EVENT_CREATED);
    assertThat(created).singleElement().satisfies(n -> {
      EventView view = (EventView) n.payload();
      assertThat(view.teamName()).isEqualTo("Valley Rovers");
      assertThat(view.playerName()).isEqualTo("Away Player 5");
      assertThat(view.kind()).isEqualTo(EventKind.YELLOW_CARD);
    });
  }

  @Test
  void batchAppliesEntriesIndependently() {
    MatchEvent existing = ledger.create(draft(null, EventKind.FOUL, HOME, null, 0), engine.owner);

    BatchResult result = ledger.applyBatch(new BatchRequest(
        List.of(draft("b1", EventKind.GOAL, HOME, "h9", 600_000),
            draft("b2", EventKind.FOUL, "ghost", null, 700_000),
            draft("b3", EventKind.CORNER, AWAY, null, 800_000)),
        List.of(new BatchRequest.Update(existing.id(),
            new EventPatch(null, null, null, null, null, "late tackle", null))),
        List.of("unknown-id")), engine.owner);

    assertThat(result.items()).hasSize(5);
    assertThat(result.failures()).isEqualTo(2);
    assertThat(result.items())
        .filteredOn(i -> !i.isSuccess())
        .extracting(BatchResult.Item::failure)
        .containsExactly(FailureKind.INVALID_REFERENCE, FailureKind.NOT_FOUND);
    assertThat(timeline()).extracting(MatchEvent::id).contains("b1", "b3");
    assertThat(engine.match().homeScore()).isEqualTo(1);
  }

  @Test
  void malformedBatchEntriesAreReportedWithoutStoppingTheRest() {
    MatchEvent toEdit = ledger.create(draft(null, EventKind.FOUL, HOME, null, 0), engine.owner);
    MatchEvent toDrop = ledger.create(draft(null, EventKind.CORNER, AWAY, null, 60_000), engine.owner);
    List<BatchRequest.Update> updates = new ArrayList<>();
    updates.add(new BatchRequest.Update(null, null));
    updates.add(new BatchRequest.Update("missing", null));
    updates.add(null);
    updates.add(new BatchRequest.Update(toEdit.id(),
        new EventPatch(null, null, null, null, null, "second yellow", null)));
    List<String> deletes = new ArrayList<>();
    deletes.add(null);
    deletes.add(toDrop.id());

    BatchResult result = ledger.applyBatch(new BatchRequest(
        List.of(draft("c1", EventKind.SAVE, AWAY, "a1", 120_000)), updates, deletes), engine.owner);

    assertThat(result.items()).hasSize(7);
    assertThat(result.items())
        .filteredOn(i -> !i.isSuccess())
        .extracting(BatchResult.Item::operation, BatchResult.Item::index, BatchResult.Item::failure)
        .containsExactly(
            tuple(BatchResult.Operation.UPDATE, 0, FailureKind.INVALID_INPUT),
            tuple(BatchResult.Operation.UPDATE, 1, FailureKind.INVALID_INPUT),
            tuple(BatchResult.Operation.UPDATE, 2, FailureKind.INVALID_INPUT),
            tuple(BatchResult.Operation.DELETE, 0, FailureKind.INVALID_INPUT));
    assertThat(timeline()).extracting(MatchEvent::id).containsExactly(toEdit.id(), "c1");
    assertThat(timeline().get(0).notes()).isEqualTo("second yellow");
  }

  @Test
  void draftRejectsOutOfRangeValues() {
    assertThatThrownBy(() -> draft(null, null, HOME, null, 0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new EventDraft(null, MATCH, EventKind.FOUL, HOME, null, 1, -1, null, 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new EventDraft(null, MATCH, EventKind.FOUL, HOME, null, 1, 0, null, 4))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(new EventDraft(" ", MATCH, EventKind.FOUL, HOME, null, 1, 0, null, 0).id()).isNull();
  }
}
