package com.gnovoa.livematch.store;

import com.gnovoa.livematch.events.EventKind;
import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.model.LineupEntry;
import com.gnovoa.livematch.model.Match;
import com.gnovoa.livematch.model.MatchState;
import com.gnovoa.livematch.model.MatchStatus;
import com.gnovoa.livematch.model.Minutes;
import com.gnovoa.livematch.model.Period;
import com.gnovoa.livematch.model.PeriodType;
import com.gnovoa.livematch.model.Player;
import com.gnovoa.livematch.model.Team;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMatchStoreTest {

  private static final Instant T0 = Instant.parse("2026-05-02T15:00:00Z");

  private InMemoryMatchStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryMatchStore();
    store.saveTeam(new Team("home", "Home", "owner"));
    store.saveTeam(new Team("away", "Away", "rival"));
    store.savePlayer(new Player("p1", "Player One", 9));
    store.saveMatch(Match.scheduled("m1", "home", "away", "owner"));
    store.saveMatch(Match.scheduled("m2", "home", "away", "owner"));
  }

  private static MatchEvent event(String id, String matchId, EventKind kind, String teamId, long clockMs) {
    return new MatchEvent(id, matchId, kind, teamId, null, null, clockMs, null, 0, T0, "owner", null);
  }

  @Test
  void failedTransactionLeavesNoPartialWrites() {
    assertThatThrownBy(() -> store.inTransaction("m1", tx -> {
      tx.saveState(MatchState.scheduled("m1").withStatus(MatchStatus.LIVE));
      tx.insertEvent(event("e1", "m1", EventKind.FOUL, "home", 1000));
      throw new IllegalStateException("boom");
    })).isInstanceOf(IllegalStateException.class);

    store.inTransaction("m1", tx -> {
      assertThat(tx.state()).isEmpty();
      assertThat(tx.events()).isEmpty();
      return null;
    });
    assertThat(store.findEvent("e1")).isEmpty();
  }

  @Test
  void eventIdsAreUniqueAcrossMatches() {
    store.inTransaction("m1", tx -> {
      tx.insertEvent(event("e1", "m1", EventKind.FOUL, "home", 1000));
      return null;
    });

    assertThatThrownBy(() -> store.inTransaction("m2", tx -> {
      tx.insertEvent(event("e1", "m2", EventKind.FOUL, "home", 1000));
      return null;
    })).isInstanceOf(StoreException.class)
        .extracting(e -> ((StoreException) e).kind())
        .isEqualTo(StoreException.Kind.UNIQUE_VIOLATION);

    assertThat(store.findEvent("e1")).get().extracting(MatchEvent::matchId).isEqualTo("m1");
  }

  @Test
  void unknownTeamIsForeignKeyViolation() {
    assertThatThrownBy(() -> store.inTransaction("m1", tx -> {
      tx.insertEvent(event("e1", "m1", EventKind.GOAL, "nowhere", 1000));
      return null;
    })).isInstanceOf(StoreException.class)
        .extracting(e -> ((StoreException) e).kind())
        .isEqualTo(StoreException.Kind.FOREIGN_KEY_VIOLATION);
  }

  @Test
  void unknownMatchIsRowNotFound() {
    assertThatThrownBy(() -> store.inTransaction("missing", MatchTransaction::match))
        .isInstanceOf(StoreException.class)
        .extracting(e -> ((StoreException) e).kind())
        .isEqualTo(StoreException.Kind.ROW_NOT_FOUND);
    assertThat(store.findMatch("missing")).isEmpty();
  }

  @Test
  void periodNumbersAndLineupKeysAreUnique() {
    store.inTransaction("m1", tx -> {
      tx.insertPeriod(Period.open("p1", "m1", 1, PeriodType.REGULAR, T0));
      tx.insertLineup(LineupEntry.open("m1", "p1", Minutes.of(0), "ST", null, null, null));
      return null;
    });

    assertThatThrownBy(() -> store.inTransaction("m1", tx -> {
      tx.insertPeriod(Period.open("p2", "m1", 1, PeriodType.REGULAR, T0));
      return null;
    })).isInstanceOf(StoreException.class);
    assertThatThrownBy(() -> store.inTransaction("m1", tx -> {
      tx.insertLineup(LineupEntry.open("m1", "p1", Minutes.of(0.001), "CF", null, null, null));
      return null;
    })).isInstanceOf(StoreException.class);
  }

  @Test
  void hooksRunAfterCommitOnlyAndFailuresAreSwallowed() {
    List<String> ran = new ArrayList<>();

    String result = store.inTransaction("m1", tx -> {
      tx.afterCommit("failing", () -> {
        throw new IllegalStateException("hook failure");
      });
      tx.afterCommit("record", () -> ran.add("committed"));
      assertThat(ran).isEmpty();
      return "ok";
    });
    assertThat(result).isEqualTo("ok");
    assertThat(ran).containsExactly("committed");

    assertThatThrownBy(() -> store.inTransaction("m1", tx -> {
      tx.afterCommit("record", () -> ran.add("rolled back"));
      throw new IllegalStateException("boom");
    })).isInstanceOf(IllegalStateException.class);
    assertThat(ran).containsExactly("committed");
  }

  @Test
  void hooksMayOpenNewTransactionsOnTheSameMatch() {
    store.inTransaction("m1", tx -> {
      tx.afterCommit("score", () -> store.inTransaction("m1", inner -> {
        inner.updateMatch(inner.match().withScore(1, 0));
        return null;
      }));
      return null;
    });
    assertThat(store.findMatch("m1")).get().extracting(Match::homeScore).isEqualTo(1);
  }

  @Test
  void nestedTransactionOnSameMatchIsRejected() {
    assertThatThrownBy(() -> store.inTransaction("m1", tx -> store.inTransaction("m1", inner -> null)))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void transactionsOnTheSameMatchAreSerialized() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < 8; t++) {
        futures.add(pool.submit(() -> {
          for (int i = 0; i < 100; i++) {
            store.inTransaction("m1", tx -> {
              Match m = tx.match();
              tx.updateMatch(m.withScore(m.homeScore() + 1, m.awayScore()));
              return null;
            });
          }
        }));
      }
      for (Future<?> f : futures) f.get();
    } finally {
      pool.shutdown();
    }
    assertThat(store.findMatch("m1")).get().extracting(Match::homeScore).isEqualTo(800);
  }

  @Test
  void softDeleteCascadesToOwnedRows() {
    store.inTransaction("m1", tx -> {
      tx.saveState(MatchState.scheduled("m1").withStatus(MatchStatus.LIVE));
      tx.insertEvent(event("e1", "m1", EventKind.FOUL, "home", 1000));
      return null;
    });

    store.softDeleteMatch("m1", "admin", T0);

    assertThat(store.findMatch("m1")).get().matches(Match::isDeleted);
    assertThat(store.findEvent("e1")).get().matches(MatchEvent::isDeleted);
    assertThat(store.findStatesByStatus(MatchStatus.LIVE)).isEmpty();
    assertThatThrownBy(() -> store.inTransaction("m1", MatchTransaction::match))
        .isInstanceOf(StoreException.class);
  }

  @Test
  void findsTeamsByCreator() {
    assertThat(store.findTeamIdsCreatedBy("owner")).containsExactly("home");
    assertThat(store.findTeamIdsCreatedBy("nobody")).isEmpty();
  }
}
