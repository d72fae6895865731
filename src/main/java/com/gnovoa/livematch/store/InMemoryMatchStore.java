package com.gnovoa.livematch.store;

import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.model.FormationSnapshot;
import com.gnovoa.livematch.model.LineupEntry;
import com.gnovoa.livematch.model.Match;
import com.gnovoa.livematch.model.MatchState;
import com.gnovoa.livematch.model.MatchStatus;
import com.gnovoa.livematch.model.Period;
import com.gnovoa.livematch.model.Player;
import com.gnovoa.livematch.model.Team;
import com.gnovoa.livematch.model.TeamMembership;
import com.gnovoa.livematch.model.Tombstone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * {@link MatchStore} kept entirely in memory (no DB).
 *
 * <p>Transactions are serialized per match with one lock each. A transaction mutates a private
 * copy of the aggregate which replaces the published one on commit, so readers never observe a
 * partial write. Event ids are unique across matches through a global id index reserved at commit.
 */
public final class InMemoryMatchStore implements MatchStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMatchStore.class);

    private final ConcurrentHashMap<String, MatchAggregate> aggregates = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> eventIndex = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Team> teams = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Player> players = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TeamMembership> memberships = new ConcurrentHashMap<>();

    @Override
    public <T> T inTransaction(String matchId, TransactionWork<T> work) {
        Objects.requireNonNull(matchId, "matchId");
        ReentrantLock lock = locks.computeIfAbsent(matchId, k -> new ReentrantLock());
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Nested transaction on match " + matchId);
        }
        PostCommitHooks hooks = new PostCommitHooks(matchId);
        T result;
        lock.lock();
        try {
            MatchAggregate published = aggregates.get(matchId);
            MatchAggregate working = published == null ? new MatchAggregate(null) : published.copy();
            Tx tx = new Tx(matchId, working, hooks);
            result = work.execute(tx);
            commit(tx, published);
        } finally {
            lock.unlock();
        }
        if (!hooks.isEmpty()) hooks.runAll();
        return result;
    }

    private void commit(Tx tx, MatchAggregate published) {
        List<String> reserved = new ArrayList<>();
        for (String id : tx.insertedEventIds) {
            String owner = eventIndex.putIfAbsent(id, tx.matchId);
            if (owner != null && !owner.equals(tx.matchId)) {
                reserved.forEach(eventIndex::remove);
                throw StoreException.unique("Event id already used: " + id);
            }
            reserved.add(id);
        }
        if (tx.working.match == null) return;
        if (published == null) {
            aggregates.put(tx.matchId, tx.working);
        } else {
            aggregates.replace(tx.matchId, published, tx.working);
        }
    }

    @Override
    public Optional<Match> findMatch(String matchId) {
        MatchAggregate a = aggregates.get(matchId);
        return a == null ? Optional.empty() : Optional.ofNullable(a.match);
    }

    @Override
    public Optional<MatchEvent> findEvent(String eventId) {
        String matchId = eventIndex.get(eventId);
        if (matchId == null) return Optional.empty();
        MatchAggregate a = aggregates.get(matchId);
        return a == null ? Optional.empty() : Optional.ofNullable(a.events.get(eventId));
    }

    @Override
    public Optional<Team> findTeam(String teamId) {
        return teamId == null ? Optional.empty() : Optional.ofNullable(teams.get(teamId));
    }

    @Override
    public Optional<Player> findPlayer(String playerId) {
        return playerId == null ? Optional.empty() : Optional.ofNullable(players.get(playerId));
    }

    @Override
    public List<MatchState> findStatesByStatus(MatchStatus status) {
        return aggregates.values().stream()
                .filter(a -> a.match != null && !a.match.isDeleted())
                .map(a -> a.state)
                .filter(s -> s != null && !s.isDeleted() && s.status() == status)
                .toList();
    }

    @Override
    public Set<String> findTeamIdsCreatedBy(String userId) {
        return teams.values().stream()
                .filter(t -> Objects.equals(t.createdBy(), userId))
                .map(Team::teamId)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public void saveMatch(Match match) {
        inTransaction(match.matchId(), tx -> {
            ((Tx) tx).working.match = match;
            return null;
        });
    }

    @Override
    public void saveTeam(Team team) {
        teams.put(team.teamId(), team);
    }

    @Override
    public void savePlayer(Player player) {
        players.put(player.playerId(), player);
    }

    @Override
    public void saveMembership(TeamMembership membership) {
        memberships.put(membership.playerId() + "/" + membership.teamId(), membership);
    }

    @Override
    public void softDeleteMatch(String matchId, String deletedBy, Instant at) {
        Tombstone t = new Tombstone(at, deletedBy);
        inTransaction(matchId, tx -> {
            MatchAggregate a = ((Tx) tx).working;
            if (a.match == null) throw StoreException.notFound("Match not found: " + matchId);
            a.match = a.match.withTombstone(t);
            if (a.state != null) a.state = a.state.withTombstone(t);
            a.periods.replaceAll((k, p) -> p.isDeleted() ? p : p.withTombstone(t));
            a.events.replaceAll((k, e) -> e.isDeleted() ? e : e.withTombstone(t));
            a.lineup.replaceAll((k, l) -> l.isDeleted() ? l : l.withTombstone(t));
            a.formations.replaceAll((k, f) -> f.isDeleted() ? f : f.withTombstone(t));
            return null;
        });
        log.info("Match {} soft-deleted by {}", matchId, deletedBy);
    }

    private final class Tx implements MatchTransaction {

        private final String matchId;
        private final MatchAggregate working;
        private final PostCommitHooks hooks;
        private final List<String> insertedEventIds = new ArrayList<>();

        private Tx(String matchId, MatchAggregate working, PostCommitHooks hooks) {
            this.matchId = matchId;
            this.working = working;
            this.hooks = hooks;
        }

        @Override
        public String matchId() {
            return matchId;
        }

        @Override
        public Match match() {
            if (working.match == null || working.match.isDeleted()) {
                throw StoreException.notFound("Match not found: " + matchId);
            }
            return working.match;
        }

        @Override
        public void updateMatch(Match match) {
            match();
            if (!matchId.equals(match.matchId())) throw new IllegalArgumentException("Match id mismatch");
            working.match = match;
        }

        @Override
        public Optional<MatchState> state() {
            return Optional.ofNullable(working.state);
        }

        @Override
        public void saveState(MatchState state) {
            match();
            working.state = state;
        }

        @Override
        public List<Period> periods() {
            return working.periods.values().stream()
                    .sorted(Comparator.comparingInt(Period::periodNumber))
                    .toList();
        }

        @Override
        public void insertPeriod(Period period) {
            match();
            if (working.periods.containsKey(period.id())) {
                throw StoreException.unique("Period id already used: " + period.id());
            }
            boolean numberTaken = working.periods.values().stream()
                    .anyMatch(p -> p.periodNumber() == period.periodNumber());
            if (numberTaken) {
                throw StoreException.unique("Period " + period.periodNumber() + " already exists for match " + matchId);
            }
            working.periods.put(period.id(), period);
        }

        @Override
        public void updatePeriod(Period period) {
            if (!working.periods.containsKey(period.id())) {
                throw StoreException.notFound("Period not found: " + period.id());
            }
            working.periods.put(period.id(), period);
        }

        @Override
        public List<MatchEvent> events() {
            return List.copyOf(working.events.values());
        }

        @Override
        public Optional<MatchEvent> findEvent(String eventId) {
            MatchEvent local = working.events.get(eventId);
            if (local != null) return Optional.of(local);
            return InMemoryMatchStore.this.findEvent(eventId);
        }

        @Override
        public void insertEvent(MatchEvent event) {
            match();
            String owner = eventIndex.get(event.id());
            if (working.events.containsKey(event.id()) || (owner != null && !owner.equals(matchId))) {
                throw StoreException.unique("Event id already used: " + event.id());
            }
            if (event.teamId() != null && !teams.containsKey(event.teamId())) {
                throw StoreException.foreignKey("Unknown team: " + event.teamId());
            }
            if (event.playerId() != null && !players.containsKey(event.playerId())) {
                throw StoreException.foreignKey("Unknown player: " + event.playerId());
            }
            working.events.put(event.id(), event);
            insertedEventIds.add(event.id());
        }

        @Override
        public void updateEvent(MatchEvent event) {
            if (!working.events.containsKey(event.id())) {
                throw StoreException.notFound("Event not found: " + event.id());
            }
            if (event.teamId() != null && !teams.containsKey(event.teamId())) {
                throw StoreException.foreignKey("Unknown team: " + event.teamId());
            }
            if (event.playerId() != null && !players.containsKey(event.playerId())) {
                throw StoreException.foreignKey("Unknown player: " + event.playerId());
            }
            working.events.put(event.id(), event);
        }

        @Override
        public List<LineupEntry> lineup() {
            return List.copyOf(working.lineup.values());
        }

        @Override
        public void insertLineup(LineupEntry entry) {
            match();
            String key = MatchAggregate.lineupKey(entry);
            if (working.lineup.containsKey(key)) {
                throw StoreException.unique("Lineup entry already exists: " + key);
            }
            if (!players.containsKey(entry.playerId())) {
                throw StoreException.foreignKey("Unknown player: " + entry.playerId());
            }
            working.lineup.put(key, entry);
        }

        @Override
        public void updateLineup(LineupEntry entry) {
            String key = MatchAggregate.lineupKey(entry);
            if (!working.lineup.containsKey(key)) {
                throw StoreException.notFound("Lineup entry not found: " + key);
            }
            working.lineup.put(key, entry);
        }

        @Override
        public List<FormationSnapshot> formations() {
            return working.formations.values().stream()
                    .sorted(Comparator.comparing(FormationSnapshot::startMin))
                    .toList();
        }

        @Override
        public void insertFormation(FormationSnapshot snapshot) {
            match();
            if (working.formations.containsKey(snapshot.id())) {
                throw StoreException.unique("Formation id already used: " + snapshot.id());
            }
            boolean startTaken = working.formations.values().stream()
                    .anyMatch(f -> f.startMin().compareTo(snapshot.startMin()) == 0);
            if (startTaken) {
                throw StoreException.unique("Formation already starts at minute " + snapshot.startMin());
            }
            working.formations.put(snapshot.id(), snapshot);
        }

        @Override
        public void updateFormation(FormationSnapshot snapshot) {
            if (!working.formations.containsKey(snapshot.id())) {
                throw StoreException.notFound("Formation not found: " + snapshot.id());
            }
            working.formations.put(snapshot.id(), snapshot);
        }

        @Override
        public Optional<Team> team(String teamId) {
            return findTeam(teamId);
        }

        @Override
        public Optional<Player> player(String playerId) {
            return findPlayer(playerId);
        }

        @Override
        public boolean hasActiveMembership(String playerId, String teamId) {
            TeamMembership m = memberships.get(playerId + "/" + teamId);
            return m != null && m.active();
        }

        @Override
        public void afterCommit(String description, Runnable hook) {
            hooks.add(description, hook);
        }
    }
}
