package com.gnovoa.livematch.store;

import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.model.Match;
import com.gnovoa.livematch.model.MatchState;
import com.gnovoa.livematch.model.MatchStatus;
import com.gnovoa.livematch.model.Player;
import com.gnovoa.livematch.model.Team;
import com.gnovoa.livematch.model.TeamMembership;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Transactional persistence port of the engine. Matches, teams, players and memberships are owned
 * by the surrounding application; the engine reads them and writes only the derived score.
 */
public interface MatchStore {

    /**
     * Runs {@code work} atomically against the aggregate of {@code matchId}. Transactions on the
     * same match are serialized.
     *
     * @throws StoreException when a constraint is violated; nothing is written in that case
     */
    <T> T inTransaction(String matchId, TransactionWork<T> work);

    Optional<Match> findMatch(String matchId);

    /** Committed event by id, from any match, soft-deleted rows included. */
    Optional<MatchEvent> findEvent(String eventId);

    Optional<Team> findTeam(String teamId);

    Optional<Player> findPlayer(String playerId);

    /** Non-deleted states with the given status, on non-deleted matches. */
    List<MatchState> findStatesByStatus(MatchStatus status);

    Set<String> findTeamIdsCreatedBy(String userId);

    void saveMatch(Match match);

    void saveTeam(Team team);

    void savePlayer(Player player);

    void saveMembership(TeamMembership membership);

    /** Soft-deletes the match and every row it owns. */
    void softDeleteMatch(String matchId, String deletedBy, Instant at);
}
