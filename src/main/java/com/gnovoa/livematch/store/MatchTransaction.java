package com.gnovoa.livematch.store;

import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.model.FormationSnapshot;
import com.gnovoa.livematch.model.LineupEntry;
import com.gnovoa.livematch.model.Match;
import com.gnovoa.livematch.model.MatchState;
import com.gnovoa.livematch.model.Period;
import com.gnovoa.livematch.model.Player;
import com.gnovoa.livematch.model.Team;

import java.util.List;
import java.util.Optional;

/**
 * Atomic view over one match aggregate. Writes become visible to other transactions only when the
 * surrounding {@link MatchStore#inTransaction} returns normally; any exception discards them.
 *
 * <p>List accessors return every row, soft-deleted ones included. Uniqueness constraints apply to
 * all rows as well:
 * <ul>
 *   <li>period number per match</li>
 *   <li>event id across all matches</li>
 *   <li>lineup {@code (playerId, startMin)} per match</li>
 *   <li>formation {@code startMin} per match</li>
 * </ul>
 */
public interface MatchTransaction {

    String matchId();

    /** @throws StoreException ROW_NOT_FOUND when the match does not exist or is soft-deleted */
    Match match();

    void updateMatch(Match match);

    Optional<MatchState> state();

    void saveState(MatchState state);

    /** Ordered by period number. */
    List<Period> periods();

    void insertPeriod(Period period);

    void updatePeriod(Period period);

    /** Ordered by insertion. */
    List<MatchEvent> events();

    /** Looks the id up across every match, this transaction's uncommitted rows first. */
    Optional<MatchEvent> findEvent(String eventId);

    void insertEvent(MatchEvent event);

    void updateEvent(MatchEvent event);

    List<LineupEntry> lineup();

    void insertLineup(LineupEntry entry);

    void updateLineup(LineupEntry entry);

    /** Ordered by start minute. */
    List<FormationSnapshot> formations();

    void insertFormation(FormationSnapshot snapshot);

    void updateFormation(FormationSnapshot snapshot);

    Optional<Team> team(String teamId);

    Optional<Player> player(String playerId);

    boolean hasActiveMembership(String playerId, String teamId);

    /**
     * Registers a side effect to run once this transaction has committed and its lock is released.
     * Hooks never run for a rolled back transaction; their failures are logged and swallowed.
     */
    void afterCommit(String description, Runnable hook);
}
