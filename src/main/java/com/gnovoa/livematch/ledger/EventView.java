package com.gnovoa.livematch.ledger;

import com.gnovoa.livematch.events.EventKind;
import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.model.Player;
import com.gnovoa.livematch.model.Team;
import com.gnovoa.livematch.store.MatchStore;

import java.time.Instant;

/** Event as shown to viewers, with team and player display names resolved. */
public record EventView(
        String id,
        String matchId,
        EventKind kind,
        String teamId,
        String teamName,
        String playerId,
        String playerName,
        Integer periodNumber,
        long clockMs,
        String notes,
        int sentiment,
        Instant createdAt,
        String createdBy
) {

    public static EventView of(MatchEvent e, MatchStore store) {
        String teamName = store.findTeam(e.teamId()).map(Team::name).orElse(null);
        String playerName = store.findPlayer(e.playerId()).map(Player::name).orElse(null);
        return new EventView(e.id(), e.matchId(), e.kind(), e.teamId(), teamName, e.playerId(), playerName,
                e.periodNumber(), e.clockMs(), e.notes(), e.sentiment(), e.createdAt(), e.createdBy());
    }
}
