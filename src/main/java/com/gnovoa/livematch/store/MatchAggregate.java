package com.gnovoa.livematch.store;

import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.model.FormationSnapshot;
import com.gnovoa.livematch.model.LineupEntry;
import com.gnovoa.livematch.model.Match;
import com.gnovoa.livematch.model.MatchState;
import com.gnovoa.livematch.model.Period;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every row owned by one match. Published aggregates are never mutated: a transaction works on
 * {@link #copy()} and swaps it in on commit.
 */
final class MatchAggregate {

    Match match;
    MatchState state;
    final Map<String, Period> periods = new LinkedHashMap<>();
    final Map<String, MatchEvent> events = new LinkedHashMap<>();
    final Map<String, LineupEntry> lineup = new LinkedHashMap<>();
    final Map<String, FormationSnapshot> formations = new LinkedHashMap<>();

    MatchAggregate(Match match) {
        this.match = match;
    }

    MatchAggregate copy() {
        MatchAggregate c = new MatchAggregate(match);
        c.state = state;
        c.periods.putAll(periods);
        c.events.putAll(events);
        c.lineup.putAll(lineup);
        c.formations.putAll(formations);
        return c;
    }

    static String lineupKey(String playerId, BigDecimal startMin) {
        return playerId + "@" + startMin.toPlainString();
    }

    static String lineupKey(LineupEntry e) {
        return lineupKey(e.playerId(), e.startMin());
    }
}
