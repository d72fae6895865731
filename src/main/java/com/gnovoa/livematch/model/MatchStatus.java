package com.gnovoa.livematch.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle status of a match.
 *
 * <p>Allowed transitions:
 * <ul>
 *   <li>SCHEDULED → LIVE, CANCELLED, POSTPONED</li>
 *   <li>LIVE → PAUSED, COMPLETED</li>
 *   <li>PAUSED → LIVE, COMPLETED, CANCELLED</li>
 *   <li>POSTPONED → SCHEDULED</li>
 * </ul>
 * COMPLETED and CANCELLED are terminal.
 */
public enum MatchStatus {
    SCHEDULED,
    LIVE,
    PAUSED,
    COMPLETED,
    CANCELLED,
    POSTPONED;

    private static final Map<MatchStatus, Set<MatchStatus>> TRANSITIONS = new EnumMap<>(MatchStatus.class);

    static {
        TRANSITIONS.put(SCHEDULED, EnumSet.of(LIVE, CANCELLED, POSTPONED));
        TRANSITIONS.put(LIVE, EnumSet.of(PAUSED, COMPLETED));
        TRANSITIONS.put(PAUSED, EnumSet.of(LIVE, COMPLETED, CANCELLED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(MatchStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(MatchStatus.class));
        TRANSITIONS.put(POSTPONED, EnumSet.of(SCHEDULED));
    }

    public boolean canTransitionTo(MatchStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }
}
