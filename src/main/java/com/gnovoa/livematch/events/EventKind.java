package com.gnovoa.livematch.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Discrete things that happen in a match. Serialized in snake case (e.g. {@code own_goal}). */
public enum EventKind {
    GOAL,
    OWN_GOAL,
    PENALTY,
    FOUL,
    FREE_KICK,
    ASSIST,
    YELLOW_CARD,
    RED_CARD,
    KEY_PASS,
    SAVE,
    INTERCEPTION,
    TACKLE,
    FORMATION_CHANGE,
    CORNER,
    OFFSIDE,
    SHOT_ON_TARGET,
    SHOT_OFF_TARGET,
    CLEARANCE,
    BLOCK,
    CROSS,
    HEADER,
    BALL_OUT,
    SUBSTITUTION_OFF,
    SUBSTITUTION_ON;

    /** @return true for kinds that change the scoreboard. */
    public boolean affectsScore() {
        return this == GOAL || this == OWN_GOAL;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EventKind fromWire(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown event kind: " + value, e);
        }
    }
}
