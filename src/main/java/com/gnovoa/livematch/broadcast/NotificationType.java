package com.gnovoa.livematch.broadcast;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NotificationType {
    SNAPSHOT,
    STATE_CHANGED,
    PERIOD_STARTED,
    PERIOD_ENDED,
    EVENT_CREATED,
    EVENT_UPDATED,
    EVENT_DELETED,
    FORMATION_CHANGED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
