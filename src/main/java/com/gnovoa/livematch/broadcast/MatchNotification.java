package com.gnovoa.livematch.broadcast;

import java.time.Instant;

/** Envelope pushed to every subscriber of a match. */
public record MatchNotification(String matchId, NotificationType type, Instant occurredAt, Object payload) {}
