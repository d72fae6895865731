package com.gnovoa.livematch.access;

import java.time.Instant;

/** Short code that lets an anonymous viewer follow one match until {@code expiresAt}. */
public record ViewerLink(String code, String matchId, Instant expiresAt, String createdBy) {

    public boolean grants(String matchId, Instant now) {
        return this.matchId.equals(matchId) && now.isBefore(expiresAt);
    }
}
