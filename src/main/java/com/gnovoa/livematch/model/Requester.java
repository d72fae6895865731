package com.gnovoa.livematch.model;

import java.util.Locale;
import java.util.Objects;

/** The authenticated caller of an operation. */
public record Requester(String userId, Role role) {

    public Requester {
        Objects.requireNonNull(userId, "userId");
        if (role == null) role = Role.USER;
    }

    public static Requester user(String userId) {
        return new Requester(userId, Role.USER);
    }

    public static Requester admin(String userId) {
        return new Requester(userId, Role.ADMIN);
    }

    /** Parses a user id and role name as sent in request headers; a blank role means {@link Role#USER}. */
    public static Requester of(String userId, String role) {
        if (userId == null || userId.isBlank()) throw new IllegalArgumentException("userId is required");
        Role r = role == null || role.isBlank() ? Role.USER : Role.valueOf(role.trim().toUpperCase(Locale.ROOT));
        return new Requester(userId, r);
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
