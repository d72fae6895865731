package com.gnovoa.livematch.cache;

import com.gnovoa.livematch.model.Requester;
import com.gnovoa.livematch.model.Role;

import java.util.Locale;

/**
 * Key families of the {@link ReadCache}. Every key starts with its family name, which is also the
 * name of the cache that holds it.
 */
public final class CacheKeys {

    public static final String MATCH_STATE = "match_state";
    public static final String MATCH_STATUS = "match_status";
    public static final String LIVE_MATCHES = "live_matches";
    public static final String USER_TEAMS = "user_teams";

    private CacheKeys() {}

    /** {@code match_status:m1} to {@code match_status}. */
    public static String family(String key) {
        int sep = key.indexOf(':');
        if (sep <= 0) throw new IllegalArgumentException("Cache key without family: " + key);
        return key.substring(0, sep);
    }

    public static String matchState(String matchId) {
        return MATCH_STATE + ":" + matchId;
    }

    public static String matchStatus(String matchId) {
        return MATCH_STATUS + ":" + matchId;
    }

    public static String liveMatches(Requester requester) {
        return liveMatches(requester.role(), requester.userId());
    }

    public static String liveMatches(Role role, String userId) {
        return LIVE_MATCHES + ":" + role.name().toLowerCase(Locale.ROOT) + ":" + userId;
    }

    /** Prefix shared by every admin's live listing. */
    public static String adminLiveMatchesPrefix() {
        return LIVE_MATCHES + ":admin:";
    }

    public static String userTeams(String userId) {
        return USER_TEAMS + ":" + userId;
    }
}
