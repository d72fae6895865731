package com.gnovoa.livematch.core;

import com.gnovoa.livematch.broadcast.BroadcastHub;
import com.gnovoa.livematch.broadcast.NotificationType;
import com.gnovoa.livematch.cache.CacheKeys;
import com.gnovoa.livematch.cache.ReadCache;
import com.gnovoa.livematch.model.Requester;
import com.gnovoa.livematch.store.MatchTransaction;

import java.util.function.Supplier;

/**
 * Registers the side effects of a write on its transaction. They run after commit, in the order
 * registered, and a failing one is logged without affecting the write.
 */
public final class PostCommitEffects {

    private final ReadCache cache;
    private final BroadcastHub hub;
    private final ScoreProjector scores;

    public PostCommitEffects(ReadCache cache, BroadcastHub hub, ScoreProjector scores) {
        this.cache = cache;
        this.hub = hub;
        this.scores = scores;
    }

    public void recomputeScore(MatchTransaction tx) {
        String matchId = tx.matchId();
        tx.afterCommit("score recompute", () -> scores.recompute(matchId));
    }

    /** Drops the cached state and status of the match plus the caller's and admins' live listings. */
    public void invalidateMatch(MatchTransaction tx, Requester requester) {
        String matchId = tx.matchId();
        tx.afterCommit("cache invalidation", () -> {
            cache.invalidate(CacheKeys.matchState(matchId), CacheKeys.matchStatus(matchId),
                    CacheKeys.liveMatches(requester));
            cache.invalidatePrefix(CacheKeys.adminLiveMatchesPrefix());
        });
    }

    public void invalidateStatus(MatchTransaction tx) {
        String matchId = tx.matchId();
        tx.afterCommit("cache invalidation", () -> cache.invalidate(CacheKeys.matchStatus(matchId)));
    }

    /** The payload is built after commit so it can resolve names from committed rows. */
    public void broadcast(MatchTransaction tx, NotificationType type, Supplier<?> payload) {
        String matchId = tx.matchId();
        tx.afterCommit("broadcast " + type.wireName(), () -> hub.broadcast(matchId, type, payload.get()));
    }
}
