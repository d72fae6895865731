package com.gnovoa.livematch.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.caffeine.CaffeineCacheManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Short-lived memoization of derived reads over one Caffeine cache per key family. Never the
 * authority of record: a miss or an early eviction only costs a reload.
 *
 * <p>Every key carries an invalidation generation. A loaded value is stored only if no
 * invalidation of its key ran while it was loading, so a read racing a commit never outlives it.
 */
public final class ReadCache {

    private static final Logger log = LoggerFactory.getLogger(ReadCache.class);

    private static final Duration GENERATION_RETENTION = Duration.ofMinutes(10);

    private final CacheManager manager;
    private final ConcurrentMap<String, AtomicLong> generations = Caffeine.newBuilder()
            .expireAfterAccess(GENERATION_RETENTION)
            .<String, AtomicLong>build()
            .asMap();

    public ReadCache(CacheManager manager) {
        this.manager = manager;
    }

    /**
     * One cache per family with its TTL from {@code cache.*}, all bounded by {@code maxEntries}.
     * Expiry follows {@code clock}.
     */
    public static CaffeineCacheManager cacheManager(CacheProperties props, Clock clock) {
        Ticker ticker = () -> {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.setAllowNullValues(false);
        manager.setCacheNames(List.of());
        manager.registerCustomCache(CacheKeys.MATCH_STATE, family(props.matchStateTtl(), props.maxEntries(), ticker));
        manager.registerCustomCache(CacheKeys.MATCH_STATUS, family(props.matchStatusTtl(), props.maxEntries(), ticker));
        manager.registerCustomCache(CacheKeys.LIVE_MATCHES, family(props.liveMatchesTtl(), props.maxEntries(), ticker));
        manager.registerCustomCache(CacheKeys.USER_TEAMS, family(props.userTeamsTtl(), props.maxEntries(), ticker));
        return manager;
    }

    private static Cache<Object, Object> family(Duration ttl, int maxEntries, Ticker ticker) {
        return Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /**
     * Returns the cached value for {@code key} or loads, stores and returns it. Null results are
     * not cached.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrLoad(String key, Supplier<T> loader) {
        Cache<Object, Object> cache = cacheOf(key);
        Object hit = cache.getIfPresent(key);
        if (hit != null) return (T) hit;
        AtomicLong generation = generations.computeIfAbsent(key, k -> new AtomicLong());
        long seen = generation.get();
        log.debug("Cache miss {}", key);
        T value = loader.get();
        if (value != null) {
            cache.asMap().compute(key, (k, current) -> generation.get() == seen ? value : current);
        }
        return value;
    }

    public void invalidate(String... keys) {
        for (String key : keys) {
            AtomicLong generation = generations.get(key);
            if (generation != null) generation.incrementAndGet();
            cacheOf(key).invalidate(key);
        }
    }

    /** Drops every key of one family that starts with {@code prefix}. */
    public void invalidatePrefix(String prefix) {
        generations.forEach((key, generation) -> {
            if (key.startsWith(prefix)) generation.incrementAndGet();
        });
        cacheOf(prefix).asMap().keySet().removeIf(k -> k.toString().startsWith(prefix));
    }

    public boolean contains(String key) {
        return cacheOf(key).getIfPresent(key) != null;
    }

    public long size() {
        long total = 0;
        for (String name : manager.getCacheNames()) {
            Cache<Object, Object> cache = nativeCache(name);
            cache.cleanUp();
            total += cache.estimatedSize();
        }
        return total;
    }

    public void clear() {
        generations.values().forEach(AtomicLong::incrementAndGet);
        for (String name : manager.getCacheNames()) {
            nativeCache(name).invalidateAll();
        }
    }

    private Cache<Object, Object> cacheOf(String key) {
        return nativeCache(CacheKeys.family(key));
    }

    private Cache<Object, Object> nativeCache(String name) {
        org.springframework.cache.Cache cache = manager.getCache(name);
        if (cache == null) throw new IllegalArgumentException("No cache named " + name);
        if (!(cache instanceof CaffeineCache)) {
            throw new IllegalStateException("Cache " + name + " is not backed by Caffeine");
        }
        return ((CaffeineCache) cache).getNativeCache();
    }
}
