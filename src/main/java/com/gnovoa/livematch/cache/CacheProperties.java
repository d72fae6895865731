package com.gnovoa.livematch.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/** TTL per key family and overall size bound of the {@link ReadCache} ({@code cache.*}). */
@ConfigurationProperties(prefix = "cache")
public record CacheProperties(
        Duration matchStateTtl,
        Duration matchStatusTtl,
        Duration liveMatchesTtl,
        Duration userTeamsTtl,
        int maxEntries
) {
    public CacheProperties {
        if (matchStateTtl == null) matchStateTtl = Duration.ofSeconds(30);
        if (matchStatusTtl == null) matchStatusTtl = Duration.ofSeconds(60);
        if (liveMatchesTtl == null) liveMatchesTtl = Duration.ofSeconds(15);
        if (userTeamsTtl == null) userTeamsTtl = Duration.ofMinutes(5);
        if (maxEntries <= 0) maxEntries = 10_000;
    }

    public static CacheProperties defaults() {
        return new CacheProperties(null, null, null, null, 0);
    }
}
