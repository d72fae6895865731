package com.gnovoa.livematch.cache;

import com.gnovoa.livematch.model.Requester;
import com.gnovoa.livematch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReadCacheTest {

  private static final String STATE = CacheKeys.matchState("m1");

  private MutableClock clock;
  private ReadCache cache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-05-02T15:00:00Z"));
    cache = new ReadCache(ReadCache.cacheManager(CacheProperties.defaults(), clock));
  }

  @Test
  void loadsOnceUntilExpiry() {
    AtomicInteger loads = new AtomicInteger();

    assertThat(cache.getOrLoad(STATE, loads::incrementAndGet)).isEqualTo(1);
    clock.advanceSeconds(29);
    assertThat(cache.getOrLoad(STATE, loads::incrementAndGet)).isEqualTo(1);
    clock.advanceSeconds(1);
    assertThat(cache.getOrLoad(STATE, loads::incrementAndGet)).isEqualTo(2);
  }

  @Test
  void familiesExpireIndependently() {
    AtomicInteger loads = new AtomicInteger();
    String status = CacheKeys.matchStatus("m1");
    cache.getOrLoad(STATE, loads::incrementAndGet);
    cache.getOrLoad(status, loads::incrementAndGet);

    clock.advanceSeconds(45);

    assertThat(cache.contains(STATE)).isFalse();
    assertThat(cache.contains(status)).isTrue();
  }

  @Test
  void nullResultsAreNotCached() {
    AtomicInteger loads = new AtomicInteger();

    cache.getOrLoad(STATE, () -> {
      loads.incrementAndGet();
      return null;
    });
    cache.getOrLoad(STATE, () -> {
      loads.incrementAndGet();
      return null;
    });

    assertThat(loads).hasValue(2);
    assertThat(cache.contains(STATE)).isFalse();
  }

  @Test
  void invalidatesByKeyAndPrefix() {
    String admin1 = CacheKeys.liveMatches(Requester.admin("a1"));
    String admin2 = CacheKeys.liveMatches(Requester.admin("a2"));
    String user = CacheKeys.liveMatches(Requester.user("u1"));
    cache.getOrLoad(STATE, () -> "state");
    cache.getOrLoad(admin1, () -> "live");
    cache.getOrLoad(admin2, () -> "live");
    cache.getOrLoad(user, () -> "live");

    cache.invalidate(STATE, CacheKeys.matchState("absent"));
    assertThat(cache.contains(STATE)).isFalse();

    cache.invalidatePrefix(CacheKeys.adminLiveMatchesPrefix());
    assertThat(cache.contains(admin1)).isFalse();
    assertThat(cache.contains(admin2)).isFalse();
    assertThat(cache.contains(user)).isTrue();
    assertThat(cache.size()).isEqualTo(1);
  }

  @Test
  void invalidationDuringLoadKeepsTheLoadedValueOut() {
    String loaded = cache.getOrLoad(STATE, () -> {
      cache.invalidate(STATE);
      return "SCHEDULED";
    });

    assertThat(loaded).isEqualTo("SCHEDULED");
    assertThat(cache.contains(STATE)).isFalse();
    assertThat(cache.getOrLoad(STATE, () -> "LIVE")).isEqualTo("LIVE");
  }

  @Test
  void prefixInvalidationDuringLoadKeepsTheLoadedValueOut() {
    String key = CacheKeys.liveMatches(Requester.admin("a1"));
    cache.getOrLoad(key, () -> "warm");
    cache.invalidate(key);

    cache.getOrLoad(key, () -> {
      cache.invalidatePrefix(CacheKeys.adminLiveMatchesPrefix());
      return "before commit";
    });

    assertThat(cache.getOrLoad(key, () -> "after commit")).isEqualTo("after commit");
  }

  @Test
  void sizeStaysWithinMaxEntries() {
    cache = new ReadCache(ReadCache.cacheManager(new CacheProperties(null, null, null, null, 3), clock));

    for (int i = 0; i < 10; i++) {
      int value = i;
      cache.getOrLoad(CacheKeys.matchState("m" + i), () -> value);
    }

    assertThat(cache.size()).isLessThanOrEqualTo(3);
  }

  @Test
  void clearDropsEveryFamily() {
    cache.getOrLoad(STATE, () -> "state");
    cache.getOrLoad(CacheKeys.userTeams("u1"), () -> "teams");

    cache.clear();

    assertThat(cache.size()).isZero();
  }

  @Test
  void keysFollowTheDocumentedLayout() {
    assertThat(CacheKeys.matchState("m1")).isEqualTo("match_state:m1");
    assertThat(CacheKeys.matchStatus("m1")).isEqualTo("match_status:m1");
    assertThat(CacheKeys.liveMatches(Requester.user("u1"))).isEqualTo("live_matches:user:u1");
    assertThat(CacheKeys.liveMatches(Requester.admin("u1"))).startsWith(CacheKeys.adminLiveMatchesPrefix());
    assertThat(CacheKeys.userTeams("u1")).isEqualTo("user_teams:u1");
    assertThat(CacheKeys.family(CacheKeys.userTeams("u1"))).isEqualTo(CacheKeys.USER_TEAMS);
  }

  @Test
  void keysWithoutFamilyAreRejected() {
    assertThatThrownBy(() -> cache.getOrLoad("plain", () -> 1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> cache.contains("unknown:k")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void missingSettingsFallBackToDefaults() {
    CacheProperties props = CacheProperties.defaults();

    assertThat(props.matchStateTtl()).hasSeconds(30);
    assertThat(props.maxEntries()).isEqualTo(10_000);
  }
}
