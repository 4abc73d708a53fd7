package dev.eureka.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.eureka.fixture.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LruTtlCacheTest {

  private static final Duration TTL = Duration.ofMinutes(30);

  private MutableClock clock;
  private LruTtlCache<String, Integer> cache;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    cache = new LruTtlCache<>(3, TTL, clock);
  }

  @Test
  void fourthKeyEvictsLeastRecentlyUsed() {
    cache.put("a", 1);
    cache.put("b", 2);
    cache.put("c", 3);
    cache.put("d", 4);

    assertThat(cache.containsKey("a")).isFalse();
    assertThat(cache.get("b")).contains(2);
    assertThat(cache.get("c")).contains(3);
    assertThat(cache.get("d")).contains(4);
    assertThat(cache.stats().evictions()).isEqualTo(1);
  }

  @Test
  void readRefreshesRecency() {
    cache.put("a", 1);
    cache.put("b", 2);
    cache.put("c", 3);
    cache.get("a");

    cache.put("d", 4);

    assertThat(cache.containsKey("a")).isTrue();
    assertThat(cache.containsKey("b")).isFalse();
  }

  @Test
  void overwritingExistingKeyDoesNotEvict() {
    cache.put("a", 1);
    cache.put("b", 2);
    cache.put("c", 3);

    cache.put("a", 10);

    assertThat(cache.size()).isEqualTo(3);
    assertThat(cache.get("a")).contains(10);
    assertThat(cache.stats().evictions()).isZero();
  }

  @Test
  void overwriteRefreshesRecency() {
    cache.put("a", 1);
    cache.put("b", 2);
    cache.put("c", 3);
    cache.put("a", 1);

    cache.put("d", 4);

    assertThat(cache.containsKey("a")).isTrue();
    assertThat(cache.containsKey("b")).isFalse();
  }

  @Test
  void entryExpiresAfterTtlAndIsPurged() {
    cache.put("a", 1);

    clock.advance(TTL);
    assertThat(cache.get("a")).contains(1);

    clock.advance(Duration.ofSeconds(1));
    assertThat(cache.get("a")).isEmpty();
    assertThat(cache.containsKey("a")).isFalse();
    assertThat(cache.size()).isZero();
  }

  @Test
  void overwriteResetsEntryAge() {
    cache.put("a", 1);
    clock.advance(Duration.ofMinutes(20));
    cache.put("a", 2);
    clock.advance(Duration.ofMinutes(20));

    assertThat(cache.get("a")).contains(2);
  }

  @Test
  void countsHitsAndMisses() {
    cache.put("a", 1);
    cache.get("a");
    cache.get("a");
    cache.get("missing");

    CacheStats stats = cache.stats();
    assertThat(stats.hits()).isEqualTo(2);
    assertThat(stats.misses()).isEqualTo(1);
    assertThat(stats.hitRate()).isEqualTo(2.0 / 3.0);
    assertThat(stats.size()).isEqualTo(1);
    assertThat(stats.capacity()).isEqualTo(3);
  }

  @Test
  void expiredLookupCountsAsMiss() {
    cache.put("a", 1);
    clock.advance(TTL.plusMillis(1));

    cache.get("a");

    assertThat(cache.stats().misses()).isEqualTo(1);
    assertThat(cache.stats().hits()).isZero();
  }

  @Test
  void resetStatsClearsCountersButKeepsEntries() {
    cache.put("a", 1);
    cache.get("a");
    cache.get("b");

    cache.resetStats();

    assertThat(cache.stats()).isEqualTo(new CacheStats(1, 3, 0, 0, 0));
    assertThat(cache.stats().hitRate()).isZero();
  }

  @Test
  void removeIfDropsMatchingKeys() {
    cache.put("java:1", 1);
    cache.put("java:2", 2);
    cache.put("rust:1", 3);

    assertThat(cache.removeIf(key -> key.startsWith("java"))).isEqualTo(2);
    assertThat(cache.containsKey("rust:1")).isTrue();
    assertThat(cache.size()).isEqualTo(1);
  }

  @Test
  void clearAndRemoveEmptyTheCache() {
    cache.put("a", 1);
    cache.put("b", 2);

    assertThat(cache.remove("a")).isTrue();
    assertThat(cache.remove("a")).isFalse();
    cache.clear();

    assertThat(cache.size()).isZero();
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThatThrownBy(() -> new LruTtlCache<String, Integer>(0, TTL, clock))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new LruTtlCache<String, Integer>(1, Duration.ZERO, clock))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void concurrentAccessNeverExceedsCapacity() throws Exception {
    LruTtlCache<Integer, Integer> shared = new LruTtlCache<>(50, TTL, clock);
    ExecutorService executor = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < 8; t++) {
        int offset = t * 1_000;
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < 1_000; i++) {
                    shared.put(offset + i, i);
                    shared.get(offset + i / 2);
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    CacheStats stats = shared.stats();
    assertThat(stats.size()).isLessThanOrEqualTo(50);
    assertThat(stats.hits() + stats.misses()).isEqualTo(8_000);
    assertThat(stats.evictions()).isEqualTo(8_000 - 50);
  }
}
