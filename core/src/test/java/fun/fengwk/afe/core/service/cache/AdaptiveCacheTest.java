package fun.fengwk.afe.core.service.cache;

import fun.fengwk.afe.core.ConcurrentRunner;
import fun.fengwk.afe.core.MutableClock;
import fun.fengwk.afe.core.service.cache.model.AdaptiveCacheStats;
import fun.fengwk.afe.core.service.cache.model.AdaptiveTtlResult;
import fun.fengwk.afe.core.service.cache.model.CacheSetOptions;
import fun.fengwk.afe.core.service.cache.model.CachedValue;
import fun.fengwk.afe.core.service.cache.model.DomainCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class AdaptiveCacheTest {

    private MutableClock clock;
    private AdaptiveTtlCalculator calculator;
    private AdaptiveCache<String> cache;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        CacheProperties cacheProperties = new CacheProperties();
        calculator = new AdaptiveTtlCalculator(
            cacheProperties, new DomainClassifier(), new VolatilityTracker(cacheProperties, clock));
        cache = new AdaptiveCache<>(calculator, clock, 3);
    }

    @Test
    public void shouldReturnValueImmediatelyAfterSet() {
        cache.set("https://example.com/a", "v1");

        assertThat(cache.get("https://example.com/a")).isEqualTo("v1");
        assertThat(cache.has("https://example.com/a")).isTrue();
    }

    @Test
    public void shouldMissAfterComputedExpiry() {
        AdaptiveTtlResult ttlResult = cache.set("https://example.com/a", "v1");

        clock.advanceMillis(ttlResult.getTtlMs());
        assertThat(cache.get("https://example.com/a")).isEqualTo("v1");

        clock.advanceMillis(1);
        assertThat(cache.get("https://example.com/a")).isNull();
        assertThat(cache.size()).isZero();
    }

    @Test
    public void shouldFoldParamsIntoKeyInSortedOrder() {
        CacheSetOptions options = CacheSetOptions.builder().params(Map.of("b", "2", "a", "1")).build();
        cache.set("https://example.com/search", "result", options);

        assertThat(cache.get("https://example.com/search", Map.of("a", "1", "b", "2"))).isEqualTo("result");
        assertThat(cache.get("https://example.com/search")).isNull();
    }

    @Test
    public void shouldStayWithinCapacityUnderConcurrentWrites() throws Exception {
        AdaptiveCache<String> bounded = new AdaptiveCache<>(calculator, clock, 50);

        ConcurrentRunner.run(8, threadIndex -> {
            for (int i = 0; i < 300; i++) {
                bounded.set("https://example.com/" + threadIndex + "/" + i, "v");
                assertThat(bounded.size()).isLessThanOrEqualTo(50);
            }
        });

        assertThat(bounded.size()).isLessThanOrEqualTo(50);
    }

    @Test
    public void shouldEvictOldestEntryAtCapacity() {
        cache.set("https://example.com/1", "1");
        clock.advanceMillis(1);
        cache.set("https://example.com/2", "2");
        clock.advanceMillis(1);
        cache.set("https://example.com/3", "3");
        clock.advanceMillis(1);
        cache.set("https://example.com/4", "4");

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.get("https://example.com/1")).isNull();
        assertThat(cache.get("https://example.com/4")).isEqualTo("4");
    }

    @Test
    public void shouldNotEvictWhenOverwritingExistingKey() {
        cache.set("https://example.com/1", "1");
        cache.set("https://example.com/2", "2");
        cache.set("https://example.com/3", "3");
        cache.set("https://example.com/3", "3b");

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.get("https://example.com/1")).isEqualTo("1");
        assertThat(cache.get("https://example.com/3")).isEqualTo("3b");
    }

    @Test
    public void shouldClearDomainAndSubdomainsOnly() {
        AdaptiveCache<String> large = new AdaptiveCache<>(calculator, clock, 10);
        large.set("https://example.com/a", "a");
        large.set("https://api.example.com/b", "b");
        large.set("https://notexample.com/c", "c");
        large.set("opaque-key", "d");

        int removed = large.clearDomain("example.com");

        assertThat(removed).isEqualTo(2);
        assertThat(large.get("https://notexample.com/c")).isEqualTo("c");
        assertThat(large.get("opaque-key")).isEqualTo("d");
    }

    @Test
    public void shouldTrackStats() {
        cache.set("https://www.irs.gov/a", "gov");
        clock.advanceMillis(5);
        cache.set("https://example.com/b", "b");
        cache.get("https://www.irs.gov/a");
        cache.get("https://example.com/missing");

        AdaptiveCacheStats stats = cache.getStats();

        assertThat(stats.getSize()).isEqualTo(2);
        assertThat(stats.getMaxEntries()).isEqualTo(3);
        assertThat(stats.getHits()).isEqualTo(1);
        assertThat(stats.getMisses()).isEqualTo(1);
        assertThat(stats.getHitRate()).isEqualTo(0.5);
        assertThat(stats.getEntriesByCategory().get(DomainCategory.STATIC_GOV)).isEqualTo(1);
        assertThat(stats.getEntriesByCategory().get(DomainCategory.DEFAULT)).isEqualTo(1);
        assertThat(stats.getOldestEntry()).isEqualTo(1_700_000_000_000L);
        assertThat(stats.getNewestEntry()).isEqualTo(1_700_000_000_005L);
    }

    @Test
    public void shouldResetCountersOnClear() {
        cache.set("https://example.com/a", "a");
        cache.get("https://example.com/a");
        cache.clear();

        AdaptiveCacheStats stats = cache.getStats();
        assertThat(stats.getSize()).isZero();
        assertThat(stats.getHits()).isZero();
        assertThat(stats.getOldestEntry()).isNull();
    }

    @Test
    public void shouldCleanupExpiredEntries() {
        cache.set("https://example.com/a", "a", CacheSetOptions.builder().baseTtlMs(30_000L).build());
        cache.set("https://www.irs.gov/b", "b");
        clock.advanceMillis(60_000);

        assertThat(cache.cleanup()).isEqualTo(1);
        assertThat(cache.getDomains()).containsExactly("www.irs.gov");
    }

    @Test
    public void shouldLoadOnlyOnMissWithCache() throws Exception {
        AtomicInteger loads = new AtomicInteger();

        CachedValue<String> first = cache.withCache("https://example.com/a", () -> "loaded-" + loads.incrementAndGet(), null);
        CachedValue<String> second = cache.withCache("https://example.com/a", () -> "loaded-" + loads.incrementAndGet(), null);

        assertThat(first.fromCache()).isFalse();
        assertThat(second.fromCache()).isTrue();
        assertThat(second.value()).isEqualTo("loaded-1");
        assertThat(second.ttlResult()).isEqualTo(cache.getTtlResult("https://example.com/a"));
        assertThat(loads).hasValue(1);
    }

    @Test
    public void shouldPropagateLoaderFailure() {
        assertThatThrownBy(() -> cache.withCache("https://example.com/a", () -> {
            throw new IllegalStateException("boom");
        }, null)).isInstanceOf(IllegalStateException.class).hasMessage("boom");
        assertThat(cache.has("https://example.com/a")).isFalse();
    }

    @Test
    public void shouldDeleteEntry() {
        cache.set("https://example.com/a", "a");

        assertThat(cache.delete("https://example.com/a")).isTrue();
        assertThat(cache.delete("https://example.com/a")).isFalse();
    }

}
