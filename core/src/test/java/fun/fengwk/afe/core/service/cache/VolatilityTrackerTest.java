package fun.fengwk.afe.core.service.cache;

import fun.fengwk.afe.core.ConcurrentRunner;
import fun.fengwk.afe.core.MutableClock;
import fun.fengwk.afe.core.service.cache.model.DomainVolatilityStats;
import fun.fengwk.afe.core.service.cache.model.VolatilityRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * @author fengwk
 */
public class VolatilityTrackerTest {

    private MutableClock clock;
    private CacheProperties cacheProperties;
    private VolatilityTracker volatilityTracker;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        cacheProperties = new CacheProperties();
        volatilityTracker = new VolatilityTracker(cacheProperties, clock);
    }

    @Test
    public void shouldNormalizeNumericAndHexSegments() {
        assertThat(VolatilityTracker.volatilityKey("https://Example.com/users/12345/posts"))
            .isEqualTo("example.com/users/{id}/posts");
        assertThat(VolatilityTracker.volatilityKey("https://example.com/items/0123456789abcdef0123456789abcdef"))
            .isEqualTo("example.com/items/{uuid}");
        assertThat(VolatilityTracker.volatilityKey("not a url")).isEqualTo("not a url");
        assertThat(VolatilityTracker.volatilityKey(null)).isEmpty();
    }

    @Test
    public void shouldShareRecordAcrossNearDuplicateUrls() {
        volatilityTracker.recordContentCheck("https://example.com/users/1", true);
        volatilityTracker.recordContentCheck("https://example.com/users/2", false);

        assertThat(volatilityTracker.size()).isEqualTo(1);
        VolatilityRecord record = volatilityTracker.getRecord("https://example.com/users/99");
        assertThat(record.getCheckCount()).isEqualTo(2);
        assertThat(record.getChangeCount()).isEqualTo(1);
    }

    @Test
    public void shouldReturnNullFactorWithFewerThanTwoChecks() {
        volatilityTracker.recordContentCheck("https://example.com/a", true);

        assertThat(volatilityTracker.getVolatilityFactor("https://example.com/a")).isNull();
        assertThat(volatilityTracker.getVolatilityFactor("https://example.com/unknown")).isNull();
    }

    @Test
    public void shouldReturnZeroWhenNeverChanged() {
        volatilityTracker.recordContentCheck("https://example.com/a", false);
        volatilityTracker.recordContentCheck("https://example.com/a", false);

        assertThat(volatilityTracker.getVolatilityFactor("https://example.com/a")).isEqualTo(0.0);
    }

    @Test
    public void shouldComputeChangeRateAndDecayAfterQuietPeriod() {
        volatilityTracker.recordContentCheck("https://example.com/a", true);
        volatilityTracker.recordContentCheck("https://example.com/a", false);
        volatilityTracker.recordContentCheck("https://example.com/a", true);
        volatilityTracker.recordContentCheck("https://example.com/a", true);

        assertThat(volatilityTracker.getVolatilityFactor("https://example.com/a")).isCloseTo(0.75, within(1e-9));

        clock.advance(Duration.ofHours(25));
        assertThat(volatilityTracker.getVolatilityFactor("https://example.com/a")).isCloseTo(0.375, within(1e-9));
    }

    @Test
    public void shouldSmoothChangeIntervalWithEma() {
        volatilityTracker.recordContentCheck("https://example.com/a", true);
        clock.advanceMillis(1000);
        volatilityTracker.recordContentCheck("https://example.com/a", true);
        assertThat(volatilityTracker.getRecord("https://example.com/a").getAvgChangeIntervalMs()).isEqualTo(1000.0);

        clock.advanceMillis(2000);
        volatilityTracker.recordContentCheck("https://example.com/a", true);
        assertThat(volatilityTracker.getRecord("https://example.com/a").getAvgChangeIntervalMs())
            .isCloseTo(1000 * 0.7 + 2000 * 0.3, within(1e-9));
    }

    @Test
    public void shouldEvictLeastRecentlyCheckedRecordAtCapacity() {
        cacheProperties.setVolatilityMaxRecords(2);
        volatilityTracker.recordContentCheck("https://example.com/a", false);
        clock.advanceMillis(10);
        volatilityTracker.recordContentCheck("https://example.com/b", false);
        clock.advanceMillis(10);
        volatilityTracker.recordContentCheck("https://example.com/a", false);
        clock.advanceMillis(10);
        volatilityTracker.recordContentCheck("https://example.com/c", false);

        assertThat(volatilityTracker.size()).isEqualTo(2);
        assertThat(volatilityTracker.getRecord("https://example.com/b")).isNull();
        assertThat(volatilityTracker.getRecord("https://example.com/a")).isNotNull();
        assertThat(volatilityTracker.getRecord("https://example.com/c")).isNotNull();
    }

    @Test
    public void shouldStayWithinBoundUnderConcurrentNewKeys() throws Exception {
        cacheProperties.setVolatilityMaxRecords(100);

        ConcurrentRunner.run(16, threadIndex -> {
            for (int i = 0; i < 500; i++) {
                volatilityTracker.recordContentCheck("https://host-" + threadIndex + "-" + i + ".example.com/page", false);
                assertThat(volatilityTracker.size()).isLessThanOrEqualTo(100);
            }
        });

        assertThat(volatilityTracker.size()).isLessThanOrEqualTo(100);
    }

    @Test
    public void shouldCountEveryConcurrentCheckOfSameKey() throws Exception {
        ConcurrentRunner.run(8, threadIndex -> {
            for (int i = 0; i < 100; i++) {
                volatilityTracker.recordContentCheck("https://example.com/live", i % 2 == 0);
            }
        });

        VolatilityRecord record = volatilityTracker.getRecord("https://example.com/live");
        assertThat(record.getCheckCount()).isEqualTo(800);
        assertThat(record.getChangeCount()).isEqualTo(400);
    }

    @Test
    public void shouldReportDomainStats() {
        volatilityTracker.recordContentCheck("https://example.com/a", true);
        volatilityTracker.recordContentCheck("https://example.com/a", true);
        volatilityTracker.recordContentCheck("https://example.com/b", false);
        volatilityTracker.recordContentCheck("https://example.com/b", false);
        volatilityTracker.recordContentCheck("https://other.com/c", true);
        volatilityTracker.recordContentCheck("https://other.com/c", true);

        DomainVolatilityStats stats = volatilityTracker.getDomainVolatilityStats("example.com");

        assertThat(stats.getUrlCount()).isEqualTo(2);
        assertThat(stats.getAvgChangeRate()).isCloseTo(0.5, within(1e-9));
        assertThat(stats.getMostVolatilePaths().get(0).path()).isEqualTo("/a");
    }

    @Test
    public void shouldRoundTripRecordsThroughExportAndImport() {
        volatilityTracker.recordContentCheck("https://example.com/a", true);
        List<VolatilityRecord> exported = volatilityTracker.exportRecords();

        VolatilityTracker restored = new VolatilityTracker(cacheProperties, clock);
        restored.importRecords(exported);

        assertThat(restored.getRecord("https://example.com/a").getChangeCount()).isEqualTo(1);
    }

}
