package fun.fengwk.afe.core.service.failure;

import fun.fengwk.afe.core.ConcurrentRunner;
import fun.fengwk.afe.core.MutableClock;
import fun.fengwk.afe.core.service.failure.model.FailureCategory;
import fun.fengwk.afe.core.service.failure.model.FailureRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class FailureHistoryStoreTest {

    private MutableClock clock;
    private FailureHistoryStore store;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        store = new FailureHistoryStore(new FailureProperties(), clock);
    }

    @Test
    public void shouldKeepOnlyTenRecentFailuresButCountAll() {
        for (int i = 0; i < 12; i++) {
            store.recordFailure(record(FailureCategory.TIMEOUT, "failure " + i));
        }

        assertThat(store.getFailures("p")).hasSize(10);
        assertThat(store.getFailures("p").get(0).getMessage()).isEqualTo("failure 2");
        assertThat(store.getFailureCount("p")).isEqualTo(12);
        assertThat(store.getFailureCounts("p").get(FailureCategory.TIMEOUT)).isEqualTo(12L);
    }

    @Test
    public void shouldFilterRecentFailuresByWindow() {
        store.recordFailure(record(FailureCategory.PARSE_ERROR, "old"));
        clock.advance(Duration.ofHours(2));
        store.recordFailure(record(FailureCategory.PARSE_ERROR, "new"));

        assertThat(store.getRecentFailures("p")).extracting(FailureRecord::getMessage).containsExactly("new");
        assertThat(store.countRecentFailures("p", FailureCategory.PARSE_ERROR)).isEqualTo(1);
        assertThat(store.getLatestFailure("p").getMessage()).isEqualTo("new");
    }

    @Test
    public void shouldSummarizeCounts() {
        assertThat(store.summarize("p")).isEqualTo("No failures");

        store.recordFailure(record(FailureCategory.AUTH_REQUIRED, "a"));
        store.recordFailure(record(FailureCategory.AUTH_REQUIRED, "b"));
        store.recordFailure(record(FailureCategory.TIMEOUT, "c"));

        assertThat(store.summarize("p")).isEqualTo("auth_required: 2, timeout: 1");
    }

    @Test
    public void shouldResetPattern() {
        store.recordFailure(record(FailureCategory.TIMEOUT, "a"));
        store.recordSuccess("p");

        store.reset("p");

        assertThat(store.getFailures("p")).isEmpty();
        assertThat(store.getSuccessCount("p")).isZero();
        assertThat(store.getFailureCount("p")).isZero();
    }

    @Test
    public void shouldEvictLeastRecentlyUpdatedPatternBeyondBound() {
        FailureProperties failureProperties = new FailureProperties();
        failureProperties.setMaxTrackedPatterns(2);
        FailureHistoryStore bounded = new FailureHistoryStore(failureProperties, clock);

        bounded.recordSuccess("a");
        clock.advanceMillis(1);
        bounded.recordSuccess("b");
        clock.advanceMillis(1);
        bounded.recordSuccess("a");
        clock.advanceMillis(1);
        bounded.recordSuccess("c");

        assertThat(bounded.size()).isEqualTo(2);
        assertThat(bounded.getSuccessCount("a")).isEqualTo(2);
        assertThat(bounded.getSuccessCount("b")).isZero();
        assertThat(bounded.getSuccessCount("c")).isEqualTo(1);
    }

    @Test
    public void shouldStayWithinBoundUnderConcurrentNewPatterns() throws Exception {
        FailureProperties failureProperties = new FailureProperties();
        failureProperties.setMaxTrackedPatterns(50);
        FailureHistoryStore bounded = new FailureHistoryStore(failureProperties, clock);

        ConcurrentRunner.run(8, threadIndex -> {
            for (int i = 0; i < 200; i++) {
                bounded.recordSuccess("pattern-" + threadIndex + "-" + i);
            }
        });

        assertThat(bounded.size()).isLessThanOrEqualTo(50);
    }

    private FailureRecord record(FailureCategory category, String message) {
        return FailureRecord.builder()
            .timestamp(clock.millis())
            .category(category)
            .message(message)
            .domain("example.com")
            .patternId("p")
            .build();
    }

}
