package fun.fengwk.afe.core.service.failure;

import fun.fengwk.afe.core.service.failure.model.AntiPattern;
import fun.fengwk.afe.core.service.failure.model.FailureCategory;
import fun.fengwk.afe.core.service.failure.model.FailureClassification;
import fun.fengwk.afe.core.service.failure.model.FailureRecord;
import fun.fengwk.afe.core.service.failure.model.PatternHealth;
import fun.fengwk.afe.core.service.failure.model.RetryAdvice;
import fun.fengwk.afe.core.service.failure.model.RetryStrategy;
import fun.fengwk.afe.core.utils.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Learns from pattern failures: classifies them, keeps history and turns repeated
 * same-category failures into anti-patterns.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class FailureLearningService {

    private final FailureClassifier failureClassifier;
    private final FailureHistoryStore failureHistoryStore;
    private final AntiPatternRegistry antiPatternRegistry;
    private final FailureProperties failureProperties;
    private final Clock clock;

    public FailureLearningService(FailureClassifier failureClassifier,
                                  FailureHistoryStore failureHistoryStore,
                                  AntiPatternRegistry antiPatternRegistry,
                                  FailureProperties failureProperties,
                                  Clock clock) {
        this.failureClassifier = failureClassifier;
        this.failureHistoryStore = failureHistoryStore;
        this.antiPatternRegistry = antiPatternRegistry;
        this.failureProperties = failureProperties;
        this.clock = clock;
    }

    /**
     * Classify and record a failure of the pattern, creating or extending an anti-pattern when
     * the category warrants one and enough recent failures accumulated.
     */
    public FailureClassification recordFailure(String patternId, String url, Integer statusCode,
                                               String message, Long responseTimeMs) {
        FailureClassification classification = failureClassifier.classify(statusCode, message, responseTimeMs);
        String hostname = UrlUtils.extractHostnameLenient(url);

        FailureRecord record = FailureRecord.builder()
            .timestamp(clock.millis())
            .category(classification.getCategory())
            .statusCode(statusCode)
            .message(classification.getMessage())
            .domain(hostname == null ? "unknown" : hostname)
            .attemptedUrl(url)
            .patternId(patternId)
            .responseTimeMs(responseTimeMs)
            .build();
        failureHistoryStore.recordFailure(record);

        log.debug("failure recorded, patternId={}, url={}, category={}, confidence={}",
            patternId, url, classification.getCategory().getValue(), classification.getConfidence());

        if (classification.isShouldCreateAntiPattern()) {
            maybeCreateAntiPattern(patternId, record);
        }
        return classification;
    }

    public void recordSuccess(String patternId) {
        failureHistoryStore.recordSuccess(patternId);
    }

    /**
     * Purge expired anti-patterns, then return the active ones matching the url.
     */
    public List<AntiPattern> checkAntiPatterns(String url) {
        antiPatternRegistry.purgeExpired();
        return antiPatternRegistry.matchAntiPatterns(url);
    }

    public boolean clearAntiPattern(String antiPatternId) {
        boolean removed = antiPatternRegistry.remove(antiPatternId);
        if (removed) {
            log.info("anti-pattern cleared, id={}", antiPatternId);
        }
        return removed;
    }

    /**
     * Retry decision based on the latest failure recorded for the pattern.
     */
    public RetryAdvice getRetryAdvice(String patternId, int attempt) {
        FailureRecord latest = failureHistoryStore.getLatestFailure(patternId);
        if (latest == null) {
            return RetryAdvice.NO_RETRY;
        }
        FailureCategory category = latest.getCategory();
        long waitMs = RetryPolicies.calculateRetryWait(category, attempt);
        return new RetryAdvice(
            RetryPolicies.shouldRetry(category, attempt),
            Math.max(0, waitMs),
            RetryPolicies.getRetryStrategy(category)
        );
    }

    public PatternHealth assessHealth(String patternId) {
        return analyzeHealth(
            failureHistoryStore.getRecentFailures(patternId),
            failureHistoryStore.getSuccessCount(patternId),
            failureHistoryStore.getFailureCount(patternId)
        );
    }

    public String getFailureSummary(String patternId) {
        return failureHistoryStore.summarize(patternId);
    }

    /**
     * Healthy when success rate is above 0.8 with fewer than 3 recent failures; unhealthy when the
     * success rate is below 0.3 or recent failures reach the anti-pattern minimum.
     */
    public PatternHealth analyzeHealth(List<FailureRecord> recentFailures, long successCount, long failureCount) {
        long total = successCount + failureCount;
        double successRate = total > 0 ? (double) successCount / total : 0;
        int recentCount = recentFailures.size();

        if (successRate > 0.8 && recentCount < 3) {
            return PatternHealth.builder()
                .healthy(true)
                .successRate(successRate)
                .recentFailures(recentCount)
                .suggestedAction(RetryStrategy.NONE)
                .reason(String.format(Locale.ROOT, "Pattern is healthy (%.0f%% success rate)", successRate * 100))
                .build();
        }

        Map<FailureCategory, Integer> counts = new EnumMap<>(FailureCategory.class);
        FailureCategory dominant = null;
        int maxCount = 0;
        for (FailureRecord failure : recentFailures) {
            int count = counts.merge(failure.getCategory(), 1, Integer::sum);
            if (count > maxCount) {
                maxCount = count;
                dominant = failure.getCategory();
            }
        }

        boolean unhealthy = successRate < 0.3 || recentCount >= failureProperties.getMinFailures();
        if (unhealthy && dominant != null) {
            return PatternHealth.builder()
                .healthy(false)
                .successRate(successRate)
                .recentFailures(recentCount)
                .dominantCategory(dominant)
                .suggestedAction(RetryPolicies.getRetryStrategy(dominant))
                .reason("Pattern unhealthy: " + recentCount + " recent failures, mostly " + dominant.getValue())
                .build();
        }

        return PatternHealth.builder()
            .healthy(true)
            .successRate(successRate)
            .recentFailures(recentCount)
            .dominantCategory(dominant)
            .suggestedAction(RetryStrategy.NONE)
            .reason("Pattern is recovering")
            .build();
    }

    private void maybeCreateAntiPattern(String patternId, FailureRecord latest) {
        FailureCategory category = latest.getCategory();
        List<FailureRecord> sameCategory = failureHistoryStore.getRecentFailures(patternId, category);
        if (sameCategory.size() < failureProperties.getMinFailures()) {
            return;
        }

        antiPatternRegistry.recordOrCreate(patternId, category, sameCategory, latest);
    }

}
