package fun.fengwk.afe.core.service.failure;

import fun.fengwk.afe.core.service.failure.model.FailureCategory;
import fun.fengwk.afe.core.service.failure.model.RetryPolicy;
import fun.fengwk.afe.core.service.failure.model.RetryStrategy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Static retry policy table keyed by failure category.
 *
 * @author fengwk
 */
public final class RetryPolicies {

    /**
     * Returned by {@link #calculateRetryWait} when no further retry should happen.
     */
    public static final long NO_RETRY = -1L;

    private static final Map<FailureCategory, RetryStrategy> STRATEGIES;
    private static final Map<FailureCategory, RetryPolicy> POLICIES;
    private static final Set<FailureCategory> ANTI_PATTERN_CANDIDATES = Collections.unmodifiableSet(EnumSet.of(
        FailureCategory.AUTH_REQUIRED,
        FailureCategory.WRONG_ENDPOINT,
        FailureCategory.PARSE_ERROR,
        FailureCategory.VALIDATION_FAILED
    ));

    static {
        Map<FailureCategory, RetryStrategy> strategies = new EnumMap<>(FailureCategory.class);
        strategies.put(FailureCategory.AUTH_REQUIRED, RetryStrategy.NONE);
        strategies.put(FailureCategory.WRONG_ENDPOINT, RetryStrategy.NONE);
        strategies.put(FailureCategory.RATE_LIMITED, RetryStrategy.EXPONENTIAL_BACKOFF);
        strategies.put(FailureCategory.SERVER_ERROR, RetryStrategy.EXPONENTIAL_BACKOFF);
        strategies.put(FailureCategory.TIMEOUT, RetryStrategy.LINEAR_BACKOFF);
        strategies.put(FailureCategory.NETWORK_ERROR, RetryStrategy.LINEAR_BACKOFF);
        strategies.put(FailureCategory.CONTENT_TOO_SHORT, RetryStrategy.IMMEDIATE);
        strategies.put(FailureCategory.PARSE_ERROR, RetryStrategy.SUPPRESSION);
        strategies.put(FailureCategory.VALIDATION_FAILED, RetryStrategy.SUPPRESSION);
        strategies.put(FailureCategory.UNKNOWN, RetryStrategy.LINEAR_BACKOFF);
        STRATEGIES = Collections.unmodifiableMap(strategies);

        Map<FailureCategory, RetryPolicy> policies = new EnumMap<>(FailureCategory.class);
        policies.put(FailureCategory.RATE_LIMITED,
            new RetryPolicy(RetryStrategy.EXPONENTIAL_BACKOFF, 3, 1000L, 30000L, 2.0));
        policies.put(FailureCategory.SERVER_ERROR,
            new RetryPolicy(RetryStrategy.EXPONENTIAL_BACKOFF, 3, 500L, 10000L, 2.0));
        policies.put(FailureCategory.TIMEOUT,
            new RetryPolicy(RetryStrategy.LINEAR_BACKOFF, 2, 2000L, 10000L, 1.5));
        policies.put(FailureCategory.NETWORK_ERROR,
            new RetryPolicy(RetryStrategy.LINEAR_BACKOFF, 3, 1000L, 15000L, 2.0));
        policies.put(FailureCategory.CONTENT_TOO_SHORT,
            new RetryPolicy(RetryStrategy.IMMEDIATE, 1, 0L, 0L, 1.0));
        policies.put(FailureCategory.UNKNOWN,
            new RetryPolicy(RetryStrategy.LINEAR_BACKOFF, 1, 1000L, 5000L, 1.5));
        POLICIES = Collections.unmodifiableMap(policies);
    }

    private RetryPolicies() {
    }

    public static RetryStrategy getRetryStrategy(FailureCategory category) {
        return STRATEGIES.getOrDefault(normalize(category), RetryStrategy.NONE);
    }

    /**
     * Retry schedule of the category, null for categories that never retry.
     */
    public static RetryPolicy getRetryPolicy(FailureCategory category) {
        return POLICIES.get(normalize(category));
    }

    public static boolean isAntiPatternCandidate(FailureCategory category) {
        return ANTI_PATTERN_CANDIDATES.contains(normalize(category));
    }

    /**
     * Wait before the given retry attempt, {@code initialDelay * multiplier^(attempt-1)} capped at
     * the category max delay.
     *
     * @param attempt 1-based retry attempt
     * @return wait in milliseconds, or {@link #NO_RETRY}
     */
    public static long calculateRetryWait(FailureCategory category, int attempt) {
        RetryPolicy policy = getRetryPolicy(category);
        if (policy == null || policy.strategy() == RetryStrategy.NONE || attempt > policy.maxRetries()) {
            return NO_RETRY;
        }
        int normalizedAttempt = Math.max(1, attempt);
        double delay = policy.initialDelayMs() * Math.pow(policy.backoffMultiplier(), normalizedAttempt - 1);
        return Math.round(Math.min(delay, policy.maxDelayMs()));
    }

    public static boolean shouldRetry(FailureCategory category, int attempt) {
        if (getRetryStrategy(category) == RetryStrategy.NONE) {
            return false;
        }
        RetryPolicy policy = getRetryPolicy(category);
        return policy != null && attempt <= policy.maxRetries();
    }

    private static FailureCategory normalize(FailureCategory category) {
        return category == null ? FailureCategory.UNKNOWN : category;
    }

}
