package fun.fengwk.afe.core.service.failure;

import fun.fengwk.afe.core.service.failure.model.FailureCategory;
import fun.fengwk.afe.core.service.failure.model.RetryPolicy;
import fun.fengwk.afe.core.service.failure.model.RetryStrategy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class RetryPoliciesTest {

    @Test
    public void shouldGrowExponentiallyUpToCap() {
        assertThat(RetryPolicies.calculateRetryWait(FailureCategory.RATE_LIMITED, 1)).isEqualTo(1000L);
        assertThat(RetryPolicies.calculateRetryWait(FailureCategory.RATE_LIMITED, 2)).isEqualTo(2000L);
        assertThat(RetryPolicies.calculateRetryWait(FailureCategory.RATE_LIMITED, 3)).isEqualTo(4000L);
        assertThat(RetryPolicies.calculateRetryWait(FailureCategory.RATE_LIMITED, 4)).isEqualTo(RetryPolicies.NO_RETRY);
    }

    @Test
    public void shouldBeNonDecreasingUntilNoRetry() {
        for (FailureCategory category : FailureCategory.values()) {
            RetryPolicy policy = RetryPolicies.getRetryPolicy(category);
            if (policy == null) {
                assertThat(RetryPolicies.calculateRetryWait(category, 1)).isEqualTo(RetryPolicies.NO_RETRY);
                continue;
            }
            long previous = 0;
            for (int attempt = 1; attempt <= policy.maxRetries(); attempt++) {
                long wait = RetryPolicies.calculateRetryWait(category, attempt);
                assertThat(wait).isGreaterThanOrEqualTo(previous).isLessThanOrEqualTo(policy.maxDelayMs());
                previous = wait;
            }
            assertThat(RetryPolicies.calculateRetryWait(category, policy.maxRetries() + 1))
                .isEqualTo(RetryPolicies.NO_RETRY);
        }
    }

    @Test
    public void shouldNeverRetryNoneStrategyCategories() {
        assertThat(RetryPolicies.getRetryStrategy(FailureCategory.AUTH_REQUIRED)).isEqualTo(RetryStrategy.NONE);
        assertThat(RetryPolicies.shouldRetry(FailureCategory.AUTH_REQUIRED, 1)).isFalse();
        assertThat(RetryPolicies.calculateRetryWait(FailureCategory.WRONG_ENDPOINT, 1)).isEqualTo(RetryPolicies.NO_RETRY);
    }

    @Test
    public void shouldRetryWithinLimit() {
        assertThat(RetryPolicies.shouldRetry(FailureCategory.SERVER_ERROR, 3)).isTrue();
        assertThat(RetryPolicies.shouldRetry(FailureCategory.SERVER_ERROR, 4)).isFalse();
        assertThat(RetryPolicies.shouldRetry(FailureCategory.PARSE_ERROR, 1)).isFalse();
    }

    @Test
    public void shouldFlagAntiPatternCandidates() {
        assertThat(RetryPolicies.isAntiPatternCandidate(FailureCategory.AUTH_REQUIRED)).isTrue();
        assertThat(RetryPolicies.isAntiPatternCandidate(FailureCategory.WRONG_ENDPOINT)).isTrue();
        assertThat(RetryPolicies.isAntiPatternCandidate(FailureCategory.PARSE_ERROR)).isTrue();
        assertThat(RetryPolicies.isAntiPatternCandidate(FailureCategory.VALIDATION_FAILED)).isTrue();
        assertThat(RetryPolicies.isAntiPatternCandidate(FailureCategory.RATE_LIMITED)).isFalse();
        assertThat(RetryPolicies.isAntiPatternCandidate(FailureCategory.TIMEOUT)).isFalse();
    }

}
