package fun.fengwk.afe.core.service.failure;

import fun.fengwk.afe.core.service.failure.model.FailureCategory;
import fun.fengwk.afe.core.service.failure.model.FailureClassification;
import fun.fengwk.afe.core.service.failure.model.RetryStrategy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class FailureClassifierTest {

    private final FailureClassifier failureClassifier = new FailureClassifier();

    @Test
    public void shouldClassifyTooManyRequestsStatus() {
        FailureClassification classification = failureClassifier.classify(429, "Too many requests");

        assertThat(classification.getCategory()).isEqualTo(FailureCategory.RATE_LIMITED);
        assertThat(classification.getConfidence()).isEqualTo(1.0);
        assertThat(classification.getRecommendedStrategy()).isEqualTo(RetryStrategy.EXPONENTIAL_BACKOFF);
        assertThat(classification.getSuggestedWaitMs()).isEqualTo(1000L);
        assertThat(classification.isShouldCreateAntiPattern()).isFalse();
    }

    @Test
    public void shouldClassifyConnectionResetMessage() {
        FailureClassification classification = failureClassifier.classify(null, "ECONNRESET while connecting");

        assertThat(classification.getCategory()).isEqualTo(FailureCategory.NETWORK_ERROR);
        assertThat(classification.getConfidence()).isEqualTo(0.9);
    }

    @Test
    public void shouldClassifyStatusCodes() {
        assertThat(failureClassifier.classify(401, "").getCategory()).isEqualTo(FailureCategory.AUTH_REQUIRED);
        assertThat(failureClassifier.classify(403, "").isShouldCreateAntiPattern()).isTrue();
        assertThat(failureClassifier.classify(404, "").getCategory()).isEqualTo(FailureCategory.WRONG_ENDPOINT);
        assertThat(failureClassifier.classify(503, "whatever").getCategory()).isEqualTo(FailureCategory.SERVER_ERROR);
        assertThat(failureClassifier.classify(503, "whatever").getConfidence()).isEqualTo(0.9);
    }

    @Test
    public void shouldUseKeywordsForOtherClientErrors() {
        FailureClassification auth = failureClassifier.classify(400, "Login required");
        FailureClassification rate = failureClassifier.classify(400, "quota exceeded for key");
        FailureClassification other = failureClassifier.classify(422, "unprocessable entity");

        assertThat(auth.getCategory()).isEqualTo(FailureCategory.AUTH_REQUIRED);
        assertThat(auth.getConfidence()).isEqualTo(0.8);
        assertThat(rate.getCategory()).isEqualTo(FailureCategory.RATE_LIMITED);
        assertThat(other.getCategory()).isEqualTo(FailureCategory.WRONG_ENDPOINT);
        assertThat(other.getConfidence()).isEqualTo(0.6);
    }

    @Test
    public void shouldCheckKeywordsInFixedOrder() {
        assertThat(failureClassifier.classify(null, "network timeout").getCategory()).isEqualTo(FailureCategory.TIMEOUT);
        assertThat(failureClassifier.classify(null, "DNS lookup failed").getCategory()).isEqualTo(FailureCategory.NETWORK_ERROR);
        assertThat(failureClassifier.classify(null, "please slow down").getCategory()).isEqualTo(FailureCategory.RATE_LIMITED);
        assertThat(failureClassifier.classify(null, "Access denied").getCategory()).isEqualTo(FailureCategory.AUTH_REQUIRED);
        assertThat(failureClassifier.classify(null, "Bad Gateway").getCategory()).isEqualTo(FailureCategory.SERVER_ERROR);
        assertThat(failureClassifier.classify(null, "Unexpected token < in JSON").getCategory()).isEqualTo(FailureCategory.PARSE_ERROR);
    }

    @Test
    public void shouldApplyStructuralHeuristics() {
        assertThat(failureClassifier.classify(null, "missing title field").getCategory())
            .isEqualTo(FailureCategory.VALIDATION_FAILED);
        assertThat(failureClassifier.classify(null, "Content too short: 12 < 200").getCategory())
            .isEqualTo(FailureCategory.CONTENT_TOO_SHORT);
        assertThat(failureClassifier.classify(null, "required field price").getCategory())
            .isEqualTo(FailureCategory.VALIDATION_FAILED);
    }

    @Test
    public void shouldFallBackToUnknown() {
        FailureClassification classification = failureClassifier.classify(null, "something odd happened");

        assertThat(classification.getCategory()).isEqualTo(FailureCategory.UNKNOWN);
        assertThat(classification.getConfidence()).isEqualTo(0.3);
        assertThat(failureClassifier.classify(null, null).getCategory()).isEqualTo(FailureCategory.UNKNOWN);
    }

}
