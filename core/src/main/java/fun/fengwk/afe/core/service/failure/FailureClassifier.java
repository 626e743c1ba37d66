package fun.fengwk.afe.core.service.failure;

import fun.fengwk.afe.core.service.failure.model.FailureCategory;
import fun.fengwk.afe.core.service.failure.model.FailureClassification;
import fun.fengwk.afe.core.service.failure.model.RetryPolicy;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Maps an http status and/or error message to a failure category. Never throws.
 *
 * @author fengwk
 */
@Component
public class FailureClassifier {

    private static final List<String> AUTH_KEYWORDS = List.of(
        "unauthorized", "authentication", "auth", "login", "credential",
        "forbidden", "access denied", "permission", "not allowed"
    );

    private static final List<String> RATE_LIMIT_KEYWORDS = List.of(
        "rate limit", "too many requests", "throttle", "quota exceeded",
        "slow down", "try again later"
    );

    private static final List<String> SERVER_ERROR_KEYWORDS = List.of(
        "internal server", "service unavailable", "bad gateway",
        "gateway timeout", "temporarily unavailable"
    );

    private static final List<String> TIMEOUT_KEYWORDS = List.of(
        "timeout", "timed out", "deadline exceeded", "connection timeout",
        "request timeout", "aborted"
    );

    private static final List<String> NETWORK_KEYWORDS = List.of(
        "network", "connection refused", "connection reset", "dns",
        "econnrefused", "econnreset", "enotfound", "enetunreach"
    );

    private static final List<String> PARSE_KEYWORDS = List.of(
        "parse", "json", "xml", "syntax", "unexpected token",
        "invalid", "malformed"
    );

    public FailureClassification classify(Integer statusCode, String message) {
        return classify(statusCode, message, null);
    }

    /**
     * Classify a failure. Status codes take precedence over message keywords.
     *
     * @param statusCode http status, may be null
     * @param message error message, may be null
     * @param responseTimeMs observed response time, may be null
     */
    public FailureClassification classify(Integer statusCode, String message, Long responseTimeMs) {
        String originalMessage = message == null ? "" : message;
        String text = originalMessage.toLowerCase(Locale.ROOT);

        if (statusCode != null) {
            int status = statusCode;
            if (status == 401 || status == 403) {
                return create(FailureCategory.AUTH_REQUIRED, 1.0, originalMessage);
            }
            if (status == 429) {
                return create(FailureCategory.RATE_LIMITED, 1.0, originalMessage);
            }
            if (status == 404) {
                return create(FailureCategory.WRONG_ENDPOINT, 1.0, originalMessage);
            }
            if (status >= 500 && status < 600) {
                return create(FailureCategory.SERVER_ERROR, 0.9, originalMessage);
            }
            if (status >= 400 && status < 500) {
                if (containsAny(text, AUTH_KEYWORDS)) {
                    return create(FailureCategory.AUTH_REQUIRED, 0.8, originalMessage);
                }
                if (containsAny(text, RATE_LIMIT_KEYWORDS)) {
                    return create(FailureCategory.RATE_LIMITED, 0.8, originalMessage);
                }
                return create(FailureCategory.WRONG_ENDPOINT, 0.6, originalMessage);
            }
        }

        if (containsAny(text, TIMEOUT_KEYWORDS)) {
            return create(FailureCategory.TIMEOUT, 0.9, originalMessage);
        }
        if (containsAny(text, NETWORK_KEYWORDS)) {
            return create(FailureCategory.NETWORK_ERROR, 0.9, originalMessage);
        }
        if (containsAny(text, RATE_LIMIT_KEYWORDS)) {
            return create(FailureCategory.RATE_LIMITED, 0.8, originalMessage);
        }
        if (containsAny(text, AUTH_KEYWORDS)) {
            return create(FailureCategory.AUTH_REQUIRED, 0.8, originalMessage);
        }
        if (containsAny(text, SERVER_ERROR_KEYWORDS)) {
            return create(FailureCategory.SERVER_ERROR, 0.8, originalMessage);
        }
        if (containsAny(text, PARSE_KEYWORDS)) {
            return create(FailureCategory.PARSE_ERROR, 0.8, originalMessage);
        }

        if (text.contains("missing") && text.contains("field")) {
            return create(FailureCategory.VALIDATION_FAILED, 0.9, originalMessage);
        }
        if (text.contains("too short")) {
            return create(FailureCategory.CONTENT_TOO_SHORT, 0.9, originalMessage);
        }
        if (text.contains("required field")) {
            return create(FailureCategory.VALIDATION_FAILED, 0.9, originalMessage);
        }

        return create(FailureCategory.UNKNOWN, 0.3, originalMessage);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static FailureClassification create(FailureCategory category, double confidence, String message) {
        RetryPolicy policy = RetryPolicies.getRetryPolicy(category);
        return FailureClassification.builder()
            .category(category)
            .confidence(confidence)
            .recommendedStrategy(RetryPolicies.getRetryStrategy(category))
            .suggestedWaitMs(policy == null ? null : policy.initialDelayMs())
            .shouldCreateAntiPattern(RetryPolicies.isAntiPatternCandidate(category))
            .message(message)
            .build();
    }

}
