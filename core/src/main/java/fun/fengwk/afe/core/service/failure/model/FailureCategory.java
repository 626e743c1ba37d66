package fun.fengwk.afe.core.service.failure.model;

import org.springframework.util.StringUtils;

/**
 * Failure categories produced by the failure classifier.
 *
 * @author fengwk
 */
public enum FailureCategory {

    AUTH_REQUIRED("auth_required"),
    RATE_LIMITED("rate_limited"),
    WRONG_ENDPOINT("wrong_endpoint"),
    SERVER_ERROR("server_error"),
    TIMEOUT("timeout"),
    NETWORK_ERROR("network_error"),
    PARSE_ERROR("parse_error"),
    VALIDATION_FAILED("validation_failed"),
    CONTENT_TOO_SHORT("content_too_short"),
    UNKNOWN("unknown");

    private final String value;

    FailureCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static FailureCategory fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return UNKNOWN;
        }
        for (FailureCategory category : values()) {
            if (category.value.equalsIgnoreCase(value.trim()) || category.name().equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        throw new IllegalArgumentException("unsupported failure category: " + value);
    }

}
