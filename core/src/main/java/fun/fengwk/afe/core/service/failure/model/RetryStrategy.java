package fun.fengwk.afe.core.service.failure.model;

import org.springframework.util.StringUtils;

/**
 * Recommended reaction to a classified failure.
 *
 * @author fengwk
 */
public enum RetryStrategy {

    /**
     * Do not retry.
     */
    NONE("none"),

    IMMEDIATE("immediate"),

    LINEAR_BACKOFF("linear-backoff"),

    EXPONENTIAL_BACKOFF("exponential-backoff"),

    /**
     * Stop trying the pattern until its suppression expires.
     */
    SUPPRESSION("suppression");

    private final String value;

    RetryStrategy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static RetryStrategy fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return NONE;
        }
        for (RetryStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(value.trim())) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("unsupported retry strategy: " + value);
    }

}
