package fun.fengwk.afe.core.service.cache.model;

import org.springframework.util.StringUtils;

/**
 * Caller's freshness preference for cached content.
 *
 * @author fengwk
 */
public enum FreshnessHint {

    /**
     * Content must be as fresh as possible, use the minimum TTL.
     */
    REALTIME("realtime"),

    /**
     * Caller prefers cached content, double the base TTL.
     */
    CACHED("cached"),

    ANY("any");

    private final String value;

    FreshnessHint(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static FreshnessHint fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return ANY;
        }
        for (FreshnessHint hint : values()) {
            if (hint.value.equalsIgnoreCase(value.trim())) {
                return hint;
            }
        }
        throw new IllegalArgumentException("unsupported freshnessHint: " + value);
    }

}
