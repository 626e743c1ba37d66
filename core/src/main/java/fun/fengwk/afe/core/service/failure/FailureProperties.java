package fun.fengwk.afe.core.service.failure;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Failure learning configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "afe.failure")
public class FailureProperties {

    /**
     * Minimum same-category failures before an anti-pattern is created.
     */
    private int minFailures = 3;

    /**
     * Window in which failures count as recent.
     */
    private long timeWindowMs = 60 * 60 * 1000L;

    /**
     * Suppression for auth_required anti-patterns, 0 means permanent.
     */
    private long authSuppressionMs = 0L;

    /**
     * Suppression for rate_limited anti-patterns.
     */
    private long rateLimitSuppressionMs = 5 * 60 * 1000L;

    /**
     * Suppression for every other category.
     */
    private long defaultSuppressionMs = 60 * 60 * 1000L;

    /**
     * Recent failures kept per pattern.
     */
    private int maxRecentFailures = 10;

    /**
     * Patterns with tracked history, the least recently updated one is evicted beyond this.
     */
    private int maxTrackedPatterns = 1000;

}
