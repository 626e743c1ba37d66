package fun.fengwk.afe.core.service.failure.model;

import lombok.Builder;
import lombok.Value;

/**
 * Health verdict for a fetch pattern.
 *
 * @author fengwk
 */
@Value
@Builder
public class PatternHealth {

    boolean healthy;
    double successRate;
    int recentFailures;

    /**
     * Most frequent category among recent failures, null when there are none.
     */
    FailureCategory dominantCategory;

    RetryStrategy suggestedAction;
    String reason;

}
