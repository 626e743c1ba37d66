package fun.fengwk.afe.core.service.failure.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of classifying one failure.
 *
 * @author fengwk
 */
@Value
@Builder
public class FailureClassification {

    FailureCategory category;

    /**
     * Confidence in [0, 1].
     */
    double confidence;

    RetryStrategy recommendedStrategy;

    /**
     * Initial retry delay of the category, null when the category has no retry schedule.
     */
    Long suggestedWaitMs;

    boolean shouldCreateAntiPattern;

    String message;

}
