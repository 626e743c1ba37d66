package fun.fengwk.afe.core.service.fetch.model;

import fun.fengwk.afe.core.service.failure.model.FailureCategory;
import lombok.Builder;
import lombok.Value;

/**
 * One failed tier attempt inside a cascade.
 *
 * @author fengwk
 */
@Value
@Builder
public class TierAttempt {

    RenderTier tier;
    String reason;

    /**
     * True when the tier returned content that failed validation, false when it threw.
     */
    boolean rejected;

    FailureCategory category;
    long elapsedMs;

}
