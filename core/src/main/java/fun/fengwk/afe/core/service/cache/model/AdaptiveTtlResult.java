package fun.fengwk.afe.core.service.cache.model;

import lombok.Builder;
import lombok.Value;

/**
 * Calculated TTL together with the trace of how it was derived.
 *
 * @author fengwk
 */
@Value
@Builder
public class AdaptiveTtlResult {

    long ttlMs;
    DomainCategory domainCategory;
    double multiplier;
    boolean respectedHeaders;

    /**
     * Learned volatility, null when there is not enough history.
     */
    Double volatilityFactor;

    String reason;

}
