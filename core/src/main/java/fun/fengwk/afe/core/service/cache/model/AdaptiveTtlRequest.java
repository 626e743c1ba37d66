package fun.fengwk.afe.core.service.cache.model;

import lombok.Builder;
import lombok.Value;

/**
 * Input of an adaptive TTL calculation.
 *
 * @author fengwk
 */
@Value
@Builder
public class AdaptiveTtlRequest {

    String url;
    boolean apiResponse;
    String cacheControlHeader;

    /**
     * Custom base TTL in milliseconds, null uses the page/api default.
     */
    Long baseTtlMs;

    FreshnessHint freshnessHint;

}
