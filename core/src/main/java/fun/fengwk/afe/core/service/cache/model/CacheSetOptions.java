package fun.fengwk.afe.core.service.cache.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Options for writing a cache entry.
 *
 * @author fengwk
 */
@Value
@Builder
public class CacheSetOptions {

    public static final CacheSetOptions DEFAULT = CacheSetOptions.builder().build();

    /**
     * Extra parameters folded into the cache key.
     */
    Map<String, String> params;

    String cacheControlHeader;
    boolean apiResponse;
    Long baseTtlMs;
    FreshnessHint freshnessHint;

}
