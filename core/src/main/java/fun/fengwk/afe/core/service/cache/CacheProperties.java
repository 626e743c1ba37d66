package fun.fengwk.afe.core.service.cache;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Adaptive cache configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "afe.cache")
public class CacheProperties {

    /**
     * Base TTL for pages in milliseconds.
     */
    private long defaultPageTtlMs = 15 * 60 * 1000L;

    /**
     * Base TTL for API responses in milliseconds.
     */
    private long defaultApiTtlMs = 5 * 60 * 1000L;

    /**
     * Lower TTL bound in milliseconds.
     */
    private long minTtlMs = 30 * 1000L;

    /**
     * Upper TTL bound in milliseconds.
     */
    private long maxTtlMs = 24 * 60 * 60 * 1000L;

    /**
     * Capacity of the page content cache.
     */
    private int pageCacheMaxEntries = 500;

    /**
     * Capacity of the API response cache.
     */
    private int apiCacheMaxEntries = 200;

    /**
     * Max number of url patterns tracked for volatility.
     */
    private int volatilityMaxRecords = 1000;

    /**
     * Volatility is halved once content stayed unchanged for this long.
     */
    private long volatilityDecayAfterMs = 24 * 60 * 60 * 1000L;

}
