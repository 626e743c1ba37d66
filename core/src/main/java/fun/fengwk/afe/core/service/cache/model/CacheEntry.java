package fun.fengwk.afe.core.service.cache.model;

import lombok.Builder;
import lombok.Value;

/**
 * @author fengwk
 */
@Value
@Builder
public class CacheEntry<T> {

    T value;
    long timestamp;
    long expiresAt;
    AdaptiveTtlResult ttlResult;

    public boolean isExpired(long now) {
        return now > expiresAt;
    }

}
