package fun.fengwk.afe.core.service.cache.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * @author fengwk
 */
@Value
@Builder
public class AdaptiveCacheStats {

    int size;
    int maxEntries;
    long hits;
    long misses;
    double hitRate;
    Map<DomainCategory, Integer> entriesByCategory;
    double avgTtlMs;
    Long oldestEntry;
    Long newestEntry;

}
