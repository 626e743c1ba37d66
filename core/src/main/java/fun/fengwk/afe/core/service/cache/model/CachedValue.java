package fun.fengwk.afe.core.service.cache.model;

/**
 * Result of a read-through cache call.
 *
 * @author fengwk
 */
public record CachedValue<T>(T value, boolean fromCache, AdaptiveTtlResult ttlResult) {
}
