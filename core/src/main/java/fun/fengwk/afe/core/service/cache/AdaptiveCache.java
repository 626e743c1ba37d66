package fun.fengwk.afe.core.service.cache;

import fun.fengwk.afe.core.service.cache.model.AdaptiveCacheStats;
import fun.fengwk.afe.core.service.cache.model.AdaptiveTtlRequest;
import fun.fengwk.afe.core.service.cache.model.AdaptiveTtlResult;
import fun.fengwk.afe.core.service.cache.model.CacheEntry;
import fun.fengwk.afe.core.service.cache.model.CacheSetOptions;
import fun.fengwk.afe.core.service.cache.model.CachedValue;
import fun.fengwk.afe.core.service.cache.model.DomainCategory;
import fun.fengwk.afe.core.utils.UrlUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded response cache whose entries expire after an adaptive TTL.
 *
 * <p>Expired entries are evicted lazily on read. When the cache is full, writing a new key evicts
 * the single entry with the oldest write time.
 *
 * @author fengwk
 */
@Slf4j
public class AdaptiveCache<T> {

    private final Map<String, CacheEntry<T>> entries = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    protected final AdaptiveTtlCalculator ttlCalculator;
    protected final Clock clock;
    private final int maxEntries;

    public AdaptiveCache(AdaptiveTtlCalculator ttlCalculator, Clock clock, int maxEntries) {
        this.ttlCalculator = ttlCalculator;
        this.clock = clock;
        this.maxEntries = Math.max(1, maxEntries);
    }

    public T get(String url) {
        return get(url, null);
    }

    /**
     * Get a cached value if present and not expired.
     *
     * @return cached value, or null on miss
     */
    public T get(String url, Map<String, String> params) {
        String key = generateKey(url, params);
        CacheEntry<T> entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return null;
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key, entry);
            misses.incrementAndGet();
            return null;
        }
        hits.incrementAndGet();
        return entry.getValue();
    }

    public AdaptiveTtlResult set(String url, T value) {
        return set(url, value, CacheSetOptions.DEFAULT);
    }

    /**
     * Store a value with an adaptive TTL.
     *
     * @return the TTL calculation used for the entry
     */
    public AdaptiveTtlResult set(String url, T value, CacheSetOptions options) {
        CacheSetOptions normalizedOptions = options == null ? CacheSetOptions.DEFAULT : options;
        String key = generateKey(url, normalizedOptions.getParams());
        AdaptiveTtlResult ttlResult = ttlCalculator.calculate(AdaptiveTtlRequest.builder()
            .url(url)
            .apiResponse(normalizedOptions.isApiResponse())
            .cacheControlHeader(normalizedOptions.getCacheControlHeader())
            .baseTtlMs(normalizedOptions.getBaseTtlMs())
            .freshnessHint(normalizedOptions.getFreshnessHint())
            .build());

        long now = clock.millis();
        CacheEntry<T> entry = CacheEntry.<T>builder()
            .value(value)
            .timestamp(now)
            .expiresAt(now + ttlResult.getTtlMs())
            .ttlResult(ttlResult)
            .build();

        synchronized (writeLock) {
            if (!entries.containsKey(key) && entries.size() >= maxEntries) {
                evictOldest();
            }
            entries.put(key, entry);
        }
        return ttlResult;
    }

    public boolean has(String url) {
        return has(url, null);
    }

    public boolean has(String url, Map<String, String> params) {
        return get(url, params) != null;
    }

    public boolean delete(String url) {
        return delete(url, null);
    }

    public boolean delete(String url, Map<String, String> params) {
        return entries.remove(generateKey(url, params)) != null;
    }

    /**
     * Remove all expired entries.
     *
     * @return number of removed entries
     */
    public int cleanup() {
        long now = clock.millis();
        int removed = 0;
        for (Map.Entry<String, CacheEntry<T>> entry : entries.entrySet()) {
            if (entry.getValue().isExpired(now) && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public void clear() {
        entries.clear();
        hits.set(0);
        misses.set(0);
    }

    /**
     * Remove entries whose hostname equals the domain or is a subdomain of it. Keys that are not
     * urls are skipped.
     *
     * @return number of removed entries
     */
    public int clearDomain(String domain) {
        int removed = 0;
        for (String key : entries.keySet()) {
            String hostname = UrlUtils.extractHostnameLenient(key);
            if (hostname == null) {
                continue;
            }
            if (UrlUtils.isSameOrSubdomain(hostname, domain) && entries.remove(key) != null) {
                removed++;
            }
        }
        log.debug("cleared cache domain, domain={}, removed={}", domain, removed);
        return removed;
    }

    public Set<String> getDomains() {
        Set<String> domains = new TreeSet<>();
        for (String key : entries.keySet()) {
            String hostname = UrlUtils.extractHostnameLenient(key);
            if (hostname != null) {
                domains.add(hostname);
            }
        }
        return domains;
    }

    public AdaptiveTtlResult getTtlResult(String url) {
        return getTtlResult(url, null);
    }

    public AdaptiveTtlResult getTtlResult(String url, Map<String, String> params) {
        CacheEntry<T> entry = entries.get(generateKey(url, params));
        return entry == null ? null : entry.getTtlResult();
    }

    public int size() {
        return entries.size();
    }

    public AdaptiveCacheStats getStats() {
        Long oldest = null;
        Long newest = null;
        long totalTtlMs = 0;
        Map<DomainCategory, Integer> byCategory = new EnumMap<>(DomainCategory.class);
        for (DomainCategory category : DomainCategory.values()) {
            byCategory.put(category, 0);
        }

        int size = 0;
        for (CacheEntry<T> entry : entries.values()) {
            size++;
            if (oldest == null || entry.getTimestamp() < oldest) {
                oldest = entry.getTimestamp();
            }
            if (newest == null || entry.getTimestamp() > newest) {
                newest = entry.getTimestamp();
            }
            totalTtlMs += entry.getTtlResult().getTtlMs();
            byCategory.merge(entry.getTtlResult().getDomainCategory(), 1, Integer::sum);
        }

        long hitCount = hits.get();
        long missCount = misses.get();
        long total = hitCount + missCount;
        return AdaptiveCacheStats.builder()
            .size(size)
            .maxEntries(maxEntries)
            .hits(hitCount)
            .misses(missCount)
            .hitRate(total > 0 ? (double) hitCount / total : 0)
            .entriesByCategory(byCategory)
            .avgTtlMs(size > 0 ? (double) totalTtlMs / size : 0)
            .oldestEntry(oldest)
            .newestEntry(newest)
            .build();
    }

    /**
     * Read-through helper: return the cached value, or load, store and return a fresh one.
     */
    public CachedValue<T> withCache(String url, CacheLoader<? extends T> loader, CacheSetOptions options) throws Exception {
        CacheSetOptions normalizedOptions = options == null ? CacheSetOptions.DEFAULT : options;
        T cached = get(url, normalizedOptions.getParams());
        if (cached != null) {
            return new CachedValue<>(cached, true, getTtlResult(url, normalizedOptions.getParams()));
        }

        T loaded = loader.load();
        AdaptiveTtlResult ttlResult = set(url, loaded, normalizedOptions);
        return new CachedValue<>(loaded, false, ttlResult);
    }

    protected String generateKey(String url, Map<String, String> params) {
        String base = url == null ? "" : url;
        if (params == null || params.isEmpty()) {
            return base;
        }
        StringBuilder key = new StringBuilder(base).append('?');
        boolean first = true;
        for (Map.Entry<String, String> param : new TreeMap<>(params).entrySet()) {
            if (!first) {
                key.append('&');
            }
            key.append(param.getKey()).append('=').append(param.getValue());
            first = false;
        }
        return key.toString();
    }

    private void evictOldest() {
        String oldestKey = null;
        long oldestTimestamp = Long.MAX_VALUE;
        for (Map.Entry<String, CacheEntry<T>> entry : entries.entrySet()) {
            if (entry.getValue().getTimestamp() < oldestTimestamp) {
                oldestTimestamp = entry.getValue().getTimestamp();
                oldestKey = entry.getKey();
            }
        }
        if (oldestKey != null) {
            entries.remove(oldestKey);
            log.debug("evicted oldest cache entry, key={}", oldestKey);
        }
    }

}
