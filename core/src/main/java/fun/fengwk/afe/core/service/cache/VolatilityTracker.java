package fun.fengwk.afe.core.service.cache;

import fun.fengwk.afe.core.service.cache.model.DomainVolatilityStats;
import fun.fengwk.afe.core.service.cache.model.VolatilityRecord;
import fun.fengwk.afe.core.utils.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Tracks how often content behind a url pattern changes.
 *
 * <p>Urls are grouped by host and normalized path: numeric segments become {@code {id}} and long
 * hex segments become {@code {uuid}}, so near-duplicate urls share one record. The number of
 * tracked patterns is bounded; the least recently checked pattern is evicted first.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class VolatilityTracker {

    private static final double EMA_WEIGHT = 0.3;
    private static final int MOST_VOLATILE_LIMIT = 5;

    private static final Pattern NUMERIC_SEGMENT = Pattern.compile("\\d+");
    private static final Pattern HEX_SEGMENT = Pattern.compile("[a-f0-9-]{32,}", Pattern.CASE_INSENSITIVE);

    private final Map<String, VolatilityRecord> records = new ConcurrentHashMap<>();
    private final Object evictionLock = new Object();
    private final CacheProperties cacheProperties;
    private final Clock clock;

    public VolatilityTracker(CacheProperties cacheProperties, Clock clock) {
        this.cacheProperties = cacheProperties;
        this.clock = clock;
    }

    /**
     * Record one observation of the url.
     *
     * @param contentChanged whether the content differed from the previous observation
     */
    public void recordContentCheck(String url, boolean contentChanged) {
        String key = volatilityKey(url);
        long now = clock.millis();

        if (records.computeIfPresent(key, (k, existing) -> applyCheck(existing, now, contentChanged)) != null) {
            return;
        }

        // new keys are inserted only under the eviction lock
        synchronized (evictionLock) {
            if (!records.containsKey(key) && records.size() >= normalizeMaxRecords()) {
                evictLeastRecentlyChecked();
            }
            records.compute(key, (k, existing) -> applyCheck(
                existing != null ? existing : VolatilityRecord.builder().key(k).lastCheckedAt(now).build(),
                now, contentChanged));
        }
    }

    private static VolatilityRecord applyCheck(VolatilityRecord record, long now, boolean contentChanged) {
        record.setCheckCount(record.getCheckCount() + 1);
        record.setLastCheckedAt(now);

        if (contentChanged) {
            Long previousChangeAt = record.getLastChangedAt();
            record.setChangeCount(record.getChangeCount() + 1);
            record.setLastChangedAt(now);
            if (previousChangeAt != null) {
                double interval = now - previousChangeAt;
                Double avg = record.getAvgChangeIntervalMs();
                record.setAvgChangeIntervalMs(
                    avg == null ? interval : avg * (1 - EMA_WEIGHT) + interval * EMA_WEIGHT
                );
            }
        }
        return record;
    }

    /**
     * Volatility in [0, 1], 0 meaning very stable.
     *
     * @return volatility factor, or null when fewer than two observations exist
     */
    public Double getVolatilityFactor(String url) {
        VolatilityRecord record = records.get(volatilityKey(url));
        if (record == null || record.getCheckCount() < 2) {
            return null;
        }

        double changeRate = (double) record.getChangeCount() / record.getCheckCount();
        Long lastChangedAt = record.getLastChangedAt();
        if (lastChangedAt == null) {
            return 0.0;
        }
        if (clock.millis() - lastChangedAt > cacheProperties.getVolatilityDecayAfterMs()) {
            return changeRate * 0.5;
        }
        return changeRate;
    }

    public VolatilityRecord getRecord(String url) {
        VolatilityRecord record = records.get(volatilityKey(url));
        return record == null ? null : record.toBuilder().build();
    }

    public DomainVolatilityStats getDomainVolatilityStats(String domain) {
        String normalizedDomain = domain == null ? "" : domain.toLowerCase(Locale.ROOT);
        List<DomainVolatilityStats.PathChangeRate> rates = new ArrayList<>();
        for (Map.Entry<String, VolatilityRecord> entry : records.entrySet()) {
            VolatilityRecord record = entry.getValue();
            boolean sameHost = entry.getKey().equals(normalizedDomain) || entry.getKey().startsWith(normalizedDomain + "/");
            if (sameHost && record.getCheckCount() >= 2) {
                rates.add(new DomainVolatilityStats.PathChangeRate(
                    entry.getKey().substring(normalizedDomain.length()),
                    (double) record.getChangeCount() / record.getCheckCount()
                ));
            }
        }

        if (rates.isEmpty()) {
            return DomainVolatilityStats.builder()
                .urlCount(0)
                .avgChangeRate(0)
                .mostVolatilePaths(List.of())
                .build();
        }

        double avgChangeRate = rates.stream()
            .mapToDouble(DomainVolatilityStats.PathChangeRate::changeRate)
            .average()
            .orElse(0);
        List<DomainVolatilityStats.PathChangeRate> mostVolatile = rates.stream()
            .sorted(Comparator.comparingDouble(DomainVolatilityStats.PathChangeRate::changeRate).reversed())
            .limit(MOST_VOLATILE_LIMIT)
            .toList();

        return DomainVolatilityStats.builder()
            .urlCount(rates.size())
            .avgChangeRate(avgChangeRate)
            .mostVolatilePaths(mostVolatile)
            .build();
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
    }

    public List<VolatilityRecord> exportRecords() {
        return records.values().stream()
            .map(record -> record.toBuilder().build())
            .toList();
    }

    public void importRecords(List<VolatilityRecord> imported) {
        if (imported == null) {
            return;
        }
        for (VolatilityRecord record : imported) {
            if (record == null || record.getKey() == null) {
                log.debug("skip volatility record without key");
                continue;
            }
            synchronized (evictionLock) {
                if (!records.containsKey(record.getKey()) && records.size() >= normalizeMaxRecords()) {
                    evictLeastRecentlyChecked();
                }
                records.put(record.getKey(), record.toBuilder().build());
            }
        }
    }

    /**
     * Grouping key: host plus normalized path, or the raw input when it is not a url.
     */
    public static String volatilityKey(String url) {
        URI uri = UrlUtils.tryParse(url);
        if (uri == null) {
            return url == null ? "" : url;
        }
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        StringBuilder normalizedPath = new StringBuilder();
        String[] segments = path.split("/", -1);
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                normalizedPath.append('/');
            }
            normalizedPath.append(normalizeSegment(segments[i]));
        }
        return uri.getHost().toLowerCase(Locale.ROOT) + normalizedPath;
    }

    private static String normalizeSegment(String segment) {
        if (segment.isEmpty()) {
            return segment;
        }
        if (NUMERIC_SEGMENT.matcher(segment).matches()) {
            return "{id}";
        }
        if (HEX_SEGMENT.matcher(segment).matches()) {
            return "{uuid}";
        }
        return segment;
    }

    private void evictLeastRecentlyChecked() {
        String oldestKey = null;
        long oldestTime = Long.MAX_VALUE;
        for (Map.Entry<String, VolatilityRecord> entry : records.entrySet()) {
            if (entry.getValue().getLastCheckedAt() < oldestTime) {
                oldestTime = entry.getValue().getLastCheckedAt();
                oldestKey = entry.getKey();
            }
        }
        if (oldestKey != null) {
            records.remove(oldestKey);
            log.debug("evicted volatility record, key={}", oldestKey);
        }
    }

    private int normalizeMaxRecords() {
        return Math.max(1, cacheProperties.getVolatilityMaxRecords());
    }

}
