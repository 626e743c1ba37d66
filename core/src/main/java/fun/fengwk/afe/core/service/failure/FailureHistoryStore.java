package fun.fengwk.afe.core.service.failure;

import fun.fengwk.afe.core.service.failure.model.FailureCategory;
import fun.fengwk.afe.core.service.failure.model.FailureCounts;
import fun.fengwk.afe.core.service.failure.model.FailureRecord;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-pattern failure history: a bounded buffer of recent failures, category totals and
 * success/failure counters. The number of tracked patterns is bounded; the least recently
 * updated pattern is evicted first.
 *
 * @author fengwk
 */
@Component
public class FailureHistoryStore {

    private final Map<String, PatternHistory> histories = new ConcurrentHashMap<>();
    private final Object evictionLock = new Object();
    private final FailureProperties failureProperties;
    private final Clock clock;

    public FailureHistoryStore(FailureProperties failureProperties, Clock clock) {
        this.failureProperties = failureProperties;
        this.clock = clock;
    }

    public void recordFailure(FailureRecord record) {
        history(record.getPatternId()).addFailure(record, Math.max(1, failureProperties.getMaxRecentFailures()), clock.millis());
    }

    public void recordSuccess(String patternId) {
        history(patternId).addSuccess(clock.millis());
    }

    /**
     * Buffered failures of the pattern, oldest first.
     */
    public List<FailureRecord> getFailures(String patternId) {
        PatternHistory history = histories.get(key(patternId));
        return history == null ? List.of() : history.failures();
    }

    public List<FailureRecord> getRecentFailures(String patternId) {
        return getRecentFailures(patternId, failureProperties.getTimeWindowMs());
    }

    /**
     * Buffered failures newer than {@code now - windowMs}, oldest first.
     */
    public List<FailureRecord> getRecentFailures(String patternId, long windowMs) {
        long cutoff = clock.millis() - windowMs;
        List<FailureRecord> recent = new ArrayList<>();
        for (FailureRecord record : getFailures(patternId)) {
            if (record.getTimestamp() > cutoff) {
                recent.add(record);
            }
        }
        return recent;
    }

    public List<FailureRecord> getRecentFailures(String patternId, FailureCategory category) {
        List<FailureRecord> matched = new ArrayList<>();
        for (FailureRecord record : getRecentFailures(patternId)) {
            if (record.getCategory() == category) {
                matched.add(record);
            }
        }
        return matched;
    }

    public int countRecentFailures(String patternId, FailureCategory category) {
        return getRecentFailures(patternId, category).size();
    }

    public FailureRecord getLatestFailure(String patternId) {
        List<FailureRecord> failures = getFailures(patternId);
        return failures.isEmpty() ? null : failures.get(failures.size() - 1);
    }

    public Map<FailureCategory, Long> getFailureCounts(String patternId) {
        PatternHistory history = histories.get(key(patternId));
        return history == null ? new FailureCounts().asMap() : history.counts.asMap();
    }

    public long getSuccessCount(String patternId) {
        PatternHistory history = histories.get(key(patternId));
        return history == null ? 0 : history.successCount();
    }

    public long getFailureCount(String patternId) {
        PatternHistory history = histories.get(key(patternId));
        return history == null ? 0 : history.counts.total();
    }

    /**
     * Human readable totals, e.g. {@code auth_required: 2, timeout: 1}.
     */
    public String summarize(String patternId) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Map.Entry<FailureCategory, Long> entry : getFailureCounts(patternId).entrySet()) {
            if (entry.getValue() > 0) {
                joiner.add(entry.getKey().getValue() + ": " + entry.getValue());
            }
        }
        return joiner.length() == 0 ? "No failures" : joiner.toString();
    }

    public int size() {
        return histories.size();
    }

    public void reset(String patternId) {
        histories.remove(key(patternId));
    }

    public void clear() {
        histories.clear();
    }

    private PatternHistory history(String patternId) {
        String key = key(patternId);
        PatternHistory history = histories.get(key);
        if (history != null) {
            return history;
        }
        synchronized (evictionLock) {
            history = histories.get(key);
            if (history == null) {
                if (histories.size() >= Math.max(1, failureProperties.getMaxTrackedPatterns())) {
                    evictLeastRecentlyUpdated();
                }
                history = new PatternHistory(clock.millis());
                histories.put(key, history);
            }
            return history;
        }
    }

    private void evictLeastRecentlyUpdated() {
        String oldestKey = null;
        long oldestTime = Long.MAX_VALUE;
        for (Map.Entry<String, PatternHistory> entry : histories.entrySet()) {
            long updatedAt = entry.getValue().updatedAt();
            if (updatedAt < oldestTime) {
                oldestTime = updatedAt;
                oldestKey = entry.getKey();
            }
        }
        if (oldestKey != null) {
            histories.remove(oldestKey);
        }
    }

    private static String key(String patternId) {
        return patternId == null ? "" : patternId;
    }

    private static class PatternHistory {

        private final Deque<FailureRecord> recent = new ArrayDeque<>();
        private final FailureCounts counts = new FailureCounts();
        private long successCount;
        private long updatedAt;

        PatternHistory(long createdAt) {
            this.updatedAt = createdAt;
        }

        synchronized void addFailure(FailureRecord record, int maxRecent, long now) {
            updatedAt = now;
            counts.increment(record.getCategory() == null ? FailureCategory.UNKNOWN : record.getCategory());
            recent.addLast(record);
            while (recent.size() > maxRecent) {
                recent.removeFirst();
            }
        }

        synchronized void addSuccess(long now) {
            updatedAt = now;
            successCount++;
        }

        synchronized long updatedAt() {
            return updatedAt;
        }

        synchronized long successCount() {
            return successCount;
        }

        synchronized List<FailureRecord> failures() {
            return new ArrayList<>(recent);
        }

    }

}
