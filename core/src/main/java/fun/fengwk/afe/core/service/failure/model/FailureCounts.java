package fun.fengwk.afe.core.service.failure.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-category failure totals. Counts only grow until {@link #reset()}.
 *
 * @author fengwk
 */
public class FailureCounts {

    private final EnumMap<FailureCategory, Long> counts = new EnumMap<>(FailureCategory.class);

    public FailureCounts() {
        reset();
    }

    public synchronized void increment(FailureCategory category) {
        counts.merge(category, 1L, Long::sum);
    }

    public synchronized long get(FailureCategory category) {
        return counts.getOrDefault(category, 0L);
    }

    public synchronized long total() {
        long total = 0;
        for (long count : counts.values()) {
            total += count;
        }
        return total;
    }

    public synchronized void reset() {
        for (FailureCategory category : FailureCategory.values()) {
            counts.put(category, 0L);
        }
    }

    public synchronized Map<FailureCategory, Long> asMap() {
        return Collections.unmodifiableMap(new EnumMap<>(counts));
    }

}
