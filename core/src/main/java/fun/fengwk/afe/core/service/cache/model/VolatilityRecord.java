package fun.fengwk.afe.core.service.cache.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Change history of one normalized url pattern.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VolatilityRecord {

    private String key;
    private int checkCount;
    private int changeCount;

    /**
     * Smoothed interval between changes in milliseconds, null until two changes were seen.
     */
    private Double avgChangeIntervalMs;

    private long lastCheckedAt;
    private Long lastChangedAt;

}
