package fun.fengwk.afe.core.service.fetch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Learned tier preference of a domain.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DomainPreference {

    private String domain;
    private RenderTier preferredTier;
    private int successCount;
    private int failureCount;
    private long lastUsed;

    /**
     * Running average of successful response times.
     */
    private double avgResponseTimeMs;

}
