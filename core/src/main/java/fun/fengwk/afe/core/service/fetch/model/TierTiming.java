package fun.fengwk.afe.core.service.fetch.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Timing of one cascade.
 *
 * @author fengwk
 */
@Value
@Builder
public class TierTiming {

    long totalMs;
    Map<RenderTier, Long> perTierMs;

}
