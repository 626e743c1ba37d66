package fun.fengwk.afe.core.service.fetch.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Informational tier usage statistics.
 *
 * @author fengwk
 */
@Value
@Builder
public class TierStats {

    int totalDomains;
    Map<RenderTier, Integer> byTier;
    Map<RenderTier, Double> avgResponseTimesMs;
    boolean fullRenderAvailable;

}
