package fun.fengwk.afe.core.service.fetch.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Accepted result of a cascade.
 *
 * @author fengwk
 */
@Value
@Builder
public class TieredFetchResult {

    String html;
    ExtractedContent content;
    String finalUrl;

    /**
     * Tier whose output was accepted.
     */
    RenderTier tier;

    boolean fellBack;
    List<RenderTier> tiersAttempted;
    String tierReason;
    TierTiming timing;
    DetectionFlags detection;

}
