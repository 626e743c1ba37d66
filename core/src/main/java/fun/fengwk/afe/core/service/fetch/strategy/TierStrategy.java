package fun.fengwk.afe.core.service.fetch.strategy;

import fun.fengwk.afe.core.service.fetch.model.RenderTier;
import fun.fengwk.afe.core.service.fetch.model.TierExtractOptions;
import fun.fengwk.afe.core.service.fetch.model.TierExtraction;

/**
 * One extraction technique, selected by its tier.
 *
 * @author fengwk
 */
public interface TierStrategy {

    RenderTier tier();

    /**
     * Whether the technique can run in this environment.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Extract the page. Any exception counts as a failed tier attempt.
     */
    TierExtraction extract(String url, TierExtractOptions options) throws Exception;

}
