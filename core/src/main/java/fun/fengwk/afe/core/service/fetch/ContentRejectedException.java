package fun.fengwk.afe.core.service.fetch;

import fun.fengwk.afe.core.service.fetch.model.RenderTier;

/**
 * Tier output that failed content validation.
 *
 * @author fengwk
 */
public class ContentRejectedException extends RuntimeException {

    private final RenderTier tier;

    public ContentRejectedException(RenderTier tier, String reason) {
        super(reason);
        this.tier = tier;
    }

    public RenderTier getTier() {
        return tier;
    }

}
