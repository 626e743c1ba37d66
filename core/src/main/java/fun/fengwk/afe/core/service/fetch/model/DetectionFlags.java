package fun.fengwk.afe.core.service.fetch.model;

import lombok.Builder;
import lombok.Value;

/**
 * What the cascade learned about the page.
 *
 * @author fengwk
 */
@Value
@Builder
public class DetectionFlags {

    boolean staticContent;
    boolean jsHeavy;
    boolean needsFullRender;
    boolean contentComplete;
    boolean fullRenderAvailable;

}
