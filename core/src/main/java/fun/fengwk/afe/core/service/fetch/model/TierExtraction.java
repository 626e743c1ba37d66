package fun.fengwk.afe.core.service.fetch.model;

import lombok.Builder;
import lombok.Value;

/**
 * Output of a single tier strategy.
 *
 * @author fengwk
 */
@Value
@Builder
public class TierExtraction {

    String html;
    ExtractedContent content;
    String finalUrl;

}
