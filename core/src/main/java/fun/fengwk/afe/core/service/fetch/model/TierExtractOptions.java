package fun.fengwk.afe.core.service.fetch.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Options handed to a tier strategy.
 *
 * @author fengwk
 */
@Value
@Builder
public class TierExtractOptions {

    /**
     * Timeout the strategy should respect for this attempt.
     */
    long timeoutMs;

    int minContentLength;

    Map<String, String> headers;

}
