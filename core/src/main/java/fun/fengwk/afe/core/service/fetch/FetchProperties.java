package fun.fengwk.afe.core.service.fetch;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tier cascade configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "afe.fetch")
public class FetchProperties {

    /**
     * Minimum extracted text length accepted from a tier.
     */
    private int minContentLength = 200;

    /**
     * Timeout handed to each tier strategy in milliseconds.
     */
    private long tierTimeoutMs = 30000L;

    /**
     * Whether the full-render tier may be used at all.
     */
    private boolean fullRenderEnabled = true;

    /**
     * Whether cascades update domain preferences by default.
     */
    private boolean learningEnabled = true;

}
