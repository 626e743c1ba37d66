package fun.fengwk.afe.core.service.fetch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Options for one cascade. Null fields fall back to {@code afe.fetch} configuration.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TieredFetchOptions {

    /**
     * Tier name to force, legacy names accepted.
     */
    private String forceTier;

    private Integer minContentLength;

    private Long tierTimeoutMs;

    private Boolean enableLearning;

    private Map<String, String> headers;

}
