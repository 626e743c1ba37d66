package fun.fengwk.afe.core.service.failure.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One observed failure of a fetch pattern.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailureRecord {

    private long timestamp;
    private FailureCategory category;
    private Integer statusCode;
    private String message;
    private String domain;
    private String attemptedUrl;
    private String patternId;
    private Long responseTimeMs;

}
