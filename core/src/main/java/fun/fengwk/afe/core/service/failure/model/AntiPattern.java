package fun.fengwk.afe.core.service.failure.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Time-bounded suppression rule learned from repeated same-category failures.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AntiPattern {

    private String id;

    /**
     * Pattern whose failures produced this rule, may be null.
     */
    private String sourcePatternId;

    private List<String> domains;

    /**
     * Case-insensitive url regexes derived from {@link #domains}.
     */
    private List<String> urlPatterns;

    private FailureCategory failureCategory;
    private String reason;
    private RetryStrategy recommendedAction;

    /**
     * Suppression duration, 0 means permanent.
     */
    private long suppressionDurationMs;

    private long createdAt;

    /**
     * Expiry time, 0 means never expires.
     */
    private long expiresAt;

    private int failureCount;
    private long lastFailure;

}
