package fun.fengwk.afe.core.service.failure.model;

/**
 * Retry schedule for one failure category.
 *
 * @author fengwk
 */
public record RetryPolicy(
    RetryStrategy strategy,
    int maxRetries,
    long initialDelayMs,
    long maxDelayMs,
    double backoffMultiplier
) {
}
