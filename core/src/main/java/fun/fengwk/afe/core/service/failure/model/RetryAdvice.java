package fun.fengwk.afe.core.service.failure.model;

/**
 * Retry decision for the latest failure of a pattern.
 *
 * @author fengwk
 */
public record RetryAdvice(boolean shouldRetry, long waitMs, RetryStrategy strategy) {

    public static final RetryAdvice NO_RETRY = new RetryAdvice(false, 0, RetryStrategy.NONE);

}
