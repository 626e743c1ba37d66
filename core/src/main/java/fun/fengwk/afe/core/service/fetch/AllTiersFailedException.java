package fun.fengwk.afe.core.service.fetch;

import fun.fengwk.afe.core.service.fetch.model.TierAttempt;

import java.util.List;
import java.util.StringJoiner;

/**
 * Thrown when every attempted tier failed or was rejected, or when the cascade was interrupted.
 * The cause is the last tier's error.
 *
 * @author fengwk
 */
public class AllTiersFailedException extends RuntimeException {

    private final String url;
    private final List<TierAttempt> attempts;

    public AllTiersFailedException(String url, List<TierAttempt> attempts, Throwable lastError) {
        super(buildMessage(url, attempts), lastError);
        this.url = url;
        this.attempts = List.copyOf(attempts);
    }

    public String getUrl() {
        return url;
    }

    public List<TierAttempt> getAttempts() {
        return attempts;
    }

    /**
     * Reason of the last attempted tier.
     */
    public String getLastReason() {
        return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).getReason();
    }

    private static String buildMessage(String url, List<TierAttempt> attempts) {
        StringJoiner joiner = new StringJoiner("; ");
        for (TierAttempt attempt : attempts) {
            joiner.add(attempt.getTier().getValue() + (attempt.isRejected() ? " rejected: " : " failed: ") + attempt.getReason());
        }
        String lastReason = attempts.isEmpty() ? "no tier attempted" : attempts.get(attempts.size() - 1).getReason();
        return "all tiers failed for " + url + ", last error: " + lastReason + " [" + joiner + "]";
    }

}
