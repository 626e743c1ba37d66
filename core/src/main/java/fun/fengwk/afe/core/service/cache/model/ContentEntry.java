package fun.fengwk.afe.core.service.cache.model;

/**
 * Cached page content with its hash for change detection.
 *
 * @author fengwk
 */
public record ContentEntry(String html, String contentHash, long fetchedAt) {
}
