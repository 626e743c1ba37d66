package fun.fengwk.afe.core.service.cache;

import fun.fengwk.afe.core.service.cache.model.AdaptiveTtlResult;
import fun.fengwk.afe.core.service.cache.model.CacheSetOptions;
import fun.fengwk.afe.core.service.cache.model.ContentEntry;
import fun.fengwk.afe.core.service.cache.model.FreshnessHint;

import java.time.Clock;

/**
 * Page content cache that detects unchanged content by hash and feeds the
 * {@link VolatilityTracker} whenever a cached page is rewritten.
 *
 * @author fengwk
 */
public class AdaptiveContentCache extends AdaptiveCache<ContentEntry> {

    private final VolatilityTracker volatilityTracker;

    public AdaptiveContentCache(AdaptiveTtlCalculator ttlCalculator, VolatilityTracker volatilityTracker,
                                Clock clock, int maxEntries) {
        super(ttlCalculator, clock, maxEntries);
        this.volatilityTracker = volatilityTracker;
    }

    /**
     * 32-bit rolling hash rendered as signed hex.
     */
    public static String hashContent(String content) {
        int hash = 0;
        if (content != null) {
            for (int i = 0; i < content.length(); i++) {
                hash = (hash << 5) - hash + content.charAt(i);
            }
        }
        return Integer.toString(hash, 16);
    }

    /**
     * Compare new content against the cached entry and record the observation.
     *
     * @return true when nothing is cached or the content differs
     */
    public boolean hasContentChanged(String url, String newContent) {
        ContentEntry cached = get(url);
        if (cached == null) {
            return true;
        }
        boolean changed = !cached.contentHash().equals(hashContent(newContent));
        volatilityTracker.recordContentCheck(url, changed);
        return changed;
    }

    public AdaptiveTtlResult setContent(String url, String html) {
        return setContent(url, html, null, null);
    }

    public AdaptiveTtlResult setContent(String url, String html, String cacheControlHeader, FreshnessHint freshnessHint) {
        String contentHash = hashContent(html);

        ContentEntry cached = get(url);
        if (cached != null) {
            volatilityTracker.recordContentCheck(url, !cached.contentHash().equals(contentHash));
        }

        return set(
            url,
            new ContentEntry(html, contentHash, clock.millis()),
            CacheSetOptions.builder()
                .apiResponse(false)
                .cacheControlHeader(cacheControlHeader)
                .freshnessHint(freshnessHint)
                .build()
        );
    }

}
