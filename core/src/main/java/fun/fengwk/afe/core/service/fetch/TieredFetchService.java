package fun.fengwk.afe.core.service.fetch;

import fun.fengwk.afe.core.service.fetch.model.DomainPreference;
import fun.fengwk.afe.core.service.fetch.model.RenderTier;
import fun.fengwk.afe.core.service.fetch.model.TierStats;
import fun.fengwk.afe.core.service.fetch.model.TieredFetchOptions;
import fun.fengwk.afe.core.service.fetch.model.TieredFetchResult;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Tiered content fetch: tries extraction tiers from cheap to expensive and learns which tier
 * to start with per domain.
 *
 * @author fengwk
 */
public interface TieredFetchService {

    /**
     * Fetch the url.
     *
     * @throws IllegalArgumentException when the url or the forced tier is invalid
     * @throws AllTiersFailedException when every attempted tier failed or was rejected, or the calling
     *                                 thread was interrupted during a tier; the interrupt flag is kept
     */
    TieredFetchResult fetch(String url, TieredFetchOptions options);

    default TieredFetchResult fetch(String url) {
        return fetch(url, null);
    }

    Optional<DomainPreference> getDomainPreference(String domain);

    void setDomainPreference(String domain, RenderTier tier);

    void clearPreferences();

    List<DomainPreference> exportPreferences();

    int importPreferences(Collection<DomainPreference> preferences);

    TierStats getStats();

    boolean isFullRenderAvailable();

}
