package fun.fengwk.afe.core.service.fetch.impl;

import fun.fengwk.afe.core.service.failure.FailureClassifier;
import fun.fengwk.afe.core.service.failure.model.FailureClassification;
import fun.fengwk.afe.core.service.fetch.AllTiersFailedException;
import fun.fengwk.afe.core.service.fetch.ContentRejectedException;
import fun.fengwk.afe.core.service.fetch.DomainPreferenceStore;
import fun.fengwk.afe.core.service.fetch.FetchProperties;
import fun.fengwk.afe.core.service.fetch.TieredFetchService;
import fun.fengwk.afe.core.service.fetch.model.DetectionFlags;
import fun.fengwk.afe.core.service.fetch.model.DomainPreference;
import fun.fengwk.afe.core.service.fetch.model.RenderTier;
import fun.fengwk.afe.core.service.fetch.model.TierAttempt;
import fun.fengwk.afe.core.service.fetch.model.TierExtractOptions;
import fun.fengwk.afe.core.service.fetch.model.TierExtraction;
import fun.fengwk.afe.core.service.fetch.model.TierStats;
import fun.fengwk.afe.core.service.fetch.model.TierTiming;
import fun.fengwk.afe.core.service.fetch.model.TieredFetchOptions;
import fun.fengwk.afe.core.service.fetch.model.TieredFetchResult;
import fun.fengwk.afe.core.service.fetch.strategy.TierStrategy;
import fun.fengwk.afe.core.service.fetch.strategy.TierStrategyRegistry;
import fun.fengwk.afe.core.service.fetch.support.ContentValidator;
import fun.fengwk.afe.core.service.support.DomainHeuristics;
import fun.fengwk.afe.core.utils.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Tier cascade implementation. Tiers of one cascade run sequentially on the caller thread.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TieredFetchServiceImpl implements TieredFetchService {

    private final TierStrategyRegistry tierStrategyRegistry;
    private final ContentValidator contentValidator;
    private final DomainPreferenceStore domainPreferenceStore;
    private final FailureClassifier failureClassifier;
    private final FetchProperties fetchProperties;
    private final Clock clock;

    @Override
    public TieredFetchResult fetch(String url, TieredFetchOptions options) {
        TieredFetchOptions normalizedOptions = options == null ? new TieredFetchOptions() : options;
        String normalizedUrl = validateUrl(url);
        String domain = UrlUtils.extractHostname(normalizedUrl);
        RenderTier forcedTier = StringUtils.hasText(normalizedOptions.getForceTier())
            ? RenderTier.fromValue(normalizedOptions.getForceTier()) : null;

        int minContentLength = normalizedOptions.getMinContentLength() != null
            ? normalizedOptions.getMinContentLength() : fetchProperties.getMinContentLength();
        long tierTimeoutMs = normalizedOptions.getTierTimeoutMs() != null
            ? normalizedOptions.getTierTimeoutMs() : fetchProperties.getTierTimeoutMs();
        boolean learningEnabled = normalizedOptions.getEnableLearning() != null
            ? normalizedOptions.getEnableLearning() : fetchProperties.isLearningEnabled();
        TierExtractOptions extractOptions = TierExtractOptions.builder()
            .timeoutMs(tierTimeoutMs)
            .minContentLength(minContentLength)
            .headers(normalizedOptions.getHeaders() == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(normalizedOptions.getHeaders())))
            .build();

        boolean fullRenderAvailable = isFullRenderAvailable();
        RenderTier startTier = forcedTier != null ? forcedTier : determineStartingTier(domain, fullRenderAvailable);
        List<RenderTier> tierOrder = getTierOrder(startTier, fullRenderAvailable);

        long startAt = clock.millis();
        Map<RenderTier, Long> perTierMs = new EnumMap<>(RenderTier.class);
        List<RenderTier> tiersAttempted = new ArrayList<>();
        List<TierAttempt> failedAttempts = new ArrayList<>();
        Throwable lastError = null;

        for (RenderTier tier : tierOrder) {
            long tierStartAt = clock.millis();
            tiersAttempted.add(tier);
            try {
                TierExtraction extraction = executeTier(tier, normalizedUrl, extractOptions);
                long elapsedMs = clock.millis() - tierStartAt;
                perTierMs.put(tier, elapsedMs);

                ContentValidator.ValidationResult validation = contentValidator.validate(extraction, minContentLength);
                if (validation.valid()) {
                    if (learningEnabled) {
                        domainPreferenceStore.recordSuccess(domain, tier, elapsedMs);
                    }
                    return buildResult(extraction, tier, tiersAttempted, failedAttempts, perTierMs,
                        clock.millis() - startAt, fullRenderAvailable, normalizedUrl);
                }

                lastError = new ContentRejectedException(tier, validation.reason());
                failedAttempts.add(attempt(tier, validation.reason(), true, elapsedMs));
                log.debug("tier rejected, url={}, tier={}, reason={}", normalizedUrl, tier.getValue(), validation.reason());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                long elapsedMs = clock.millis() - tierStartAt;
                perTierMs.put(tier, elapsedMs);
                failedAttempts.add(attempt(tier, "interrupted", false, elapsedMs));
                log.warn("tier cascade interrupted, url={}, tier={}, tiers={}", normalizedUrl, tier.getValue(), tiersAttempted);
                throw new AllTiersFailedException(normalizedUrl, failedAttempts, ex);
            } catch (Exception ex) {
                long elapsedMs = clock.millis() - tierStartAt;
                perTierMs.put(tier, elapsedMs);
                String reason = StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
                lastError = ex;
                failedAttempts.add(attempt(tier, reason, false, elapsedMs));
                log.debug("tier failed, url={}, tier={}, error={}", normalizedUrl, tier.getValue(), reason);
            }
        }

        if (learningEnabled) {
            domainPreferenceStore.recordFailure(domain, tiersAttempted.get(tiersAttempted.size() - 1));
        }
        AllTiersFailedException failure = new AllTiersFailedException(normalizedUrl, failedAttempts, lastError);
        log.warn("all tiers failed, url={}, tiers={}, error={}", normalizedUrl, tiersAttempted, failure.getLastReason());
        throw failure;
    }

    @Override
    public Optional<DomainPreference> getDomainPreference(String domain) {
        return domainPreferenceStore.get(normalizeDomain(domain));
    }

    @Override
    public void setDomainPreference(String domain, RenderTier tier) {
        if (!StringUtils.hasText(domain) || tier == null) {
            throw new IllegalArgumentException("domain and tier are required");
        }
        domainPreferenceStore.set(normalizeDomain(domain), tier);
    }

    @Override
    public void clearPreferences() {
        domainPreferenceStore.clear();
    }

    @Override
    public List<DomainPreference> exportPreferences() {
        return domainPreferenceStore.exportPreferences();
    }

    @Override
    public int importPreferences(Collection<DomainPreference> preferences) {
        return domainPreferenceStore.importPreferences(preferences);
    }

    @Override
    public TierStats getStats() {
        return domainPreferenceStore.stats(isFullRenderAvailable());
    }

    @Override
    public boolean isFullRenderAvailable() {
        return fetchProperties.isFullRenderEnabled() && tierStrategyRegistry.isAvailable(RenderTier.FULL_RENDER);
    }

    RenderTier determineStartingTier(String domain, boolean fullRenderAvailable) {
        Optional<DomainPreference> preference = domainPreferenceStore.get(domain);
        if (preference.isPresent() && preference.get().getSuccessCount() > 2) {
            RenderTier preferredTier = preference.get().getPreferredTier();
            if (preferredTier == RenderTier.FULL_RENDER && !fullRenderAvailable) {
                return RenderTier.LIGHTWEIGHT_SCRIPT;
            }
            return preferredTier;
        }

        if (DomainHeuristics.isBrowserRequired(domain)) {
            return fullRenderAvailable ? RenderTier.FULL_RENDER : RenderTier.LIGHTWEIGHT_SCRIPT;
        }

        return RenderTier.STRUCTURAL;
    }

    List<RenderTier> getTierOrder(RenderTier startTier, boolean fullRenderAvailable) {
        if (startTier == RenderTier.FULL_RENDER && !fullRenderAvailable) {
            log.warn("full-render tier requested but unavailable, fallback={}", RenderTier.LIGHTWEIGHT_SCRIPT.getValue());
            return List.of(RenderTier.LIGHTWEIGHT_SCRIPT);
        }
        List<RenderTier> order = new ArrayList<>();
        for (RenderTier tier : RenderTier.values()) {
            if (tier.ordinal() < startTier.ordinal()) {
                continue;
            }
            if (tier == RenderTier.FULL_RENDER && !fullRenderAvailable) {
                continue;
            }
            order.add(tier);
        }
        return order;
    }

    private TierExtraction executeTier(RenderTier tier, String url, TierExtractOptions options) throws Exception {
        TierStrategy strategy = tierStrategyRegistry.get(tier)
            .orElseThrow(() -> new IllegalStateException("no strategy registered for tier " + tier.getValue()));
        TierExtraction extraction = strategy.extract(url, options);
        if (extraction == null) {
            throw new IllegalStateException("tier " + tier.getValue() + " returned no result");
        }
        return extraction;
    }

    private TierAttempt attempt(RenderTier tier, String reason, boolean rejected, long elapsedMs) {
        FailureClassification classification = failureClassifier.classify(null, reason);
        return TierAttempt.builder()
            .tier(tier)
            .reason(reason)
            .rejected(rejected)
            .category(classification.getCategory())
            .elapsedMs(elapsedMs)
            .build();
    }

    private TieredFetchResult buildResult(TierExtraction extraction,
                                          RenderTier tier,
                                          List<RenderTier> tiersAttempted,
                                          List<TierAttempt> failedAttempts,
                                          Map<RenderTier, Long> perTierMs,
                                          long totalMs,
                                          boolean fullRenderAvailable,
                                          String url) {
        boolean fellBack = !failedAttempts.isEmpty();
        String tierReason = fellBack
            ? "Fell back from " + tiersAttempted.get(0).getValue() + " due to: "
                + failedAttempts.get(failedAttempts.size() - 1).getReason()
            : tier.getValue() + " tier successful";

        return TieredFetchResult.builder()
            .html(extraction.getHtml())
            .content(extraction.getContent())
            .finalUrl(StringUtils.hasText(extraction.getFinalUrl()) ? extraction.getFinalUrl() : url)
            .tier(tier)
            .fellBack(fellBack)
            .tiersAttempted(List.copyOf(tiersAttempted))
            .tierReason(tierReason)
            .timing(TierTiming.builder().totalMs(totalMs).perTierMs(Map.copyOf(perTierMs)).build())
            .detection(DetectionFlags.builder()
                .staticContent(tier == RenderTier.STRUCTURAL)
                .jsHeavy(tier == RenderTier.FULL_RENDER)
                .needsFullRender(tier == RenderTier.FULL_RENDER)
                .contentComplete(true)
                .fullRenderAvailable(fullRenderAvailable)
                .build())
            .build();
    }

    private String validateUrl(String url) {
        if (!StringUtils.hasText(url)) {
            throw new IllegalArgumentException("url is blank");
        }
        String normalizedUrl = url.trim();
        String lowerCaseUrl = normalizedUrl.toLowerCase(Locale.ROOT);
        if (!lowerCaseUrl.startsWith("http://") && !lowerCaseUrl.startsWith("https://")) {
            throw new IllegalArgumentException("unsupported url protocol");
        }
        if (UrlUtils.extractHostname(normalizedUrl) == null) {
            throw new IllegalArgumentException("invalid url: " + normalizedUrl);
        }
        return normalizedUrl;
    }

    private static String normalizeDomain(String domain) {
        return domain == null ? null : domain.trim().toLowerCase(Locale.ROOT);
    }

}
