package fun.fengwk.afe.core.service.cache;

import fun.fengwk.afe.core.service.cache.model.AdaptiveTtlRequest;
import fun.fengwk.afe.core.service.cache.model.AdaptiveTtlResult;
import fun.fengwk.afe.core.service.cache.model.CacheControlDirectives;
import fun.fengwk.afe.core.service.cache.model.DomainCategory;
import fun.fengwk.afe.core.service.cache.model.FreshnessHint;
import fun.fengwk.afe.core.utils.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes a per-request TTL from freshness hints, Cache-Control headers, domain category and
 * learned volatility. The result always lies within the configured [min, max] bounds.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdaptiveTtlCalculator {

    private static final double HIGH_VOLATILITY = 0.5;
    private static final double LOW_VOLATILITY = 0.2;

    private final CacheProperties cacheProperties;
    private final DomainClassifier domainClassifier;
    private final VolatilityTracker volatilityTracker;

    public AdaptiveTtlResult calculate(String url, boolean apiResponse, String cacheControlHeader,
                                       Long baseTtlMs, FreshnessHint freshnessHint) {
        return calculate(AdaptiveTtlRequest.builder()
            .url(url)
            .apiResponse(apiResponse)
            .cacheControlHeader(cacheControlHeader)
            .baseTtlMs(baseTtlMs)
            .freshnessHint(freshnessHint)
            .build());
    }

    public AdaptiveTtlResult calculate(AdaptiveTtlRequest request) {
        String hostname = UrlUtils.extractHostname(request.getUrl());
        DomainCategory category = domainClassifier.classify(hostname == null ? "unknown" : hostname);
        long minTtlMs = cacheProperties.getMinTtlMs();
        long maxTtlMs = cacheProperties.getMaxTtlMs();

        long defaultTtlMs = request.isApiResponse()
            ? cacheProperties.getDefaultApiTtlMs()
            : cacheProperties.getDefaultPageTtlMs();
        double ttlMs = request.getBaseTtlMs() != null ? request.getBaseTtlMs() : defaultTtlMs;
        List<String> reasons = new ArrayList<>();

        FreshnessHint freshnessHint = request.getFreshnessHint() == null ? FreshnessHint.ANY : request.getFreshnessHint();
        if (freshnessHint == FreshnessHint.REALTIME) {
            return AdaptiveTtlResult.builder()
                .ttlMs(minTtlMs)
                .domainCategory(category)
                .multiplier(1.0)
                .respectedHeaders(false)
                .reason("Freshness hint: realtime requested")
                .build();
        }
        if (freshnessHint == FreshnessHint.CACHED) {
            ttlMs = Math.min(ttlMs * 2, maxTtlMs);
            reasons.add("cached preference (+100%)");
        }

        CacheControlDirectives cacheControl = CacheControlParser.parse(request.getCacheControlHeader());
        if (cacheControl.isNoStore() || cacheControl.isNoCache()) {
            // Still keep a minimal TTL for internal deduplication.
            return AdaptiveTtlResult.builder()
                .ttlMs(minTtlMs)
                .domainCategory(category)
                .multiplier(1.0)
                .respectedHeaders(true)
                .reason("Cache-Control: " + (cacheControl.isNoStore() ? "no-store" : "no-cache"))
                .build();
        }

        boolean respectedHeaders = false;
        if (cacheControl.getMaxAge() != null) {
            ttlMs = clamp(cacheControl.getMaxAge() * 1000.0, minTtlMs, maxTtlMs);
            respectedHeaders = true;
            reasons.add("max-age=" + cacheControl.getMaxAge() + "s");
        } else if (cacheControl.getSMaxAge() != null) {
            ttlMs = clamp(cacheControl.getSMaxAge() * 1000.0, minTtlMs, maxTtlMs);
            respectedHeaders = true;
            reasons.add("s-maxage=" + cacheControl.getSMaxAge() + "s");
        }

        double multiplier = category.getTtlMultiplier();
        if (!respectedHeaders && multiplier != 1.0) {
            ttlMs = ttlMs * multiplier;
            reasons.add(category.getValue() + " domain (x" + multiplier + ")");
        }

        Double volatility = volatilityTracker.getVolatilityFactor(request.getUrl());
        if (volatility != null) {
            if (volatility > HIGH_VOLATILITY) {
                ttlMs = ttlMs * (1 - (volatility - HIGH_VOLATILITY));
                reasons.add("high volatility (" + Math.round(volatility * 100) + "%)");
            } else if (volatility < LOW_VOLATILITY) {
                ttlMs = ttlMs * (1 + (LOW_VOLATILITY - volatility));
                reasons.add("low volatility (" + Math.round(volatility * 100) + "%)");
            }
        }

        long boundedTtlMs = Math.round(clamp(ttlMs, minTtlMs, maxTtlMs));
        log.debug(
            "calculated adaptive ttl, url={}, ttlMs={}, category={}, multiplier={}, respectedHeaders={}, volatility={}, reasons={}",
            request.getUrl(),
            boundedTtlMs,
            category,
            multiplier,
            respectedHeaders,
            volatility,
            reasons
        );

        return AdaptiveTtlResult.builder()
            .ttlMs(boundedTtlMs)
            .domainCategory(category)
            .multiplier(multiplier)
            .respectedHeaders(respectedHeaders)
            .volatilityFactor(volatility)
            .reason(reasons.isEmpty() ? "default TTL" : String.join(", ", reasons))
            .build();
    }

    private static double clamp(double value, long min, long max) {
        return Math.max(min, Math.min(value, max));
    }

}
