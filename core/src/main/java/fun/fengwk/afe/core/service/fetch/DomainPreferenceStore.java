package fun.fengwk.afe.core.service.fetch;

import fun.fengwk.afe.core.service.fetch.model.DomainPreference;
import fun.fengwk.afe.core.service.fetch.model.RenderTier;
import fun.fengwk.afe.core.service.fetch.model.TierStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-domain tier preferences learned from cascades.
 *
 * <p>Each update is a single {@code compute} on the domain key. Preferences change tier only
 * after accumulated evidence, so one bad sample does not flip a domain.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class DomainPreferenceStore {

    static final int MANUAL_SUCCESS_COUNT = 10;

    private final Map<String, DomainPreference> preferences = new ConcurrentHashMap<>();
    private final Clock clock;

    public DomainPreferenceStore(Clock clock) {
        this.clock = clock;
    }

    public Optional<DomainPreference> get(String domain) {
        if (domain == null) {
            return Optional.empty();
        }
        DomainPreference preference = preferences.get(domain);
        return preference == null ? Optional.empty() : Optional.of(preference.toBuilder().build());
    }

    /**
     * Record an accepted result. The preferred tier switches only when the used tier differs and
     * failures exceed half of successes; the switch resets counters to one success.
     */
    public void recordSuccess(String domain, RenderTier tier, long responseTimeMs) {
        long now = clock.millis();
        preferences.compute(domain, (key, existing) -> {
            if (existing == null) {
                return DomainPreference.builder()
                    .domain(key)
                    .preferredTier(tier)
                    .successCount(1)
                    .failureCount(0)
                    .lastUsed(now)
                    .avgResponseTimeMs(responseTimeMs)
                    .build();
            }
            DomainPreference updated = existing.toBuilder().build();
            updated.setSuccessCount(updated.getSuccessCount() + 1);
            updated.setLastUsed(now);
            updated.setAvgResponseTimeMs(
                (updated.getAvgResponseTimeMs() * (updated.getSuccessCount() - 1) + responseTimeMs) / updated.getSuccessCount()
            );
            if (tier != updated.getPreferredTier() && updated.getFailureCount() > updated.getSuccessCount() / 2.0) {
                log.debug("domain preference switched, domain={}, from={}, to={}",
                    key, updated.getPreferredTier(), tier);
                updated.setPreferredTier(tier);
                updated.setSuccessCount(1);
                updated.setFailureCount(0);
            }
            return updated;
        });
    }

    /**
     * Record an exhausted cascade whose last attempted tier was {@code lastTier}. More than two
     * failures below full-render bump the preference to the next tier and reset counters.
     */
    public void recordFailure(String domain, RenderTier lastTier) {
        long now = clock.millis();
        preferences.compute(domain, (key, existing) -> {
            if (existing == null) {
                return DomainPreference.builder()
                    .domain(key)
                    .preferredTier(lastTier.next())
                    .successCount(0)
                    .failureCount(1)
                    .lastUsed(now)
                    .avgResponseTimeMs(0)
                    .build();
            }
            DomainPreference updated = existing.toBuilder().build();
            updated.setFailureCount(updated.getFailureCount() + 1);
            updated.setLastUsed(now);
            if (updated.getFailureCount() > 2 && lastTier != RenderTier.FULL_RENDER) {
                log.debug("domain preference escalated, domain={}, to={}", key, lastTier.next());
                updated.setPreferredTier(lastTier.next());
                updated.setSuccessCount(0);
                updated.setFailureCount(0);
            }
            return updated;
        });
    }

    /**
     * Pin a tier for the domain with high confidence.
     */
    public void set(String domain, RenderTier tier) {
        preferences.put(domain, DomainPreference.builder()
            .domain(domain)
            .preferredTier(tier)
            .successCount(MANUAL_SUCCESS_COUNT)
            .failureCount(0)
            .lastUsed(clock.millis())
            .avgResponseTimeMs(0)
            .build());
    }

    public void clear() {
        preferences.clear();
    }

    public int size() {
        return preferences.size();
    }

    public List<DomainPreference> exportPreferences() {
        List<DomainPreference> exported = new ArrayList<>();
        for (DomainPreference preference : preferences.values()) {
            exported.add(preference.toBuilder().build());
        }
        return exported;
    }

    /**
     * Merge preferences, replacing existing ones of the same domain. Entries without domain or
     * tier are skipped.
     *
     * @return number of imported preferences
     */
    public int importPreferences(Collection<DomainPreference> imported) {
        if (imported == null) {
            return 0;
        }
        int count = 0;
        for (DomainPreference preference : imported) {
            if (preference == null || !StringUtils.hasText(preference.getDomain()) || preference.getPreferredTier() == null) {
                continue;
            }
            preferences.put(preference.getDomain(), preference.toBuilder().build());
            count++;
        }
        return count;
    }

    public TierStats stats(boolean fullRenderAvailable) {
        Map<RenderTier, Integer> byTier = new EnumMap<>(RenderTier.class);
        Map<RenderTier, Double> totals = new EnumMap<>(RenderTier.class);
        Map<RenderTier, Integer> samples = new EnumMap<>(RenderTier.class);
        for (RenderTier tier : RenderTier.values()) {
            byTier.put(tier, 0);
            totals.put(tier, 0.0);
            samples.put(tier, 0);
        }

        int totalDomains = 0;
        for (DomainPreference preference : preferences.values()) {
            totalDomains++;
            RenderTier tier = preference.getPreferredTier();
            byTier.merge(tier, 1, Integer::sum);
            if (preference.getAvgResponseTimeMs() > 0) {
                totals.merge(tier, preference.getAvgResponseTimeMs(), Double::sum);
                samples.merge(tier, 1, Integer::sum);
            }
        }

        Map<RenderTier, Double> averages = new EnumMap<>(RenderTier.class);
        for (RenderTier tier : RenderTier.values()) {
            int count = samples.get(tier);
            averages.put(tier, count > 0 ? totals.get(tier) / count : 0.0);
        }

        return TierStats.builder()
            .totalDomains(totalDomains)
            .byTier(byTier)
            .avgResponseTimesMs(averages)
            .fullRenderAvailable(fullRenderAvailable)
            .build();
    }

}
