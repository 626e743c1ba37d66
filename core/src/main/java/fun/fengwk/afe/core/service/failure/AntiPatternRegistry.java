package fun.fengwk.afe.core.service.failure;

import fun.fengwk.afe.core.service.failure.model.AntiPattern;
import fun.fengwk.afe.core.service.failure.model.FailureCategory;
import fun.fengwk.afe.core.service.failure.model.FailureRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Registry of learned anti-patterns.
 *
 * <p>All reads and writes go through one lock. Url regexes are compiled once when a rule is
 * stored; malformed regexes are skipped.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class AntiPatternRegistry {

    private final Object lock = new Object();
    private final Map<String, StoredAntiPattern> antiPatterns = new LinkedHashMap<>();
    private final Map<String, String> index = new LinkedHashMap<>();
    private final FailureProperties failureProperties;
    private final Clock clock;

    public AntiPatternRegistry(FailureProperties failureProperties, Clock clock) {
        this.failureProperties = failureProperties;
        this.clock = clock;
    }

    /**
     * Create and store an anti-pattern from same-category failures. The category of the first
     * record is used; records of other categories are ignored.
     *
     * @return the stored anti-pattern, or empty when fewer than the minimum failures are supplied
     */
    public Optional<AntiPattern> createAntiPattern(List<FailureRecord> failures, String sourcePatternId) {
        AntiPattern antiPattern = buildAntiPattern(failures, sourcePatternId);
        if (antiPattern == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            antiPattern.setId(uniqueId(antiPattern.getId()));
            store(antiPattern);
        }
        logCreated(antiPattern);
        return Optional.of(copy(antiPattern));
    }

    /**
     * Register a renewed failure: extend expiry by the original duration unless permanent and
     * increment the count. A registered anti-pattern is renewed from its stored state, not from
     * the given copy.
     */
    public AntiPattern updateAntiPattern(AntiPattern existing, FailureRecord newFailure) {
        AntiPattern updated;
        synchronized (lock) {
            StoredAntiPattern stored = antiPatterns.get(existing.getId());
            updated = renew(stored == null ? existing : stored.antiPattern());
            if (stored != null) {
                store(updated);
            }
        }
        logUpdated(updated, newFailure);
        return copy(updated);
    }

    /**
     * Renew the anti-pattern indexed under the pattern and category, or create one from the
     * recent failures when none is registered. Lookup and write happen atomically.
     *
     * @param recentFailures recent failures of the pattern, used only when creating
     * @return the renewed or created anti-pattern, empty when there were too few failures to create one
     */
    public Optional<AntiPattern> recordOrCreate(String sourcePatternId, FailureCategory category,
                                                List<FailureRecord> recentFailures, FailureRecord latest) {
        AntiPattern result;
        boolean created = false;
        synchronized (lock) {
            String id = index.get(indexKey(sourcePatternId, category));
            StoredAntiPattern stored = id == null ? null : antiPatterns.get(id);
            if (stored != null) {
                result = renew(stored.antiPattern());
                store(result);
            } else {
                result = buildAntiPattern(recentFailures, sourcePatternId);
                if (result == null) {
                    return Optional.empty();
                }
                result.setId(uniqueId(result.getId()));
                store(result);
                created = true;
            }
        }
        if (created) {
            logCreated(result);
        } else {
            logUpdated(result, latest);
        }
        return Optional.of(copy(result));
    }

    /**
     * Active when {@code expiresAt} is 0 or still in the future.
     */
    public boolean isAntiPatternActive(AntiPattern antiPattern) {
        return antiPattern.getExpiresAt() == 0 || clock.millis() < antiPattern.getExpiresAt();
    }

    /**
     * Active anti-patterns with a url regex matching the url.
     */
    public List<AntiPattern> matchAntiPatterns(String url) {
        List<AntiPattern> matches = new ArrayList<>();
        if (url == null) {
            return matches;
        }
        synchronized (lock) {
            for (StoredAntiPattern stored : antiPatterns.values()) {
                if (isAntiPatternActive(stored.antiPattern()) && stored.matches(url)) {
                    matches.add(copy(stored.antiPattern()));
                }
            }
        }
        return matches;
    }

    public boolean isSuppressed(String url) {
        return !matchAntiPatterns(url).isEmpty();
    }

    /**
     * Anti-pattern created from the pattern for the category, if still registered.
     */
    public Optional<AntiPattern> findByIndex(String sourcePatternId, FailureCategory category) {
        synchronized (lock) {
            String id = index.get(indexKey(sourcePatternId, category));
            StoredAntiPattern stored = id == null ? null : antiPatterns.get(id);
            return stored == null ? Optional.empty() : Optional.of(copy(stored.antiPattern()));
        }
    }

    public Optional<AntiPattern> get(String id) {
        synchronized (lock) {
            StoredAntiPattern stored = antiPatterns.get(id);
            return stored == null ? Optional.empty() : Optional.of(copy(stored.antiPattern()));
        }
    }

    public boolean remove(String id) {
        synchronized (lock) {
            StoredAntiPattern removed = antiPatterns.remove(id);
            if (removed == null) {
                return false;
            }
            unindex(removed.antiPattern());
            return true;
        }
    }

    /**
     * Remove expired anti-patterns.
     *
     * @return number of removed anti-patterns
     */
    public int purgeExpired() {
        int removed = 0;
        synchronized (lock) {
            Iterator<StoredAntiPattern> iterator = antiPatterns.values().iterator();
            while (iterator.hasNext()) {
                AntiPattern antiPattern = iterator.next().antiPattern();
                if (!isAntiPatternActive(antiPattern)) {
                    iterator.remove();
                    unindex(antiPattern);
                    removed++;
                    log.debug("expired anti-pattern removed, id={}", antiPattern.getId());
                }
            }
        }
        return removed;
    }

    public List<AntiPattern> getActiveAntiPatterns() {
        List<AntiPattern> active = new ArrayList<>();
        synchronized (lock) {
            for (StoredAntiPattern stored : antiPatterns.values()) {
                if (isAntiPatternActive(stored.antiPattern())) {
                    active.add(copy(stored.antiPattern()));
                }
            }
        }
        return active;
    }

    public List<AntiPattern> exportAntiPatterns() {
        List<AntiPattern> exported = new ArrayList<>();
        synchronized (lock) {
            for (StoredAntiPattern stored : antiPatterns.values()) {
                exported.add(copy(stored.antiPattern()));
            }
        }
        return exported;
    }

    /**
     * Load anti-patterns, skipping entries without id and already expired ones.
     *
     * @return number of imported anti-patterns
     */
    public int importAntiPatterns(Collection<AntiPattern> imported) {
        if (imported == null) {
            return 0;
        }
        int count = 0;
        synchronized (lock) {
            for (AntiPattern antiPattern : imported) {
                if (antiPattern == null || !StringUtils.hasText(antiPattern.getId()) || !isAntiPatternActive(antiPattern)) {
                    continue;
                }
                store(copy(antiPattern));
                count++;
            }
        }
        return count;
    }

    public int size() {
        synchronized (lock) {
            return antiPatterns.size();
        }
    }

    public void clear() {
        synchronized (lock) {
            antiPatterns.clear();
            index.clear();
        }
    }

    private AntiPattern buildAntiPattern(List<FailureRecord> failures, String sourcePatternId) {
        if (failures == null || failures.isEmpty()) {
            return null;
        }
        FailureCategory category = failures.get(0).getCategory() == null
            ? FailureCategory.UNKNOWN : failures.get(0).getCategory();
        List<FailureRecord> sameCategory = new ArrayList<>();
        for (FailureRecord failure : failures) {
            if ((failure.getCategory() == null ? FailureCategory.UNKNOWN : failure.getCategory()) == category) {
                sameCategory.add(failure);
            }
        }
        if (sameCategory.size() < failureProperties.getMinFailures()) {
            return null;
        }

        Set<String> domains = new LinkedHashSet<>();
        long lastFailure = 0;
        for (FailureRecord failure : sameCategory) {
            if (StringUtils.hasText(failure.getDomain())) {
                domains.add(failure.getDomain());
            }
            lastFailure = Math.max(lastFailure, failure.getTimestamp());
        }
        List<String> urlPatterns = new ArrayList<>();
        for (String domain : domains) {
            urlPatterns.add("^https?://(www\\.)?" + domain.replace(".", "\\."));
        }

        long suppressionDurationMs = suppressionDuration(category);
        long now = clock.millis();
        return AntiPattern.builder()
            .id("anti:" + (StringUtils.hasText(sourcePatternId) ? sourcePatternId : "unknown") + ":"
                + category.getValue() + ":" + now)
            .sourcePatternId(sourcePatternId)
            .domains(new ArrayList<>(domains))
            .urlPatterns(urlPatterns)
            .failureCategory(category)
            .reason(sameCategory.size() + " failures of type " + category.getValue() + " in " + String.join(", ", domains))
            .recommendedAction(RetryPolicies.getRetryStrategy(category))
            .suppressionDurationMs(suppressionDurationMs)
            .createdAt(now)
            .expiresAt(suppressionDurationMs > 0 ? now + suppressionDurationMs : 0)
            .failureCount(sameCategory.size())
            .lastFailure(lastFailure)
            .build();
    }

    private AntiPattern renew(AntiPattern current) {
        long now = clock.millis();
        return current.toBuilder()
            .failureCount(current.getFailureCount() + 1)
            .lastFailure(now)
            .expiresAt(current.getExpiresAt() > 0 ? now + current.getSuppressionDurationMs() : current.getExpiresAt())
            .build();
    }

    /**
     * Suffix the id with a sequence number when another rule already uses it. Caller holds the lock.
     */
    private String uniqueId(String id) {
        if (!antiPatterns.containsKey(id)) {
            return id;
        }
        int sequence = 2;
        while (antiPatterns.containsKey(id + "-" + sequence)) {
            sequence++;
        }
        return id + "-" + sequence;
    }

    private void logCreated(AntiPattern antiPattern) {
        log.info("anti-pattern created, id={}, category={}, domains={}, failureCount={}",
            antiPattern.getId(), antiPattern.getFailureCategory().getValue(), antiPattern.getDomains(),
            antiPattern.getFailureCount());
    }

    private void logUpdated(AntiPattern antiPattern, FailureRecord failure) {
        log.debug("anti-pattern updated, id={}, failureCount={}, expiresAt={}, failure={}",
            antiPattern.getId(), antiPattern.getFailureCount(), antiPattern.getExpiresAt(),
            failure == null ? "" : failure.getMessage());
    }

    private long suppressionDuration(FailureCategory category) {
        return switch (category) {
            case AUTH_REQUIRED -> failureProperties.getAuthSuppressionMs();
            case RATE_LIMITED -> failureProperties.getRateLimitSuppressionMs();
            default -> failureProperties.getDefaultSuppressionMs();
        };
    }

    private void store(AntiPattern antiPattern) {
        antiPatterns.put(antiPattern.getId(), new StoredAntiPattern(antiPattern, compile(antiPattern)));
        if (antiPattern.getFailureCategory() != null) {
            index.put(indexKey(antiPattern.getSourcePatternId(), antiPattern.getFailureCategory()), antiPattern.getId());
        }
    }

    private void unindex(AntiPattern antiPattern) {
        if (antiPattern.getFailureCategory() != null) {
            index.remove(indexKey(antiPattern.getSourcePatternId(), antiPattern.getFailureCategory()), antiPattern.getId());
        }
    }

    private static List<Pattern> compile(AntiPattern antiPattern) {
        List<Pattern> compiled = new ArrayList<>();
        if (antiPattern.getUrlPatterns() == null) {
            return compiled;
        }
        for (String regex : antiPattern.getUrlPatterns()) {
            if (regex == null) {
                continue;
            }
            try {
                compiled.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException ex) {
                log.warn("skip malformed anti-pattern regex, id={}, regex={}, error={}",
                    antiPattern.getId(), regex, ex.getDescription());
            }
        }
        return compiled;
    }

    private static String indexKey(String sourcePatternId, FailureCategory category) {
        return (sourcePatternId == null ? "" : sourcePatternId) + ":" + (category == null ? FailureCategory.UNKNOWN : category).getValue();
    }

    private static AntiPattern copy(AntiPattern antiPattern) {
        return antiPattern.toBuilder()
            .domains(antiPattern.getDomains() == null ? null : new ArrayList<>(antiPattern.getDomains()))
            .urlPatterns(antiPattern.getUrlPatterns() == null ? null : new ArrayList<>(antiPattern.getUrlPatterns()))
            .build();
    }

    private record StoredAntiPattern(AntiPattern antiPattern, List<Pattern> patterns) {

        boolean matches(String url) {
            for (Pattern pattern : patterns) {
                if (pattern.matcher(url).find()) {
                    return true;
                }
            }
            return false;
        }

    }

}
