package fun.fengwk.afe.core.service.state;

import fun.fengwk.afe.core.service.cache.VolatilityTracker;
import fun.fengwk.afe.core.service.failure.AntiPatternRegistry;
import fun.fengwk.afe.core.service.fetch.DomainPreferenceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;

/**
 * Exports and restores learned state: domain preferences, anti-patterns and volatility records.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LearningStateService {

    private final DomainPreferenceStore domainPreferenceStore;
    private final AntiPatternRegistry antiPatternRegistry;
    private final VolatilityTracker volatilityTracker;
    private final Clock clock;

    public LearningStateSnapshot exportState() {
        return LearningStateSnapshot.builder()
            .exportedAt(clock.millis())
            .preferences(new ArrayList<>(domainPreferenceStore.exportPreferences()))
            .antiPatterns(new ArrayList<>(antiPatternRegistry.exportAntiPatterns()))
            .volatilityRecords(new ArrayList<>(volatilityTracker.exportRecords()))
            .build();
    }

    /**
     * Merge a snapshot into the live stores. Expired anti-patterns are dropped.
     */
    public void restoreState(LearningStateSnapshot snapshot) {
        if (snapshot == null) {
            return;
        }
        if (snapshot.getVersion() > LearningStateSnapshot.CURRENT_VERSION) {
            throw new IllegalArgumentException("unsupported learning state version: " + snapshot.getVersion());
        }
        int preferences = domainPreferenceStore.importPreferences(snapshot.getPreferences());
        int antiPatterns = antiPatternRegistry.importAntiPatterns(snapshot.getAntiPatterns());
        volatilityTracker.importRecords(snapshot.getVolatilityRecords());
        log.info("learning state restored, preferences={}, antiPatterns={}, volatilityRecords={}",
            preferences, antiPatterns, volatilityTracker.size());
    }

}
