package fun.fengwk.afe.core.service.state;

import fun.fengwk.afe.core.service.cache.model.VolatilityRecord;
import fun.fengwk.afe.core.service.failure.model.AntiPattern;
import fun.fengwk.afe.core.service.fetch.model.DomainPreference;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain snapshot of everything the engine learned.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearningStateSnapshot {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    private int version = CURRENT_VERSION;

    private long exportedAt;

    @Builder.Default
    private List<DomainPreference> preferences = new ArrayList<>();

    @Builder.Default
    private List<AntiPattern> antiPatterns = new ArrayList<>();

    @Builder.Default
    private List<VolatilityRecord> volatilityRecords = new ArrayList<>();

}
