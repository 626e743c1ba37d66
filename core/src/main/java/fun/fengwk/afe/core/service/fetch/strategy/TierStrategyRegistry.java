package fun.fengwk.afe.core.service.fetch.strategy;

import fun.fengwk.afe.core.service.fetch.model.RenderTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tier strategies known to the cascade, at most one per tier.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class TierStrategyRegistry {

    private final Map<RenderTier, TierStrategy> strategies;

    @Autowired
    public TierStrategyRegistry(ObjectProvider<TierStrategy> strategyProvider) {
        this(strategyProvider.orderedStream().toList());
    }

    public TierStrategyRegistry(List<TierStrategy> strategies) {
        Map<RenderTier, TierStrategy> byTier = new EnumMap<>(RenderTier.class);
        for (TierStrategy strategy : strategies) {
            TierStrategy previous = byTier.putIfAbsent(strategy.tier(), strategy);
            if (previous != null) {
                log.warn("duplicate tier strategy ignored, tier={}, kept={}, ignored={}",
                    strategy.tier().getValue(), previous.getClass().getName(), strategy.getClass().getName());
            }
        }
        this.strategies = Collections.unmodifiableMap(byTier);
        log.info("tier strategies registered, tiers={}", byTier.keySet());
    }

    public Optional<TierStrategy> get(RenderTier tier) {
        return Optional.ofNullable(strategies.get(tier));
    }

    /**
     * True when a strategy for the tier is registered and reports itself available.
     */
    public boolean isAvailable(RenderTier tier) {
        TierStrategy strategy = strategies.get(tier);
        return strategy != null && strategy.isAvailable();
    }

}
