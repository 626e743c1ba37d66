package fun.fengwk.afe.core.service.cache.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * @author fengwk
 */
@Value
@Builder
public class DomainVolatilityStats {

    int urlCount;
    double avgChangeRate;
    List<PathChangeRate> mostVolatilePaths;

    public record PathChangeRate(String path, double changeRate) {
    }

}
