package fun.fengwk.afe.core.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.afe.core.service.cache.AdaptiveCache;
import fun.fengwk.afe.core.service.cache.AdaptiveContentCache;
import fun.fengwk.afe.core.service.cache.AdaptiveTtlCalculator;
import fun.fengwk.afe.core.service.cache.CacheProperties;
import fun.fengwk.afe.core.service.cache.VolatilityTracker;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;

import java.time.Clock;

/**
 * Wires the adaptive fetch engine.
 *
 * @author fengwk
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ComponentScan(basePackages = "fun.fengwk.afe.core.service")
public class AdaptiveFetchAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock afeClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    /**
     * Page content cache.
     */
    @Bean(name = "adaptivePageCache")
    public AdaptiveContentCache adaptivePageCache(AdaptiveTtlCalculator adaptiveTtlCalculator,
                                                  VolatilityTracker volatilityTracker,
                                                  CacheProperties cacheProperties,
                                                  Clock clock) {
        return new AdaptiveContentCache(adaptiveTtlCalculator, volatilityTracker, clock,
            cacheProperties.getPageCacheMaxEntries());
    }

    /**
     * Api response cache.
     */
    @Bean(name = "adaptiveApiCache")
    public AdaptiveCache<Object> adaptiveApiCache(AdaptiveTtlCalculator adaptiveTtlCalculator,
                                                  CacheProperties cacheProperties,
                                                  Clock clock) {
        return new AdaptiveCache<>(adaptiveTtlCalculator, clock, cacheProperties.getApiCacheMaxEntries());
    }

}
