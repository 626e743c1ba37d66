package fun.fengwk.afe.core.configuration;

import fun.fengwk.afe.core.service.cache.AdaptiveContentCache;
import fun.fengwk.afe.core.service.cache.CacheProperties;
import fun.fengwk.afe.core.service.failure.FailureLearningService;
import fun.fengwk.afe.core.service.fetch.FetchProperties;
import fun.fengwk.afe.core.service.fetch.TieredFetchService;
import fun.fengwk.afe.core.service.state.StateProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class AdaptiveFetchAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            ConfigurationPropertiesAutoConfiguration.class,
            JacksonAutoConfiguration.class,
            AdaptiveFetchAutoConfiguration.class
        ));

    @Test
    public void shouldWireEngineServices() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(TieredFetchService.class);
            assertThat(context).hasSingleBean(FailureLearningService.class);
            assertThat(context).hasSingleBean(AdaptiveContentCache.class);
            assertThat(context).hasBean("adaptiveApiCache");
            assertThat(context).hasSingleBean(Clock.class);

            TieredFetchService tieredFetchService = context.getBean(TieredFetchService.class);
            assertThat(tieredFetchService.isFullRenderAvailable()).isFalse();
            assertThat(context.getBean(StateProperties.class).isPersistenceEnabled()).isFalse();
        });
    }

    @Test
    public void shouldBindProperties() {
        contextRunner
            .withPropertyValues(
                "afe.fetch.min-content-length=50",
                "afe.fetch.full-render-enabled=false",
                "afe.cache.page-cache-max-entries=7"
            )
            .run(context -> {
                assertThat(context.getBean(FetchProperties.class).getMinContentLength()).isEqualTo(50);
                assertThat(context.getBean(FetchProperties.class).isFullRenderEnabled()).isFalse();
                assertThat(context.getBean(CacheProperties.class).getPageCacheMaxEntries()).isEqualTo(7);
            });
    }

    @Test
    public void shouldBackOffWhenClockIsProvided() {
        Clock fixed = Clock.fixed(Instant.ofEpochMilli(1_000L), ZoneOffset.UTC);

        contextRunner
            .withBean(Clock.class, () -> fixed)
            .run(context -> assertThat(context.getBean(Clock.class)).isSameAs(fixed));
    }

}
