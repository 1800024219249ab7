package io.github.adscache.spring;

import io.github.adscache.core.TieredCacheManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for tiered cache Micrometer metrics.
 * Binds cache metrics when Micrometer is on the classpath.
 */
@Configuration
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean(TieredCacheManager.class)
@AutoConfigureAfter(value = AdsCacheAutoConfiguration.class,
        name = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
public class AdsCacheMetricsAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AdsCacheMetricsAutoConfiguration.class);

    @Bean
    public MeterBinder adsCacheMetricsBinder(TieredCacheManager cacheManager) {
        logger.info("Tiered cache metrics enabled");
        return new AdsCacheMetrics(cacheManager);
    }
}
