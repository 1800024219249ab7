package io.github.adscache.spring;

import io.github.adscache.core.TieredCacheManager;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link AdsCacheHealthIndicator} when Spring Boot Actuator is on the classpath.
 */
@Configuration
@ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
@ConditionalOnBean(TieredCacheManager.class)
@AutoConfigureAfter(AdsCacheAutoConfiguration.class)
public class AdsCacheHealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "adsCacheHealthIndicator")
    public AdsCacheHealthIndicator adsCacheHealthIndicator(TieredCacheManager tieredCacheManager) {
        return new AdsCacheHealthIndicator(tieredCacheManager);
    }
}
