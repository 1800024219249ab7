package io.github.adscache.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Configuration class imported by {@link EnableAdsCache}.
 */
@Configuration
@Import(AdsCacheAutoConfiguration.class)
public class AdsCacheConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AdsCacheConfiguration.class);

    public AdsCacheConfiguration() {
        logger.info("Tiered cache Spring integration enabled");
    }
}
