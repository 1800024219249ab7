package io.github.adscache.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.adscache.core.CacheEventListener;
import io.github.adscache.core.CacheKeyGenerator;
import io.github.adscache.core.JdbcPersistentStore;
import io.github.adscache.core.PersistentStore;
import io.github.adscache.core.TieredCacheManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.AutoConfigureBefore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.interceptor.KeyGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Auto-configuration for the tiered cache.
 * Configures a PostgreSQL-backed {@link TieredCacheManager} when a DataSource is available,
 * or around any {@link PersistentStore} bean the application defines, and exposes it as the
 * Spring {@link CacheManager}.
 */
@Configuration
@ConditionalOnClass({ObjectMapper.class, CacheManager.class})
@ConditionalOnProperty(prefix = "adscache", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(AdsCacheProperties.class)
@AutoConfigureAfter(name = "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration")
@AutoConfigureBefore(name = "org.springframework.boot.autoconfigure.cache.CacheAutoConfiguration")
public class AdsCacheAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AdsCacheAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CacheKeyGenerator adsCacheKeyGenerator(ObjectProvider<ObjectMapper> objectMapper) {
        return new CacheKeyGenerator(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    /**
     * Create the PostgreSQL store if no other PersistentStore is defined.
     */
    @Bean
    @ConditionalOnMissingBean(PersistentStore.class)
    @ConditionalOnBean(DataSource.class)
    public JdbcPersistentStore adsCachePersistentStore(DataSource dataSource, AdsCacheProperties properties,
                                                       ObjectProvider<ObjectMapper> objectMapper) {
        logger.info("Auto-configuring JdbcPersistentStore with table: {}, auto-create: {}",
                   properties.getTableName(), properties.isAutoCreateTable());

        return JdbcPersistentStore.builder()
                .dataSource(dataSource)
                .objectMapper(objectMapper.getIfAvailable(ObjectMapper::new))
                .tableName(properties.getTableName())
                .autoCreateTable(properties.isAutoCreateTable())
                .defaultRetention(properties.getDefaultTtl())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(PersistentStore.class)
    public TieredCacheManager tieredCacheManager(PersistentStore store, AdsCacheProperties properties,
                                                 ObjectProvider<ObjectMapper> objectMapper,
                                                 ObjectProvider<CacheEventListener> listeners) {
        logger.info("Auto-configuring TieredCacheManager with default TTL: {}, store timeout: {}, background cleanup: {}",
                   properties.getDefaultTtl(), properties.getStoreTimeout(), properties.getBackgroundCleanup().isEnabled());

        TieredCacheManager.Builder builder = TieredCacheManager.builder()
                .store(store)
                .objectMapper(objectMapper.getIfAvailable(ObjectMapper::new))
                .defaultTtl(properties.getDefaultTtl())
                .storeTimeout(properties.getStoreTimeout())
                .defaultHints(properties.getDefaultHints().toPartitionHints())
                .enableBackgroundCleanup(properties.getBackgroundCleanup().isEnabled())
                .cleanupInterval(properties.getBackgroundCleanup().getInterval());
        listeners.orderedStream().forEach(builder::addEventListener);
        return builder.build();
    }

    /**
     * Expose the tiered cache as the Spring CacheManager if no other CacheManager is defined.
     */
    @Bean
    @ConditionalOnMissingBean(CacheManager.class)
    @ConditionalOnBean(TieredCacheManager.class)
    public AdsSpringCacheManager adsSpringCacheManager(TieredCacheManager tieredCacheManager,
                                                       CacheKeyGenerator keyGenerator,
                                                       AdsCacheProperties properties,
                                                       ObjectProvider<ObjectMapper> objectMapper) {
        AdsSpringCacheManager cacheManager = new AdsSpringCacheManager(tieredCacheManager, keyGenerator,
                objectMapper.getIfAvailable(ObjectMapper::new), properties.isAllowNullValues());

        properties.getCaches().forEach((cacheName, ttl) -> {
            logger.info("Configuring cache '{}' with TTL: {}", cacheName, ttl);
            cacheManager.setCacheTtl(cacheName, ttl);
        });
        return cacheManager;
    }

    /**
     * Makes {@code @Cacheable} methods with several arguments use {@link MethodArgumentsKeyGenerator},
     * unless the application configures caching itself.
     */
    @Bean
    @ConditionalOnMissingBean(CachingConfigurer.class)
    @ConditionalOnBean(AdsSpringCacheManager.class)
    public CachingConfigurer adsCachingConfigurer() {
        KeyGenerator keyGenerator = new MethodArgumentsKeyGenerator();
        return new CachingConfigurer() {
            @Override
            public KeyGenerator keyGenerator() {
                return keyGenerator;
            }
        };
    }
}
