package io.github.adscache.spring;

import io.github.adscache.core.JdbcPersistentStore;
import io.github.adscache.core.PartitionHints;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the tiered cache.
 * Supports YAML/Properties configuration via application.yml or application.properties.
 */
@ConfigurationProperties(prefix = "adscache")
public class AdsCacheProperties {

    /**
     * Whether the tiered cache is enabled.
     */
    private boolean enabled = true;

    /**
     * Default TTL for cache entries and for entries back-filled from the durable store.
     */
    private Duration defaultTtl = Duration.ofHours(1);

    /**
     * Upper bound on a single durable-store call before it counts as a failure.
     */
    private Duration storeTimeout = Duration.ofSeconds(2);

    /**
     * Table backing the durable store.
     */
    private String tableName = JdbcPersistentStore.DEFAULT_TABLE_NAME;

    /**
     * Whether to create the durable table and its indexes on startup.
     */
    private boolean autoCreateTable = true;

    /**
     * Whether Spring caches may hold null values.
     */
    private boolean allowNullValues = true;

    /**
     * Partition hints used when a cached payload carries none.
     */
    private DefaultHints defaultHints = new DefaultHints();

    /**
     * Background cleanup configuration.
     */
    private BackgroundCleanup backgroundCleanup = new BackgroundCleanup();

    /**
     * Per-cache TTL overrides, keyed by Spring cache name.
     */
    private Map<String, Duration> caches = new HashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public Duration getStoreTimeout() {
        return storeTimeout;
    }

    public void setStoreTimeout(Duration storeTimeout) {
        this.storeTimeout = storeTimeout;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public boolean isAutoCreateTable() {
        return autoCreateTable;
    }

    public void setAutoCreateTable(boolean autoCreateTable) {
        this.autoCreateTable = autoCreateTable;
    }

    public boolean isAllowNullValues() {
        return allowNullValues;
    }

    public void setAllowNullValues(boolean allowNullValues) {
        this.allowNullValues = allowNullValues;
    }

    public DefaultHints getDefaultHints() {
        return defaultHints;
    }

    public void setDefaultHints(DefaultHints defaultHints) {
        this.defaultHints = defaultHints;
    }

    public BackgroundCleanup getBackgroundCleanup() {
        return backgroundCleanup;
    }

    public void setBackgroundCleanup(BackgroundCleanup backgroundCleanup) {
        this.backgroundCleanup = backgroundCleanup;
    }

    public Map<String, Duration> getCaches() {
        return caches;
    }

    public void setCaches(Map<String, Duration> caches) {
        this.caches = caches;
    }

    /**
     * Default account and date range for the durable store's partition columns.
     */
    public static class DefaultHints {

        private String accountId = PartitionHints.DEFAULTS.getAccountId();

        private String startDate = PartitionHints.DEFAULTS.getStartDate();

        private String endDate = PartitionHints.DEFAULTS.getEndDate();

        public String getAccountId() {
            return accountId;
        }

        public void setAccountId(String accountId) {
            this.accountId = accountId;
        }

        public String getStartDate() {
            return startDate;
        }

        public void setStartDate(String startDate) {
            this.startDate = startDate;
        }

        public String getEndDate() {
            return endDate;
        }

        public void setEndDate(String endDate) {
            this.endDate = endDate;
        }

        public PartitionHints toPartitionHints() {
            return PartitionHints.of(accountId, startDate, endDate);
        }
    }

    /**
     * Background cleanup configuration.
     */
    public static class BackgroundCleanup {

        /**
         * Whether background cleanup is enabled.
         */
        private boolean enabled = false;

        /**
         * Interval between background cleanup runs.
         */
        private Duration interval = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }
}
