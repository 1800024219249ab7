package io.github.adscache.core;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.sql.DataSource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PersistentStore} on a PostgreSQL table partitioned by account and date range.
 *
 * <p>Each row keeps the cache key, the partition columns, a JSONB segmentation
 * ({@code {"prefix": ..., "ttl": ...}}), the JSONB payload and its own {@code expires_at}.
 * Rows past {@code expires_at} read as absent and are removed by {@link #cleanupExpired()}.</p>
 *
 * <p>This implementation is thread-safe. Connections are obtained per operation with a short
 * retry for transient failures; statements carry a query timeout.</p>
 */
public class JdbcPersistentStore implements PersistentStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcPersistentStore.class);

    public static final String DEFAULT_TABLE_NAME = "account_kpi_cache";
    private static final Pattern TABLE_NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    // Connection retry configuration
    private static final int MAX_RETRY_ATTEMPTS = 3;
    private static final int RETRY_DELAY_MS = 100;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final String tableName;
    private final Duration defaultRetention;
    private final int queryTimeoutSeconds;

    // Thread-safe initialization flag using double-checked locking pattern
    private volatile boolean tableInitialized = false;

    private final String upsertSql;
    private final String selectSql;
    private final String deleteAllSql;
    private final String deleteExpiredSql;
    private final String countSql;

    private JdbcPersistentStore(Builder builder) {
        this.dataSource = builder.dataSource;
        this.objectMapper = builder.objectMapper;
        this.tableName = builder.tableName;
        this.defaultRetention = builder.defaultRetention;
        this.queryTimeoutSeconds = builder.queryTimeoutSeconds;

        this.upsertSql = "INSERT INTO " + tableName +
            " (cache_key, account_id, start_date, end_date, segmentation, kpi_data, created_at, expires_at) " +
            "VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, now(), now() + (? * interval '1 second')) " +
            "ON CONFLICT (cache_key) DO UPDATE SET " +
            "account_id = EXCLUDED.account_id, " +
            "start_date = EXCLUDED.start_date, " +
            "end_date = EXCLUDED.end_date, " +
            "segmentation = EXCLUDED.segmentation, " +
            "kpi_data = EXCLUDED.kpi_data, " +
            "created_at = EXCLUDED.created_at, " +
            "expires_at = EXCLUDED.expires_at";
        this.selectSql = "SELECT kpi_data FROM " + tableName + " WHERE cache_key = ? AND expires_at > now()";
        this.deleteAllSql = "DELETE FROM " + tableName;
        this.deleteExpiredSql = "DELETE FROM " + tableName + " WHERE expires_at <= now()";
        this.countSql = "SELECT COUNT(*) FROM " + tableName + " WHERE expires_at > now()";

        if (builder.autoCreateTable) {
            initializeTable();
        }
    }

    /**
     * Initializes the cache table in the database if it doesn't exist.
     * Uses double-checked locking pattern for thread safety.
     */
    private void initializeTable() {
        if (!tableInitialized) {
            synchronized (this) {
                if (!tableInitialized) {
                    performTableInitialization();
                    tableInitialized = true;
                }
            }
        }
    }

    private void performTableInitialization() {
        try (Connection conn = openConnection();
             Statement stmt = conn.createStatement()) {

            boolean tableExists;
            try (ResultSet rs = conn.getMetaData().getTables(null, null, tableName, new String[] {"TABLE"})) {
                tableExists = rs.next();
            }

            stmt.execute("CREATE TABLE IF NOT EXISTS " + tableName + " (" +
                "  cache_key TEXT PRIMARY KEY, " +
                "  account_id TEXT NOT NULL, " +
                "  start_date TEXT NOT NULL, " +
                "  end_date TEXT NOT NULL, " +
                "  segmentation JSONB, " +
                "  kpi_data JSONB NOT NULL, " +
                "  created_at TIMESTAMP NOT NULL DEFAULT now(), " +
                "  expires_at TIMESTAMP NOT NULL" +
                ")");
            stmt.execute("CREATE INDEX IF NOT EXISTS " + tableName + "_account_idx ON " + tableName + " (account_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS " + tableName + "_dates_idx ON " + tableName + " (start_date, end_date)");
            stmt.execute("CREATE INDEX IF NOT EXISTS " + tableName + "_expires_idx ON " + tableName + " (expires_at)");

            if (!tableExists) {
                logger.info("Table '{}' was created successfully", tableName);
            } else {
                logger.debug("Table '{}' already exists, skipping creation", tableName);
            }
        } catch (SQLException | StoreException e) {
            logger.error("Failed to initialize cache table '{}'", tableName, e);
            throw new AdsCacheException("Failed to initialize cache table " + tableName, e);
        }
    }

    /**
     * Checks if the table exists in the database.
     */
    public boolean tableExists() throws StoreException {
        try (Connection conn = openConnection();
             ResultSet tables = conn.getMetaData().getTables(null, null, tableName, new String[] {"TABLE"})) {
            return tables.next();
        } catch (SQLException e) {
            throw translate("Failed to check if table exists", e);
        }
    }

    @Override
    public Optional<String> getByKey(String key) throws StoreException {
        try (Connection conn = openConnection();
             PreparedStatement stmt = conn.prepareStatement(selectSql)) {

            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.setString(1, key);

            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.ofNullable(rs.getString(1));
            }
        } catch (SQLException e) {
            throw translate("Failed to read cache entry " + key, e);
        }
    }

    @Override
    public void put(String key, PartitionHints hints, String serializedValue) throws StoreException {
        long ttlSeconds = hints.getTtlSeconds() != null ? hints.getTtlSeconds() : defaultRetention.getSeconds();

        String segmentation;
        try {
            Map<String, Object> segments = new LinkedHashMap<>();
            segments.put("prefix", hints.getPrefix() != null ? hints.getPrefix() : CacheKeyGenerator.namespaceOf(key));
            segments.put("ttl", ttlSeconds);
            segmentation = objectMapper.writeValueAsString(segments);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize segmentation for " + key, e);
        }

        try (Connection conn = openConnection();
             PreparedStatement stmt = conn.prepareStatement(upsertSql)) {

            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.setString(1, key);
            stmt.setString(2, hints.getAccountId());
            stmt.setString(3, hints.getStartDate());
            stmt.setString(4, hints.getEndDate());
            stmt.setString(5, segmentation);
            stmt.setString(6, serializedValue);
            stmt.setLong(7, ttlSeconds);

            stmt.executeUpdate();
        } catch (SQLException e) {
            throw translate("Failed to store cache entry " + key, e);
        }
    }

    @Override
    public void clearAll() throws StoreException {
        try (Connection conn = openConnection();
             Statement stmt = conn.createStatement()) {

            stmt.setQueryTimeout(queryTimeoutSeconds);
            int deleted = stmt.executeUpdate(deleteAllSql);
            logger.info("Deleted {} rows from '{}'", deleted, tableName);
        } catch (SQLException e) {
            throw translate("Failed to clear cache table", e);
        }
    }

    /**
     * Removes all rows past their {@code expires_at}.
     *
     * @return the number of expired rows that were removed
     */
    @Override
    public int cleanupExpired() throws StoreException {
        try (Connection conn = openConnection();
             Statement stmt = conn.createStatement()) {

            stmt.setQueryTimeout(queryTimeoutSeconds);
            int deletedCount = stmt.executeUpdate(deleteExpiredSql);

            if (deletedCount > 0) {
                logger.info("Cleaned up {} expired rows from '{}'", deletedCount, tableName);
            } else {
                logger.debug("No expired rows found in '{}' during cleanup", tableName);
            }
            return deletedCount;
        } catch (SQLException e) {
            throw translate("Failed to cleanup expired cache entries", e);
        }
    }

    @Override
    public long size() throws StoreException {
        try (Connection conn = openConnection();
             Statement stmt = conn.createStatement()) {

            stmt.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rs = stmt.executeQuery(countSql)) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw translate("Failed to count cache entries", e);
        }
    }

    public String getTableName() {
        return tableName;
    }

    /**
     * Gets a connection from the DataSource with retry logic for transient failures.
     *
     * @throws StoreUnavailableException if no connection could be obtained after retries
     */
    private Connection openConnection() throws StoreUnavailableException {
        SQLException lastException = null;

        for (int attempt = 1; attempt <= MAX_RETRY_ATTEMPTS; attempt++) {
            try {
                return dataSource.getConnection();
            } catch (SQLException e) {
                lastException = e;
                logger.warn("Connection attempt {} failed: {}", attempt, e.getMessage());

                if (attempt < MAX_RETRY_ATTEMPTS) {
                    try {
                        Thread.sleep((long) RETRY_DELAY_MS * attempt);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new StoreUnavailableException("Connection retry interrupted", ie);
                    }
                }
            }
        }

        throw new StoreUnavailableException("Failed to obtain connection after " + MAX_RETRY_ATTEMPTS + " attempts", lastException);
    }

    // SQLState class 08 = connection exception
    private static StoreException translate(String message, SQLException e) {
        String state = e.getSQLState();
        if (e instanceof SQLTransientConnectionException
            || e instanceof SQLNonTransientConnectionException
            || (state != null && state.startsWith("08"))) {
            return new StoreUnavailableException(message, e);
        }
        return new StoreException(message, e);
    }

    /**
     * Creates a builder for JdbcPersistentStore.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for JdbcPersistentStore.
     */
    public static class Builder {
        private DataSource dataSource;
        private ObjectMapper objectMapper = new ObjectMapper();
        private String tableName = DEFAULT_TABLE_NAME;
        private boolean autoCreateTable = true;
        private Duration defaultRetention = Duration.ofHours(1);
        private int queryTimeoutSeconds = 5;

        private Builder() {
        }

        /**
         * Sets the data source.
         *
         * @param dataSource the PostgreSQL data source
         * @return this builder
         */
        public Builder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Sets the table name; must be a plain SQL identifier.
         */
        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        /**
         * Sets whether to automatically create the cache table if it doesn't exist.
         */
        public Builder autoCreateTable(boolean autoCreateTable) {
            this.autoCreateTable = autoCreateTable;
            return this;
        }

        /**
         * Sets the row retention used when a write carries no TTL in its partition hints.
         */
        public Builder defaultRetention(Duration defaultRetention) {
            this.defaultRetention = defaultRetention;
            return this;
        }

        /**
         * Sets the JDBC query timeout applied to every statement.
         */
        public Builder queryTimeoutSeconds(int queryTimeoutSeconds) {
            this.queryTimeoutSeconds = queryTimeoutSeconds;
            return this;
        }

        /**
         * Builds a new JdbcPersistentStore instance.
         *
         * @throws IllegalStateException if dataSource is not set or the table name is not a plain identifier
         * @throws AdsCacheException if auto table creation fails
         */
        public JdbcPersistentStore build() {
            if (dataSource == null) {
                throw new IllegalStateException("DataSource must be set");
            }
            if (tableName == null || !TABLE_NAME_PATTERN.matcher(tableName).matches()) {
                throw new IllegalStateException("Invalid table name: " + tableName);
            }
            if (defaultRetention == null || defaultRetention.isNegative() || defaultRetention.isZero()) {
                throw new IllegalStateException("defaultRetention must be positive");
            }
            if (queryTimeoutSeconds < 0) {
                throw new IllegalStateException("queryTimeoutSeconds cannot be negative");
            }
            if (objectMapper == null) {
                objectMapper = new ObjectMapper();
            }
            return new JdbcPersistentStore(this);
        }
    }
}
