package io.github.adscache.core;

import java.time.Duration;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads partition hints out of a cached payload.
 *
 * <p>Object payloads are searched for {@code account_id}/{@code accountId},
 * {@code start_date}/{@code startDate} and {@code end_date}/{@code endDate}; any field that is
 * absent, null or the payload not being an object falls back to the configured defaults.</p>
 */
public class PartitionHintsResolver {

    private final PartitionHints defaults;

    public PartitionHintsResolver() {
        this(PartitionHints.DEFAULTS);
    }

    public PartitionHintsResolver(PartitionHints defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public PartitionHints getDefaults() {
        return defaults;
    }

    public PartitionHints resolve(String key, JsonNode value, Duration ttl) {
        String accountId = defaults.getAccountId();
        String startDate = defaults.getStartDate();
        String endDate = defaults.getEndDate();

        if (value != null && value.isObject()) {
            accountId = field(value, "account_id", "accountId", accountId);
            startDate = field(value, "start_date", "startDate", startDate);
            endDate = field(value, "end_date", "endDate", endDate);
        }

        return PartitionHints.of(accountId, startDate, endDate)
            .withSegmentation(CacheKeyGenerator.namespaceOf(key), ttl.getSeconds());
    }

    private static String field(JsonNode value, String snakeName, String camelName, String fallback) {
        JsonNode node = value.get(snakeName);
        if (node == null || node.isNull()) {
            node = value.get(camelName);
        }
        if (node == null || node.isNull() || node.isContainerNode()) {
            return fallback;
        }
        return node.asText();
    }
}
