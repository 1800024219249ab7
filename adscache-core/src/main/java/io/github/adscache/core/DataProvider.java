package io.github.adscache.core;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Upstream source of account metrics, typically the advertising API client.
 */
@FunctionalInterface
public interface DataProvider {

    /**
     * Fetches metrics for a query.
     *
     * @throws DataProviderException if the upstream call fails
     */
    JsonNode fetch(MetricsQuery query);
}
