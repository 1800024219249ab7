package io.github.adscache.core;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A request for time-ranged metrics of one account.
 *
 * <p>The account id is normalized by stripping dashes ({@code 123-456-7890} and
 * {@code 1234567890} are the same account). Filters are the query-specific parameters that
 * take part in the cache key, for example {@code campaign_id}.</p>
 */
public final class MetricsQuery {
    private static final Set<String> RESERVED_PARAMETERS = Set.of("customer_id", "start_date", "end_date");

    private final String namespace;
    private final String accountId;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final Map<String, Object> filters;

    private MetricsQuery(Builder builder) {
        this.namespace = builder.namespace;
        this.accountId = builder.accountId;
        this.startDate = builder.startDate;
        this.endDate = builder.endDate;
        this.filters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.filters));
    }

    public String getNamespace() {
        return namespace;
    }

    public String getAccountId() {
        return accountId;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public Map<String, Object> getFilters() {
        return filters;
    }

    /**
     * Parameters hashed into the cache key: account, ISO dates and filters.
     */
    public Map<String, Object> toKeyParameters() {
        Map<String, Object> params = new LinkedHashMap<>(filters);
        params.put("customer_id", accountId);
        params.put("start_date", startDate.toString());
        params.put("end_date", endDate.toString());
        return params;
    }

    public PartitionHints toPartitionHints() {
        return PartitionHints.of(accountId, startDate.toString(), endDate.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MetricsQuery)) {
            return false;
        }
        MetricsQuery that = (MetricsQuery) o;
        return namespace.equals(that.namespace)
            && accountId.equals(that.accountId)
            && startDate.equals(that.startDate)
            && endDate.equals(that.endDate)
            && filters.equals(that.filters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, accountId, startDate, endDate, filters);
    }

    @Override
    public String toString() {
        return "MetricsQuery{" +
            "namespace='" + namespace + '\'' +
            ", accountId='" + accountId + '\'' +
            ", startDate=" + startDate +
            ", endDate=" + endDate +
            ", filters=" + filters +
            '}';
    }

    public static Builder builder(String namespace) {
        return new Builder(namespace);
    }

    public static class Builder {
        private final String namespace;
        private String accountId;
        private LocalDate startDate;
        private LocalDate endDate;
        private final Map<String, Object> filters = new LinkedHashMap<>();

        private Builder(String namespace) {
            this.namespace = namespace;
        }

        public Builder accountId(String accountId) {
            this.accountId = accountId;
            return this;
        }

        public Builder dateRange(LocalDate startDate, LocalDate endDate) {
            this.startDate = startDate;
            this.endDate = endDate;
            return this;
        }

        /**
         * @throws InvalidParameterException if the name is empty or one of {@code customer_id},
         *                                   {@code start_date}, {@code end_date}
         */
        public Builder filter(String name, Object value) {
            if (name == null || name.isEmpty()) {
                throw new InvalidParameterException("Filter name cannot be null or empty");
            }
            if (RESERVED_PARAMETERS.contains(name)) {
                throw new InvalidParameterException("Filter name '" + name + "' is reserved for the query itself");
            }
            this.filters.put(name, value);
            return this;
        }

        /**
         * @throws InvalidParameterException if the namespace or account is empty, a date is
         *                                   missing, or the range ends before it starts
         */
        public MetricsQuery build() {
            if (namespace == null || namespace.isEmpty()) {
                throw new InvalidParameterException("Query namespace cannot be null or empty");
            }
            if (accountId == null) {
                throw new InvalidParameterException("Account id must be set");
            }
            accountId = accountId.replace("-", "").trim();
            if (accountId.isEmpty()) {
                throw new InvalidParameterException("Account id cannot be empty");
            }
            if (startDate == null || endDate == null) {
                throw new InvalidParameterException("Date range must be set");
            }
            if (endDate.isBefore(startDate)) {
                throw new InvalidParameterException("End date " + endDate + " is before start date " + startDate);
            }
            return new MetricsQuery(this);
        }
    }
}
