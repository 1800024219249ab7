package io.github.adscache.core;

import java.util.Objects;

/**
 * Routing metadata handed to the durable store with every write: the account and date range
 * a cached payload belongs to, plus the namespace and TTL it was written with.
 *
 * <p>Dates are ISO-8601 {@code yyyy-MM-dd} strings, the form the advertising API uses.</p>
 */
public final class PartitionHints {

    /** Defaults applied when a payload carries no partition fields. */
    public static final PartitionHints DEFAULTS = new PartitionHints("0", "2023-01-01", "2023-12-31", null, null);

    private final String accountId;
    private final String startDate;
    private final String endDate;
    private final String prefix;
    private final Long ttlSeconds;

    private PartitionHints(String accountId, String startDate, String endDate, String prefix, Long ttlSeconds) {
        this.accountId = Objects.requireNonNull(accountId, "accountId");
        this.startDate = Objects.requireNonNull(startDate, "startDate");
        this.endDate = Objects.requireNonNull(endDate, "endDate");
        this.prefix = prefix;
        this.ttlSeconds = ttlSeconds;
    }

    public static PartitionHints of(String accountId, String startDate, String endDate) {
        return new PartitionHints(accountId, startDate, endDate, null, null);
    }

    /**
     * Returns a copy carrying the segmentation the store records alongside the payload.
     */
    public PartitionHints withSegmentation(String prefix, long ttlSeconds) {
        return new PartitionHints(accountId, startDate, endDate, prefix, ttlSeconds);
    }

    public String getAccountId() {
        return accountId;
    }

    public String getStartDate() {
        return startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    /**
     * Namespace of the key this entry was written under, if known.
     */
    public String getPrefix() {
        return prefix;
    }

    /**
     * TTL the entry was written with, if known.
     */
    public Long getTtlSeconds() {
        return ttlSeconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PartitionHints)) {
            return false;
        }
        PartitionHints that = (PartitionHints) o;
        return accountId.equals(that.accountId)
            && startDate.equals(that.startDate)
            && endDate.equals(that.endDate)
            && Objects.equals(prefix, that.prefix)
            && Objects.equals(ttlSeconds, that.ttlSeconds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountId, startDate, endDate, prefix, ttlSeconds);
    }

    @Override
    public String toString() {
        return "PartitionHints{account=" + accountId + ", range=" + startDate + ".." + endDate
            + (prefix != null ? ", prefix=" + prefix : "")
            + (ttlSeconds != null ? ", ttl=" + ttlSeconds + "s" : "") + "}";
    }
}
