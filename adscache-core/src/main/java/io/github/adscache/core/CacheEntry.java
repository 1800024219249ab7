package io.github.adscache.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A fast-tier value with its absolute expiration time. Immutable; the manager never hands
 * the wrapped tree to callers without copying it.
 */
public final class CacheEntry {
    private final JsonNode value;
    private final Instant expiresAt;

    public CacheEntry(JsonNode value, Instant expiresAt) {
        this.value = Objects.requireNonNull(value, "value");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public JsonNode getValue() {
        return value;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * An entry is dead strictly after its expiration instant.
     */
    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public Duration remainingTtl(Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    @Override
    public String toString() {
        return "CacheEntry{expiresAt=" + expiresAt + "}";
    }
}
