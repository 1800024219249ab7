package io.github.adscache.core;

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of {@link TieredCacheManager#lookup(String)}.
 *
 * <p>Separates a genuine miss from a miss caused by a failing durable store, which a plain
 * {@code Optional} would conflate.</p>
 */
public final class CacheLookup {

    public enum Outcome {
        /** Live entry found in the in-process tier. */
        FAST_HIT,
        /** Found in the durable store; the fast tier was back-filled. */
        DURABLE_HIT,
        /** Absent from both tiers. */
        MISS,
        /** Absent from the fast tier and the durable store failed or timed out. */
        DURABLE_FAILURE
    }

    private static final CacheLookup MISS = new CacheLookup(Outcome.MISS, null, null);

    private final Outcome outcome;
    private final JsonNode value;
    private final Throwable failure;

    private CacheLookup(Outcome outcome, JsonNode value, Throwable failure) {
        this.outcome = outcome;
        this.value = value;
        this.failure = failure;
    }

    static CacheLookup fastHit(JsonNode value) {
        return new CacheLookup(Outcome.FAST_HIT, Objects.requireNonNull(value), null);
    }

    static CacheLookup durableHit(JsonNode value) {
        return new CacheLookup(Outcome.DURABLE_HIT, Objects.requireNonNull(value), null);
    }

    static CacheLookup miss() {
        return MISS;
    }

    static CacheLookup durableFailure(Throwable failure) {
        return new CacheLookup(Outcome.DURABLE_FAILURE, null, failure);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isHit() {
        return outcome == Outcome.FAST_HIT || outcome == Outcome.DURABLE_HIT;
    }

    /**
     * The cached value; empty for {@link Outcome#MISS} and {@link Outcome#DURABLE_FAILURE}.
     * A cached JSON {@code null} is present as a {@code NullNode}.
     */
    public Optional<JsonNode> value() {
        return Optional.ofNullable(value);
    }

    /**
     * The durable-store failure, present only for {@link Outcome#DURABLE_FAILURE}.
     */
    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return "CacheLookup{" + outcome + (failure != null ? ", failure=" + failure.getMessage() : "") + "}";
    }
}
