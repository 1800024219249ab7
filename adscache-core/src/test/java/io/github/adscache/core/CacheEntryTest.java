package io.github.adscache.core;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CacheEntryTest {

    private final Instant expiresAt = Instant.parse("2024-06-01T12:00:00Z");
    private final CacheEntry entry = new CacheEntry(TextNode.valueOf("v"), expiresAt);

    @Test
    void testNotExpiredBeforeDeadline() {
        assertFalse(entry.isExpired(expiresAt.minusSeconds(1)));
    }

    @Test
    void testNotExpiredExactlyAtDeadline() {
        assertFalse(entry.isExpired(expiresAt));
    }

    @Test
    void testExpiredAfterDeadline() {
        assertTrue(entry.isExpired(expiresAt.plusMillis(1)));
    }

    @Test
    void testRemainingTtl() {
        assertEquals(Duration.ofSeconds(30), entry.remainingTtl(expiresAt.minusSeconds(30)));
        assertEquals(Duration.ZERO, entry.remainingTtl(expiresAt.plusSeconds(5)));
    }
}
