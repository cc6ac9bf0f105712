package com.flagship.pocket_ledger.price;

import com.flagship.pocket_ledger.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TtlCacheTest {

    private MutableClock clock;
    private TtlCache<String, String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        cache = new TtlCache<>(clock, Duration.ofMinutes(15));
    }

    @Test
    @DisplayName("Entries are visible until the TTL elapses")
    void visibleWithinTtl() {
        cache.put("VOO", "480");
        clock.advance(Duration.ofMinutes(14).plusSeconds(59));

        assertEquals("480", cache.get("VOO").orElseThrow());
    }

    @Test
    @DisplayName("Entries expire exactly at the TTL")
    void expiresAtTtl() {
        cache.put("VOO", "480");
        clock.advance(Duration.ofMinutes(15));

        assertTrue(cache.get("VOO").isEmpty());
    }

    @Test
    @DisplayName("Expired entries are evicted even when never read again")
    void evictsUnreadExpiredEntries() {
        TtlCache<String, String> large = new TtlCache<>(clock, Duration.ofMinutes(15), 20_000);
        for (int i = 0; i < 10_000; i++) {
            large.put("SYM" + i, "1");
        }
        clock.advance(Duration.ofDays(1));
        large.put("VOO", "480");

        assertEquals(1, large.size());
        assertEquals("480", large.get("VOO").orElseThrow());
    }

    @Test
    @DisplayName("Size is bounded by the maximum entry count")
    void boundedBySize() {
        TtlCache<String, String> small = new TtlCache<>(clock, Duration.ofMinutes(15), 10);
        for (int i = 0; i < 100; i++) {
            small.put("SYM" + i, "1");
        }

        assertTrue(small.size() <= 10);
    }

    @Test
    @DisplayName("Explicit write time is honored")
    void explicitWriteTime() {
        cache.put("VOO", "480", clock.instant().minus(Duration.ofMinutes(20)));
        assertTrue(cache.get("VOO").isEmpty());
    }

    @Test
    @DisplayName("Rejects a non-positive TTL")
    void rejectsNonPositiveTtl() {
        Clock fixed = Clock.systemUTC();
        assertThrows(IllegalArgumentException.class, () -> new TtlCache<>(fixed, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new TtlCache<>(fixed, Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> new TtlCache<>(fixed, Duration.ofMinutes(1), 0));
    }
}
