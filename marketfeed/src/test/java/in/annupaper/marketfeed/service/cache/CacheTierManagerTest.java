package in.annupaper.marketfeed.service.cache;

import in.annupaper.marketfeed.infrastructure.cache.InMemoryWarmStore;
import in.annupaper.marketfeed.infrastructure.cache.WarmStore;
import in.annupaper.marketfeed.infrastructure.metrics.NoOpStreamMetrics;
import in.annupaper.marketfeed.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CacheTierManager.
 *
 * Tests:
 * - Compression threshold per write profile
 * - Expiry, stale reads and warm-tier promotion
 * - Pattern invalidation across tiers
 * - Warm store failures degrade to misses
 */
class CacheTierManagerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-04T15:00:00Z"));
    private InMemoryWarmStore warm;
    private CacheTierManager tiers;

    static CacheConfig config(int hotMaxEntries) {
        return new CacheConfig(hotMaxEntries, 64, 640, Duration.ofSeconds(2), Duration.ofMinutes(10),
            Duration.ofSeconds(1), 4, 1, Duration.ofSeconds(30), 100, 5, 300, 60, 5, 3600, "");
    }

    @BeforeEach
    void setUp() {
        warm = new InMemoryWarmStore(clock);
        tiers = new CacheTierManager(config(100), warm, new PayloadCodec(), NoOpStreamMetrics.INSTANCE, clock);
    }

    @Test
    void testCompressionDependsOnProfile() {
        String value = "x".repeat(100);

        CacheEntry streaming = tiers.set("quote:a", value, 60, CompressionProfile.STREAMING);
        CacheEntry batch = tiers.set("report:a", value, 60, CompressionProfile.BATCH);

        assertTrue(streaming.compressed());
        assertFalse(batch.compressed());
        assertEquals(batch.sizeBytes(), streaming.sizeBytes());
        assertEquals(value, tiers.decode(streaming, String.class));
        assertEquals(value, tiers.decode(batch, String.class));
    }

    @Test
    void testSmallValueStaysUncompressed() {
        CacheEntry entry = tiers.set("quote:a", "42", 60, CompressionProfile.STREAMING);

        assertFalse(entry.compressed());
    }

    @Test
    void testValueAtThresholdStaysUncompressed() {
        // JSON string: 62 chars plus two quotes
        CacheEntry atThreshold = tiers.set("quote:a", "x".repeat(62), 60, CompressionProfile.STREAMING);
        CacheEntry overThreshold = tiers.set("quote:b", "x".repeat(63), 60, CompressionProfile.STREAMING);

        assertEquals(64, atThreshold.sizeBytes());
        assertFalse(atThreshold.compressed());
        assertEquals(65, overThreshold.sizeBytes());
        assertTrue(overThreshold.compressed());
    }

    @Test
    void testExpiredEntryIsMissButStillReadableAsStale() {
        tiers.set("quote:a", Map.of("price", 101.5), 5, CompressionProfile.STREAMING);
        assertTrue(tiers.get("quote:a").isPresent());

        clock.advance(Duration.ofSeconds(5));

        assertTrue(tiers.get("quote:a").isEmpty());
        Optional<CacheEntry> stale = tiers.getIncludingStale("quote:a");
        assertTrue(stale.isPresent());
        assertTrue(stale.get().isExpired(clock.millis()));
        assertEquals(1, tiers.stats().misses());
    }

    @Test
    void testWarmHitIsPromoted() {
        CacheTierManager other = new CacheTierManager(config(100), warm, new PayloadCodec(), NoOpStreamMetrics.INSTANCE, clock);
        tiers.set("quote:a", "v1", 60, CompressionProfile.STREAMING);

        assertEquals(CacheTier.WARM, other.get("quote:a").orElseThrow().tier());
        assertEquals(CacheTier.HOT, other.get("quote:a").orElseThrow().tier());

        CacheStats stats = other.stats();
        assertEquals(1, stats.warmHits());
        assertEquals(1, stats.hotHits());
        assertEquals(1.0, stats.hitRate(), 1e-9);
    }

    @Test
    void testWarmTierKeepsValueForStaleGrace() {
        CacheTierManager other = new CacheTierManager(config(100), warm, new PayloadCodec(), NoOpStreamMetrics.INSTANCE, clock);
        tiers.set("quote:a", "v1", 5, CompressionProfile.STREAMING);

        clock.advance(Duration.ofSeconds(6));
        assertTrue(other.get("quote:a").isEmpty());
        assertTrue(other.getIncludingStale("quote:a").isPresent());

        clock.advance(Duration.ofMinutes(10));
        assertTrue(other.getIncludingStale("quote:a").isEmpty());
    }

    @Test
    void testHotEvictionFallsBackToWarm() {
        CacheTierManager small = new CacheTierManager(config(1), warm, new PayloadCodec(), NoOpStreamMetrics.INSTANCE, clock);
        small.set("quote:a", "a", 60, CompressionProfile.STREAMING);
        small.set("quote:b", "b", 60, CompressionProfile.STREAMING);

        assertNull(small.hotTier().get("quote:a"));
        assertEquals("a", small.decode(small.get("quote:a").orElseThrow(), String.class));
        assertEquals(1, small.stats().warmHits());
        assertTrue(small.stats().evictions() >= 1);
    }

    @Test
    void testInvalidatePatternAcrossTiers() {
        tiers.set("quote:P1:AAPL", "a", 60, CompressionProfile.STREAMING);
        tiers.set("quote:P1:MSFT", "m", 60, CompressionProfile.STREAMING);
        tiers.set("quote:P2:AAPL", "b", 60, CompressionProfile.STREAMING);

        int removed = tiers.invalidatePattern("quote:P1:*");

        assertEquals(4, removed, "Two keys in each tier");
        assertTrue(tiers.get("quote:P1:AAPL").isEmpty());
        assertTrue(tiers.get("quote:P2:AAPL").isPresent());
        assertEquals(1, warm.size());
        assertEquals(0, tiers.stats().degradedScans());
    }

    @Test
    void testInvalidatePatternRejectsInnerWildcard() {
        assertThrows(IllegalArgumentException.class, () -> tiers.invalidatePattern("quote:*:AAPL"));
    }

    @Test
    void testInvalidateSingleKey() {
        tiers.set("quote:a", "v", 60, CompressionProfile.STREAMING);

        assertTrue(tiers.invalidate("quote:a"));
        assertFalse(tiers.invalidate("quote:a"));
        assertTrue(tiers.getIncludingStale("quote:a").isEmpty());
    }

    @Test
    void testWarmStoreFailureIsAMiss() {
        WarmStore broken = mock(WarmStore.class);
        doThrow(new IllegalStateException("redis down")).when(broken).put(anyString(), anyString(), any());
        when(broken.get(anyString())).thenThrow(new IllegalStateException("redis down"));
        CacheTierManager degraded = new CacheTierManager(config(100), broken, new PayloadCodec(), NoOpStreamMetrics.INSTANCE, clock);

        degraded.set("quote:a", "v", 5, CompressionProfile.STREAMING);
        assertTrue(degraded.get("quote:a").isPresent());

        assertTrue(degraded.get("quote:missing").isEmpty());
    }
}
