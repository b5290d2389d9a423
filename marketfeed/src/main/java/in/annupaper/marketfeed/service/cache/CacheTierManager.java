package in.annupaper.marketfeed.service.cache;

import in.annupaper.marketfeed.infrastructure.cache.WarmStore;
import in.annupaper.marketfeed.infrastructure.metrics.StreamMetrics;
import in.annupaper.marketfeed.infrastructure.metrics.StreamMetrics.CacheEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hot (in-process LRU) and warm (shared TTL store) cache tiers.
 *
 * Writes go to both tiers. TTL comes from the {@link MarketContext}; the value is
 * serialized with Jackson and GZIP'd when its size exceeds the threshold of the
 * caller's {@link CompressionProfile}. The warm tier keeps each value for TTL plus the
 * configured stale grace, so {@link #getIncludingStale} can serve expired data after a
 * failed fetch. A warm hit is promoted into the hot tier.
 *
 * Warm store failures are logged and treated as misses; the hot tier keeps serving.
 */
public class CacheTierManager {
    private static final Logger log = LoggerFactory.getLogger(CacheTierManager.class);

    private final HotTier hot;
    private final WarmStore warm;
    private final PayloadCodec codec;
    private final CacheConfig config;
    private final StreamMetrics metrics;
    private final Clock clock;

    private final AtomicLong hotHits = new AtomicLong();
    private final AtomicLong warmHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong staleServed = new AtomicLong();

    public CacheTierManager(CacheConfig config, WarmStore warm, PayloadCodec codec, StreamMetrics metrics, Clock clock) {
        this.config = config;
        this.warm = warm;
        this.codec = codec;
        this.metrics = metrics;
        this.clock = clock;
        this.hot = new HotTier(config.hotMaxEntries());
        this.hot.onEviction(e -> metrics.recordCacheEvent(CacheEvent.EVICTION, CacheTier.HOT.name()));
    }

    /**
     * Fresh entry for {@code key}, or empty on miss or expiry.
     */
    public Optional<CacheEntry> get(String key) {
        long now = clock.millis();
        CacheEntry h = hot.get(key);
        if (h != null && !h.isExpired(now)) {
            hotHits.incrementAndGet();
            metrics.recordCacheEvent(CacheEvent.HIT, CacheTier.HOT.name());
            return Optional.of(h);
        }

        Optional<CacheEntry> w = readWarm(key);
        if (w.isPresent() && !w.get().isExpired(now)) {
            warmHits.incrementAndGet();
            metrics.recordCacheEvent(CacheEvent.HIT, CacheTier.WARM.name());
            hot.put(w.get().withTier(CacheTier.HOT));
            return w;
        }

        misses.incrementAndGet();
        metrics.recordCacheEvent(CacheEvent.MISS, h != null ? CacheTier.HOT.name() : CacheTier.WARM.name());
        return Optional.empty();
    }

    /**
     * Entry for {@code key} even if expired, as long as a tier still holds it.
     */
    public Optional<CacheEntry> getIncludingStale(String key) {
        CacheEntry h = hot.get(key);
        if (h != null) {
            return Optional.of(h);
        }
        return readWarm(key);
    }

    void recordStaleServed(String key) {
        staleServed.incrementAndGet();
        metrics.recordCacheEvent(CacheEvent.STALE_SERVED, CacheTier.WARM.name());
        log.info("[CACHE] Serving stale value for {}", key);
    }

    public CacheEntry set(String key, Object value, MarketContext context, CompressionProfile compression) {
        return set(key, value, context.ttlSeconds(), compression);
    }

    public CacheEntry set(String key, Object value, long ttlSeconds, CompressionProfile compression) {
        byte[] raw = codec.serialize(value);
        int threshold = config.compressionThreshold(compression);
        boolean compress = raw.length > threshold;
        byte[] payload = compress ? PayloadCodec.gzip(raw) : raw;
        metrics.recordCompression(compression.name(), compress);

        CacheEntry entry = new CacheEntry(key, payload, clock.millis(), ttlSeconds, CacheTier.HOT, compress, raw.length);
        hot.put(entry);

        Duration warmTtl = Duration.ofSeconds(ttlSeconds).plus(config.staleGrace());
        try {
            warm.put(key, codec.toEnvelope(entry), warmTtl);
        } catch (RuntimeException e) {
            log.warn("[CACHE] Warm tier write failed for {}: {}", key, e.getMessage());
        }
        log.debug("[CACHE] Stored {} ({} bytes{}, ttl {} s)", key, raw.length, compress ? ", gzip" : "", ttlSeconds);
        return entry;
    }

    public <T> T decode(CacheEntry entry, Class<T> type) {
        return codec.deserialize(entry, type);
    }

    public boolean invalidate(String key) {
        boolean removed = hot.remove(key);
        try {
            removed |= warm.delete(key);
        } catch (RuntimeException e) {
            log.warn("[CACHE] Warm tier delete failed for {}: {}", key, e.getMessage());
        }
        return removed;
    }

    /**
     * Invalidate every key matching {@code pattern}, a literal prefix optionally ending in
     * {@code *} ({@code quote:P1:*}).
     *
     * @return number of entries removed across both tiers
     */
    public int invalidatePattern(String pattern) {
        String prefix = pattern.endsWith("*") ? pattern.substring(0, pattern.length() - 1) : pattern;
        if (prefix.contains("*")) {
            throw new IllegalArgumentException("Only trailing '*' wildcards are supported: " + pattern);
        }
        long scansBefore = hot.degradedScans();
        int removed = hot.removeByPrefix(prefix);
        if (hot.degradedScans() > scansBefore) {
            metrics.recordCacheEvent(CacheEvent.DEGRADED_SCAN, CacheTier.HOT.name());
        }
        try {
            List<String> keys = warm.scanKeys(prefix);
            removed += warm.deleteAll(keys);
        } catch (RuntimeException e) {
            log.warn("[CACHE] Warm tier pattern invalidation failed for {}: {}", pattern, e.getMessage());
        }
        log.info("[CACHE] Invalidated {} entries for {}", removed, pattern);
        return removed;
    }

    public CacheStats stats() {
        return new CacheStats(hotHits.get(), warmHits.get(), misses.get(), staleServed.get(),
            hot.evictions(), hot.degradedScans(), hot.size());
    }

    PayloadCodec codec() {
        return codec;
    }

    HotTier hotTier() {
        return hot;
    }

    private Optional<CacheEntry> readWarm(String key) {
        try {
            return warm.get(key).map(json -> codec.fromEnvelope(key, json));
        } catch (RuntimeException e) {
            log.warn("[CACHE] Warm tier read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
