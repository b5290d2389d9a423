package in.annupaper.marketfeed.service.cache;

import in.annupaper.marketfeed.util.Env;

import java.time.Duration;

/**
 * Cache tier and orchestrator settings.
 *
 * @param staleGrace how long the warm tier keeps a value past its TTL for stale fallback
 * @param minUpdateInterval lower bound between two background refreshes of one key
 * @param redisUri warm tier backend; empty selects the in-memory store
 */
public record CacheConfig(
    int hotMaxEntries,
    int streamingCompressionBytes,
    int batchCompressionBytes,
    Duration refreshAhead,
    Duration staleGrace,
    Duration fetchTimeout,
    int fetchThreads,
    int refreshThreads,
    Duration minUpdateInterval,
    int maxPendingUpdates,
    long strongTtlSeconds,
    long weakTtlSeconds,
    long adaptiveBaseTtlSeconds,
    long adaptiveMinTtlSeconds,
    long adaptiveMaxTtlSeconds,
    String redisUri
) {
    public CacheConfig {
        if (hotMaxEntries < 1) {
            throw new IllegalArgumentException("hotMaxEntries must be at least 1");
        }
        if (streamingCompressionBytes < 0 || batchCompressionBytes < 0) {
            throw new IllegalArgumentException("compression thresholds must not be negative");
        }
        if (fetchThreads < 1 || refreshThreads < 1 || maxPendingUpdates < 1) {
            throw new IllegalArgumentException("thread counts and maxPendingUpdates must be at least 1");
        }
        if (strongTtlSeconds < 1 || weakTtlSeconds < 1) {
            throw new IllegalArgumentException("strong and weak TTLs must be positive");
        }
        if (adaptiveMinTtlSeconds < 1 || adaptiveMaxTtlSeconds <= adaptiveMinTtlSeconds
                || adaptiveBaseTtlSeconds < adaptiveMinTtlSeconds || adaptiveBaseTtlSeconds > adaptiveMaxTtlSeconds) {
            throw new IllegalArgumentException("adaptive TTL bounds must satisfy 1 <= min <= base <= max and min < max");
        }
        if (refreshAhead.isNegative() || staleGrace.isNegative() || minUpdateInterval.isNegative()) {
            throw new IllegalArgumentException("durations must not be negative");
        }
        if (fetchTimeout.isZero() || fetchTimeout.isNegative()) {
            throw new IllegalArgumentException("fetchTimeout must be positive");
        }
        redisUri = redisUri == null ? "" : redisUri.trim();
    }

    public static CacheConfig defaults() {
        return new CacheConfig(
            10_000,
            1024,
            10_240,
            Duration.ofSeconds(2),
            Duration.ofMinutes(10),
            Duration.ofSeconds(5),
            8,
            4,
            Duration.ofSeconds(30),
            1000,
            5,
            300,
            60,
            5,
            3600,
            ""
        );
    }

    public static CacheConfig fromEnv() {
        CacheConfig d = defaults();
        return new CacheConfig(
            Env.getInt("CACHE_HOT_MAX_ENTRIES", d.hotMaxEntries()),
            Env.getInt("CACHE_STREAMING_COMPRESSION_BYTES", d.streamingCompressionBytes()),
            Env.getInt("CACHE_BATCH_COMPRESSION_BYTES", d.batchCompressionBytes()),
            Env.getDuration("CACHE_REFRESH_AHEAD_MS", d.refreshAhead()),
            Duration.ofSeconds(Env.getLong("CACHE_STALE_GRACE_SECONDS", d.staleGrace().toSeconds())),
            Env.getDuration("CACHE_FETCH_TIMEOUT_MS", d.fetchTimeout()),
            Env.getInt("CACHE_FETCH_THREADS", d.fetchThreads()),
            Env.getInt("CACHE_REFRESH_THREADS", d.refreshThreads()),
            Env.getDuration("CACHE_MIN_UPDATE_INTERVAL_MS", d.minUpdateInterval()),
            Env.getInt("CACHE_MAX_PENDING_UPDATES", d.maxPendingUpdates()),
            Env.getLong("CACHE_STRONG_TTL_SECONDS", d.strongTtlSeconds()),
            Env.getLong("CACHE_WEAK_TTL_SECONDS", d.weakTtlSeconds()),
            Env.getLong("CACHE_ADAPTIVE_BASE_TTL_SECONDS", d.adaptiveBaseTtlSeconds()),
            Env.getLong("CACHE_ADAPTIVE_MIN_TTL_SECONDS", d.adaptiveMinTtlSeconds()),
            Env.getLong("CACHE_ADAPTIVE_MAX_TTL_SECONDS", d.adaptiveMaxTtlSeconds()),
            Env.get("REDIS_URI", d.redisUri())
        );
    }

    public int compressionThreshold(CompressionProfile profile) {
        return switch (profile) {
            case STREAMING -> streamingCompressionBytes;
            case BATCH -> batchCompressionBytes;
        };
    }
}
