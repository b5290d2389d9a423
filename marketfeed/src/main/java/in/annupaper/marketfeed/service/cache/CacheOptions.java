package in.annupaper.marketfeed.service.cache;

import java.time.Duration;

/**
 * Per-call cache behaviour.
 *
 * @param symbol instrument used for the market session lookup; required for MARKET_AWARE
 * @param refreshAhead pre-expiry window that triggers a background refresh; null uses the configured default
 * @param timeout how long a caller waits on the shared fetch; null uses the configured default
 * @param staleFallback serve an expired value instead of failing when the fetch fails or times out
 * @param ttlSeconds fixed TTL for STRONG and WEAK; 0 uses the configured default
 * @param priority background refresh priority, higher first
 */
public record CacheOptions(
    CacheStrategy strategy,
    String symbol,
    TtlProfile ttlProfile,
    CompressionProfile compression,
    Duration refreshAhead,
    Duration timeout,
    boolean staleFallback,
    long ttlSeconds,
    int priority
) {
    public CacheOptions {
        if (strategy == null || ttlProfile == null || compression == null) {
            throw new IllegalArgumentException("strategy, ttlProfile and compression are required");
        }
        if (strategy == CacheStrategy.MARKET_AWARE && (symbol == null || symbol.isBlank())) {
            throw new IllegalArgumentException("MARKET_AWARE caching needs a symbol");
        }
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("ttlSeconds must not be negative");
        }
    }

    public static Builder builder(CacheStrategy strategy) {
        return new Builder(strategy);
    }

    public static CacheOptions marketAware(String symbol) {
        return builder(CacheStrategy.MARKET_AWARE).symbol(symbol).build();
    }

    public static CacheOptions strong() {
        return builder(CacheStrategy.STRONG_TIMELINESS).build();
    }

    public static CacheOptions weak() {
        return builder(CacheStrategy.WEAK_TIMELINESS).compression(CompressionProfile.BATCH).build();
    }

    public static class Builder {
        private final CacheStrategy strategy;
        private String symbol;
        private TtlProfile ttlProfile = TtlProfile.REALTIME;
        private CompressionProfile compression = CompressionProfile.STREAMING;
        private Duration refreshAhead;
        private Duration timeout;
        private boolean staleFallback = true;
        private long ttlSeconds;
        private int priority;

        private Builder(CacheStrategy strategy) {
            this.strategy = strategy;
        }

        public Builder symbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder ttlProfile(TtlProfile ttlProfile) {
            this.ttlProfile = ttlProfile;
            return this;
        }

        public Builder compression(CompressionProfile compression) {
            this.compression = compression;
            return this;
        }

        public Builder refreshAhead(Duration refreshAhead) {
            this.refreshAhead = refreshAhead;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder staleFallback(boolean staleFallback) {
            this.staleFallback = staleFallback;
            return this;
        }

        public Builder ttlSeconds(long ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public CacheOptions build() {
            return new CacheOptions(strategy, symbol, ttlProfile, compression, refreshAhead, timeout,
                staleFallback, ttlSeconds, priority);
        }
    }
}
