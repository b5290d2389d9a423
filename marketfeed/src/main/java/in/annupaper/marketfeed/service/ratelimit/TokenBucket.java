package in.annupaper.marketfeed.service.ratelimit;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Classic token bucket: capacity = burst, continuous refill at maxQps.
 * Starts full.
 */
final class TokenBucket {

    private final double capacity;
    private final double tokensPerNano;
    private final LongSupplier ticker;

    private double tokens;
    private long lastRefillNanos;

    TokenBucket(RateLimitConfig config, LongSupplier ticker) {
        this.capacity = config.burst();
        this.tokensPerNano = config.maxQps() / TimeUnit.SECONDS.toNanos(1);
        this.ticker = ticker;
        this.tokens = capacity;
        this.lastRefillNanos = ticker.getAsLong();
    }

    synchronized boolean tryTake() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    /**
     * Nanoseconds until at least one whole token is available (0 if one is available now).
     */
    synchronized long nanosUntilNextToken() {
        refill();
        if (tokens >= 1.0) {
            return 0L;
        }
        return (long) Math.ceil((1.0 - tokens) / tokensPerNano);
    }

    synchronized double available() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = ticker.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * tokensPerNano);
            lastRefillNanos = now;
        }
    }
}
