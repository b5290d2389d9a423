package in.annupaper.marketfeed.service.ratelimit;

import in.annupaper.marketfeed.util.Env;

import java.util.Locale;

/**
 * Token bucket budget for one provider.
 *
 * @param maxQps refill rate in permits per second
 * @param burst bucket capacity, the most permits that can be taken back to back
 */
public record RateLimitConfig(double maxQps, int burst) {

    public RateLimitConfig {
        if (maxQps <= 0) {
            throw new IllegalArgumentException("maxQps must be positive");
        }
        if (burst <= 0) {
            throw new IllegalArgumentException("burst must be positive");
        }
    }

    public static RateLimitConfig defaults() {
        return new RateLimitConfig(10.0, 20);
    }

    /**
     * Read RATE_LIMIT_&lt;PROVIDER&gt;_QPS and RATE_LIMIT_&lt;PROVIDER&gt;_BURST, falling back to defaults.
     */
    public static RateLimitConfig fromEnv(String providerId) {
        String prefix = "RATE_LIMIT_" + providerId.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
        RateLimitConfig d = defaults();
        return new RateLimitConfig(
            Env.getDouble(prefix + "_QPS", d.maxQps()),
            Env.getInt(prefix + "_BURST", d.burst())
        );
    }
}
