package in.annupaper.marketfeed.infrastructure.provider.common;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with a retry cap, used for upstream reconnects and recovery retries.
 *
 * The delay grows by {@code multiplier} after each failure up to {@code maxDelay}. Once
 * {@code maxAttempts} failures are recorded the policy is exhausted until
 * {@link #recordSuccess()} or {@link #reset()}. {@link #getNextDelayWithJitter()} adds
 * a random 0..jitter offset so that many connections dropped together do not retry in
 * lockstep.
 *
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofSeconds(60))
 *     .multiplier(2.0)
 *     .maxAttempts(10)
 *     .build();
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;
    private final Duration jitter;

    private int attemptCount = 0;
    private Duration currentDelay;
    private Instant lastAttemptTime;
    private boolean exhausted = false;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay,
                               double multiplier, int maxAttempts, Duration jitter) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.jitter = jitter;
        this.currentDelay = initialDelay;
    }

    public synchronized boolean shouldRetry() {
        return !exhausted && attemptCount < maxAttempts;
    }

    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    public synchronized Duration getNextDelayWithJitter() {
        if (jitter.isZero()) {
            return currentDelay;
        }
        long extra = ThreadLocalRandom.current().nextLong(jitter.toMillis() + 1);
        return currentDelay.plusMillis(extra);
    }

    public synchronized void recordFailure() {
        attemptCount++;
        lastAttemptTime = Instant.now();

        // Delay before the next attempt: initial after the first failure, then multiplied.
        double scaled = initialDelay.toMillis() * Math.pow(multiplier, attemptCount - 1);
        currentDelay = Duration.ofMillis((long) Math.min(scaled, maxDelay.toMillis()));

        if (attemptCount >= maxAttempts) {
            exhausted = true;
        }
    }

    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastAttemptTime = null;
        exhausted = false;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized boolean isExhausted() {
        return exhausted;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Fresh policy with the same settings and no recorded attempts.
     */
    public ReconnectionPolicy copy() {
        return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts, jitter);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        private int maxAttempts = 10;
        private Duration jitter = Duration.ZERO;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder jitter(Duration jitter) {
            if (jitter.isNegative()) {
                throw new IllegalArgumentException("Jitter must not be negative");
            }
            this.jitter = jitter;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts, jitter);
        }
    }
}
