package in.annupaper.marketfeed.service.ratelimit;

import in.annupaper.marketfeed.infrastructure.metrics.NoOpStreamMetrics;
import in.annupaper.marketfeed.infrastructure.metrics.StreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Per-provider QPS gate shared by live subscription traffic and recovery traffic.
 *
 * Both paths go through the same bucket so a recovery storm cannot starve live
 * subscribers. Exceeding the budget never throws: {@link #tryAcquire} denies
 * immediately and {@link #acquireBlocking} returns {@link AcquireResult} after a
 * bounded wait. Blocking callers queue on a fair lock per provider and are admitted
 * in arrival order; {@code tryAcquire} is denied while any of them is waiting.
 *
 * Usage:
 * <pre>
 * RateLimiter limiter = new RateLimiter(RateLimitConfig::fromEnv, metrics);
 * if (limiter.acquireBlocking("P1", Duration.ofSeconds(2)).isPermit()) {
 *     session.subscribe(symbols);
 * }
 * </pre>
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final Map<String, Budget> budgets = new ConcurrentHashMap<>();
    private final Function<String, RateLimitConfig> configSource;
    private final StreamMetrics metrics;
    private final LongSupplier ticker;

    public RateLimiter() {
        this(RateLimitConfig::fromEnv, NoOpStreamMetrics.INSTANCE);
    }

    public RateLimiter(Function<String, RateLimitConfig> configSource, StreamMetrics metrics) {
        this(configSource, metrics, System::nanoTime);
    }

    /**
     * @param ticker monotonic nanosecond source, replaceable in tests
     */
    public RateLimiter(Function<String, RateLimitConfig> configSource, StreamMetrics metrics, LongSupplier ticker) {
        this.configSource = configSource;
        this.metrics = metrics;
        this.ticker = ticker;
    }

    /**
     * Register or replace the budget for a provider. Replacing resets the bucket to full.
     */
    public void configure(String providerId, RateLimitConfig config) {
        budgets.put(providerId, new Budget(new TokenBucket(config, ticker), config));
        log.info("[RATE] {} budget set to {} qps, burst {}", providerId, config.maxQps(), config.burst());
    }

    /**
     * Take a permit if one is available right now and no blocking caller is waiting for
     * the same provider. Waiting callers keep their place in line.
     *
     * @return true if allowed, false if the budget is exhausted or callers are queued
     */
    public boolean tryAcquire(String providerId) {
        Budget budget = budget(providerId);
        boolean allowed = !budget.waiters.isLocked() && budget.bucket.tryTake();
        if (!allowed) {
            metrics.recordRateLimitRejection(providerId);
            log.debug("[RATE] {} permit denied", providerId);
        }
        return allowed;
    }

    /**
     * Wait up to {@code timeout} for a permit.
     */
    public AcquireResult acquireBlocking(String providerId, Duration timeout) {
        Budget budget = budget(providerId);
        long start = ticker.getAsLong();
        long deadline = start + timeout.toNanos();

        boolean locked;
        try {
            locked = budget.waiters.tryLock(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return denied(providerId, start);
        }
        if (!locked) {
            return denied(providerId, start);
        }

        try {
            while (true) {
                if (budget.bucket.tryTake()) {
                    Duration waited = Duration.ofNanos(ticker.getAsLong() - start);
                    metrics.recordRateLimitWait(providerId, waited);
                    return AcquireResult.permit(waited);
                }
                long remaining = deadline - ticker.getAsLong();
                if (remaining <= 0) {
                    return denied(providerId, start);
                }
                LockSupport.parkNanos(Math.min(budget.bucket.nanosUntilNextToken(), remaining));
                if (Thread.currentThread().isInterrupted()) {
                    return denied(providerId, start);
                }
            }
        } finally {
            budget.waiters.unlock();
        }
    }

    /**
     * Tokens currently available for a provider (fractional).
     */
    public double availablePermits(String providerId) {
        return budget(providerId).bucket.available();
    }

    public RateLimitConfig configFor(String providerId) {
        return budget(providerId).config;
    }

    private AcquireResult denied(String providerId, long start) {
        Duration waited = Duration.ofNanos(ticker.getAsLong() - start);
        metrics.recordRateLimitRejection(providerId);
        log.debug("[RATE] {} no permit within {} ms", providerId, waited.toMillis());
        return AcquireResult.timeout(waited);
    }

    private Budget budget(String providerId) {
        return budgets.computeIfAbsent(providerId, id -> {
            RateLimitConfig config = configSource.apply(id);
            log.info("[RATE] {} budget initialised at {} qps, burst {}", id, config.maxQps(), config.burst());
            return new Budget(new TokenBucket(config, ticker), config);
        });
    }

    private static final class Budget {
        final TokenBucket bucket;
        final RateLimitConfig config;
        final ReentrantLock waiters = new ReentrantLock(true);

        Budget(TokenBucket bucket, RateLimitConfig config) {
            this.bucket = bucket;
            this.config = config;
        }
    }
}
