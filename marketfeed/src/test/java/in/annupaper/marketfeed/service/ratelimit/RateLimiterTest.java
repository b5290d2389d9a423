package in.annupaper.marketfeed.service.ratelimit;

import in.annupaper.marketfeed.infrastructure.metrics.NoOpStreamMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RateLimiter.
 *
 * Tests:
 * - Burst capacity and refill
 * - Provider isolation
 * - Denial rate under sustained overload
 * - Bounded blocking acquire, queued callers ahead of tryAcquire
 */
class RateLimiterTest {

    private final AtomicLong nanos = new AtomicLong(0);

    private RateLimiter limiter(double qps, int burst) {
        return new RateLimiter(id -> new RateLimitConfig(qps, burst), NoOpStreamMetrics.INSTANCE, nanos::get);
    }

    @Test
    void testBurstThenDeny() {
        RateLimiter limiter = limiter(10, 3);

        assertTrue(limiter.tryAcquire("P1"));
        assertTrue(limiter.tryAcquire("P1"));
        assertTrue(limiter.tryAcquire("P1"));
        assertFalse(limiter.tryAcquire("P1"), "Burst exhausted");
    }

    @Test
    void testRefillAtConfiguredRate() {
        RateLimiter limiter = limiter(10, 1);

        assertTrue(limiter.tryAcquire("P1"));
        assertFalse(limiter.tryAcquire("P1"));

        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(50));
        assertFalse(limiter.tryAcquire("P1"), "Half a token after 50ms");

        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(50));
        assertTrue(limiter.tryAcquire("P1"), "One token after 100ms at 10 qps");
    }

    @Test
    void testRefillNeverExceedsBurst() {
        RateLimiter limiter = limiter(10, 2);

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(60));
        assertEquals(2.0, limiter.availablePermits("P1"), 1e-9);
    }

    @Test
    void testProvidersAreIsolated() {
        RateLimiter limiter = limiter(1, 1);

        assertTrue(limiter.tryAcquire("P1"));
        assertFalse(limiter.tryAcquire("P1"));
        assertTrue(limiter.tryAcquire("P2"), "P2 has its own bucket");
    }

    @Test
    void testConfigureReplacesBudget() {
        RateLimiter limiter = limiter(1, 1);
        limiter.configure("P1", new RateLimitConfig(100, 5));

        for (int i = 0; i < 5; i++) {
            assertTrue(limiter.tryAcquire("P1"));
        }
        assertFalse(limiter.tryAcquire("P1"));
        assertEquals(5, limiter.configFor("P1").burst());
    }

    @Test
    @DisplayName("Denial rate converges to (offered - budget) / offered under sustained overload")
    void testDenialRateUnderOverload() {
        double budgetQps = 10;
        double offeredQps = 100;
        RateLimiter limiter = limiter(budgetQps, 20);

        int offered = 0;
        int denied = 0;
        long stepNanos = (long) (TimeUnit.SECONDS.toNanos(1) / offeredQps);
        for (int i = 0; i < 60_000; i++) {
            offered++;
            if (!limiter.tryAcquire("P1")) {
                denied++;
            }
            nanos.addAndGet(stepNanos);
        }

        double expected = (offeredQps - budgetQps) / offeredQps;
        double observed = (double) denied / offered;
        assertEquals(expected, observed, 0.01, "Observed denial rate " + observed);
    }

    @Test
    void testAcquireBlockingReturnsTimeoutWithoutThrowing() {
        RateLimiter limiter = limiter(1, 1);
        assertTrue(limiter.tryAcquire("P1"));

        AcquireResult result = limiter.acquireBlocking("P1", Duration.ZERO);

        assertFalse(result.isPermit());
        assertEquals(AcquireResult.Outcome.TIMEOUT, result.outcome());
        RateLimitExceededException e = assertThrows(RateLimitExceededException.class, () -> result.orThrow("P1"));
        assertEquals("P1", e.getProviderId());
    }

    @Test
    void testAcquireBlockingGrantsImmediatePermit() {
        RateLimiter limiter = limiter(1, 1);

        AcquireResult result = limiter.acquireBlocking("P1", Duration.ofSeconds(1));

        assertTrue(result.isPermit());
        assertSame(result, result.orThrow("P1"));
    }

    @Test
    void testBlockingWaitersAllAdmittedAsTokensRefill() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(id -> new RateLimitConfig(50, 1), NoOpStreamMetrics.INSTANCE);
        assertTrue(limiter.tryAcquire("P1"));

        int waiters = 4;
        ExecutorService pool = Executors.newFixedThreadPool(waiters);
        CountDownLatch done = new CountDownLatch(waiters);
        AtomicInteger permits = new AtomicInteger();
        try {
            for (int i = 0; i < waiters; i++) {
                pool.submit(() -> {
                    if (limiter.acquireBlocking("P1", Duration.ofSeconds(2)).isPermit()) {
                        permits.incrementAndGet();
                    }
                    done.countDown();
                });
            }
            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(waiters, permits.get(), "Every waiter gets a permit within its timeout");
    }

    @Test
    void testTryAcquireDoesNotOvertakeBlockingWaiter() throws Exception {
        RateLimiter limiter = limiter(10, 1);
        assertTrue(limiter.tryAcquire("P1"));

        ExecutorService waiter = Executors.newSingleThreadExecutor();
        try {
            Future<AcquireResult> queued = waiter.submit(() -> limiter.acquireBlocking("P1", Duration.ofSeconds(5)));
            Thread.sleep(200);

            nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(100));
            assertFalse(limiter.tryAcquire("P1"), "Refilled token belongs to the queued caller");

            assertTrue(queued.get(3, TimeUnit.SECONDS).isPermit());
        } finally {
            waiter.shutdownNow();
        }

        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(100));
        assertTrue(limiter.tryAcquire("P1"), "No one queued any more");
    }

    @Test
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimitConfig(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new RateLimitConfig(1, 0));
    }
}
