package in.annupaper.marketfeed.service.cache;

import in.annupaper.marketfeed.util.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BackgroundUpdateQueue.
 *
 * Tests:
 * - One pending refresh per key
 * - Minimum interval between refreshes
 * - Bounded pending count
 * - Priority order
 */
class BackgroundUpdateQueueTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-04T15:00:00Z"));
    private BackgroundUpdateQueue queue;

    @AfterEach
    void tearDown() {
        queue.shutdown(Duration.ofSeconds(1));
    }

    private static void awaitIdle(BackgroundUpdateQueue queue) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (queue.pendingCount() > 0) {
            if (System.currentTimeMillis() > deadline) {
                fail("Queue did not drain");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void testSameKeyIsNotQueuedTwice() throws InterruptedException {
        queue = new BackgroundUpdateQueue(1, 10, clock);
        CountDownLatch release = new CountDownLatch(1);

        assertTrue(queue.schedule("quote:a", 0, Duration.ZERO, () -> await(release)));
        assertFalse(queue.schedule("quote:a", 0, Duration.ZERO, () -> {}));
        assertTrue(queue.isPending("quote:a"));

        release.countDown();
        awaitIdle(queue);
        assertEquals(1, queue.completedCount());
    }

    @Test
    void testMinimumIntervalThrottles() throws InterruptedException {
        queue = new BackgroundUpdateQueue(1, 10, clock);
        queue.schedule("quote:a", 0, Duration.ofSeconds(30), () -> {});
        awaitIdle(queue);

        assertFalse(queue.schedule("quote:a", 0, Duration.ofSeconds(30), () -> {}));

        clock.advance(Duration.ofSeconds(31));
        assertTrue(queue.schedule("quote:a", 0, Duration.ofSeconds(30), () -> {}));
    }

    @Test
    void testFullQueueRejects() throws InterruptedException {
        queue = new BackgroundUpdateQueue(1, 1, clock);
        CountDownLatch release = new CountDownLatch(1);
        queue.schedule("quote:a", 0, Duration.ZERO, () -> await(release));

        assertFalse(queue.schedule("quote:b", 0, Duration.ZERO, () -> {}));
        assertEquals(1, queue.rejectedCount());

        release.countDown();
        awaitIdle(queue);
    }

    @Test
    void testHigherPriorityRunsFirst() throws InterruptedException {
        queue = new BackgroundUpdateQueue(1, 10, clock);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> order = new CopyOnWriteArrayList<>();

        queue.schedule("blocker", 0, Duration.ZERO, () -> {
            started.countDown();
            await(release);
        });
        assertTrue(started.await(2, TimeUnit.SECONDS));
        queue.schedule("low", 1, Duration.ZERO, () -> order.add("low"));
        queue.schedule("high", 9, Duration.ZERO, () -> order.add("high"));
        release.countDown();

        awaitIdle(queue);
        assertEquals(List.of("high", "low"), order);
    }

    @Test
    void testFailingRefreshStillClearsKey() throws InterruptedException {
        queue = new BackgroundUpdateQueue(1, 10, clock);

        queue.schedule("quote:a", 0, Duration.ZERO, () -> {
            throw new IllegalStateException("upstream 503");
        });
        awaitIdle(queue);

        assertFalse(queue.isPending("quote:a"));
        assertTrue(queue.schedule("quote:a", 0, Duration.ZERO, () -> {}));
    }

    @Test
    void testNothingAcceptedAfterShutdown() {
        queue = new BackgroundUpdateQueue(1, 10, clock);

        assertTrue(queue.shutdown(Duration.ofSeconds(1)));
        assertFalse(queue.schedule("quote:a", 0, Duration.ZERO, () -> {}));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
