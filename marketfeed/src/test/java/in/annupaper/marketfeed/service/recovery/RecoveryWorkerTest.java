package in.annupaper.marketfeed.service.recovery;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;
import in.annupaper.marketfeed.infrastructure.metrics.NoOpStreamMetrics;
import in.annupaper.marketfeed.service.ratelimit.RateLimitConfig;
import in.annupaper.marketfeed.service.ratelimit.RateLimiter;
import in.annupaper.marketfeed.service.stream.GapEvent;
import in.annupaper.marketfeed.util.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RecoveryWorker.
 *
 * Tests:
 * - Window bounding and priorities
 * - Ordered, batched delivery per consumer
 * - Retry with backoff and exhaustion
 * - Degraded health check when replay is unavailable
 */
@ExtendWith(MockitoExtension.class)
class RecoveryWorkerTest {

    private static final ConnectionKey KEY = ConnectionKey.of("P1", "quote-stream");
    private static final long T0 = 1_709_564_400_000L;

    @Mock
    private HistoricalReplaySource replaySource;

    @Mock
    private BatchHealthChecker healthChecker;

    private final List<RecoveryBatch> batches = new CopyOnWriteArrayList<>();
    private final List<RecoveryNotice> completed = new CopyOnWriteArrayList<>();
    private final List<RecoveryNotice> failed = new CopyOnWriteArrayList<>();
    private final List<HealthReport> reports = new CopyOnWriteArrayList<>();

    private MutableClock clock;
    private RecoveryWorker worker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.ofEpochMilli(T0 + 60_000));
        worker = newWorker(config(3, 2), new RateLimiter(id -> new RateLimitConfig(1000, 1000), NoOpStreamMetrics.INSTANCE));
    }

    @AfterEach
    void tearDown() {
        worker.stop();
    }

    private static RecoveryConfig config(int maxAttempts, int batchSize) {
        return new RecoveryConfig(Duration.ofMinutes(5), maxAttempts, Duration.ofMillis(10), batchSize, 1,
            Duration.ZERO, 50, Duration.ofSeconds(1));
    }

    private RecoveryWorker newWorker(RecoveryConfig config, RateLimiter limiter) {
        RecoveryWorker w = new RecoveryWorker(config, replaySource, limiter, healthChecker, NoOpStreamMetrics.INSTANCE, clock);
        w.addListener(new RecoveryListener() {
            @Override
            public void onBatch(RecoveryBatch batch) {
                batches.add(batch);
            }

            @Override
            public void onComplete(RecoveryNotice notice) {
                completed.add(notice);
            }

            @Override
            public void onFailed(RecoveryNotice notice) {
                failed.add(notice);
            }

            @Override
            public void onHealthReport(HealthReport report) {
                reports.add(report);
            }
        });
        return w;
    }

    private static GapEvent gap(long from, long to, Map<String, Set<String>> symbols) {
        return new GapEvent(KEY, from, to, symbols, "RECONNECT");
    }

    private static Tick tick(String symbol, long ts) {
        return Tick.of(symbol, BigDecimal.ONE, ts);
    }

    private static void await(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail(message);
            }
            Thread.sleep(10);
        }
    }

    @Test
    void testEmptyOrZeroLengthGapIsIgnored() {
        assertTrue(worker.submit(gap(T0, T0 + 1000, Map.of())).isEmpty());
        assertTrue(worker.submit(gap(T0, T0, Map.of("c1", Set.of("AAPL")))).isEmpty());
        assertEquals(0, worker.queueSize());
    }

    @Test
    void testWindowBoundedToMostRecentPart() {
        RecoveryJob job = worker.submit(gap(T0, T0 + Duration.ofMinutes(20).toMillis(), Map.of("c1", Set.of("AAPL"))))
            .orElseThrow();

        assertTrue(job.getWindow().truncated());
        assertEquals(Duration.ofMinutes(5), job.getWindow().length());
        assertEquals(T0 + Duration.ofMinutes(20).toMillis(), job.getWindow().toMillis());
    }

    @Test
    void testPriorityFromWindowAndWidth() {
        Set<String> wide = IntStream.range(0, 60).mapToObj(i -> "S" + i).collect(Collectors.toSet());

        RecoveryJob recent = worker.submit(gap(T0, T0 + 10_000, Map.of("c1", Set.of("AAPL")))).orElseThrow();
        RecoveryJob older = worker.submit(gap(T0, T0 + 120_000, Map.of("c1", Set.of("AAPL")))).orElseThrow();
        RecoveryJob large = worker.submit(gap(T0, T0 + 10_000, Map.of("c1", wide))).orElseThrow();

        assertEquals(RecoveryPriority.HIGH, recent.getPriority());
        assertEquals(RecoveryPriority.NORMAL, older.getPriority());
        assertEquals(RecoveryPriority.LOW, large.getPriority());
        assertTrue(recent.compareTo(older) < 0);
        assertTrue(older.compareTo(large) < 0);
    }

    @Test
    void testDeliversSortedBatchesPerConsumer() {
        when(replaySource.replay(eq(KEY), eq(Set.of("AAPL", "MSFT")), any())).thenReturn(List.of(
            tick("AAPL", T0 + 300),
            tick("MSFT", T0 + 200),
            tick("AAPL", T0 + 100),
            tick("AAPL", T0 + 200),
            tick("AAPL", T0 + 5_000)));
        RecoveryJob job = worker.submit(gap(T0, T0 + 1_000,
            Map.of("c1", Set.of("AAPL"), "c2", Set.of("MSFT")))).orElseThrow();

        worker.runAttempt(job);

        List<RecoveryBatch> forC1 = batches.stream().filter(b -> b.consumerId().equals("c1")).toList();
        assertEquals(2, forC1.size(), "Three in-window ticks at batch size 2");
        assertEquals(List.of(T0 + 100, T0 + 200), forC1.get(0).ticks().stream().map(Tick::timestamp).toList());
        assertEquals(List.of(T0 + 300), forC1.get(1).ticks().stream().map(Tick::timestamp).toList());
        assertTrue(forC1.get(1).isLast());

        List<RecoveryBatch> forC2 = batches.stream().filter(b -> b.consumerId().equals("c2")).toList();
        assertEquals(1, forC2.size());
        assertEquals("MSFT", forC2.get(0).ticks().get(0).symbol());

        assertEquals(2, completed.size());
        assertTrue(failed.isEmpty());
        assertEquals(3, completed.stream().filter(n -> n.consumers().contains("c1")).findFirst().orElseThrow().recoveredTicks());
    }

    @Test
    void testFailingConsumerDoesNotBlockOthers() {
        when(replaySource.replay(any(), any(), any())).thenReturn(List.of(tick("AAPL", T0 + 100), tick("MSFT", T0 + 100)));
        worker.addListener(batch -> {
            if (batch.consumerId().equals("bad")) {
                throw new IllegalStateException("socket gone");
            }
        });
        RecoveryJob job = worker.submit(gap(T0, T0 + 1_000,
            Map.of("bad", Set.of("AAPL"), "good", Set.of("MSFT")))).orElseThrow();

        worker.runAttempt(job);

        assertEquals(1, failed.size());
        assertEquals(Set.of("bad"), failed.get(0).consumers());
        assertTrue(failed.get(0).failureReason().contains("socket gone"));
        assertEquals(1, completed.size());
        assertEquals(Set.of("good"), completed.get(0).consumers());
    }

    @Test
    void testTransientFailureIsRetried() throws InterruptedException {
        when(replaySource.replay(any(), any(), any())).thenThrow(new IllegalStateException("HTTP 429"));
        RecoveryJob job = worker.submit(gap(T0, T0 + 1_000, Map.of("c1", Set.of("AAPL")))).orElseThrow();
        assertEquals(1, worker.queueSize());

        worker.runAttempt(job);

        await(() -> worker.queueSize() == 2, "Retry not queued after backoff");
        assertTrue(failed.isEmpty());
    }

    @Test
    void testExhaustionEmitsFailedNotice() {
        worker = newWorker(config(1, 100), new RateLimiter(id -> new RateLimitConfig(1000, 1000), NoOpStreamMetrics.INSTANCE));
        when(replaySource.replay(any(), any(), any())).thenThrow(new IllegalStateException("HTTP 500"));
        RecoveryJob job = worker.submit(gap(T0, T0 + 1_000, Map.of("c1", Set.of("AAPL")))).orElseThrow();

        worker.runAttempt(job);

        assertEquals(1, failed.size());
        RecoveryNotice notice = failed.get(0);
        assertTrue(notice.isFailed());
        assertEquals(1, notice.attempts());
        assertEquals("HTTP 500", notice.failureReason());
    }

    @Test
    void testUnavailableSourceRunsBatchHealthCheck() {
        worker = newWorker(config(1, 100), new RateLimiter(id -> new RateLimitConfig(1000, 1000), NoOpStreamMetrics.INSTANCE));
        HealthReport report = new HealthReport(HealthStatus.DEGRADED, Map.of("P1:quote-stream", true, "P2:depth", false),
            1, 2, clock.instant());
        when(healthChecker.check()).thenReturn(report);
        when(replaySource.replay(any(), any(), any())).thenThrow(new RecoveryUnavailableException("history store down"));
        RecoveryJob job = worker.submit(gap(T0, T0 + 1_000, Map.of("c1", Set.of("AAPL")))).orElseThrow();

        worker.runAttempt(job);

        verify(healthChecker).check();
        assertSame(report, worker.lastHealthReport());
        assertEquals(List.of(report), reports);
        assertEquals(1, failed.size());
        assertTrue(failed.get(0).failureReason().contains("unavailable"));
    }

    @Test
    void testNoPermitCountsAsFailedAttempt() {
        RateLimiter exhausted = new RateLimiter(id -> new RateLimitConfig(0.001, 1), NoOpStreamMetrics.INSTANCE);
        assertTrue(exhausted.tryAcquire("P1"));
        worker = newWorker(config(1, 100), exhausted);
        RecoveryJob job = worker.submit(gap(T0, T0 + 1_000, Map.of("c1", Set.of("AAPL")))).orElseThrow();

        worker.runAttempt(job);

        verifyNoInteractions(replaySource);
        assertEquals(1, failed.size());
        assertTrue(failed.get(0).failureReason().startsWith("no rate-limit permit"));
    }

    @Test
    void testStartedWorkerDrainsQueue() throws InterruptedException {
        when(replaySource.replay(any(), any(), any())).thenReturn(List.of(tick("AAPL", T0 + 100)));
        CountDownLatch done = new CountDownLatch(1);
        worker.addListener(new RecoveryListener() {
            @Override
            public void onBatch(RecoveryBatch batch) {
            }

            @Override
            public void onComplete(RecoveryNotice notice) {
                done.countDown();
            }
        });
        worker.start();

        worker.onGap(gap(T0, T0 + 1_000, Map.of("c1", Set.of("AAPL"))));

        assertTrue(done.await(3, TimeUnit.SECONDS));
        assertEquals(1, batches.size());
        assertEquals(0, worker.queueSize());
    }
}
