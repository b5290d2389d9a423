package in.annupaper.marketfeed.service.recovery;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;
import in.annupaper.marketfeed.infrastructure.metrics.StreamMetrics;
import in.annupaper.marketfeed.infrastructure.provider.common.ReconnectionPolicy;
import in.annupaper.marketfeed.service.ratelimit.AcquireResult;
import in.annupaper.marketfeed.service.ratelimit.RateLimiter;
import in.annupaper.marketfeed.service.stream.ConnectionListener;
import in.annupaper.marketfeed.service.stream.GapEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Replays missed ticks after a gap.
 *
 * Gap events from the supervisor become {@link RecoveryJob}s on a priority queue drained by a
 * fixed worker pool. Each attempt takes a rate-limit permit, so replay traffic is paced
 * exactly like live traffic. Failed attempts are retried with exponential backoff; when
 * the replay source is unreachable the worker runs a {@link BatchHealthChecker} pass and
 * reports degraded health instead. Exhaustion emits a failed notice and leaves the
 * connection alone.
 */
public class RecoveryWorker implements ConnectionListener {
    private static final Logger log = LoggerFactory.getLogger(RecoveryWorker.class);

    private final RecoveryConfig config;
    private final HistoricalReplaySource replaySource;
    private final RateLimiter rateLimiter;
    private final BatchHealthChecker healthChecker;
    private final StreamMetrics metrics;
    private final Clock clock;

    private final PriorityBlockingQueue<RecoveryJob> queue = new PriorityBlockingQueue<>();
    private final List<RecoveryListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong jobIds = new AtomicLong();
    private final AtomicInteger inFlight = new AtomicInteger();

    private ExecutorService workers;
    private final ScheduledExecutorService retryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "RecoveryRetry");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean running = false;
    private volatile HealthReport lastHealthReport;

    public RecoveryWorker(RecoveryConfig config, HistoricalReplaySource replaySource, RateLimiter rateLimiter,
                          BatchHealthChecker healthChecker, StreamMetrics metrics, Clock clock) {
        this.config = config;
        this.replaySource = replaySource;
        this.rateLimiter = rateLimiter;
        this.healthChecker = healthChecker;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void addListener(RecoveryListener listener) {
        listeners.add(listener);
    }

    public synchronized void start() {
        if (running) {
            log.warn("[RECOVERY] Already running");
            return;
        }
        running = true;
        AtomicInteger threadIndex = new AtomicInteger();
        workers = Executors.newFixedThreadPool(config.workers(), r -> {
            Thread t = new Thread(r, "RecoveryWorker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < config.workers(); i++) {
            workers.execute(this::drainLoop);
        }
        log.info("[RECOVERY] Started {} workers (max window {} s, {} attempts)",
            config.workers(), config.maxWindow().toSeconds(), config.maxAttempts());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("[RECOVERY] Stopping, {} jobs still queued", queue.size());
        retryScheduler.shutdownNow();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[RECOVERY] Workers did not stop within 5 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        queue.clear();
    }

    @Override
    public void onGap(GapEvent gap) {
        submit(gap);
    }

    /**
     * Queue a recovery job for {@code gap}.
     *
     * @return the job, or empty if there was nothing to recover
     */
    public Optional<RecoveryJob> submit(GapEvent gap) {
        if (gap.symbolsByConsumer().isEmpty() || gap.toTimestamp() <= gap.fromTimestamp()) {
            log.debug("[RECOVERY] Nothing to recover for {} ({})", gap.key(), gap.reason());
            return Optional.empty();
        }
        RecoveryWindow window = RecoveryWindow.bounded(gap.fromTimestamp(), gap.toTimestamp(), config.maxWindow());
        if (window.truncated()) {
            log.warn("[RECOVERY] [{}] Gap of {} ms exceeds max window, replaying last {} ms only",
                gap.key(), gap.toTimestamp() - gap.fromTimestamp(), window.length().toMillis());
        }
        RecoveryJob job = new RecoveryJob(jobIds.incrementAndGet(), gap.key(), window, gap.symbolsByConsumer(),
            gap.reason(), clock.instant(), config.retryPolicy());
        queue.offer(job);
        log.info("[RECOVERY] Queued {} ({})", job, gap.reason());
        return Optional.of(job);
    }

    public int queueSize() {
        return queue.size();
    }

    public int inFlight() {
        return inFlight.get();
    }

    public HealthReport lastHealthReport() {
        return lastHealthReport;
    }

    private void drainLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            RecoveryJob job;
            try {
                job = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            inFlight.incrementAndGet();
            try {
                runAttempt(job);
            } catch (Exception e) {
                log.error("[RECOVERY] Unexpected failure running {}", job, e);
            } finally {
                inFlight.decrementAndGet();
            }
        }
    }

    /**
     * One replay attempt. Package-private so tests can drive jobs without the pool.
     */
    void runAttempt(RecoveryJob job) {
        ConnectionKey key = job.getKey();
        AcquireResult permit = rateLimiter.acquireBlocking(key.providerId(), config.permitTimeout());
        if (!permit.isPermit()) {
            retryOrFail(job, "no rate-limit permit within " + config.permitTimeout().toMillis() + " ms");
            return;
        }

        List<Tick> ticks;
        try {
            ticks = replaySource.replay(key, job.allSymbols(), job.getWindow());
        } catch (RecoveryUnavailableException e) {
            metrics.recordRecoveryAttempt(key.providerId(), "UNAVAILABLE");
            log.warn("[RECOVERY] [{}] Replay source unavailable: {}. Falling back to batch health check",
                key, e.getMessage());
            runHealthCheck();
            retryOrFail(job, "replay source unavailable: " + e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.warn("[RECOVERY] [{}] Replay attempt failed: {}", key, e.getMessage());
            retryOrFail(job, e.getMessage());
            return;
        }

        deliver(job, ticks);
    }

    private void deliver(RecoveryJob job, List<Tick> replayed) {
        ConnectionKey key = job.getKey();
        List<Tick> ordered = replayed.stream()
            .filter(t -> job.getWindow().contains(t.timestamp()))
            .sorted(Comparator.comparingLong(Tick::timestamp))
            .toList();

        int delivered = 0;
        for (Map.Entry<String, Set<String>> entry : job.getSymbolsByConsumer().entrySet()) {
            String consumerId = entry.getKey();
            Set<String> symbols = entry.getValue();
            List<Tick> forConsumer = ordered.stream().filter(t -> symbols.contains(t.symbol())).toList();

            int attempts = job.retryPolicy().getAttemptCount() + 1;
            try {
                deliverBatches(job, consumerId, forConsumer);
            } catch (RuntimeException e) {
                log.error("[RECOVERY] [{}] Batch delivery to {} failed, replay stopped: {}", key, consumerId, e.getMessage());
                notifyFailed(new RecoveryNotice(job.getId(), key, Set.of(consumerId), job.getWindow(),
                    RecoveryNotice.Outcome.FAILED, 0, attempts, "delivery failed: " + e.getMessage()));
                continue;
            }
            delivered += forConsumer.size();
            notifyComplete(new RecoveryNotice(job.getId(), key, Set.of(consumerId), job.getWindow(),
                RecoveryNotice.Outcome.COMPLETED, forConsumer.size(), attempts, null));
        }

        metrics.recordRecoveryAttempt(key.providerId(), "SUCCESS");
        metrics.recordRecoveredTicks(key.providerId(), delivered);
        log.info("[RECOVERY] [{}] Job #{} recovered {} ticks over {} ms", key, job.getId(), delivered,
            job.getWindow().length().toMillis());
    }

    private void deliverBatches(RecoveryJob job, String consumerId, List<Tick> ticks) {
        int total = Math.max(1, (ticks.size() + config.batchSize() - 1) / config.batchSize());
        for (int i = 0; i < total; i++) {
            List<Tick> slice = ticks.subList(i * config.batchSize(), Math.min((i + 1) * config.batchSize(), ticks.size()));
            RecoveryBatch batch = new RecoveryBatch(job.getId(), job.getKey(), consumerId, List.copyOf(slice), i, total);
            for (RecoveryListener listener : listeners) {
                listener.onBatch(batch);
            }
        }
    }

    private void retryOrFail(RecoveryJob job, String reason) {
        ReconnectionPolicy policy = job.retryPolicy();
        policy.recordFailure();
        if (policy.shouldRetry() && !retryScheduler.isShutdown()) {
            Duration delay = policy.getNextDelay();
            metrics.recordRecoveryAttempt(job.getKey().providerId(), "RETRY");
            log.info("[RECOVERY] [{}] Job #{} attempt {} failed ({}), retrying in {} ms",
                job.getKey(), job.getId(), policy.getAttemptCount(), reason, delay.toMillis());
            retryScheduler.schedule(() -> queue.offer(job), delay.toMillis(), TimeUnit.MILLISECONDS);
            return;
        }

        metrics.recordRecoveryAttempt(job.getKey().providerId(), "FAILED");
        log.error("[RECOVERY] [{}] Job #{} failed after {} attempts: {}. Connection left as is",
            job.getKey(), job.getId(), policy.getAttemptCount(), reason);
        notifyFailed(new RecoveryNotice(job.getId(), job.getKey(), job.getSymbolsByConsumer().keySet(),
            job.getWindow(), RecoveryNotice.Outcome.FAILED, 0, policy.getAttemptCount(), reason));
    }

    /**
     * Run the degraded-mode health check now and publish the report.
     */
    public HealthReport runHealthCheck() {
        HealthReport report = healthChecker.check();
        lastHealthReport = report;
        for (RecoveryListener listener : listeners) {
            try {
                listener.onHealthReport(report);
            } catch (Exception e) {
                log.error("[RECOVERY] Health report listener threw exception", e);
            }
        }
        return report;
    }

    private void notifyComplete(RecoveryNotice notice) {
        for (RecoveryListener listener : listeners) {
            try {
                listener.onComplete(notice);
            } catch (Exception e) {
                log.error("[RECOVERY] Completion listener threw exception", e);
            }
        }
    }

    private void notifyFailed(RecoveryNotice notice) {
        for (RecoveryListener listener : listeners) {
            try {
                listener.onFailed(notice);
            } catch (Exception e) {
                log.error("[RECOVERY] Failure listener threw exception", e);
            }
        }
    }
}
