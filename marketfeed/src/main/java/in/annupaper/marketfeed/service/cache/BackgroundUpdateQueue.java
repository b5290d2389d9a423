package in.annupaper.marketfeed.service.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded priority queue of background cache refreshes.
 *
 * At most one refresh per key is pending or running at a time. A key refreshed less than
 * the requested minimum interval ago is not scheduled again. When the pending count hits
 * the bound, new requests are rejected rather than queued.
 */
public class BackgroundUpdateQueue {
    private static final Logger log = LoggerFactory.getLogger(BackgroundUpdateQueue.class);

    private final PriorityBlockingQueue<Task> queue = new PriorityBlockingQueue<>();
    private final Set<String> pendingKeys = ConcurrentHashMap.newKeySet();
    private final Map<String, Long> lastUpdateAt = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    private final int maxPending;
    private final Clock clock;
    private final ExecutorService workers;
    private volatile boolean accepting = true;

    public BackgroundUpdateQueue(int concurrency, int maxPending, Clock clock) {
        this.maxPending = maxPending;
        this.clock = clock;
        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(concurrency, r -> {
            Thread t = new Thread(r, "CacheRefresh-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < concurrency; i++) {
            workers.execute(this::drainLoop);
        }
    }

    /**
     * @return true if the refresh was queued
     */
    public boolean schedule(String key, int priority, Duration minInterval, Runnable work) {
        if (!accepting) {
            return false;
        }
        Long last = lastUpdateAt.get(key);
        if (last != null && clock.millis() - last < minInterval.toMillis()) {
            log.debug("[SMART-CACHE] Refresh of {} throttled, last update {} ms ago", key, clock.millis() - last);
            return false;
        }
        if (pendingKeys.size() >= maxPending) {
            rejected.incrementAndGet();
            log.warn("[SMART-CACHE] Update queue full ({} pending), refresh of {} dropped", maxPending, key);
            return false;
        }
        if (!pendingKeys.add(key)) {
            return false;
        }
        queue.offer(new Task(key, priority, sequence.incrementAndGet(), work));
        return true;
    }

    public boolean isPending(String key) {
        return pendingKeys.contains(key);
    }

    public int pendingCount() {
        return pendingKeys.size();
    }

    public long completedCount() {
        return completed.get();
    }

    public long rejectedCount() {
        return rejected.get();
    }

    private void drainLoop() {
        while (accepting || !queue.isEmpty()) {
            Task task;
            try {
                task = queue.poll(100, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (task == null) {
                continue;
            }
            try {
                task.work().run();
            } catch (Exception e) {
                log.warn("[SMART-CACHE] Background refresh of {} failed: {}", task.key(), e.getMessage());
            } finally {
                lastUpdateAt.put(task.key(), clock.millis());
                completed.incrementAndGet();
                pendingKeys.remove(task.key());
            }
        }
    }

    /**
     * Stop accepting work and let queued refreshes finish within {@code timeout}.
     *
     * @return true if everything drained in time
     */
    public boolean shutdown(Duration timeout) {
        accepting = false;
        workers.shutdown();
        try {
            if (workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.warn("[SMART-CACHE] {} refreshes still pending after {} ms, interrupting", pendingKeys.size(), timeout.toMillis());
        workers.shutdownNow();
        queue.clear();
        pendingKeys.clear();
        return false;
    }

    private record Task(String key, int priority, long seq, Runnable work) implements Comparable<Task> {
        @Override
        public int compareTo(Task other) {
            int byPriority = Integer.compare(other.priority, priority);
            return byPriority != 0 ? byPriority : Long.compare(seq, other.seq);
        }
    }
}
