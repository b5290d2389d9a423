package in.annupaper.marketfeed.service.cache;

import in.annupaper.marketfeed.infrastructure.metrics.StreamMetrics;
import in.annupaper.marketfeed.infrastructure.metrics.StreamMetrics.CacheEvent;
import in.annupaper.marketfeed.service.market.MarketSessionClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Read-through cache with single-flight fetches and refresh-ahead.
 *
 * <ol>
 *   <li>Fresh hit: returned immediately.</li>
 *   <li>Fresh hit inside the refresh-ahead window: returned immediately, and one background
 *       refresh is queued for the key.</li>
 *   <li>Miss: one fetch per key. Concurrent callers share the in-flight future, so
 *       upstream sees at most one concurrent call per key.</li>
 *   <li>Fetch failure or timeout: nothing is cached. Every waiter gets the same
 *       {@link CacheFetchException}, or the expired value flagged stale when the options
 *       allow stale fallback and a tier still holds it.</li>
 * </ol>
 *
 * <pre>
 * CacheResult&lt;Quote&gt; r = orchestrator.getOrCompute("quote:AAPL", Quote.class,
 *     () -&gt; provider.quote("AAPL"), CacheOptions.marketAware("AAPL"));
 * </pre>
 */
public class SmartCacheOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SmartCacheOrchestrator.class);

    private final CacheTierManager tiers;
    private final MarketSessionClock sessions;
    private final CacheConfig config;
    private final StreamMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();
    private final Map<String, AdaptiveState> adaptive = new ConcurrentHashMap<>();
    private final ThreadPoolExecutor fetchExecutor;
    private final BackgroundUpdateQueue updates;

    public SmartCacheOrchestrator(CacheTierManager tiers, MarketSessionClock sessions, CacheConfig config,
                                  StreamMetrics metrics, Clock clock) {
        this.tiers = tiers;
        this.sessions = sessions;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;

        AtomicInteger threadIndex = new AtomicInteger();
        this.fetchExecutor = new ThreadPoolExecutor(
            config.fetchThreads(), config.fetchThreads(), 60, TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(config.maxPendingUpdates()),
            r -> {
                Thread t = new Thread(r, "CacheFetch-" + threadIndex.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        this.updates = new BackgroundUpdateQueue(config.refreshThreads(), config.maxPendingUpdates(), clock);
    }

    public <T> CacheResult<T> getOrCompute(String key, Class<T> type, Callable<T> fetchFn, CacheOptions options) {
        Optional<CacheResult<T>> hit = lookup(key, type, fetchFn, options);
        if (hit.isPresent()) {
            return hit.get();
        }
        CompletableFuture<Object> future = startFetch(key, type, fetchFn, options, fetchExecutor);
        return await(key, type, options, future, timeoutOf(options).toMillis());
    }

    /**
     * {@link #getOrCompute} over many keys. Misses are fetched concurrently.
     */
    public <T> CacheBatchResult<T> getOrComputeAll(Map<String, Callable<T>> fetchers, Class<T> type,
                                                   Function<String, CacheOptions> optionsFor) {
        Map<String, CacheResult<T>> results = new LinkedHashMap<>();
        Map<String, CacheFetchException> failures = new LinkedHashMap<>();
        Map<String, CompletableFuture<Object>> pending = new LinkedHashMap<>();

        for (Map.Entry<String, Callable<T>> e : fetchers.entrySet()) {
            String key = e.getKey();
            CacheOptions options = optionsFor.apply(key);
            Optional<CacheResult<T>> hit = lookup(key, type, e.getValue(), options);
            if (hit.isPresent()) {
                results.put(key, hit.get());
            } else {
                pending.put(key, startFetch(key, type, e.getValue(), options, fetchExecutor));
            }
        }

        long start = clock.millis();
        for (Map.Entry<String, CompletableFuture<Object>> e : pending.entrySet()) {
            CacheOptions options = optionsFor.apply(e.getKey());
            long remaining = Math.max(0, start + timeoutOf(options).toMillis() - clock.millis());
            try {
                results.put(e.getKey(), await(e.getKey(), type, options, e.getValue(), remaining));
            } catch (CacheFetchException ex) {
                failures.put(e.getKey(), ex);
            }
        }
        if (!failures.isEmpty()) {
            log.warn("[SMART-CACHE] Batch of {}: {} keys failed", fetchers.size(), failures.size());
        }
        return new CacheBatchResult<>(results, failures);
    }

    private <T> Optional<CacheResult<T>> lookup(String key, Class<T> type, Callable<T> fetchFn, CacheOptions options) {
        if (options.strategy() == CacheStrategy.NO_CACHE) {
            return Optional.empty();
        }
        Optional<CacheEntry> cached = tiers.get(key);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        CacheEntry entry = cached.get();
        T value;
        try {
            value = tiers.decode(entry, type);
        } catch (UncheckedIOException e) {
            log.warn("[SMART-CACHE] Dropping undecodable entry {}: {}", key, e.getMessage());
            tiers.invalidate(key);
            return Optional.empty();
        }

        long now = clock.millis();
        if (entry.remainingMillis(now) <= refreshWindow(entry, options).toMillis()) {
            scheduleRefresh(key, fetchFn, options, entry);
        }
        CacheSource source = entry.tier() == CacheTier.HOT ? CacheSource.HOT : CacheSource.WARM;
        return Optional.of(new CacheResult<>(value, source, false, entry.ageMillis(now)));
    }

    private <T> CacheResult<T> await(String key, Class<T> type, CacheOptions options,
                                     CompletableFuture<Object> future, long timeoutMs) {
        try {
            Object value = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return CacheResult.fetched(type.cast(value));
        } catch (TimeoutException e) {
            log.warn("[SMART-CACHE] Fetch of {} exceeded {} ms", key, timeoutMs);
            return staleOrThrow(key, type, options, CacheFetchException.timeout(key, timeoutMs));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            CacheFetchException failure = cause instanceof CacheFetchException
                ? (CacheFetchException) cause
                : new CacheFetchException(key, "fetch failed: " + cause.getMessage(), cause);
            return staleOrThrow(key, type, options, failure);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheFetchException(key, "interrupted while waiting for fetch", e);
        }
    }

    private <T> CacheResult<T> staleOrThrow(String key, Class<T> type, CacheOptions options, CacheFetchException failure) {
        if (options.staleFallback() && options.strategy() != CacheStrategy.NO_CACHE) {
            Optional<CacheEntry> stale = tiers.getIncludingStale(key);
            if (stale.isPresent()) {
                CacheEntry entry = stale.get();
                long now = clock.millis();
                boolean expired = entry.isExpired(now);
                if (expired) {
                    tiers.recordStaleServed(key);
                }
                CacheSource source = entry.tier() == CacheTier.HOT ? CacheSource.HOT : CacheSource.WARM;
                return new CacheResult<>(tiers.decode(entry, type), source, expired, entry.ageMillis(now));
            }
        }
        throw failure;
    }

    // ═══════════════════════════════════════════════════════════════
    // Single flight
    // ═══════════════════════════════════════════════════════════════

    /**
     * @param missType value type when called after a miss; the tiers are read again once the
     *                 flight is owned, since a flight that finished between the miss and here has
     *                 already stored the value. {@code null} for refresh-ahead, which must fetch.
     */
    private CompletableFuture<Object> startFetch(String key, Class<?> missType, Callable<?> fetchFn,
                                                 CacheOptions options, Executor executor) {
        CompletableFuture<Object> created = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            metrics.recordCacheEvent(CacheEvent.SINGLE_FLIGHT_JOIN, CacheTier.HOT.name());
            return existing;
        }
        if (missType != null && options.strategy() != CacheStrategy.NO_CACHE) {
            Optional<Object> settled = freshValue(key, missType);
            if (settled.isPresent()) {
                metrics.recordCacheEvent(CacheEvent.SINGLE_FLIGHT_JOIN, CacheTier.HOT.name());
                inFlight.remove(key, created);
                created.complete(settled.get());
                return created;
            }
        }
        try {
            executor.execute(() -> runFetch(key, fetchFn, options, created));
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, created);
            created.completeExceptionally(new CacheFetchException(key, "fetch pool saturated", e));
        }
        return created;
    }

    private Optional<Object> freshValue(String key, Class<?> type) {
        Optional<CacheEntry> cached = tiers.getIncludingStale(key);
        if (cached.isEmpty() || cached.get().isExpired(clock.millis())) {
            return Optional.empty();
        }
        try {
            Object value = tiers.decode(cached.get(), type);
            return Optional.ofNullable(value);
        } catch (UncheckedIOException e) {
            log.warn("[SMART-CACHE] Refetching undecodable entry {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void runFetch(String key, Callable<?> fetchFn, CacheOptions options, CompletableFuture<Object> future) {
        long start = System.nanoTime();
        try {
            Object value = fetchFn.call();
            if (value != null && options.strategy() != CacheStrategy.NO_CACHE) {
                store(key, value, options);
            }
            metrics.recordFetchLatency(Duration.ofNanos(System.nanoTime() - start), true);
            inFlight.remove(key, future);
            future.complete(value);
        } catch (Exception e) {
            metrics.recordFetchLatency(Duration.ofNanos(System.nanoTime() - start), false);
            metrics.recordCacheEvent(CacheEvent.FETCH_ERROR, CacheTier.HOT.name());
            log.warn("[SMART-CACHE] Fetch of {} failed: {}", key, e.getMessage());
            CacheFetchException failure = e instanceof CacheFetchException
                ? (CacheFetchException) e
                : new CacheFetchException(key, "fetch failed: " + e.getMessage(), e);
            inFlight.remove(key, future);
            future.completeExceptionally(failure);
        }
    }

    private void store(String key, Object value, CacheOptions options) {
        switch (options.strategy()) {
            case MARKET_AWARE -> tiers.set(key, value,
                MarketContext.forSymbol(options.symbol(), sessions, options.ttlProfile()), options.compression());
            case STRONG_TIMELINESS -> tiers.set(key, value,
                options.ttlSeconds() > 0 ? options.ttlSeconds() : config.strongTtlSeconds(), options.compression());
            case WEAK_TIMELINESS -> tiers.set(key, value,
                options.ttlSeconds() > 0 ? options.ttlSeconds() : config.weakTtlSeconds(), options.compression());
            case ADAPTIVE -> tiers.set(key, value, adaptiveTtl(key, value), options.compression());
            case NO_CACHE -> { }
        }
    }

    /**
     * Halve the TTL when the value changed since the last store, double it when it did not.
     */
    private long adaptiveTtl(String key, Object value) {
        int hash = Arrays.hashCode(tiers.codec().serialize(value));
        AdaptiveState next = adaptive.compute(key, (k, prev) -> {
            if (prev == null) {
                return new AdaptiveState(config.adaptiveBaseTtlSeconds(), hash);
            }
            long ttl = prev.hash() != hash
                ? Math.max(config.adaptiveMinTtlSeconds(), prev.ttlSeconds() / 2)
                : Math.min(config.adaptiveMaxTtlSeconds(), prev.ttlSeconds() * 2);
            return new AdaptiveState(ttl, hash);
        });
        return next.ttlSeconds();
    }

    // ═══════════════════════════════════════════════════════════════
    // Refresh-ahead
    // ═══════════════════════════════════════════════════════════════

    private Duration refreshWindow(CacheEntry entry, CacheOptions options) {
        if (options.strategy() == CacheStrategy.STRONG_TIMELINESS) {
            return Duration.ofMillis(entry.ttlSeconds() * 500);
        }
        return options.refreshAhead() != null ? options.refreshAhead() : config.refreshAhead();
    }

    private void scheduleRefresh(String key, Callable<?> fetchFn, CacheOptions options, CacheEntry entry) {
        if (inFlight.containsKey(key)) {
            return;
        }
        Duration halfTtl = Duration.ofMillis(entry.ttlSeconds() * 500);
        Duration minInterval = halfTtl.compareTo(config.minUpdateInterval()) < 0 ? halfTtl : config.minUpdateInterval();

        boolean queued = updates.schedule(key, options.priority(), minInterval, () -> {
            CompletableFuture<Object> f = startFetch(key, null, fetchFn, options, Runnable::run);
            if (!f.isCompletedExceptionally()) {
                metrics.recordCacheEvent(CacheEvent.REFRESH_COMPLETED, CacheTier.HOT.name());
            }
        });
        if (queued) {
            metrics.recordCacheEvent(CacheEvent.REFRESH_SCHEDULED, CacheTier.HOT.name());
            log.debug("[SMART-CACHE] Refresh-ahead queued for {} ({} ms left)", key, entry.remainingMillis(clock.millis()));
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public int pendingRefreshes() {
        return updates.pendingCount();
    }

    public CacheStats stats() {
        return tiers.stats();
    }

    /**
     * Stop accepting refreshes, drain queued ones and wait for running fetches.
     */
    public void shutdown(Duration timeout) {
        log.info("[SMART-CACHE] Shutting down ({} in flight, {} refreshes pending)", inFlight.size(), updates.pendingCount());
        long start = clock.millis();
        updates.shutdown(timeout);
        fetchExecutor.shutdown();
        long remaining = Math.max(0, timeout.toMillis() - (clock.millis() - start));
        try {
            if (!fetchExecutor.awaitTermination(remaining, TimeUnit.MILLISECONDS)) {
                fetchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            fetchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Duration timeoutOf(CacheOptions options) {
        return options.timeout() != null ? options.timeout() : config.fetchTimeout();
    }

    private record AdaptiveState(long ttlSeconds, int hash) {}
}
