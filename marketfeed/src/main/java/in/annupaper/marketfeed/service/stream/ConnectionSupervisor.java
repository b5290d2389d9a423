package in.annupaper.marketfeed.service.stream;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;
import in.annupaper.marketfeed.infrastructure.metrics.StreamMetrics;
import in.annupaper.marketfeed.infrastructure.provider.ProviderAuthException;
import in.annupaper.marketfeed.infrastructure.provider.ProviderTransport;
import in.annupaper.marketfeed.infrastructure.provider.TransportException;
import in.annupaper.marketfeed.infrastructure.provider.TransportListener;
import in.annupaper.marketfeed.infrastructure.provider.TransportSession;
import in.annupaper.marketfeed.infrastructure.provider.common.HeartbeatMonitor;
import in.annupaper.marketfeed.service.ratelimit.AcquireResult;
import in.annupaper.marketfeed.service.ratelimit.RateLimitExceededException;
import in.annupaper.marketfeed.service.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns one long-lived upstream connection per (provider, capability).
 *
 * A connection is created on the first subscription for its key and driven through
 * {@link ConnectionStateMachine}. Subscriptions are reference counted per symbol and
 * consumer. Unsubscribing the last symbol starts a grace timer; a new subscription
 * within the grace period reuses the live link.
 *
 * Threading: each connection's state is guarded by its own monitor. Ticks are handed
 * to {@link TickListener}s outside that monitor, on the transport's callback thread,
 * so per-connection receipt order is preserved. Listeners must not block.
 */
public class ConnectionSupervisor {
    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private final Map<ConnectionKey, ManagedConnection> connections = new ConcurrentHashMap<>();
    private final List<TickListener> tickListeners = new CopyOnWriteArrayList<>();
    private final List<ConnectionListener> connectionListeners = new CopyOnWriteArrayList<>();

    private final ProviderTransport transport;
    private final RateLimiter rateLimiter;
    private final SupervisorConfig config;
    private final StreamMetrics metrics;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    public ConnectionSupervisor(ProviderTransport transport, RateLimiter rateLimiter,
                                SupervisorConfig config, StreamMetrics metrics) {
        this(transport, rateLimiter, config, metrics, Clock.systemUTC(), newScheduler(), true);
    }

    public ConnectionSupervisor(ProviderTransport transport, RateLimiter rateLimiter,
                                SupervisorConfig config, StreamMetrics metrics,
                                Clock clock, ScheduledExecutorService scheduler) {
        this(transport, rateLimiter, config, metrics, clock, scheduler, false);
    }

    private ConnectionSupervisor(ProviderTransport transport, RateLimiter rateLimiter,
                                 SupervisorConfig config, StreamMetrics metrics,
                                 Clock clock, ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    private static ScheduledExecutorService newScheduler() {
        return Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "Supervisor-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public void addTickListener(TickListener listener) {
        tickListeners.add(listener);
    }

    public void addConnectionListener(ConnectionListener listener) {
        connectionListeners.add(listener);
    }

    // ═══════════════════════════════════════════════════════════════
    // Subscribe / unsubscribe
    // ═══════════════════════════════════════════════════════════════

    /**
     * Reference {@code symbols} for {@code consumerId} on the connection for {@code key},
     * opening the connection if needed. Idempotent per (consumer, symbol).
     *
     * @throws RateLimitExceededException if the upstream subscribe could not be paced in
     *         within the permit timeout; nothing is registered in that case
     * @throws TransportException if the connection gave up reconnecting and is waiting for its
     *         remaining consumers to leave; nothing is registered in that case
     */
    public void subscribe(String consumerId, ConnectionKey key, Collection<String> symbols) {
        Objects.requireNonNull(consumerId, "consumerId");
        Objects.requireNonNull(key, "key");
        if (symbols.isEmpty()) {
            return;
        }

        while (true) {
            ManagedConnection conn = connections.computeIfAbsent(key, this::newConnection);

            boolean needsPermit;
            synchronized (conn) {
                if (conn.state == ConnectionState.CLOSED) {
                    connections.remove(key, conn);
                    continue;
                }
                rejectIfDisconnected(conn, consumerId);
                needsPermit = conn.state == ConnectionState.CONNECTED && hasUnreferenced(conn, symbols);
            }

            if (needsPermit) {
                AcquireResult permit = rateLimiter.acquireBlocking(key.providerId(), config.subscribePermitTimeout());
                if (!permit.isPermit()) {
                    log.warn("[{}] Subscribe for {} rejected by rate limiter", key, consumerId);
                    throw new RateLimitExceededException(key.providerId(), permit.waited());
                }
            }

            synchronized (conn) {
                if (conn.state == ConnectionState.CLOSED) {
                    connections.remove(key, conn);
                    continue;
                }
                rejectIfDisconnected(conn, consumerId);
                Set<String> added = conn.subscriptions.add(consumerId, symbols);
                cancelGraceTimer(conn);
                log.debug("[{}] {} subscribed {} (new upstream: {})", key, consumerId, symbols, added);

                if (conn.state == ConnectionState.IDLE) {
                    apply(conn, ConnectionEvent.SUBSCRIBE);
                    startHandshake(conn);
                } else if (conn.state == ConnectionState.CONNECTED && !added.isEmpty()) {
                    conn.pendingUnsubscribes.removeAll(added);
                    sendUpstream(conn, added, true);
                }
                // Other states resubscribe everything on the next successful handshake.
            }
            return;
        }
    }

    private void rejectIfDisconnected(ManagedConnection conn, String consumerId) {
        if (conn.state == ConnectionState.DISCONNECTED) {
            log.warn("[{}] Subscribe for {} refused: connection disconnected", conn.key, consumerId);
            throw new TransportException(conn.key, "connection disconnected");
        }
    }

    /**
     * Drop references held by {@code consumerId}. Symbols still referenced by other
     * consumers stay subscribed upstream.
     */
    public void unsubscribe(String consumerId, ConnectionKey key, Collection<String> symbols) {
        ManagedConnection conn = connections.get(key);
        if (conn == null) {
            return;
        }
        synchronized (conn) {
            Set<String> dropped = conn.subscriptions.remove(consumerId, symbols);
            afterUnsubscribe(conn, consumerId, dropped);
        }
    }

    /**
     * Remove {@code consumerId} from every connection.
     */
    public void unsubscribeAll(String consumerId) {
        for (ManagedConnection conn : connections.values()) {
            synchronized (conn) {
                Set<String> dropped = conn.subscriptions.removeConsumer(consumerId);
                afterUnsubscribe(conn, consumerId, dropped);
            }
        }
    }

    private void afterUnsubscribe(ManagedConnection conn, String consumerId, Set<String> dropped) {
        if (!dropped.isEmpty()) {
            log.debug("[{}] {} released {}", conn.key, consumerId, dropped);
            if (conn.state == ConnectionState.CONNECTED) {
                if (rateLimiter.tryAcquire(conn.key.providerId())) {
                    sendUpstream(conn, dropped, false);
                } else {
                    conn.pendingUnsubscribes.addAll(dropped);
                    log.debug("[{}] Upstream unsubscribe of {} queued until next heartbeat", conn.key, dropped);
                }
            }
        }
        if (conn.subscriptions.isEmpty()) {
            if (conn.state == ConnectionState.DISCONNECTED) {
                retire(conn);
            } else {
                startGraceTimer(conn);
            }
        }
    }

    private boolean hasUnreferenced(ManagedConnection conn, Collection<String> symbols) {
        for (String symbol : symbols) {
            if (conn.subscriptions.referenceCount(symbol) == 0) {
                return true;
            }
        }
        return false;
    }

    private void sendUpstream(ManagedConnection conn, Set<String> symbols, boolean subscribe) {
        TransportSession session = conn.session;
        if (session == null) {
            return;
        }
        try {
            if (subscribe) {
                session.subscribe(symbols);
            } else {
                session.unsubscribe(symbols);
            }
        } catch (RuntimeException e) {
            // The heartbeat or close callback will move the connection to RECONNECTING,
            // which resubscribes from the table.
            log.warn("[{}] Upstream {} of {} failed: {}", conn.key, subscribe ? "subscribe" : "unsubscribe",
                symbols, e.getMessage());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Grace timer and retirement
    // ═══════════════════════════════════════════════════════════════

    private void startGraceTimer(ManagedConnection conn) {
        if (conn.graceTimer != null || conn.state == ConnectionState.CLOSED) {
            return;
        }
        conn.graceElapsed = false;
        log.debug("[{}] No subscribers left, grace period {} ms", conn.key, config.gracePeriod().toMillis());
        conn.graceTimer = scheduler.schedule(() -> {
            synchronized (conn) {
                conn.graceTimer = null;
                conn.graceElapsed = true;
                maybeRetire(conn);
            }
        }, config.gracePeriod().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelGraceTimer(ManagedConnection conn) {
        conn.graceElapsed = false;
        if (conn.graceTimer != null) {
            conn.graceTimer.cancel(false);
            conn.graceTimer = null;
        }
    }

    /**
     * Retire if the grace period has elapsed with no subscribers. States that are in the
     * middle of a handshake or backoff are retired when they settle.
     */
    private void maybeRetire(ManagedConnection conn) {
        if (!conn.graceElapsed || !conn.subscriptions.isEmpty()) {
            return;
        }
        switch (conn.state) {
            case CONNECTED -> {
                apply(conn, ConnectionEvent.GRACE_EXPIRED);
                retire(conn);
            }
            case RECONNECTING -> {
                cancelRetry(conn);
                apply(conn, ConnectionEvent.RETRIES_EXHAUSTED);
                retire(conn);
            }
            case DISCONNECTED -> retire(conn);
            default -> log.debug("[{}] Retirement deferred in state {}", conn.key, conn.state);
        }
    }

    /**
     * DISCONNECTED with no subscribers goes to CLOSED; with subscribers it stays put.
     */
    private void retire(ManagedConnection conn) {
        teardownSession(conn);
        if (conn.state == ConnectionState.DISCONNECTED && conn.subscriptions.isEmpty()) {
            apply(conn, ConnectionEvent.NO_SUBSCRIBERS);
            cleanupClosed(conn);
        }
    }

    private void cleanupClosed(ManagedConnection conn) {
        teardownSession(conn);
        cancelGraceTimer(conn);
        cancelRetry(conn);
        conn.subscriptions.clear();
        conn.pendingUnsubscribes.clear();
        connections.remove(conn.key, conn);
        metrics.setActiveConnections(connections.size());
        log.info("[{}] Connection closed and released", conn.key);
    }

    // ═══════════════════════════════════════════════════════════════
    // Handshake and reconnect
    // ═══════════════════════════════════════════════════════════════

    private void startHandshake(ManagedConnection conn) {
        int generation = ++conn.generation;
        CompletableFuture<TransportSession> future;
        try {
            future = transport.connect(conn.key, new SessionListener(conn, generation));
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.orTimeout(config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((session, error) -> onHandshakeComplete(conn, generation, session, error));
    }

    private void onHandshakeComplete(ManagedConnection conn, int generation,
                                     TransportSession session, Throwable error) {
        synchronized (conn) {
            if (generation != conn.generation || conn.state == ConnectionState.CLOSED) {
                if (session != null) {
                    session.close();
                }
                return;
            }

            if (error == null) {
                boolean wasReconnect = conn.state == ConnectionState.RECONNECTING;
                conn.session = session;
                apply(conn, ConnectionEvent.HANDSHAKE_SUCCEEDED);
                conn.policy.recordSuccess();
                conn.lastSequence = Tick.NO_SEQUENCE;
                conn.lastHeartbeat = clock.instant();
                startHeartbeat(conn, generation);

                Set<String> symbols = conn.subscriptions.symbols();
                if (!symbols.isEmpty()) {
                    scheduler.execute(() -> resubscribe(conn, generation));
                }
                if (wasReconnect) {
                    long from = conn.lastTickTimestamp > 0
                        ? conn.lastTickTimestamp
                        : (conn.disconnectedAt != null ? conn.disconnectedAt.toEpochMilli() : clock.millis());
                    fireGap(gapEvent(conn, from, clock.millis(), "RECONNECT"));
                }
                maybeRetire(conn);
                return;
            }

            Throwable cause = unwrap(error);
            if (cause instanceof TimeoutException) {
                cause = new TransportException(conn.key, "Handshake timed out after " + config.connectTimeout().toMillis() + " ms", cause);
            }

            if (conn.state == ConnectionState.CONNECTING) {
                log.warn("[{}] Handshake failed: {}", conn.key, cause.getMessage());
                apply(conn, ConnectionEvent.HANDSHAKE_FAILED);
                handleError(conn, cause);
            } else if (conn.state == ConnectionState.RECONNECTING) {
                if (cause instanceof ProviderAuthException) {
                    log.error("[{}] Reconnect rejected by provider authentication, giving up: {}", conn.key, cause.getMessage());
                    apply(conn, ConnectionEvent.RETRIES_EXHAUSTED);
                    retire(conn);
                } else {
                    log.warn("[{}] Reconnect attempt {} failed: {}", conn.key, conn.policy.getAttemptCount() + 1, cause.getMessage());
                    conn.policy.recordFailure();
                    scheduleReconnectAttempt(conn);
                }
            }
        }
    }

    /**
     * In ERROR: authentication failures close the connection, everything else retries after backoff.
     */
    private void handleError(ManagedConnection conn, Throwable cause) {
        teardownSession(conn);
        if (cause instanceof ProviderAuthException) {
            log.error("[{}] Fatal authentication error, closing: {}", conn.key, cause.getMessage());
            apply(conn, ConnectionEvent.FATAL_ERROR);
            cleanupClosed(conn);
            return;
        }
        conn.policy.recordFailure();
        Duration delay = conn.policy.getNextDelayWithJitter();
        log.info("[{}] Retrying in {} ms", conn.key, delay.toMillis());
        conn.retryTask = scheduler.schedule(() -> {
            synchronized (conn) {
                conn.retryTask = null;
                if (conn.state != ConnectionState.ERROR) {
                    return;
                }
                apply(conn, ConnectionEvent.RETRY_AFTER_BACKOFF);
                if (conn.graceElapsed && conn.subscriptions.isEmpty()) {
                    maybeRetire(conn);
                    return;
                }
            }
            attemptReconnect(conn);
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void enterReconnecting(ManagedConnection conn, ConnectionEvent event) {
        apply(conn, event);
        teardownSession(conn);
        conn.disconnectedAt = clock.instant();
        scheduler.execute(() -> attemptReconnect(conn));
    }

    private void attemptReconnect(ManagedConnection conn) {
        synchronized (conn) {
            if (conn.state != ConnectionState.RECONNECTING) {
                return;
            }
        }

        AcquireResult permit = rateLimiter.acquireBlocking(conn.key.providerId(), config.connectTimeout());

        synchronized (conn) {
            if (conn.state != ConnectionState.RECONNECTING) {
                return;
            }
            if (!permit.isPermit()) {
                log.warn("[{}] No rate-limit permit for reconnect within {} ms", conn.key, permit.waited().toMillis());
                conn.policy.recordFailure();
                scheduleReconnectAttempt(conn);
                return;
            }
            log.info("[{}] Reconnect attempt {}/{}", conn.key, conn.policy.getAttemptCount() + 1, conn.policy.getMaxAttempts());
            startHandshake(conn);
        }
    }

    private void scheduleReconnectAttempt(ManagedConnection conn) {
        if (!conn.policy.shouldRetry()) {
            log.error("[{}] Reconnect attempts exhausted after {} tries", conn.key, conn.policy.getAttemptCount());
            apply(conn, ConnectionEvent.RETRIES_EXHAUSTED);
            retire(conn);
            return;
        }
        Duration delay = conn.policy.getNextDelayWithJitter();
        conn.retryTask = scheduler.schedule(() -> {
            synchronized (conn) {
                conn.retryTask = null;
            }
            attemptReconnect(conn);
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelRetry(ManagedConnection conn) {
        if (conn.retryTask != null) {
            conn.retryTask.cancel(false);
            conn.retryTask = null;
        }
    }

    private void resubscribe(ManagedConnection conn, int generation) {
        AcquireResult permit = rateLimiter.acquireBlocking(conn.key.providerId(), config.connectTimeout());
        synchronized (conn) {
            if (generation != conn.generation || conn.state != ConnectionState.CONNECTED) {
                return;
            }
            if (!permit.isPermit()) {
                log.warn("[{}] No permit to resubscribe, forcing reconnect", conn.key);
                enterReconnecting(conn, ConnectionEvent.TRANSPORT_CLOSED);
                return;
            }
            Set<String> symbols = conn.subscriptions.symbols();
            if (!symbols.isEmpty()) {
                log.info("[{}] Resubscribing {} symbols", conn.key, symbols.size());
                sendUpstream(conn, symbols, true);
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Heartbeat
    // ═══════════════════════════════════════════════════════════════

    private void startHeartbeat(ManagedConnection conn, int generation) {
        conn.heartbeat = new HeartbeatMonitor(
            conn.key.id(),
            config.heartbeatInterval(),
            config.missedHeartbeats(),
            clock,
            scheduler,
            () -> onHeartbeatTick(conn, generation),
            () -> onHeartbeatTimeout(conn, generation)
        );
        conn.heartbeat.start();
    }

    private void onHeartbeatTick(ManagedConnection conn, int generation) {
        synchronized (conn) {
            if (generation != conn.generation || conn.session == null) {
                return;
            }
            conn.session.sendHeartbeat();
            if (!conn.pendingUnsubscribes.isEmpty() && rateLimiter.tryAcquire(conn.key.providerId())) {
                Set<String> pending = new HashSet<>(conn.pendingUnsubscribes);
                conn.pendingUnsubscribes.clear();
                sendUpstream(conn, pending, false);
            }
        }
    }

    private void onHeartbeatTimeout(ManagedConnection conn, int generation) {
        synchronized (conn) {
            if (generation != conn.generation || conn.state != ConnectionState.CONNECTED) {
                return;
            }
            metrics.recordHeartbeatTimeout(conn.key.id());
            enterReconnecting(conn, ConnectionEvent.HEARTBEAT_TIMEOUT);
        }
    }

    /**
     * Run one heartbeat evaluation now. Used by tests and the tier-2 health check.
     */
    public void evaluateHeartbeat(ConnectionKey key) {
        ManagedConnection conn = connections.get(key);
        if (conn == null) {
            return;
        }
        HeartbeatMonitor heartbeat;
        synchronized (conn) {
            heartbeat = conn.heartbeat;
        }
        if (heartbeat != null) {
            heartbeat.evaluate();
        }
    }

    /**
     * Ping the provider and wait for a heartbeat reply.
     *
     * @return future completing with true if a beat arrives within {@code timeout}
     */
    public CompletableFuture<Boolean> probe(ConnectionKey key, Duration timeout) {
        ManagedConnection conn = connections.get(key);
        if (conn == null) {
            return CompletableFuture.completedFuture(false);
        }
        CompletableFuture<Boolean> probe = new CompletableFuture<>();
        synchronized (conn) {
            if (conn.state != ConnectionState.CONNECTED || conn.session == null) {
                return CompletableFuture.completedFuture(false);
            }
            conn.probes.add(probe);
            try {
                conn.session.sendHeartbeat();
            } catch (RuntimeException e) {
                conn.probes.remove(probe);
                return CompletableFuture.completedFuture(false);
            }
        }
        return probe.completeOnTimeout(false, timeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((ok, err) -> {
                synchronized (conn) {
                    conn.probes.remove(probe);
                }
            });
    }

    // ═══════════════════════════════════════════════════════════════
    // Transport callbacks
    // ═══════════════════════════════════════════════════════════════

    private final class SessionListener implements TransportListener {
        private final ManagedConnection conn;
        private final int generation;

        SessionListener(ManagedConnection conn, int generation) {
            this.conn = conn;
            this.generation = generation;
        }

        @Override
        public void onTick(Tick tick) {
            GapEvent gap = null;
            boolean referenced;
            synchronized (conn) {
                if (generation != conn.generation || conn.state != ConnectionState.CONNECTED) {
                    return;
                }
                recordBeat(conn);
                if (tick.hasSequence()) {
                    if (conn.lastSequence != Tick.NO_SEQUENCE && tick.sequence() > conn.lastSequence + 1) {
                        log.warn("[{}] Sequence gap {} -> {}", conn.key, conn.lastSequence, tick.sequence());
                        gap = gapEvent(conn, conn.lastTickTimestamp, tick.timestamp(), "SEQUENCE");
                    }
                    conn.lastSequence = Math.max(conn.lastSequence, tick.sequence());
                }
                conn.lastTickTimestamp = Math.max(conn.lastTickTimestamp, tick.timestamp());
                referenced = conn.subscriptions.referenceCount(tick.symbol()) > 0;
            }

            if (gap != null) {
                fireGap(gap);
            }
            if (!referenced) {
                return;
            }
            for (TickListener listener : tickListeners) {
                try {
                    listener.onTick(conn.key, tick);
                } catch (Exception e) {
                    log.error("[{}] Tick listener threw exception", conn.key, e);
                }
            }
        }

        @Override
        public void onHeartbeat() {
            List<CompletableFuture<Boolean>> probes;
            synchronized (conn) {
                if (generation != conn.generation) {
                    return;
                }
                recordBeat(conn);
                probes = new ArrayList<>(conn.probes);
                conn.probes.clear();
            }
            probes.forEach(p -> p.complete(true));
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            synchronized (conn) {
                if (generation != conn.generation || conn.state != ConnectionState.CONNECTED) {
                    return;
                }
                log.warn("[{}] Transport closed by peer: {} {}", conn.key, statusCode, reason);
                enterReconnecting(conn, ConnectionEvent.TRANSPORT_CLOSED);
            }
        }

        @Override
        public void onError(Throwable error) {
            synchronized (conn) {
                if (generation != conn.generation || conn.state != ConnectionState.CONNECTED) {
                    return;
                }
                log.warn("[{}] Protocol violation: {}", conn.key, error.getMessage());
                apply(conn, ConnectionEvent.PROTOCOL_VIOLATION);
                handleError(conn, error);
            }
        }
    }

    private void recordBeat(ManagedConnection conn) {
        conn.lastHeartbeat = clock.instant();
        if (conn.heartbeat != null) {
            conn.heartbeat.recordBeat();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Queries
    // ═══════════════════════════════════════════════════════════════

    public Optional<ConnectionState> state(ConnectionKey key) {
        ManagedConnection conn = connections.get(key);
        if (conn == null) {
            return Optional.empty();
        }
        synchronized (conn) {
            return Optional.of(conn.state);
        }
    }

    public Set<String> consumersFor(ConnectionKey key, String symbol) {
        ManagedConnection conn = connections.get(key);
        if (conn == null) {
            return Set.of();
        }
        synchronized (conn) {
            return conn.subscriptions.consumersOf(symbol);
        }
    }

    /**
     * Consumers of {@code symbol} across every connection.
     */
    public Set<String> consumersForSymbol(String symbol) {
        Set<String> result = new HashSet<>();
        for (ManagedConnection conn : connections.values()) {
            synchronized (conn) {
                result.addAll(conn.subscriptions.consumersOf(symbol));
            }
        }
        return result;
    }

    public Set<String> symbolsFor(String consumerId, ConnectionKey key) {
        ManagedConnection conn = connections.get(key);
        if (conn == null) {
            return Set.of();
        }
        synchronized (conn) {
            return conn.subscriptions.symbolsOf(consumerId);
        }
    }

    /**
     * True if {@code consumerId} holds at least one symbol on any connection.
     */
    public boolean isSubscribed(String consumerId) {
        for (ManagedConnection conn : connections.values()) {
            synchronized (conn) {
                if (!conn.subscriptions.symbolsOf(consumerId).isEmpty()) {
                    return true;
                }
            }
        }
        return false;
    }

    public Set<ConnectionKey> activeConnections() {
        return Set.copyOf(connections.keySet());
    }

    public Optional<ConnectionSnapshot> snapshot(ConnectionKey key) {
        ManagedConnection conn = connections.get(key);
        if (conn == null) {
            return Optional.empty();
        }
        synchronized (conn) {
            return Optional.of(snapshotOf(conn));
        }
    }

    public List<ConnectionSnapshot> snapshots() {
        List<ConnectionSnapshot> result = new ArrayList<>();
        for (ManagedConnection conn : connections.values()) {
            synchronized (conn) {
                result.add(snapshotOf(conn));
            }
        }
        return result;
    }

    private ConnectionSnapshot snapshotOf(ManagedConnection conn) {
        Duration since = conn.lastHeartbeat == null ? Duration.ZERO : Duration.between(conn.lastHeartbeat, clock.instant());
        return new ConnectionSnapshot(
            conn.key,
            conn.state,
            conn.subscriptions.symbols(),
            conn.subscriptions.consumers().size(),
            conn.lastHeartbeat,
            since,
            conn.lastSequence,
            conn.lastTickTimestamp,
            conn.policy.getAttemptCount(),
            conn.heartbeat != null && conn.heartbeat.isHealthy()
        );
    }

    /**
     * Close every connection and stop the scheduler if this supervisor created it.
     * Shutdown bypasses the state table: connections are simply released.
     */
    public void stop() {
        log.info("[SUPERVISOR] Stopping {} connections", connections.size());
        for (ManagedConnection conn : connections.values()) {
            synchronized (conn) {
                teardownSession(conn);
                cancelGraceTimer(conn);
                cancelRetry(conn);
                conn.generation++;
            }
        }
        connections.clear();
        metrics.setActiveConnections(0);

        if (ownsScheduler) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Internals
    // ═══════════════════════════════════════════════════════════════

    private ManagedConnection newConnection(ConnectionKey key) {
        log.info("[{}] Creating connection", key);
        ManagedConnection conn = new ManagedConnection(key, config.reconnectionPolicy());
        metrics.setActiveConnections(connections.size() + 1);
        return conn;
    }

    private void apply(ManagedConnection conn, ConnectionEvent event) {
        ConnectionState from = conn.state;
        ConnectionState to = ConnectionStateMachine.transition(from, event);
        conn.state = to;
        log.info("[{}] {} -> {} ({})", conn.key, from, to, event);
        metrics.recordStateTransition(conn.key.id(), from.name(), to.name());
        for (ConnectionListener listener : connectionListeners) {
            try {
                listener.onStateChange(conn.key, from, to);
            } catch (Exception e) {
                log.error("[{}] Connection listener threw exception", conn.key, e);
            }
        }
    }

    private void teardownSession(ManagedConnection conn) {
        if (conn.heartbeat != null) {
            conn.heartbeat.stop();
            conn.heartbeat = null;
        }
        if (conn.session != null) {
            TransportSession session = conn.session;
            conn.session = null;
            conn.generation++;
            try {
                session.close();
            } catch (RuntimeException e) {
                log.debug("[{}] Error closing session: {}", conn.key, e.getMessage());
            }
        }
        conn.probes.forEach(p -> p.complete(false));
        conn.probes.clear();
    }

    private GapEvent gapEvent(ManagedConnection conn, long from, long to, String reason) {
        Map<String, Set<String>> bySymbol = new LinkedHashMap<>();
        for (String consumer : conn.subscriptions.consumers()) {
            bySymbol.put(consumer, conn.subscriptions.symbolsOf(consumer));
        }
        return new GapEvent(conn.key, from, to, bySymbol, reason);
    }

    private void fireGap(GapEvent gap) {
        if (gap.symbolsByConsumer().isEmpty()) {
            return;
        }
        for (ConnectionListener listener : connectionListeners) {
            try {
                listener.onGap(gap);
            } catch (Exception e) {
                log.error("[{}] Gap listener threw exception", gap.key(), e);
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
