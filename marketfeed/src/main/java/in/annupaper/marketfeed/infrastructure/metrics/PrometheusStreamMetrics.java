package in.annupaper.marketfeed.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of {@link StreamMetrics}.
 *
 * Key series:
 * - marketfeed_connection_transitions_total{connection, from, to}
 * - marketfeed_rate_limit_rejections_total{provider}
 * - marketfeed_recovery_attempts_total{provider, outcome}
 * - marketfeed_deliveries_total{mode}
 * - marketfeed_cache_events_total{event, tier}
 * - marketfeed_cache_fetch_latency_seconds{status}
 *
 * Exposed through {@link PrometheusMetricsHandler} at /metrics.
 */
public class PrometheusStreamMetrics implements StreamMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusStreamMetrics.class);

    private final CollectorRegistry registry;

    // Connection metrics
    private final Counter transitionCounter;
    private final Counter heartbeatTimeoutCounter;
    private final Gauge activeConnections;
    private final Gauge connectionUp;

    // Rate limit metrics
    private final Counter rateLimitRejections;
    private final Histogram rateLimitWait;

    // Recovery metrics
    private final Counter recoveryAttempts;
    private final Counter recoveredTicks;
    private final Counter healthChecks;
    private final Gauge healthyConnections;

    // Delivery metrics
    private final Counter deliveries;
    private final Counter deliveryDrops;
    private final Counter gatewayErrors;
    private final Counter flagConflicts;
    private final Counter emergencyOverrides;

    // Cache metrics
    private final Counter cacheEvents;
    private final Counter compressionDecisions;
    private final Histogram fetchLatency;

    public PrometheusStreamMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusStreamMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.transitionCounter = Counter.build()
            .name("marketfeed_connection_transitions_total")
            .help("Connection state transitions")
            .labelNames("connection", "from", "to")
            .register(registry);

        this.heartbeatTimeoutCounter = Counter.build()
            .name("marketfeed_heartbeat_timeouts_total")
            .help("Heartbeat timeouts detected")
            .labelNames("connection")
            .register(registry);

        this.activeConnections = Gauge.build()
            .name("marketfeed_active_connections")
            .help("Connections currently supervised")
            .register(registry);

        this.connectionUp = Gauge.build()
            .name("marketfeed_connection_up")
            .help("Connection status (1=connected, 0=not connected)")
            .labelNames("connection")
            .register(registry);

        this.rateLimitRejections = Counter.build()
            .name("marketfeed_rate_limit_rejections_total")
            .help("Permits denied by the provider rate limiter")
            .labelNames("provider")
            .register(registry);

        this.rateLimitWait = Histogram.build()
            .name("marketfeed_rate_limit_wait_seconds")
            .help("Time spent waiting for a permit")
            .labelNames("provider")
            .buckets(0.001, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        this.recoveryAttempts = Counter.build()
            .name("marketfeed_recovery_attempts_total")
            .help("Recovery job attempts by outcome")
            .labelNames("provider", "outcome")
            .register(registry);

        this.recoveredTicks = Counter.build()
            .name("marketfeed_recovered_ticks_total")
            .help("Ticks replayed to consumers after a gap")
            .labelNames("provider")
            .register(registry);

        this.healthChecks = Counter.build()
            .name("marketfeed_health_checks_total")
            .help("Degraded batch health checks by resulting status")
            .labelNames("status")
            .register(registry);

        this.healthyConnections = Gauge.build()
            .name("marketfeed_healthy_connection_ratio")
            .help("Healthy share of connections in the last batch health check")
            .register(registry);

        this.deliveries = Counter.build()
            .name("marketfeed_deliveries_total")
            .help("Tick deliveries to consumers")
            .labelNames("mode")
            .register(registry);

        this.deliveryDrops = Counter.build()
            .name("marketfeed_delivery_drops_total")
            .help("Deliveries skipped or failed")
            .labelNames("mode", "reason")
            .register(registry);

        this.gatewayErrors = Counter.build()
            .name("marketfeed_gateway_errors_total")
            .help("Gateway broadcast failures")
            .register(registry);

        this.flagConflicts = Counter.build()
            .name("marketfeed_flag_conflicts_total")
            .help("Feature flag conflicts detected")
            .register(registry);

        this.emergencyOverrides = Counter.build()
            .name("marketfeed_emergency_overrides_total")
            .help("Emergency legacy re-enables")
            .labelNames("trigger")
            .register(registry);

        this.cacheEvents = Counter.build()
            .name("marketfeed_cache_events_total")
            .help("Cache events by tier")
            .labelNames("event", "tier")
            .register(registry);

        this.compressionDecisions = Counter.build()
            .name("marketfeed_cache_compression_total")
            .help("Compression decisions on cache writes")
            .labelNames("profile", "compressed")
            .register(registry);

        this.fetchLatency = Histogram.build()
            .name("marketfeed_cache_fetch_latency_seconds")
            .help("Upstream fetch latency on cache miss or refresh")
            .labelNames("status")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        log.info("[PrometheusStreamMetrics] Initialized");
    }

    @Override
    public void recordStateTransition(String connectionId, String from, String to) {
        transitionCounter.labels(connectionId, from, to).inc();
        connectionUp.labels(connectionId).set("CONNECTED".equals(to) ? 1 : 0);
    }

    @Override
    public void recordHeartbeatTimeout(String connectionId) {
        heartbeatTimeoutCounter.labels(connectionId).inc();
    }

    @Override
    public void setActiveConnections(int count) {
        activeConnections.set(count);
    }

    @Override
    public void recordRateLimitRejection(String providerId) {
        rateLimitRejections.labels(providerId).inc();
    }

    @Override
    public void recordRateLimitWait(String providerId, Duration waited) {
        rateLimitWait.labels(providerId).observe(waited.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordRecoveryAttempt(String providerId, String outcome) {
        recoveryAttempts.labels(providerId, outcome).inc();
    }

    @Override
    public void recordRecoveredTicks(String providerId, int count) {
        recoveredTicks.labels(providerId).inc(count);
    }

    @Override
    public void recordHealthCheck(String status, int healthy, int total) {
        healthChecks.labels(status).inc();
        healthyConnections.set(total == 0 ? 1.0 : (double) healthy / total);
    }

    @Override
    public void recordDelivery(String mode, int consumers) {
        deliveries.labels(mode).inc(consumers);
    }

    @Override
    public void recordDeliveryDrop(String mode, String reason) {
        deliveryDrops.labels(mode, reason).inc();
    }

    @Override
    public void recordGatewayError() {
        gatewayErrors.inc();
    }

    @Override
    public void recordFlagConflict() {
        flagConflicts.inc();
    }

    @Override
    public void recordEmergencyOverride(boolean automatic) {
        emergencyOverrides.labels(automatic ? "auto" : "operator").inc();
    }

    @Override
    public void recordCacheEvent(CacheEvent event, String tier) {
        cacheEvents.labels(event.name(), tier).inc();
    }

    @Override
    public void recordCompression(String profile, boolean compressed) {
        compressionDecisions.labels(profile, Boolean.toString(compressed)).inc();
    }

    @Override
    public void recordFetchLatency(Duration latency, boolean success) {
        fetchLatency.labels(success ? "success" : "failure").observe(latency.toNanos() / 1_000_000_000.0);
    }

    /**
     * Get Prometheus registry for /metrics endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
