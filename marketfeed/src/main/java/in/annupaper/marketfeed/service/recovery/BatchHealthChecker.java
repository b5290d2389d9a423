package in.annupaper.marketfeed.service.recovery;

import in.annupaper.marketfeed.infrastructure.metrics.StreamMetrics;
import in.annupaper.marketfeed.service.stream.ConnectionState;
import in.annupaper.marketfeed.service.stream.ConnectionSnapshot;
import in.annupaper.marketfeed.service.stream.ConnectionSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Degraded-mode health check used when replay is unavailable.
 *
 * Connections are checked in batches, cheapest test first:
 * <ol>
 *   <li>Tier 1: state check. Anything not CONNECTED is unhealthy; CONNECTED with a beat inside
 *       one interval is healthy.</li>
 *   <li>Tier 2: heartbeat monitor verdict for the suspicious remainder.</li>
 *   <li>Tier 3: transport ping for whatever tier 2 could not clear.</li>
 * </ol>
 */
public class BatchHealthChecker {
    private static final Logger log = LoggerFactory.getLogger(BatchHealthChecker.class);

    private final ConnectionSupervisor supervisor;
    private final RecoveryConfig config;
    private final Duration heartbeatInterval;
    private final StreamMetrics metrics;
    private final Clock clock;

    public BatchHealthChecker(ConnectionSupervisor supervisor, RecoveryConfig config,
                              Duration heartbeatInterval, StreamMetrics metrics, Clock clock) {
        this.supervisor = supervisor;
        this.config = config;
        this.heartbeatInterval = heartbeatInterval;
        this.metrics = metrics;
        this.clock = clock;
    }

    public HealthReport check() {
        List<ConnectionSnapshot> snapshots = supervisor.snapshots();
        Map<String, Boolean> results = new LinkedHashMap<>();

        for (int start = 0; start < snapshots.size(); start += config.healthBatchSize()) {
            List<ConnectionSnapshot> batch = snapshots.subList(start, Math.min(start + config.healthBatchSize(), snapshots.size()));
            results.putAll(checkBatch(batch));
        }

        int healthy = (int) results.values().stream().filter(Boolean::booleanValue).count();
        int total = results.size();
        HealthStatus status = HealthStatus.fromRate(healthy, total);
        HealthReport report = new HealthReport(status, Map.copyOf(results), healthy, total, clock.instant());

        metrics.recordHealthCheck(status.name(), healthy, total);
        if (report.healthRate() < 0.5) {
            log.error("[RECOVERY] Batch health check: {} of {} connections healthy ({})", healthy, total, status);
        } else {
            log.info("[RECOVERY] Batch health check: {} of {} connections healthy ({})", healthy, total, status);
        }
        return report;
    }

    private Map<String, Boolean> checkBatch(List<ConnectionSnapshot> batch) {
        Map<String, Boolean> results = new LinkedHashMap<>();
        List<ConnectionSnapshot> suspicious = new ArrayList<>();

        // Tier 1
        for (ConnectionSnapshot s : batch) {
            if (s.state() != ConnectionState.CONNECTED) {
                results.put(s.key().id(), false);
            } else if (s.sinceLastHeartbeat().compareTo(heartbeatInterval) <= 0) {
                results.put(s.key().id(), true);
            } else {
                suspicious.add(s);
            }
        }

        // Tier 2
        List<ConnectionSnapshot> needPing = new ArrayList<>();
        for (ConnectionSnapshot s : suspicious) {
            if (s.heartbeatHealthy()) {
                results.put(s.key().id(), true);
            } else {
                needPing.add(s);
            }
        }

        // Tier 3
        Map<String, CompletableFuture<Boolean>> probes = new LinkedHashMap<>();
        for (ConnectionSnapshot s : needPing) {
            probes.put(s.key().id(), supervisor.probe(s.key(), config.healthTimeout()));
        }
        probes.forEach((id, probe) -> results.put(id, awaitProbe(id, probe)));

        if (!needPing.isEmpty()) {
            log.debug("[RECOVERY] Batch of {}: {} suspicious, {} pinged", batch.size(), suspicious.size(), needPing.size());
        }
        return results;
    }

    private boolean awaitProbe(String connectionId, CompletableFuture<Boolean> probe) {
        try {
            return probe.join();
        } catch (RuntimeException e) {
            log.warn("[RECOVERY] Ping for {} failed: {}", connectionId, e.getMessage());
            return false;
        }
    }
}
