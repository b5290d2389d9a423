package in.annupaper.marketfeed.service.stream;

import in.annupaper.marketfeed.domain.data.ConnectionKey;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Point-in-time view of a supervised connection, for health checks and diagnostics.
 */
public record ConnectionSnapshot(
    ConnectionKey key,
    ConnectionState state,
    Set<String> symbols,
    int consumerCount,
    Instant lastHeartbeat,
    Duration sinceLastHeartbeat,
    long lastSequence,
    long lastTickTimestamp,
    int reconnectAttempts,
    boolean heartbeatHealthy
) {}
