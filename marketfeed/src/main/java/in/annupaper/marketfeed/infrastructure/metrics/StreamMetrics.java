package in.annupaper.marketfeed.infrastructure.metrics;

import java.time.Duration;

/**
 * Metrics emitted by the streaming fetcher and the cache tiers.
 *
 * Implementations can publish to Prometheus or drop everything (tests, tools).
 */
public interface StreamMetrics {

    /**
     * Record a connection state change.
     *
     * @param connectionId provider:capability id
     * @param from previous state name
     * @param to new state name
     */
    void recordStateTransition(String connectionId, String from, String to);

    void recordHeartbeatTimeout(String connectionId);

    void setActiveConnections(int count);

    /**
     * Record a denied permit (immediate denial or a blocking acquire that timed out).
     */
    void recordRateLimitRejection(String providerId);

    void recordRateLimitWait(String providerId, Duration waited);

    /**
     * Record the outcome of one recovery job attempt.
     *
     * @param providerId provider
     * @param outcome SUCCESS, RETRY, FAILED or UNAVAILABLE
     */
    void recordRecoveryAttempt(String providerId, String outcome);

    void recordRecoveredTicks(String providerId, int count);

    /**
     * Record a degraded batch health check result.
     */
    void recordHealthCheck(String status, int healthy, int total);

    void recordDelivery(String mode, int consumers);

    void recordDeliveryDrop(String mode, String reason);

    void recordGatewayError();

    void recordFlagConflict();

    void recordEmergencyOverride(boolean automatic);

    void recordCacheEvent(CacheEvent event, String tier);

    void recordCompression(String profile, boolean compressed);

    void recordFetchLatency(Duration latency, boolean success);

    /**
     * Cache events.
     */
    enum CacheEvent {
        HIT,
        MISS,
        STALE_SERVED,
        REFRESH_SCHEDULED,
        REFRESH_COMPLETED,
        EVICTION,
        SINGLE_FLIGHT_JOIN,
        FETCH_ERROR,
        DEGRADED_SCAN
    }
}
