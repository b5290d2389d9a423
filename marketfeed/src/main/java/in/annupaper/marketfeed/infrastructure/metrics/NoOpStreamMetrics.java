package in.annupaper.marketfeed.infrastructure.metrics;

import java.time.Duration;

/**
 * Metrics sink that drops everything.
 */
public final class NoOpStreamMetrics implements StreamMetrics {

    public static final NoOpStreamMetrics INSTANCE = new NoOpStreamMetrics();

    private NoOpStreamMetrics() {}

    @Override public void recordStateTransition(String connectionId, String from, String to) {}
    @Override public void recordHeartbeatTimeout(String connectionId) {}
    @Override public void setActiveConnections(int count) {}
    @Override public void recordRateLimitRejection(String providerId) {}
    @Override public void recordRateLimitWait(String providerId, Duration waited) {}
    @Override public void recordRecoveryAttempt(String providerId, String outcome) {}
    @Override public void recordRecoveredTicks(String providerId, int count) {}
    @Override public void recordHealthCheck(String status, int healthy, int total) {}
    @Override public void recordDelivery(String mode, int consumers) {}
    @Override public void recordDeliveryDrop(String mode, String reason) {}
    @Override public void recordGatewayError() {}
    @Override public void recordFlagConflict() {}
    @Override public void recordEmergencyOverride(boolean automatic) {}
    @Override public void recordCacheEvent(CacheEvent event, String tier) {}
    @Override public void recordCompression(String profile, boolean compressed) {}
    @Override public void recordFetchLatency(Duration latency, boolean success) {}
}
