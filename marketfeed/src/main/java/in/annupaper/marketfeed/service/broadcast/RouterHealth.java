package in.annupaper.marketfeed.service.broadcast;

import java.util.List;

/**
 * Router status for operators.
 *
 * @param status healthy, degraded or critical
 */
public record RouterHealth(
    String status,
    DeliveryMode mode,
    FeatureFlagSet flags,
    long delivered,
    long dropped,
    double gatewayErrorRate,
    AutoRollbackMonitor.RollbackMetrics rollback,
    LegacyRemovalReadiness readiness,
    List<String> recommendations
) {}
