package in.annupaper.marketfeed.service.recovery;

import java.time.Instant;
import java.util.Map;

/**
 * Result of a degraded-mode batch health check.
 *
 * @param results connection id to healthy flag
 */
public record HealthReport(
    HealthStatus status,
    Map<String, Boolean> results,
    int healthy,
    int total,
    Instant checkedAt
) {
    public double healthRate() {
        return total == 0 ? 1.0 : (double) healthy / total;
    }
}
