package in.annupaper.marketfeed.service.recovery;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    DOWN;

    static HealthStatus fromRate(int healthy, int total) {
        if (total == 0 || healthy == total) {
            return HEALTHY;
        }
        return (double) healthy / total >= 0.5 ? DEGRADED : DOWN;
    }
}
