package in.annupaper.marketfeed.service.broadcast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Watches gateway health over a fixed observation window and forces the emergency legacy
 * override when clients drop off or gateway publishes start failing.
 *
 * Never acts in strict mode or while an override is already open. Counters reset when
 * their window expires and after a rollback.
 */
public class AutoRollbackMonitor {
    private static final Logger log = LoggerFactory.getLogger(AutoRollbackMonitor.class);

    /** Gateway error rate is not judged on fewer publishes than this. */
    static final int MIN_GATEWAY_SAMPLES = 20;

    private final Clock clock;
    private final Supplier<FeatureFlagSet> flags;
    private Consumer<String> rollbackAction = reason -> {};

    private final Window disconnects = new Window();
    private final Window gatewayErrors = new Window();
    private final Window emergencyTriggers = new Window();
    private int lastClientTotal;
    private boolean strictBlockLogged;

    public AutoRollbackMonitor(Clock clock, Supplier<FeatureFlagSet> flags) {
        this.clock = clock;
        this.flags = flags;
    }

    /**
     * Called with the rollback reason when a threshold is crossed.
     */
    public void onRollback(Consumer<String> action) {
        this.rollbackAction = action;
    }

    public void recordClientDisconnections(int disconnected, int totalClients) {
        String trigger = null;
        synchronized (this) {
            FeatureFlagSet f = flags.get();
            disconnects.roll(now(), f);
            disconnects.count += disconnected;
            disconnects.total = Math.max(disconnects.total, totalClients);
            lastClientTotal = totalClients;

            double percent = disconnects.total == 0 ? 0 : disconnects.count * 100.0 / disconnects.total;
            if (percent > f.clientDisconnectSpikePercent()) {
                trigger = String.format("Auto-rollback: client disconnect spike %.1f%% > %.1f%%",
                    percent, f.clientDisconnectSpikePercent());
            }
        }
        maybeRollback(trigger);
    }

    public void recordGatewayResult(boolean success) {
        recordGatewayErrors(success ? 0 : 1, 1);
    }

    public void recordGatewayErrors(int errors, int publishes) {
        String trigger = null;
        synchronized (this) {
            FeatureFlagSet f = flags.get();
            gatewayErrors.roll(now(), f);
            gatewayErrors.count += errors;
            gatewayErrors.total += publishes;

            if (gatewayErrors.total >= MIN_GATEWAY_SAMPLES) {
                double percent = gatewayErrors.count * 100.0 / gatewayErrors.total;
                if (percent > f.gatewayErrorRollbackPercent()) {
                    trigger = String.format("Auto-rollback: gateway error rate %.1f%% > %.1f%%",
                        percent, f.gatewayErrorRollbackPercent());
                }
            }
        }
        maybeRollback(trigger);
    }

    /**
     * Count an emergency override, manual or automatic.
     */
    public synchronized void recordEmergencyTrigger() {
        FeatureFlagSet f = flags.get();
        emergencyTriggers.roll(now(), f);
        emergencyTriggers.count++;
        if (emergencyTriggers.count > f.emergencyTriggerThreshold()) {
            log.warn("[ROUTER] {} emergency overrides within {} s, threshold {}. Gateway needs attention",
                emergencyTriggers.count, f.observationWindow().toSeconds(), f.emergencyTriggerThreshold());
        }
    }

    /**
     * Gateway error rate in the current window, 0 when nothing was published.
     */
    public synchronized double gatewayErrorRate() {
        gatewayErrors.roll(now(), flags.get());
        return gatewayErrors.total == 0 ? 0.0 : (double) gatewayErrors.count / gatewayErrors.total;
    }

    public synchronized RollbackMetrics snapshot() {
        FeatureFlagSet f = flags.get();
        long now = now();
        disconnects.roll(now, f);
        gatewayErrors.roll(now, f);
        emergencyTriggers.roll(now, f);
        return new RollbackMetrics(disconnects.count, lastClientTotal, gatewayErrors.count, gatewayErrors.total,
            emergencyTriggers.count);
    }

    private void maybeRollback(String trigger) {
        if (trigger == null) {
            return;
        }
        FeatureFlagSet f = flags.get();
        if (f.emergencyOverride()) {
            return;
        }
        if (f.strictMode()) {
            synchronized (this) {
                if (!strictBlockLogged) {
                    log.warn("[ROUTER] {} blocked: strict mode is on", trigger);
                    strictBlockLogged = true;
                }
            }
            return;
        }
        log.warn("[ROUTER] {}", trigger);
        synchronized (this) {
            disconnects.reset(now());
            gatewayErrors.reset(now());
        }
        rollbackAction.accept(trigger);
    }

    private long now() {
        return clock.millis();
    }

    public record RollbackMetrics(int clientDisconnections, int clientTotal, int gatewayErrors,
                                  int gatewayPublishes, int emergencyTriggers) {}

    private final class Window {
        long start = -1;
        int count;
        int total;

        void roll(long now, FeatureFlagSet f) {
            if (start < 0 || now - start > f.observationWindow().toMillis()) {
                reset(now);
            }
        }

        void reset(long now) {
            start = now;
            count = 0;
            total = 0;
            strictBlockLogged = false;
        }
    }
}
