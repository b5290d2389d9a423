package in.annupaper.marketfeed.service.broadcast;

import in.annupaper.marketfeed.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AutoRollbackMonitor.
 *
 * Tests:
 * - Client disconnect spike triggers rollback
 * - Gateway error rate needs a minimum sample
 * - Observation window expiry
 * - Strict mode and open overrides block rollback
 */
class AutoRollbackMonitorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-04T10:00:00Z"));
    private final AtomicReference<FeatureFlagSet> flags =
        new AtomicReference<>(FeatureFlagSet.defaults().withStrictMode(false));
    private final List<String> rollbacks = new ArrayList<>();
    private AutoRollbackMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new AutoRollbackMonitor(clock, flags::get);
        monitor.onRollback(rollbacks::add);
    }

    @Test
    void testDisconnectSpikeTriggersRollback() {
        monitor.recordClientDisconnections(10, 100);
        assertTrue(rollbacks.isEmpty(), "10% is under the 20% threshold");

        monitor.recordClientDisconnections(15, 100);

        assertEquals(1, rollbacks.size());
        assertTrue(rollbacks.get(0).contains("client disconnect spike"));
        assertEquals(0, monitor.snapshot().clientDisconnections(), "Counters reset after rollback");
    }

    @Test
    void testWindowExpiryResetsCounters() {
        monitor.recordClientDisconnections(15, 100);
        clock.advance(Duration.ofMinutes(6));

        monitor.recordClientDisconnections(10, 100);

        assertTrue(rollbacks.isEmpty());
        assertEquals(10, monitor.snapshot().clientDisconnections());
    }

    @Test
    void testGatewayErrorsNeedMinimumSample() {
        for (int i = 0; i < AutoRollbackMonitor.MIN_GATEWAY_SAMPLES - 1; i++) {
            monitor.recordGatewayResult(false);
        }
        assertTrue(rollbacks.isEmpty());

        monitor.recordGatewayResult(false);

        assertEquals(1, rollbacks.size());
        assertTrue(rollbacks.get(0).contains("gateway error rate"));
    }

    @Test
    void testLowGatewayErrorRateDoesNotRollBack() {
        monitor.recordGatewayErrors(1, 100);

        assertTrue(rollbacks.isEmpty());
        assertEquals(0.01, monitor.gatewayErrorRate(), 1e-9);
    }

    @Test
    void testStrictModeBlocksRollback() {
        flags.set(FeatureFlagSet.defaults());

        monitor.recordClientDisconnections(50, 100);
        monitor.recordGatewayErrors(20, 20);

        assertTrue(rollbacks.isEmpty());
    }

    @Test
    void testOpenOverrideBlocksRollback() {
        flags.set(FeatureFlagSet.defaults().withEmergencyOverride("manual"));

        monitor.recordClientDisconnections(50, 100);

        assertTrue(rollbacks.isEmpty());
    }

    @Test
    void testSnapshotCountsTriggers() {
        monitor.recordEmergencyTrigger();
        monitor.recordEmergencyTrigger();
        monitor.recordGatewayErrors(1, 4);

        AutoRollbackMonitor.RollbackMetrics metrics = monitor.snapshot();

        assertEquals(2, metrics.emergencyTriggers());
        assertEquals(1, metrics.gatewayErrors());
        assertEquals(4, metrics.gatewayPublishes());
        assertEquals(0.25, monitor.gatewayErrorRate(), 1e-9);
    }
}
