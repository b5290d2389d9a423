package in.annupaper.marketfeed.service.broadcast;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;
import in.annupaper.marketfeed.infrastructure.metrics.NoOpStreamMetrics;
import in.annupaper.marketfeed.service.stream.ConnectionSupervisor;
import in.annupaper.marketfeed.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BroadcastRouter.
 *
 * Tests:
 * - Startup flag validation
 * - Legacy and gateway delivery paths
 * - Emergency override and its audit trail
 * - Runtime flag updates by validation mode
 * - Legacy removal readiness
 * - Automatic rollback on gateway errors
 */
@ExtendWith(MockitoExtension.class)
class BroadcastRouterTest {

    private static final ConnectionKey KEY = ConnectionKey.of("P1", "quote-stream");

    @Mock
    private ConnectionSupervisor supervisor;

    @Mock
    private BroadcastBus bus;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-04T10:00:00Z"));
    private ConsumerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConsumerRegistry();
    }

    private BroadcastRouter router(FeatureFlagSet flags) {
        return new BroadcastRouter(flags, supervisor, registry, bus, NoOpStreamMetrics.INSTANCE, clock);
    }

    private static Tick tick(String symbol) {
        return Tick.of(symbol, new BigDecimal("101.5"), 1_709_546_400_000L);
    }

    private static final class RecordingConsumer implements TickConsumer {
        private final String id;
        private final boolean gatewayCapable;
        final List<Tick> received = new CopyOnWriteArrayList<>();

        RecordingConsumer(String id, boolean gatewayCapable) {
            this.id = id;
            this.gatewayCapable = gatewayCapable;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public boolean gatewayCapable() {
            return gatewayCapable;
        }

        @Override
        public void onTick(ConnectionKey source, Tick tick) {
            received.add(tick);
        }
    }

    @Test
    @DisplayName("Strict mode plus legacy fallback refuses to start")
    void testConflictingFlagsAbortStartup() {
        BroadcastRouter router = router(FeatureFlagSet.defaults().withAllowLegacyFallback(true));

        assertThrows(ConfigConflictException.class, router::start);
        assertFalse(router.isStarted());
    }

    @Test
    void testTicksBeforeStartAreDropped() {
        BroadcastRouter router = router(FeatureFlagSet.defaults());

        router.onTick(KEY, tick("AAPL"));

        assertEquals(1, router.health().dropped());
        assertEquals("critical", router.health().status());
        verifyNoInteractions(bus);
    }

    @Test
    void testLegacyDeliversOnlyToConnectionSubscribers() {
        RecordingConsumer subscribed = new RecordingConsumer("c1", true);
        RecordingConsumer other = new RecordingConsumer("c2", true);
        when(supervisor.consumersFor(KEY, "AAPL")).thenReturn(Set.of("c1"));
        BroadcastRouter router = router(FeatureFlagSet.defaults().withGatewayOnlyMode(false));
        router.registerConsumer(subscribed);
        router.registerConsumer(other);
        router.start();

        router.onTick(KEY, tick("AAPL"));

        assertEquals(1, subscribed.received.size());
        assertTrue(other.received.isEmpty());
        assertEquals(DeliveryMode.LEGACY, router.mode());
        verifyNoInteractions(bus);
    }

    @Test
    void testGatewayDeliversBySymbolAndPublishes() {
        RecordingConsumer capable = new RecordingConsumer("c1", true);
        RecordingConsumer legacy = new RecordingConsumer("legacy", false);
        when(supervisor.consumersForSymbol("AAPL")).thenReturn(Set.of("c1", "legacy"));
        BroadcastRouter router = router(FeatureFlagSet.defaults());
        router.registerConsumer(capable);
        router.registerConsumer(legacy);
        router.start();
        Tick tick = tick("AAPL");

        router.onTick(KEY, tick);

        assertEquals(List.of(tick), capable.received);
        assertTrue(legacy.received.isEmpty(), "Legacy-only consumer skipped without fallback");
        verify(bus).publish(tick);
    }

    @Test
    void testGatewayFallbackServesLegacyOnItsOwnConnection() {
        RecordingConsumer legacy = new RecordingConsumer("legacy", false);
        when(supervisor.consumersForSymbol("AAPL")).thenReturn(Set.of("legacy"));
        when(supervisor.consumersFor(KEY, "AAPL")).thenReturn(Set.of("legacy"));
        BroadcastRouter router = router(FeatureFlagSet.defaults().withStrictMode(false).withAllowLegacyFallback(true));
        router.registerConsumer(legacy);
        router.start();

        router.onTick(KEY, tick("AAPL"));

        assertEquals(1, legacy.received.size());
    }

    @Test
    void testEmergencyOverrideSwitchesToLegacyAndBack() {
        RecordingConsumer consumer = new RecordingConsumer("c1", true);
        when(supervisor.consumersFor(KEY, "AAPL")).thenReturn(Set.of("c1"));
        BroadcastRouter router = router(FeatureFlagSet.defaults());
        router.registerConsumer(consumer);
        router.start();

        router.emergencyOverride("gateway cluster down");

        assertEquals(DeliveryMode.LEGACY, router.mode());
        assertFalse(router.flags().strictMode());
        assertEquals("gateway cluster down", router.flags().overrideReason());
        router.onTick(KEY, tick("AAPL"));
        assertEquals(1, consumer.received.size());
        verifyNoInteractions(bus);

        RouterHealth health = router.health();
        assertEquals("degraded", health.status(), "Override on a strict default set is degraded, not critical");
        assertTrue(health.recommendations().stream().anyMatch(r -> r.startsWith("Emergency legacy override")));
        assertFalse(health.readiness().ready());
        assertEquals(1, health.rollback().emergencyTriggers());

        router.closeEmergencyOverride("gateway restored");

        assertEquals(DeliveryMode.GATEWAY, router.mode());
        assertTrue(router.flags().strictMode());
    }

    @Test
    void testOverrideRequiresReason() {
        BroadcastRouter router = router(FeatureFlagSet.defaults());
        router.start();

        assertThrows(IllegalArgumentException.class, () -> router.emergencyOverride(" "));
        assertEquals(DeliveryMode.GATEWAY, router.mode());
    }

    @Test
    void testFlagUpdateRejectedInProduction() {
        BroadcastRouter router = router(FeatureFlagSet.defaults());
        router.start();

        assertFalse(router.updateFlags(FeatureFlagSet.defaults().withGatewayOnlyMode(false), "try legacy"));
        assertEquals(DeliveryMode.GATEWAY, router.mode());
    }

    @Test
    void testFlagUpdateInDevelopment() {
        FeatureFlagSet dev = FeatureFlagSet.defaults().withValidationMode(ValidationMode.DEVELOPMENT);
        BroadcastRouter router = router(dev);
        router.start();

        assertTrue(router.updateFlags(dev.withGatewayOnlyMode(false), "local testing"));
        assertEquals(DeliveryMode.LEGACY, router.mode());

        FeatureFlagSet conflicting = dev.withAllowLegacyFallback(true);
        assertThrows(ConfigConflictException.class, () -> router.updateFlags(conflicting, "bad"));
        assertEquals(DeliveryMode.LEGACY, router.mode());
    }

    @Test
    void testReadinessBlockedByLegacyConsumerAndMissingAck() {
        when(supervisor.isSubscribed("legacy")).thenReturn(true);
        BroadcastRouter router = router(FeatureFlagSet.defaults());
        router.registerConsumer(new RecordingConsumer("legacy", false));

        LegacyRemovalReadiness readiness = router.isReadyForLegacyRemoval();

        assertFalse(readiness.ready());
        assertFalse(readiness.checks().get("noLegacyOnlyConsumers"));
        assertFalse(readiness.checks().get("operatorAcknowledged"));
        assertTrue(readiness.checks().get("gatewayErrorRateBelowThreshold"));
        assertTrue(readiness.reason().contains("1 legacy-only consumers"));
    }

    @Test
    void testReadyForLegacyRemoval() {
        BroadcastRouter router = router(FeatureFlagSet.defaults().withOperatorAck(true));
        router.registerConsumer(new RecordingConsumer("c1", true));

        LegacyRemovalReadiness readiness = router.isReadyForLegacyRemoval();

        assertTrue(readiness.ready(), readiness.reason());
        assertTrue(readiness.checks().values().stream().allMatch(Boolean::booleanValue));
    }

    @Test
    void testGatewayErrorsTriggerAutomaticRollback() {
        when(supervisor.consumersForSymbol(any())).thenReturn(Set.of());
        when(bus.publish(any())).thenThrow(new IllegalStateException("gateway unreachable"));
        BroadcastRouter router = router(FeatureFlagSet.defaults().withStrictMode(false));
        router.start();

        for (int i = 0; i < AutoRollbackMonitor.MIN_GATEWAY_SAMPLES; i++) {
            router.onTick(KEY, tick("AAPL"));
        }

        assertEquals(DeliveryMode.LEGACY, router.mode());
        assertTrue(router.flags().emergencyOverride());
        assertTrue(router.flags().overrideReason().startsWith("Auto-rollback"));
    }

    @Test
    void testStrictModeBlocksAutomaticRollback() {
        when(supervisor.consumersForSymbol(any())).thenReturn(Set.of());
        when(bus.publish(any())).thenThrow(new IllegalStateException("gateway unreachable"));
        BroadcastRouter router = router(FeatureFlagSet.defaults());
        router.start();

        for (int i = 0; i < AutoRollbackMonitor.MIN_GATEWAY_SAMPLES * 2; i++) {
            router.onTick(KEY, tick("AAPL"));
        }

        assertEquals(DeliveryMode.GATEWAY, router.mode());
        assertEquals(1.0, router.rollbackMonitor().gatewayErrorRate(), 1e-9);
    }

    @Test
    void testUnregisterDropsSubscriptions() {
        BroadcastRouter router = router(FeatureFlagSet.defaults());
        router.registerConsumer(new RecordingConsumer("c1", true));

        router.unregisterConsumer("c1");

        assertNull(registry.get("c1"));
        verify(supervisor).unsubscribeAll("c1");
    }
}
