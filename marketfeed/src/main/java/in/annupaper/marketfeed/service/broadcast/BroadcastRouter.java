package in.annupaper.marketfeed.service.broadcast;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;
import in.annupaper.marketfeed.infrastructure.metrics.StreamMetrics;
import in.annupaper.marketfeed.service.stream.ConnectionSupervisor;
import in.annupaper.marketfeed.service.stream.TickListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Dispatches every received tick through the {@link DeliveryStrategy} selected by the
 * current {@link FeatureFlagSet}.
 *
 * The flag set is validated in {@link #start()}; a conflict aborts startup. At runtime the
 * flags change only through {@link #emergencyOverride(String)} (and its counterpart
 * {@link #closeEmergencyOverride(String)}), or through {@link #updateFlags} in development
 * validation mode. Each change is validated before it takes effect and written to the
 * AUDIT log.
 *
 * <pre>
 * BroadcastRouter router = new BroadcastRouter(FeatureFlagSet.fromEnv(), supervisor, registry, gateway, metrics, clock);
 * router.start();                 // throws ConfigConflictException on bad flags
 * supervisor.addTickListener(router);
 * </pre>
 */
public class BroadcastRouter implements TickListener {
    private static final Logger log = LoggerFactory.getLogger(BroadcastRouter.class);
    private static final Logger audit = LoggerFactory.getLogger("AUDIT");

    private final ConnectionSupervisor supervisor;
    private final ConsumerRegistry registry;
    private final BroadcastBus bus;
    private final StreamMetrics metrics;
    private final AutoRollbackMonitor rollbackMonitor;

    private final FeatureFlagSet startupFlags;
    private final AtomicReference<FeatureFlagSet> flags;
    private final AtomicReference<DeliveryStrategy> strategy = new AtomicReference<>();

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean started = false;

    public BroadcastRouter(FeatureFlagSet flags, ConnectionSupervisor supervisor, ConsumerRegistry registry,
                           BroadcastBus bus, StreamMetrics metrics, Clock clock) {
        this.startupFlags = flags;
        this.flags = new AtomicReference<>(flags);
        this.supervisor = supervisor;
        this.registry = registry;
        this.bus = bus;
        this.metrics = metrics;
        this.rollbackMonitor = new AutoRollbackMonitor(clock, this.flags::get);
        this.rollbackMonitor.onRollback(this::automaticOverride);
    }

    /**
     * Validate flags and select the delivery strategy.
     *
     * @throws ConfigConflictException if mutually exclusive flags are both enabled
     */
    public synchronized void start() {
        FeatureFlagSet current = flags.get();
        try {
            current.validate();
        } catch (ConfigConflictException e) {
            metrics.recordFlagConflict();
            log.error("[ROUTER] Refusing to start: {}", e.getMessage());
            throw e;
        }
        strategy.set(strategyFor(current));
        started = true;
        log.info("[ROUTER] Started ({})", current.describe());
    }

    public boolean isStarted() {
        return started;
    }

    @Override
    public void onTick(ConnectionKey key, Tick tick) {
        DeliveryStrategy active = strategy.get();
        if (!started || active == null) {
            dropped.incrementAndGet();
            return;
        }
        int n = active.deliver(key, tick);
        if (n == 0) {
            dropped.incrementAndGet();
        } else {
            delivered.addAndGet(n);
        }
    }

    public void registerConsumer(TickConsumer consumer) {
        registry.register(consumer);
        log.info("[ROUTER] Registered consumer {} ({})", consumer.id(), consumer.gatewayCapable() ? "gateway" : "legacy-only");
    }

    /**
     * Forget the consumer and drop all its subscriptions. Delivery stops immediately;
     * recoveries already queued for its connections keep running.
     */
    public void unregisterConsumer(String consumerId) {
        registry.unregister(consumerId);
        supervisor.unsubscribeAll(consumerId);
    }

    // ═══════════════════════════════════════════════════════════════
    // Flag mutation
    // ═══════════════════════════════════════════════════════════════

    /**
     * Force legacy delivery back on.
     *
     * @param reason mandatory, written to the audit log
     * @throws IllegalArgumentException if {@code reason} is blank
     */
    public void emergencyOverride(String reason) {
        override(reason, false);
    }

    private void automaticOverride(String reason) {
        override(reason, true);
    }

    private synchronized void override(String reason, boolean automatic) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Emergency override requires a reason");
        }
        FeatureFlagSet previous = flags.get();
        FeatureFlagSet next = previous.withEmergencyOverride(reason).validate();
        apply(previous, next, automatic ? "AUTO_ROLLBACK" : "EMERGENCY_OVERRIDE", reason);
        metrics.recordEmergencyOverride(automatic);
        rollbackMonitor.recordEmergencyTrigger();
    }

    /**
     * Close an open override and return to the startup flags.
     */
    public synchronized void closeEmergencyOverride(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Closing an override requires a reason");
        }
        FeatureFlagSet previous = flags.get();
        if (!previous.emergencyOverride()) {
            log.info("[ROUTER] No emergency override open");
            return;
        }
        apply(previous, startupFlags.validate(), "OVERRIDE_CLOSED", reason);
    }

    /**
     * Replace the flag set. Only honoured in development validation mode.
     *
     * @return false if rejected because the router runs in production validation mode
     * @throws ConfigConflictException if the new set is inconsistent
     */
    public synchronized boolean updateFlags(FeatureFlagSet next, String reason) {
        FeatureFlagSet previous = flags.get();
        if (previous.validationMode() == ValidationMode.PRODUCTION) {
            log.warn("[ROUTER] Flag update rejected in production validation mode: {}", reason);
            return false;
        }
        try {
            next.validate();
        } catch (ConfigConflictException e) {
            metrics.recordFlagConflict();
            throw e;
        }
        apply(previous, next, "FLAG_UPDATE", reason);
        return true;
    }

    private void apply(FeatureFlagSet previous, FeatureFlagSet next, String action, String reason) {
        flags.set(next);
        if (started) {
            strategy.set(strategyFor(next));
        }
        audit.warn("{} reason=\"{}\" previous=[{}] new=[{}]", action, reason, previous.describe(), next.describe());
        log.warn("[ROUTER] {}: {} -> {}", action, previous.deliveryMode(), next.deliveryMode());
    }

    private DeliveryStrategy strategyFor(FeatureFlagSet f) {
        return switch (f.deliveryMode()) {
            case LEGACY -> new DirectDeliveryStrategy(supervisor, registry, metrics);
            case GATEWAY -> new GatewayDeliveryStrategy(supervisor, registry, bus, f.allowLegacyFallback(),
                rollbackMonitor, metrics);
        };
    }

    // ═══════════════════════════════════════════════════════════════
    // Readiness and health
    // ═══════════════════════════════════════════════════════════════

    public LegacyRemovalReadiness isReadyForLegacyRemoval() {
        FeatureFlagSet f = flags.get();
        Map<String, Boolean> checks = new LinkedHashMap<>();
        List<String> failures = new ArrayList<>();

        long legacyOnlyActive = registry.legacyOnly().stream()
            .filter(c -> supervisor.isSubscribed(c.id()))
            .count();
        boolean noLegacyConsumers = legacyOnlyActive == 0;
        checks.put("noLegacyOnlyConsumers", noLegacyConsumers);
        if (!noLegacyConsumers) {
            failures.add(legacyOnlyActive + " legacy-only consumers still subscribed");
        }

        double errorRate = rollbackMonitor.gatewayErrorRate();
        boolean gatewayHealthy = errorRate < f.gatewayErrorRateThreshold();
        checks.put("gatewayErrorRateBelowThreshold", gatewayHealthy);
        if (!gatewayHealthy) {
            failures.add(String.format("gateway error rate %.2f%% is not below %.2f%%",
                errorRate * 100, f.gatewayErrorRateThreshold() * 100));
        }

        boolean noOverride = !f.emergencyOverride();
        checks.put("noEmergencyOverride", noOverride);
        if (!noOverride) {
            failures.add("emergency override open: " + f.overrideReason());
        }

        checks.put("operatorAcknowledged", f.operatorAckLegacyRemoval());
        if (!f.operatorAckLegacyRemoval()) {
            failures.add("operator acknowledgement missing");
        }

        boolean ready = failures.isEmpty();
        String reason = ready ? "All readiness checks passed" : String.join("; ", failures);
        return new LegacyRemovalReadiness(ready, reason, Map.copyOf(checks));
    }

    public RouterHealth health() {
        FeatureFlagSet f = flags.get();
        List<String> recommendations = new ArrayList<>();
        String status = "healthy";

        if (f.emergencyOverride() && f.gatewayOnlyMode()) {
            status = "degraded";
            recommendations.add("Emergency legacy override is open while gateway-only mode is configured");
        }
        if (!started) {
            status = "critical";
            recommendations.add("Router not started");
        }

        return new RouterHealth(status, f.deliveryMode(), f, delivered.get(), dropped.get(),
            rollbackMonitor.gatewayErrorRate(), rollbackMonitor.snapshot(), isReadyForLegacyRemoval(),
            List.copyOf(recommendations));
    }

    public FeatureFlagSet flags() {
        return flags.get();
    }

    public DeliveryMode mode() {
        return flags.get().deliveryMode();
    }

    public AutoRollbackMonitor rollbackMonitor() {
        return rollbackMonitor;
    }
}
