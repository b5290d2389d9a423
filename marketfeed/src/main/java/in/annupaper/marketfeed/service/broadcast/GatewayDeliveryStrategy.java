package in.annupaper.marketfeed.service.broadcast;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;
import in.annupaper.marketfeed.infrastructure.metrics.StreamMetrics;
import in.annupaper.marketfeed.service.stream.ConnectionSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gateway path: every consumer of the symbol receives the tick, whichever connection it
 * arrived on, and the tick is published to the remote broadcast bus.
 *
 * Legacy-only consumers are served through the direct path when fallback is allowed, and
 * only for ticks from a connection they are subscribed on. Otherwise they are skipped.
 */
public class GatewayDeliveryStrategy implements DeliveryStrategy {
    private static final Logger log = LoggerFactory.getLogger(GatewayDeliveryStrategy.class);

    private final ConnectionSupervisor supervisor;
    private final ConsumerRegistry registry;
    private final BroadcastBus bus;
    private final boolean allowLegacyFallback;
    private final AutoRollbackMonitor rollbackMonitor;
    private final StreamMetrics metrics;

    public GatewayDeliveryStrategy(ConnectionSupervisor supervisor, ConsumerRegistry registry, BroadcastBus bus,
                                   boolean allowLegacyFallback, AutoRollbackMonitor rollbackMonitor,
                                   StreamMetrics metrics) {
        this.supervisor = supervisor;
        this.registry = registry;
        this.bus = bus;
        this.allowLegacyFallback = allowLegacyFallback;
        this.rollbackMonitor = rollbackMonitor;
        this.metrics = metrics;
    }

    @Override
    public DeliveryMode mode() {
        return DeliveryMode.GATEWAY;
    }

    @Override
    public int deliver(ConnectionKey source, Tick tick) {
        int delivered = 0;
        for (String consumerId : supervisor.consumersForSymbol(tick.symbol())) {
            TickConsumer consumer = registry.get(consumerId);
            if (consumer == null) {
                metrics.recordDeliveryDrop(mode().name(), "unregistered");
                continue;
            }
            if (!consumer.gatewayCapable()) {
                if (!allowLegacyFallback) {
                    metrics.recordDeliveryDrop(mode().name(), "legacy_only");
                    continue;
                }
                if (!supervisor.consumersFor(source, tick.symbol()).contains(consumerId)) {
                    continue;
                }
            }
            if (registry.deliver(consumer, source, tick)) {
                delivered++;
            } else {
                metrics.recordDeliveryDrop(mode().name(), "consumer_error");
            }
        }

        boolean published = true;
        try {
            bus.publish(tick);
        } catch (RuntimeException e) {
            published = false;
            metrics.recordGatewayError();
            log.warn("[GATEWAY] Publish of {} failed: {}", tick.symbol(), e.getMessage());
        }
        rollbackMonitor.recordGatewayResult(published);

        metrics.recordDelivery(mode().name(), delivered);
        return delivered;
    }
}
