package in.annupaper.marketfeed.service.broadcast;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;
import in.annupaper.marketfeed.infrastructure.metrics.StreamMetrics;
import in.annupaper.marketfeed.service.stream.ConnectionSupervisor;

/**
 * Legacy path: only consumers subscribed on the receiving connection get the tick.
 */
public class DirectDeliveryStrategy implements DeliveryStrategy {

    private final ConnectionSupervisor supervisor;
    private final ConsumerRegistry registry;
    private final StreamMetrics metrics;

    public DirectDeliveryStrategy(ConnectionSupervisor supervisor, ConsumerRegistry registry, StreamMetrics metrics) {
        this.supervisor = supervisor;
        this.registry = registry;
        this.metrics = metrics;
    }

    @Override
    public DeliveryMode mode() {
        return DeliveryMode.LEGACY;
    }

    @Override
    public int deliver(ConnectionKey source, Tick tick) {
        int delivered = 0;
        for (String consumerId : supervisor.consumersFor(source, tick.symbol())) {
            TickConsumer consumer = registry.get(consumerId);
            if (consumer == null) {
                metrics.recordDeliveryDrop(mode().name(), "unregistered");
                continue;
            }
            if (registry.deliver(consumer, source, tick)) {
                delivered++;
            } else {
                metrics.recordDeliveryDrop(mode().name(), "consumer_error");
            }
        }
        metrics.recordDelivery(mode().name(), delivered);
        return delivered;
    }
}
