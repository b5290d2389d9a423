package in.annupaper.marketfeed.service.broadcast;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered tick consumers by id.
 */
public class ConsumerRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConsumerRegistry.class);

    private final Map<String, TickConsumer> consumers = new ConcurrentHashMap<>();

    public void register(TickConsumer consumer) {
        TickConsumer previous = consumers.put(consumer.id(), consumer);
        if (previous != null && previous != consumer) {
            log.warn("[ROUTER] Consumer {} re-registered, previous instance replaced", consumer.id());
        }
    }

    public TickConsumer unregister(String consumerId) {
        return consumers.remove(consumerId);
    }

    public TickConsumer get(String consumerId) {
        return consumers.get(consumerId);
    }

    public Collection<TickConsumer> all() {
        return List.copyOf(consumers.values());
    }

    public List<TickConsumer> legacyOnly() {
        return consumers.values().stream().filter(c -> !c.gatewayCapable()).toList();
    }

    /**
     * Hand one tick to one consumer. A throwing consumer never affects the others.
     *
     * @return true if the consumer accepted the tick
     */
    boolean deliver(TickConsumer consumer, ConnectionKey source, Tick tick) {
        try {
            consumer.onTick(source, tick);
            return true;
        } catch (Exception e) {
            log.error("[ROUTER] Consumer {} threw on {} tick", consumer.id(), tick.symbol(), e);
            return false;
        }
    }
}
