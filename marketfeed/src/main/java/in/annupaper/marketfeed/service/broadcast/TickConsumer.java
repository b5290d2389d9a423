package in.annupaper.marketfeed.service.broadcast;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;

/**
 * Downstream receiver of ticks. Implementations must return quickly.
 */
public interface TickConsumer {

    String id();

    /**
     * False for consumers that can only be served by direct push.
     */
    default boolean gatewayCapable() {
        return true;
    }

    void onTick(ConnectionKey source, Tick tick);
}
