package in.annupaper.marketfeed.service.broadcast;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;

/**
 * How a received tick reaches consumers. One implementation per {@link DeliveryMode};
 * the router swaps instances instead of branching per tick.
 */
public interface DeliveryStrategy {

    DeliveryMode mode();

    /**
     * @return number of consumers the tick was handed to
     */
    int deliver(ConnectionKey source, Tick tick);
}
