package in.annupaper.marketfeed.service.stream;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;

/**
 * Receives every tick for a referenced symbol, per connection, in receipt order.
 */
@FunctionalInterface
public interface TickListener {

    void onTick(ConnectionKey key, Tick tick);
}
