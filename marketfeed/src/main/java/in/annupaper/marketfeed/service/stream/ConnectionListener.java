package in.annupaper.marketfeed.service.stream;

import in.annupaper.marketfeed.domain.data.ConnectionKey;

/**
 * Lifecycle notifications from the supervisor. Implementations must not block.
 */
public interface ConnectionListener {

    default void onStateChange(ConnectionKey key, ConnectionState from, ConnectionState to) {}

    default void onGap(GapEvent gap) {}
}
