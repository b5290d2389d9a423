package in.annupaper.marketfeed.infrastructure.provider;

import java.util.Set;

/**
 * An open upstream connection.
 */
public interface TransportSession {

    void subscribe(Set<String> symbols);

    void unsubscribe(Set<String> symbols);

    /**
     * Send a heartbeat ping. The provider answers through {@link TransportListener#onHeartbeat()}.
     */
    void sendHeartbeat();

    boolean isOpen();

    void close();
}
