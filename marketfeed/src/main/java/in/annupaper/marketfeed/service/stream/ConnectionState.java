package in.annupaper.marketfeed.service.stream;

/**
 * Lifecycle of one supervised upstream connection.
 */
public enum ConnectionState {
    IDLE,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    DISCONNECTED,
    ERROR,
    CLOSED;

    public boolean isTerminal() {
        return this == CLOSED;
    }
}
