package in.annupaper.marketfeed.service.stream;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The legal transition table. Every state change in the supervisor goes through here.
 *
 * <pre>
 * IDLE         --SUBSCRIBE-------------&gt; CONNECTING
 * CONNECTING   --HANDSHAKE_SUCCEEDED---&gt; CONNECTED
 * CONNECTING   --HANDSHAKE_FAILED------&gt; ERROR
 * CONNECTING   --PROTOCOL_VIOLATION----&gt; ERROR
 * CONNECTED    --PROTOCOL_VIOLATION----&gt; ERROR
 * CONNECTED    --HEARTBEAT_TIMEOUT-----&gt; RECONNECTING
 * CONNECTED    --TRANSPORT_CLOSED------&gt; RECONNECTING
 * CONNECTED    --GRACE_EXPIRED---------&gt; DISCONNECTED
 * RECONNECTING --HANDSHAKE_SUCCEEDED---&gt; CONNECTED
 * RECONNECTING --RETRIES_EXHAUSTED-----&gt; DISCONNECTED
 * ERROR        --RETRY_AFTER_BACKOFF---&gt; RECONNECTING
 * ERROR        --FATAL_ERROR-----------&gt; CLOSED
 * DISCONNECTED --NO_SUBSCRIBERS--------&gt; CLOSED
 * </pre>
 */
public final class ConnectionStateMachine {

    private static final Map<ConnectionState, Map<ConnectionEvent, ConnectionState>> TABLE;

    static {
        Map<ConnectionState, Map<ConnectionEvent, ConnectionState>> t = new EnumMap<>(ConnectionState.class);
        for (ConnectionState s : ConnectionState.values()) {
            t.put(s, new EnumMap<>(ConnectionEvent.class));
        }
        t.get(ConnectionState.IDLE).put(ConnectionEvent.SUBSCRIBE, ConnectionState.CONNECTING);

        t.get(ConnectionState.CONNECTING).put(ConnectionEvent.HANDSHAKE_SUCCEEDED, ConnectionState.CONNECTED);
        t.get(ConnectionState.CONNECTING).put(ConnectionEvent.HANDSHAKE_FAILED, ConnectionState.ERROR);
        t.get(ConnectionState.CONNECTING).put(ConnectionEvent.PROTOCOL_VIOLATION, ConnectionState.ERROR);

        t.get(ConnectionState.CONNECTED).put(ConnectionEvent.PROTOCOL_VIOLATION, ConnectionState.ERROR);
        t.get(ConnectionState.CONNECTED).put(ConnectionEvent.HEARTBEAT_TIMEOUT, ConnectionState.RECONNECTING);
        t.get(ConnectionState.CONNECTED).put(ConnectionEvent.TRANSPORT_CLOSED, ConnectionState.RECONNECTING);
        t.get(ConnectionState.CONNECTED).put(ConnectionEvent.GRACE_EXPIRED, ConnectionState.DISCONNECTED);

        t.get(ConnectionState.RECONNECTING).put(ConnectionEvent.HANDSHAKE_SUCCEEDED, ConnectionState.CONNECTED);
        t.get(ConnectionState.RECONNECTING).put(ConnectionEvent.RETRIES_EXHAUSTED, ConnectionState.DISCONNECTED);

        t.get(ConnectionState.ERROR).put(ConnectionEvent.RETRY_AFTER_BACKOFF, ConnectionState.RECONNECTING);
        t.get(ConnectionState.ERROR).put(ConnectionEvent.FATAL_ERROR, ConnectionState.CLOSED);

        t.get(ConnectionState.DISCONNECTED).put(ConnectionEvent.NO_SUBSCRIBERS, ConnectionState.CLOSED);

        t.replaceAll((state, edges) -> Collections.unmodifiableMap(edges));
        TABLE = Collections.unmodifiableMap(t);
    }

    private ConnectionStateMachine() {}

    /**
     * @return the target state, or empty if the event is not legal in {@code from}
     */
    public static Optional<ConnectionState> next(ConnectionState from, ConnectionEvent event) {
        return Optional.ofNullable(TABLE.get(from).get(event));
    }

    /**
     * @throws IllegalStateTransitionException if the event is not legal in {@code from}
     */
    public static ConnectionState transition(ConnectionState from, ConnectionEvent event) {
        return next(from, event).orElseThrow(() -> new IllegalStateTransitionException(from, event));
    }

    public static boolean isLegal(ConnectionState from, ConnectionEvent event) {
        return TABLE.get(from).containsKey(event);
    }

    public static Map<ConnectionEvent, ConnectionState> edgesFrom(ConnectionState from) {
        return TABLE.get(from);
    }
}
