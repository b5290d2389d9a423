package in.annupaper.marketfeed.service.stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exhaustive legality check of the connection state table.
 */
class ConnectionStateMachineTest {

    private static final Map<ConnectionState, Map<ConnectionEvent, ConnectionState>> EXPECTED = new EnumMap<>(ConnectionState.class);

    static {
        for (ConnectionState s : ConnectionState.values()) {
            EXPECTED.put(s, new EnumMap<>(ConnectionEvent.class));
        }
        EXPECTED.get(ConnectionState.IDLE).put(ConnectionEvent.SUBSCRIBE, ConnectionState.CONNECTING);
        EXPECTED.get(ConnectionState.CONNECTING).put(ConnectionEvent.HANDSHAKE_SUCCEEDED, ConnectionState.CONNECTED);
        EXPECTED.get(ConnectionState.CONNECTING).put(ConnectionEvent.HANDSHAKE_FAILED, ConnectionState.ERROR);
        EXPECTED.get(ConnectionState.CONNECTING).put(ConnectionEvent.PROTOCOL_VIOLATION, ConnectionState.ERROR);
        EXPECTED.get(ConnectionState.CONNECTED).put(ConnectionEvent.PROTOCOL_VIOLATION, ConnectionState.ERROR);
        EXPECTED.get(ConnectionState.CONNECTED).put(ConnectionEvent.HEARTBEAT_TIMEOUT, ConnectionState.RECONNECTING);
        EXPECTED.get(ConnectionState.CONNECTED).put(ConnectionEvent.TRANSPORT_CLOSED, ConnectionState.RECONNECTING);
        EXPECTED.get(ConnectionState.CONNECTED).put(ConnectionEvent.GRACE_EXPIRED, ConnectionState.DISCONNECTED);
        EXPECTED.get(ConnectionState.RECONNECTING).put(ConnectionEvent.HANDSHAKE_SUCCEEDED, ConnectionState.CONNECTED);
        EXPECTED.get(ConnectionState.RECONNECTING).put(ConnectionEvent.RETRIES_EXHAUSTED, ConnectionState.DISCONNECTED);
        EXPECTED.get(ConnectionState.ERROR).put(ConnectionEvent.RETRY_AFTER_BACKOFF, ConnectionState.RECONNECTING);
        EXPECTED.get(ConnectionState.ERROR).put(ConnectionEvent.FATAL_ERROR, ConnectionState.CLOSED);
        EXPECTED.get(ConnectionState.DISCONNECTED).put(ConnectionEvent.NO_SUBSCRIBERS, ConnectionState.CLOSED);
    }

    @Test
    @DisplayName("Every (state, event) pair is either in the table or rejected")
    void testAllPairs() {
        int legal = 0;
        for (ConnectionState from : ConnectionState.values()) {
            for (ConnectionEvent event : ConnectionEvent.values()) {
                ConnectionState expected = EXPECTED.get(from).get(event);
                if (expected != null) {
                    legal++;
                    assertTrue(ConnectionStateMachine.isLegal(from, event));
                    assertEquals(expected, ConnectionStateMachine.transition(from, event), from + " --" + event);
                } else {
                    assertFalse(ConnectionStateMachine.isLegal(from, event), from + " --" + event + " must be illegal");
                    IllegalStateTransitionException e = assertThrows(IllegalStateTransitionException.class,
                        () -> ConnectionStateMachine.transition(from, event));
                    assertTrue(e.getMessage().contains(from.name()));
                }
            }
        }
        assertEquals(13, legal);
    }

    @Test
    void testClosedIsTerminal() {
        assertTrue(ConnectionStateMachine.edgesFrom(ConnectionState.CLOSED).isEmpty());
        assertTrue(ConnectionState.CLOSED.isTerminal());
    }

    @Test
    void testClosedOnlyReachableFromErrorOrDisconnected() {
        for (ConnectionState from : ConnectionState.values()) {
            boolean reachesClosed = ConnectionStateMachine.edgesFrom(from).containsValue(ConnectionState.CLOSED);
            assertEquals(Set.of(ConnectionState.ERROR, ConnectionState.DISCONNECTED).contains(from), reachesClosed, from.name());
        }
    }

    @Test
    void testEdgesAreUnmodifiable() {
        assertThrows(UnsupportedOperationException.class, () ->
            ConnectionStateMachine.edgesFrom(ConnectionState.IDLE).put(ConnectionEvent.FATAL_ERROR, ConnectionState.CLOSED));
    }
}
