package in.annupaper.marketfeed.service.stream;

/**
 * Inputs to the connection state machine.
 */
public enum ConnectionEvent {
    /** First subscription on an idle connection. */
    SUBSCRIBE,
    HANDSHAKE_SUCCEEDED,
    HANDSHAKE_FAILED,
    PROTOCOL_VIOLATION,
    HEARTBEAT_TIMEOUT,
    TRANSPORT_CLOSED,
    RETRIES_EXHAUSTED,
    RETRY_AFTER_BACKOFF,
    /** Error classified as non-retryable (authentication). */
    FATAL_ERROR,
    /** Grace timer elapsed on a connected link with no subscribers left. */
    GRACE_EXPIRED,
    NO_SUBSCRIBERS
}
