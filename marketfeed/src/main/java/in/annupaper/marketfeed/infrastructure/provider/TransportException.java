package in.annupaper.marketfeed.infrastructure.provider;

import in.annupaper.marketfeed.domain.common.MarketFeedException;
import in.annupaper.marketfeed.domain.data.ConnectionKey;

/**
 * Connection-level failure. Retryable: the supervisor reacts by reconnecting.
 */
public class TransportException extends MarketFeedException {

    private final String providerId;
    private final String capabilityId;

    public TransportException(ConnectionKey key, String message) {
        super(String.format("[%s:%s] %s", key.providerId(), key.capabilityId(), message));
        this.providerId = key.providerId();
        this.capabilityId = key.capabilityId();
    }

    public TransportException(ConnectionKey key, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", key.providerId(), key.capabilityId(), message), cause);
        this.providerId = key.providerId();
        this.capabilityId = key.capabilityId();
    }

    public String getProviderId() {
        return providerId;
    }

    public String getCapabilityId() {
        return capabilityId;
    }
}
