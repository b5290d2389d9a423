package in.annupaper.marketfeed.infrastructure.provider;

import in.annupaper.marketfeed.domain.data.Tick;

/**
 * Push stream of everything a provider sends on one connection.
 *
 * Callbacks for one session are invoked sequentially, in receipt order.
 */
public interface TransportListener {

    void onTick(Tick tick);

    void onHeartbeat();

    void onClosed(int statusCode, String reason);

    /**
     * Protocol violation or transport failure after the handshake.
     * A {@link ProviderAuthException} here means the session was revoked.
     */
    void onError(Throwable error);
}
