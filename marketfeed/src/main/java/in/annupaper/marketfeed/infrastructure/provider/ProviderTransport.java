package in.annupaper.marketfeed.infrastructure.provider;

import in.annupaper.marketfeed.domain.data.ConnectionKey;

import java.util.concurrent.CompletableFuture;

/**
 * Upstream provider adapter: a capability-typed stream source with heartbeat semantics.
 *
 * The returned future completes once the handshake succeeds. It completes exceptionally
 * with {@link ProviderAuthException} when credentials are rejected and with
 * {@link TransportException} for any other connection failure.
 */
public interface ProviderTransport {

    CompletableFuture<TransportSession> connect(ConnectionKey key, TransportListener listener);
}
