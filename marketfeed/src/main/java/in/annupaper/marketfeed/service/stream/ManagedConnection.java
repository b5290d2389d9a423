package in.annupaper.marketfeed.service.stream;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;
import in.annupaper.marketfeed.infrastructure.provider.TransportSession;
import in.annupaper.marketfeed.infrastructure.provider.common.HeartbeatMonitor;
import in.annupaper.marketfeed.infrastructure.provider.common.ReconnectionPolicy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Mutable state of one supervised connection. Guarded by the instance monitor;
 * only {@link ConnectionSupervisor} touches it.
 */
final class ManagedConnection {

    final ConnectionKey key;
    final SubscriptionTable subscriptions = new SubscriptionTable();
    final ReconnectionPolicy policy;

    ConnectionState state = ConnectionState.IDLE;
    TransportSession session;
    HeartbeatMonitor heartbeat;

    /** Bumped on every handshake; callbacks from older sessions are ignored. */
    int generation;

    ScheduledFuture<?> graceTimer;
    ScheduledFuture<?> retryTask;
    boolean graceElapsed;

    long lastSequence = Tick.NO_SEQUENCE;
    long lastTickTimestamp;
    Instant lastHeartbeat;
    Instant disconnectedAt;

    final Set<String> pendingUnsubscribes = new LinkedHashSet<>();
    final List<CompletableFuture<Boolean>> probes = new ArrayList<>();

    ManagedConnection(ConnectionKey key, ReconnectionPolicy policy) {
        this.key = key;
        this.policy = policy;
    }
}
