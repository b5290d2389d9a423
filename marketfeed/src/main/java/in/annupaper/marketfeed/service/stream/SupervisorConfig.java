package in.annupaper.marketfeed.service.stream;

import in.annupaper.marketfeed.infrastructure.provider.common.ReconnectionPolicy;
import in.annupaper.marketfeed.util.Env;

import java.time.Duration;

/**
 * Connection supervisor settings. Heartbeat and reconnect timeouts are independent.
 */
public record SupervisorConfig(
    Duration heartbeatInterval,
    int missedHeartbeats,
    Duration connectTimeout,
    int reconnectMaxAttempts,
    Duration reconnectInitialDelay,
    Duration reconnectMaxDelay,
    Duration reconnectJitter,
    Duration gracePeriod,
    Duration subscribePermitTimeout
) {
    public SupervisorConfig {
        requirePositive(heartbeatInterval, "heartbeatInterval");
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(reconnectInitialDelay, "reconnectInitialDelay");
        requirePositive(reconnectMaxDelay, "reconnectMaxDelay");
        if (missedHeartbeats < 1) {
            throw new IllegalArgumentException("missedHeartbeats must be at least 1");
        }
        if (reconnectMaxAttempts < 1) {
            throw new IllegalArgumentException("reconnectMaxAttempts must be at least 1");
        }
        if (reconnectJitter.isNegative() || gracePeriod.isNegative() || subscribePermitTimeout.isNegative()) {
            throw new IllegalArgumentException("jitter, grace period and permit timeout must not be negative");
        }
    }

    public static SupervisorConfig defaults() {
        return new SupervisorConfig(
            Duration.ofSeconds(30),
            2,
            Duration.ofSeconds(10),
            10,
            Duration.ofSeconds(1),
            Duration.ofSeconds(60),
            Duration.ofMillis(500),
            Duration.ofSeconds(30),
            Duration.ofSeconds(2)
        );
    }

    public static SupervisorConfig fromEnv() {
        SupervisorConfig d = defaults();
        return new SupervisorConfig(
            Env.getDuration("STREAM_HEARTBEAT_INTERVAL_MS", d.heartbeatInterval()),
            Env.getInt("STREAM_MISSED_HEARTBEATS", d.missedHeartbeats()),
            Env.getDuration("STREAM_CONNECT_TIMEOUT_MS", d.connectTimeout()),
            Env.getInt("STREAM_RECONNECT_MAX_ATTEMPTS", d.reconnectMaxAttempts()),
            Env.getDuration("STREAM_RECONNECT_INITIAL_DELAY_MS", d.reconnectInitialDelay()),
            Env.getDuration("STREAM_RECONNECT_MAX_DELAY_MS", d.reconnectMaxDelay()),
            Env.getDuration("STREAM_RECONNECT_JITTER_MS", d.reconnectJitter()),
            Env.getDuration("STREAM_GRACE_PERIOD_MS", d.gracePeriod()),
            Env.getDuration("STREAM_SUBSCRIBE_PERMIT_TIMEOUT_MS", d.subscribePermitTimeout())
        );
    }

    /**
     * Fresh reconnect policy for one connection.
     */
    public ReconnectionPolicy reconnectionPolicy() {
        return ReconnectionPolicy.builder()
            .initialDelay(reconnectInitialDelay)
            .maxDelay(reconnectMaxDelay)
            .multiplier(2.0)
            .maxAttempts(reconnectMaxAttempts)
            .jitter(reconnectJitter)
            .build();
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
