package in.annupaper.marketfeed.service.recovery;

import in.annupaper.marketfeed.infrastructure.provider.common.ReconnectionPolicy;
import in.annupaper.marketfeed.util.Env;

import java.time.Duration;

/**
 * Recovery worker settings.
 *
 * @param maxWindow longest history span replayed for one gap
 * @param maxAttempts replay attempts per job before giving up
 * @param retryDelay first backoff delay, doubled per attempt
 * @param batchSize ticks per delivered recovery batch
 * @param workers worker threads draining the job queue
 * @param permitTimeout wait for a rate-limit permit before an attempt counts as failed
 * @param healthBatchSize connections checked together in the degraded path
 * @param healthTimeout tier-3 ping timeout
 */
public record RecoveryConfig(
    Duration maxWindow,
    int maxAttempts,
    Duration retryDelay,
    int batchSize,
    int workers,
    Duration permitTimeout,
    int healthBatchSize,
    Duration healthTimeout
) {
    private static final Duration MAX_RETRY_DELAY = Duration.ofSeconds(30);

    public RecoveryConfig {
        if (maxWindow == null || maxWindow.isZero() || maxWindow.isNegative()) {
            throw new IllegalArgumentException("maxWindow must be positive");
        }
        if (retryDelay == null || retryDelay.isZero() || retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be positive");
        }
        if (maxAttempts < 1 || batchSize < 1 || workers < 1 || healthBatchSize < 1) {
            throw new IllegalArgumentException("maxAttempts, batchSize, workers and healthBatchSize must be at least 1");
        }
        if (permitTimeout.isNegative() || healthTimeout.isNegative()) {
            throw new IllegalArgumentException("timeouts must not be negative");
        }
    }

    public static RecoveryConfig defaults() {
        return new RecoveryConfig(
            Duration.ofMinutes(5),
            3,
            Duration.ofSeconds(1),
            100,
            2,
            Duration.ofSeconds(5),
            50,
            Duration.ofSeconds(5)
        );
    }

    public static RecoveryConfig fromEnv() {
        RecoveryConfig d = defaults();
        return new RecoveryConfig(
            Env.getDuration("RECOVERY_MAX_WINDOW_MS", d.maxWindow()),
            Env.getInt("RECOVERY_MAX_ATTEMPTS", d.maxAttempts()),
            Env.getDuration("RECOVERY_RETRY_DELAY_MS", d.retryDelay()),
            Env.getInt("RECOVERY_BATCH_SIZE", d.batchSize()),
            Env.getInt("RECOVERY_WORKERS", d.workers()),
            Env.getDuration("RECOVERY_PERMIT_TIMEOUT_MS", d.permitTimeout()),
            Env.getInt("RECOVERY_HEALTH_BATCH_SIZE", d.healthBatchSize()),
            Env.getDuration("RECOVERY_HEALTH_TIMEOUT_MS", d.healthTimeout())
        );
    }

    ReconnectionPolicy retryPolicy() {
        return ReconnectionPolicy.builder()
            .initialDelay(retryDelay)
            .maxDelay(retryDelay.compareTo(MAX_RETRY_DELAY) > 0 ? retryDelay : MAX_RETRY_DELAY)
            .multiplier(2.0)
            .maxAttempts(maxAttempts)
            .build();
    }
}
