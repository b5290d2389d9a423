package in.annupaper.marketfeed.infrastructure.provider.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Heartbeat ticker for one upstream connection.
 *
 * Every interval the monitor sends a ping and counts how many whole intervals have
 * passed since the last beat (pong, provider heartbeat or tick). Once the count
 * reaches the missed-beat threshold the timeout callback fires, exactly once until
 * the next beat is recorded.
 *
 * Usage:
 * <pre>
 * HeartbeatMonitor heartbeat = new HeartbeatMonitor(
 *     "P1:quote", Duration.ofSeconds(30), 2, clock, scheduler,
 *     session::sendHeartbeat,
 *     () -> supervisor.onHeartbeatTimeout(key));
 * heartbeat.start();
 * // on every pong or tick:
 * heartbeat.recordBeat();
 * </pre>
 */
public class HeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final String connectionId;
    private final Duration interval;
    private final int missedBeatsThreshold;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Runnable pingFunction;
    private final Runnable timeoutCallback;

    private volatile ScheduledFuture<?> tickTask;
    private volatile Instant lastBeatTime;
    private volatile boolean running = false;
    private volatile boolean timedOut = false;

    public HeartbeatMonitor(String connectionId, Duration interval, int missedBeatsThreshold,
                            Clock clock, ScheduledExecutorService scheduler,
                            Runnable pingFunction, Runnable timeoutCallback) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Heartbeat interval must be positive");
        }
        if (missedBeatsThreshold < 1) {
            throw new IllegalArgumentException("Missed beats threshold must be at least 1");
        }
        this.connectionId = connectionId;
        this.interval = interval;
        this.missedBeatsThreshold = missedBeatsThreshold;
        this.clock = clock;
        this.scheduler = scheduler;
        this.pingFunction = pingFunction;
        this.timeoutCallback = timeoutCallback;
    }

    /**
     * Start the ticker. The first evaluation happens one interval from now.
     */
    public synchronized void start() {
        if (running) {
            log.warn("[{}] Heartbeat monitor already running", connectionId);
            return;
        }
        log.info("[{}] Starting heartbeat monitor (interval: {} ms, missed beats: {})",
            connectionId, interval.toMillis(), missedBeatsThreshold);

        running = true;
        timedOut = false;
        lastBeatTime = clock.instant();

        tickTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                evaluate();
            } catch (Exception e) {
                log.error("[{}] Heartbeat evaluation failed", connectionId, e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop the ticker. The shared scheduler stays up.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.debug("[{}] Stopping heartbeat monitor", connectionId);
        running = false;
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
    }

    public void recordBeat() {
        lastBeatTime = clock.instant();
        if (timedOut) {
            log.info("[{}] Heartbeat resumed", connectionId);
            timedOut = false;
        }
    }

    /**
     * One heartbeat tick: ping, then check for missed beats.
     * Runs on the scheduler; called directly by tests with a controlled clock.
     */
    public void evaluate() {
        if (!running) {
            return;
        }

        try {
            pingFunction.run();
        } catch (Exception e) {
            log.warn("[{}] Ping failed: {}", connectionId, e.getMessage());
        }

        int missed = missedBeats();
        if (missed >= missedBeatsThreshold && !timedOut) {
            timedOut = true;
            log.warn("[{}] Heartbeat timeout - {} consecutive beats missed ({} ms silent)",
                connectionId, missed, getTimeSinceLastBeat().toMillis());
            try {
                timeoutCallback.run();
            } catch (Exception e) {
                log.error("[{}] Timeout callback threw exception", connectionId, e);
            }
        }
    }

    /**
     * Whole intervals elapsed since the last beat.
     */
    public int missedBeats() {
        Duration silence = getTimeSinceLastBeat();
        return (int) (silence.toMillis() / interval.toMillis());
    }

    public boolean isHealthy() {
        return running && !timedOut && missedBeats() < missedBeatsThreshold;
    }

    public boolean isRunning() {
        return running;
    }

    public Instant getLastBeatTime() {
        return lastBeatTime;
    }

    public Duration getTimeSinceLastBeat() {
        Instant last = lastBeatTime;
        if (last == null) {
            return Duration.ZERO;
        }
        return Duration.between(last, clock.instant());
    }
}
