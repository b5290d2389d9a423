package in.annupaper.marketfeed.service.recovery;

import java.time.Duration;

/**
 * History span requested for one recovery attempt, in epoch millis.
 *
 * @param truncated true if the gap was longer than the configured bound and the oldest part was dropped
 */
public record RecoveryWindow(long fromMillis, long toMillis, boolean truncated) {

    public RecoveryWindow {
        if (toMillis < fromMillis) {
            throw new IllegalArgumentException("Window end " + toMillis + " before start " + fromMillis);
        }
    }

    /**
     * Bound a detected gap to at most {@code maxWindow}, keeping the most recent part.
     */
    public static RecoveryWindow bounded(long gapFrom, long gapTo, Duration maxWindow) {
        long to = Math.max(gapFrom, gapTo);
        long from = Math.min(gapFrom, gapTo);
        long limit = maxWindow.toMillis();
        if (to - from > limit) {
            return new RecoveryWindow(to - limit, to, true);
        }
        return new RecoveryWindow(from, to, false);
    }

    public Duration length() {
        return Duration.ofMillis(toMillis - fromMillis);
    }

    public boolean contains(long timestamp) {
        return timestamp >= fromMillis && timestamp <= toMillis;
    }
}
