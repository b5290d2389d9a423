package in.annupaper.marketfeed.service.recovery;

import in.annupaper.marketfeed.domain.data.ConnectionKey;

import java.util.Set;

/**
 * End of a recovery job, successful or not.
 *
 * @param consumers consumers the notice applies to
 * @param failureReason null when completed
 */
public record RecoveryNotice(
    long jobId,
    ConnectionKey key,
    Set<String> consumers,
    RecoveryWindow window,
    Outcome outcome,
    int recoveredTicks,
    int attempts,
    String failureReason
) {
    public enum Outcome {
        COMPLETED,
        FAILED
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }
}
