package in.annupaper.marketfeed.service.recovery;

/**
 * Receives replayed data and recovery outcomes. A throw from {@link #onBatch} stops the
 * replay for that consumer.
 */
public interface RecoveryListener {

    void onBatch(RecoveryBatch batch);

    default void onComplete(RecoveryNotice notice) {}

    default void onFailed(RecoveryNotice notice) {}

    default void onHealthReport(HealthReport report) {}
}
