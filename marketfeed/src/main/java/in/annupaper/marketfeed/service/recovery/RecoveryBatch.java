package in.annupaper.marketfeed.service.recovery;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;

import java.util.List;

/**
 * Replayed ticks for one consumer. Always recovery data, never live.
 */
public record RecoveryBatch(
    long jobId,
    ConnectionKey key,
    String consumerId,
    List<Tick> ticks,
    int batchIndex,
    int totalBatches
) {
    public boolean isLast() {
        return batchIndex == totalBatches - 1;
    }
}
