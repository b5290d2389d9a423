package in.annupaper.marketfeed.service.recovery;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;

import java.util.List;
import java.util.Set;

/**
 * Historical tick store used to fill gaps.
 */
public interface HistoricalReplaySource {

    /**
     * Ticks for {@code symbols} within {@code window}, in any order.
     *
     * @throws RecoveryUnavailableException if the source itself cannot be reached
     */
    List<Tick> replay(ConnectionKey key, Set<String> symbols, RecoveryWindow window);
}
