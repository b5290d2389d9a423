package in.annupaper.marketfeed.service.broadcast;

import in.annupaper.marketfeed.domain.data.Tick;

/**
 * Out-of-process fan-out used in gateway mode.
 */
public interface BroadcastBus {

    /**
     * @return number of remote subscribers the tick was sent to
     */
    int publish(Tick tick);

    BroadcastBus NONE = tick -> 0;
}
