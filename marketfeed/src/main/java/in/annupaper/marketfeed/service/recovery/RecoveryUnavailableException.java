package in.annupaper.marketfeed.service.recovery;

import in.annupaper.marketfeed.domain.common.MarketFeedException;

/**
 * The historical replay source cannot be reached. Distinct from "nothing to replay".
 */
public class RecoveryUnavailableException extends MarketFeedException {

    public RecoveryUnavailableException(String message) {
        super(message);
    }

    public RecoveryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
