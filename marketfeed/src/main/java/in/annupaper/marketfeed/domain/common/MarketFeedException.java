package in.annupaper.marketfeed.domain.common;

/**
 * Root of the market feed error taxonomy.
 */
public class MarketFeedException extends RuntimeException {

    public MarketFeedException(String message) {
        super(message);
    }

    public MarketFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
