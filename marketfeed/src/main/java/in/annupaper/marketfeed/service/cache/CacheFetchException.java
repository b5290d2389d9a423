package in.annupaper.marketfeed.service.cache;

import in.annupaper.marketfeed.domain.common.MarketFeedException;

/**
 * A cache-miss fetch failed or did not finish within the caller's timeout.
 * Never cached; every waiter on the same key observes the same instance.
 */
public class CacheFetchException extends MarketFeedException {

    private final String key;
    private final boolean timeout;

    public CacheFetchException(String key, String message, Throwable cause) {
        super(String.format("[%s] %s", key, message), cause);
        this.key = key;
        this.timeout = false;
    }

    private CacheFetchException(String key, String message) {
        super(String.format("[%s] %s", key, message));
        this.key = key;
        this.timeout = true;
    }

    public static CacheFetchException timeout(String key, long timeoutMs) {
        return new CacheFetchException(key, "fetch timed out after " + timeoutMs + " ms");
    }

    public String getKey() {
        return key;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
