package in.annupaper.marketfeed.service.ratelimit;

import in.annupaper.marketfeed.domain.common.MarketFeedException;

import java.time.Duration;

/**
 * Caller-visible, non-fatal: no permit could be obtained within the allowed wait.
 * The caller decides whether to retry, queue or drop.
 */
public class RateLimitExceededException extends MarketFeedException {

    private final String providerId;
    private final Duration waited;

    public RateLimitExceededException(String providerId, Duration waited) {
        super(String.format("[%s] rate limit exceeded (waited %d ms)", providerId, waited.toMillis()));
        this.providerId = providerId;
        this.waited = waited;
    }

    public String getProviderId() {
        return providerId;
    }

    public Duration getWaited() {
        return waited;
    }
}
