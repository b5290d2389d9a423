package in.annupaper.marketfeed.service.ratelimit;

import java.time.Duration;

/**
 * Outcome of {@link RateLimiter#acquireBlocking}: either a permit or a timeout, never an exception.
 */
public final class AcquireResult {

    public enum Outcome { PERMIT, TIMEOUT }

    private final Outcome outcome;
    private final Duration waited;

    private AcquireResult(Outcome outcome, Duration waited) {
        this.outcome = outcome;
        this.waited = waited;
    }

    static AcquireResult permit(Duration waited) {
        return new AcquireResult(Outcome.PERMIT, waited);
    }

    static AcquireResult timeout(Duration waited) {
        return new AcquireResult(Outcome.TIMEOUT, waited);
    }

    public Outcome outcome() {
        return outcome;
    }

    public boolean isPermit() {
        return outcome == Outcome.PERMIT;
    }

    public Duration waited() {
        return waited;
    }

    /**
     * For callers that prefer an exception over checking the outcome.
     *
     * @throws RateLimitExceededException if this result is a timeout
     */
    public AcquireResult orThrow(String providerId) {
        if (!isPermit()) {
            throw new RateLimitExceededException(providerId, waited);
        }
        return this;
    }

    @Override
    public String toString() {
        return outcome + "(" + waited.toMillis() + "ms)";
    }
}
