package in.annupaper.marketfeed.service.cache;

public enum CacheStrategy {
    /** Fixed short TTL, refreshed once half of it has elapsed. */
    STRONG_TIMELINESS,
    /** Fixed long TTL. */
    WEAK_TIMELINESS,
    /** TTL from the market session of the symbol. */
    MARKET_AWARE,
    /** TTL shrinks while the value keeps changing and grows while it is stable. */
    ADAPTIVE,
    /** Never stored; concurrent fetches are still shared. */
    NO_CACHE
}
