package in.annupaper.marketfeed.service.cache;

import in.annupaper.marketfeed.service.market.MarketStatus;

import java.util.EnumMap;
import java.util.Map;

/**
 * TTL tables by market status. Seconds while prices move, hours once the venue is closed.
 */
public enum TtlProfile {
    /** Quotes and other point-in-time data. */
    REALTIME(5, 10, 30, 60, 3600, 7200, 14400),
    /** Aggregates, fundamentals and reports. */
    ANALYTICAL(60, 300, 600, 900, 3600, 7200, 14400);

    private final Map<MarketStatus, Long> seconds = new EnumMap<>(MarketStatus.class);

    TtlProfile(long trading, long preMarket, long afterHours, long lunchBreak,
               long closed, long weekend, long holiday) {
        seconds.put(MarketStatus.TRADING, trading);
        seconds.put(MarketStatus.PRE_MARKET, preMarket);
        seconds.put(MarketStatus.AFTER_HOURS, afterHours);
        seconds.put(MarketStatus.LUNCH_BREAK, lunchBreak);
        seconds.put(MarketStatus.MARKET_CLOSED, closed);
        seconds.put(MarketStatus.WEEKEND, weekend);
        seconds.put(MarketStatus.HOLIDAY, holiday);
    }

    public long ttlSeconds(MarketStatus status) {
        return seconds.get(status);
    }
}
