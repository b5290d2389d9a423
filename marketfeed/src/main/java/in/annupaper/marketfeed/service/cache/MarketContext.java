package in.annupaper.marketfeed.service.cache;

import in.annupaper.marketfeed.service.market.Market;
import in.annupaper.marketfeed.service.market.MarketSessionClock;
import in.annupaper.marketfeed.service.market.MarketStatus;

/**
 * Market session state a cache write is made under. Same context, same TTL.
 */
public record MarketContext(Market market, MarketStatus status, TtlProfile profile) {

    public static MarketContext forSymbol(String symbol, MarketSessionClock sessions, TtlProfile profile) {
        Market market = MarketSessionClock.marketOf(symbol);
        return new MarketContext(market, sessions.statusOf(market), profile);
    }

    public long ttlSeconds() {
        return profile.ttlSeconds(status);
    }
}
