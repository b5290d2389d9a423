package in.annupaper.marketfeed.service.cache;

import in.annupaper.marketfeed.service.market.Market;
import in.annupaper.marketfeed.service.market.MarketSessionClock;
import in.annupaper.marketfeed.service.market.MarketStatus;
import in.annupaper.marketfeed.util.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MarketContextTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-04T15:00:00Z"));
    private final MarketSessionClock sessions = new MarketSessionClock(clock);

    @Test
    void testTtlFollowsSession() {
        MarketContext open = MarketContext.forSymbol("AAPL", sessions, TtlProfile.REALTIME);
        assertEquals(Market.US, open.market());
        assertEquals(MarketStatus.TRADING, open.status());
        assertEquals(5, open.ttlSeconds());

        clock.advance(Duration.ofHours(12));
        MarketContext closed = MarketContext.forSymbol("AAPL", sessions, TtlProfile.REALTIME);
        assertEquals(MarketStatus.MARKET_CLOSED, closed.status());
        assertEquals(3600, closed.ttlSeconds());
    }

    @Test
    void testSameContextSameTtl() {
        MarketContext a = MarketContext.forSymbol("0700.HK", sessions, TtlProfile.ANALYTICAL);
        MarketContext b = MarketContext.forSymbol("0700.HK", sessions, TtlProfile.ANALYTICAL);

        assertEquals(a, b);
        assertEquals(a.ttlSeconds(), b.ttlSeconds());
    }

    @Test
    void testEveryStatusHasTtl() {
        for (TtlProfile profile : TtlProfile.values()) {
            for (MarketStatus status : MarketStatus.values()) {
                assertTrue(profile.ttlSeconds(status) > 0, profile + "/" + status);
            }
        }
        assertTrue(TtlProfile.REALTIME.ttlSeconds(MarketStatus.TRADING)
            < TtlProfile.REALTIME.ttlSeconds(MarketStatus.WEEKEND));
    }
}
