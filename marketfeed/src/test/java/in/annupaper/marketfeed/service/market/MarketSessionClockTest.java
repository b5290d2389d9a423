package in.annupaper.marketfeed.service.market;

import in.annupaper.marketfeed.util.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MarketSessionClock.
 *
 * Tests:
 * - Session boundaries per venue, DST aware
 * - Weekends and registered holidays
 * - Venue detection from the symbol
 */
class MarketSessionClockTest {

    // Monday 2024-03-04, New York on EST (UTC-5)
    private final MarketSessionClock sessions = new MarketSessionClock(new MutableClock(Instant.parse("2024-03-04T15:00:00Z")));

    private MarketStatus at(Market market, String instant) {
        return sessions.statusAt(market, Instant.parse(instant));
    }

    @Test
    void testUsSessions() {
        assertEquals(MarketStatus.PRE_MARKET, at(Market.US, "2024-03-04T13:00:00Z"));
        assertEquals(MarketStatus.TRADING, at(Market.US, "2024-03-04T14:30:00Z"));
        assertEquals(MarketStatus.AFTER_HOURS, at(Market.US, "2024-03-04T21:00:00Z"));
        assertEquals(MarketStatus.MARKET_CLOSED, at(Market.US, "2024-03-05T02:00:00Z"));
        assertEquals(MarketStatus.TRADING, sessions.statusOf(Market.US));
    }

    @Test
    void testUsOpenFollowsDaylightSaving() {
        // 13:30Z is 08:30 EST in March but 09:30 EDT in July
        assertEquals(MarketStatus.PRE_MARKET, at(Market.US, "2024-03-04T13:30:00Z"));
        assertEquals(MarketStatus.TRADING, at(Market.US, "2024-07-01T13:30:00Z"));
    }

    @Test
    void testHongKongLunchBreak() {
        assertEquals(MarketStatus.PRE_MARKET, at(Market.HK, "2024-03-04T01:10:00Z"));
        assertEquals(MarketStatus.TRADING, at(Market.HK, "2024-03-04T02:00:00Z"));
        assertEquals(MarketStatus.LUNCH_BREAK, at(Market.HK, "2024-03-04T04:30:00Z"));
        assertEquals(MarketStatus.TRADING, at(Market.HK, "2024-03-04T05:00:00Z"));
        assertEquals(MarketStatus.MARKET_CLOSED, at(Market.HK, "2024-03-04T08:30:00Z"));
    }

    @Test
    void testShanghaiSessions() {
        assertEquals(MarketStatus.PRE_MARKET, at(Market.SH, "2024-03-04T01:20:00Z"));
        assertEquals(MarketStatus.LUNCH_BREAK, at(Market.SH, "2024-03-04T04:00:00Z"));
        assertEquals(MarketStatus.MARKET_CLOSED, at(Market.SZ, "2024-03-04T07:30:00Z"));
    }

    @Test
    void testWeekendAndHoliday() {
        assertEquals(MarketStatus.WEEKEND, at(Market.US, "2024-03-09T15:00:00Z"));

        sessions.addHoliday(Market.HK, LocalDate.of(2024, 3, 4));

        assertEquals(MarketStatus.HOLIDAY, at(Market.HK, "2024-03-04T02:00:00Z"));
        assertEquals(MarketStatus.TRADING, at(Market.SH, "2024-03-04T02:00:00Z"));
    }

    @Test
    void testCryptoAlwaysTrading() {
        assertEquals(MarketStatus.TRADING, at(Market.CRYPTO, "2024-03-09T03:00:00Z"));
    }

    @Test
    void testMarketOfSymbol() {
        assertEquals(Market.HK, MarketSessionClock.marketOf("0700.HK"));
        assertEquals(Market.HK, MarketSessionClock.marketOf("00700"));
        assertEquals(Market.SH, MarketSessionClock.marketOf("600519"));
        assertEquals(Market.SH, MarketSessionClock.marketOf("600519.SH"));
        assertEquals(Market.SZ, MarketSessionClock.marketOf("000001"));
        assertEquals(Market.SZ, MarketSessionClock.marketOf("300750"));
        assertEquals(Market.US, MarketSessionClock.marketOf("aapl.us"));
        assertEquals(Market.US, MarketSessionClock.marketOf("MSFT"));
        assertEquals(Market.CRYPTO, MarketSessionClock.marketOf("BTCUSDT"));
    }

    @Test
    void testActiveStatuses() {
        assertTrue(MarketStatus.TRADING.isActive());
        assertTrue(MarketStatus.AFTER_HOURS.isActive());
        assertFalse(MarketStatus.LUNCH_BREAK.isActive());
        assertFalse(MarketStatus.HOLIDAY.isActive());
    }
}
