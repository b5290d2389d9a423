package in.annupaper.marketfeed.service.market;

public enum MarketStatus {
    PRE_MARKET,
    TRADING,
    LUNCH_BREAK,
    AFTER_HOURS,
    MARKET_CLOSED,
    WEEKEND,
    HOLIDAY;

    /**
     * Prices can move: regular, pre-market or after-hours trading.
     */
    public boolean isActive() {
        return this == TRADING || this == PRE_MARKET || this == AFTER_HOURS;
    }
}
