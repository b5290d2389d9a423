package in.annupaper.marketfeed.service.market;

import java.time.ZoneId;

/**
 * Trading venues with their local time zone.
 */
public enum Market {
    US(ZoneId.of("America/New_York")),
    HK(ZoneId.of("Asia/Hong_Kong")),
    SH(ZoneId.of("Asia/Shanghai")),
    SZ(ZoneId.of("Asia/Shanghai")),
    CRYPTO(ZoneId.of("UTC"));

    private final ZoneId zone;

    Market(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId zone() {
        return zone;
    }
}
