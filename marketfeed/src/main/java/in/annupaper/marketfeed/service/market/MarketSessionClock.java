package in.annupaper.marketfeed.service.market;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Market session lookup per venue.
 *
 * Local trading hours:
 * <pre>
 * US      pre 04:00-09:30, regular 09:30-16:00, after-hours 16:00-20:00 (New York, DST aware)
 * HK      pre 09:00-09:30, regular 09:30-12:00 and 13:00-16:00
 * SH, SZ  pre 09:15-09:30, regular 09:30-11:30 and 13:00-15:00
 * CRYPTO  always trading
 * </pre>
 * Saturdays and Sundays are WEEKEND, registered dates are HOLIDAY.
 */
public class MarketSessionClock {
    private static final Logger log = LoggerFactory.getLogger(MarketSessionClock.class);

    private static final Pattern A_SHARE_SH = Pattern.compile("^6\\d{5}$");
    private static final Pattern A_SHARE_SZ = Pattern.compile("^[03]\\d{5}$");
    private static final Pattern HK_CODE = Pattern.compile("^\\d{4,5}$");

    private static final Map<Market, Hours> HOURS = new EnumMap<>(Market.class);

    static {
        HOURS.put(Market.US, new Hours(
            LocalTime.of(4, 0),
            List.of(new Session(LocalTime.of(9, 30), LocalTime.of(16, 0))),
            LocalTime.of(20, 0)));
        HOURS.put(Market.HK, new Hours(
            LocalTime.of(9, 0),
            List.of(new Session(LocalTime.of(9, 30), LocalTime.of(12, 0)),
                    new Session(LocalTime.of(13, 0), LocalTime.of(16, 0))),
            null));
        Hours china = new Hours(
            LocalTime.of(9, 15),
            List.of(new Session(LocalTime.of(9, 30), LocalTime.of(11, 30)),
                    new Session(LocalTime.of(13, 0), LocalTime.of(15, 0))),
            null);
        HOURS.put(Market.SH, china);
        HOURS.put(Market.SZ, china);
    }

    private final Clock clock;
    private final Map<Market, Set<LocalDate>> holidays = new ConcurrentHashMap<>();

    public MarketSessionClock(Clock clock) {
        this.clock = clock;
    }

    public MarketSessionClock() {
        this(Clock.systemUTC());
    }

    public void addHoliday(Market market, LocalDate date) {
        holidays.computeIfAbsent(market, m -> ConcurrentHashMap.newKeySet()).add(date);
        log.info("[MARKET] Holiday registered: {} {}", market, date);
    }

    public MarketStatus statusOf(Market market) {
        return statusAt(market, clock.instant());
    }

    public MarketStatus statusAt(Market market, Instant instant) {
        if (market == Market.CRYPTO) {
            return MarketStatus.TRADING;
        }
        ZonedDateTime local = instant.atZone(market.zone());
        LocalDate date = local.toLocalDate();
        if (holidays.getOrDefault(market, Set.of()).contains(date)) {
            return MarketStatus.HOLIDAY;
        }
        if (date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY) {
            return MarketStatus.WEEKEND;
        }

        Hours hours = HOURS.get(market);
        LocalTime t = local.toLocalTime();
        List<Session> sessions = hours.sessions();
        for (Session s : sessions) {
            if (s.contains(t)) {
                return MarketStatus.TRADING;
            }
        }

        LocalTime open = sessions.get(0).start();
        LocalTime close = sessions.get(sessions.size() - 1).end();
        if (!t.isBefore(hours.preMarketStart()) && t.isBefore(open)) {
            return MarketStatus.PRE_MARKET;
        }
        if (t.isAfter(open) && t.isBefore(close)) {
            return MarketStatus.LUNCH_BREAK;
        }
        if (hours.afterHoursEnd() != null && !t.isBefore(close) && t.isBefore(hours.afterHoursEnd())) {
            return MarketStatus.AFTER_HOURS;
        }
        return MarketStatus.MARKET_CLOSED;
    }

    /**
     * Venue for a symbol: explicit suffix first ({@code .HK .SH .SZ .US}), then the code shape.
     * Anything unrecognised is treated as US.
     */
    public static Market marketOf(String symbol) {
        String s = symbol.trim().toUpperCase(Locale.ROOT);
        int dot = s.lastIndexOf('.');
        if (dot > 0) {
            String base = s.substring(0, dot);
            switch (s.substring(dot + 1)) {
                case "HK" -> { return Market.HK; }
                case "SH" -> { return Market.SH; }
                case "SZ" -> { return Market.SZ; }
                case "US" -> { return Market.US; }
                default -> s = base;
            }
        }
        if (A_SHARE_SH.matcher(s).matches()) {
            return Market.SH;
        }
        if (A_SHARE_SZ.matcher(s).matches()) {
            return Market.SZ;
        }
        if (HK_CODE.matcher(s).matches()) {
            return Market.HK;
        }
        if (s.endsWith("USDT") || s.endsWith("-USD") || s.startsWith("BTC") || s.startsWith("ETH")) {
            return Market.CRYPTO;
        }
        return Market.US;
    }

    private record Session(LocalTime start, LocalTime end) {
        boolean contains(LocalTime t) {
            return !t.isBefore(start) && t.isBefore(end);
        }
    }

    private record Hours(LocalTime preMarketStart, List<Session> sessions, LocalTime afterHoursEnd) {}
}
