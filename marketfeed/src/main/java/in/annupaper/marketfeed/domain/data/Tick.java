package in.annupaper.marketfeed.domain.data;

import java.math.BigDecimal;

/**
 * Real-time market tick as received from an upstream provider.
 *
 * {@code sequence} is the provider's message sequence number, or {@link #NO_SEQUENCE}
 * when the provider does not number its messages.
 */
public record Tick(
    String symbol,
    BigDecimal lastPrice,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    long volume,
    BigDecimal bid,
    BigDecimal ask,
    long timestamp,
    long sequence
) {
    public static final long NO_SEQUENCE = -1L;

    public static Tick of(String symbol, BigDecimal lastPrice, long timestamp) {
        return new Tick(symbol, lastPrice, null, null, null, null, 0L, null, null, timestamp, NO_SEQUENCE);
    }

    public static Tick of(String symbol, BigDecimal lastPrice, long timestamp, long sequence) {
        return new Tick(symbol, lastPrice, null, null, null, null, 0L, null, null, timestamp, sequence);
    }

    public boolean hasSequence() {
        return sequence != NO_SEQUENCE;
    }
}
