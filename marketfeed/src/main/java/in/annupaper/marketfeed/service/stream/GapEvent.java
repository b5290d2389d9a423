package in.annupaper.marketfeed.service.stream;

import in.annupaper.marketfeed.domain.data.ConnectionKey;

import java.util.Map;
import java.util.Set;

/**
 * Ticks were probably missed on a connection between {@code fromTimestamp} and {@code toTimestamp}.
 *
 * @param symbolsByConsumer consumers that were subscribed when the gap was detected, with their symbols
 * @param reason RECONNECT or SEQUENCE
 */
public record GapEvent(
    ConnectionKey key,
    long fromTimestamp,
    long toTimestamp,
    Map<String, Set<String>> symbolsByConsumer,
    String reason
) {}
