package in.annupaper.marketfeed.service.recovery;

import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.infrastructure.provider.common.ReconnectionPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * One gap to replay. Ordered by priority, then submission order.
 */
public final class RecoveryJob implements Comparable<RecoveryJob> {

    static final Duration RECENT_GAP = Duration.ofSeconds(30);
    static final int LARGE_SYMBOL_COUNT = 50;

    private final long id;
    private final ConnectionKey key;
    private final RecoveryWindow window;
    private final Map<String, Set<String>> symbolsByConsumer;
    private final RecoveryPriority priority;
    private final String reason;
    private final Instant submittedAt;
    private final ReconnectionPolicy retryPolicy;

    RecoveryJob(long id, ConnectionKey key, RecoveryWindow window, Map<String, Set<String>> symbolsByConsumer,
                String reason, Instant submittedAt, ReconnectionPolicy retryPolicy) {
        this.id = id;
        this.key = key;
        this.window = window;
        this.symbolsByConsumer = Map.copyOf(symbolsByConsumer);
        this.reason = reason;
        this.submittedAt = submittedAt;
        this.retryPolicy = retryPolicy;
        this.priority = priorityFor(window, allSymbols().size());
    }

    /**
     * Short gaps first: they are cheap and the freshest data matters most.
     * Very wide jobs go last so they cannot starve everything else.
     */
    static RecoveryPriority priorityFor(RecoveryWindow window, int symbolCount) {
        if (symbolCount > LARGE_SYMBOL_COUNT) {
            return RecoveryPriority.LOW;
        }
        if (window.length().compareTo(RECENT_GAP) < 0) {
            return RecoveryPriority.HIGH;
        }
        return RecoveryPriority.NORMAL;
    }

    public Set<String> allSymbols() {
        Set<String> all = new TreeSet<>();
        symbolsByConsumer.values().forEach(all::addAll);
        return all;
    }

    @Override
    public int compareTo(RecoveryJob other) {
        int byPriority = priority.compareTo(other.priority);
        return byPriority != 0 ? byPriority : Long.compare(id, other.id);
    }

    public long getId() {
        return id;
    }

    public ConnectionKey getKey() {
        return key;
    }

    public RecoveryWindow getWindow() {
        return window;
    }

    public Map<String, Set<String>> getSymbolsByConsumer() {
        return symbolsByConsumer;
    }

    public RecoveryPriority getPriority() {
        return priority;
    }

    public String getReason() {
        return reason;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    ReconnectionPolicy retryPolicy() {
        return retryPolicy;
    }

    @Override
    public String toString() {
        return "RecoveryJob#" + id + "[" + key + " " + priority + " " + window.length().toMillis() + "ms, "
            + allSymbols().size() + " symbols]";
    }
}
