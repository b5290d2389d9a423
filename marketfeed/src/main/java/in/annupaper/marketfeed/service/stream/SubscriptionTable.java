package in.annupaper.marketfeed.service.stream;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-symbol reference counts for one connection, keyed by consumer.
 *
 * A symbol stays referenced while at least one consumer holds it. Adding the same
 * (consumer, symbol) pair twice is a no-op, as is removing a pair that is not held.
 * Not thread-safe: the owning connection serializes access.
 */
final class SubscriptionTable {

    private final Map<String, Set<String>> consumersBySymbol = new HashMap<>();
    private final Map<String, Set<String>> symbolsByConsumer = new HashMap<>();

    /**
     * @return symbols that went from zero to one reference
     */
    Set<String> add(String consumerId, Collection<String> symbols) {
        Set<String> added = new LinkedHashSet<>();
        Set<String> held = symbolsByConsumer.computeIfAbsent(consumerId, c -> new HashSet<>());
        for (String symbol : symbols) {
            if (!held.add(symbol)) {
                continue;
            }
            Set<String> consumers = consumersBySymbol.computeIfAbsent(symbol, s -> new HashSet<>());
            if (consumers.isEmpty()) {
                added.add(symbol);
            }
            consumers.add(consumerId);
        }
        if (held.isEmpty()) {
            symbolsByConsumer.remove(consumerId);
        }
        return added;
    }

    /**
     * @return symbols that dropped to zero references
     */
    Set<String> remove(String consumerId, Collection<String> symbols) {
        Set<String> dropped = new LinkedHashSet<>();
        Set<String> held = symbolsByConsumer.get(consumerId);
        if (held == null) {
            return dropped;
        }
        for (String symbol : symbols) {
            if (!held.remove(symbol)) {
                continue;
            }
            Set<String> consumers = consumersBySymbol.get(symbol);
            consumers.remove(consumerId);
            if (consumers.isEmpty()) {
                consumersBySymbol.remove(symbol);
                dropped.add(symbol);
            }
        }
        if (held.isEmpty()) {
            symbolsByConsumer.remove(consumerId);
        }
        return dropped;
    }

    Set<String> removeConsumer(String consumerId) {
        Set<String> held = symbolsByConsumer.get(consumerId);
        if (held == null) {
            return Set.of();
        }
        return remove(consumerId, new HashSet<>(held));
    }

    Set<String> consumersOf(String symbol) {
        Set<String> consumers = consumersBySymbol.get(symbol);
        return consumers == null ? Set.of() : Set.copyOf(consumers);
    }

    Set<String> symbolsOf(String consumerId) {
        Set<String> held = symbolsByConsumer.get(consumerId);
        return held == null ? Set.of() : Set.copyOf(held);
    }

    Set<String> symbols() {
        return Set.copyOf(consumersBySymbol.keySet());
    }

    Set<String> consumers() {
        return Set.copyOf(symbolsByConsumer.keySet());
    }

    int referenceCount(String symbol) {
        Set<String> consumers = consumersBySymbol.get(symbol);
        return consumers == null ? 0 : consumers.size();
    }

    boolean isEmpty() {
        return symbolsByConsumer.isEmpty();
    }

    void clear() {
        consumersBySymbol.clear();
        symbolsByConsumer.clear();
    }
}
