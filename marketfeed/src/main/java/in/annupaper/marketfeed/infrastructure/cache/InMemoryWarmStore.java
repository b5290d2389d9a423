package in.annupaper.marketfeed.infrastructure.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local warm store, used when no Redis URI is configured and in tests.
 * Expired values are dropped lazily on access and by {@link #purgeExpired()}.
 */
public class InMemoryWarmStore implements WarmStore {

    private final Map<String, Stored> values = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryWarmStore(Clock clock) {
        this.clock = clock;
    }

    public InMemoryWarmStore() {
        this(Clock.systemUTC());
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        values.put(key, new Stored(value, clock.millis() + ttl.toMillis()));
    }

    @Override
    public Optional<String> get(String key) {
        Stored s = values.get(key);
        if (s == null) {
            return Optional.empty();
        }
        if (s.expiresAt() <= clock.millis()) {
            values.remove(key, s);
            return Optional.empty();
        }
        return Optional.of(s.value());
    }

    @Override
    public List<String> scanKeys(String prefix) {
        long now = clock.millis();
        return values.entrySet().stream()
            .filter(e -> e.getKey().startsWith(prefix) && e.getValue().expiresAt() > now)
            .map(Map.Entry::getKey)
            .toList();
    }

    @Override
    public boolean delete(String key) {
        return values.remove(key) != null;
    }

    public int purgeExpired() {
        long now = clock.millis();
        int before = values.size();
        values.entrySet().removeIf(e -> e.getValue().expiresAt() <= now);
        return before - values.size();
    }

    public int size() {
        return values.size();
    }

    private record Stored(String value, long expiresAt) {}
}
