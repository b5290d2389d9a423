package in.annupaper.marketfeed.infrastructure.cache;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Shared key-value backend of the warm cache tier. Entries expire by TTL only.
 */
public interface WarmStore extends AutoCloseable {

    void put(String key, String value, Duration ttl);

    Optional<String> get(String key);

    /**
     * Keys starting with {@code prefix}. Implementations enumerate incrementally.
     */
    List<String> scanKeys(String prefix);

    boolean delete(String key);

    default int deleteAll(Collection<String> keys) {
        int removed = 0;
        for (String key : keys) {
            if (delete(key)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    default void close() {}
}
