package in.annupaper.marketfeed.service.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Bounded in-process tier with LRU eviction.
 *
 * Keys are colon-separated ({@code quote:P1:AAPL}). A secondary index maps every
 * colon-terminated prefix ({@code quote:}, {@code quote:P1:}) to its keys so that prefix
 * invalidation touches only matching entries. A key count per prefix is kept next to the
 * index; a bucket whose size or members disagree with it (phantom keys, missing keys, a
 * missing bucket) is rebuilt, and the call falls back to a logged linear scan, as do
 * prefixes that do not end at a colon.
 */
class HotTier {
    private static final Logger log = LoggerFactory.getLogger(HotTier.class);

    private final int maxEntries;
    private final ReentrantLock lock = new ReentrantLock();
    // Guarded by lock
    final Map<String, Set<String>> prefixIndex = new HashMap<>();
    private final Map<String, Integer> prefixCounts = new HashMap<>();
    private final LinkedHashMap<String, CacheEntry> entries;
    private Consumer<CacheEntry> evictionListener = e -> {};
    private long evictions;
    private long degradedScans;

    HotTier(int maxEntries) {
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(Math.min(maxEntries, 1024), 0.75f, true);
    }

    void onEviction(Consumer<CacheEntry> listener) {
        this.evictionListener = listener;
    }

    CacheEntry get(String key) {
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    void put(CacheEntry entry) {
        List<CacheEntry> evicted = new ArrayList<>();
        lock.lock();
        try {
            if (entries.put(entry.key(), entry) == null) {
                index(entry.key());
            }
            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            while (entries.size() > maxEntries && it.hasNext()) {
                Map.Entry<String, CacheEntry> eldest = it.next();
                it.remove();
                unindex(eldest.getKey());
                evicted.add(eldest.getValue());
                evictions++;
            }
        } finally {
            lock.unlock();
        }
        evicted.forEach(evictionListener);
    }

    boolean remove(String key) {
        lock.lock();
        try {
            if (entries.remove(key) != null) {
                unindex(key);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every key starting with {@code prefix}.
     *
     * @return number of removed entries
     */
    int removeByPrefix(String prefix) {
        lock.lock();
        try {
            if (prefix.endsWith(":")) {
                Set<String> indexed = prefixIndex.get(prefix);
                int expected = prefixCounts.getOrDefault(prefix, 0);
                if (isConsistent(indexed, expected)) {
                    if (indexed == null) {
                        return 0;
                    }
                    List<String> keys = new ArrayList<>(indexed);
                    keys.forEach(this::removeLocked);
                    return keys.size();
                }
                log.warn("[CACHE] Hot-tier index for '{}' is inconsistent ({} indexed, {} expected), "
                    + "rebuilding with a linear scan", prefix, indexed == null ? 0 : indexed.size(), expected);
                rebuildIndex();
            } else {
                log.warn("[CACHE] Prefix '{}' is not colon-terminated, linear scan over {} hot entries",
                    prefix, entries.size());
            }
            degradedScans++;
            List<String> matches = new ArrayList<>();
            for (String key : entries.keySet()) {
                if (key.startsWith(prefix)) {
                    matches.add(key);
                }
            }
            matches.forEach(this::removeLocked);
            return matches.size();
        } finally {
            lock.unlock();
        }
    }

    private void removeLocked(String key) {
        if (entries.remove(key) != null) {
            unindex(key);
        }
    }

    private boolean isConsistent(Set<String> indexed, int expected) {
        if (indexed == null) {
            return expected == 0;
        }
        if (indexed.size() != expected) {
            return false;
        }
        for (String key : indexed) {
            if (!entries.containsKey(key)) {
                return false;
            }
        }
        return true;
    }

    private void index(String key) {
        for (int i = key.indexOf(':'); i >= 0; i = key.indexOf(':', i + 1)) {
            String prefix = key.substring(0, i + 1);
            prefixIndex.computeIfAbsent(prefix, p -> new HashSet<>()).add(key);
            prefixCounts.merge(prefix, 1, Integer::sum);
        }
    }

    private void unindex(String key) {
        for (int i = key.indexOf(':'); i >= 0; i = key.indexOf(':', i + 1)) {
            String prefix = key.substring(0, i + 1);
            Set<String> keys = prefixIndex.get(prefix);
            if (keys != null) {
                keys.remove(key);
                if (keys.isEmpty()) {
                    prefixIndex.remove(prefix);
                }
            }
            prefixCounts.computeIfPresent(prefix, (p, n) -> n > 1 ? n - 1 : null);
        }
    }

    private void rebuildIndex() {
        prefixIndex.clear();
        prefixCounts.clear();
        entries.keySet().forEach(this::index);
    }

    int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    long evictions() {
        lock.lock();
        try {
            return evictions;
        } finally {
            lock.unlock();
        }
    }

    long degradedScans() {
        lock.lock();
        try {
            return degradedScans;
        } finally {
            lock.unlock();
        }
    }
}
