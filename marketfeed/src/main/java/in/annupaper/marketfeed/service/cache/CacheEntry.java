package in.annupaper.marketfeed.service.cache;

/**
 * One cached value in serialized form.
 *
 * @param payload serialized value, GZIP'd when {@code compressed}
 * @param sizeBytes serialized size before compression
 * @param compressed true iff {@code sizeBytes} exceeded the write path's threshold
 */
public record CacheEntry(
    String key,
    byte[] payload,
    long storedAtMillis,
    long ttlSeconds,
    CacheTier tier,
    boolean compressed,
    int sizeBytes
) {
    public CacheEntry {
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("ttlSeconds must not be negative: " + ttlSeconds);
        }
    }

    public long expiresAtMillis() {
        return storedAtMillis + ttlSeconds * 1000L;
    }

    public boolean isExpired(long nowMillis) {
        return nowMillis >= expiresAtMillis();
    }

    public long remainingMillis(long nowMillis) {
        return Math.max(0, expiresAtMillis() - nowMillis);
    }

    public long ageMillis(long nowMillis) {
        return Math.max(0, nowMillis - storedAtMillis);
    }

    public CacheEntry withTier(CacheTier newTier) {
        return new CacheEntry(key, payload, storedAtMillis, ttlSeconds, newTier, compressed, sizeBytes);
    }
}
