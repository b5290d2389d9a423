package in.annupaper.marketfeed.service.cache;

public record CacheStats(
    long hotHits,
    long warmHits,
    long misses,
    long staleServed,
    long evictions,
    long degradedScans,
    int hotSize
) {
    public double hitRate() {
        long total = hotHits + warmHits + misses;
        return total == 0 ? 0.0 : (double) (hotHits + warmHits) / total;
    }
}
