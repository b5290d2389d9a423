package in.annupaper.marketfeed.service.cache;

/**
 * Value returned by the orchestrator.
 *
 * @param stale true when the value is past its TTL and was served because the fetch failed or timed out
 */
public record CacheResult<T>(T value, CacheSource source, boolean stale, long ageMillis) {

    static <T> CacheResult<T> fetched(T value) {
        return new CacheResult<>(value, CacheSource.FETCH, false, 0);
    }
}
