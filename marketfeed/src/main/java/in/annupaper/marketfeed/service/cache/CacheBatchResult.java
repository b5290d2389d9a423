package in.annupaper.marketfeed.service.cache;

import java.util.Map;

/**
 * Outcome of {@link SmartCacheOrchestrator#getOrComputeAll}. One failing key never hides
 * the others.
 */
public record CacheBatchResult<T>(Map<String, CacheResult<T>> results, Map<String, CacheFetchException> failures) {

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
