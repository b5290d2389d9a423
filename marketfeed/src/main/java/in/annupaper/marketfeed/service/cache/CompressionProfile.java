package in.annupaper.marketfeed.service.cache;

/**
 * Compression threshold per write path. Streaming writes favour latency with a small
 * threshold; batch and report writes favour storage with a larger one. Callers pick the
 * profile explicitly; the byte values come from {@link CacheConfig}.
 */
public enum CompressionProfile {
    STREAMING,
    BATCH
}
