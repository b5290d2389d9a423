package in.annupaper.marketfeed.service.cache;

public enum CacheSource {
    HOT,
    WARM,
    FETCH
}
