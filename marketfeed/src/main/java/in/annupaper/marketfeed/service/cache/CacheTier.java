package in.annupaper.marketfeed.service.cache;

public enum CacheTier {
    HOT,
    WARM
}
