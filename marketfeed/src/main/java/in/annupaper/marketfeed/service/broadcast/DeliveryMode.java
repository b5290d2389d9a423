package in.annupaper.marketfeed.service.broadcast;

public enum DeliveryMode {
    /** Push straight to consumers of the connection that received the tick. */
    LEGACY,
    /** Publish to the broadcast layer; every consumer of the symbol receives it. */
    GATEWAY
}
