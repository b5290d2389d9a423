package in.annupaper.marketfeed.service.stream;

import in.annupaper.marketfeed.domain.common.MarketFeedException;

public class IllegalStateTransitionException extends MarketFeedException {

    private final ConnectionState from;
    private final ConnectionEvent event;

    public IllegalStateTransitionException(ConnectionState from, ConnectionEvent event) {
        super("No transition from " + from + " on " + event);
        this.from = from;
        this.event = event;
    }

    public ConnectionState getFrom() {
        return from;
    }

    public ConnectionEvent getEvent() {
        return event;
    }
}
