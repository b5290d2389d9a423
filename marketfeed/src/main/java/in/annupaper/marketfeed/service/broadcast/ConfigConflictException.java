package in.annupaper.marketfeed.service.broadcast;

import in.annupaper.marketfeed.domain.common.MarketFeedException;

import java.util.List;

/**
 * Mutually exclusive feature flags are enabled together. Fatal: the router refuses to start.
 */
public class ConfigConflictException extends MarketFeedException {

    private final List<String> conflicts;

    public ConfigConflictException(List<String> conflicts) {
        super("Feature flag conflict: " + String.join("; ", conflicts));
        this.conflicts = List.copyOf(conflicts);
    }

    public List<String> getConflicts() {
        return conflicts;
    }
}
