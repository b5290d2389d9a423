package in.annupaper.marketfeed.domain.data;

import java.util.Objects;

/**
 * Identifies one logical upstream link: a provider and one of its capabilities
 * (for example {@code P1 / quote-stream}).
 */
public record ConnectionKey(String providerId, String capabilityId) {

    public ConnectionKey {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(capabilityId, "capabilityId");
        if (providerId.isBlank() || capabilityId.isBlank()) {
            throw new IllegalArgumentException("providerId and capabilityId must not be blank");
        }
    }

    public static ConnectionKey of(String providerId, String capabilityId) {
        return new ConnectionKey(providerId, capabilityId);
    }

    /**
     * Stable id used in logs, metrics labels and delivery callbacks.
     */
    public String id() {
        return providerId + ":" + capabilityId;
    }

    @Override
    public String toString() {
        return id();
    }
}
