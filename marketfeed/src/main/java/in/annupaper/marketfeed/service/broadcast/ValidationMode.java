package in.annupaper.marketfeed.service.broadcast;

import java.util.Locale;

/**
 * PRODUCTION freezes the flag set except for the emergency override.
 */
public enum ValidationMode {
    PRODUCTION,
    DEVELOPMENT;

    public static ValidationMode parse(String value) {
        try {
            return ValidationMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid validation mode '" + value + "', expected production or development", e);
        }
    }
}
