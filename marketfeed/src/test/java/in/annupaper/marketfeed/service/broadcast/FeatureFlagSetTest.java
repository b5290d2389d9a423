package in.annupaper.marketfeed.service.broadcast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FeatureFlagSet.
 *
 * Tests:
 * - Defaults are consistent
 * - Mutually exclusive flags are reported
 * - Emergency override keeps the set valid
 */
class FeatureFlagSetTest {

    @Test
    void testDefaultsAreValidGatewayStrict() {
        FeatureFlagSet flags = FeatureFlagSet.defaults().validate();

        assertEquals(DeliveryMode.GATEWAY, flags.deliveryMode());
        assertTrue(flags.strictMode());
        assertFalse(flags.allowLegacyFallback());
        assertEquals(ValidationMode.PRODUCTION, flags.validationMode());
        assertTrue(flags.conflicts().isEmpty());
    }

    @Test
    @DisplayName("Strict mode with legacy fallback is a conflict")
    void testStrictWithFallbackConflicts() {
        FeatureFlagSet flags = FeatureFlagSet.defaults().withAllowLegacyFallback(true);

        ConfigConflictException e = assertThrows(ConfigConflictException.class, flags::validate);

        assertEquals(1, e.getConflicts().size());
        assertTrue(e.getMessage().contains("allowLegacyFallback"));
    }

    @Test
    void testOverrideWithoutReasonConflicts() {
        FeatureFlagSet flags = new FeatureFlagSet(true, false, true, ValidationMode.PRODUCTION, false,
            0.05, 20, 5, 10, Duration.ofMinutes(5), true, " ");

        assertEquals(1, flags.conflicts().size());
        assertThrows(ConfigConflictException.class, flags::validate);
    }

    @Test
    void testEmergencyOverrideLiftsStrictMode() {
        FeatureFlagSet flags = FeatureFlagSet.defaults().withEmergencyOverride("gateway outage");

        assertDoesNotThrow(flags::validate);
        assertFalse(flags.strictMode());
        assertTrue(flags.allowLegacyFallback());
        assertTrue(flags.emergencyOverride());
        assertEquals("gateway outage", flags.overrideReason());
        assertEquals(DeliveryMode.LEGACY, flags.deliveryMode());
    }

    @Test
    void testGatewayOffMeansLegacy() {
        assertEquals(DeliveryMode.LEGACY, FeatureFlagSet.defaults().withGatewayOnlyMode(false).deliveryMode());
    }

    @Test
    void testConstructorRejectsBadThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new FeatureFlagSet(true, true, false,
            ValidationMode.PRODUCTION, false, 1.5, 20, 5, 10, Duration.ofMinutes(5), false, null));
        assertThrows(IllegalArgumentException.class, () -> new FeatureFlagSet(true, true, false,
            ValidationMode.PRODUCTION, false, 0.05, 0, 5, 10, Duration.ofMinutes(5), false, null));
        assertThrows(IllegalArgumentException.class, () -> new FeatureFlagSet(true, true, false,
            ValidationMode.PRODUCTION, false, 0.05, 20, 5, 10, Duration.ZERO, false, null));
        assertThrows(IllegalArgumentException.class, () -> new FeatureFlagSet(true, true, false,
            null, false, 0.05, 20, 5, 10, Duration.ofMinutes(5), false, null));
    }

    @Test
    void testValidationModeParse() {
        assertEquals(ValidationMode.DEVELOPMENT, ValidationMode.parse(" Development "));
        assertEquals(ValidationMode.PRODUCTION, ValidationMode.parse("production"));
        assertThrows(IllegalArgumentException.class, () -> ValidationMode.parse("staging"));
    }
}
