package in.annupaper.marketfeed.service.broadcast;

import in.annupaper.marketfeed.util.Env;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Delivery feature flags. Immutable; a change means a new instance.
 *
 * @param gatewayOnlyMode deliver through the gateway
 * @param strictMode refuse any legacy path, including fallback and automatic rollback
 * @param allowLegacyFallback serve legacy-only consumers directly while in gateway mode
 * @param operatorAckLegacyRemoval an operator has signed off legacy removal
 * @param gatewayErrorRateThreshold readiness limit for the gateway error rate (fraction)
 * @param clientDisconnectSpikePercent auto-rollback when this percentage of clients drops in one window
 * @param gatewayErrorRollbackPercent auto-rollback when the gateway error rate exceeds this percentage
 * @param emergencyTriggerThreshold warn once more overrides than this happen in one window
 * @param emergencyOverride legacy re-enabled at runtime
 * @param overrideReason why, when {@code emergencyOverride} is set
 */
public record FeatureFlagSet(
    boolean gatewayOnlyMode,
    boolean strictMode,
    boolean allowLegacyFallback,
    ValidationMode validationMode,
    boolean operatorAckLegacyRemoval,
    double gatewayErrorRateThreshold,
    double clientDisconnectSpikePercent,
    double gatewayErrorRollbackPercent,
    int emergencyTriggerThreshold,
    Duration observationWindow,
    boolean emergencyOverride,
    String overrideReason
) {
    public FeatureFlagSet {
        if (validationMode == null) {
            throw new IllegalArgumentException("validationMode is required");
        }
        if (gatewayErrorRateThreshold < 0 || gatewayErrorRateThreshold > 1) {
            throw new IllegalArgumentException("gatewayErrorRateThreshold must be within [0, 1]");
        }
        if (clientDisconnectSpikePercent <= 0 || gatewayErrorRollbackPercent <= 0 || emergencyTriggerThreshold <= 0) {
            throw new IllegalArgumentException("auto-rollback thresholds must be positive");
        }
        if (observationWindow == null || observationWindow.isZero() || observationWindow.isNegative()) {
            throw new IllegalArgumentException("observationWindow must be positive");
        }
    }

    public static FeatureFlagSet defaults() {
        return new FeatureFlagSet(true, true, false, ValidationMode.PRODUCTION, false,
            0.05, 20, 5, 10, Duration.ofMinutes(5), false, null);
    }

    public static FeatureFlagSet fromEnv() {
        FeatureFlagSet d = defaults();
        return new FeatureFlagSet(
            Env.getBool("WS_GATEWAY_ONLY_MODE", d.gatewayOnlyMode()),
            Env.getBool("WS_STRICT_MODE", d.strictMode()),
            Env.getBool("WS_ALLOW_LEGACY_FALLBACK", d.allowLegacyFallback()),
            ValidationMode.parse(Env.get("WS_VALIDATION_MODE", "production")),
            Env.getBool("WS_OPERATOR_ACK_LEGACY_REMOVAL", d.operatorAckLegacyRemoval()),
            Env.getDouble("WS_GATEWAY_ERROR_RATE_THRESHOLD", d.gatewayErrorRateThreshold()),
            Env.getDouble("WS_AUTO_ROLLBACK_CLIENT_DISCONNECT_THRESHOLD", d.clientDisconnectSpikePercent()),
            Env.getDouble("WS_AUTO_ROLLBACK_GATEWAY_ERROR_THRESHOLD", d.gatewayErrorRollbackPercent()),
            Env.getInt("WS_AUTO_ROLLBACK_EMERGENCY_TRIGGER_THRESHOLD", d.emergencyTriggerThreshold()),
            Env.getDuration("WS_OBSERVATION_WINDOW_MS", d.observationWindow()),
            false,
            null
        );
    }

    public DeliveryMode deliveryMode() {
        return gatewayOnlyMode && !emergencyOverride ? DeliveryMode.GATEWAY : DeliveryMode.LEGACY;
    }

    /**
     * Every pair of mutually exclusive flags that is enabled together.
     */
    public List<String> conflicts() {
        List<String> conflicts = new ArrayList<>();
        if (strictMode && allowLegacyFallback) {
            conflicts.add("strictMode=true with allowLegacyFallback=true");
        }
        if (strictMode && emergencyOverride) {
            conflicts.add("strictMode=true with emergencyOverride=true");
        }
        if (emergencyOverride && (overrideReason == null || overrideReason.isBlank())) {
            conflicts.add("emergencyOverride=true without a reason");
        }
        return conflicts;
    }

    /**
     * @throws ConfigConflictException if any mutually exclusive flags are both on
     */
    public FeatureFlagSet validate() {
        List<String> conflicts = conflicts();
        if (!conflicts.isEmpty()) {
            throw new ConfigConflictException(conflicts);
        }
        return this;
    }

    /**
     * Legacy delivery forced back on. Strict mode is lifted so that the set stays valid.
     */
    public FeatureFlagSet withEmergencyOverride(String reason) {
        return new FeatureFlagSet(gatewayOnlyMode, false, true, validationMode, operatorAckLegacyRemoval,
            gatewayErrorRateThreshold, clientDisconnectSpikePercent, gatewayErrorRollbackPercent,
            emergencyTriggerThreshold, observationWindow, true, reason);
    }

    public FeatureFlagSet withGatewayOnlyMode(boolean value) {
        return new FeatureFlagSet(value, strictMode, allowLegacyFallback, validationMode, operatorAckLegacyRemoval,
            gatewayErrorRateThreshold, clientDisconnectSpikePercent, gatewayErrorRollbackPercent,
            emergencyTriggerThreshold, observationWindow, emergencyOverride, overrideReason);
    }

    public FeatureFlagSet withStrictMode(boolean value) {
        return new FeatureFlagSet(gatewayOnlyMode, value, allowLegacyFallback, validationMode, operatorAckLegacyRemoval,
            gatewayErrorRateThreshold, clientDisconnectSpikePercent, gatewayErrorRollbackPercent,
            emergencyTriggerThreshold, observationWindow, emergencyOverride, overrideReason);
    }

    public FeatureFlagSet withAllowLegacyFallback(boolean value) {
        return new FeatureFlagSet(gatewayOnlyMode, strictMode, value, validationMode, operatorAckLegacyRemoval,
            gatewayErrorRateThreshold, clientDisconnectSpikePercent, gatewayErrorRollbackPercent,
            emergencyTriggerThreshold, observationWindow, emergencyOverride, overrideReason);
    }

    public FeatureFlagSet withValidationMode(ValidationMode value) {
        return new FeatureFlagSet(gatewayOnlyMode, strictMode, allowLegacyFallback, value, operatorAckLegacyRemoval,
            gatewayErrorRateThreshold, clientDisconnectSpikePercent, gatewayErrorRollbackPercent,
            emergencyTriggerThreshold, observationWindow, emergencyOverride, overrideReason);
    }

    public FeatureFlagSet withOperatorAck(boolean value) {
        return new FeatureFlagSet(gatewayOnlyMode, strictMode, allowLegacyFallback, validationMode, value,
            gatewayErrorRateThreshold, clientDisconnectSpikePercent, gatewayErrorRollbackPercent,
            emergencyTriggerThreshold, observationWindow, emergencyOverride, overrideReason);
    }

    public String describe() {
        return "mode=" + deliveryMode()
            + " gatewayOnly=" + gatewayOnlyMode
            + " strict=" + strictMode
            + " legacyFallback=" + allowLegacyFallback
            + " validation=" + validationMode
            + " override=" + emergencyOverride;
    }
}
