package in.annupaper.marketfeed.bootstrap;

import in.annupaper.marketfeed.service.broadcast.ConfigConflictException;
import in.annupaper.marketfeed.service.broadcast.FeatureFlagSet;
import in.annupaper.marketfeed.service.broadcast.ValidationMode;
import in.annupaper.marketfeed.service.cache.CacheConfig;
import in.annupaper.marketfeed.service.recovery.RecoveryConfig;
import in.annupaper.marketfeed.service.stream.SupervisorConfig;
import in.annupaper.marketfeed.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Startup configuration validator.
 *
 * Loads every configuration block from the environment and refuses to start on the first
 * pass that finds a problem. All problems are reported together.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if any block is invalid
     * @throws ConfigConflictException if mutually exclusive feature flags are both enabled
     */
    public static StartupConfig validate() {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> errors = new ArrayList<>();
        int port = Env.getInt("PORT", 9090);
        if (port < 1 || port > 65535) {
            errors.add("PORT must be between 1 and 65535, got " + port);
        }

        SupervisorConfig supervisor = load("Stream supervisor", SupervisorConfig::fromEnv, errors);
        RecoveryConfig recovery = load("Recovery", RecoveryConfig::fromEnv, errors);
        CacheConfig cache = load("Cache", CacheConfig::fromEnv, errors);
        FeatureFlagSet flags = load("Feature flags", FeatureFlagSet::fromEnv, errors);
        String gatewayToken = Env.get("GATEWAY_TOKEN", "");

        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("❌ INVALID CONFIG: system refuses to start\n");
            for (String error : errors) {
                sb.append("  - ").append(error).append('\n');
            }
            throw new IllegalStateException(sb.toString());
        }

        // Conflicts carry their own exception type so operators see every clashing pair
        flags.validate();
        log.info("✓ Feature flags: {}", flags.describe());
        if (flags.validationMode() == ValidationMode.DEVELOPMENT) {
            log.warn("⚠️  Development validation mode: runtime flag updates are allowed");
        }
        if (flags.validationMode() == ValidationMode.PRODUCTION && gatewayToken.isBlank()) {
            log.warn("⚠️  Production validation mode without GATEWAY_TOKEN - /ticks accepts anyone");
        }
        if (cache.redisUri().isBlank()) {
            log.warn("⚠️  REDIS_URI not set - warm tier is in-memory and lost on restart");
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
        return new StartupConfig(port, gatewayToken, supervisor, recovery, flags, cache);
    }

    private static <T> T load(String name, Supplier<T> loader, List<String> errors) {
        try {
            T value = loader.get();
            log.info("✓ {} config loaded", name);
            return value;
        } catch (IllegalArgumentException e) {
            errors.add(name + ": " + e.getMessage());
            return null;
        }
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
