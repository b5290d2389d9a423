package in.annupaper.marketfeed.bootstrap;

import in.annupaper.marketfeed.service.broadcast.FeatureFlagSet;
import in.annupaper.marketfeed.service.cache.CacheConfig;
import in.annupaper.marketfeed.service.recovery.RecoveryConfig;
import in.annupaper.marketfeed.service.stream.SupervisorConfig;

/**
 * Every configuration block, validated together before anything starts.
 */
public record StartupConfig(
    int port,
    String gatewayToken,
    SupervisorConfig supervisor,
    RecoveryConfig recovery,
    FeatureFlagSet flags,
    CacheConfig cache
) {}
