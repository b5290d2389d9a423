package in.annupaper.marketfeed.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;
import in.annupaper.marketfeed.feedrelay.TickGatewayServer;
import in.annupaper.marketfeed.infrastructure.cache.InMemoryWarmStore;
import in.annupaper.marketfeed.infrastructure.cache.RedisWarmStore;
import in.annupaper.marketfeed.infrastructure.cache.WarmStore;
import in.annupaper.marketfeed.infrastructure.metrics.PrometheusMetricsHandler;
import in.annupaper.marketfeed.infrastructure.metrics.PrometheusStreamMetrics;
import in.annupaper.marketfeed.infrastructure.provider.HttpHistoricalReplaySource;
import in.annupaper.marketfeed.infrastructure.provider.WebSocketProviderTransport;
import in.annupaper.marketfeed.service.broadcast.BroadcastRouter;
import in.annupaper.marketfeed.service.broadcast.ConsumerRegistry;
import in.annupaper.marketfeed.service.broadcast.DeliveryMode;
import in.annupaper.marketfeed.service.broadcast.RouterHealth;
import in.annupaper.marketfeed.service.broadcast.TickConsumer;
import in.annupaper.marketfeed.service.cache.CacheStats;
import in.annupaper.marketfeed.service.cache.CacheTierManager;
import in.annupaper.marketfeed.service.cache.PayloadCodec;
import in.annupaper.marketfeed.service.cache.SmartCacheOrchestrator;
import in.annupaper.marketfeed.service.market.MarketSessionClock;
import in.annupaper.marketfeed.service.ratelimit.RateLimitConfig;
import in.annupaper.marketfeed.service.ratelimit.RateLimiter;
import in.annupaper.marketfeed.service.recovery.BatchHealthChecker;
import in.annupaper.marketfeed.service.recovery.HistoricalReplaySource;
import in.annupaper.marketfeed.service.recovery.RecoveryBatch;
import in.annupaper.marketfeed.service.recovery.RecoveryListener;
import in.annupaper.marketfeed.service.recovery.RecoveryNotice;
import in.annupaper.marketfeed.service.recovery.RecoveryUnavailableException;
import in.annupaper.marketfeed.service.recovery.RecoveryWorker;
import in.annupaper.marketfeed.service.stream.ConnectionSupervisor;
import in.annupaper.marketfeed.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Market feed entry point (no framework).
 *
 * Upstream provider streams feed the connection supervisor; ticks fan out through the
 * broadcast router to local consumers and the /ticks websocket gateway. Gaps are refilled
 * by the recovery worker. The smart cache serves request/response market data.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final String GATEWAY_CONSUMER = "gateway";

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Market Feed Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        StartupConfig config = StartupConfigValidator.validate();
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusStreamMetrics metrics = new PrometheusStreamMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Streaming fetcher
        // ═══════════════════════════════════════════════════════════════
        RateLimiter rateLimiter = new RateLimiter(RateLimitConfig::fromEnv, metrics);

        WebSocketProviderTransport transport = new WebSocketProviderTransport(
            App::providerEndpoint,
            providerId -> Env.get("PROVIDER_" + envName(providerId) + "_TOKEN", null),
            config.supervisor().connectTimeout());
        ConnectionSupervisor supervisor = new ConnectionSupervisor(transport, rateLimiter, config.supervisor(), metrics);
        log.info("✓ Connection supervisor ready (heartbeat {} ms, grace {} ms)",
            config.supervisor().heartbeatInterval().toMillis(), config.supervisor().gracePeriod().toMillis());

        // ═══════════════════════════════════════════════════════════════
        // Broadcast router + gateway
        // ═══════════════════════════════════════════════════════════════
        TickGatewayServer gateway = new TickGatewayServer(config.gatewayToken());
        ConsumerRegistry registry = new ConsumerRegistry();
        BroadcastRouter router = new BroadcastRouter(config.flags(), supervisor, registry, gateway, metrics, clock);
        gateway.onDisconnect((disconnected, total) ->
            router.rollbackMonitor().recordClientDisconnections(disconnected, total));
        router.start();
        supervisor.addTickListener(router);
        log.info("✓ Broadcast router started in {} mode", router.mode());

        // ═══════════════════════════════════════════════════════════════
        // Gap recovery
        // ═══════════════════════════════════════════════════════════════
        BatchHealthChecker healthChecker = new BatchHealthChecker(
            supervisor, config.recovery(), config.supervisor().heartbeatInterval(), metrics, clock);
        RecoveryWorker recoveryWorker = new RecoveryWorker(
            config.recovery(), createReplaySource(), rateLimiter, healthChecker, metrics, clock);
        recoveryWorker.addListener(new RecoveryListener() {
            @Override
            public void onBatch(RecoveryBatch batch) {
                TickConsumer consumer = registry.get(batch.consumerId());
                if (consumer == null) {
                    return;
                }
                for (Tick tick : batch.ticks()) {
                    consumer.onTick(batch.key(), tick);
                }
            }

            @Override
            public void onFailed(RecoveryNotice notice) {
                log.warn("[RECOVERY] {} failed for {}: {}", notice.jobId(), notice.key(), notice.failureReason());
            }
        });
        supervisor.addConnectionListener(recoveryWorker);
        recoveryWorker.start();
        log.info("✓ Recovery worker started");

        // ═══════════════════════════════════════════════════════════════
        // Smart cache
        // ═══════════════════════════════════════════════════════════════
        MarketSessionClock sessions = new MarketSessionClock(clock);
        WarmStore warmStore = config.cache().redisUri().isBlank()
            ? new InMemoryWarmStore(clock)
            : new RedisWarmStore(config.cache().redisUri());
        CacheTierManager cacheTiers = new CacheTierManager(config.cache(), warmStore, new PayloadCodec(), metrics, clock);
        SmartCacheOrchestrator cache = new SmartCacheOrchestrator(cacheTiers, sessions, config.cache(), metrics, clock);
        log.info("✓ Smart cache ready (warm tier: {})", warmStore.getClass().getSimpleName());

        // ═══════════════════════════════════════════════════════════════
        // Startup subscriptions for the gateway
        // ═══════════════════════════════════════════════════════════════
        router.registerConsumer(new TickConsumer() {
            @Override
            public String id() {
                return GATEWAY_CONSUMER;
            }

            @Override
            public void onTick(ConnectionKey source, Tick tick) {
                // Gateway mode already publishes every tick to the bus
                if (router.mode() == DeliveryMode.LEGACY) {
                    gateway.publish(tick);
                }
            }
        });
        subscribeStartupSymbols(supervisor);

        // ═══════════════════════════════════════════════════════════════
        // HTTP server
        // ═══════════════════════════════════════════════════════════════
        ObjectMapper mapper = new ObjectMapper();
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/ticks", gateway.handler())
            .get("/health", exchange -> {
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                exchange.getResponseSender().send(healthJson(mapper, router, supervisor, cache, recoveryWorker));
            });

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ HTTP server listening on :{} (/metrics, /health, /ticks)", config.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("=== Market Feed shutting down ===");
            server.stop();
            cache.shutdown(Duration.ofSeconds(5));
            try {
                warmStore.close();
            } catch (Exception e) {
                log.warn("Warm store close failed: {}", e.getMessage());
            }
            recoveryWorker.stop();
            supervisor.stop();
            gateway.stop();
            log.info("=== Market Feed stopped ===");
        }, "ShutdownHook"));
    }

    /**
     * STREAM_SUBSCRIPTIONS: "P1:quote-stream=AAPL,MSFT;P2:depth=0700.HK".
     */
    private static void subscribeStartupSymbols(ConnectionSupervisor supervisor) {
        String subscriptions = Env.get("STREAM_SUBSCRIPTIONS", "");
        if (subscriptions.isBlank()) {
            log.info("No STREAM_SUBSCRIPTIONS configured - waiting for consumers");
            return;
        }
        for (String part : subscriptions.split(";")) {
            String[] sides = part.trim().split("=", 2);
            String[] key = sides[0].trim().split(":", 2);
            if (sides.length != 2 || key.length != 2) {
                log.warn("Ignoring malformed subscription '{}'", part);
                continue;
            }
            List<String> symbols = Arrays.stream(sides[1].split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
            try {
                supervisor.subscribe(GATEWAY_CONSUMER, ConnectionKey.of(key[0].trim(), key[1].trim()), symbols);
                log.info("✓ Subscribed {} symbols on {}:{}", symbols.size(), key[0].trim(), key[1].trim());
            } catch (RuntimeException e) {
                log.error("Startup subscription '{}' failed: {}", part, e.getMessage(), e);
            }
        }
    }

    private static URI providerEndpoint(ConnectionKey key) {
        String base = Env.get("PROVIDER_" + envName(key.providerId()) + "_WS_URL", null);
        if (base == null) {
            throw new IllegalStateException("PROVIDER_" + envName(key.providerId()) + "_WS_URL is not set");
        }
        return URI.create(base.endsWith("/") ? base + key.capabilityId() : base + "/" + key.capabilityId());
    }

    private static HistoricalReplaySource createReplaySource() {
        String url = Env.get("RECOVERY_REPLAY_URL", "");
        if (url.isBlank()) {
            log.warn("⚠️  RECOVERY_REPLAY_URL not set - gaps are reported but not refilled");
            return (key, symbols, window) -> {
                throw new RecoveryUnavailableException("[" + key + "] No replay source configured");
            };
        }
        return new HttpHistoricalReplaySource(url, Env.getDuration("RECOVERY_REPLAY_TIMEOUT_MS", Duration.ofSeconds(10)));
    }

    private static String healthJson(ObjectMapper mapper, BroadcastRouter router, ConnectionSupervisor supervisor,
                                     SmartCacheOrchestrator cache, RecoveryWorker recoveryWorker) {
        RouterHealth health = router.health();
        CacheStats stats = cache.stats();
        ObjectNode root = mapper.createObjectNode();
        root.put("status", health.status());
        root.put("mode", health.mode().name());
        root.put("delivered", health.delivered());
        root.put("dropped", health.dropped());
        root.put("gatewayErrorRate", health.gatewayErrorRate());
        root.put("legacyRemovalReady", health.readiness().ready());
        root.put("connections", supervisor.activeConnections().size());
        root.put("recoveryQueue", recoveryWorker.queueSize());
        root.put("cacheHitRate", stats.hitRate());
        root.put("cacheHotSize", stats.hotSize());
        root.putPOJO("recommendations", health.recommendations());
        return root.toString();
    }

    private static String envName(String providerId) {
        return providerId.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
    }

    private App() {}
}
