package in.annupaper.marketfeed.feedrelay;

import in.annupaper.marketfeed.domain.data.Tick;
import in.annupaper.marketfeed.service.broadcast.BroadcastBus;
import io.undertow.server.HttpHandler;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * Websocket gateway for remote tick clients, mounted at {@code /ticks}.
 *
 * Clients pick symbols with subscribe/unsubscribe control frames and receive ticks for
 * those symbols whichever upstream connection produced them.
 */
public final class TickGatewayServer implements BroadcastBus {
    private static final Logger log = LoggerFactory.getLogger(TickGatewayServer.class);

    private final Map<WebSocketChannel, Set<String>> clients = new ConcurrentHashMap<>();
    private final String token;
    private BiConsumer<Integer, Integer> disconnectListener = (disconnected, total) -> {};

    /**
     * @param token shared secret expected as {@code ?token=}; empty allows everyone
     */
    public TickGatewayServer(String token) {
        this.token = token == null ? "" : token.trim();
    }

    /**
     * Called with (disconnected, clients before the disconnect) whenever a client drops.
     */
    public void onDisconnect(BiConsumer<Integer, Integer> listener) {
        this.disconnectListener = listener;
    }

    public HttpHandler handler() {
        if (!token.isEmpty()) {
            log.info("[GATEWAY] Token authentication ENABLED");
        } else {
            log.warn("[GATEWAY] Token authentication DISABLED - set GATEWAY_TOKEN for production");
        }

        WebSocketConnectionCallback cb = (exchange, channel) -> {
            if (!isAuthorized(exchange)) {
                log.warn("[GATEWAY] Unauthorized connection attempt from {}", exchange.getRequestHeader("X-Forwarded-For"));
                try {
                    channel.sendClose();
                } catch (IOException e) {
                    log.warn("[GATEWAY] Failed to close unauthorized connection: {}", e.getMessage());
                }
                return;
            }

            clients.put(channel, ConcurrentHashMap.newKeySet());
            channel.getCloseSetter().set(c -> clientClosed(channel));
            channel.getReceiveSetter().set(new AbstractReceiveListener() {
                @Override
                protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                    handleControl(ch, message.getData());
                }
            });
            channel.resumeReceives();
            log.info("[GATEWAY] Client connected (total: {})", clients.size());
        };
        return new WebSocketProtocolHandshakeHandler(cb);
    }

    void handleControl(WebSocketChannel channel, String text) {
        Set<String> symbols = clients.get(channel);
        if (symbols == null) {
            return;
        }
        try {
            TickJsonMapper.ClientCommand cmd = TickJsonMapper.parseCommand(text);
            if (cmd.subscribe()) {
                symbols.addAll(cmd.symbols());
            } else {
                symbols.removeAll(cmd.symbols());
            }
            log.debug("[GATEWAY] Client now follows {} symbols", symbols.size());
        } catch (IllegalArgumentException e) {
            WebSockets.sendText(TickJsonMapper.error(e.getMessage()), channel, null);
        }
    }

    private void clientClosed(WebSocketChannel channel) {
        int before = clients.size();
        if (clients.remove(channel) != null) {
            log.info("[GATEWAY] Client disconnected (remaining: {})", clients.size());
            disconnectListener.accept(1, before);
        }
    }

    @Override
    public int publish(Tick tick) {
        String json = null;
        int sent = 0;
        for (Map.Entry<WebSocketChannel, Set<String>> e : clients.entrySet()) {
            WebSocketChannel ch = e.getKey();
            if (!ch.isOpen() || !e.getValue().contains(tick.symbol())) {
                continue;
            }
            if (json == null) {
                json = TickJsonMapper.toJson(tick);
            }
            WebSockets.sendText(json, ch, null);
            sent++;
        }
        return sent;
    }

    public int clientCount() {
        return clients.size();
    }

    public void stop() {
        for (WebSocketChannel ch : clients.keySet()) {
            try {
                ch.sendClose();
            } catch (IOException e) {
                log.debug("[GATEWAY] Close failed: {}", e.getMessage());
            }
        }
        clients.clear();
    }

    /**
     * Example: /ticks?token=abc&amp;foo=bar gives {token: abc, foo: bar}
     */
    static Map<String, String> parseQuery(String uri) {
        int idx = uri.indexOf('?');
        Map<String, String> m = new HashMap<>();
        if (idx < 0 || idx == uri.length() - 1) return m;

        for (String part : uri.substring(idx + 1).split("&")) {
            if (part.isBlank()) continue;
            String[] kv = part.split("=", 2);
            String k = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            String v = kv.length > 1 ? URLDecoder.decode(kv[1], StandardCharsets.UTF_8) : "";
            m.put(k, v);
        }
        return m;
    }

    private boolean isAuthorized(WebSocketHttpExchange exchange) {
        if (token.isEmpty()) {
            return true;
        }
        return token.equals(parseQuery(exchange.getRequestURI()).getOrDefault("token", ""));
    }
}
