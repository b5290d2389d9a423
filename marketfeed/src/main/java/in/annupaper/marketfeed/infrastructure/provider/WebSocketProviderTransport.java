package in.annupaper.marketfeed.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * {@link ProviderTransport} over {@code java.net.http.WebSocket} speaking a small JSON protocol.
 *
 * Outbound:
 * <pre>
 * {"action":"subscribe","capability":"quote","symbols":["AAPL"]}
 * {"action":"unsubscribe","capability":"quote","symbols":["AAPL"]}
 * {"action":"ping"}
 * </pre>
 * Inbound:
 * <pre>
 * {"type":"tick","symbol":"AAPL","price":"189.20","ts":1700000000000,"seq":42}
 * {"type":"pong"}
 * {"type":"error","code":"AUTH","message":"token revoked"}
 * </pre>
 * Handshake status 401/403 is reported as {@link ProviderAuthException}; everything else
 * as {@link TransportException}.
 */
public class WebSocketProviderTransport implements ProviderTransport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketProviderTransport.class);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Function<ConnectionKey, URI> endpoints;
    private final Function<String, String> tokens;
    private final Duration connectTimeout;

    /**
     * @param endpoints resolves the websocket URI for a provider capability
     * @param tokens resolves the bearer token for a provider, or null for none
     */
    public WebSocketProviderTransport(Function<ConnectionKey, URI> endpoints,
                                      Function<String, String> tokens,
                                      Duration connectTimeout) {
        this(HttpClient.newBuilder().connectTimeout(connectTimeout).build(),
            new ObjectMapper(), endpoints, tokens, connectTimeout);
    }

    public WebSocketProviderTransport(HttpClient httpClient, ObjectMapper mapper,
                                      Function<ConnectionKey, URI> endpoints,
                                      Function<String, String> tokens,
                                      Duration connectTimeout) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.endpoints = endpoints;
        this.tokens = tokens;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public CompletableFuture<TransportSession> connect(ConnectionKey key, TransportListener listener) {
        URI uri = endpoints.apply(key);
        log.info("[{}] Opening websocket to {}", key, uri);

        WebSocket.Builder builder = httpClient.newWebSocketBuilder().connectTimeout(connectTimeout);
        String token = tokens.apply(key.providerId());
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }

        return builder.buildAsync(uri, new FrameListener(key, listener))
            .handle((ws, error) -> {
                if (error != null) {
                    throw classify(key, error);
                }
                return (TransportSession) new Session(key, ws);
            });
    }

    /**
     * Map a handshake failure onto the error taxonomy.
     */
    static RuntimeException classify(ConnectionKey key, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof WebSocketHandshakeException) {
            HttpResponse<?> response = ((WebSocketHandshakeException) cause).getResponse();
            int status = response != null ? response.statusCode() : -1;
            if (status == 401 || status == 403) {
                return new ProviderAuthException(key, "Handshake rejected with HTTP " + status, cause);
            }
            return new TransportException(key, "Handshake failed with HTTP " + status, cause);
        }
        if (cause instanceof ProviderAuthException || cause instanceof TransportException) {
            return (RuntimeException) cause;
        }
        return new TransportException(key, "Connect failed: " + cause, cause);
    }

    static Tick parseTick(JsonNode node) {
        long seq = node.hasNonNull("seq") ? node.get("seq").asLong() : Tick.NO_SEQUENCE;
        return new Tick(
            node.path("symbol").asText(),
            decimal(node, "price"),
            decimal(node, "open"),
            decimal(node, "high"),
            decimal(node, "low"),
            decimal(node, "close"),
            node.path("volume").asLong(0L),
            decimal(node, "bid"),
            decimal(node, "ask"),
            node.path("ts").asLong(System.currentTimeMillis()),
            seq
        );
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        return new BigDecimal(v.asText());
    }

    private final class FrameListener implements WebSocket.Listener {
        private final ConnectionKey key;
        private final TransportListener listener;
        private final StringBuilder messageBuffer = new StringBuilder();

        FrameListener(ConnectionKey key, TransportListener listener) {
            this.key = key;
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            log.info("[{}] Websocket handshake successful", key);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            messageBuffer.append(data);
            if (last) {
                String message = messageBuffer.toString();
                messageBuffer.setLength(0);
                dispatch(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.error("[{}] Websocket error: {}", key, error.getMessage());
            listener.onError(new TransportException(key, "Websocket error: " + error.getMessage(), error));
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.info("[{}] Websocket closed: {} - {}", key, statusCode, reason);
            listener.onClosed(statusCode, reason);
            return null;
        }

        private void dispatch(String message) {
            JsonNode node;
            try {
                node = mapper.readTree(message);
            } catch (Exception e) {
                listener.onError(new TransportException(key, "Unparseable frame: " + e.getMessage(), e));
                return;
            }

            String type = node.path("type").asText("");
            switch (type) {
                case "tick" -> listener.onTick(parseTick(node));
                case "pong", "heartbeat" -> listener.onHeartbeat();
                case "error" -> {
                    String code = node.path("code").asText("");
                    String text = node.path("message").asText("provider error");
                    if ("AUTH".equals(code)) {
                        listener.onError(new ProviderAuthException(key, text));
                    } else {
                        listener.onError(new TransportException(key, text));
                    }
                }
                default -> listener.onError(new TransportException(key, "Unexpected frame type '" + type + "'"));
            }
        }
    }

    private final class Session implements TransportSession {
        private final ConnectionKey key;
        private final WebSocket ws;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        Session(ConnectionKey key, WebSocket ws) {
            this.key = key;
            this.ws = ws;
        }

        @Override
        public void subscribe(Set<String> symbols) {
            send(symbolMessage("subscribe", symbols));
        }

        @Override
        public void unsubscribe(Set<String> symbols) {
            send(symbolMessage("unsubscribe", symbols));
        }

        @Override
        public void sendHeartbeat() {
            send(mapper.createObjectNode().put("action", "ping").toString());
        }

        @Override
        public boolean isOpen() {
            return !closed.get() && !ws.isOutputClosed() && !ws.isInputClosed();
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "Closing");
            }
        }

        private String symbolMessage(String action, Set<String> symbols) {
            ObjectNode msg = mapper.createObjectNode();
            msg.put("action", action);
            msg.put("capability", key.capabilityId());
            ArrayNode arr = msg.putArray("symbols");
            symbols.forEach(arr::add);
            return msg.toString();
        }

        private void send(String json) {
            if (!isOpen()) {
                throw new TransportException(key, "Send on closed session");
            }
            ws.sendText(json, true).join();
        }
    }
}
