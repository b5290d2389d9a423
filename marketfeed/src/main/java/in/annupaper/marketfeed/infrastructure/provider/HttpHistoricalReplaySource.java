package in.annupaper.marketfeed.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.annupaper.marketfeed.domain.data.ConnectionKey;
import in.annupaper.marketfeed.domain.data.Tick;
import in.annupaper.marketfeed.service.recovery.HistoricalReplaySource;
import in.annupaper.marketfeed.service.recovery.RecoveryUnavailableException;
import in.annupaper.marketfeed.service.recovery.RecoveryWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Replays ticks from a provider's REST history endpoint.
 *
 * GET {baseUrl}/history?provider=P1&capability=quote-stream&symbols=A,B&from=ms&to=ms
 * returning a JSON array of tick objects in the same shape as the live stream.
 */
public class HttpHistoricalReplaySource implements HistoricalReplaySource {
    private static final Logger log = LoggerFactory.getLogger(HttpHistoricalReplaySource.class);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final Duration requestTimeout;

    public HttpHistoricalReplaySource(String baseUrl, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(requestTimeout).build(), new ObjectMapper(), baseUrl, requestTimeout);
    }

    public HttpHistoricalReplaySource(HttpClient httpClient, ObjectMapper mapper, String baseUrl, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public List<Tick> replay(ConnectionKey key, Set<String> symbols, RecoveryWindow window) {
        URI uri = URI.create(baseUrl + "/history"
            + "?provider=" + encode(key.providerId())
            + "&capability=" + encode(key.capabilityId())
            + "&symbols=" + encode(String.join(",", symbols))
            + "&from=" + window.fromMillis()
            + "&to=" + window.toMillis());

        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RecoveryUnavailableException("[" + key + "] History endpoint unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecoveryUnavailableException("[" + key + "] Interrupted during history request", e);
        }

        if (response.statusCode() >= 500) {
            throw new RecoveryUnavailableException("[" + key + "] History endpoint HTTP " + response.statusCode());
        }
        if (response.statusCode() != 200) {
            throw new TransportException(key, "History request rejected with HTTP " + response.statusCode());
        }

        try {
            JsonNode root = mapper.readTree(response.body());
            if (!root.isArray()) {
                throw new TransportException(key, "History response is not a JSON array");
            }
            List<Tick> ticks = new ArrayList<>(root.size());
            for (JsonNode node : root) {
                ticks.add(WebSocketProviderTransport.parseTick(node));
            }
            log.debug("[{}] Replayed {} ticks for {} symbols", key, ticks.size(), symbols.size());
            return ticks;
        } catch (IOException | NumberFormatException e) {
            throw new TransportException(key, "Malformed history response: " + e.getMessage(), e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
