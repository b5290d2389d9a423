package in.annupaper.marketfeed.feedrelay;

import in.annupaper.marketfeed.domain.data.Tick;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * JSON frames of the tick gateway socket.
 */
public final class TickJsonMapper {
    private TickJsonMapper() {}

    public static String toJson(Tick t) {
        JSONObject o = new JSONObject();
        o.put("type", "tick");
        o.put("symbol", t.symbol());
        o.put("timestamp", t.timestamp());

        putDecimal(o, "lastPrice", t.lastPrice());
        putDecimal(o, "open", t.open());
        putDecimal(o, "high", t.high());
        putDecimal(o, "low", t.low());
        putDecimal(o, "close", t.close());
        o.put("volume", t.volume());
        putDecimal(o, "bid", t.bid());
        putDecimal(o, "ask", t.ask());

        if (t.hasSequence()) {
            o.put("sequence", t.sequence());
        }
        return o.toString();
    }

    /**
     * Client control frame: {@code {"action":"subscribe","symbols":["AAPL","00700.HK"]}}.
     *
     * @throws IllegalArgumentException if the frame is not a valid control message
     */
    public static ClientCommand parseCommand(String text) {
        try {
            JSONObject o = new JSONObject(text);
            String action = o.getString("action");
            JSONArray arr = o.optJSONArray("symbols");
            Set<String> symbols = new LinkedHashSet<>();
            if (arr != null) {
                for (int i = 0; i < arr.length(); i++) {
                    String s = arr.optString(i, "").trim();
                    if (!s.isEmpty()) {
                        symbols.add(s);
                    }
                }
            }
            return switch (action) {
                case "subscribe" -> new ClientCommand(true, symbols);
                case "unsubscribe" -> new ClientCommand(false, symbols);
                default -> throw new IllegalArgumentException("Unknown action: " + action);
            };
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed control frame: " + e.getMessage(), e);
        }
    }

    public static String error(String message) {
        return new JSONObject().put("type", "error").put("message", message).toString();
    }

    private static void putDecimal(JSONObject o, String key, BigDecimal v) {
        if (v == null) return;
        o.put(key, v.toPlainString());
    }

    public record ClientCommand(boolean subscribe, Set<String> symbols) {}
}
