package in.annupaper.marketfeed.feedrelay;

import in.annupaper.marketfeed.domain.data.Tick;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TickJsonMapperTest {

    @Test
    void testTickFrame() {
        JSONObject frame = new JSONObject(TickJsonMapper.toJson(
            Tick.of("0700.HK", new BigDecimal("312.40"), 1_709_546_400_000L, 42)));

        assertEquals("tick", frame.getString("type"));
        assertEquals("0700.HK", frame.getString("symbol"));
        assertEquals("312.40", frame.getString("lastPrice"));
        assertEquals(42, frame.getLong("sequence"));
        assertFalse(frame.has("bid"), "Absent prices are omitted");
    }

    @Test
    void testUnsequencedTickHasNoSequence() {
        JSONObject frame = new JSONObject(TickJsonMapper.toJson(Tick.of("AAPL", BigDecimal.TEN, 1L)));

        assertFalse(frame.has("sequence"));
    }

    @Test
    void testParseCommands() {
        TickJsonMapper.ClientCommand sub = TickJsonMapper.parseCommand(
            "{\"action\":\"subscribe\",\"symbols\":[\"AAPL\",\" \",\"0700.HK\",\"AAPL\"]}");
        assertTrue(sub.subscribe());
        assertEquals(Set.of("AAPL", "0700.HK"), sub.symbols());

        TickJsonMapper.ClientCommand unsub = TickJsonMapper.parseCommand("{\"action\":\"unsubscribe\"}");
        assertFalse(unsub.subscribe());
        assertTrue(unsub.symbols().isEmpty());
    }

    @Test
    void testRejectsBadCommands() {
        assertThrows(IllegalArgumentException.class, () -> TickJsonMapper.parseCommand("{\"action\":\"replay\"}"));
        assertThrows(IllegalArgumentException.class, () -> TickJsonMapper.parseCommand("not json"));
        assertThrows(IllegalArgumentException.class, () -> TickJsonMapper.parseCommand("{\"symbols\":[]}"));
    }

    @Test
    void testErrorFrame() {
        JSONObject frame = new JSONObject(TickJsonMapper.error("unauthorized"));

        assertEquals("error", frame.getString("type"));
        assertEquals("unauthorized", frame.getString("message"));
    }
}
