package in.annupaper.marketfeed.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Jackson serialization and GZIP for cache payloads, plus the warm-tier envelope.
 */
public final class PayloadCodec {

    private final ObjectMapper mapper;

    public PayloadCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public PayloadCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] serialize(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value of type " + value.getClass().getName() + " is not serializable", e);
        }
    }

    public <T> T deserialize(CacheEntry entry, Class<T> type) {
        byte[] raw = entry.compressed() ? gunzip(entry.payload()) : entry.payload();
        try {
            return mapper.readValue(raw, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read cached " + entry.key() + " as " + type.getSimpleName(), e);
        }
    }

    public static byte[] gzip(byte[] raw) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(raw.length / 2 + 16);
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(raw);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    public static byte[] gunzip(byte[] compressed) {
        try (GZIPInputStream gz = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return gz.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    String toEnvelope(CacheEntry entry) {
        try {
            return mapper.writeValueAsString(new Envelope(entry.payload(), entry.storedAtMillis(), entry.ttlSeconds(),
                entry.compressed(), entry.sizeBytes()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Envelope serialization failed for " + entry.key(), e);
        }
    }

    CacheEntry fromEnvelope(String key, String json) {
        try {
            Envelope e = mapper.readValue(json, Envelope.class);
            return new CacheEntry(key, e.payload(), e.storedAt(), e.ttl(), CacheTier.WARM, e.compressed(), e.size());
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Corrupt warm-tier envelope for " + key, ex);
        }
    }

    /** byte[] is written as base64 by Jackson. */
    record Envelope(byte[] payload, long storedAt, long ttl, boolean compressed, int size) {}
}
