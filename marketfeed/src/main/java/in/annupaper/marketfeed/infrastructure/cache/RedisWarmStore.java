package in.annupaper.marketfeed.infrastructure.cache;

import io.lettuce.core.KeyScanCursor;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScanCursor;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Warm store on Redis through Lettuce. Prefix enumeration uses {@code SCAN MATCH prefix*}
 * so the server is never blocked by KEYS.
 */
public class RedisWarmStore implements WarmStore {
    private static final Logger log = LoggerFactory.getLogger(RedisWarmStore.class);
    private static final int SCAN_COUNT = 500;

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisCommands<String, String> commands;

    public RedisWarmStore(String uri) {
        RedisURI redisUri = RedisURI.create(uri);
        this.client = RedisClient.create(redisUri);
        this.connection = client.connect();
        this.commands = connection.sync();
        log.info("[CACHE] Warm tier connected to Redis {}:{}", redisUri.getHost(), redisUri.getPort());
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        commands.psetex(key, Math.max(1, ttl.toMillis()), value);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(commands.get(key));
    }

    @Override
    public List<String> scanKeys(String prefix) {
        List<String> keys = new ArrayList<>();
        ScanArgs args = ScanArgs.Builder.matches(escapeGlob(prefix) + "*").limit(SCAN_COUNT);
        ScanCursor cursor = ScanCursor.INITIAL;
        do {
            KeyScanCursor<String> page = commands.scan(cursor, args);
            keys.addAll(page.getKeys());
            cursor = page;
        } while (!cursor.isFinished());
        return keys;
    }

    @Override
    public boolean delete(String key) {
        return commands.del(key) > 0;
    }

    @Override
    public int deleteAll(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        return commands.del(keys.toArray(new String[0])).intValue();
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
    }

    static String escapeGlob(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
