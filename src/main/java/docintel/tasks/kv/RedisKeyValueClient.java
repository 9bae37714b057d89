package docintel.tasks.kv;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link KeyValueClient} backed by Redis through Spring Data Redis and Lettuce.
 * The connection factory is created standalone, without a Spring context.
 */
public final class RedisKeyValueClient implements KeyValueClient {

    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueClient.class);
    private static final long SCAN_BATCH = 500;

    // KEYS[1] = hash key, ARGV = field1, value1, field2, value2, ...
    private static final RedisScript<Long> REPLACE_IF_EXISTS = new DefaultRedisScript<>(
            "if redis.call('EXISTS', KEYS[1]) == 0 then return 0 end\n"
                    + "redis.call('DEL', KEYS[1])\n"
                    + "redis.call('HSET', KEYS[1], unpack(ARGV))\n"
                    + "return 1",
            Long.class);

    private final LettuceConnectionFactory connectionFactory;
    private final StringRedisTemplate template;
    private final String endpoint;

    /**
     * @param redisUrl {@code redis://[user:password@]host:port[/db]} or {@code rediss://...}
     * @param timeout  connect and command timeout
     * @throws IllegalArgumentException if the URL cannot be parsed
     */
    public RedisKeyValueClient(String redisUrl, Duration timeout) {
        RedisURI uri;
        try {
            uri = RedisURI.create(redisUrl);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid Redis URL", e);
        }
        this.endpoint = uri.getHost() + ":" + uri.getPort() + "/" + uri.getDatabase();

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
        server.setDatabase(uri.getDatabase());
        if (uri.getUsername() != null) {
            server.setUsername(uri.getUsername());
        }
        if (uri.getPassword() != null && uri.getPassword().length > 0) {
            server.setPassword(RedisPassword.of(uri.getPassword()));
        }

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(SocketOptions.builder().connectTimeout(timeout).build())
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .build();

        LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
                .commandTimeout(timeout)
                .clientOptions(clientOptions);
        if (uri.isSsl()) {
            client.useSsl();
        }

        this.connectionFactory = new LettuceConnectionFactory(server, client.build());
        this.connectionFactory.afterPropertiesSet();
        this.connectionFactory.start();
        this.template = new StringRedisTemplate(connectionFactory);

        log.debug("Redis client created for {}", endpoint);
    }

    @Override
    public void ping() {
        String reply = call("PING", () -> template.execute((RedisCallback<String>) RedisConnection::ping));
        if (!"PONG".equalsIgnoreCase(reply)) {
            throw new KeyValueException("Unexpected PING reply from " + endpoint + ": " + reply);
        }
    }

    @Override
    public void putHash(String key, Map<String, String> fields) {
        HashOperations<String, String, String> hashes = template.opsForHash();
        call("HSET " + key, () -> {
            hashes.putAll(key, fields);
            return null;
        });
    }

    @Override
    public boolean replaceHash(String key, Map<String, String> fields) {
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("fields must not be empty");
        }
        Object[] argv = new Object[fields.size() * 2];
        int i = 0;
        for (Map.Entry<String, String> field : fields.entrySet()) {
            argv[i++] = field.getKey();
            argv[i++] = field.getValue();
        }
        Long replaced = call("EVAL replace " + key, () -> template.execute(REPLACE_IF_EXISTS, List.of(key), argv));
        return replaced != null && replaced == 1L;
    }

    @Override
    public Map<String, String> getHash(String key) {
        HashOperations<String, String, String> hashes = template.opsForHash();
        return call("HGETALL " + key, () -> hashes.entries(key));
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(call("GET " + key, () -> template.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("SET " + key, () -> {
            template.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(call("DEL " + key, () -> template.delete(key)));
    }

    @Override
    public List<String> scan(String pattern) {
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
        return call("SCAN " + pattern, () -> {
            List<String> keys = new ArrayList<>();
            try (Cursor<String> cursor = template.scan(options)) {
                cursor.forEachRemaining(keys::add);
            }
            return keys;
        });
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    @Override
    public void close() {
        try {
            connectionFactory.destroy();
            log.debug("Redis client for {} closed", endpoint);
        } catch (RuntimeException e) {
            log.warn("Error closing Redis client for {}: {}", endpoint, e.getMessage());
        }
    }

    private <T> T call(String command, Supplier<T> action) {
        try {
            return action.get();
        } catch (KeyValueException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new KeyValueException(command + " failed on " + endpoint + ": " + e.getMessage(), e);
        }
    }
}
