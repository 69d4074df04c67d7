package com.example.chatorchestrator.kv;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;

/**
 * Redis-backed mirrors. All keys live under a configurable namespace and expire through
 * Redis key TTLs.
 */
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo", matchIfMissing = true)
public class RedisKvClient implements KvClient {

    private final StringRedisTemplate redis;
    private final String namespace;

    public RedisKvClient(StringRedisTemplate redis, @Value("${app.kv.namespace:chat:}") String namespace) {
        this.redis = redis;
        this.namespace = namespace;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(namespace + key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redis.opsForValue().set(namespace + key, value);
        } else {
            redis.opsForValue().set(namespace + key, value, ttl);
        }
    }

    @Override
    public void del(String... keys) {
        if (keys.length == 0) return;
        redis.delete(Arrays.stream(keys).map(k -> namespace + k).collect(Collectors.toList()));
    }

    @Override
    public Map<String, Long> ttlMillis(String prefix, int limit) {
        Map<String, Long> out = new LinkedHashMap<>();
        for (String key : scan(namespace + prefix, limit)) {
            Long millis = redis.getExpire(key, TimeUnit.MILLISECONDS);
            out.put(key.substring(namespace.length()), millis == null || millis < 0 ? -1L : millis);
        }
        return out;
    }

    private List<String> scan(String pattern, int limit) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(pattern + "*")
                .count(Math.max(limit, 100)).build();
        try (RedisConnection conn = Objects.requireNonNull(redis.getConnectionFactory()).getConnection()) {
            List<String> keys = new ArrayList<>();
            try (var cursor = conn.keyCommands().scan(options)) {
                while (cursor.hasNext() && keys.size() < limit) {
                    keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
            return keys;
        }
    }
}
