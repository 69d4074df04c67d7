package com.example.chatorchestrator.kv;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Key/value store holding the ephemeral typing and presence mirrors. Keys expire natively.
 */
public interface KvClient {
    Optional<String> get(String key);
    void set(String key, String value, Duration ttl);
    void del(String... keys);

    /**
     * Keys under the prefix with their remaining time to live in milliseconds, -1 for keys
     * without an expiry.
     */
    Map<String, Long> ttlMillis(String prefix, int limit);
}
