package com.example.chatorchestrator.kv;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local key/value store. Expired keys are dropped lazily on access.
 */
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
public class InMemoryKvClient implements KvClient {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return live(key).map(e -> e.value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Instant expiresAt = (ttl == null || ttl.isZero() || ttl.isNegative()) ? null : Instant.now().plus(ttl);
        entries.put(key, new Entry(value, expiresAt));
    }

    @Override
    public void del(String... keys) {
        for (String key : keys) {
            entries.remove(key);
        }
    }

    @Override
    public Map<String, Long> ttlMillis(String prefix, int limit) {
        Instant now = Instant.now();
        Map<String, Long> out = new LinkedHashMap<>();
        entries.keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .sorted()
                .forEach(k -> live(k).ifPresent(e -> {
                    if (out.size() < limit) {
                        out.put(k, e.expiresAt == null ? -1L : Duration.between(now, e.expiresAt).toMillis());
                    }
                }));
        return out;
    }

    private Optional<Entry> live(String key) {
        Entry entry = entries.get(key);
        if (entry == null) return Optional.empty();
        if (entry.expiresAt != null && !entry.expiresAt.isAfter(Instant.now())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private static final class Entry {
        final String value;
        final Instant expiresAt;

        Entry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
