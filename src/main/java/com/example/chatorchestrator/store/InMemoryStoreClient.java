package com.example.chatorchestrator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Process-local store for local runs and tests. Change-feed callbacks fire synchronously
 * after each write to a matching document.
 */
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
public class InMemoryStoreClient implements StoreClient {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStoreClient.class);

    private final Map<String, Map<String, Map<String, Object>>> collections = new ConcurrentHashMap<>();
    private final List<Watch> watches = new CopyOnWriteArrayList<>();

    @Override
    public void put(String collection, String key, Map<String, Object> doc) {
        Map<String, Object> stored = new LinkedHashMap<>(doc);
        stored.put("_id", key);
        synchronized (this) {
            collection(collection).put(key, stored);
        }
        notifyWatches(collection, copy(stored));
    }

    @Override
    public synchronized Optional<Map<String, Object>> get(String collection, String key) {
        Map<String, Object> doc = collection(collection).get(key);
        return Optional.ofNullable(doc == null ? null : copy(doc));
    }

    @Override
    public synchronized void delete(String collection, String key) {
        collection(collection).remove(key);
    }

    @Override
    public synchronized List<Map<String, Object>> find(String collection, Map<String, Object> filter, Map<String, Integer> sort, Integer limit) {
        List<Map<String, Object>> docs = collection(collection).values().stream()
                .filter(doc -> matches(doc, filter))
                .map(InMemoryStoreClient::copy)
                .collect(Collectors.toList());
        if (sort != null && !sort.isEmpty()) {
            docs.sort(comparator(sort));
        }
        if (limit != null && limit > 0 && docs.size() > limit) {
            docs = new ArrayList<>(docs.subList(0, limit));
        }
        return docs;
    }

    @Override
    public void updateFields(String collection, String key, Map<String, Object> fields) {
        if (fields == null || fields.isEmpty()) return;
        Map<String, Object> updated;
        synchronized (this) {
            Map<String, Object> doc = upsert(collection, key);
            doc.putAll(fields);
            updated = copy(doc);
        }
        notifyWatches(collection, updated);
    }

    @Override
    public void addToSet(String collection, String key, String field, Object value) {
        Map<String, Object> updated;
        synchronized (this) {
            Map<String, Object> doc = upsert(collection, key);
            List<Object> values = listField(doc, field);
            if (!values.contains(value)) {
                values.add(value);
            }
            doc.put(field, values);
            updated = copy(doc);
        }
        notifyWatches(collection, updated);
    }

    @Override
    public void removeFromSet(String collection, String key, String field, Object value) {
        Map<String, Object> updated;
        synchronized (this) {
            Map<String, Object> doc = collection(collection).get(key);
            if (doc == null) return;
            List<Object> values = listField(doc, field);
            values.remove(value);
            doc.put(field, values);
            updated = copy(doc);
        }
        notifyWatches(collection, updated);
    }

    @Override
    public StoreSubscription subscribe(String collection, Map<String, Object> filter, Consumer<Map<String, Object>> callback) {
        Watch watch = new Watch(collection, filter == null ? Map.of() : Map.copyOf(filter), callback);
        watches.add(watch);
        return () -> watches.remove(watch);
    }

    public synchronized int count(String collection) {
        return collection(collection).size();
    }

    private Map<String, Map<String, Object>> collection(String name) {
        return collections.computeIfAbsent(name, n -> new LinkedHashMap<>());
    }

    private Map<String, Object> upsert(String collection, String key) {
        return collection(collection).computeIfAbsent(key, k -> {
            Map<String, Object> doc = new LinkedHashMap<>();
            doc.put("_id", k);
            return doc;
        });
    }

    private void notifyWatches(String collection, Map<String, Object> doc) {
        for (Watch watch : watches) {
            if (watch.collection.equals(collection) && matches(doc, watch.filter)) {
                try {
                    watch.callback.accept(copy(doc));
                } catch (RuntimeException e) {
                    logger.warn("Change-feed callback on {} failed", collection, e);
                }
            }
        }
    }

    private static boolean matches(Map<String, Object> doc, Map<String, Object> filter) {
        if (filter == null) return true;
        for (Map.Entry<String, Object> e : filter.entrySet()) {
            Object actual = doc.get(e.getKey());
            if (actual instanceof Collection) {
                if (!((Collection<?>) actual).contains(e.getValue())) return false;
            } else if (!Objects.equals(actual, e.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static Comparator<Map<String, Object>> comparator(Map<String, Integer> sort) {
        Comparator<Map<String, Object>> result = null;
        for (Map.Entry<String, Integer> e : sort.entrySet()) {
            String field = e.getKey();
            Comparator<Map<String, Object>> c = (a, b) -> compareValues(a.get(field), b.get(field));
            if (e.getValue() != null && e.getValue() < 0) {
                c = c.reversed();
            }
            result = result == null ? c : result.thenComparing(c);
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static int compareValues(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        return ((Comparable<Object>) a).compareTo(b);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> listField(Map<String, Object> doc, String field) {
        Object current = doc.get(field);
        return current instanceof Collection ? new ArrayList<>((Collection<Object>) current) : new ArrayList<>();
    }

    private static Map<String, Object> copy(Map<String, Object> doc) {
        Map<String, Object> out = new LinkedHashMap<>();
        doc.forEach((k, v) -> out.put(k, v instanceof Collection ? new ArrayList<>((Collection<?>) v) : v));
        return out;
    }

    private static final class Watch {
        final String collection;
        final Map<String, Object> filter;
        final Consumer<Map<String, Object>> callback;

        Watch(String collection, Map<String, Object> filter, Consumer<Map<String, Object>> callback) {
            this.collection = collection;
            this.filter = filter;
            this.callback = callback;
        }
    }
}
