package com.example.chatorchestrator.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Document store boundary. Documents are keyed by {@code _id} within a collection.
 * <p>
 * Filters are field-equality maps; a filter value matches an array field when the array
 * contains it. Field-level updates upsert the document when it does not exist yet.
 */
public interface StoreClient {
    void put(String collection, String key, Map<String,Object> doc);
    Optional<Map<String,Object>> get(String collection, String key);
    void delete(String collection, String key);
    List<Map<String,Object>> find(String collection, Map<String,Object> filter, Map<String,Integer> sort, Integer limit);
    void updateFields(String collection, String key, Map<String,Object> fields);
    void addToSet(String collection, String key, String field, Object value);
    void removeFromSet(String collection, String key, String field, Object value);
    StoreSubscription subscribe(String collection, Map<String,Object> filter, Consumer<Map<String,Object>> callback);
}
