package com.example.chatorchestrator.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStoreClientTest {

    private InMemoryStoreClient store;

    @BeforeEach
    void setUp() {
        store = new InMemoryStoreClient();
    }

    @Test
    void testFind_FilterSortAndLimit() {
        // Given
        store.put("sessions", "s1", Map.of("participantIds", List.of("a", "b"), "lastActivity", 10L));
        store.put("sessions", "s2", Map.of("participantIds", List.of("b"), "lastActivity", 30L));
        store.put("sessions", "s3", Map.of("participantIds", List.of("b", "c"), "lastActivity", 20L));
        store.put("sessions", "s4", Map.of("participantIds", List.of("c"), "lastActivity", 40L));

        // When
        List<Map<String, Object>> found = store.find("sessions", Map.of("participantIds", "b"),
                Map.of("lastActivity", -1), 2);

        // Then
        assertEquals(List.of("s2", "s3"), found.stream().map(d -> d.get("_id")).collect(Collectors.toList()));
    }

    @Test
    void testUpdateFields_UpsertsMissingDocument() {
        // When
        store.updateFields("participants", "s1_u1", Map.of("isOnline", true));

        // Then
        Map<String, Object> doc = store.get("participants", "s1_u1").orElseThrow();
        assertEquals(true, doc.get("isOnline"));
        assertEquals("s1_u1", doc.get("_id"));
    }

    @Test
    void testAddToSetAndRemoveFromSet() {
        // When
        store.addToSet("messages", "m1", "deliveredTo", "a");
        store.addToSet("messages", "m1", "deliveredTo", "a");
        store.addToSet("messages", "m1", "deliveredTo", "b");
        store.removeFromSet("messages", "m1", "deliveredTo", "a");
        store.removeFromSet("messages", "missing", "deliveredTo", "a");

        // Then
        assertEquals(List.of("b"), store.get("messages", "m1").orElseThrow().get("deliveredTo"));
        assertTrue(store.get("messages", "missing").isEmpty());
        assertEquals(1, store.count("messages"));
    }

    @Test
    void testGet_ReturnsCopy() {
        // Given
        store.put("sessions", "s1", Map.of("participantIds", List.of("a")));

        // When
        @SuppressWarnings("unchecked")
        List<Object> ids = (List<Object>) store.get("sessions", "s1").orElseThrow().get("participantIds");
        ids.add("intruder");

        // Then
        assertEquals(List.of("a"), store.get("sessions", "s1").orElseThrow().get("participantIds"));
    }

    @Test
    void testSubscribe_FiresForMatchingWritesUntilCancelled() {
        // Given
        List<Object> seen = new ArrayList<>();
        StoreSubscription subscription = store.subscribe("sessions", Map.of("id", "s1"), doc -> seen.add(doc.get("name")));

        // When
        store.put("sessions", "s1", Map.of("id", "s1", "name", "first"));
        store.put("sessions", "s2", Map.of("id", "s2", "name", "other"));
        store.updateFields("sessions", "s1", Map.of("name", "second"));
        subscription.cancel();
        store.updateFields("sessions", "s1", Map.of("name", "third"));

        // Then
        assertEquals(List.of("first", "second"), seen);
    }

    @Test
    void testDelete() {
        // Given
        store.put("inbox", "u1_m1", Map.of("userId", "u1"));

        // When
        store.delete("inbox", "u1_m1");

        // Then
        assertTrue(store.find("inbox", Map.of(), null, null).isEmpty());
    }
}
