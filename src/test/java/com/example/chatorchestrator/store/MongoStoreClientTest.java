package com.example.chatorchestrator.store;

import com.mongodb.client.model.changestream.ChangeStreamDocument;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.messaging.Message;
import org.springframework.data.mongodb.core.messaging.MessageListener;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoStoreClientTest {

    @Mock
    private Message<ChangeStreamDocument<Document>, Document> message;

    @Test
    void testChangeListener_ForwardsFullDocument() {
        // Given
        List<Map<String, Object>> seen = new ArrayList<>();
        MessageListener<ChangeStreamDocument<Document>, Document> listener = MongoStoreClient.changeListener(seen::add);
        when(message.getBody()).thenReturn(new Document("_id", "s1").append("mode", "shared"));

        // When
        listener.onMessage(message);

        // Then
        assertEquals(1, seen.size());
        assertEquals("shared", seen.get(0).get("mode"));
    }

    @Test
    void testChangeListener_SkipsEventsWithoutDocument() {
        // Given
        List<Map<String, Object>> seen = new ArrayList<>();
        when(message.getBody()).thenReturn(null);

        // When
        MongoStoreClient.changeListener(seen::add).onMessage(message);

        // Then
        assertTrue(seen.isEmpty());
    }
}
