package com.example.chatorchestrator.controller;

import com.example.chatorchestrator.kv.KvClient;
import com.example.chatorchestrator.service.ChatOrchestrator;
import com.example.chatorchestrator.store.StoreClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private KvClient kvClient;

    @Mock
    private StoreClient storeClient;

    @Mock
    private ChatOrchestrator orchestrator;

    @InjectMocks
    private HealthController controller;

    @Test
    void testHealth_AllUp() {
        // Given
        when(orchestrator.residentSessionCount()).thenReturn(3);

        // When
        Map<String, Object> health = controller.health().getBody();

        // Then
        assertEquals("UP", health.get("status"));
        assertEquals("UP", health.get("kv"));
        assertEquals("UP", health.get("store"));
        assertEquals(3, health.get("residentSessions"));
    }

    @Test
    void testHealth_StoreDownIsDegraded() {
        // Given
        when(storeClient.find(eq("sessions"), anyMap(), isNull(), eq(1))).thenThrow(new RuntimeException("no primary"));

        // When
        Map<String, Object> health = controller.health().getBody();

        // Then
        assertEquals("DEGRADED", health.get("status"));
        assertEquals("DOWN", health.get("store"));
        assertEquals("no primary", health.get("storeError"));
        assertEquals("UP", health.get("kv"));
    }
}
