package com.example.chatorchestrator.controller;

import com.example.chatorchestrator.event.ChatEventBus;
import com.example.chatorchestrator.exception.NotFoundException;
import com.example.chatorchestrator.mcp.CapabilitiesTools;
import com.example.chatorchestrator.mcp.ChatSessionTools;
import com.example.chatorchestrator.mcp.SyncTools;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.tool.ToolCallbackProvider;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChatRpcControllerTest {

    @Mock
    private ChatSessionTools chatTools;

    @Mock
    private SyncTools syncTools;

    @Mock
    private ToolCallbackProvider toolCallbacks;

    private ChatRpcController controller;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        controller = new ChatRpcController(chatTools, syncTools, new CapabilitiesTools(), toolCallbacks,
                new ChatEventBus(), objectMapper);
    }

    @Test
    void testToolCall_UserHeaderIsActingUser() {
        // Given
        when(chatTools.chat_heartbeat("u1", "s1")).thenReturn(Map.of("ok", true));

        // When
        Map<String, Object> response = controller.handleMessage(call("chat_heartbeat", Map.of("sessionId", "s1")), "u1").block();

        // Then
        assertNotNull(response);
        assertEquals(false, response.get("isError"));
        verify(chatTools).chat_heartbeat("u1", "s1");
    }

    @Test
    void testToolCall_ExplicitActingUserWins() {
        // Given
        when(chatTools.chat_markAsRead("u2", "m1")).thenReturn(Map.of("ok", true, "newlyRead", true));

        // When
        Map<String, Object> response = controller.handleMessage(
                call("chat_markAsRead", Map.of("actingUserId", "u2", "messageId", "m1")), "u1").block();

        // Then
        assertEquals(false, response.get("isError"));
        verify(chatTools, never()).chat_markAsRead("u1", "m1");
    }

    @Test
    void testToolCall_DomainErrorIsMapped() {
        // Given
        when(chatTools.chat_getMessages("missing", null)).thenThrow(new NotFoundException("Session", "missing"));

        // When
        Map<String, Object> response = controller.handleMessage(
                call("chat_getMessages", Map.of("sessionId", "missing")), null).block();

        // Then
        assertEquals(true, response.get("isError"));
        @SuppressWarnings("unchecked")
        Map<String, Object> error = (Map<String, Object>) response.get("error");
        assertEquals(-32004, error.get("code"));
        assertEquals("NOT_FOUND", error.get("reason"));
    }

    @Test
    void testToolCall_ThreadReplyForwardsArguments() {
        // Given
        when(chatTools.chat_replyToThread("u1", "t1", "EU first", null)).thenReturn(Map.of("message", Map.of()));

        // When
        Map<String, Object> response = controller.handleMessage(
                call("chat_replyToThread", Map.of("threadId", "t1", "content", "EU first")), "u1").block();

        // Then
        assertEquals(false, response.get("isError"));
        verify(chatTools).chat_replyToThread("u1", "t1", "EU first", null);
    }

    @Test
    void testToolCall_UnknownTool() {
        // When
        Map<String, Object> response = controller.handleMessage(call("kv_get", Map.of()), null).block();

        // Then
        @SuppressWarnings("unchecked")
        Map<String, Object> error = (Map<String, Object>) response.get("error");
        assertEquals(-32602, error.get("code"));
        verifyNoInteractions(chatTools, syncTools);
    }

    @Test
    void testUnknownMethod() {
        // When
        Map<String, Object> response = controller.handleMessage(Map.of("method", "resources/list"), null).block();

        // Then
        @SuppressWarnings("unchecked")
        Map<String, Object> error = (Map<String, Object>) response.get("error");
        assertEquals(-32601, error.get("code"));
    }

    @Test
    void testInitialize_ReportsServer() {
        // When
        Map<String, Object> response = controller.handleMessage(Map.of("method", "initialize"), null).block();

        // Then
        @SuppressWarnings("unchecked")
        Map<String, Object> server = (Map<String, Object>) response.get("serverInfo");
        assertEquals("chat-orchestrator", server.get("name"));
    }

    private static Map<String, Object> call(String tool, Map<String, Object> arguments) {
        return Map.of("method", "tools/call", "params", Map.of("name", tool, "arguments", arguments));
    }
}
