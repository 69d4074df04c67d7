package com.example.chatorchestrator.controller;

import com.example.chatorchestrator.event.ChatEvent;
import com.example.chatorchestrator.event.ChatEventBus;
import com.example.chatorchestrator.exception.ChatOrchestrationException;
import com.example.chatorchestrator.mcp.CapabilitiesTools;
import com.example.chatorchestrator.mcp.ChatSessionTools;
import com.example.chatorchestrator.mcp.SyncTools;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * JSON-RPC style entry point for clients that do not speak MCP, plus a per-session event
 * stream. The MCP transport itself is served by the Spring AI starter.
 */
@RestController
@RequestMapping("/chat")
public class ChatRpcController {

    private static final Logger logger = LoggerFactory.getLogger(ChatRpcController.class);

    static final String USER_HEADER = "X-User-Id";

    private final ChatSessionTools chatTools;
    private final SyncTools syncTools;
    private final CapabilitiesTools capabilitiesTools;
    private final ToolCallbackProvider toolCallbacks;
    private final ChatEventBus eventBus;
    private final ObjectMapper objectMapper;

    public ChatRpcController(ChatSessionTools chatTools, SyncTools syncTools, CapabilitiesTools capabilitiesTools,
                             ToolCallbackProvider toolCallbacks, ChatEventBus eventBus, ObjectMapper objectMapper) {
        this.chatTools = chatTools;
        this.syncTools = syncTools;
        this.capabilitiesTools = capabilitiesTools;
        this.toolCallbacks = toolCallbacks;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> events(@RequestParam String sessionId) {
        ServerSentEvent<String> connected = ServerSentEvent.<String>builder()
                .event("connected")
                .data("{\"status\":\"connected\",\"sessionId\":\"" + sessionId + "\"}")
                .build();
        return Flux.concat(Flux.just(connected), eventBus.events(sessionId).map(this::toServerSentEvent))
                .doOnCancel(() -> logger.debug("Event stream for session {} closed", sessionId));
    }

    @PostMapping(value = "/rpc", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> handleMessage(@RequestBody Map<String, Object> request,
                                                   @RequestHeader(value = USER_HEADER, required = false) String userHeader) {
        return Mono.fromCallable(() -> {
            try {
                String method = (String) request.get("method");
                if (method == null) {
                    return createErrorResponse("Missing method field", -32600);
                }

                switch (method) {
                    case "initialize":
                        return handleInitialize();
                    case "tools/list":
                        return handleToolsList();
                    case "tools/call":
                        return handleToolCall(request, userHeader);
                    default:
                        return createErrorResponse("Method not found: " + method, -32601);
                }
            } catch (Exception e) {
                logger.error("Request failed", e);
                return createErrorResponse("Internal error: " + e.getMessage(), -32603);
            }
        });
    }

    @GetMapping("/capabilities")
    public Map<String, Object> getCapabilities() {
        Map<String, Object> capabilities = new LinkedHashMap<>(capabilitiesTools.capabilities_list());
        capabilities.put("tools", Arrays.stream(toolCallbacks.getToolCallbacks())
                .map(ToolCallback::getToolDefinition)
                .map(def -> Map.of("name", def.name(), "description", def.description()))
                .toList());
        return capabilities;
    }

    private Map<String, Object> handleInitialize() {
        return Map.of(
                "protocolVersion", "2024-11-05",
                "capabilities", Map.of(
                        "tools", Map.of("listChanged", false),
                        "resources", Map.of(),
                        "prompts", Map.of()
                ),
                "serverInfo", capabilitiesTools.capabilities_list().get("server")
        );
    }

    private Map<String, Object> handleToolsList() throws JsonProcessingException {
        List<Map<String, Object>> tools = new ArrayList<>();
        for (ToolCallback callback : toolCallbacks.getToolCallbacks()) {
            ToolDefinition def = callback.getToolDefinition();
            tools.add(Map.of(
                    "name", def.name(),
                    "description", def.description(),
                    "inputSchema", objectMapper.readValue(def.inputSchema(), new TypeReference<Map<String, Object>>() {})
            ));
        }
        return Map.of("tools", tools);
    }

    private Map<String, Object> handleToolCall(Map<String, Object> request, String userHeader) throws JsonProcessingException {
        @SuppressWarnings("unchecked")
        Map<String, Object> params = (Map<String, Object>) request.get("params");
        if (params == null || params.get("name") == null) {
            return createErrorResponse("Missing tool name", -32602);
        }
        String toolName = (String) params.get("name");
        @SuppressWarnings("unchecked")
        Map<String, Object> arguments = (Map<String, Object>) params.get("arguments");
        Map<String, Object> args = arguments != null ? new HashMap<>(arguments) : new HashMap<>();
        if (args.get("actingUserId") == null && userHeader != null) {
            args.put("actingUserId", userHeader);
        }

        try {
            Object result = callTool(toolName, args);
            return Map.of(
                    "content", Map.of(
                            "type", "text",
                            "text", objectMapper.writeValueAsString(result)
                    ),
                    "isError", false
            );
        } catch (ChatOrchestrationException e) {
            logger.debug("Tool {} rejected: {}", toolName, e.getMessage());
            return createErrorResponse(e.getMessage(), errorCode(e), e.getCode());
        } catch (IllegalArgumentException | ClassCastException | NullPointerException | DateTimeParseException e) {
            return createErrorResponse("Invalid params: " + e.getMessage(), -32602);
        }
    }

    @SuppressWarnings("unchecked")
    private Object callTool(String toolName, Map<String, Object> arguments) {
        switch (toolName) {
            case "chat_createOrGetSession":
                return chatTools.chat_createOrGetSession(
                        (String) arguments.get("actingUserId"),
                        (String) arguments.get("sessionId"),
                        (String) arguments.get("name"),
                        (String) arguments.get("agentId"),
                        (List<String>) arguments.get("initialParticipants"),
                        (String) arguments.get("linkedSessionId"));
            case "chat_addParticipant":
                return chatTools.chat_addParticipant(
                        (String) arguments.get("sessionId"),
                        (String) arguments.get("userId"),
                        (String) arguments.get("role"));
            case "chat_removeParticipant":
                return chatTools.chat_removeParticipant(
                        (String) arguments.get("sessionId"),
                        (String) arguments.get("userId"));
            case "chat_sendMessage":
                return chatTools.chat_sendMessage(
                        (String) arguments.get("actingUserId"),
                        (String) arguments.get("sessionId"),
                        (String) arguments.get("content"),
                        (String) arguments.get("targetType"),
                        (String) arguments.get("targetId"),
                        (List<String>) arguments.get("attachments"));
            case "chat_setTyping":
                return chatTools.chat_setTyping(
                        (String) arguments.get("actingUserId"),
                        (String) arguments.get("sessionId"),
                        (Boolean) arguments.get("isTyping"));
            case "chat_heartbeat":
                return chatTools.chat_heartbeat(
                        (String) arguments.get("actingUserId"),
                        (String) arguments.get("sessionId"));
            case "chat_markAsRead":
                return chatTools.chat_markAsRead(
                        (String) arguments.get("actingUserId"),
                        (String) arguments.get("messageId"));
            case "chat_getSession":
                return chatTools.chat_getSession((String) arguments.get("sessionId"));
            case "chat_getUserSessions":
                return chatTools.chat_getUserSessions((String) arguments.get("userId"));
            case "chat_getMessages":
                return chatTools.chat_getMessages(
                        (String) arguments.get("sessionId"),
                        (Integer) arguments.get("limit"));
            case "chat_listTyping":
                return chatTools.chat_listTyping((String) arguments.get("sessionId"));
            case "chat_grantPermission":
                return chatTools.chat_grantPermission(
                        (String) arguments.get("sessionId"),
                        (String) arguments.get("userId"),
                        (String) arguments.get("permission"));
            case "chat_revokePermission":
                return chatTools.chat_revokePermission(
                        (String) arguments.get("sessionId"),
                        (String) arguments.get("userId"),
                        (String) arguments.get("permission"));

            case "chat_createThread":
                return chatTools.chat_createThread(
                        (String) arguments.get("actingUserId"),
                        (String) arguments.get("sessionId"),
                        (String) arguments.get("parentMessageId"),
                        (String) arguments.get("title"),
                        (String) arguments.get("description"),
                        (List<String>) arguments.get("tags"));
            case "chat_replyToThread":
                return chatTools.chat_replyToThread(
                        (String) arguments.get("actingUserId"),
                        (String) arguments.get("threadId"),
                        (String) arguments.get("content"),
                        (List<String>) arguments.get("attachments"));
            case "chat_updateThreadStatus":
                return chatTools.chat_updateThreadStatus(
                        (String) arguments.get("actingUserId"),
                        (String) arguments.get("threadId"),
                        (String) arguments.get("status"));
            case "chat_getThread":
                return chatTools.chat_getThread((String) arguments.get("threadId"));
            case "chat_getSessionThreads":
                return chatTools.chat_getSessionThreads((String) arguments.get("sessionId"));
            case "chat_getThreadMessages":
                return chatTools.chat_getThreadMessages(
                        (String) arguments.get("threadId"),
                        (Integer) arguments.get("limit"));
            case "chat_searchThreads":
                return chatTools.chat_searchThreads(
                        (String) arguments.get("sessionId"),
                        (String) arguments.get("query"),
                        (List<String>) arguments.get("statuses"),
                        (List<String>) arguments.get("participants"),
                        (String) arguments.get("createdFrom"),
                        (String) arguments.get("createdTo"),
                        (String) arguments.get("sortBy"),
                        (Boolean) arguments.get("ascending"),
                        (Integer) arguments.get("limit"));
            case "chat_getThreadActivities":
                return chatTools.chat_getThreadActivities(
                        (String) arguments.get("sessionId"),
                        (Integer) arguments.get("limit"));

            case "sync_stats":
                return syncTools.sync_stats();
            case "sync_presenceMirror":
                return syncTools.sync_presenceMirror((String) arguments.get("sessionId"));
            case "capabilities_list":
                return capabilitiesTools.capabilities_list();

            default:
                throw new IllegalArgumentException("Unknown tool: " + toolName);
        }
    }

    private ServerSentEvent<String> toServerSentEvent(ChatEvent event) {
        String data;
        try {
            data = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize {} event for session {}", event.getEventName(), event.getSessionId(), e);
            data = "{\"type\":\"" + event.getEventName() + "\"}";
        }
        return ServerSentEvent.<String>builder()
                .event(event.getEventName())
                .data(data)
                .build();
    }

    static int errorCode(ChatOrchestrationException e) {
        switch (e.getCode()) {
            case "NOT_FOUND":
                return -32004;
            case "UNAUTHENTICATED":
                return -32001;
            case "CAPACITY_EXCEEDED":
                return -32009;
            default:
                return -32000;
        }
    }

    private Map<String, Object> createErrorResponse(String message, int code) {
        return createErrorResponse(message, code, null);
    }

    private Map<String, Object> createErrorResponse(String message, int code, String reason) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);
        if (reason != null) {
            error.put("reason", reason);
        }
        return Map.of("error", error, "isError", true);
    }
}
