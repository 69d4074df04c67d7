package com.example.chatorchestrator.mcp;

import com.example.chatorchestrator.event.ChatEventType;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class CapabilitiesTools {

    static final String SERVER_NAME = "chat-orchestrator";
    static final String SERVER_VERSION = "0.1.0";

    @Tool(description = "List server info, capabilities and the chat event names a client can subscribe to")
    public Map<String,Object> capabilities_list() {
        // static: listing the tool beans here would be circular
        return Map.of(
                "server", Map.of("name", SERVER_NAME, "version", SERVER_VERSION),
                "capabilities", Map.of(
                    "tools", true,
                    "events", true,
                    "resources", false,
                    "prompts", false
                ),
                "events", Arrays.stream(ChatEventType.values())
                        .map(ChatEventType::getEventName)
                        .collect(Collectors.toList())
        );
    }
}
