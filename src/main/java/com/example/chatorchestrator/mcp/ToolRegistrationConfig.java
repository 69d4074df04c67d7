package com.example.chatorchestrator.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final ChatSessionTools chatTools;
    private final SyncTools syncTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(ChatSessionTools chatTools, SyncTools syncTools, CapabilitiesTools capTools) {
        this.chatTools = chatTools;
        this.syncTools = syncTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(chatTools, syncTools, capTools)
                .build();
    }
}
