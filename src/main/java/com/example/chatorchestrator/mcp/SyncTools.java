package com.example.chatorchestrator.mcp;

import com.example.chatorchestrator.service.SessionSynchronizer;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class SyncTools {

    private final SessionSynchronizer synchronizer;

    public SyncTools(SessionSynchronizer synchronizer) {
        this.synchronizer = synchronizer;
    }

    @Tool(description = "Get persistence sync statistics including thread pool status and failure counters")
    public Map<String, Object> sync_stats() {
        return synchronizer.getSyncStats();
    }

    @Tool(description = "List the presence keys mirrored in the KV store for a session with their remaining TTL in ms")
    public Map<String, Object> sync_presenceMirror(String sessionId) {
        return Map.of("sessionId", sessionId, "keys", synchronizer.getPresenceMirror(sessionId));
    }
}
