package com.example.chatorchestrator.controller;

import com.example.chatorchestrator.kv.KvClient;
import com.example.chatorchestrator.service.ChatOrchestrator;
import com.example.chatorchestrator.store.StoreClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final StoreClient storeClient;
    private final ChatOrchestrator orchestrator;

    public HealthController(KvClient kvClient, StoreClient storeClient, ChatOrchestrator orchestrator) {
        this.kvClient = kvClient;
        this.storeClient = storeClient;
        this.orchestrator = orchestrator;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "chat-orchestrator");
        health.put("residentSessions", orchestrator.residentSessionCount());

        try {
            kvClient.get("health-check");
            health.put("kv", "UP");
        } catch (Exception e) {
            health.put("kv", "DOWN");
            health.put("kvError", e.getMessage());
        }

        try {
            storeClient.find("sessions", Map.of(), null, 1);
            health.put("store", "UP");
        } catch (Exception e) {
            health.put("store", "DOWN");
            health.put("storeError", e.getMessage());
        }

        if ("DOWN".equals(health.get("kv")) || "DOWN".equals(health.get("store"))) {
            health.put("status", "DEGRADED");
        }
        return ResponseEntity.ok(health);
    }
}
