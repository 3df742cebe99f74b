package com.example.zenflow.controller;

import com.example.zenflow.kv.KvClient;
import com.example.zenflow.repo.PracticeSessionRepo;
import com.example.zenflow.service.ProgressSyncGateway;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final PracticeSessionRepo sessionRepo;
    private final ProgressSyncGateway gateway;
    private final String role;

    public HealthController(KvClient kvClient, PracticeSessionRepo sessionRepo, ProgressSyncGateway gateway,
                            @Value("${zenflow.role:writer}") String role) {
        this.kvClient = kvClient;
        this.sessionRepo = sessionRepo;
        this.gateway = gateway;
        this.role = role;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", gateway.isDegraded() ? "DEGRADED" : "UP");
        health.put("service", "zenflow-progress");
        health.put("role", role);
        health.put("gateway", gateway.getGatewayStatus());

        // Test Redis connection
        try {
            kvClient.get(gateway.getNamespace() + "health-check");
            health.put("redis", "UP");
        } catch (Exception e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        // the reader never touches the event store
        if ("writer".equals(role)) {
            try {
                sessionRepo.count();
                health.put("mongodb", "UP");
            } catch (Exception e) {
                health.put("mongodb", "DOWN");
                health.put("mongodbError", e.getMessage());
            }
        }

        return ResponseEntity.ok(health);
    }
}
