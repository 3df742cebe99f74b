package com.example.zenflow.mcp;

import com.example.zenflow.model.AggregateState;
import com.example.zenflow.model.PracticeSession;
import com.example.zenflow.service.ProgressService;
import com.example.zenflow.service.ProgressSyncGateway;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

@Service
@ConditionalOnProperty(name = "zenflow.role", havingValue = "writer", matchIfMissing = true)
public class ProgressTools {

    private final ProgressService progressService;
    private final ProgressSyncGateway gateway;

    public ProgressTools(ProgressService progressService, ProgressSyncGateway gateway) {
        this.progressService = progressService;
        this.gateway = gateway;
    }

    @Tool(description = "Record a completed practice session of durationMinutes, optionally at an ISO-8601 instant")
    public Map<String,Object> progress_record_session(Integer durationMinutes, String at) {
        int minutes = durationMinutes == null ? 0 : durationMinutes;
        AggregateState state = (at == null || at.isBlank())
                ? progressService.recordSession(minutes)
                : progressService.recordSession(minutes, Instant.parse(at));

        Map<String, Object> result = new HashMap<>();
        result.put("ok", true);
        result.put("state", toMap(state));
        result.put("degraded", gateway.isDegraded());
        return result;
    }

    @Tool(description = "Get total minutes, session count and streaks")
    public Map<String,Object> progress_state() {
        return toMap(progressService.getState());
    }

    @Tool(description = "List recorded sessions, newest first (limit enforced)")
    public Map<String,Object> progress_sessions(Integer limit) {
        int lim = (limit == null || limit <= 0) ? 100 : Math.min(limit, 1000);
        List<Map<String, Object>> sessions = new ArrayList<>();
        for (PracticeSession s : progressService.getSessions(lim)) {
            sessions.add(Map.of("timestamp", s.getTimestamp().toString(), "durationMinutes", s.getDurationMinutes()));
        }
        return Map.of("sessions", sessions);
    }

    @Tool(description = "Report whether the shared progress store is in use or the local fallback")
    public Map<String,Object> progress_gateway_status() {
        return gateway.getGatewayStatus();
    }

    static Map<String, Object> toMap(AggregateState state) {
        Map<String, Object> map = new HashMap<>();
        map.put("totalMinutes", state.getTotalMinutes());
        map.put("totalSessions", state.getTotalSessions());
        map.put("currentStreak", state.getCurrentStreak());
        map.put("longestStreak", state.getLongestStreak());
        map.put("lastSessionDate", state.findLastSessionDate().map(Instant::toString).orElse(null));
        return map;
    }
}
