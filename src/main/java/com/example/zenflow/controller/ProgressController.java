package com.example.zenflow.controller;

import com.example.zenflow.model.AggregateState;
import com.example.zenflow.model.PracticeSession;
import com.example.zenflow.service.ProgressService;
import com.example.zenflow.service.ProgressSyncVerificationService;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@RestController
@RequestMapping("/progress")
@ConditionalOnProperty(name = "zenflow.role", havingValue = "writer", matchIfMissing = true)
public class ProgressController {

    private final ProgressService progressService;
    private final ProgressSyncVerificationService verificationService;

    public ProgressController(ProgressService progressService, ProgressSyncVerificationService verificationService) {
        this.progressService = progressService;
        this.verificationService = verificationService;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecordSessionRequest {
        private int durationMinutes;
        private Instant at;
    }

    @PostMapping("/sessions")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Map<String, Object>> recordSession(@RequestBody RecordSessionRequest request) {
        return blocking(() -> toView(request.getAt() == null
                ? progressService.recordSession(request.getDurationMinutes())
                : progressService.recordSession(request.getDurationMinutes(), request.getAt())));
    }

    @GetMapping("/state")
    public Mono<Map<String, Object>> state() {
        return blocking(() -> toView(progressService.getState()));
    }

    @GetMapping("/sessions")
    public Mono<List<PracticeSession>> sessions(@RequestParam(required = false) Integer limit) {
        return blocking(() -> progressService.getSessions(limit));
    }

    @GetMapping("/sessions/today")
    public Mono<List<PracticeSession>> todaySessions() {
        return blocking(progressService::getTodaySessions);
    }

    @GetMapping("/sessions/range")
    public Mono<List<PracticeSession>> sessionsInRange(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return blocking(() -> progressService.getSessions(from, to));
    }

    @GetMapping("/sync")
    public Mono<Map<String, Object>> verifySync() {
        return blocking(verificationService::verifySync);
    }

    @PostMapping("/sync/repair")
    public Mono<Map<String, Object>> repair() {
        return blocking(verificationService::forceRepair);
    }

    static Map<String, Object> toView(AggregateState state) {
        Map<String, Object> view = new HashMap<>();
        view.put("totalMinutes", state.getTotalMinutes());
        view.put("totalSessions", state.getTotalSessions());
        view.put("currentStreak", state.getCurrentStreak());
        view.put("longestStreak", state.getLongestStreak());
        view.put("lastSessionDate", state.getLastSessionDate());
        view.put("averageSessionMinutes", state.getAverageSessionMinutes());
        return view;
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        // store clients are blocking; keep them off the event loop
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
