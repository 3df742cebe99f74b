package com.example.zenflow.service;

import com.example.zenflow.model.AggregateState;
import com.example.zenflow.model.PracticeSession;
import com.example.zenflow.repo.PracticeSessionRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;

/**
 * Compares the shared aggregate against a replay of the event store. Never repairs on its own.
 */
@Service
@ConditionalOnProperty(name = "zenflow.role", havingValue = "writer", matchIfMissing = true)
public class ProgressSyncVerificationService {

    private static final Logger logger = LoggerFactory.getLogger(ProgressSyncVerificationService.class);

    private final PracticeSessionRepo sessionRepo;
    private final ProgressSyncGateway gateway;
    private final ProgressAggregator aggregator;
    private final ProgressService progressService;
    private final Clock clock;

    public ProgressSyncVerificationService(PracticeSessionRepo sessionRepo, ProgressSyncGateway gateway,
                                           ProgressAggregator aggregator, ProgressService progressService,
                                           Clock clock) {
        this.sessionRepo = sessionRepo;
        this.gateway = gateway;
        this.aggregator = aggregator;
        this.progressService = progressService;
        this.clock = clock;
    }

    public Map<String, Object> verifySync() {
        List<PracticeSession> history = sessionRepo.findAllByOrderByTimestampAsc();
        AggregateState expected = aggregator.replay(history);
        AggregateState actual = gateway.load();
        int mirrored = gateway.loadSessions().size();

        List<Map<String, Object>> mismatches = new ArrayList<>();
        compare(mismatches, "totalMinutes", expected.getTotalMinutes(), actual.getTotalMinutes());
        compare(mismatches, "totalSessions", expected.getTotalSessions(), actual.getTotalSessions());
        compare(mismatches, "currentStreak", expected.getCurrentStreak(), actual.getCurrentStreak());
        compare(mismatches, "longestStreak", expected.getLongestStreak(), actual.getLongestStreak());
        compare(mismatches, "lastSessionDate", expected.getLastSessionDate(), actual.getLastSessionDate());
        compare(mismatches, "mirroredSessions", history.size(), mirrored);

        boolean inSync = mismatches.isEmpty();
        Map<String, Object> report = new HashMap<>();
        report.put("inSync", inSync);
        report.put("mismatches", mismatches);
        report.put("eventStoreSessions", history.size());
        report.put("mirroredSessions", mirrored);
        report.put("degraded", gateway.isDegraded());
        report.put("overallSyncHealth", inSync && !gateway.isDegraded() ? "HEALTHY" : "ISSUES_DETECTED");
        report.put("timestamp", clock.instant());

        logger.info("Progress sync verification completed. Health: {}", report.get("overallSyncHealth"));
        return report;
    }

    /**
     * Rebuilds the shared state from the event store (emergency use).
     */
    public Map<String, Object> forceRepair() {
        AggregateState rebuilt = progressService.rebuildFromHistory();
        return Map.of(
            "action", "rebuilt_from_event_store",
            "success", true,
            "totalMinutes", rebuilt.getTotalMinutes(),
            "totalSessions", rebuilt.getTotalSessions()
        );
    }

    @Scheduled(fixedDelayString = "${zenflow.sync.verify-interval-ms:300000}", initialDelay = 60000L)
    public void scheduledSyncHealthCheck() {
        try {
            Map<String, Object> report = verifySync();
            if (!"HEALTHY".equals(report.get("overallSyncHealth"))) {
                logger.warn("Progress sync health check failed: {}", report);
            } else {
                logger.debug("Progress sync health check passed");
            }
        } catch (Exception e) {
            logger.error("Error during scheduled progress sync health check", e);
        }
    }

    private static void compare(List<Map<String, Object>> mismatches, String field, Object expected, Object actual) {
        if (!Objects.equals(expected, actual)) {
            Map<String, Object> mismatch = new HashMap<>();
            mismatch.put("field", field);
            mismatch.put("eventStoreValue", expected);
            mismatch.put("sharedValue", actual);
            mismatches.add(mismatch);
        }
    }
}
