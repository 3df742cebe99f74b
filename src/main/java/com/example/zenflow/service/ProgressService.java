package com.example.zenflow.service;

import com.example.zenflow.exception.InvalidDurationException;
import com.example.zenflow.model.AggregateState;
import com.example.zenflow.model.PracticeSession;
import com.example.zenflow.repo.PracticeSessionRepo;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writer-side owner of progress state.
 * <p>
 * Each session is persisted in two tiers:
 * - MongoDB: the append-only event store, replayed on repair
 * - shared KV store: the session mirror and aggregate keys read by the widget process
 * <p>
 * MongoDB is authoritative. The shared aggregate is rebuilt from it at startup, after the gateway
 * leaves its local fallback, and whenever it no longer matches what this writer last committed.
 * All read-modify-write cycles on the aggregate run under one lock.
 */
@Service
@ConditionalOnProperty(name = "zenflow.role", havingValue = "writer", matchIfMissing = true)
public class ProgressService {

    private static final Logger logger = LoggerFactory.getLogger(ProgressService.class);

    private final PracticeSessionRepo sessionRepo;
    private final ProgressSyncGateway gateway;
    private final ProgressAggregator aggregator;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    // last aggregate this writer committed, null until reconciled with the event store
    private AggregateState committed;

    public ProgressService(PracticeSessionRepo sessionRepo, ProgressSyncGateway gateway,
                           ProgressAggregator aggregator, Clock clock) {
        this.sessionRepo = sessionRepo;
        this.gateway = gateway;
        this.aggregator = aggregator;
        this.clock = clock;
    }

    @PostConstruct
    public void reconcileOnStartup() {
        gateway.onRecovered(this::reconcileAfterRecovery);
        try {
            AggregateState state = rebuildFromHistory();
            logger.info("Reconciled {} progress store with event store: {} sessions, {} min",
                    gateway.isDegraded() ? "local" : "shared", state.getTotalSessions(), state.getTotalMinutes());
        } catch (DataAccessException e) {
            logger.error("Event store unavailable at startup, reconciling on first recorded session", e);
        }
    }

    void reconcileAfterRecovery() {
        try {
            rebuildFromHistory();
        } catch (DataAccessException e) {
            logger.error("Event store unavailable after shared store recovery, reconciling on next session", e);
        }
    }

    public AggregateState recordSession(int durationMinutes) {
        return recordSession(durationMinutes, clock.instant());
    }

    /**
     * Appends a session, folds it into the aggregate, commits, then signals readers.
     *
     * @throws InvalidDurationException if {@code durationMinutes} is not positive
     */
    public AggregateState recordSession(int durationMinutes, Instant at) {
        if (durationMinutes <= 0) {
            throw new InvalidDurationException(durationMinutes);
        }
        Objects.requireNonNull(at, "at");
        // the event store keeps millisecond precision
        Instant timestamp = at.truncatedTo(ChronoUnit.MILLIS);

        writeLock.lock();
        try {
            AggregateState prior = currentOrReconciled();
            PracticeSession saved = sessionRepo.save(PracticeSession.builder()
                    .timestamp(timestamp)
                    .durationMinutes(durationMinutes)
                    .build());
            AggregateState next = aggregator.apply(prior, saved);

            gateway.appendSession(saved);
            gateway.commit(next);
            committed = next;
            // readers woken by the signal must find the committed state
            gateway.signalChanged();

            logger.debug("Recorded {} min session at {}", durationMinutes, timestamp);
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    public AggregateState getState() {
        return gateway.load();
    }

    /**
     * Newest first.
     */
    public List<PracticeSession> getSessions(Integer limit) {
        List<PracticeSession> sessions = sessionRepo.findAllByOrderByTimestampDesc();
        if (limit != null && limit > 0 && sessions.size() > limit) {
            return sessions.subList(0, limit);
        }
        return sessions;
    }

    /**
     * Sessions with {@code from <= timestamp <= to}, newest first.
     */
    public List<PracticeSession> getSessions(Instant from, Instant to) {
        return sessionRepo.findInRange(from, to);
    }

    public List<PracticeSession> getTodaySessions() {
        LocalDate today = LocalDate.now(clock.withZone(aggregator.getZone()));
        Instant start = today.atStartOfDay(aggregator.getZone()).toInstant();
        Instant end = today.plusDays(1).atStartOfDay(aggregator.getZone()).toInstant();
        return sessionRepo.findFromUntil(start, end);
    }

    /**
     * Replays the event store, rewrites the shared mirror and aggregate, and signals readers.
     */
    public AggregateState rebuildFromHistory() {
        writeLock.lock();
        try {
            AggregateState rebuilt = replayEventStore();
            gateway.signalChanged();
            return rebuilt;
        } finally {
            writeLock.unlock();
        }
    }

    private AggregateState currentOrReconciled() {
        AggregateState shared = gateway.load();
        if (shared.equals(committed)) {
            return shared;
        }
        if (committed != null) {
            logger.warn("Shared progress state {} differs from last commit {}; replaying event store",
                    shared, committed);
        }
        return replayEventStore();
    }

    private AggregateState replayEventStore() {
        List<PracticeSession> history = sessionRepo.findAllByOrderByTimestampAsc();
        AggregateState rebuilt = aggregator.replay(history);
        gateway.replaceSessions(history);
        gateway.commit(rebuilt);
        committed = rebuilt;
        logger.info("Rebuilt progress from {} sessions", history.size());
        return rebuilt;
    }
}
