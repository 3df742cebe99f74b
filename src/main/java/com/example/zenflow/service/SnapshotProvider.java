package com.example.zenflow.service;

import com.example.zenflow.model.AggregateState;
import com.example.zenflow.model.RefreshState;
import com.example.zenflow.model.Snapshot;
import com.example.zenflow.model.StageResolution;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reader-side, pull-based view of progress for the widget process.
 * <p>
 * Refresh cycle: IDLE -> INVALIDATED (change signal or host re-evaluation) -> REFRESHED -> IDLE.
 * Signals carry no data; every refresh re-reads the full state through the gateway. Signals that
 * arrive while a refresh is running are coalesced into one more pass.
 * <p>
 * The optional timed refresh is a safety net only, off by default. Progress changes solely when
 * the writer records a session, and the writer always signals after committing.
 */
@Service
@ConditionalOnProperty(name = "zenflow.role", havingValue = "reader")
public class SnapshotProvider {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotProvider.class);

    private static final AggregateState PLACEHOLDER_STATE = AggregateState.builder()
            .totalMinutes(150)
            .totalSessions(10)
            .currentStreak(7)
            .longestStreak(14)
            .build();

    private final ProgressSyncGateway gateway;
    private final MilestoneResolver resolver;
    private final ProgressAggregator aggregator;
    private final Clock clock;
    private final boolean safetyRefreshEnabled;

    private final AtomicReference<Snapshot> current = new AtomicReference<>();
    private final AtomicBoolean dirty = new AtomicBoolean();
    private final AtomicBoolean refreshing = new AtomicBoolean();
    private final Sinks.Many<Snapshot> updates = Sinks.many().multicast().directBestEffort();
    private volatile RefreshState state = RefreshState.IDLE;

    public SnapshotProvider(ProgressSyncGateway gateway, MilestoneResolver resolver, ProgressAggregator aggregator,
                            Clock clock,
                            @Value("${zenflow.snapshot.safety-refresh-enabled:false}") boolean safetyRefreshEnabled) {
        this.gateway = gateway;
        this.resolver = resolver;
        this.aggregator = aggregator;
        this.clock = clock;
        this.safetyRefreshEnabled = safetyRefreshEnabled;
    }

    @PostConstruct
    public void start() {
        gateway.subscribe(this::onInvalidated);
        // signals sent while degraded never reached this process
        gateway.onRecovered(this::onInvalidated);
        logger.info("Snapshot provider listening on {}{}", gateway.channel(),
                safetyRefreshEnabled ? " with timed safety refresh" : "");
    }

    /**
     * Computes a fresh snapshot from whatever the gateway holds now. Does not touch the cached one.
     */
    public Snapshot snapshot(Instant asOf) {
        AggregateState aggregate = gateway.load();
        return build(asOf, aggregate, false, gateway.isDegraded());
    }

    /**
     * Sample data for rendering before any real progress exists. Flagged and never cached.
     */
    public Snapshot placeholder(Instant asOf) {
        AggregateState sample = PLACEHOLDER_STATE.toBuilder().lastSessionDate(asOf).build();
        return build(asOf, sample, true, false);
    }

    /**
     * The last refreshed snapshot, refreshing first if there is none yet.
     */
    public Snapshot current() {
        Snapshot snapshot = current.get();
        if (snapshot == null) {
            onInvalidated();
            snapshot = current.get();
        }
        // another thread holds the refresh and has not published yet
        return snapshot != null ? snapshot : snapshot(clock.instant());
    }

    /**
     * Handles a change signal or host wake-up.
     */
    public void onInvalidated() {
        dirty.set(true);
        state = RefreshState.INVALIDATED;
        if (!refreshing.compareAndSet(false, true)) {
            logger.debug("Refresh already running, signal coalesced");
            return;
        }
        try {
            while (dirty.getAndSet(false)) {
                Snapshot refreshed = snapshot(clock.instant());
                current.set(refreshed);
                state = RefreshState.REFRESHED;
                updates.tryEmitNext(refreshed);
                logger.info("Snapshot refreshed: {} min, stage {}, streak {}",
                        refreshed.getState().getTotalMinutes(), refreshed.getStageName(),
                        refreshed.getState().getCurrentStreak());
            }
            state = RefreshState.IDLE;
        } finally {
            refreshing.set(false);
        }
        // a signal may have landed between the loop check and releasing the flag
        if (dirty.get()) {
            onInvalidated();
        }
    }

    @Scheduled(fixedDelayString = "${zenflow.snapshot.safety-refresh-ms:900000}",
            initialDelayString = "${zenflow.snapshot.safety-refresh-ms:900000}")
    public void safetyRefresh() {
        if (safetyRefreshEnabled) {
            logger.debug("Timed safety refresh");
            onInvalidated();
        }
    }

    public Flux<Snapshot> updates() {
        return updates.asFlux();
    }

    public RefreshState getState() {
        return state;
    }

    private Snapshot build(Instant asOf, AggregateState aggregate, boolean placeholder, boolean degraded) {
        StageResolution stage = resolver.resolve(aggregate.getTotalMinutes());
        return Snapshot.builder()
                .asOf(asOf)
                .state(aggregate)
                .stageName(stage.getStageName())
                .iconToken(stage.getIconToken())
                .nextStageThreshold(stage.getNextStageThreshold())
                .progressFraction(stage.getProgressFraction())
                .minutesUntilNextStage(stage.minutesUntilNextStage(aggregate.getTotalMinutes()))
                .streakActive(aggregator.isStreakActive(aggregate, asOf))
                .placeholder(placeholder)
                .degraded(degraded)
                .build();
    }
}
