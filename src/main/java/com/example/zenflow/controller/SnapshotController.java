package com.example.zenflow.controller;

import com.example.zenflow.model.Snapshot;
import com.example.zenflow.service.SnapshotProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;

/**
 * Read-only endpoints of the widget process.
 */
@RestController
@RequestMapping("/snapshot")
@ConditionalOnProperty(name = "zenflow.role", havingValue = "reader")
public class SnapshotController {

    private final SnapshotProvider snapshotProvider;
    private final Clock clock;

    public SnapshotController(SnapshotProvider snapshotProvider, Clock clock) {
        this.snapshotProvider = snapshotProvider;
        this.clock = clock;
    }

    @GetMapping
    public Mono<Snapshot> current() {
        return Mono.fromCallable(snapshotProvider::current).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/placeholder")
    public Snapshot placeholder() {
        return snapshotProvider.placeholder(clock.instant());
    }

    /**
     * Host-driven re-evaluation point, equivalent to receiving a change signal.
     */
    @PostMapping("/invalidate")
    public Mono<Snapshot> invalidate() {
        return Mono.fromCallable(() -> {
            snapshotProvider.onInvalidated();
            return snapshotProvider.current();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Snapshot>> stream() {
        Flux<Snapshot> initial = Mono.fromCallable(snapshotProvider::current)
                .subscribeOn(Schedulers.boundedElastic())
                .flux();
        Flux<ServerSentEvent<Snapshot>> snapshots = initial.concatWith(snapshotProvider.updates())
                .map(snapshot -> ServerSentEvent.<Snapshot>builder()
                        .event("snapshot")
                        .data(snapshot)
                        .build());
        Flux<ServerSentEvent<Snapshot>> heartbeat = Flux.interval(Duration.ofSeconds(30))
                .map(tick -> ServerSentEvent.<Snapshot>builder().comment("keepalive").build());
        return Flux.merge(snapshots, heartbeat)
                .onErrorResume(throwable -> Flux.empty());
    }
}
