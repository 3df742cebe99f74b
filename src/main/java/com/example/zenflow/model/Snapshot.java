package com.example.zenflow.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of progress handed to the presentation process.
 * Computed on read and never persisted.
 */
@Value
@Builder
public class Snapshot {
    Instant asOf;
    AggregateState state;
    String stageName;
    String iconToken;
    Integer nextStageThreshold;
    double progressFraction;
    Integer minutesUntilNextStage;
    boolean streakActive;
    // placeholder snapshots are sample data for empty-state rendering, never real progress
    boolean placeholder;
    boolean degraded;
}
