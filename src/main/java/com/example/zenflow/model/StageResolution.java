package com.example.zenflow.model;

import lombok.Value;

/**
 * Where a given minute total sits in the growth-stage table.
 */
@Value
public class StageResolution {
    String stageName;
    String iconToken;
    /** Null at the top stage. */
    Integer nextStageThreshold;
    double progressFraction;

    public Integer minutesUntilNextStage(int totalMinutes) {
        if (nextStageThreshold == null) return null;
        return Math.max(0, nextStageThreshold - totalMinutes);
    }
}
