package com.example.zenflow.model;

import lombok.Value;

/**
 * A named growth stage that unlocks once cumulative minutes reach {@code minMinutes}.
 */
@Value
public class MilestoneThreshold {
    String stageName;
    int minMinutes;
    String iconToken;
}
