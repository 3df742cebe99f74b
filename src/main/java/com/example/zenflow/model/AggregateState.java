package com.example.zenflow.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Derived progress totals folded from the session history.
 * <p>
 * {@code totalMinutes} never decreases and {@code longestStreak >= currentStreak} always holds.
 */
@Value
@Builder(toBuilder = true)
public class AggregateState {

    public static final AggregateState EMPTY = AggregateState.builder().build();

    int totalMinutes;
    int totalSessions;
    int currentStreak;
    int longestStreak;
    Instant lastSessionDate;

    public Optional<Instant> findLastSessionDate() {
        return Optional.ofNullable(lastSessionDate);
    }

    public int getAverageSessionMinutes() {
        return totalSessions == 0 ? 0 : totalMinutes / totalSessions;
    }
}
