package com.example.zenflow.service;

import com.example.zenflow.model.AggregateState;
import com.example.zenflow.model.PracticeSession;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Folds practice sessions into {@link AggregateState}. Stateless; day boundaries are taken in the configured zone.
 */
@Component
public class ProgressAggregator {

    private final ZoneId zone;

    public ProgressAggregator(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Applies one session on top of {@code prior}.
     */
    public AggregateState apply(AggregateState prior, PracticeSession session) {
        int streak = nextStreak(prior, session.getTimestamp());
        return prior.toBuilder()
                .totalMinutes(prior.getTotalMinutes() + session.getDurationMinutes())
                .totalSessions(prior.getTotalSessions() + 1)
                .currentStreak(streak)
                .longestStreak(Math.max(prior.getLongestStreak(), streak))
                .lastSessionDate(session.getTimestamp())
                .build();
    }

    /**
     * Rebuilds state from nothing by folding every session in timestamp order.
     * Sessions sharing a timestamp keep their given order.
     */
    public AggregateState replay(List<PracticeSession> sessions) {
        List<PracticeSession> ordered = new ArrayList<>(sessions);
        ordered.sort(Comparator.comparing(PracticeSession::getTimestamp));
        AggregateState state = AggregateState.EMPTY;
        for (PracticeSession session : ordered) {
            state = apply(state, session);
        }
        return state;
    }

    /**
     * True when the last session fell on the day of {@code asOf} or the day before.
     */
    public boolean isStreakActive(AggregateState state, Instant asOf) {
        Instant last = state.getLastSessionDate();
        if (last == null) {
            return false;
        }
        return daysBetween(last, asOf) <= 1;
    }

    private int nextStreak(AggregateState prior, Instant at) {
        Instant last = prior.getLastSessionDate();
        if (last == null) {
            return 1;
        }
        long gap = daysBetween(last, at);
        if (gap == 0) {
            return Math.max(prior.getCurrentStreak(), 1);
        }
        if (gap == 1) {
            return prior.getCurrentStreak() + 1;
        }
        // a gap of two or more days, or a session dated before the last one
        return 1;
    }

    private long daysBetween(Instant from, Instant to) {
        LocalDate fromDay = LocalDate.ofInstant(from, zone);
        LocalDate toDay = LocalDate.ofInstant(to, zone);
        return ChronoUnit.DAYS.between(fromDay, toDay);
    }

    public ZoneId getZone() {
        return zone;
    }
}
